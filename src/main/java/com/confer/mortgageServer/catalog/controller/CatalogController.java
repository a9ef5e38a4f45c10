package com.confer.mortgageServer.catalog.controller;

import com.confer.mortgageServer.catalog.model.PromptDefinition;
import com.confer.mortgageServer.catalog.model.PromptResult;
import com.confer.mortgageServer.catalog.model.ResourceContent;
import com.confer.mortgageServer.catalog.model.ResourceDescriptor;
import com.confer.mortgageServer.catalog.service.AnalysisPromptCatalog;
import com.confer.mortgageServer.catalog.service.ReferenceResourceCatalog;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Reference resources and analysis prompts.
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class CatalogController {

    private final ReferenceResourceCatalog resourceCatalog;
    private final AnalysisPromptCatalog promptCatalog;

    @GetMapping("/resources")
    public Map<String, List<ResourceDescriptor>> listResources() {
        return Map.of("resources", resourceCatalog.listResources());
    }

    @GetMapping("/resources/read")
    public ResourceContent readResource(@RequestParam("uri") String uri) {
        return resourceCatalog.read(uri);
    }

    @GetMapping("/prompts")
    public Map<String, List<PromptDefinition>> listPrompts() {
        return Map.of("prompts", promptCatalog.listPrompts());
    }

    @GetMapping("/prompts/{name}")
    public PromptResult getPrompt(@PathVariable("name") String name,
                                  @RequestParam(value = "analysis_type", required = false) String analysisType) {
        return promptCatalog.getPrompt(name, analysisType);
    }
}
