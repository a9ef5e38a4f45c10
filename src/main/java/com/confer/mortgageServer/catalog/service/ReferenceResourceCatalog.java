package com.confer.mortgageServer.catalog.service;

import com.confer.mortgageServer.catalog.exception.CatalogEntryNotFoundException;
import com.confer.mortgageServer.catalog.model.ResourceContent;
import com.confer.mortgageServer.catalog.model.ResourceDescriptor;
import com.confer.mortgageServer.compliance.model.ToleranceBucket;
import com.confer.mortgageServer.compliance.service.ToleranceClassifier;
import com.confer.mortgageServer.document.model.CostLine;
import com.confer.mortgageServer.util.JsonFileLoader;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Read-only MISMO reference material for agents working with parsed disclosures.
 *
 * Resources:
 * - mortgage://schemas/mismo-le  Loan Estimate fields plus the tolerance rules applied by the comparator
 * - mortgage://schemas/mismo-cd  Closing Disclosure fields
 * - mortgage://glossary/{term}   Case-insensitive glossary lookup
 */
@Slf4j
@Service
public class ReferenceResourceCatalog {

    public static final String LE_SCHEMA_URI = "mortgage://schemas/mismo-le";
    public static final String CD_SCHEMA_URI = "mortgage://schemas/mismo-cd";
    public static final String GLOSSARY_URI_PREFIX = "mortgage://glossary/";

    private static final String JSON = MediaType.APPLICATION_JSON_VALUE;
    private static final String TEXT = MediaType.TEXT_PLAIN_VALUE;

    private final String loanEstimateSchema;
    private final String closingDisclosureSchema;
    private final Map<String, String> glossary;

    public ReferenceResourceCatalog(ToleranceClassifier toleranceClassifier) {
        ObjectNode leSchema = JsonFileLoader.loadRequiredObject("catalog/mismo-le.json");
        ObjectNode toleranceRules = leSchema.putObject("tolerance_rules");
        for (ToleranceBucket bucket : ToleranceBucket.values()) {
            ArrayNode lines = toleranceRules.putArray(bucket.getTag());
            toleranceClassifier.linesIn(bucket).stream()
                    .map(CostLine::getFieldName)
                    .forEach(lines::add);
        }
        this.loanEstimateSchema = leSchema.toPrettyString();
        this.closingDisclosureSchema = JsonFileLoader.loadRequiredObject("catalog/mismo-cd.json").toPrettyString();
        this.glossary = JsonFileLoader.loadRequiredStringMap("catalog/glossary.json");
        log.info("Reference catalog loaded - glossaryTerms: {}", glossary.size());
    }

    public List<ResourceDescriptor> listResources() {
        return List.of(
                ResourceDescriptor.builder()
                        .uri(LE_SCHEMA_URI)
                        .name("MISMO Loan Estimate Schema")
                        .mimeType(JSON)
                        .description("MISMO 3.4 Loan Estimate schema reference with TRID tolerance rules")
                        .build(),
                ResourceDescriptor.builder()
                        .uri(CD_SCHEMA_URI)
                        .name("MISMO Closing Disclosure Schema")
                        .mimeType(JSON)
                        .description("MISMO 3.4 Closing Disclosure schema reference")
                        .build(),
                ResourceDescriptor.builder()
                        .uri(GLOSSARY_URI_PREFIX + "{term}")
                        .name("Mortgage Glossary")
                        .mimeType(TEXT)
                        .description("Mortgage terminology definitions (e.g. APR, escrow, TRID)")
                        .build());
    }

    /**
     * Reads a resource.
     *
     * @param uri Resource URI; glossary URIs carry the term as last segment
     * @return Resource content
     * @throws CatalogEntryNotFoundException if the URI names no resource
     */
    public ResourceContent read(String uri) {
        if (LE_SCHEMA_URI.equals(uri)) {
            return new ResourceContent(uri, JSON, loanEstimateSchema);
        }
        if (CD_SCHEMA_URI.equals(uri)) {
            return new ResourceContent(uri, JSON, closingDisclosureSchema);
        }
        if (uri != null && uri.startsWith(GLOSSARY_URI_PREFIX)) {
            return new ResourceContent(uri, TEXT, lookupTerm(uri.substring(GLOSSARY_URI_PREFIX.length())));
        }
        throw new CatalogEntryNotFoundException("Unknown resource: " + uri);
    }

    /**
     * Looks up a glossary term, ignoring case. An unknown term is not an error:
     * the answer lists the terms that are available.
     */
    public String lookupTerm(String term) {
        for (Map.Entry<String, String> entry : glossary.entrySet()) {
            if (entry.getKey().equalsIgnoreCase(term)) {
                return term.toUpperCase(Locale.ROOT) + ": " + entry.getValue();
            }
        }
        return "Term not found: " + term + ". Available terms: " + String.join(", ", glossary.keySet());
    }
}
