package com.confer.mortgageServer.catalog.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Listing entry for a reusable analysis prompt.
 */
@Value
@Builder
public class PromptDefinition {

    String name;

    String description;

    @Singular
    List<PromptArgument> arguments;
}
