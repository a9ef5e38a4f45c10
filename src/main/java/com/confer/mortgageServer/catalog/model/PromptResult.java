package com.confer.mortgageServer.catalog.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * A rendered prompt: messages ready to hand to the calling agent.
 */
@Value
@Builder
public class PromptResult {

    String description;

    @Singular
    List<PromptMessage> messages;
}
