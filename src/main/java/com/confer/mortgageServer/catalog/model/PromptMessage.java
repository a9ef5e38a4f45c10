package com.confer.mortgageServer.catalog.model;

import lombok.Value;

@Value
public class PromptMessage {

    String role;

    String content;

    public static PromptMessage user(String content) {
        return new PromptMessage("user", content);
    }
}
