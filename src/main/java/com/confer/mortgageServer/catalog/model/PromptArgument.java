package com.confer.mortgageServer.catalog.model;

import lombok.Value;

@Value
public class PromptArgument {

    String name;

    String description;

    boolean required;
}
