package com.confer.mortgageServer.catalog.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

@Value
public class ResourceContent {

    String uri;

    @JsonProperty("mime_type")
    String mimeType;

    String text;
}
