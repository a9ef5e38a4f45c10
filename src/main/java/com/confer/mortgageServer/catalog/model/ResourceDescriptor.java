package com.confer.mortgageServer.catalog.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

/**
 * Listing entry for a readable reference resource. Templated URIs use {placeholder} segments.
 */
@Value
@Builder
public class ResourceDescriptor {

    String uri;

    String name;

    @JsonProperty("mime_type")
    String mimeType;

    String description;
}
