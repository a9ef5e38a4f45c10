package com.confer.mortgageServer.ingestion.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.Set;

/**
 * Safety limits applied by a {@code DocumentIngestionGateway}.
 * Passed in at construction so gateways with different policies can coexist.
 */
@Value
@Builder
public class IngestionPolicy {

    public static final long DEFAULT_MAX_PDF_SIZE = 10L * 1024 * 1024;
    public static final Duration DEFAULT_DOWNLOAD_TIMEOUT = Duration.ofSeconds(30);

    /**
     * Hosts (as written in the URL authority) documents may be fetched from. Exact match only.
     */
    Set<String> allowedDomains;

    @Builder.Default
    long maxPdfSizeBytes = DEFAULT_MAX_PDF_SIZE;

    /**
     * Hard limit for the whole download, headers and body.
     */
    @Builder.Default
    Duration downloadTimeout = DEFAULT_DOWNLOAD_TIMEOUT;

    public boolean isAllowedDomain(String host) {
        return host != null && allowedDomains.contains(host);
    }
}
