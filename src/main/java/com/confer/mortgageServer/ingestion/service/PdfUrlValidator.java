package com.confer.mortgageServer.ingestion.service;

import com.confer.mortgageServer.ingestion.exception.SecurityViolationException;
import com.confer.mortgageServer.ingestion.exception.SecurityViolationException.Reason;
import com.confer.mortgageServer.ingestion.model.IngestionPolicy;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.TreeSet;

/**
 * Static checks on a document reference, run before any network access.
 *
 * Order (first failure wins): scheme is https, host is allow-listed, path ends in .pdf.
 */
public class PdfUrlValidator {

    private static final String PDF_EXTENSION = ".pdf";

    private final IngestionPolicy policy;

    public PdfUrlValidator(IngestionPolicy policy) {
        this.policy = policy;
    }

    /**
     * Validates the reference and returns it parsed.
     *
     * @param url Caller-supplied document URL
     * @return Parsed URI, safe to fetch under the policy
     * @throws SecurityViolationException if any check fails
     */
    public URI validate(String url) {
        URI uri = parse(url);

        String scheme = uri.getScheme();
        if (!"https".equals(scheme)) {
            throw new SecurityViolationException(Reason.SCHEME_NOT_ALLOWED,
                    "Only HTTPS URLs allowed, got: " + (scheme == null ? "" : scheme));
        }

        // Authority as written (host[:port]); no userinfo, no wildcard or subdomain matching.
        String host = uri.getRawAuthority();
        if (!policy.isAllowedDomain(host)) {
            throw new SecurityViolationException(Reason.DOMAIN_NOT_ALLOWED,
                    "Domain not allowed: " + host + ". Allowed: " + String.join(", ", new TreeSet<>(policy.getAllowedDomains())));
        }

        String path = uri.getPath();
        if (path == null || !path.toLowerCase(Locale.ROOT).endsWith(PDF_EXTENSION)) {
            throw new SecurityViolationException(Reason.EXTENSION_NOT_ALLOWED, "Only PDF files allowed");
        }

        return uri;
    }

    private static URI parse(String url) {
        if (url == null || url.isBlank()) {
            throw new SecurityViolationException(Reason.MALFORMED_URL, "Document URL is required");
        }
        try {
            return new URI(url.trim());
        } catch (URISyntaxException e) {
            throw new SecurityViolationException(Reason.MALFORMED_URL, "Malformed document URL: " + e.getReason());
        }
    }
}
