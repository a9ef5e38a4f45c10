package com.confer.mortgageServer.ingestion.service;

import com.confer.mortgageServer.common.exception.MortgageServerException;
import com.confer.mortgageServer.ingestion.exception.FormatViolationException;
import com.confer.mortgageServer.ingestion.exception.TransportFailureException;
import com.confer.mortgageServer.ingestion.model.IngestionPolicy;
import com.confer.mortgageServer.util.UrlMasker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Acquires untrusted PDF documents for extraction.
 *
 * Responsibilities:
 * - Reject unsafe references before any network access (scheme, domain allow-list, extension)
 * - Perform exactly one GET per call, bounded by the policy timeout, without following redirects
 * - Enforce the maximum payload size while reading
 * - Verify the %PDF magic marker
 *
 * Bytes are returned in memory only. Nothing is cached and failures are never retried.
 */
@Slf4j
public class DocumentIngestionGateway {

    private static final byte[] PDF_MAGIC = {'%', 'P', 'D', 'F'};
    private static final int READ_CHUNK_SIZE = 8192;

    private final IngestionPolicy policy;
    private final PdfUrlValidator urlValidator;
    private final RestClient restClient;
    private final AsyncTaskExecutor downloadExecutor;

    public DocumentIngestionGateway(IngestionPolicy policy, RestClient restClient, AsyncTaskExecutor downloadExecutor) {
        this.policy = policy;
        this.urlValidator = new PdfUrlValidator(policy);
        this.restClient = restClient;
        this.downloadExecutor = downloadExecutor;
    }

    /**
     * Validates and downloads a PDF document.
     *
     * @param url Caller-supplied HTTPS URL of the document
     * @return PDF bytes
     * @throws com.confer.mortgageServer.ingestion.exception.SecurityViolationException if the URL fails static validation
     * @throws FormatViolationException if the payload is too large or not a PDF
     * @throws TransportFailureException on timeout, redirect, HTTP error or I/O failure
     */
    public byte[] fetch(String url) {
        URI uri = urlValidator.validate(url);
        String maskedUrl = UrlMasker.mask(url);
        long timeoutMs = policy.getDownloadTimeout().toMillis();

        log.info("Fetching document - url: {}, timeoutMs: {}, maxBytes: {}", maskedUrl, timeoutMs, policy.getMaxPdfSizeBytes());

        Future<byte[]> download = downloadExecutor.submit(() -> download(uri));
        try {
            byte[] content = download.get(timeoutMs, TimeUnit.MILLISECONDS);
            log.info("Document fetched - url: {}, bytes: {}", maskedUrl, content.length);
            return content;
        } catch (TimeoutException e) {
            download.cancel(true);
            log.warn("Document download timed out - url: {}, timeoutMs: {}", maskedUrl, timeoutMs);
            throw new TransportFailureException("Download timed out after " + timeoutMs + " ms");
        } catch (InterruptedException e) {
            download.cancel(true);
            Thread.currentThread().interrupt();
            throw new TransportFailureException("Download interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof MortgageServerException failure) {
                log.warn("Document rejected - url: {}, kind: {}, error: {}", maskedUrl, failure.getKind().getCode(), failure.getMessage());
                throw failure;
            }
            log.error("Document download failed - url: {}, error: {}", maskedUrl, cause.getMessage(), cause);
            throw new TransportFailureException("Download failed: " + cause.getMessage(), cause);
        }
    }

    private byte[] download(URI uri) {
        try {
            return restClient.get()
                    .uri(uri)
                    .accept(MediaType.APPLICATION_PDF, MediaType.ALL)
                    .exchange((request, response) -> {
                        HttpStatusCode status = response.getStatusCode();
                        if (status.is3xxRedirection()) {
                            throw new TransportFailureException("Redirect not followed (HTTP " + status.value() + ")");
                        }
                        if (status.isError()) {
                            throw new TransportFailureException("Document server returned HTTP " + status.value());
                        }

                        long declaredLength = response.getHeaders().getContentLength();
                        if (declaredLength > policy.getMaxPdfSizeBytes()) {
                            throw tooLarge(declaredLength);
                        }

                        byte[] content = readBounded(response.getBody());
                        if (!hasPdfMagic(content)) {
                            throw new FormatViolationException(FormatViolationException.Reason.NOT_A_PDF,
                                    "File does not appear to be a valid PDF");
                        }
                        return content;
                    });
        } catch (RestClientException e) {
            throw new TransportFailureException("Download failed: " + e.getMessage(), e);
        }
    }

    /**
     * Reads the body, aborting as soon as it exceeds the policy maximum.
     */
    private byte[] readBounded(InputStream body) throws IOException {
        long max = policy.getMaxPdfSizeBytes();
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        byte[] chunk = new byte[READ_CHUNK_SIZE];
        long total = 0;
        int read;
        while ((read = body.read(chunk)) != -1) {
            if (Thread.currentThread().isInterrupted()) {
                throw new TransportFailureException("Download cancelled");
            }
            total += read;
            if (total > max) {
                throw tooLarge(total);
            }
            buffer.write(chunk, 0, read);
        }
        return buffer.toByteArray();
    }

    private FormatViolationException tooLarge(long size) {
        return new FormatViolationException(FormatViolationException.Reason.PAYLOAD_TOO_LARGE,
                "PDF too large: " + size + " bytes (max: " + policy.getMaxPdfSizeBytes() + " bytes)");
    }

    private static boolean hasPdfMagic(byte[] content) {
        if (content.length < PDF_MAGIC.length) {
            return false;
        }
        for (int i = 0; i < PDF_MAGIC.length; i++) {
            if (content[i] != PDF_MAGIC[i]) {
                return false;
            }
        }
        return true;
    }
}
