package com.confer.mortgageServer.ingestion.service;

import com.confer.mortgageServer.common.exception.ErrorKind;
import com.confer.mortgageServer.ingestion.exception.FormatViolationException;
import com.confer.mortgageServer.ingestion.exception.SecurityViolationException;
import com.confer.mortgageServer.ingestion.exception.TransportFailureException;
import com.confer.mortgageServer.ingestion.model.IngestionPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.test.web.client.ResponseCreator;
import org.springframework.web.client.RestClient;

import java.io.InterruptedIOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.ExpectedCount.once;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

/**
 * Unit tests for {@link DocumentIngestionGateway} against a mocked document server.
 */
class DocumentIngestionGatewayTest {

    private static final String LE_URL = "https://storage.googleapis.com/docs/le.pdf";
    private static final byte[] PDF = "%PDF-1.7\n1 0 obj\n<<>>\nendobj\n".getBytes(StandardCharsets.US_ASCII);

    private ThreadPoolTaskExecutor downloadExecutor;
    private MockRestServiceServer server;
    private RestClient restClient;

    @BeforeEach
    void setUp() {
        downloadExecutor = new ThreadPoolTaskExecutor();
        downloadExecutor.setCorePoolSize(2);
        downloadExecutor.setThreadNamePrefix("test-download-");
        downloadExecutor.initialize();

        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        restClient = builder.build();
    }

    @AfterEach
    void tearDown() {
        downloadExecutor.shutdown();
    }

    private DocumentIngestionGateway gateway(IngestionPolicy.IngestionPolicyBuilder policy) {
        return new DocumentIngestionGateway(
                policy.allowedDomains(Set.of("storage.googleapis.com")).build(), restClient, downloadExecutor);
    }

    private DocumentIngestionGateway gateway() {
        return gateway(IngestionPolicy.builder());
    }

    @Nested
    @DisplayName("successful fetch")
    class SuccessfulFetch {

        @Test
        @DisplayName("returns the PDF bytes after exactly one GET")
        void returnsBytes() {
            server.expect(once(), requestTo(LE_URL))
                    .andExpect(method(HttpMethod.GET))
                    .andRespond(withSuccess(PDF, MediaType.APPLICATION_PDF));

            byte[] content = gateway().fetch(LE_URL);

            assertThat(content).isEqualTo(PDF);
            server.verify();
        }

        @Test
        @DisplayName("body exactly at the size limit is accepted")
        void bodyAtLimit() {
            server.expect(requestTo(LE_URL)).andRespond(withSuccess(PDF, MediaType.APPLICATION_PDF));

            byte[] content = gateway(IngestionPolicy.builder().maxPdfSizeBytes(PDF.length)).fetch(LE_URL);

            assertThat(content).hasSize(PDF.length);
        }
    }

    @Nested
    @DisplayName("static rejection, no network access")
    class StaticRejection {

        @Test
        void plainHttp() {
            assertThatThrownBy(() -> gateway().fetch("http://storage.googleapis.com/docs/le.pdf"))
                    .isInstanceOfSatisfying(SecurityViolationException.class,
                            e -> assertThat(e.getViolation()).isEqualTo(SecurityViolationException.Reason.SCHEME_NOT_ALLOWED));
            server.verify();
        }

        @Test
        void hostNotAllowed() {
            assertThatThrownBy(() -> gateway().fetch("https://169.254.169.254/latest/meta-data.pdf"))
                    .isInstanceOfSatisfying(SecurityViolationException.class,
                            e -> assertThat(e.getViolation()).isEqualTo(SecurityViolationException.Reason.DOMAIN_NOT_ALLOWED));
            server.verify();
        }

        @Test
        void notPdfExtension() {
            assertThatThrownBy(() -> gateway().fetch("https://storage.googleapis.com/docs/le.txt"))
                    .isInstanceOfSatisfying(SecurityViolationException.class,
                            e -> assertThat(e.getViolation()).isEqualTo(SecurityViolationException.Reason.EXTENSION_NOT_ALLOWED));
            server.verify();
        }
    }

    @Nested
    @DisplayName("payload checks")
    class PayloadChecks {

        @Test
        @DisplayName("declared Content-Length above the limit is rejected before reading")
        void declaredLengthTooLarge() {
            HttpHeaders headers = new HttpHeaders();
            headers.setContentLength(11L * 1024 * 1024);
            server.expect(requestTo(LE_URL)).andRespond(withSuccess(PDF, MediaType.APPLICATION_PDF).headers(headers));

            assertThatThrownBy(() -> gateway().fetch(LE_URL))
                    .isInstanceOfSatisfying(FormatViolationException.class, e -> {
                        assertThat(e.getKind()).isEqualTo(ErrorKind.FORMAT_VIOLATION);
                        assertThat(e.getViolation()).isEqualTo(FormatViolationException.Reason.PAYLOAD_TOO_LARGE);
                    });
        }

        @Test
        @DisplayName("body growing past the limit is rejected while reading")
        void streamedBodyTooLarge() {
            server.expect(requestTo(LE_URL)).andRespond(withSuccess(PDF, MediaType.APPLICATION_PDF));

            assertThatThrownBy(() -> gateway(IngestionPolicy.builder().maxPdfSizeBytes(8)).fetch(LE_URL))
                    .isInstanceOfSatisfying(FormatViolationException.class,
                            e -> assertThat(e.getViolation()).isEqualTo(FormatViolationException.Reason.PAYLOAD_TOO_LARGE))
                    .hasMessageContaining("max: 8 bytes");
        }

        @Test
        @DisplayName("content without the %PDF marker is rejected")
        void notAPdf() {
            server.expect(requestTo(LE_URL))
                    .andRespond(withSuccess("<html>login</html>", MediaType.TEXT_HTML));

            assertThatThrownBy(() -> gateway().fetch(LE_URL))
                    .isInstanceOfSatisfying(FormatViolationException.class,
                            e -> assertThat(e.getViolation()).isEqualTo(FormatViolationException.Reason.NOT_A_PDF))
                    .hasMessage("File does not appear to be a valid PDF");
        }

        @Test
        @DisplayName("empty body is not a PDF")
        void emptyBody() {
            server.expect(requestTo(LE_URL)).andRespond(withSuccess(new byte[0], MediaType.APPLICATION_PDF));

            assertThatThrownBy(() -> gateway().fetch(LE_URL))
                    .isInstanceOf(FormatViolationException.class);
        }
    }

    @Nested
    @DisplayName("transport failures")
    class TransportFailures {

        @Test
        @DisplayName("HTTP error status")
        void httpError() {
            server.expect(requestTo(LE_URL)).andRespond(withStatus(HttpStatus.NOT_FOUND));

            assertThatThrownBy(() -> gateway().fetch(LE_URL))
                    .isInstanceOf(TransportFailureException.class)
                    .hasMessage("Document server returned HTTP 404");
        }

        @Test
        @DisplayName("redirects are not followed")
        void redirectNotFollowed() {
            server.expect(once(), requestTo(LE_URL))
                    .andRespond(withStatus(HttpStatus.FOUND).location(URI.create("https://evil.com/le.pdf")));

            assertThatThrownBy(() -> gateway().fetch(LE_URL))
                    .isInstanceOfSatisfying(TransportFailureException.class,
                            e -> assertThat(e.getKind()).isEqualTo(ErrorKind.TRANSPORT_FAILURE))
                    .hasMessage("Redirect not followed (HTTP 302)");
            server.verify();
        }

        @Test
        @DisplayName("a hung download is abandoned at the timeout and interrupted")
        void hungDownloadTimesOut() throws InterruptedException {
            CountDownLatch interrupted = new CountDownLatch(1);
            ResponseCreator hangs = request -> {
                try {
                    Thread.sleep(10_000);
                } catch (InterruptedException e) {
                    interrupted.countDown();
                    throw new InterruptedIOException("cancelled");
                }
                return withSuccess(PDF, MediaType.APPLICATION_PDF).createResponse(request);
            };
            server.expect(requestTo(LE_URL)).andRespond(hangs);

            long startedAt = System.nanoTime();
            assertThatThrownBy(() -> gateway(IngestionPolicy.builder().downloadTimeout(Duration.ofMillis(200))).fetch(LE_URL))
                    .isInstanceOf(TransportFailureException.class)
                    .hasMessage("Download timed out after 200 ms");

            assertThat(Duration.ofNanos(System.nanoTime() - startedAt)).isLessThan(Duration.ofSeconds(5));
            assertThat(interrupted.await(5, TimeUnit.SECONDS)).isTrue();
        }
    }
}
