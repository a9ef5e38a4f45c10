package com.confer.mortgageServer.ingestion.config;

import com.confer.mortgageServer.concurrent.MdcTaskDecorator;
import com.confer.mortgageServer.ingestion.model.IngestionPolicy;
import com.confer.mortgageServer.ingestion.service.DocumentIngestionGateway;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestClient;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Wires the ingestion gateway from environment-style settings read once at startup.
 */
@Slf4j
@Configuration
public class IngestionConfig {

    @Value("${ingestion.allowed-domains:storage.googleapis.com,s3.amazonaws.com,mortgage-docs.confer.ai}")
    private String allowedDomains;

    @Value("${ingestion.max-pdf-size:10485760}")
    private long maxPdfSize;

    @Value("${ingestion.download-timeout-seconds:30}")
    private long downloadTimeoutSeconds;

    @Value("${ingestion.download-threads:8}")
    private int downloadThreads;

    @Bean
    public IngestionPolicy ingestionPolicy() {
        IngestionPolicy policy = IngestionPolicy.builder()
                .allowedDomains(parseDomains(allowedDomains))
                .maxPdfSizeBytes(maxPdfSize)
                .downloadTimeout(Duration.ofSeconds(downloadTimeoutSeconds))
                .build();
        log.info("Ingestion policy - allowedDomains: {}, maxPdfSize: {}, downloadTimeout: {}",
                policy.getAllowedDomains(), policy.getMaxPdfSizeBytes(), policy.getDownloadTimeout());
        return policy;
    }

    /**
     * RestClient for document downloads. Redirects are never followed: the allow-list
     * is checked against the original URL only.
     */
    @Bean
    public RestClient documentRestClient(IngestionPolicy ingestionPolicy) {
        HttpClient httpClient = HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NEVER)
                .connectTimeout(ingestionPolicy.getDownloadTimeout())
                .build();
        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(ingestionPolicy.getDownloadTimeout());
        return RestClient.builder()
                .requestFactory(requestFactory)
                .build();
    }

    @Bean
    public ThreadPoolTaskExecutor downloadExecutor() {
        return newExecutor("pdf-download-", downloadThreads);
    }

    /**
     * Runs whole document loads (fetch, extract, validate) so LE and CD can be loaded concurrently.
     */
    @Bean
    public ThreadPoolTaskExecutor documentExecutor() {
        return newExecutor("document-load-", downloadThreads);
    }

    @Bean
    public DocumentIngestionGateway documentIngestionGateway(IngestionPolicy ingestionPolicy,
                                                             RestClient documentRestClient,
                                                             @Qualifier("downloadExecutor") ThreadPoolTaskExecutor downloadExecutor) {
        return new DocumentIngestionGateway(ingestionPolicy, documentRestClient, downloadExecutor);
    }

    static Set<String> parseDomains(String domains) {
        List<String> parsed = Arrays.stream(domains.split(","))
                .map(String::trim)
                .filter(domain -> !domain.isEmpty())
                .collect(Collectors.toList());
        return Set.copyOf(parsed);
    }

    private static ThreadPoolTaskExecutor newExecutor(String threadNamePrefix, int threads) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix(threadNamePrefix);
        executor.setTaskDecorator(new MdcTaskDecorator());
        return executor;
    }
}
