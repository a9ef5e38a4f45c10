package com.confer.mortgageServer.gateway.config;

import com.confer.mortgageServer.gateway.interceptor.ApiAccessInterceptor;
import com.confer.mortgageServer.gateway.service.CorrelationIdService;
import com.confer.mortgageServer.gateway.service.RateLimiter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Registers API access control on every /api endpoint. /health stays open.
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class WebConfig implements WebMvcConfigurer {

    private final RateLimiter rateLimiter;
    private final CorrelationIdService correlationIdService;

    @Value("${gateway.api-key:}")
    private String apiKey;

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        if (apiKey.isEmpty()) {
            log.warn("No API key configured - authentication disabled");
        }
        registry.addInterceptor(new ApiAccessInterceptor(apiKey, rateLimiter, correlationIdService))
                .addPathPatterns("/api/**");
    }
}
