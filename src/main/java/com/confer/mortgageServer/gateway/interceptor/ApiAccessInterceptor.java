package com.confer.mortgageServer.gateway.interceptor;

import com.confer.mortgageServer.gateway.exception.InvalidApiKeyException;
import com.confer.mortgageServer.gateway.exception.RateLimitExceededException;
import com.confer.mortgageServer.gateway.service.CorrelationIdService;
import com.confer.mortgageServer.gateway.service.RateLimiter;
import com.confer.mortgageServer.gateway.util.ClientKeyMasker;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.servlet.HandlerInterceptor;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Front door of the API.
 *
 * Responsibilities:
 * - Bind a correlation id to the request thread
 * - Verify the X-API-Key header when a key is configured
 * - Enforce the per-client rate limit
 */
@Slf4j
public class ApiAccessInterceptor implements HandlerInterceptor {

    public static final String API_KEY_HEADER = "X-API-Key";

    private final String apiKey;
    private final RateLimiter rateLimiter;
    private final CorrelationIdService correlationIdService;

    public ApiAccessInterceptor(String apiKey, RateLimiter rateLimiter, CorrelationIdService correlationIdService) {
        this.apiKey = apiKey == null ? "" : apiKey;
        this.rateLimiter = rateLimiter;
        this.correlationIdService = correlationIdService;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        String correlationId = correlationIdService.open();
        String providedKey = request.getHeader(API_KEY_HEADER);

        if (!apiKey.isEmpty() && !matchesApiKey(providedKey)) {
            log.warn("Invalid API key - correlationId: {}, path: {}, remote: {}",
                    correlationId, request.getRequestURI(), request.getRemoteAddr());
            correlationIdService.close();
            throw new InvalidApiKeyException("Invalid or missing API key");
        }

        String clientKey = providedKey != null && !providedKey.isBlank() ? providedKey : request.getRemoteAddr();
        if (!rateLimiter.isAllowed(clientKey)) {
            log.warn("Request throttled - correlationId: {}, client: {}", correlationId, ClientKeyMasker.mask(clientKey));
            correlationIdService.close();
            throw new RateLimitExceededException("Rate limit exceeded. Please try again later.");
        }

        log.debug("Request accepted - correlationId: {}, method: {}, path: {}",
                correlationId, request.getMethod(), request.getRequestURI());
        return true;
    }

    /**
     * Only runs when preHandle returned true; rejected requests unbind the correlation id themselves.
     */
    @Override
    public void afterCompletion(HttpServletRequest request, HttpServletResponse response, Object handler, Exception ex) {
        correlationIdService.close();
    }

    private boolean matchesApiKey(String providedKey) {
        if (providedKey == null) {
            return false;
        }
        return MessageDigest.isEqual(
                apiKey.getBytes(StandardCharsets.UTF_8),
                providedKey.getBytes(StandardCharsets.UTF_8));
    }
}
