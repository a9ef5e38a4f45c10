package com.confer.mortgageServer.gateway.service;

import com.confer.mortgageServer.gateway.util.ClientKeyMasker;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * In-memory sliding-window rate limiter, keyed by client (API key or remote address).
 * A limit of zero or less disables limiting.
 */
@Slf4j
@Service
public class RateLimiter {

    private static final long WINDOW_SIZE_SECONDS = 60;

    private final int maxRequestsPerMinute;
    private final Clock clock;

    /**
     * Windows of clients idle for a full window are empty anyway, so they are evicted.
     */
    private final Cache<String, RequestWindow> clientWindows = Caffeine.newBuilder()
            .expireAfterAccess(Duration.ofSeconds(WINDOW_SIZE_SECONDS))
            .maximumSize(100_000)
            .build();

    @Autowired
    public RateLimiter(@Value("${gateway.rate-limit-per-minute:120}") int maxRequestsPerMinute) {
        this(maxRequestsPerMinute, Clock.systemUTC());
    }

    RateLimiter(int maxRequestsPerMinute, Clock clock) {
        this.maxRequestsPerMinute = maxRequestsPerMinute;
        this.clock = clock;
    }

    /**
     * Checks if the request should be allowed and records it when it is.
     *
     * @param clientKey The client to check the rate limit for
     * @return true if request is allowed, false if rate limit exceeded
     */
    public boolean isAllowed(String clientKey) {
        if (maxRequestsPerMinute <= 0) {
            return true;
        }
        RequestWindow window = clientWindows.get(clientKey, k -> new RequestWindow());
        if (!window.tryAcquire(Instant.now(clock), maxRequestsPerMinute)) {
            log.warn("Rate limit exceeded - client: {}, limit: {}/min", ClientKeyMasker.mask(clientKey), maxRequestsPerMinute);
            return false;
        }
        return true;
    }

    private static class RequestWindow {
        private final Deque<Instant> requests = new ArrayDeque<>();

        synchronized boolean tryAcquire(Instant now, int limit) {
            Instant cutoff = now.minusSeconds(WINDOW_SIZE_SECONDS);
            while (!requests.isEmpty() && !requests.peekFirst().isAfter(cutoff)) {
                requests.pollFirst();
            }
            if (requests.size() >= limit) {
                return false;
            }
            requests.addLast(now);
            return true;
        }
    }
}
