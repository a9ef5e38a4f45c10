package com.confer.mortgageServer.gateway.service;

import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Correlation ids for request tracking. The id of the request in flight lives in the MDC
 * so that log lines from worker threads carry it too.
 */
@Service
public class CorrelationIdService {

    public static final String MDC_KEY = "correlationId";

    /**
     * Generates a correlation id and binds it to the current thread.
     *
     * @return A UUID-based correlation ID
     */
    public String open() {
        String correlationId = UUID.randomUUID().toString();
        MDC.put(MDC_KEY, correlationId);
        return correlationId;
    }

    /**
     * @return Correlation id bound to the current thread, or a fresh one if none is bound
     */
    public String current() {
        String correlationId = MDC.get(MDC_KEY);
        return correlationId != null ? correlationId : open();
    }

    public void close() {
        MDC.remove(MDC_KEY);
    }
}
