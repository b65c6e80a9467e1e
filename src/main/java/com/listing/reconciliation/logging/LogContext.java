package com.listing.reconciliation.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC wrapper. Entries added through a context are removed when it closes.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forApply(correlationId, sessionId)) {
 *     log.info("apply.completed applied={}", count);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    public static LogContext forSessionBuild(String correlationId, String sellerId) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("sellerId", sellerId);
        ctx.put("operation", "build");
        return ctx;
    }

    public static LogContext forApply(String correlationId, String sessionId) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("sessionId", sessionId);
        ctx.put("operation", "apply");
        return ctx;
    }

    public static LogContext forReview(String changeId) {
        LogContext ctx = new LogContext();
        ctx.put("changeId", changeId);
        ctx.put("operation", "review");
        return ctx;
    }

    public static String generateCorrelationId() {
        return UUID.randomUUID().toString();
    }

    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        keys.add(key);
        MDC.put(key, value);
    }

    @Override
    public void close() {
        for (String key : keys) {
            MDC.remove(key);
        }
        keys.clear();
    }
}
