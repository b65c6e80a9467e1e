package com.listing.reconciliation.tracing;

import java.util.Map;

/**
 * Starts spans around session builds and apply runs. {@link NoOpTracingService} is used when
 * no tracer is configured.
 */
public interface TracingService {

    String SESSION_BUILD = "reconciliation.build";
    String APPLY = "reconciliation.apply";

    Span startSpan(String operationName, Map<String, String> attributes);
}
