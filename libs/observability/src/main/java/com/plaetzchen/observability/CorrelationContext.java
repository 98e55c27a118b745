package com.plaetzchen.observability;

/**
 * Immutable correlation context that travels with a single request.
 * <p>
 * Every incoming HTTP request establishes a {@code CorrelationContext}. Its values are
 * mirrored into SLF4J MDC by {@link CorrelationContextHolder} so that every log line written
 * while serving the request can be tied back to it.
 *
 * @param correlationId id of the business flow, echoed to the client in {@code X-Correlation-ID}
 * @param userId        authenticated member performing the action (null for anonymous requests)
 * @param requestId     id of this request (one correlation may span several requests)
 */
public record CorrelationContext(
        String correlationId,
        String userId,
        String requestId
) {

    /** MDC key for correlation ID. */
    public static final String MDC_CORRELATION_ID = "correlationId";

    /** MDC key for user ID. */
    public static final String MDC_USER_ID = "userId";

    /** MDC key for request ID. */
    public static final String MDC_REQUEST_ID = "requestId";

    /**
     * correlationId is mandatory.
     */
    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }

    /**
     * Returns a copy bound to the given user, used once the bearer token has been resolved.
     */
    public CorrelationContext withUserId(String newUserId) {
        return new CorrelationContext(correlationId, newUserId, requestId);
    }
}
