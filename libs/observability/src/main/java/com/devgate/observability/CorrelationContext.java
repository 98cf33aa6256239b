package com.devgate.observability;

/**
 * Immutable correlation data for one inbound gateway request.
 * <p>
 * The correlation id is established by the web layer before anything else runs. Once the
 * bearer token has been validated, the context is replaced with a copy that also names the
 * authenticated principal, so log lines written after authentication carry the user and tenant.
 *
 * @param correlationId unique ID for the request (propagated from {@code X-Correlation-ID} or generated)
 * @param method        HTTP method of the request (nullable outside HTTP processing)
 * @param path          request path (nullable outside HTTP processing)
 * @param userId        object id of the authenticated principal (nullable before authentication)
 * @param tenantId      tenant of the authenticated principal (nullable before authentication)
 */
public record CorrelationContext(
        String correlationId,
        String method,
        String path,
        String userId,
        String tenantId
) {

    /** MDC key for correlation ID. */
    public static final String MDC_CORRELATION_ID = "correlationId";

    /** MDC key for the request path. */
    public static final String MDC_PATH = "path";

    /** MDC key for the authenticated principal's object id. */
    public static final String MDC_USER_ID = "userId";

    /** MDC key for the authenticated principal's tenant. */
    public static final String MDC_TENANT_ID = "tenantId";

    /**
     * Compact constructor; correlationId is never null.
     */
    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }

    /**
     * Creates a context for a request that has not been authenticated yet.
     */
    public static CorrelationContext forRequest(String correlationId, String method, String path) {
        return new CorrelationContext(correlationId, method, path, null, null);
    }

    /**
     * Returns a copy of this context naming the authenticated principal.
     */
    public CorrelationContext withPrincipal(String userId, String tenantId) {
        return new CorrelationContext(correlationId, method, path, userId, tenantId);
    }

    /** Whether a principal has been attached to this context. */
    public boolean authenticated() {
        return userId != null;
    }
}
