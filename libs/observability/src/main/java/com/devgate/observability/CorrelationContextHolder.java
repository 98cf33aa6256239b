package com.devgate.observability;

import org.slf4j.MDC;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.function.Function;

/**
 * Per-thread {@link CorrelationContext}, mirrored into the SLF4J MDC so that every log line
 * written while a request is handled carries its correlation id and caller.
 * <p>
 * Servlet containers reuse threads: whoever calls {@link #set(CorrelationContext)} owns the
 * matching {@link #clear()}. Work that continues on another thread (a streaming response body,
 * for one) must go through {@link #wrap(Runnable)}, which carries the context over and puts the
 * worker thread's own context back afterwards.
 */
public final class CorrelationContextHolder {

    private static final ThreadLocal<CorrelationContext> CONTEXT = new ThreadLocal<>();

    private static final Map<String, Function<CorrelationContext, String>> MDC_FIELDS = mdcFields();

    private CorrelationContextHolder() {
        // Utility class, no instantiation
    }

    private static Map<String, Function<CorrelationContext, String>> mdcFields() {
        Map<String, Function<CorrelationContext, String>> fields = new LinkedHashMap<>();
        fields.put(CorrelationContext.MDC_CORRELATION_ID, CorrelationContext::correlationId);
        fields.put(CorrelationContext.MDC_PATH, CorrelationContext::path);
        fields.put(CorrelationContext.MDC_USER_ID, CorrelationContext::userId);
        fields.put(CorrelationContext.MDC_TENANT_ID, CorrelationContext::tenantId);
        return Map.copyOf(fields);
    }

    /**
     * Binds {@code context} to the current thread and the MDC.
     *
     * @throws IllegalArgumentException if context is null
     */
    public static void set(CorrelationContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context must not be null");
        }
        CONTEXT.set(context);
        MDC_FIELDS.forEach((key, field) -> {
            String value = field.apply(context);
            if (value == null) {
                MDC.remove(key);
            } else {
                MDC.put(key, value);
            }
        });
    }

    public static Optional<CorrelationContext> get() {
        return Optional.ofNullable(CONTEXT.get());
    }

    public static Optional<String> correlationId() {
        return get().map(CorrelationContext::correlationId);
    }

    /**
     * Records the authenticated caller on the current context. No-op when no context is bound.
     */
    public static void attachPrincipal(String userId, String tenantId) {
        get().ifPresent(current -> set(current.withPrincipal(userId, tenantId)));
    }

    /** Unbinds the context and removes its MDC keys. */
    public static void clear() {
        CONTEXT.remove();
        MDC_FIELDS.keySet().forEach(MDC::remove);
    }

    /**
     * Binds {@code context} until the returned binding is closed, which restores whatever was
     * bound before (or clears, if nothing was).
     */
    public static Binding bind(CorrelationContext context) {
        CorrelationContext previous = CONTEXT.get();
        set(context);
        return () -> {
            if (previous == null) {
                clear();
            } else {
                set(previous);
            }
        };
    }

    /**
     * Runs {@code callable} with {@code context} bound.
     *
     * @throws Exception whatever the callable throws
     */
    public static <T> T callWithContext(CorrelationContext context, Callable<T> callable) throws Exception {
        try (Binding ignored = bind(context)) {
            return callable.call();
        }
    }

    /**
     * Captures the current context now and returns a runnable that binds it on whichever thread
     * eventually runs it. Returns the runnable unchanged when nothing is bound.
     */
    public static Runnable wrap(Runnable runnable) {
        CorrelationContext captured = CONTEXT.get();
        if (captured == null) {
            return runnable;
        }
        return () -> {
            try (Binding ignored = bind(captured)) {
                runnable.run();
            }
        };
    }

    /** A scoped binding; closing it never throws. */
    @FunctionalInterface
    public interface Binding extends AutoCloseable {
        @Override
        void close();
    }
}
