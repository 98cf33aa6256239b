package com.devgate.security.context;

import com.devgate.security.AuthenticatedPrincipal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Makes the authenticated caller visible to everything that runs inside one unit of work,
 * without threading it through method parameters.
 * <p>
 * The binding is scoped: {@link #withContext} installs it, runs the work and restores whatever
 * was bound before, on success and on failure. Bindings never leak into other threads;
 * work handed to an executor must be wrapped with {@link #wrap(Runnable)}.
 * <p>
 * WHY an instance rather than static state: each propagator owns its own slot, so tests and
 * embedded servers cannot observe each other's callers.
 */
public class ExecutionContextPropagator {

    private static final Logger log = LoggerFactory.getLogger(ExecutionContextPropagator.class);

    static final String MDC_USER = "userId";

    private final ThreadLocal<ExecutionContext> current = new ThreadLocal<>();

    /**
     * Runs {@code work} with the caller bound, returning its result.
     */
    public <T> T withContext(AuthenticatedPrincipal principal, String accessToken, Supplier<T> work) {
        return withContext(new ExecutionContext(principal, accessToken), work);
    }

    public <T> T withContext(ExecutionContext context, Supplier<T> work) {
        if (work == null) {
            throw new IllegalArgumentException("work must not be null");
        }
        try (Scope ignored = open(context)) {
            return work.get();
        }
    }

    /**
     * Binds {@code context} until the returned scope is closed. For callers whose work throws
     * checked exceptions, such as servlet filters:
     * <pre>
     * try (var scope = propagator.open(context)) {
     *     chain.doFilter(request, response);
     * }
     * </pre>
     */
    public Scope open(ExecutionContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context must not be null");
        }
        ExecutionContext previous = current.get();
        String previousMdcUser = MDC.get(MDC_USER);
        current.set(context);
        MDC.put(MDC_USER, context.principal().objectId());
        return () -> restore(previous, previousMdcUser);
    }

    public void runWithContext(AuthenticatedPrincipal principal, String accessToken, Runnable work) {
        if (work == null) {
            throw new IllegalArgumentException("work must not be null");
        }
        withContext(principal, accessToken, () -> {
            work.run();
            return null;
        });
    }

    public Optional<ExecutionContext> currentContext() {
        return Optional.ofNullable(current.get());
    }

    public Optional<AuthenticatedPrincipal> currentPrincipal() {
        return currentContext().map(ExecutionContext::principal);
    }

    public Optional<String> currentAccessToken() {
        return currentContext().map(ExecutionContext::accessToken);
    }

    /**
     * The bound caller's identity map, or empty outside a bound scope.
     */
    public Optional<Map<String, Object>> currentUserContext() {
        return currentContext().map(ExecutionContext::userContext);
    }

    /**
     * Tool arguments for the bound caller; an empty map outside a bound scope.
     */
    public Map<String, Object> toToolArguments() {
        return currentContext().map(ExecutionContext::toToolArguments).orElse(Map.of());
    }

    /**
     * Captures the current binding so the returned task sees it when run on another thread.
     * With nothing bound, the task is returned unchanged.
     */
    public Runnable wrap(Runnable task) {
        if (task == null) {
            throw new IllegalArgumentException("task must not be null");
        }
        ExecutionContext captured = current.get();
        if (captured == null) {
            return task;
        }
        return () -> withContext(captured, () -> {
            task.run();
            return null;
        });
    }

    /**
     * An open binding. Closing restores the binding that was active when it was opened.
     */
    @FunctionalInterface
    public interface Scope extends AutoCloseable {
        @Override
        void close();
    }

    private void restore(ExecutionContext previous, String previousMdcUser) {
        if (previous == null) {
            current.remove();
        } else {
            current.set(previous);
        }
        if (previousMdcUser == null) {
            MDC.remove(MDC_USER);
        } else {
            MDC.put(MDC_USER, previousMdcUser);
        }
        log.trace("Restored execution context: {}", previous);
    }
}
