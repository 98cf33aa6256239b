package com.devgate.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

/**
 * The gateway's Micrometer meters: authentication decisions, SSE frames and stream durations.
 * <p>
 * Every meter carries a {@code service} tag. Micrometer de-duplicates meters by name and tags,
 * so these helpers are called per request; their tag values come from small fixed sets
 * (reason codes, frame kinds, stream outcomes).
 */
public final class MetricFactory {

    public static final String TAG_SERVICE = "service";

    /** Counter, tagged {@code outcome} and {@code reason}. */
    public static final String AUTH_REQUESTS = "devgate.auth.requests";

    /** Counter, tagged {@code kind}. */
    public static final String STREAM_FRAMES = "devgate.stream.frames";

    /** Timer, tagged {@code outcome}. */
    public static final String STREAM_DURATION = "devgate.stream.duration";

    private final MeterRegistry registry;
    private final Tags serviceTags;

    /**
     * @param registry    where meters are registered (Prometheus in the running service)
     * @param serviceName value of the {@code service} tag
     */
    public MetricFactory(MeterRegistry registry, String serviceName) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName must not be null or blank");
        }
        this.registry = registry;
        this.serviceTags = Tags.of(TAG_SERVICE, serviceName);
    }

    /**
     * @param outcome {@code accepted} or {@code rejected}
     * @param reason  machine-readable reason code ({@code ok} when accepted)
     */
    public void recordAuthentication(String outcome, String reason) {
        Counter.builder(AUTH_REQUESTS)
                .description("Authentication decisions on protected routes")
                .tags(serviceTags.and("outcome", outcome, "reason", reason))
                .register(registry)
                .increment();
    }

    /**
     * @param kind {@code event}, {@code completed}, {@code error} or {@code done}
     */
    public void recordStreamFrame(String kind) {
        Counter.builder(STREAM_FRAMES)
                .description("SSE frames written to clients")
                .tags(serviceTags.and("kind", kind))
                .register(registry)
                .increment();
    }

    /** Starts timing one stream; finish with {@link #stopStream(Timer.Sample, String)}. */
    public Timer.Sample startStream() {
        return Timer.start(registry);
    }

    /**
     * @param outcome how the stream ended, e.g. {@code completed}, {@code failed}
     */
    public void stopStream(Timer.Sample sample, String outcome) {
        sample.stop(Timer.builder(STREAM_DURATION)
                .description("Time from first event to the end of an SSE stream")
                .tags(serviceTags.and("outcome", outcome))
                .register(registry));
    }
}
