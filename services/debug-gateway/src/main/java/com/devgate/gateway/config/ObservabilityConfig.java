package com.devgate.gateway.config;

import com.devgate.observability.MetricFactory;
import com.devgate.observability.SensitiveDataRedactor;
import com.devgate.observability.SpanHelper;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.GlobalOpenTelemetry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Metrics, tracing and log-redaction helpers.
 */
@Configuration
public class ObservabilityConfig {

    static final String INSTRUMENTATION_NAME = "com.devgate.gateway";

    @Bean
    public MetricFactory metricFactory(MeterRegistry registry, GatewayProperties properties) {
        return new MetricFactory(registry, properties.name());
    }

    @Bean
    public SpanHelper spanHelper() {
        return new SpanHelper(GlobalOpenTelemetry.getTracer(INSTRUMENTATION_NAME));
    }

    @Bean
    public SensitiveDataRedactor sensitiveDataRedactor() {
        return new SensitiveDataRedactor();
    }
}
