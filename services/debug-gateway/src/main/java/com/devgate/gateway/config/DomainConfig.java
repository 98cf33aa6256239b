package com.devgate.gateway.config;

import com.devgate.gateway.domain.ConversationStore;
import com.devgate.gateway.domain.EchoExecutionEngine;
import com.devgate.gateway.domain.EntityCatalog;
import com.devgate.gateway.domain.EntityInfo;
import com.devgate.gateway.domain.ExecutionEngine;
import com.devgate.gateway.domain.InMemoryConversationStore;
import com.devgate.gateway.domain.InMemoryEntityCatalog;
import com.devgate.gateway.streaming.SseStreamAggregator;
import com.devgate.observability.MetricFactory;
import com.devgate.security.context.ExecutionContextPropagator;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Collaborators behind the debug API. Each is replaceable by declaring a bean of the same type.
 */
@Configuration
public class DomainConfig {

    static final String ECHO_AGENT_ID = "echo_agent";

    @Bean
    @ConditionalOnMissingBean
    public EntityCatalog entityCatalog() {
        EntityInfo echo = new EntityInfo(
                ECHO_AGENT_ID,
                EntityInfo.TYPE_AGENT,
                "Echo Agent",
                "Echoes its input and reports the calling user through the whoami tool",
                null,
                List.of(EchoExecutionEngine.WHOAMI_TOOL),
                "in_memory",
                Map.of());
        return new InMemoryEntityCatalog(List.of(echo));
    }

    @Bean
    @ConditionalOnMissingBean
    public ExecutionEngine executionEngine(EntityCatalog catalog, ExecutionContextPropagator propagator) {
        return new EchoExecutionEngine(catalog, propagator);
    }

    @Bean
    @ConditionalOnMissingBean
    public ConversationStore conversationStore(Clock clock) {
        return new InMemoryConversationStore(clock);
    }

    @Bean
    public SseStreamAggregator sseStreamAggregator(MetricFactory metrics, Clock clock) {
        return new SseStreamAggregator(metrics, clock);
    }
}
