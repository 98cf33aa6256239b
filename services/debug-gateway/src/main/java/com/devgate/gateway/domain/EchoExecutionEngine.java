package com.devgate.gateway.domain;

import com.devgate.eventmodel.EventSequence;
import com.devgate.eventmodel.EventSerializer;
import com.devgate.eventmodel.ExecutionEvent;
import com.devgate.security.context.ExecutionContext;
import com.devgate.security.context.ExecutionContextPropagator;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Built-in engine that echoes the input back word by word.
 *
 * <p>Before answering it calls a {@code whoami} tool, which reads the caller from the injected
 * {@link ExecutionContextPropagator}; the tool result shows whether identity reached the code
 * executing the request.
 */
public class EchoExecutionEngine implements ExecutionEngine {

    private static final Logger log = LoggerFactory.getLogger(EchoExecutionEngine.class);

    public static final String WHOAMI_TOOL = "whoami";

    private final EntityCatalog catalog;
    private final ExecutionContextPropagator propagator;

    public EchoExecutionEngine(EntityCatalog catalog, ExecutionContextPropagator propagator) {
        this.catalog = catalog;
        this.propagator = propagator;
    }

    @Override
    public Stream<ExecutionEvent> executeStreaming(ExecutionRequest request) {
        EntityInfo entity = catalog.get(request.entityId())
                .orElseThrow(() -> new EntityNotFoundException("Entity not found: " + request.entityId()));
        EventSequence sequence = EventSequence.start(entity.id());
        String messageId = EventSequence.newItemId("msg");

        // built lazily so the caller's binding is read when the stream is consumed
        return Stream.<Supplier<List<ExecutionEvent>>>of(
                        () -> List.of(sequence.created(), sequence.inProgress()),
                        () -> whoami(sequence),
                        () -> echo(sequence, messageId, request.input()))
                .flatMap(step -> step.get().stream());
    }

    private List<ExecutionEvent> whoami(EventSequence sequence) {
        String callId = EventSequence.newItemId("call");
        List<ExecutionEvent> events = new ArrayList<>();
        events.add(sequence.functionCall(callId, WHOAMI_TOOL, "{}"));
        Map<String, Object> result = new LinkedHashMap<>();
        propagator.currentContext().ifPresentOrElse(
                context -> {
                    result.put("authenticated", true);
                    result.put("user", context.userIdentifier());
                    result.put("tenant_id", context.principal().tenantId());
                    result.put("roles", context.toMetadata().get("user_roles"));
                },
                () -> result.put("authenticated", false));
        log.debug("whoami resolved caller: {}", result.get("user"));
        events.add(sequence.functionResult(callId, EventSerializer.toSingleLineJson(result), true));
        return events;
    }

    private List<ExecutionEvent> echo(EventSequence sequence, String messageId, String input) {
        List<ExecutionEvent> events = new ArrayList<>();
        String greeting = propagator.currentContext()
                .map(ExecutionContext::userIdentifier)
                .map(user -> "Hello " + user + ". ")
                .orElse("");
        if (!greeting.isEmpty()) {
            events.add(sequence.textDelta(messageId, greeting));
        }
        if (input.isBlank()) {
            events.add(sequence.textDelta(messageId, "(no input)"));
            return events;
        }
        String[] words = input.strip().split("\\s+");
        for (int i = 0; i < words.length; i++) {
            events.add(sequence.textDelta(messageId, i == 0 ? words[i] : " " + words[i]));
        }
        return events;
    }
}
