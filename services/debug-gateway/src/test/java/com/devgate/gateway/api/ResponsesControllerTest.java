package com.devgate.gateway.api;

import static org.assertj.core.api.Assertions.assertThat;

import com.devgate.eventmodel.EventSequence;
import com.devgate.eventmodel.EventSerializer;
import com.devgate.eventmodel.ExecutionEvent;
import com.devgate.gateway.domain.EntityInfo;
import com.devgate.gateway.domain.ExecutionEngine;
import com.devgate.gateway.domain.InMemoryEntityCatalog;
import com.devgate.gateway.streaming.SseStreamAggregator;
import com.devgate.observability.MetricFactory;
import com.devgate.observability.SpanHelper;
import com.devgate.security.context.ExecutionContextPropagator;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.opentelemetry.api.OpenTelemetry;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;
import java.util.stream.Stream;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;

/**
 * Drives {@link ResponsesController} as a plain object with scripted engines, writing the
 * streaming body into memory.
 */
@DisplayName("ResponsesController")
class ResponsesControllerTest {

    private static final String ENTITY = "scripted_agent";
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC);

    private final ObjectMapper mapper = new ObjectMapper();
    private final ByteArrayOutputStream out = new ByteArrayOutputStream();

    private ResponsesController controllerFor(ExecutionEngine engine) {
        return new ResponsesController(
                new InMemoryEntityCatalog(List.of(new EntityInfo(ENTITY, "agent", ENTITY, null, null, null, "test", null))),
                engine,
                new SseStreamAggregator(new MetricFactory(new SimpleMeterRegistry(), "debug-gateway"), CLOCK),
                new ExecutionContextPropagator(),
                new SpanHelper(OpenTelemetry.noop().getTracer("test")));
    }

    private static ResponseRequest streamingRequest() {
        return new ResponseRequest(ENTITY, "hi", true, null, null, Map.of());
    }

    private List<String> stream(ExecutionEngine engine, MockHttpServletResponse response) throws Exception {
        Object result = controllerFor(engine).createResponse(streamingRequest(), response);
        assertThat(result).isInstanceOf(StreamingResponseBody.class);
        ((StreamingResponseBody) result).writeTo(out);
        return frames(out.toString(StandardCharsets.UTF_8));
    }

    private static List<String> frames(String body) {
        return Arrays.stream(body.split("(?<=\n\n)")).filter(f -> !f.isEmpty()).toList();
    }

    private static Stream<ExecutionEvent> lazily(List<Supplier<ExecutionEvent>> steps) {
        return steps.stream().map(Supplier::get);
    }

    @Nested
    @DisplayName("streaming")
    class Streaming {

        @Test
        @DisplayName("returns a bare streaming body with event-stream headers")
        void returnsStreamingBody() throws Exception {
            MockHttpServletResponse response = new MockHttpServletResponse();
            EventSequence sequence = EventSequence.start(ENTITY);

            List<String> frames = stream(request -> Stream.of(sequence.created()), response);

            assertThat(response.getContentType()).startsWith(MediaType.TEXT_EVENT_STREAM_VALUE);
            assertThat(response.getHeader(HttpHeaders.CACHE_CONTROL)).isEqualTo("no-cache");
            assertThat(frames).hasSize(3).last().isEqualTo(EventSerializer.DONE_FRAME);
        }

        @Test
        @DisplayName("a fault after two events leaves two data frames and one error frame")
        void faultAfterTwoEvents() throws Exception {
            EventSequence sequence = EventSequence.start(ENTITY);
            ExecutionEngine engine = request -> lazily(List.of(
                    sequence::created,
                    sequence::inProgress,
                    () -> {
                        throw new IllegalStateException("model backend unavailable");
                    }));

            List<String> frames = stream(engine, new MockHttpServletResponse());

            assertThat(frames).hasSize(3);
            assertThat(mapper.readTree(EventSerializer.payloadOf(frames.get(0))).get("type").asText())
                    .isEqualTo("response.created");
            assertThat(mapper.readTree(EventSerializer.payloadOf(frames.get(1))).get("type").asText())
                    .isEqualTo("response.in_progress");
            JsonNode error = mapper.readTree(EventSerializer.payloadOf(frames.get(2)));
            assertThat(error.get("object").asText()).isEqualTo("error");
            assertThat(error.at("/error/message").asText()).isEqualTo("model backend unavailable");
            assertThat(frames).doesNotContain(EventSerializer.DONE_FRAME);
        }

        @Test
        @DisplayName("each frame is written before the next event is produced")
        void writesIncrementally() throws Exception {
            EventSequence sequence = EventSequence.start(ENTITY);
            AtomicReference<String> writtenBeforeThird = new AtomicReference<>();
            ExecutionEngine engine = request -> lazily(List.of(
                    sequence::created,
                    sequence::inProgress,
                    () -> {
                        writtenBeforeThird.set(out.toString(StandardCharsets.UTF_8));
                        return sequence.textDelta("msg_1", "hi");
                    }));

            stream(engine, new MockHttpServletResponse());

            assertThat(frames(writtenBeforeThird.get())).hasSize(2);
        }

        @Test
        @DisplayName("an engine that fails to start yields only the error frame")
        void failureToStart() throws Exception {
            ExecutionEngine engine = request -> {
                throw new IllegalStateException("entity crashed on start");
            };

            List<String> frames = stream(engine, new MockHttpServletResponse());

            assertThat(frames).hasSize(1);
            assertThat(mapper.readTree(EventSerializer.payloadOf(frames.get(0))).at("/error/message").asText())
                    .isEqualTo("entity crashed on start");
        }
    }

    @Nested
    @DisplayName("synchronous")
    class Synchronous {

        @Test
        @DisplayName("answers with the aggregate as a ResponseEntity")
        void answersWithAggregate() {
            EventSequence sequence = EventSequence.start(ENTITY);
            ExecutionEngine engine = request -> Stream.of(sequence.created(), sequence.textDelta("msg_1", "hello"));

            Object result = controllerFor(engine).createResponse(
                    new ResponseRequest(ENTITY, "hi", false, null, null, null), new MockHttpServletResponse());

            assertThat(result).isInstanceOf(ResponseEntity.class);
            assertThat(((ResponseEntity<?>) result).getStatusCode().value()).isEqualTo(200);
        }
    }
}
