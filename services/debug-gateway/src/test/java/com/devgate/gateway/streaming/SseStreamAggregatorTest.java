package com.devgate.gateway.streaming;

import static org.assertj.core.api.Assertions.assertThat;

import com.devgate.eventmodel.EventSequence;
import com.devgate.eventmodel.EventSerializer;
import com.devgate.eventmodel.ExecutionEvent;
import com.devgate.observability.MetricFactory;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("SseStreamAggregator")
class SseStreamAggregatorTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-01T12:00:00Z"), ZoneOffset.UTC);

    private final ObjectMapper mapper = new ObjectMapper();
    private SimpleMeterRegistry registry;
    private SseStreamAggregator aggregator;
    private EventSequence sequence;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        aggregator = new SseStreamAggregator(new MetricFactory(registry, "debug-gateway"), CLOCK);
        sequence = new EventSequence("resp_test", "echo_agent");
    }

    @Nested
    @DisplayName("Successful streams")
    class Successful {

        @Test
        @DisplayName("writes every event, then the aggregate, then [DONE]")
        void framesEventsAggregateAndDone() throws Exception {
            List<ExecutionEvent> events = List.of(
                    sequence.created(),
                    sequence.textDelta("msg_1", "Hello"),
                    sequence.textDelta("msg_1", " world"));
            var out = new ByteArrayOutputStream();

            var outcome = aggregator.stream(events.stream(), out, "resp_fallback", "echo_agent");

            assertThat(outcome).isEqualTo(SseStreamAggregator.Outcome.COMPLETED);
            List<String> frames = frames(out);
            assertThat(frames).hasSize(5);
            for (int i = 0; i < 3; i++) {
                assertThat(frames.get(i)).isEqualTo(EventSerializer.frame(events.get(i)));
            }
            JsonNode completed = payload(frames.get(3));
            assertThat(completed.get("type").asText()).isEqualTo("response.completed");
            assertThat(completed.get("sequence_number").asInt()).isEqualTo(3);
            assertThat(completed.at("/response/id").asText()).isEqualTo("resp_test");
            assertThat(completed.at("/response/output_text").asText()).isEqualTo("Hello world");
            assertThat(completed.at("/response/status").asText()).isEqualTo("completed");
            assertThat(frames.get(4)).isEqualTo(EventSerializer.DONE_FRAME);
        }

        @Test
        @DisplayName("an empty stream still completes with the fallback response id")
        void emptyStreamCompletes() throws Exception {
            var out = new ByteArrayOutputStream();

            aggregator.stream(Stream.empty(), out, "resp_fallback", "echo_agent");

            List<String> frames = frames(out);
            assertThat(frames).hasSize(2);
            JsonNode completed = payload(frames.get(0));
            assertThat(completed.at("/response/id").asText()).isEqualTo("resp_fallback");
            assertThat(completed.get("sequence_number").asInt()).isZero();
        }

        @Test
        @DisplayName("frames never contain a bare newline inside the payload")
        void multiLineTextStaysOnOneLine() {
            var out = new ByteArrayOutputStream();

            aggregator.stream(Stream.of(sequence.textDelta("msg_1", "line one\nline two")), out, "r", "m");

            String first = frames(out).get(0);
            assertThat(first.substring(0, first.length() - 2)).doesNotContain("\n");
            assertThat(first).contains("line one\\nline two");
        }

        @Test
        @DisplayName("counts frames by kind")
        void countsFrames() {
            aggregator.stream(Stream.of(sequence.created()), new ByteArrayOutputStream(), "r", "m");

            assertThat(registry.get(MetricFactory.STREAM_FRAMES).tags("kind", "event").counter().count())
                    .isEqualTo(1.0);
            assertThat(registry.get(MetricFactory.STREAM_FRAMES).tags("kind", "done").counter().count())
                    .isEqualTo(1.0);
            assertThat(registry.get(MetricFactory.STREAM_DURATION).tags("outcome", "completed").timer().count())
                    .isEqualTo(1L);
        }
    }

    @Nested
    @DisplayName("Failing streams")
    class Failing {

        @Test
        @DisplayName("a fault ends the stream with one error frame and no [DONE]")
        void faultEndsWithErrorFrame() throws Exception {
            var first = sequence.created();
            var second = sequence.textDelta("msg_1", "partial");
            Stream<ExecutionEvent> events = Stream.<Supplier<ExecutionEvent>>of(
                            () -> first,
                            () -> second,
                            () -> {
                                throw new IllegalStateException("model backend unavailable");
                            })
                    .map(Supplier::get);
            var out = new ByteArrayOutputStream();

            var outcome = aggregator.stream(events, out, "r", "m");

            assertThat(outcome).isEqualTo(SseStreamAggregator.Outcome.FAILED);
            List<String> frames = frames(out);
            assertThat(frames).hasSize(3);
            JsonNode error = payload(frames.get(2));
            assertThat(error.get("id").asText()).isEqualTo("error");
            assertThat(error.get("object").asText()).isEqualTo("error");
            assertThat(error.at("/error/message").asText()).isEqualTo("model backend unavailable");
            assertThat(error.at("/error/type").asText()).isEqualTo("execution_error");
            assertThat(out.toString(StandardCharsets.UTF_8))
                    .doesNotContain("[DONE]")
                    .doesNotContain("response.completed");
        }

        @Test
        @DisplayName("a fault without a message reports the exception type")
        void faultWithoutMessage() {
            assertThat(SseStreamAggregator.errorFrame(new NullPointerException()))
                    .contains("\"message\":\"NullPointerException\"");
        }

        @Test
        @DisplayName("the event stream is closed when the stream ends")
        void closesEventStream() {
            var closed = new AtomicBoolean();
            Stream<ExecutionEvent> events = Stream.<ExecutionEvent>of(sequence.created()).onClose(() -> closed.set(true));

            aggregator.stream(events, new ByteArrayOutputStream(), "r", "m");

            assertThat(closed).isTrue();
        }
    }

    @Nested
    @DisplayName("Client disconnects")
    class Disconnects {

        @Test
        @DisplayName("a failed write stops the stream quietly")
        void failedWriteStopsStream() {
            var pulled = new int[1];
            Stream<ExecutionEvent> events = Stream.generate(() -> {
                pulled[0]++;
                return (ExecutionEvent) sequence.textDelta("msg_1", "x");
            }).limit(10);

            var outcome = aggregator.stream(events, new BrokenOutputStream(), "r", "m");

            assertThat(outcome).isEqualTo(SseStreamAggregator.Outcome.CLIENT_DISCONNECTED);
            assertThat(pulled[0]).isEqualTo(1);
            assertThat(registry.get(MetricFactory.STREAM_DURATION).tags("outcome", "client_disconnected").timer()
                    .count()).isEqualTo(1L);
        }
    }

    private static List<String> frames(ByteArrayOutputStream out) {
        String body = out.toString(StandardCharsets.UTF_8);
        return Arrays.stream(body.split("(?<=\n\n)")).filter(f -> !f.isEmpty()).toList();
    }

    private JsonNode payload(String frame) throws IOException {
        return mapper.readTree(EventSerializer.payloadOf(frame));
    }

    private static final class BrokenOutputStream extends OutputStream {
        @Override
        public void write(int b) throws IOException {
            throw new IOException("Broken pipe");
        }

        @Override
        public void write(byte[] b, int off, int len) throws IOException {
            throw new IOException("Broken pipe");
        }
    }
}
