package com.devgate.gateway.streaming;

import com.devgate.eventmodel.EventSerializer;
import com.devgate.eventmodel.ExecutionEvent;
import com.devgate.eventmodel.ResponseAggregator;
import com.devgate.observability.MetricFactory;
import io.micrometer.core.instrument.Timer;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Supplier;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes an execution's events as a server-sent-events body.
 *
 * <p>Every event becomes one {@code data: <json>\n\n} frame, in production order. When the
 * events run out, a {@code response.completed} frame carrying the aggregate follows, then
 * {@code data: [DONE]\n\n}. If producing an event fails, one error frame replaces the aggregate
 * and nothing follows it. Frames are written and flushed whole. A client that goes away ends
 * the stream quietly.
 */
public class SseStreamAggregator {

    private static final Logger log = LoggerFactory.getLogger(SseStreamAggregator.class);

    static final String KIND_EVENT = "event";
    static final String KIND_COMPLETED = "completed";
    static final String KIND_DONE = "done";
    static final String KIND_ERROR = "error";

    private final MetricFactory metrics;
    private final Clock clock;

    public SseStreamAggregator(MetricFactory metrics, Clock clock) {
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Drains {@code events} into {@code out}. Closes the event stream before returning.
     *
     * @param responseId id for the aggregate if no {@code response.created} event names one
     * @param model      entity id reported on the aggregate
     * @return how the stream ended
     */
    public Outcome stream(Stream<ExecutionEvent> events, OutputStream out, String responseId, String model) {
        return stream(() -> events, out, responseId, model);
    }

    /**
     * Opens the event stream from {@code source} and drains it into {@code out}. A failure to open
     * the stream is reported like a failure while producing events: as the single error frame.
     */
    public Outcome stream(Supplier<Stream<ExecutionEvent>> source, OutputStream out, String responseId, String model) {
        Timer.Sample timing = metrics.startStream();
        Stream<ExecutionEvent> events;
        try {
            events = source.get();
        } catch (RuntimeException fault) {
            return finish(timing, fail(out, fault, 0));
        }
        return finish(timing, drain(events, out, responseId, model));
    }

    private Outcome finish(Timer.Sample timing, Outcome outcome) {
        metrics.stopStream(timing, outcome.name().toLowerCase(Locale.ROOT));
        return outcome;
    }

    private Outcome drain(Stream<ExecutionEvent> events, OutputStream out, String responseId, String model) {
        List<ExecutionEvent> emitted = new ArrayList<>();
        try (events) {
            // one event at a time; each frame is flushed before the next event is pulled
            Iterator<ExecutionEvent> iterator = events.iterator();
            while (true) {
                ExecutionEvent event;
                try {
                    if (!iterator.hasNext()) {
                        break;
                    }
                    event = iterator.next();
                } catch (RuntimeException fault) {
                    return fail(out, fault, emitted.size());
                }
                emitted.add(event);
                writeFrame(out, EventSerializer.frame(event), KIND_EVENT);
            }

            ExecutionEvent.ResponseCompleted completed =
                    ResponseAggregator.complete(emitted, responseId, model, clock.instant());
            writeFrame(out, EventSerializer.frame(completed), KIND_COMPLETED);
            writeFrame(out, EventSerializer.DONE_FRAME, KIND_DONE);
            log.debug("Stream {} completed after {} events", completed.response().id(), emitted.size());
            return Outcome.COMPLETED;
        } catch (ClientGoneException e) {
            log.info("Client disconnected after {} events: {}", emitted.size(), e.getCause().toString());
            return Outcome.CLIENT_DISCONNECTED;
        }
    }

    /**
     * The single terminal frame written when event production fails.
     */
    public static String errorFrame(Throwable fault) {
        String message = fault.getMessage();
        if (message == null || message.isBlank()) {
            message = fault.getClass().getSimpleName();
        }
        Map<String, Object> error = new LinkedHashMap<>();
        error.put("message", message);
        error.put("type", "execution_error");
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("id", "error");
        body.put("object", "error");
        body.put("error", error);
        return EventSerializer.frame(body);
    }

    private Outcome fail(OutputStream out, RuntimeException fault, int emittedCount) {
        log.error("Error in streaming execution after {} events", emittedCount, fault);
        try {
            writeFrame(out, errorFrame(fault), KIND_ERROR);
        } catch (ClientGoneException e) {
            log.info("Client disconnected before the error frame could be sent: {}", e.getCause().toString());
            return Outcome.CLIENT_DISCONNECTED;
        }
        return Outcome.FAILED;
    }

    private void writeFrame(OutputStream out, String frame, String kind) {
        try {
            out.write(frame.getBytes(StandardCharsets.UTF_8));
            out.flush();
        } catch (IOException e) {
            throw new ClientGoneException(e);
        }
        metrics.recordStreamFrame(kind);
    }

    /** How a stream ended. */
    public enum Outcome {
        COMPLETED,
        FAILED,
        CLIENT_DISCONNECTED
    }

    /** Signals a write to a closed connection; never escapes this class. */
    private static final class ClientGoneException extends RuntimeException {
        ClientGoneException(IOException cause) {
            super(cause);
        }
    }
}
