package io.agentrelay.client.http.sse;

import java.util.Optional;
import java.util.concurrent.Flow;
import java.util.function.Consumer;
import java.util.stream.Stream;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads an event stream line by line and emits the payload of every {@code data: } line.
 * <p>
 * Each event occupies exactly one line. A line is handled as follows:
 * <ul>
 *   <li>a line starting with {@code "data: "} has the prefix stripped; if the remainder, trimmed,
 *   is empty or {@code [DONE]} the line is a keepalive and nothing is emitted, otherwise the
 *   remainder is emitted unchanged</li>
 *   <li>any other line (comments, {@code event:} or {@code id:} fields, blank separators) is ignored</li>
 * </ul>
 * The end of the stream is signalled by the connection closing, never by a sentinel payload.
 * <p>
 * Lines are requested one at a time, so at most one line is buffered by the reader. Once
 * {@link #cancel()} is called the upstream subscription is cancelled and no further callback
 * runs.
 */
public class EventStreamReader implements Flow.Subscriber<String>, StreamSubscription {

    private static final Logger LOGGER = LoggerFactory.getLogger(EventStreamReader.class);

    public static final String DATA_PREFIX = "data: ";
    public static final String DONE_SENTINEL = "[DONE]";

    private final Consumer<StreamEvent> eventConsumer;
    private final Consumer<Throwable> errorConsumer;
    private final Runnable completeRunnable;

    private volatile Flow.@Nullable Subscription subscription;
    private volatile boolean cancelled;
    private long ordinal;

    public EventStreamReader(Consumer<StreamEvent> eventConsumer,
                             Consumer<Throwable> errorConsumer,
                             Runnable completeRunnable) {
        this.eventConsumer = eventConsumer;
        this.errorConsumer = errorConsumer;
        this.completeRunnable = completeRunnable;
    }

    /**
     * Applies the line rule to a single line.
     *
     * @param line one line of the stream, without its line terminator
     * @return the payload carried by the line, or empty when the line carries none
     */
    public static Optional<String> payloadOf(String line) {
        if (!line.startsWith(DATA_PREFIX)) {
            return Optional.empty();
        }
        String payload = line.substring(DATA_PREFIX.length());
        String trimmed = payload.trim();
        if (trimmed.isEmpty() || DONE_SENTINEL.equals(trimmed)) {
            return Optional.empty();
        }
        return Optional.of(payload);
    }

    /**
     * Applies the line rule lazily to a stream of lines.
     *
     * @param lines the lines of an event stream, for instance {@code BufferedReader.lines()}
     * @return the payloads in stream order
     */
    public static Stream<String> payloads(Stream<String> lines) {
        return lines.map(EventStreamReader::payloadOf)
                .flatMap(Optional::stream);
    }

    @Override
    public void onSubscribe(Flow.Subscription subscription) {
        this.subscription = subscription;
        if (cancelled) {
            subscription.cancel();
        } else {
            subscription.request(1);
        }
    }

    @Override
    public void onNext(String line) {
        if (cancelled) {
            return;
        }
        LOGGER.debug("got line `{}`", line);
        Optional<String> payload = payloadOf(line);
        if (payload.isPresent()) {
            eventConsumer.accept(new StreamEvent(ordinal++, payload.get()));
        }
        Flow.Subscription current = subscription;
        if (!cancelled && current != null) {
            current.request(1);
        }
    }

    @Override
    public void onError(Throwable throwable) {
        if (cancelled) {
            LOGGER.debug("Ignoring stream error after cancellation: {}", throwable.toString());
            return;
        }
        errorConsumer.accept(throwable);
    }

    @Override
    public void onComplete() {
        if (cancelled) {
            return;
        }
        LOGGER.debug("Event stream closed after {} payloads", ordinal);
        completeRunnable.run();
    }

    @Override
    public void cancel() {
        cancelled = true;
        Flow.Subscription current = subscription;
        if (current != null) {
            current.cancel();
        }
    }

    @Override
    public boolean isCancelled() {
        return cancelled;
    }
}
