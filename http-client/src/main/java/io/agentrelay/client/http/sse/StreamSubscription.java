package io.agentrelay.client.http.sse;

/**
 * Handle on an event stream being consumed.
 */
public interface StreamSubscription {

    /**
     * Stops consuming the stream and releases the connection. Idempotent; no callback is
     * invoked after cancellation.
     */
    void cancel();

    boolean isCancelled();
}
