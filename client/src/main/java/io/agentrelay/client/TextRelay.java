package io.agentrelay.client;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import io.agentrelay.spec.AgentCard;
import io.agentrelay.spec.RelayException;

/**
 * Sends text to an agent and returns the agent's text reply.
 */
public interface TextRelay {

    /**
     * Starts an invocation. Cancelling the returned future aborts the network read and
     * discards any content received so far.
     *
     * @param text the input text
     * @return a future completed with the reply, or exceptionally with a {@link RelayException}
     */
    CompletableFuture<String> invokeAsync(String text);

    /**
     * Invokes the agent and waits for the reply.
     *
     * @param text the input text
     * @return the reply, trimmed and never empty
     * @throws RelayException if the invocation fails, returns no content or is cancelled
     */
    default String invoke(String text) throws RelayException {
        return RelayFutures.await(invokeAsync(text));
    }

    /**
     * Looks up the card of the agent behind this relay, if it publishes one.
     *
     * @return the agent card, or empty when it is unknown or could not be fetched
     */
    default Optional<AgentCard> discover() {
        return Optional.empty();
    }

    /**
     * Looks up the agent card, giving up once the timeout has elapsed.
     *
     * @param timeout the longest time to wait for the card
     * @return the agent card, or empty when it is unknown, could not be fetched in time or
     *         could not be fetched at all
     */
    default Optional<AgentCard> discover(Duration timeout) {
        return discover();
    }

    /**
     * Probes whether the agent behind this relay is reachable.
     *
     * @return {@code false} if the agent is known to be down
     */
    default boolean isHealthy() {
        return true;
    }
}
