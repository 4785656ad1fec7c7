package io.agentrelay.client.http.sse;

/**
 * One data payload read from an event stream.
 *
 * @param ordinal the zero-based position of the payload among the payloads of its stream
 * @param rawPayload the line content after the {@code data: } prefix
 */
public record StreamEvent(long ordinal, String rawPayload) {
}
