/**
 * HTTP client utilities for talking to streaming agents.
 *
 * <p>This package provides a pluggable HTTP client abstraction used to post messages to an
 * agent's {@code /v1/message:stream} endpoint, consume the reply as a server-sent event stream,
 * and fetch the agent's capability card.
 *
 * <h2>Core Components</h2>
 * <ul>
 *   <li>{@link io.agentrelay.client.http.HttpClient} - request builders bound to one agent base URL</li>
 *   <li>{@link io.agentrelay.client.http.HttpClientBuilder} - factory, defaulting to the JDK implementation</li>
 *   <li>{@link io.agentrelay.client.http.HttpResponse} - status, buffered body and event-stream access</li>
 *   <li>{@link io.agentrelay.client.http.AgentCardResolver} - fetches {@code /.well-known/agent.json}</li>
 *   <li>{@link io.agentrelay.client.http.sse.EventStreamReader} - per-line {@code data: } payload reader</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * HttpClient client = HttpClient.createHttpClient("http://localhost:8003");
 * client.post("/v1/message:stream")
 *     .asJson()
 *     .asSSE()
 *     .send(body)
 *     .thenAccept(response -> response.bodyAsSse(
 *         event -> System.out.println(event.rawPayload()),
 *         error -> System.err.println("Error: " + error),
 *         () -> System.out.println("Stream complete")));
 * }</pre>
 */
@NullMarked
package io.agentrelay.client.http;

import org.jspecify.annotations.NullMarked;
