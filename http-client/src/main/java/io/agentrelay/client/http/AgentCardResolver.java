package io.agentrelay.client.http;

import static io.agentrelay.util.Utils.unmarshalFrom;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import io.agentrelay.spec.AgentCard;
import io.agentrelay.spec.AgentCardResolutionException;
import org.jspecify.annotations.Nullable;

public class AgentCardResolver {
    private final HttpClient httpClient;
    private final @Nullable Map<String, String> authHeaders;
    private final String agentCardPath;
    private final Duration timeout;
    public static final String DEFAULT_AGENT_CARD_PATH = "/.well-known/agent.json";
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    private static final TypeReference<AgentCard> AGENT_CARD_TYPE_REFERENCE = new TypeReference<>() {};

    /**
     * Get the agent card for an agent.
     * The {@code HttpClient} will be used to fetch the agent card.
     *
     * @param baseUrl the base URL for the agent whose agent card we want to retrieve
     * @throws AgentCardResolutionException if the URL for the agent is invalid
     */
    public AgentCardResolver(String baseUrl) throws AgentCardResolutionException {
        this(HttpClient.createHttpClient(baseUrl), agentCardPathOf(baseUrl), null);
    }

    /**
     * @param httpClient the http client to use
     * @param agentCardPath optional path of the agent relative to the client's base URL; the
     *                      card path is appended unless it is already present
     * @param authHeaders the HTTP authentication headers to use. May be {@code null}
     */
    public AgentCardResolver(HttpClient httpClient, @Nullable String agentCardPath,
                             @Nullable Map<String, String> authHeaders) {
        this(httpClient, agentCardPath, authHeaders, DEFAULT_TIMEOUT);
    }

    public AgentCardResolver(HttpClient httpClient, @Nullable String agentCardPath,
                             @Nullable Map<String, String> authHeaders, Duration timeout) {
        this.httpClient = httpClient;
        if (agentCardPath == null || agentCardPath.isEmpty()) {
            this.agentCardPath = DEFAULT_AGENT_CARD_PATH;
        } else if (agentCardPath.endsWith(DEFAULT_AGENT_CARD_PATH)) {
            this.agentCardPath = agentCardPath;
        } else {
            this.agentCardPath = stripTrailingSlash(agentCardPath) + DEFAULT_AGENT_CARD_PATH;
        }
        this.authHeaders = authHeaders;
        this.timeout = timeout;
    }

    private static String agentCardPathOf(String baseUrl) throws AgentCardResolutionException {
        try {
            String path = new URI(baseUrl).getPath();
            return path == null ? "" : stripTrailingSlash(path);
        } catch (URISyntaxException e) {
            throw new AgentCardResolutionException("Invalid agent URL", e);
        }
    }

    private static String stripTrailingSlash(String path) {
        return path.endsWith("/") ? path.substring(0, path.length() - 1) : path;
    }

    String getAgentCardPath() {
        return agentCardPath;
    }

    /**
     * Get the agent card for the configured agent.
     *
     * @return the agent card
     * @throws AgentCardResolutionException if an HTTP error occurs fetching the card, or if the
     *                                      response body cannot be decoded as an agent card
     */
    public AgentCard getAgentCard() throws AgentCardResolutionException {
        HttpClient.GetRequestBuilder builder = httpClient.get(agentCardPath)
                .addHeader(HttpHeaders.CONTENT_TYPE, HttpHeaders.APPLICATION_JSON)
                .timeout(timeout);

        if (authHeaders != null) {
            builder.addHeaders(authHeaders);
        }

        String body;

        try {
            HttpResponse response = builder.send().get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!response.success()) {
                throw new AgentCardResolutionException("Failed to obtain agent card: " + response.statusCode());
            }
            body = response.body().get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AgentCardResolutionException("Interrupted while obtaining agent card", e);
        } catch (ExecutionException | TimeoutException e) {
            throw new AgentCardResolutionException("Failed to obtain agent card", e);
        }

        try {
            return unmarshalFrom(body, AGENT_CARD_TYPE_REFERENCE);
        } catch (JsonProcessingException e) {
            throw new AgentCardResolutionException("Could not unmarshal agent card response", e);
        }
    }
}
