package io.agentrelay.client;

import java.time.Duration;

import io.agentrelay.client.extraction.ExtractionListener;
import io.agentrelay.client.http.HttpClientBuilder;
import io.agentrelay.util.Assert;

/**
 * Settings of a {@link RelayClient}. Built with {@link RelayClientConfigBuilder}.
 */
public class RelayClientConfig {

    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(300);
    public static final Duration DEFAULT_HEALTH_TIMEOUT = Duration.ofSeconds(5);
    public static final int DEFAULT_ERROR_EXCERPT_LENGTH = 500;

    private final String agentUrl;
    private final Duration requestTimeout;
    private final Duration healthTimeout;
    private final int errorExcerptLength;
    private final HttpClientBuilder httpClientBuilder;
    private final ExtractionListener extractionListener;

    RelayClientConfig(String agentUrl, Duration requestTimeout, Duration healthTimeout, int errorExcerptLength,
                      HttpClientBuilder httpClientBuilder, ExtractionListener extractionListener) {
        Assert.checkNotNullParam("agentUrl", agentUrl);
        Assert.checkNotNullParam("httpClientBuilder", httpClientBuilder);
        Assert.checkNotNullParam("extractionListener", extractionListener);
        this.agentUrl = agentUrl;
        this.requestTimeout = requestTimeout;
        this.healthTimeout = healthTimeout;
        this.errorExcerptLength = errorExcerptLength;
        this.httpClientBuilder = httpClientBuilder;
        this.extractionListener = extractionListener;
    }

    public String getAgentUrl() {
        return agentUrl;
    }

    /**
     * Overall bound on one invocation, from sending the request to the end of the stream.
     */
    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public Duration getHealthTimeout() {
        return healthTimeout;
    }

    public int getErrorExcerptLength() {
        return errorExcerptLength;
    }

    public HttpClientBuilder getHttpClientBuilder() {
        return httpClientBuilder;
    }

    public ExtractionListener getExtractionListener() {
        return extractionListener;
    }
}
