package io.agentrelay.client;

import java.time.Duration;

import io.agentrelay.client.extraction.ExtractionListener;
import io.agentrelay.client.http.HttpClientBuilder;
import io.agentrelay.client.http.jdk.JdkHttpClientBuilder;
import io.agentrelay.util.Assert;
import org.jspecify.annotations.Nullable;

public class RelayClientConfigBuilder {

    private @Nullable String agentUrl;
    private Duration requestTimeout = RelayClientConfig.DEFAULT_REQUEST_TIMEOUT;
    private Duration connectTimeout = JdkHttpClientBuilder.DEFAULT_CONNECT_TIMEOUT;
    private Duration healthTimeout = RelayClientConfig.DEFAULT_HEALTH_TIMEOUT;
    private int errorExcerptLength = RelayClientConfig.DEFAULT_ERROR_EXCERPT_LENGTH;
    private @Nullable HttpClientBuilder httpClientBuilder;
    private ExtractionListener extractionListener = ExtractionListener.NO_OP;

    public RelayClientConfigBuilder agentUrl(String agentUrl) {
        Assert.checkNotNullParam("agentUrl", agentUrl);
        this.agentUrl = agentUrl;
        return this;
    }

    public RelayClientConfigBuilder requestTimeout(Duration requestTimeout) {
        this.requestTimeout = Assert.checkPositiveParam("requestTimeout", requestTimeout);
        return this;
    }

    /**
     * Only applies when no {@link #httpClientBuilder(HttpClientBuilder)} is set.
     */
    public RelayClientConfigBuilder connectTimeout(Duration connectTimeout) {
        this.connectTimeout = Assert.checkPositiveParam("connectTimeout", connectTimeout);
        return this;
    }

    public RelayClientConfigBuilder healthTimeout(Duration healthTimeout) {
        this.healthTimeout = Assert.checkPositiveParam("healthTimeout", healthTimeout);
        return this;
    }

    public RelayClientConfigBuilder errorExcerptLength(int errorExcerptLength) {
        if (errorExcerptLength < 0) {
            throw new IllegalArgumentException("Parameter 'errorExcerptLength' may not be negative");
        }
        this.errorExcerptLength = errorExcerptLength;
        return this;
    }

    public RelayClientConfigBuilder httpClientBuilder(HttpClientBuilder httpClientBuilder) {
        Assert.checkNotNullParam("httpClientBuilder", httpClientBuilder);
        this.httpClientBuilder = httpClientBuilder;
        return this;
    }

    public RelayClientConfigBuilder extractionListener(ExtractionListener extractionListener) {
        Assert.checkNotNullParam("extractionListener", extractionListener);
        this.extractionListener = extractionListener;
        return this;
    }

    public RelayClientConfig build() {
        if (agentUrl == null) {
            throw new IllegalArgumentException("Parameter 'agentUrl' may not be null");
        }
        HttpClientBuilder clientBuilder = httpClientBuilder != null
                ? httpClientBuilder
                : new JdkHttpClientBuilder().connectTimeout(connectTimeout);
        return new RelayClientConfig(agentUrl, requestTimeout, healthTimeout, errorExcerptLength,
                clientBuilder, extractionListener);
    }
}
