package io.agentrelay.client.http.jdk;

import java.time.Duration;

import io.agentrelay.client.http.HttpClient;
import io.agentrelay.client.http.HttpClientBuilder;
import io.agentrelay.util.Assert;

public class JdkHttpClientBuilder implements HttpClientBuilder {

    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);

    private Duration connectTimeout = DEFAULT_CONNECT_TIMEOUT;

    public JdkHttpClientBuilder connectTimeout(Duration connectTimeout) {
        this.connectTimeout = Assert.checkPositiveParam("connectTimeout", connectTimeout);
        return this;
    }

    @Override
    public HttpClient create(String url) {
        return new JdkHttpClient(url, java.net.http.HttpClient.newBuilder()
                .version(java.net.http.HttpClient.Version.HTTP_1_1)
                .followRedirects(java.net.http.HttpClient.Redirect.NORMAL)
                .connectTimeout(connectTimeout)
                .build());
    }
}
