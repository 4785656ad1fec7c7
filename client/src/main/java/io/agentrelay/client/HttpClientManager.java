package io.agentrelay.client;

import java.net.URI;
import java.net.URL;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

import io.agentrelay.client.http.HttpClient;
import io.agentrelay.client.http.HttpClientBuilder;
import io.agentrelay.util.Assert;

/**
 * Shares one {@link HttpClient} per agent endpoint (host and port), so that relays to the same
 * agent reuse its connection pool.
 */
public class HttpClientManager {

    private final Map<Endpoint, HttpClient> clients = new ConcurrentHashMap<>();
    private final HttpClientBuilder httpClientBuilder;

    public HttpClientManager() {
        this(HttpClientBuilder.DEFAULT_FACTORY);
    }

    public HttpClientManager(HttpClientBuilder httpClientBuilder) {
        Assert.checkNotNullParam("httpClientBuilder", httpClientBuilder);
        this.httpClientBuilder = httpClientBuilder;
    }

    public HttpClient getOrCreate(String url) {
        Assert.checkNotNullParam("url", url);

        try {
            return clients.computeIfAbsent(Endpoint.from(URI.create(url).toURL()), new Function<Endpoint, HttpClient>() {
                @Override
                public HttpClient apply(Endpoint endpoint) {
                    return httpClientBuilder.create(url);
                }
            });
        } catch (Exception ex) {
            throw new IllegalArgumentException("URL is malformed: [" + url + "]", ex);
        }
    }

    int size() {
        return clients.size();
    }

    private static class Endpoint {
        private final String host;
        private final int port;

        Endpoint(String host, int port) {
            this.host = host;
            this.port = port;
        }

        static Endpoint from(URL url) {
            return new Endpoint(url.getHost(), url.getPort() != -1 ? url.getPort() : url.getDefaultPort());
        }

        @Override
        public boolean equals(Object o) {
            if (o == null || getClass() != o.getClass()) return false;
            Endpoint endpoint = (Endpoint) o;
            return port == endpoint.port && Objects.equals(host, endpoint.host);
        }

        @Override
        public int hashCode() {
            return Objects.hash(host, port);
        }
    }
}
