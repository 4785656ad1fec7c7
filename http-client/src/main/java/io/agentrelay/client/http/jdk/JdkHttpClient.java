package io.agentrelay.client.http.jdk;

import static java.net.HttpURLConnection.HTTP_MULT_CHOICE;
import static java.net.HttpURLConnection.HTTP_OK;

import io.agentrelay.client.http.HttpClient;
import io.agentrelay.client.http.HttpHeaders;
import io.agentrelay.client.http.HttpResponse;
import io.agentrelay.client.http.sse.EventStreamReader;
import io.agentrelay.client.http.sse.StreamEvent;
import io.agentrelay.client.http.sse.StreamSubscription;

import java.io.IOException;
import java.net.MalformedURLException;
import java.net.URI;
import java.net.URL;
import java.net.URLConnection;
import java.net.URLStreamHandler;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse.BodyHandler;
import java.net.http.HttpResponse.BodyHandlers;
import java.net.http.HttpResponse.BodySubscriber;
import java.net.http.HttpResponse.BodySubscribers;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Flow;
import java.util.function.Consumer;

import org.jspecify.annotations.Nullable;

class JdkHttpClient implements HttpClient {

    private final java.net.http.HttpClient httpClient;
    private final String baseUrl;

    JdkHttpClient(String baseUrl) {
        this(baseUrl, java.net.http.HttpClient.newBuilder()
                .version(java.net.http.HttpClient.Version.HTTP_1_1)
                .followRedirects(java.net.http.HttpClient.Redirect.NORMAL)
                .build());
    }

    JdkHttpClient(String baseUrl, java.net.http.HttpClient httpClient) {
        this.httpClient = httpClient;

        URL targetUrl = buildUrl(baseUrl);
        this.baseUrl = targetUrl.getProtocol() + "://" + targetUrl.getAuthority();
    }

    @Override
    public String getBaseUrl() {
        return baseUrl;
    }

    private static final URLStreamHandler URL_HANDLER = new URLStreamHandler() {
        protected URLConnection openConnection(URL u) {
            return null;
        }
    };

    private static URL buildUrl(String uri) {
        try {
            return new URL(null, uri, URL_HANDLER);
        } catch (MalformedURLException var2) {
            throw new IllegalArgumentException("URI [" + uri + "] is not valid");
        }
    }

    @Override
    public GetRequestBuilder get(String path) {
        return new JdkGetRequestBuilder(path);
    }

    @Override
    public PostRequestBuilder post(String path) {
        return new JdkPostRequestBuilder(path);
    }

    private abstract class JdkRequestBuilder<T extends RequestBuilder<T>> implements RequestBuilder<T> {
        private final String path;
        protected final Map<String, String> headers = new HashMap<>();
        private @Nullable Duration timeout;

        public JdkRequestBuilder(String path) {
            this.path = path;
        }

        @Override
        public T addHeader(String name, String value) {
            headers.put(name, value);
            return self();
        }

        @Override
        public T addHeaders(Map<String, String> headers) {
            if (headers != null && !headers.isEmpty()) {
                for (Map.Entry<String, String> entry : headers.entrySet()) {
                    addHeader(entry.getKey(), entry.getValue());
                }
            }
            return self();
        }

        @Override
        public T timeout(Duration timeout) {
            this.timeout = timeout;
            return self();
        }

        @SuppressWarnings("unchecked")
        T self() {
            return (T) this;
        }

        protected HttpRequest.Builder createRequestBuilder() {
            HttpRequest.Builder builder = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + path));
            if (timeout != null) {
                builder.timeout(timeout);
            }
            for (Map.Entry<String, String> headerEntry : headers.entrySet()) {
                builder.header(headerEntry.getKey(), headerEntry.getValue());
            }
            return builder;
        }
    }

    private class JdkGetRequestBuilder extends JdkRequestBuilder<GetRequestBuilder> implements GetRequestBuilder {

        public JdkGetRequestBuilder(String path) {
            super(path);
        }

        @Override
        public CompletableFuture<HttpResponse> send() {
            HttpRequest request = super.createRequestBuilder().GET().build();
            return httpClient
                    .sendAsync(request, BodyHandlers.ofString(StandardCharsets.UTF_8))
                    .thenApply(JdkHttpResponse::new);
        }
    }

    private class JdkPostRequestBuilder extends JdkRequestBuilder<PostRequestBuilder> implements PostRequestBuilder {
        String body = "";

        public JdkPostRequestBuilder(String path) {
            super(path);
        }

        @Override
        public PostRequestBuilder body(@Nullable String body) {
            this.body = body == null ? "" : body;
            return this;
        }

        @Override
        public CompletableFuture<HttpResponse> send() {
            final HttpRequest request = super.createRequestBuilder()
                    .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8))
                    .build();

            final BodyHandler<?> bodyHandler;

            final String acceptHeader = this.headers.get(HttpHeaders.ACCEPT);
            if (HttpHeaders.EVENT_STREAM.equalsIgnoreCase(acceptHeader)) {
                bodyHandler = BodyHandlers.ofPublisher();
            } else {
                bodyHandler = BodyHandlers.ofString(StandardCharsets.UTF_8);
            }

            return httpClient.sendAsync(request, bodyHandler).thenApply(JdkHttpResponse::new);
        }
    }

    private record JdkHttpResponse(java.net.http.HttpResponse<?> response) implements HttpResponse {

        @Override
        public int statusCode() {
            return response.statusCode();
        }

        @Override
        public boolean success() {
            return response.statusCode() >= HTTP_OK && response.statusCode() < HTTP_MULT_CHOICE;
        }

        @Override
        public CompletableFuture<String> body() {
            if (response.body() instanceof String) {
                return CompletableFuture.completedFuture((String) response.body());
            }

            BodySubscriber<String> subscriber = BodySubscribers.ofString(StandardCharsets.UTF_8);
            publisher().subscribe(subscriber);
            return subscriber.getBody().toCompletableFuture();
        }

        @Override
        public StreamSubscription bodyAsSse(Consumer<StreamEvent> eventConsumer,
                                            Consumer<Throwable> errorConsumer,
                                            Runnable completeRunnable) {
            EventStreamReader reader = new EventStreamReader(eventConsumer, errorConsumer, completeRunnable);
            if (!(response.body() instanceof Flow.Publisher)) {
                errorConsumer.accept(new IOException("Response is not an event-stream response: Accept["
                        + response.request().headers().firstValue(HttpHeaders.ACCEPT).orElse("unknown") + "]"));
                return reader;
            }

            publisher().subscribe(BodySubscribers.fromLineSubscriber(reader));
            return reader;
        }

        @SuppressWarnings("unchecked")
        private Flow.Publisher<List<ByteBuffer>> publisher() {
            Object body = response.body();
            if (body instanceof Flow.Publisher) {
                return (Flow.Publisher<List<ByteBuffer>>) body;
            }
            throw new IllegalStateException("Response body is not a publisher: " + body);
        }
    }
}
