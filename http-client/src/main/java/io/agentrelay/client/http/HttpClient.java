package io.agentrelay.client.http;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import org.jspecify.annotations.Nullable;

public interface HttpClient {

    static HttpClient createHttpClient(String baseUrl) {
        return HttpClientBuilder.DEFAULT_FACTORY.create(baseUrl);
    }

    String getBaseUrl();

    GetRequestBuilder get(String path);

    PostRequestBuilder post(String path);

    interface RequestBuilder<T extends RequestBuilder<T>> {
        CompletableFuture<HttpResponse> send();

        T addHeader(String name, String value);

        T addHeaders(Map<String, String> headers);

        /**
         * Bounds the time until the response headers are received.
         */
        T timeout(Duration timeout);
    }

    interface GetRequestBuilder extends RequestBuilder<GetRequestBuilder> {

    }

    interface PostRequestBuilder extends RequestBuilder<PostRequestBuilder> {
        PostRequestBuilder body(@Nullable String body);

        default PostRequestBuilder asJson() {
            return addHeader(HttpHeaders.CONTENT_TYPE, HttpHeaders.APPLICATION_JSON);
        }

        default PostRequestBuilder asSSE() {
            return addHeader(HttpHeaders.ACCEPT, HttpHeaders.EVENT_STREAM);
        }

        default CompletableFuture<HttpResponse> send(String body) {
            return this.body(body).send();
        }
    }
}
