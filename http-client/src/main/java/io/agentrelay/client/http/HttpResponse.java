package io.agentrelay.client.http;

import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

import io.agentrelay.client.http.sse.StreamEvent;
import io.agentrelay.client.http.sse.StreamSubscription;

public interface HttpResponse {
    int statusCode();

    default boolean success() {
        return statusCode() >= 200 && statusCode() < 300;
    }

    /**
     * Reads the whole body, whether the request was sent as a plain or as a streaming request.
     */
    CompletableFuture<String> body();

    /**
     * Consumes the body as a server-sent event stream.
     *
     * @param eventConsumer receives each data payload in arrival order
     * @param errorConsumer receives a read error that ended the stream
     * @param completeRunnable runs when the server closes the stream normally
     * @return a handle that cancels the stream and closes the underlying connection
     */
    StreamSubscription bodyAsSse(Consumer<StreamEvent> eventConsumer,
                                 Consumer<Throwable> errorConsumer,
                                 Runnable completeRunnable);
}
