package io.agentrelay.client;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

import io.agentrelay.client.http.HttpClient;
import io.agentrelay.client.http.HttpResponse;
import io.agentrelay.client.http.sse.StreamEvent;
import io.agentrelay.client.http.sse.StreamSubscription;
import io.agentrelay.spec.RelayCancelledException;
import io.agentrelay.spec.RelayTransportException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

/**
 * Drives the stream callbacks directly to cover broken and abandoned streams.
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
public class RelayClientStreamTest {

    private static final String AGENT_URL = "http://localhost:8003";

    @Mock
    private HttpClient httpClient;
    @Mock
    private HttpClient.PostRequestBuilder postBuilder;
    @Mock
    private HttpResponse response;
    @Mock
    private StreamSubscription subscription;

    private Consumer<StreamEvent> eventConsumer;
    private Consumer<Throwable> errorConsumer;
    private Runnable completeRunnable;

    @BeforeEach
    @SuppressWarnings("unchecked")
    public void setUp() {
        when(httpClient.post(anyString())).thenReturn(postBuilder);
        when(postBuilder.asJson()).thenReturn(postBuilder);
        when(postBuilder.asSSE()).thenReturn(postBuilder);
        when(postBuilder.send(anyString())).thenReturn(CompletableFuture.completedFuture(response));
        when(response.statusCode()).thenReturn(200);
        when(response.bodyAsSse(any(), any(), any())).thenAnswer(invocation -> {
            eventConsumer = invocation.getArgument(0);
            errorConsumer = invocation.getArgument(1);
            completeRunnable = invocation.getArgument(2);
            return subscription;
        });
    }

    private RelayClient client(Duration requestTimeout) {
        return new RelayClient(httpClient, new RelayClientConfigBuilder()
                .agentUrl(AGENT_URL)
                .requestTimeout(requestTimeout)
                .build());
    }

    @Test
    public void testBrokenStreamKeepsPartialContent() throws Exception {
        CompletableFuture<String> invocation = client(Duration.ofSeconds(30)).invokeAsync("topic");

        eventConsumer.accept(new StreamEvent(0, "{\"content\":[{\"text\":\"partial\"}]}"));
        errorConsumer.accept(new IOException("connection reset"));

        assertEquals("partial", RelayFutures.await(invocation));
    }

    @Test
    public void testBrokenStreamWithoutContent() {
        CompletableFuture<String> invocation = client(Duration.ofSeconds(30)).invokeAsync("topic");

        eventConsumer.accept(new StreamEvent(0, "{\"statusUpdate\":{\"status\":{\"state\":\"working\"}}}"));
        errorConsumer.accept(new IOException("connection reset"));

        RelayTransportException exception = assertThrows(RelayTransportException.class,
                () -> RelayFutures.await(invocation));
        assertTrue(exception.getCause() instanceof IOException);
    }

    @Test
    public void testCancellationDiscardsContent() {
        CompletableFuture<String> invocation = client(Duration.ofSeconds(30)).invokeAsync("topic");

        eventConsumer.accept(new StreamEvent(0, "{\"content\":[{\"text\":\"discarded\"}]}"));
        assertTrue(invocation.cancel(true));
        completeRunnable.run();

        verify(subscription).cancel();
        assertThrows(RelayCancelledException.class, () -> RelayFutures.await(invocation));
    }

    @Test
    public void testDeadlineCancelsStream() {
        CompletableFuture<String> invocation = client(Duration.ofMillis(100)).invokeAsync("topic");

        eventConsumer.accept(new StreamEvent(0, "{\"content\":[{\"text\":\"too slow\"}]}"));

        RelayCancelledException exception = assertThrows(RelayCancelledException.class,
                () -> RelayFutures.await(invocation));
        assertTrue(exception.getMessage().contains("timed out"));
        verify(subscription, timeout(1000)).cancel();
    }

    @Test
    public void testCallerDeadline() {
        CompletableFuture<String> invocation = client(Duration.ofSeconds(30)).invokeAsync("topic");

        assertThrows(RelayCancelledException.class,
                () -> RelayFutures.await(invocation, Duration.ofMillis(100)));
        assertTrue(invocation.isCancelled());
        verify(subscription).cancel();
    }

    @Test
    public void testConnectionFailure() {
        when(postBuilder.send(anyString()))
                .thenReturn(CompletableFuture.failedFuture(new IOException("Connection refused")));

        CompletableFuture<String> invocation = client(Duration.ofSeconds(30)).invokeAsync("topic");

        RelayTransportException exception = assertThrows(RelayTransportException.class,
                () -> RelayFutures.await(invocation));
        assertTrue(exception.getMessage().contains("Connection refused"));
    }
}
