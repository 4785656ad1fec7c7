package io.agentrelay.client;

import static io.agentrelay.common.RelayErrorMessages.CONNECTION_FAILED;
import static io.agentrelay.common.RelayErrorMessages.INVOCATION_TIMED_OUT;
import static io.agentrelay.common.RelayErrorMessages.STREAM_CLOSED_WITHOUT_CONTENT;
import static io.agentrelay.util.Assert.checkNotNullParam;

import java.net.URI;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.agentrelay.client.extraction.EnvelopeExtractor;
import io.agentrelay.client.extraction.Extraction;
import io.agentrelay.client.extraction.ExtractionListener;
import io.agentrelay.client.extraction.ResultAccumulator;
import io.agentrelay.client.extraction.TextFragment;
import io.agentrelay.client.http.AgentCardResolver;
import io.agentrelay.client.http.HttpClient;
import io.agentrelay.client.http.HttpResponse;
import io.agentrelay.client.http.sse.StreamEvent;
import io.agentrelay.client.http.sse.StreamSubscription;
import io.agentrelay.spec.AgentCard;
import io.agentrelay.spec.AgentCardResolutionException;
import io.agentrelay.spec.EmptyResultException;
import io.agentrelay.spec.MessageStreamRequest;
import io.agentrelay.spec.RelayCancelledException;
import io.agentrelay.spec.RelayProtocolException;
import io.agentrelay.spec.RelayTransportException;
import io.agentrelay.util.Utils;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Relays text to one agent over its streaming message endpoint.
 * <p>
 * Each invocation posts the text to {@code /v1/message:stream}, reads the event stream as it
 * arrives and concatenates the text extracted from every event. A stream that breaks after
 * some text was received yields that text; a stream that breaks before is a
 * {@link RelayTransportException}. Cancellation, or the configured request timeout, closes
 * the connection and discards whatever was received.
 * <p>
 * Invocations share nothing but the underlying {@link HttpClient}, so a client may be used
 * from several threads.
 */
public class RelayClient implements TextRelay {

    private static final Logger LOGGER = LoggerFactory.getLogger(RelayClient.class);

    public static final String HEALTH_PATH = "/health";

    private final HttpClient httpClient;
    private final RelayClientConfig config;
    private final String agentPath;
    private final EnvelopeExtractor extractor;

    public RelayClient(String agentUrl) {
        this(new RelayClientConfigBuilder().agentUrl(agentUrl).build());
    }

    public RelayClient(RelayClientConfig config) {
        this(null, config);
    }

    public RelayClient(@Nullable HttpClient httpClient, RelayClientConfig config) {
        checkNotNullParam("config", config);
        this.config = config;
        this.httpClient = httpClient == null ? config.getHttpClientBuilder().create(config.getAgentUrl()) : httpClient;
        this.extractor = new EnvelopeExtractor(config.getExtractionListener());
        String sAgentPath = URI.create(config.getAgentUrl()).getPath();

        // Strip the last slash if one is provided
        if (sAgentPath == null) {
            this.agentPath = "";
        } else if (sAgentPath.endsWith("/")) {
            this.agentPath = sAgentPath.substring(0, sAgentPath.length() - 1);
        } else {
            this.agentPath = sAgentPath;
        }
    }

    public String getAgentUrl() {
        return config.getAgentUrl();
    }

    @Override
    public CompletableFuture<String> invokeAsync(String text) {
        checkNotNullParam("text", text);
        String body;
        try {
            body = Utils.marshalTo(MessageStreamRequest.ofText(text));
        } catch (JsonProcessingException e) {
            return CompletableFuture.failedFuture(new RelayTransportException("Failed to serialize request: " + e, e));
        }
        Invocation invocation = new Invocation();
        invocation.start(body);
        return invocation.result;
    }

    /**
     * Fetches the agent's card. Failures are logged and reported as an empty result.
     *
     * @return the agent card, if it could be obtained
     */
    @Override
    public Optional<AgentCard> discover() {
        return discover(AgentCardResolver.DEFAULT_TIMEOUT);
    }

    @Override
    public Optional<AgentCard> discover(Duration timeout) {
        checkNotNullParam("timeout", timeout);
        try {
            AgentCard card = new AgentCardResolver(httpClient, agentPath, null, timeout).getAgentCard();
            LOGGER.info("Discovered agent '{}' at {}", card.name(), config.getAgentUrl());
            return Optional.of(card);
        } catch (AgentCardResolutionException e) {
            LOGGER.warn("Could not discover agent at {}: {}", config.getAgentUrl(), e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Probes the agent's health endpoint.
     *
     * @return {@code true} if the agent answered with a 2xx status within the health timeout
     */
    @Override
    public boolean isHealthy() {
        Duration timeout = config.getHealthTimeout();
        try {
            HttpResponse response = httpClient.get(agentPath + HEALTH_PATH)
                    .timeout(timeout)
                    .send()
                    .get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return response.success();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (ExecutionException | TimeoutException e) {
            LOGGER.debug("Health check of {} failed: {}", config.getAgentUrl(), e.toString());
            return false;
        }
    }

    private final class Invocation {
        private final CompletableFuture<String> result = new CompletableFuture<>();
        private final ResultAccumulator accumulator = new ResultAccumulator();
        private final AtomicReference<StreamSubscription> subscription = new AtomicReference<>();
        private final AtomicReference<CompletableFuture<HttpResponse>> response = new AtomicReference<>();
        private final ExtractionListener listener = config.getExtractionListener();

        void start(String body) {
            result.whenComplete((text, error) -> {
                if (error != null) {
                    abort();
                }
            });

            // The timer is cancelled once the result completes, releasing this invocation
            Duration timeout = config.getRequestTimeout();
            CompletableFuture<Void> deadline = new CompletableFuture<>();
            result.whenComplete((text, error) -> deadline.complete(null));
            deadline.orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS).whenComplete((ignored, error) -> {
                if (error instanceof TimeoutException && !result.isDone()) {
                    LOGGER.warn("Invocation of {} timed out after {}", config.getAgentUrl(), timeout);
                    result.completeExceptionally(new RelayCancelledException(INVOCATION_TIMED_OUT + " after " + timeout));
                }
            });

            LOGGER.debug("Posting {} characters to {}", body.length(), config.getAgentUrl());
            CompletableFuture<HttpResponse> sent = httpClient.post(agentPath + MessageStreamRequest.PATH)
                    .asJson()
                    .asSSE()
                    .send(body);
            response.set(sent);
            if (result.isDone()) {
                sent.cancel(true);
                return;
            }
            sent.whenComplete(this::onResponse);
        }

        private void onResponse(@Nullable HttpResponse httpResponse, @Nullable Throwable throwable) {
            if (httpResponse == null) {
                Throwable cause = throwable instanceof CompletionException && throwable.getCause() != null
                        ? throwable.getCause() : throwable;
                if (!(cause instanceof CancellationException)) {
                    result.completeExceptionally(new RelayTransportException(CONNECTION_FAILED + ": " + cause, cause));
                }
                return;
            }

            int status = httpResponse.statusCode();
            if (status >= 400) {
                LOGGER.debug("Agent {} answered with HTTP {}", config.getAgentUrl(), status);
                httpResponse.body().whenComplete((errorBody, error) -> result.completeExceptionally(
                        new RelayProtocolException(status,
                                Utils.truncate(errorBody == null ? "" : errorBody, config.getErrorExcerptLength()))));
                return;
            }

            StreamSubscription stream = httpResponse.bodyAsSse(this::onEvent, this::onStreamError, this::onStreamComplete);
            subscription.set(stream);
            if (result.isDone()) {
                stream.cancel();
            }
        }

        private void onEvent(StreamEvent event) {
            Extraction extraction = extractor.extract(event.rawPayload());
            if (!extraction.matched()) {
                return;
            }
            TextFragment fragment = new TextFragment(event.ordinal(), extraction.text());
            if (accumulator.add(fragment)) {
                listener.onFragmentExtracted(fragment);
            }
        }

        private void onStreamError(Throwable error) {
            if (accumulator.hasFragments()) {
                LOGGER.warn("Stream from {} broke after {} fragments, keeping partial content: {}",
                        config.getAgentUrl(), accumulator.fragmentCount(), error.toString());
                finish();
            } else {
                result.completeExceptionally(new RelayTransportException(STREAM_CLOSED_WITHOUT_CONTENT + ": " + error, error));
            }
        }

        private void onStreamComplete() {
            finish();
        }

        private void finish() {
            try {
                String text = accumulator.finish();
                LOGGER.debug("Received {} characters in {} fragments from {}",
                        text.length(), accumulator.fragmentCount(), config.getAgentUrl());
                result.complete(text);
            } catch (EmptyResultException e) {
                result.completeExceptionally(e);
            }
        }

        private void abort() {
            StreamSubscription stream = subscription.get();
            if (stream != null) {
                stream.cancel();
            }
            CompletableFuture<HttpResponse> sent = response.get();
            if (sent != null) {
                sent.cancel(true);
            }
        }
    }
}
