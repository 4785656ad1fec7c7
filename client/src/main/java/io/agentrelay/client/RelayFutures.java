package io.agentrelay.client;

import static io.agentrelay.common.RelayErrorMessages.INVOCATION_CANCELLED;
import static io.agentrelay.common.RelayErrorMessages.INVOCATION_TIMED_OUT;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import io.agentrelay.spec.RelayCancelledException;
import io.agentrelay.spec.RelayException;
import io.agentrelay.spec.RelayTransportException;
import io.agentrelay.util.Assert;

/**
 * Waits on invocation futures and maps their failures onto {@link RelayException}.
 */
public final class RelayFutures {

    private RelayFutures() {
    }

    public static <T> T await(CompletableFuture<T> future) throws RelayException {
        Assert.checkNotNullParam("future", future);
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new RelayCancelledException(INVOCATION_CANCELLED, e);
        } catch (CancellationException e) {
            throw new RelayCancelledException(INVOCATION_CANCELLED, e);
        } catch (ExecutionException e) {
            throw unwrap(e.getCause());
        }
    }

    /**
     * Waits at most {@code timeout}; when it elapses the future is cancelled.
     */
    public static <T> T await(CompletableFuture<T> future, Duration timeout) throws RelayException {
        Assert.checkNotNullParam("future", future);
        Assert.checkPositiveParam("timeout", timeout);
        try {
            return future.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new RelayCancelledException(INVOCATION_TIMED_OUT + " after " + timeout, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new RelayCancelledException(INVOCATION_CANCELLED, e);
        } catch (CancellationException e) {
            throw new RelayCancelledException(INVOCATION_CANCELLED, e);
        } catch (ExecutionException e) {
            throw unwrap(e.getCause());
        }
    }

    static RelayException unwrap(Throwable cause) {
        Throwable actual = cause;
        while (actual instanceof CompletionException && actual.getCause() != null) {
            actual = actual.getCause();
        }
        if (actual instanceof RelayException) {
            return (RelayException) actual;
        }
        if (actual instanceof CancellationException) {
            return new RelayCancelledException(INVOCATION_CANCELLED, actual);
        }
        return new RelayTransportException("Agent invocation failed: " + actual, actual);
    }
}
