package com.azure.simpleRuntime.client;

import com.azure.simpleRuntime.CancellationToken;
import com.azure.simpleRuntime.exceptions.InterruptedPollException;
import com.azure.simpleRuntime.exceptions.ServiceClientException;
import com.azure.simpleRuntime.operation.Operation;
import com.azure.simpleRuntime.operation.OperationResult;
import com.azure.simpleRuntime.polling.PollState;
import com.azure.simpleRuntime.polling.PollStatus;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * Handle on a long running operation polled in the background.
 */
public final class PollerHandle {
    private final Operation operation;
    private final PollState state;
    private final CancellationToken cancellationToken;
    private final CompletableFuture<OperationResult> result;

    PollerHandle(Operation operation, PollState state, CancellationToken cancellationToken,
                 CompletableFuture<OperationResult> result) {
        this.operation = operation;
        this.state = state;
        this.cancellationToken = cancellationToken;
        this.result = result;
    }

    public Operation getOperation() {
        return operation;
    }

    public PollStatus getStatus() {
        return state.getStatus();
    }

    public int getPollCount() {
        return state.getPollCount();
    }

    public Duration getElapsed() {
        return state.getElapsed();
    }

    public boolean isDone() {
        return result.isDone();
    }

    public CompletableFuture<OperationResult> getResult() {
        return result;
    }

    /**
     * Requests cancellation. A wait or call in progress is aborted and the result completes with
     * an {@link InterruptedPollException}.
     */
    public void cancel() {
        cancellationToken.cancel();
    }

    /**
     * Blocks until the operation reaches a terminal state.
     */
    public OperationResult await() throws ServiceClientException {
        try {
            return result.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancel();
            throw new InterruptedPollException("Interrupted while waiting for " + operation.qualifiedName(), e);
        } catch (ExecutionException e) {
            throw ServiceClient.unwrap(e.getCause());
        }
    }

    @Override
    public String toString() {
        return "PollerHandle{" + operation.qualifiedName() + ", " + state + "}";
    }
}
