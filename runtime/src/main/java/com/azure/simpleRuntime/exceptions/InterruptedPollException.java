package com.azure.simpleRuntime.exceptions;

/**
 * Cancellation was observed while a long running operation was being polled.
 */
public class InterruptedPollException extends OperationCancelledException {
    public InterruptedPollException(String message) {
        super(message);
    }

    public InterruptedPollException(String message, Throwable cause) {
        super(message, cause);
    }
}
