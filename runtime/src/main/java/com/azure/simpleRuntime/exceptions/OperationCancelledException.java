package com.azure.simpleRuntime.exceptions;

public class OperationCancelledException extends ServiceClientException {
    public OperationCancelledException(String message) {
        super(message);
    }

    public OperationCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
