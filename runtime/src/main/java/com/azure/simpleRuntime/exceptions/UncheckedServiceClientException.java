package com.azure.simpleRuntime.exceptions;

/**
 * Carries a {@link ServiceClientException} out of iterators and streams, which cannot throw
 * checked exceptions.
 */
public class UncheckedServiceClientException extends RuntimeException {
    public UncheckedServiceClientException(ServiceClientException cause) {
        super(cause.getMessage(), cause);
    }

    @Override
    public synchronized ServiceClientException getCause() {
        return (ServiceClientException) super.getCause();
    }
}
