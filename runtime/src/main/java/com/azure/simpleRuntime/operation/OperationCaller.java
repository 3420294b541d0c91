package com.azure.simpleRuntime.operation;

import com.azure.simpleRuntime.CancellationToken;
import com.azure.simpleRuntime.exceptions.ServiceClientException;
import com.azure.simpleRuntime.http.TransportResponse;

/**
 * Issues exactly one request for an operation, without paging or polling.
 */
@FunctionalInterface
public interface OperationCaller {
    TransportResponse send(Operation operation, OperationArguments arguments, CancellationToken cancellationToken)
        throws ServiceClientException;
}
