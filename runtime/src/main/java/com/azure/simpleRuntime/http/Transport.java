package com.azure.simpleRuntime.http;

import com.azure.simpleRuntime.CancellationToken;
import com.azure.simpleRuntime.exceptions.ServiceClientException;

/**
 * Sends one request and returns the decoded response.
 *
 * <p>Implementations own wire encoding, retries and authentication. Network failures surface as
 * {@link com.azure.simpleRuntime.exceptions.TransportException}, error status codes as
 * {@link com.azure.simpleRuntime.exceptions.ServiceResponseException}, and a call aborted through
 * the token as {@link com.azure.simpleRuntime.exceptions.OperationCancelledException}.
 */
public interface Transport {
    TransportResponse call(TransportRequest request, CancellationToken cancellationToken) throws ServiceClientException;
}
