package com.azure.simpleRuntime.exceptions;

import com.azure.simpleRuntime.polling.PollStatus;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * A long running operation reached the Failed or Canceled terminal state.
 */
public class OperationFailedException extends ServiceClientException {
    private final PollStatus status;
    private final int statusCode;
    private final JsonNode lastBody;

    public OperationFailedException(String message, PollStatus status, int statusCode, JsonNode lastBody) {
        super(message);
        this.status = status;
        this.statusCode = statusCode;
        this.lastBody = lastBody;
    }

    public PollStatus getStatus() {
        return status;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public JsonNode getLastBody() {
        return lastBody;
    }
}
