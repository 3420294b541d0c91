package com.azure.simpleRuntime.operation;

import com.azure.simpleRuntime.http.TransportResponse;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;

import java.util.Map;

/**
 * Final value of an invocation. For paged operations the body is the array of every item, for
 * long running operations the final resource or result, and null for void results.
 */
public record OperationResult(
    int statusCode,
    Map<String, String> headers,
    JsonNode body
) {
    public OperationResult {
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    public static OperationResult of(TransportResponse response) {
        return new OperationResult(response.getStatusCode(), response.getHeaders(), response.getBody());
    }

    public static OperationResult withoutBody(TransportResponse response) {
        return new OperationResult(response.getStatusCode(), response.getHeaders(), null);
    }

    public static OperationResult ofItems(ArrayNode items) {
        return new OperationResult(200, Map.of(), items);
    }

    public boolean hasBody() {
        return body != null && !body.isNull() && !body.isMissingNode();
    }
}
