package com.azure.simpleRuntime.http;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Decoded response handed back by a {@link Transport}. Header lookups ignore case.
 */
public class TransportResponse {
    private final int statusCode;
    private final Map<String, String> headers;
    private final JsonNode body;
    private final String rawBody;

    public TransportResponse(int statusCode, Map<String, String> headers, JsonNode body, String rawBody) {
        this.statusCode = statusCode;
        TreeMap<String, String> sorted = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (headers != null) {
            sorted.putAll(headers);
        }
        this.headers = sorted;
        this.body = body;
        this.rawBody = rawBody;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public Map<String, String> getHeaders() {
        return Collections.unmodifiableMap(headers);
    }

    public String getHeader(String name) {
        return headers.get(name);
    }

    public Optional<String> getHeaderOptional(String name) {
        String value = headers.get(name);
        return value == null || value.isBlank() ? Optional.empty() : Optional.of(value);
    }

    public JsonNode getBody() {
        return body;
    }

    public String getRawBody() {
        return rawBody;
    }

    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300;
    }

    @Override
    public String toString() {
        return String.format("TransportResponse{statusCode=%d, headers=%s, body=%s}",
            statusCode, headers, body != null ? body.toString() : "null");
    }
}
