package com.azure.simpleRuntime.http;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public class TransportRequest {
    private final HttpVerb verb;
    private final String url;
    private final Map<String, String> headers;
    private final Map<String, String> queryParameters;
    private Object body;

    public TransportRequest(HttpVerb verb, String url) {
        this.verb = verb;
        this.url = url;
        this.headers = new LinkedHashMap<>();
        this.queryParameters = new LinkedHashMap<>();
    }

    public TransportRequest header(String name, String value) {
        if (value != null) {
            headers.put(name, value);
        }
        return this;
    }

    public TransportRequest headers(Map<String, String> headers) {
        this.headers.putAll(headers);
        return this;
    }

    public TransportRequest queryParam(String name, String value) {
        if (value != null) {
            queryParameters.put(name, value);
        }
        return this;
    }

    public TransportRequest queryParams(Map<String, String> queryParams) {
        this.queryParameters.putAll(queryParams);
        return this;
    }

    public TransportRequest body(Object body) {
        this.body = body;
        return this;
    }

    public HttpVerb getVerb() {
        return verb;
    }

    public String getUrl() {
        return url;
    }

    public Map<String, String> getHeaders() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(headers));
    }

    /**
     * Query parameters in the order they were added.
     */
    public Map<String, String> getQueryParameters() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(queryParameters));
    }

    public Object getBody() {
        return body;
    }

    @Override
    public String toString() {
        return verb + " " + url;
    }
}
