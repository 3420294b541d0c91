package com.azure.simpleRuntime.operation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Argument values for one call: path and query parameters, headers, the request body, the
 * grouped parameter, and for next-page calls the continuation link.
 */
public final class OperationArguments {
    public static final OperationArguments NONE = builder().build();

    private final Map<String, String> pathParameters;
    private final Map<String, String> queryParameters;
    private final Map<String, String> headers;
    private final Object body;
    private final Object groupedParameter;
    private final String nextLink;

    private OperationArguments(Builder builder) {
        this.pathParameters = Collections.unmodifiableMap(new LinkedHashMap<>(builder.pathParameters));
        this.queryParameters = Collections.unmodifiableMap(new LinkedHashMap<>(builder.queryParameters));
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(builder.headers));
        this.body = builder.body;
        this.groupedParameter = builder.groupedParameter;
        this.nextLink = builder.nextLink;
    }

    public Map<String, String> getPathParameters() {
        return pathParameters;
    }

    public Map<String, String> getQueryParameters() {
        return queryParameters;
    }

    public Map<String, String> getHeaders() {
        return headers;
    }

    public Object getBody() {
        return body;
    }

    public Object getGroupedParameter() {
        return groupedParameter;
    }

    public String getNextLink() {
        return nextLink;
    }

    /**
     * Arguments of the call fetching the page at {@code nextLink}: the caller's headers are kept,
     * everything else is carried by the link itself or by the derived grouped parameter.
     */
    public OperationArguments forNextPage(String nextLink, Object nextGroupedParameter) {
        return builder()
            .headers(headers)
            .groupedParameter(nextGroupedParameter)
            .nextLink(nextLink)
            .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "OperationArguments{path=" + pathParameters + ", query=" + queryParameters
            + (nextLink != null ? ", nextLink=" + nextLink : "") + "}";
    }

    public static class Builder {
        private final Map<String, String> pathParameters = new LinkedHashMap<>();
        private final Map<String, String> queryParameters = new LinkedHashMap<>();
        private final Map<String, String> headers = new LinkedHashMap<>();
        private Object body;
        private Object groupedParameter;
        private String nextLink;

        public Builder pathParameter(String name, String value) {
            pathParameters.put(name, value);
            return this;
        }

        public Builder queryParameter(String name, String value) {
            if (value != null) {
                queryParameters.put(name, value);
            }
            return this;
        }

        public Builder header(String name, String value) {
            if (value != null) {
                headers.put(name, value);
            }
            return this;
        }

        public Builder headers(Map<String, String> headers) {
            this.headers.putAll(headers);
            return this;
        }

        public Builder body(Object body) {
            this.body = body;
            return this;
        }

        public Builder groupedParameter(Object groupedParameter) {
            this.groupedParameter = groupedParameter;
            return this;
        }

        public Builder nextLink(String nextLink) {
            this.nextLink = nextLink;
            return this;
        }

        public OperationArguments build() {
            return new OperationArguments(this);
        }
    }
}
