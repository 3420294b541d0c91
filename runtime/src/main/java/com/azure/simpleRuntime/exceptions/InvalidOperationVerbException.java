package com.azure.simpleRuntime.exceptions;

import com.azure.simpleRuntime.http.HttpVerb;

public class InvalidOperationVerbException extends ServiceClientException {
    private final HttpVerb verb;

    public InvalidOperationVerbException(String operationName, HttpVerb verb) {
        super("Invalid long running operation HTTP method " + verb + " on " + operationName);
        this.verb = verb;
    }

    public HttpVerb getVerb() {
        return verb;
    }
}
