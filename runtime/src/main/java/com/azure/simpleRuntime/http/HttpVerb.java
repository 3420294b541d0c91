package com.azure.simpleRuntime.http;

public enum HttpVerb {
    GET,
    PUT,
    PATCH,
    POST,
    DELETE
}
