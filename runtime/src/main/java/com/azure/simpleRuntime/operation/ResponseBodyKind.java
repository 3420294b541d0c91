package com.azure.simpleRuntime.operation;

public enum ResponseBodyKind {
    SCALAR,
    SEQUENCE,
    NONE
}
