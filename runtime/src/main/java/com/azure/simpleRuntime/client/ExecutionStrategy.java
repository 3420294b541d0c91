package com.azure.simpleRuntime.client;

import com.azure.simpleRuntime.operation.Operation;
import com.azure.simpleRuntime.operation.OperationDescriptor;

public enum ExecutionStrategy {
    PLAIN,
    PAGED,
    LONG_RUNNING;

    /**
     * Long running wins over pageable. Next-page operations are always plain so that following a
     * continuation link never starts a second pagination.
     */
    public static ExecutionStrategy forOperation(Operation operation) {
        OperationDescriptor descriptor = operation.descriptor();
        if (descriptor.isLongRunning()) {
            return LONG_RUNNING;
        }
        if (descriptor.isPageable() && !operation.isNextPageOperation()) {
            return PAGED;
        }
        return PLAIN;
    }
}
