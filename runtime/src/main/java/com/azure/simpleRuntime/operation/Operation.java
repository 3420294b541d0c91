package com.azure.simpleRuntime.operation;

import com.azure.simpleRuntime.exceptions.InvalidOperationVerbException;
import com.azure.simpleRuntime.exceptions.OperationNotFoundException;
import com.azure.simpleRuntime.polling.PollingFamily;

/**
 * A registered operation: its descriptor plus everything derived from it once at registration.
 */
public final class Operation {
    private final OperationDescriptor descriptor;
    private final OperationGroup group;
    private final PollingFamily pollingFamily;
    private final boolean nextPageOperation;

    Operation(OperationDescriptor descriptor, OperationGroup group, PollingFamily pollingFamily, boolean nextPageOperation) {
        this.descriptor = descriptor;
        this.group = group;
        this.pollingFamily = pollingFamily;
        this.nextPageOperation = nextPageOperation;
    }

    public String name() {
        return descriptor.name();
    }

    public OperationDescriptor descriptor() {
        return descriptor;
    }

    public OperationGroup group() {
        return group;
    }

    /**
     * True when the operation is only reached through another operation's next-page reference,
     * so calling it never starts a pagination of its own.
     */
    public boolean isNextPageOperation() {
        return nextPageOperation;
    }

    public PollingFamily pollingFamily() throws InvalidOperationVerbException {
        if (pollingFamily == null) {
            throw new InvalidOperationVerbException(qualifiedName(), descriptor.httpVerb());
        }
        return pollingFamily;
    }

    /**
     * Resolves the operation fetching the page after this one. Without an explicit reference the
     * operation follows its own continuation links.
     */
    public Operation nextOperation() throws OperationNotFoundException {
        NextOperationRef ref = descriptor.nextOperationRef();
        if (ref == null) {
            return this;
        }
        return group.resolve(ref.operationName(), ref.groupName());
    }

    public String qualifiedName() {
        return group.isRoot() ? name() : group.name() + "." + name();
    }

    @Override
    public String toString() {
        return "Operation{" + qualifiedName() + ", " + descriptor.httpVerb() + " " + descriptor.urlTemplate() + "}";
    }
}
