package com.azure.simpleRuntime.operation;

import com.azure.simpleRuntime.exceptions.OperationNotFoundException;

import java.util.Collection;

/**
 * Named collection of operations, the equivalent of a sub-client. Keeps a reference to the
 * registry that owns it so that operations can reach sibling groups.
 */
public final class OperationGroup {
    /** Name of the group holding operations defined on the client itself. */
    public static final String ROOT = "";

    private final String name;
    private final OperationRegistry registry;

    OperationGroup(String name, OperationRegistry registry) {
        this.name = name;
        this.registry = registry;
    }

    public String name() {
        return name;
    }

    public boolean isRoot() {
        return ROOT.equals(name);
    }

    public OperationRegistry registry() {
        return registry;
    }

    public Collection<Operation> operations() {
        return registry.operationsIn(name).values();
    }

    public Operation operation(String operationName) throws OperationNotFoundException {
        Operation operation = registry.operationsIn(name).get(operationName);
        if (operation == null) {
            throw new OperationNotFoundException(operationName, isRoot() ? null : name);
        }
        return operation;
    }

    /**
     * Resolves an operation as seen from this group. A null group name, or this group's own
     * name, is a direct lookup; any other name is looked up on the owning registry.
     * The group name must already be canonical.
     */
    public Operation resolve(String operationName, String groupName) throws OperationNotFoundException {
        if (groupName == null || groupName.equals(name)) {
            return operation(operationName);
        }
        return registry.resolve(operationName, groupName);
    }

    @Override
    public String toString() {
        return "OperationGroup{" + (isRoot() ? "<root>" : name) + ", operations=" + registry.operationsIn(name).keySet() + "}";
    }
}
