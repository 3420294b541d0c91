package com.azure.simpleRuntime.operation;

/**
 * Points at the operation that fetches the following page. A null group means the referencing
 * operation's own group.
 */
public record NextOperationRef(
    String operationName,
    String groupName
) {
    public NextOperationRef {
        if (operationName == null || operationName.isBlank()) {
            throw new IllegalArgumentException("operationName is required");
        }
    }

    public static NextOperationRef of(String operationName) {
        return new NextOperationRef(operationName, null);
    }

    public static NextOperationRef of(String operationName, String groupName) {
        return new NextOperationRef(operationName, groupName);
    }
}
