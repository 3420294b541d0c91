package com.azure.simpleRuntime.exceptions;

public class OperationNotFoundException extends ServiceClientException {
    private final String operationName;
    private final String groupName;

    public OperationNotFoundException(String operationName, String groupName) {
        super(groupName == null
            ? "Operation not found: " + operationName
            : "Operation not found: " + groupName + "." + operationName);
        this.operationName = operationName;
        this.groupName = groupName;
    }

    public String getOperationName() {
        return operationName;
    }

    public String getGroupName() {
        return groupName;
    }
}
