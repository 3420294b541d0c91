package com.azure.simpleRuntime.polling;

import com.azure.simpleRuntime.exceptions.InvalidOperationVerbException;
import com.azure.simpleRuntime.http.HttpVerb;

/**
 * How a long running operation is followed to completion, fixed by the initiating verb.
 */
public enum PollingFamily {
    /** PUT/PATCH: status checks read the resource itself; the final result is the resource body. */
    RESOURCE_POLLING,
    /** POST/DELETE: status checks read an operation-status URL returned by the initiating call. */
    OPERATION_POLLING;

    public static PollingFamily forVerb(String operationName, HttpVerb verb) throws InvalidOperationVerbException {
        switch (verb) {
            case PUT:
            case PATCH:
                return RESOURCE_POLLING;
            case POST:
            case DELETE:
                return OPERATION_POLLING;
            default:
                throw new InvalidOperationVerbException(operationName, verb);
        }
    }
}
