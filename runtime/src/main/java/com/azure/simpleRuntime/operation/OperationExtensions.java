package com.azure.simpleRuntime.operation;

/**
 * Extension keys understood by the runtime.
 */
public final class OperationExtensions {
    public static final String PAGEABLE = "x-ms-pageable";
    public static final String LONG_RUNNING = "x-ms-long-running-operation";
    public static final String LONG_RUNNING_OPTIONS = "x-ms-long-running-operation-options";

    public static final String ITEM_NAME = "itemName";
    public static final String NEXT_LINK_NAME = "nextLinkName";
    public static final String FINAL_STATE_VIA = "final-state-via";

    public static final String DEFAULT_ITEM_NAME = "value";
    public static final String DEFAULT_NEXT_LINK_NAME = "nextLink";

    /** URL template of operations that fetch a continuation link as-is. */
    public static final String NEXT_LINK_URL = "{nextLink}";

    private OperationExtensions() {
    }
}
