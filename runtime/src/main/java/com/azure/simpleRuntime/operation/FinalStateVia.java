package com.azure.simpleRuntime.operation;

import java.util.Locale;

/**
 * Where a long running operation's final result is read from once it succeeds.
 */
public enum FinalStateVia {
    AZURE_ASYNC_OPERATION("azure-async-operation"),
    LOCATION("location"),
    ORIGINAL_URI("original-uri");

    private final String value;

    FinalStateVia(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static FinalStateVia fromValue(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (FinalStateVia via : values()) {
            if (via.value.equals(normalized)) {
                return via;
            }
        }
        throw new IllegalArgumentException("Unknown final-state-via: " + value);
    }
}
