package com.azure.simpleRuntime.polling;

import java.util.Locale;

public enum PollStatus {
    IN_PROGRESS,
    SUCCEEDED,
    FAILED,
    CANCELED;

    public boolean isTerminal() {
        return this != IN_PROGRESS;
    }

    /**
     * Maps a service-reported state. Anything that is not one of the three terminal states
     * ({@code Accepted}, {@code Creating}, {@code Running}...) counts as in progress.
     */
    public static PollStatus fromValue(String value) {
        if (value == null) {
            return null;
        }
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "succeeded":
                return SUCCEEDED;
            case "failed":
                return FAILED;
            case "canceled":
            case "cancelled":
                return CANCELED;
            default:
                return IN_PROGRESS;
        }
    }
}
