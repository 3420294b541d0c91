package com.azure.simpleRuntime.operation;

import java.util.Locale;

/**
 * Canonical form of operation group names: {@code WidgetsOperations}, {@code Widgets} and
 * {@code widgets} all become {@code widgets}.
 */
public final class GroupNames {
    private static final String SUFFIX = "Operations";

    private GroupNames() {
    }

    public static String canonicalize(String groupName) {
        if (groupName == null || groupName.isBlank()) {
            return OperationGroup.ROOT;
        }
        String name = groupName.trim();
        if (name.length() > SUFFIX.length() && name.endsWith(SUFFIX)) {
            name = name.substring(0, name.length() - SUFFIX.length());
        }
        return name.substring(0, 1).toLowerCase(Locale.ROOT) + name.substring(1);
    }
}
