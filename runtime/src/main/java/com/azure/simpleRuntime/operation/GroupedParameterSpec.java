package com.azure.simpleRuntime.operation;

import java.util.List;

/**
 * Describes the logical parameter an operation accepts as a bundle of fields.
 *
 * @param parameterName name of the grouped parameter, e.g. {@code widgetsListOptions}
 * @param type          class instantiated for the group
 * @param fieldNames    fields the operation reads from the group; empty means every property of {@code type}
 */
public record GroupedParameterSpec(
    String parameterName,
    Class<?> type,
    List<String> fieldNames
) {
    public GroupedParameterSpec {
        if (type == null) {
            throw new IllegalArgumentException("type is required");
        }
        fieldNames = fieldNames == null ? List.of() : List.copyOf(fieldNames);
    }

    public static GroupedParameterSpec of(String parameterName, Class<?> type, String... fieldNames) {
        return new GroupedParameterSpec(parameterName, type, List.of(fieldNames));
    }
}
