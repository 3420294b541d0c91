package com.azure.simpleRuntime.parameters;

import com.azure.simpleRuntime.operation.GroupedParameterSpec;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.BeanDescription;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.introspect.BeanPropertyDefinition;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Derives the grouped parameter of a next-page or polling call from the grouped parameter the
 * caller passed to the originating operation.
 *
 * <p>Only the fields the target group declares are copied, matched by property name. A missing
 * source group yields a missing target group rather than an empty one.
 */
public class ParameterGroupingTransformer {
    private final ObjectMapper objectMapper;

    public ParameterGroupingTransformer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public Object transform(Object sourceGroupValue, GroupedParameterSpec targetGroupSpec) {
        if (sourceGroupValue == null || targetGroupSpec == null) {
            return null;
        }
        return transform(sourceGroupValue, targetGroupSpec, targetGroupSpec.type());
    }

    public <T> T transform(Object sourceGroupValue, GroupedParameterSpec targetGroupSpec, Class<T> targetType) {
        if (sourceGroupValue == null) {
            return null;
        }

        JsonNode source = objectMapper.valueToTree(sourceGroupValue);
        if (!source.isObject()) {
            throw new IllegalArgumentException("Grouped parameter must be an object, got " + sourceGroupValue.getClass().getName());
        }

        ObjectNode target = objectMapper.createObjectNode();
        for (String field : targetFields(targetGroupSpec, targetType)) {
            JsonNode value = source.get(field);
            if (value != null && !value.isNull()) {
                target.set(field, value);
            }
        }

        try {
            return objectMapper.treeToValue(target, targetType);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot build grouped parameter " + targetType.getName(), e);
        }
    }

    private List<String> targetFields(GroupedParameterSpec spec, Class<?> targetType) {
        if (spec != null && !spec.fieldNames().isEmpty()) {
            return spec.fieldNames();
        }
        JavaType type = objectMapper.constructType(targetType);
        BeanDescription description = objectMapper.getDeserializationConfig().introspect(type);
        List<String> names = new ArrayList<>();
        for (BeanPropertyDefinition property : description.findProperties()) {
            names.add(property.getName());
        }
        return names;
    }
}
