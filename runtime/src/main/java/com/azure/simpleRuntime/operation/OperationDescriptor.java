package com.azure.simpleRuntime.operation;

import com.azure.simpleRuntime.http.HttpVerb;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Static metadata for one remote operation, produced by whatever parsed the service schema.
 *
 * @param name                 operation name, unique within its group
 * @param groupName            owning group; empty for operations defined on the client itself
 * @param httpVerb             HTTP method
 * @param urlTemplate          path with {@code {name}} placeholders, or {@code {nextLink}}
 * @param extensions           extension flags such as {@code x-ms-pageable}
 * @param responseBodyKind     shape of the response body
 * @param nextOperationRef     operation fetching the following page, null when not paged
 * @param groupedParameterSpec grouped input parameter, null when the operation has none
 */
public record OperationDescriptor(
    String name,
    String groupName,
    HttpVerb httpVerb,
    String urlTemplate,
    Map<String, Object> extensions,
    ResponseBodyKind responseBodyKind,
    NextOperationRef nextOperationRef,
    GroupedParameterSpec groupedParameterSpec
) {
    public OperationDescriptor {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Operation name is required");
        }
        if (httpVerb == null) {
            throw new IllegalArgumentException("HTTP verb is required for operation " + name);
        }
        if (urlTemplate == null) {
            throw new IllegalArgumentException("URL template is required for operation " + name);
        }
        groupName = groupName == null ? "" : groupName;
        extensions = extensions == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(extensions));
        responseBodyKind = responseBodyKind == null ? ResponseBodyKind.SCALAR : responseBodyKind;
    }

    public boolean isLongRunning() {
        Object flag = extensions.get(OperationExtensions.LONG_RUNNING);
        return flag != null && !Boolean.FALSE.equals(flag) && !"false".equalsIgnoreCase(flag.toString());
    }

    public boolean isPageable() {
        return extensions.containsKey(OperationExtensions.PAGEABLE);
    }

    public boolean isNextLinkOperation() {
        return OperationExtensions.NEXT_LINK_URL.equals(urlTemplate);
    }

    public String itemName() {
        Map<?, ?> pageable = extensionMap(OperationExtensions.PAGEABLE);
        Object itemName = pageable.get(OperationExtensions.ITEM_NAME);
        return itemName != null ? itemName.toString() : OperationExtensions.DEFAULT_ITEM_NAME;
    }

    /**
     * Name of the response field carrying the continuation link, or null if the operation
     * declares that it always returns a single page.
     */
    public String nextLinkName() {
        Map<?, ?> pageable = extensionMap(OperationExtensions.PAGEABLE);
        if (!pageable.containsKey(OperationExtensions.NEXT_LINK_NAME)) {
            return OperationExtensions.DEFAULT_NEXT_LINK_NAME;
        }
        Object nextLinkName = pageable.get(OperationExtensions.NEXT_LINK_NAME);
        return nextLinkName != null ? nextLinkName.toString() : null;
    }

    public FinalStateVia finalStateVia() {
        Object via = extensionMap(OperationExtensions.LONG_RUNNING_OPTIONS).get(OperationExtensions.FINAL_STATE_VIA);
        return via != null ? FinalStateVia.fromValue(via.toString()) : null;
    }

    OperationDescriptor inGroup(String canonicalGroupName, NextOperationRef canonicalNextRef) {
        return new OperationDescriptor(name, canonicalGroupName, httpVerb, urlTemplate, extensions,
            responseBodyKind, canonicalNextRef, groupedParameterSpec);
    }

    private Map<?, ?> extensionMap(String key) {
        Object value = extensions.get(key);
        return value instanceof Map ? (Map<?, ?>) value : Map.of();
    }

    public static Builder builder(String name, HttpVerb httpVerb, String urlTemplate) {
        return new Builder(name, httpVerb, urlTemplate);
    }

    public static class Builder {
        private final String name;
        private final HttpVerb httpVerb;
        private final String urlTemplate;
        private String groupName = "";
        private final Map<String, Object> extensions = new LinkedHashMap<>();
        private ResponseBodyKind responseBodyKind = ResponseBodyKind.SCALAR;
        private NextOperationRef nextOperationRef;
        private GroupedParameterSpec groupedParameterSpec;

        private Builder(String name, HttpVerb httpVerb, String urlTemplate) {
            this.name = name;
            this.httpVerb = httpVerb;
            this.urlTemplate = urlTemplate;
        }

        public Builder group(String groupName) {
            this.groupName = groupName;
            return this;
        }

        public Builder extension(String key, Object value) {
            this.extensions.put(key, value);
            return this;
        }

        /**
         * Marks the operation pageable with the default {@code value}/{@code nextLink} field names.
         */
        public Builder pageable() {
            return pageable(OperationExtensions.DEFAULT_ITEM_NAME, OperationExtensions.DEFAULT_NEXT_LINK_NAME);
        }

        public Builder pageable(String itemName, String nextLinkName) {
            Map<String, Object> pageable = new LinkedHashMap<>();
            pageable.put(OperationExtensions.ITEM_NAME, itemName);
            pageable.put(OperationExtensions.NEXT_LINK_NAME, nextLinkName);
            this.extensions.put(OperationExtensions.PAGEABLE, pageable);
            this.responseBodyKind = ResponseBodyKind.SEQUENCE;
            return this;
        }

        public Builder nextOperation(String operationName) {
            this.nextOperationRef = NextOperationRef.of(operationName);
            return this;
        }

        public Builder nextOperation(String operationName, String groupName) {
            this.nextOperationRef = NextOperationRef.of(operationName, groupName);
            return this;
        }

        public Builder longRunning() {
            this.extensions.put(OperationExtensions.LONG_RUNNING, Boolean.TRUE);
            return this;
        }

        public Builder longRunning(FinalStateVia finalStateVia) {
            longRunning();
            this.extensions.put(OperationExtensions.LONG_RUNNING_OPTIONS,
                Map.of(OperationExtensions.FINAL_STATE_VIA, finalStateVia.getValue()));
            return this;
        }

        public Builder responseBodyKind(ResponseBodyKind responseBodyKind) {
            this.responseBodyKind = responseBodyKind;
            return this;
        }

        public Builder groupedParameter(GroupedParameterSpec groupedParameterSpec) {
            this.groupedParameterSpec = groupedParameterSpec;
            return this;
        }

        public OperationDescriptor build() {
            return new OperationDescriptor(name, groupName, httpVerb, urlTemplate, extensions,
                responseBodyKind, nextOperationRef, groupedParameterSpec);
        }
    }
}
