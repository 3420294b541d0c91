package com.azure.simpleRuntime.operation;

import com.azure.simpleRuntime.exceptions.InvalidOperationVerbException;
import com.azure.simpleRuntime.exceptions.OperationNotFoundException;
import com.azure.simpleRuntime.polling.PollingFamily;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Flat {@code (group, operation) -> Operation} index over every operation of a client.
 *
 * <p>Group names are canonicalized while building, next-page references are checked, and the
 * polling family of each long running operation is chosen. The registry is immutable once built
 * and safe to share between threads.
 */
public final class OperationRegistry {
    private static final Logger logger = LoggerFactory.getLogger(OperationRegistry.class);

    private final Map<String, OperationGroup> groups;
    private final Map<OperationKey, Operation> operations;
    private final Map<String, Map<String, Operation>> operationsByGroup;

    private OperationRegistry(List<OperationDescriptor> descriptors) {
        Map<String, OperationGroup> groupIndex = new LinkedHashMap<>();
        Map<OperationKey, OperationDescriptor> canonical = new LinkedHashMap<>();

        for (OperationDescriptor descriptor : descriptors) {
            String groupName = GroupNames.canonicalize(descriptor.groupName());
            NextOperationRef ref = descriptor.nextOperationRef();
            NextOperationRef canonicalRef = ref == null ? null
                : new NextOperationRef(ref.operationName(), ref.groupName() == null ? groupName : GroupNames.canonicalize(ref.groupName()));

            OperationKey key = new OperationKey(groupName, descriptor.name());
            if (canonical.putIfAbsent(key, descriptor.inGroup(groupName, canonicalRef)) != null) {
                throw new IllegalStateException("Duplicate operation " + key);
            }
            groupIndex.computeIfAbsent(groupName, name -> new OperationGroup(name, this));
        }

        Set<OperationKey> nextPageTargets = new HashSet<>();
        for (Map.Entry<OperationKey, OperationDescriptor> entry : canonical.entrySet()) {
            NextOperationRef ref = entry.getValue().nextOperationRef();
            if (ref == null) {
                continue;
            }
            OperationKey target = new OperationKey(ref.groupName(), ref.operationName());
            if (!canonical.containsKey(target)) {
                throw new IllegalStateException("Operation " + entry.getKey() + " references unknown next operation " + target);
            }
            if (!target.equals(entry.getKey())) {
                nextPageTargets.add(target);
            }
        }

        Map<OperationKey, Operation> index = new HashMap<>();
        Map<String, Map<String, Operation>> byGroup = new HashMap<>();
        for (Map.Entry<OperationKey, OperationDescriptor> entry : canonical.entrySet()) {
            OperationKey key = entry.getKey();
            OperationDescriptor descriptor = entry.getValue();
            boolean nextPage = nextPageTargets.contains(key) || descriptor.isNextLinkOperation();
            Operation operation = new Operation(descriptor, groupIndex.get(key.group()), pollingFamilyOf(key, descriptor), nextPage);
            index.put(key, operation);
            byGroup.computeIfAbsent(key.group(), g -> new HashMap<>()).put(key.name(), operation);
        }
        Map<String, Map<String, Operation>> frozenByGroup = new HashMap<>();
        byGroup.forEach((group, ops) -> frozenByGroup.put(group, Map.copyOf(ops)));

        // groups only hold their name and this registry; their operations are read through the final map below
        this.groups = Map.copyOf(groupIndex);
        this.operations = Map.copyOf(index);
        this.operationsByGroup = Map.copyOf(frozenByGroup);
        logger.debug("Registered {} operations in {} groups", operations.size(), groups.size());
    }

    private static PollingFamily pollingFamilyOf(OperationKey key, OperationDescriptor descriptor) {
        if (!descriptor.isLongRunning()) {
            return null;
        }
        if (descriptor.isPageable()) {
            logger.debug("Operation {} is both pageable and long running; it will be polled, not paged", key);
        }
        try {
            return PollingFamily.forVerb(key.toString(), descriptor.httpVerb());
        } catch (InvalidOperationVerbException e) {
            logger.warn("Long running operation {} uses {}, which has no polling strategy", key, descriptor.httpVerb());
            return null;
        }
    }

    /**
     * Exact lookup of a canonical group name and an operation name. A null group means the root
     * group.
     */
    public Operation resolve(String operationName, String groupName) throws OperationNotFoundException {
        String group = groupName == null ? OperationGroup.ROOT : groupName;
        Operation operation = operations.get(new OperationKey(group, operationName));
        if (operation == null) {
            throw new OperationNotFoundException(operationName, groupName);
        }
        return operation;
    }

    public OperationGroup group(String groupName) throws OperationNotFoundException {
        OperationGroup group = groups.get(groupName == null ? OperationGroup.ROOT : groupName);
        if (group == null) {
            throw new OperationNotFoundException("*", groupName);
        }
        return group;
    }

    Map<String, Operation> operationsIn(String groupName) {
        return operationsByGroup.getOrDefault(groupName, Map.of());
    }

    public Collection<OperationGroup> groups() {
        return groups.values();
    }

    public int size() {
        return operations.size();
    }

    public static Builder builder() {
        return new Builder();
    }

    private record OperationKey(String group, String name) {
        @Override
        public String toString() {
            return group.isEmpty() ? name : group + "." + name;
        }
    }

    public static class Builder {
        private final List<OperationDescriptor> descriptors = new ArrayList<>();

        public Builder register(OperationDescriptor descriptor) {
            descriptors.add(descriptor);
            return this;
        }

        /**
         * Registers descriptors under the given group, overriding the group they declare.
         */
        public Builder group(String groupName, OperationDescriptor... groupDescriptors) {
            for (OperationDescriptor descriptor : groupDescriptors) {
                descriptors.add(descriptor.inGroup(groupName, descriptor.nextOperationRef()));
            }
            return this;
        }

        public OperationRegistry build() {
            return new OperationRegistry(descriptors);
        }
    }
}
