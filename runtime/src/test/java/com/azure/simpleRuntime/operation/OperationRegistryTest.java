package com.azure.simpleRuntime.operation;

import com.azure.simpleRuntime.exceptions.InvalidOperationVerbException;
import com.azure.simpleRuntime.exceptions.OperationNotFoundException;
import com.azure.simpleRuntime.http.HttpVerb;
import com.azure.simpleRuntime.polling.PollingFamily;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

class OperationRegistryTest {

    private static OperationRegistry widgetsAndGadgets() {
        return OperationRegistry.builder()
            .register(OperationDescriptor.builder("list", HttpVerb.GET, "/gadgets")
                .group("GadgetsOperations")
                .pageable()
                .nextOperation("listNext", "WidgetsOperations")
                .build())
            .register(OperationDescriptor.builder("listNext", HttpVerb.GET, OperationExtensions.NEXT_LINK_URL)
                .group("Widgets")
                .pageable()
                .build())
            .register(OperationDescriptor.builder("get", HttpVerb.GET, "/widgets/{name}")
                .group("widgets")
                .build())
            .build();
    }

    @Test
    @DisplayName("Cross-group resolve finds the operation in the named group")
    void resolvesAcrossGroupsFromAnotherGroupsContext() throws Exception {
        OperationRegistry registry = widgetsAndGadgets();
        OperationGroup gadgets = registry.group("gadgets");

        Operation next = gadgets.resolve("listNext", "widgets");

        assertEquals("listNext", next.name());
        assertEquals("widgets", next.group().name());
        assertSame(registry, gadgets.registry());
    }

    @Test
    void resolvesWithinOwnGroupWhenNoGroupGiven() throws Exception {
        OperationGroup widgets = widgetsAndGadgets().group("widgets");

        assertEquals("get", widgets.resolve("get", null).name());
        assertEquals("get", widgets.resolve("get", "widgets").name());
    }

    @Test
    @DisplayName("Unknown operation names fail with OperationNotFoundException")
    void missingOperationFails() {
        OperationRegistry registry = widgetsAndGadgets();

        OperationNotFoundException error = assertThrows(OperationNotFoundException.class,
            () -> registry.resolve("missing", "widgets"));
        assertEquals("missing", error.getOperationName());
        assertThrows(OperationNotFoundException.class, () -> registry.group("widgets").resolve("list", "nowhere"));
    }

    @Test
    void canonicalizesGroupNamesAndReferences() throws Exception {
        OperationRegistry registry = widgetsAndGadgets();

        assertThat(registry.groups()).extracting(OperationGroup::name).containsExactlyInAnyOrder("gadgets", "widgets");
        assertThat(registry.size()).isEqualTo(3);

        Operation list = registry.resolve("list", "gadgets");
        assertEquals(NextOperationRef.of("listNext", "widgets"), list.descriptor().nextOperationRef());
        assertSame(registry.resolve("listNext", "widgets"), list.nextOperation());
    }

    @Test
    @DisplayName("Next-page targets and {nextLink} operations are marked as next-page operations")
    void marksNextPageOperationsStructurally() throws Exception {
        OperationRegistry registry = OperationRegistry.builder()
            .register(OperationDescriptor.builder("list", HttpVerb.GET, "/items").pageable().nextOperation("more").build())
            .register(OperationDescriptor.builder("more", HttpVerb.POST, "/items/more").pageable().build())
            .register(OperationDescriptor.builder("self", HttpVerb.GET, "/self").pageable().nextOperation("self").build())
            .register(OperationDescriptor.builder("follow", HttpVerb.GET, "{nextLink}").build())
            .build();

        assertThat(registry.resolve("list", null).isNextPageOperation()).isFalse();
        assertThat(registry.resolve("more", null).isNextPageOperation()).isTrue();
        assertThat(registry.resolve("self", null).isNextPageOperation()).isFalse();
        assertThat(registry.resolve("follow", null).isNextPageOperation()).isTrue();
    }

    @Test
    void nextOperationWithoutReferenceIsItself() throws Exception {
        OperationRegistry registry = OperationRegistry.builder()
            .register(OperationDescriptor.builder("list", HttpVerb.GET, "/items").pageable().build())
            .build();

        Operation list = registry.resolve("list", null);
        assertSame(list, list.nextOperation());
    }

    @Test
    void rejectsDuplicatesAndDanglingReferences() {
        assertThatThrownBy(() -> OperationRegistry.builder()
            .register(OperationDescriptor.builder("get", HttpVerb.GET, "/a").group("Widgets").build())
            .register(OperationDescriptor.builder("get", HttpVerb.GET, "/b").group("WidgetsOperations").build())
            .build())
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("Duplicate");

        assertThatThrownBy(() -> OperationRegistry.builder()
            .register(OperationDescriptor.builder("list", HttpVerb.GET, "/a").pageable().nextOperation("listNext", "other").build())
            .build())
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("listNext");
    }

    @Test
    @DisplayName("Polling family is fixed per descriptor from its verb")
    void choosesPollingFamilyFromVerb() throws Exception {
        OperationRegistry registry = OperationRegistry.builder()
            .register(OperationDescriptor.builder("create", HttpVerb.PUT, "/r").longRunning().build())
            .register(OperationDescriptor.builder("update", HttpVerb.PATCH, "/r").longRunning().build())
            .register(OperationDescriptor.builder("start", HttpVerb.POST, "/r/start").longRunning().build())
            .register(OperationDescriptor.builder("delete", HttpVerb.DELETE, "/r").longRunning().build())
            .register(OperationDescriptor.builder("watch", HttpVerb.GET, "/r").longRunning().build())
            .build();

        assertEquals(PollingFamily.RESOURCE_POLLING, registry.resolve("create", null).pollingFamily());
        assertEquals(PollingFamily.RESOURCE_POLLING, registry.resolve("update", null).pollingFamily());
        assertEquals(PollingFamily.OPERATION_POLLING, registry.resolve("start", null).pollingFamily());
        assertEquals(PollingFamily.OPERATION_POLLING, registry.resolve("delete", null).pollingFamily());

        InvalidOperationVerbException error = assertThrows(InvalidOperationVerbException.class,
            () -> registry.resolve("watch", null).pollingFamily());
        assertEquals(HttpVerb.GET, error.getVerb());
    }

    @Test
    void groupBuilderOverridesDeclaredGroup() throws Exception {
        OperationRegistry registry = OperationRegistry.builder()
            .group("StorageAccountsOperations", OperationDescriptor.builder("get", HttpVerb.GET, "/accounts/{name}").build())
            .build();

        assertEquals("storageAccounts", registry.resolve("get", "storageAccounts").group().name());
    }

    @Test
    void groupsSeeTheirOperationsFromOtherThreads() throws Exception {
        OperationRegistry registry = widgetsAndGadgets();
        ExecutorService readers = Executors.newFixedThreadPool(4);
        try {
            List<Future<List<String>>> views = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                views.add(readers.submit(() -> registry.group("widgets").operations().stream()
                    .map(Operation::name)
                    .sorted()
                    .collect(Collectors.toList())));
            }

            for (Future<List<String>> view : views) {
                assertThat(view.get(5, TimeUnit.SECONDS)).containsExactly("get", "listNext");
            }
            assertThat(registry.group("gadgets").operation("list").group()).isSameAs(registry.group("gadgets"));
        } finally {
            readers.shutdownNow();
        }
    }
}
