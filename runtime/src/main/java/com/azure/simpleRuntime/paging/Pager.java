package com.azure.simpleRuntime.paging;

import com.azure.simpleRuntime.CancellationToken;
import com.azure.simpleRuntime.exceptions.OperationCancelledException;
import com.azure.simpleRuntime.exceptions.ServiceClientException;
import com.azure.simpleRuntime.http.TransportResponse;
import com.azure.simpleRuntime.operation.Operation;
import com.azure.simpleRuntime.operation.OperationArguments;
import com.azure.simpleRuntime.operation.OperationCaller;
import com.azure.simpleRuntime.operation.OperationDescriptor;
import com.azure.simpleRuntime.parameters.ParameterGroupingTransformer;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Follows continuation links of a pageable operation.
 *
 * <p>The first request goes to the initiating operation. Each following request goes to the
 * operation named by the initiating descriptor's next-page reference, which may live in another
 * group, with the continuation link as its URL and a grouped parameter derived from the
 * caller's. Pages are fetched one after another, never ahead.
 */
public class Pager {
    private static final Logger logger = LoggerFactory.getLogger(Pager.class);

    private final OperationCaller caller;
    private final ParameterGroupingTransformer groupingTransformer;
    private final ObjectMapper objectMapper;
    private final int maxPages;

    /**
     * @param maxPages upper bound on pages fetched per traversal, 0 for none
     */
    public Pager(OperationCaller caller, ParameterGroupingTransformer groupingTransformer, ObjectMapper objectMapper, int maxPages) {
        if (maxPages < 0) {
            throw new IllegalArgumentException("maxPages must not be negative");
        }
        this.caller = caller;
        this.groupingTransformer = groupingTransformer;
        this.objectMapper = objectMapper.copy()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.maxPages = maxPages;
    }

    /**
     * Fetches every page and returns all items in fetch order. On cancellation, failure, or when
     * the page limit is hit, nothing fetched so far is returned.
     */
    public <T> List<T> page(Operation operation, OperationArguments arguments, Class<T> itemType,
                            CancellationToken cancellationToken) throws ServiceClientException {
        return page(operation, arguments, itemType, items -> ListOperationCallback.PagingBehavior.CONTINUE, cancellationToken);
    }

    /**
     * Like {@link #page(Operation, OperationArguments, Class, CancellationToken)}, consulting the
     * callback after every page. A {@code STOP} answer returns the items accumulated so far.
     */
    public <T> List<T> page(Operation operation, OperationArguments arguments, Class<T> itemType,
                            ListOperationCallback<T> callback, CancellationToken cancellationToken) throws ServiceClientException {
        PageCursor<T> cursor = new PageCursor<>(operation, arguments, itemType, cancellationToken);
        List<T> result = new ArrayList<>();

        while (cursor.hasMore()) {
            if (maxPages > 0 && cursor.pagesFetched() >= maxPages) {
                throw new OperationCancelledException("Paging of " + operation.qualifiedName()
                    + " stopped at the limit of " + maxPages + " pages")
                    .withPagesProcessed(cursor.pagesFetched());
            }
            Page<T> page = cursor.fetch();
            result.addAll(page.items());
            ListOperationCallback.PagingBehavior behavior = callback.progress(page.items());
            if (page.hasNext() && behavior == ListOperationCallback.PagingBehavior.STOP) {
                logger.debug("Paging of {} stopped by callback after {} pages", operation.qualifiedName(), cursor.pagesFetched());
                break;
            }
        }

        logger.debug("Paging of {} returned {} items from {} pages", operation.qualifiedName(), result.size(), cursor.pagesFetched());
        return result;
    }

    /**
     * Lazy page sequence; each iteration starts a fresh traversal. Failures surface as
     * {@link com.azure.simpleRuntime.exceptions.UncheckedServiceClientException}. The sequence is
     * unbounded when the service never stops returning continuation links and no page limit is
     * configured.
     */
    public <T> PagedIterable<T> pages(Operation operation, OperationArguments arguments, Class<T> itemType,
                                      CancellationToken cancellationToken) {
        return new PagedIterable<>(() -> new PageCursor<>(operation, arguments, itemType, cancellationToken), maxPages);
    }

    /**
     * Iteration state of one traversal: {@code Fetching -> HasNext | Done}.
     */
    final class PageCursor<T> {
        private final Operation initialOperation;
        private final OperationArguments initialArguments;
        private final JavaType itemType;
        private final CancellationToken cancellationToken;

        private Operation nextOperation;
        private String continuationToken;
        private boolean started;
        private int pagesFetched;

        PageCursor(Operation operation, OperationArguments arguments, Class<T> itemType, CancellationToken cancellationToken) {
            this.initialOperation = operation;
            this.initialArguments = arguments;
            this.itemType = objectMapper.constructType(itemType);
            this.cancellationToken = cancellationToken;
        }

        boolean hasMore() {
            return !started || continuationToken != null;
        }

        int pagesFetched() {
            return pagesFetched;
        }

        Page<T> fetch() throws ServiceClientException {
            if (cancellationToken.isCancelled()) {
                throw new OperationCancelledException("Paging of " + initialOperation.qualifiedName() + " was cancelled")
                    .withPagesProcessed(pagesFetched);
            }

            try {
                Operation operation;
                OperationArguments arguments;
                if (!started) {
                    operation = initialOperation;
                    arguments = initialArguments;
                } else {
                    if (nextOperation == null) {
                        nextOperation = initialOperation.nextOperation();
                    }
                    operation = nextOperation;
                    arguments = initialArguments.forNextPage(continuationToken, nextGroupedParameter(operation));
                }

                TransportResponse response = caller.send(operation, arguments, cancellationToken);
                Page<T> page = toPage(response, operation);
                started = true;
                pagesFetched++;
                continuationToken = page.continuationToken();
                logger.debug("Fetched page {} of {} with {} items, more: {}",
                    pagesFetched, initialOperation.qualifiedName(), page.items().size(), page.hasNext());
                return page;
            } catch (ServiceClientException e) {
                throw e.withPagesProcessed(pagesFetched);
            }
        }

        private Object nextGroupedParameter(Operation operation) {
            Object source = initialArguments.getGroupedParameter();
            if (operation == initialOperation) {
                return source;
            }
            return groupingTransformer.transform(source, operation.descriptor().groupedParameterSpec());
        }

        private Page<T> toPage(TransportResponse response, Operation operation) throws ServiceClientException {
            OperationDescriptor descriptor = operation.descriptor().isPageable()
                ? operation.descriptor()
                : initialOperation.descriptor();
            JsonNode body = response.getBody();
            if (body == null || body.isNull()) {
                return new Page<>(List.of(), null);
            }
            if (!body.isObject() && !body.isArray()) {
                throw new ServiceClientException("Page " + (pagesFetched + 1) + " of " + initialOperation.qualifiedName()
                    + " is not a JSON object or array (HTTP " + response.getStatusCode() + ", " + body.getNodeType() + ")");
            }

            List<T> items = new ArrayList<>();
            JsonNode itemsNode = body.isArray() ? body : body.path(descriptor.itemName());
            if (itemsNode.isArray()) {
                for (JsonNode item : itemsNode) {
                    try {
                        items.add(objectMapper.convertValue(item, itemType));
                    } catch (IllegalArgumentException e) {
                        throw new ServiceClientException("Cannot read item " + items.size() + " of page " + (pagesFetched + 1)
                            + " of " + initialOperation.qualifiedName() + " as " + itemType.getRawClass().getSimpleName(), e);
                    }
                }
            }

            String nextLinkName = descriptor.nextLinkName();
            String token = null;
            if (nextLinkName != null) {
                JsonNode nextLinkNode = body.path(nextLinkName);
                token = nextLinkNode.isTextual() ? nextLinkNode.asText() : null;
            }
            return new Page<>(items, token);
        }
    }
}
