package com.azure.simpleRuntime.client;

import com.azure.simpleRuntime.CancellationToken;
import com.azure.simpleRuntime.exceptions.ServiceClientException;
import com.azure.simpleRuntime.exceptions.UncheckedServiceClientException;
import com.azure.simpleRuntime.http.Transport;
import com.azure.simpleRuntime.operation.GroupNames;
import com.azure.simpleRuntime.operation.Operation;
import com.azure.simpleRuntime.operation.OperationArguments;
import com.azure.simpleRuntime.operation.OperationGroup;
import com.azure.simpleRuntime.operation.OperationRegistry;
import com.azure.simpleRuntime.operation.OperationResult;
import com.azure.simpleRuntime.paging.ListOperationCallback;
import com.azure.simpleRuntime.paging.PagedIterable;
import com.azure.simpleRuntime.polling.PollState;
import com.azure.simpleRuntime.polling.PollingPolicy;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entry point for invoking registered operations by name.
 *
 * <p>Group names given to this client may be written the way a service definition spells them
 * ({@code WidgetsOperations}); they are canonicalized before lookup. Blocking methods run on the
 * calling thread; the {@code Async} variants and {@link #beginLongRunning} run on the configured
 * executor.
 */
public class ServiceClient implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(ServiceClient.class);

    private final OperationRegistry registry;
    private final Invoker invoker;
    private final Executor executor;
    private final ExecutorService ownedExecutor;

    private ServiceClient(Builder builder) {
        this.registry = builder.registry;
        this.invoker = new Invoker(builder.transport, builder.objectMapper, builder.pollingPolicy, builder.maxPages);
        if (builder.executor != null) {
            this.executor = builder.executor;
            this.ownedExecutor = null;
        } else {
            this.ownedExecutor = Executors.newCachedThreadPool(daemonThreads());
            this.executor = ownedExecutor;
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public OperationRegistry getRegistry() {
        return registry;
    }

    public OperationGroup group(String groupName) throws ServiceClientException {
        return registry.group(canonical(groupName));
    }

    public OperationResult invoke(String operationName, String groupName, OperationArguments arguments) throws ServiceClientException {
        return invoke(operationName, groupName, arguments, CancellationToken.NONE);
    }

    public OperationResult invoke(String operationName, String groupName, OperationArguments arguments,
                                  CancellationToken cancellationToken) throws ServiceClientException {
        return invoker.invoke(resolve(operationName, groupName), arguments, cancellationToken);
    }

    /**
     * Runs {@link #invoke} on the executor. Cancelling the returned future cancels the call, the
     * page traversal or the poll loop behind it.
     */
    public CompletableFuture<OperationResult> invokeAsync(String operationName, String groupName, OperationArguments arguments) {
        CancellationToken cancellationToken = new CancellationToken();
        return submit(() -> invoke(operationName, groupName, arguments, cancellationToken), cancellationToken);
    }

    public <T> List<T> list(String operationName, String groupName, OperationArguments arguments, Class<T> itemType)
            throws ServiceClientException {
        return invoker.pager().page(resolve(operationName, groupName), arguments, itemType, CancellationToken.NONE);
    }

    public <T> PagedIterable<T> listPages(String operationName, String groupName, OperationArguments arguments, Class<T> itemType)
            throws ServiceClientException {
        return listPages(operationName, groupName, arguments, itemType, CancellationToken.NONE);
    }

    /**
     * Lazy page sequence that stops when {@code cancellationToken} is cancelled. Pages already
     * received stay with the caller; the next fetch fails with an
     * {@link com.azure.simpleRuntime.exceptions.OperationCancelledException} wrapped unchecked.
     */
    public <T> PagedIterable<T> listPages(String operationName, String groupName, OperationArguments arguments, Class<T> itemType,
                                          CancellationToken cancellationToken) throws ServiceClientException {
        return invoker.pager().pages(resolve(operationName, groupName), arguments, itemType, cancellationToken);
    }

    /**
     * Pages through the operation on the executor, reporting every page to {@code callback}.
     */
    public <T> CompletableFuture<List<T>> listAsync(String operationName, String groupName, OperationArguments arguments,
                                                    Class<T> itemType, ListOperationCallback<T> callback) {
        CancellationToken cancellationToken = new CancellationToken();
        return submit(() -> invoker.pager().page(resolve(operationName, groupName), arguments, itemType, callback, cancellationToken),
            cancellationToken);
    }

    /**
     * Starts a long running operation and polls it in the background.
     *
     * @throws ServiceClientException when the operation is unknown or is not long running
     */
    public PollerHandle beginLongRunning(String operationName, String groupName, OperationArguments arguments)
            throws ServiceClientException {
        Operation operation = resolve(operationName, groupName);
        if (!operation.descriptor().isLongRunning()) {
            throw new ServiceClientException("Operation " + operation.qualifiedName() + " is not long running");
        }
        operation.pollingFamily();

        PollState state = new PollState();
        CancellationToken cancellationToken = new CancellationToken();
        CompletableFuture<OperationResult> result =
            submit(() -> invoker.invokeLongRunning(operation, arguments, cancellationToken, state), cancellationToken);
        return new PollerHandle(operation, state, cancellationToken, result);
    }

    @Override
    public void close() {
        if (ownedExecutor != null) {
            ownedExecutor.shutdownNow();
        }
    }

    private Operation resolve(String operationName, String groupName) throws ServiceClientException {
        return registry.resolve(operationName, canonical(groupName));
    }

    private static String canonical(String groupName) {
        return groupName == null ? null : GroupNames.canonicalize(groupName);
    }

    private <R> CompletableFuture<R> submit(Call<R> call, CancellationToken cancellationToken) {
        CompletableFuture<R> future = CompletableFuture.supplyAsync(() -> {
            try {
                return call.run();
            } catch (ServiceClientException e) {
                throw new UncheckedServiceClientException(e);
            }
        }, executor);
        future.whenComplete((value, error) -> {
            if (future.isCancelled()) {
                logger.debug("Async call cancelled by caller");
                cancellationToken.cancel();
            }
        });
        return future;
    }

    /**
     * Turns a failure observed through a future back into the checked exception that caused it.
     */
    static ServiceClientException unwrap(Throwable error) {
        Throwable cause = error;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException) && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof UncheckedServiceClientException) {
            return ((UncheckedServiceClientException) cause).getCause();
        }
        if (cause instanceof ServiceClientException) {
            return (ServiceClientException) cause;
        }
        return new ServiceClientException("Operation failed unexpectedly", cause);
    }

    private static ThreadFactory daemonThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "simple-runtime-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    @FunctionalInterface
    private interface Call<R> {
        R run() throws ServiceClientException;
    }

    public static class Builder {
        private Transport transport;
        private OperationRegistry registry;
        private PollingPolicy pollingPolicy = PollingPolicy.DEFAULT;
        private ObjectMapper objectMapper = new ObjectMapper();
        private Executor executor;
        private int maxPages;

        public Builder transport(Transport transport) {
            this.transport = transport;
            return this;
        }

        public Builder registry(OperationRegistry registry) {
            this.registry = registry;
            return this;
        }

        public Builder pollingPolicy(PollingPolicy pollingPolicy) {
            this.pollingPolicy = pollingPolicy;
            return this;
        }

        public Builder objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }

        /**
         * Executor for asynchronous calls. When none is set the client owns a daemon pool that
         * {@link #close()} shuts down.
         */
        public Builder executor(Executor executor) {
            this.executor = executor;
            return this;
        }

        public Builder maxPages(int maxPages) {
            if (maxPages < 0) {
                throw new IllegalArgumentException("maxPages must not be negative");
            }
            this.maxPages = maxPages;
            return this;
        }

        public ServiceClient build() {
            if (transport == null) {
                throw new IllegalStateException("transport is required");
            }
            if (registry == null) {
                throw new IllegalStateException("registry is required");
            }
            return new ServiceClient(this);
        }
    }
}
