package com.azure.simpleRuntime.polling;

import com.azure.simpleRuntime.CancellationToken;
import com.azure.simpleRuntime.exceptions.InterruptedPollException;
import com.azure.simpleRuntime.exceptions.OperationCancelledException;
import com.azure.simpleRuntime.exceptions.OperationFailedException;
import com.azure.simpleRuntime.exceptions.ServiceClientException;
import com.azure.simpleRuntime.http.HttpVerb;
import com.azure.simpleRuntime.http.Transport;
import com.azure.simpleRuntime.http.TransportRequest;
import com.azure.simpleRuntime.http.TransportResponse;
import com.azure.simpleRuntime.http.retry.RetryAfter;
import com.azure.simpleRuntime.operation.FinalStateVia;
import com.azure.simpleRuntime.operation.Operation;
import com.azure.simpleRuntime.operation.OperationResult;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;

/**
 * Drives a long running operation from its initiating response to a terminal state.
 *
 * <p>PUT and PATCH operations are polled on the resource itself and finish with the resource
 * body. POST and DELETE operations are polled on the operation-status URL the service handed
 * out ({@code Azure-AsyncOperation}, else {@code Location}); DELETE finishes without a body.
 * The loop has no attempt limit: it ends on a terminal status or on cancellation.
 */
public class Poller {
    private static final Logger logger = LoggerFactory.getLogger(Poller.class);

    public static final String AZURE_ASYNC_OPERATION = "Azure-AsyncOperation";
    public static final String LOCATION = "Location";

    private final Transport transport;
    private final PollingPolicy pollingPolicy;

    public Poller(Transport transport, PollingPolicy pollingPolicy) {
        this.transport = transport;
        this.pollingPolicy = pollingPolicy;
    }

    public OperationResult pollToCompletion(Operation operation, String resourceUrl, TransportResponse initiatingResponse,
                                            CancellationToken cancellationToken) throws ServiceClientException {
        return pollToCompletion(operation, resourceUrl, initiatingResponse, cancellationToken, new PollState());
    }

    /**
     * @param resourceUrl        URL the initiating request was sent to
     * @param initiatingResponse response of the initiating request
     * @param state              receives status and poll count as the loop advances
     */
    public OperationResult pollToCompletion(Operation operation, String resourceUrl, TransportResponse initiatingResponse,
                                            CancellationToken cancellationToken, PollState state) throws ServiceClientException {
        if (!operation.descriptor().isLongRunning()) {
            throw new ServiceClientException("Operation " + operation.qualifiedName() + " is not long running");
        }
        PollingFamily family = operation.pollingFamily();
        Tracker tracker = new Tracker(operation, family, resourceUrl, initiatingResponse);

        PollStatus status = tracker.initialStatus(initiatingResponse);
        state.update(status, initiatingResponse);
        TransportResponse last = initiatingResponse;
        logger.debug("Polling {} ({}) starting from {}", operation.qualifiedName(), family, status);

        while (status == PollStatus.IN_PROGRESS) {
            waitBeforePoll(operation, last, cancellationToken, state);
            TransportResponse response = get(tracker.pollUrl(), operation, cancellationToken, state);
            tracker.follow(response);
            status = tracker.statusOf(response);
            state.recordPoll(status, response);
            last = response;
            logger.debug("Poll {} of {}: HTTP {}, status {}", state.getPollCount(), operation.qualifiedName(),
                response.getStatusCode(), status);
        }

        if (status != PollStatus.SUCCEEDED) {
            logger.info("Long running operation {} ended {} after {} polls", operation.qualifiedName(), status, state.getPollCount());
            throw new OperationFailedException("Long running operation " + operation.qualifiedName() + " ended with status " + status,
                status, last.getStatusCode(), last.getBody())
                .withPollsCompleted(state.getPollCount());
        }

        OperationResult result = finalResult(tracker, last, operation, cancellationToken, state);
        logger.info("Long running operation {} succeeded after {} polls in {}", operation.qualifiedName(),
            state.getPollCount(), state.getElapsed());
        return result;
    }

    private OperationResult finalResult(Tracker tracker, TransportResponse last, Operation operation,
                                        CancellationToken cancellationToken, PollState state) throws ServiceClientException {
        if (operation.descriptor().httpVerb() == HttpVerb.DELETE) {
            return OperationResult.withoutBody(last);
        }
        FinalStateVia via = operation.descriptor().finalStateVia();

        if (tracker.family == PollingFamily.RESOURCE_POLLING) {
            if (!tracker.pollsAsyncOperation()) {
                return OperationResult.of(last);
            }
            if (via == FinalStateVia.AZURE_ASYNC_OPERATION) {
                return OperationResult.of(last);
            }
            String url = via == FinalStateVia.LOCATION && tracker.locationUrl != null ? tracker.locationUrl : tracker.resourceUrl;
            return OperationResult.of(get(url, operation, cancellationToken, state));
        }

        if (!tracker.pollsAsyncOperation()) {
            return OperationResult.of(last);
        }
        if (via == FinalStateVia.ORIGINAL_URI) {
            return OperationResult.of(get(tracker.resourceUrl, operation, cancellationToken, state));
        }
        if (via != FinalStateVia.AZURE_ASYNC_OPERATION && tracker.locationUrl != null) {
            return OperationResult.of(get(tracker.locationUrl, operation, cancellationToken, state));
        }
        JsonNode embedded = last.getBody() == null ? null : last.getBody().get("properties");
        return new OperationResult(last.getStatusCode(), last.getHeaders(), embedded);
    }

    private void waitBeforePoll(Operation operation, TransportResponse last, CancellationToken cancellationToken,
                                PollState state) throws InterruptedPollException {
        Duration delay = pollingPolicy.getDefaultInterval();
        if (pollingPolicy.shouldHonorRetryAfter()) {
            Optional<Duration> suggested = RetryAfter.parse(last.getHeader(RetryAfter.HEADER));
            if (suggested.isPresent()) {
                delay = suggested.get();
            }
        }

        try {
            if (cancellationToken.isCancelled() || cancellationToken.await(delay)) {
                throw interrupted(operation, state, null);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw interrupted(operation, state, e);
        }
    }

    private TransportResponse get(String url, Operation operation, CancellationToken cancellationToken,
                                  PollState state) throws ServiceClientException {
        try {
            return transport.call(new TransportRequest(HttpVerb.GET, url), cancellationToken);
        } catch (InterruptedPollException e) {
            throw e.withPollsCompleted(state.getPollCount());
        } catch (OperationCancelledException e) {
            throw interrupted(operation, state, e);
        } catch (ServiceClientException e) {
            throw e.withPollsCompleted(state.getPollCount());
        }
    }

    private static InterruptedPollException interrupted(Operation operation, PollState state, Throwable cause) {
        InterruptedPollException exception = new InterruptedPollException(
            "Polling of " + operation.qualifiedName() + " was cancelled after " + state.getPollCount() + " polls", cause);
        exception.withPollsCompleted(state.getPollCount());
        return exception;
    }

    /**
     * Polling URLs of one operation and how their responses translate to a status.
     */
    private static final class Tracker {
        private final Operation operation;
        private final PollingFamily family;
        private final String resourceUrl;
        private String asyncOperationUrl;
        private String locationUrl;

        Tracker(Operation operation, PollingFamily family, String resourceUrl, TransportResponse initiatingResponse) {
            this.operation = operation;
            this.family = family;
            this.resourceUrl = resourceUrl;
            this.asyncOperationUrl = initiatingResponse.getHeaderOptional(AZURE_ASYNC_OPERATION).orElse(null);
            this.locationUrl = initiatingResponse.getHeaderOptional(LOCATION).orElse(null);
        }

        boolean pollsAsyncOperation() {
            return asyncOperationUrl != null;
        }

        String pollUrl() {
            if (asyncOperationUrl != null) {
                return asyncOperationUrl;
            }
            return family == PollingFamily.RESOURCE_POLLING ? resourceUrl : locationUrl;
        }

        PollStatus initialStatus(TransportResponse response) throws ServiceClientException {
            if (family == PollingFamily.RESOURCE_POLLING) {
                return asyncOperationUrl != null ? PollStatus.IN_PROGRESS : resourceStatus(response);
            }
            if (asyncOperationUrl != null || locationUrl != null) {
                return PollStatus.IN_PROGRESS;
            }
            if (response.getStatusCode() == 202) {
                throw new ServiceClientException("Long running operation " + operation.qualifiedName()
                    + " was accepted without an " + AZURE_ASYNC_OPERATION + " or " + LOCATION + " header to poll");
            }
            return PollStatus.SUCCEEDED;
        }

        void follow(TransportResponse response) {
            if (asyncOperationUrl == null && family == PollingFamily.OPERATION_POLLING) {
                response.getHeaderOptional(LOCATION).ifPresent(url -> locationUrl = url);
            }
        }

        PollStatus statusOf(TransportResponse response) throws ServiceClientException {
            if (asyncOperationUrl != null) {
                return asyncOperationStatus(response);
            }
            if (family == PollingFamily.RESOURCE_POLLING) {
                return resourceStatus(response);
            }
            return response.getStatusCode() == 202 ? PollStatus.IN_PROGRESS : PollStatus.SUCCEEDED;
        }

        private PollStatus asyncOperationStatus(TransportResponse response) throws ServiceClientException {
            JsonNode status = response.getBody() == null ? null : response.getBody().get("status");
            if (status != null && status.isTextual()) {
                return PollStatus.fromValue(status.asText());
            }
            if (response.getStatusCode() == 202) {
                return PollStatus.IN_PROGRESS;
            }
            throw new ServiceClientException("Operation status of " + operation.qualifiedName()
                + " carries no status field: " + response.getRawBody());
        }

        private static PollStatus resourceStatus(TransportResponse response) {
            JsonNode body = response.getBody();
            JsonNode state = body == null ? null : body.path("properties").path("provisioningState");
            if (state != null && state.isTextual()) {
                return PollStatus.fromValue(state.asText());
            }
            int code = response.getStatusCode();
            return code == 201 || code == 202 ? PollStatus.IN_PROGRESS : PollStatus.SUCCEEDED;
        }
    }
}
