package com.azure.simpleRuntime.polling;

import com.azure.simpleRuntime.CancellationToken;
import com.azure.simpleRuntime.exceptions.InterruptedPollException;
import com.azure.simpleRuntime.exceptions.InvalidOperationVerbException;
import com.azure.simpleRuntime.exceptions.OperationFailedException;
import com.azure.simpleRuntime.exceptions.ServiceClientException;
import com.azure.simpleRuntime.http.HttpVerb;
import com.azure.simpleRuntime.http.ScriptedTransport;
import com.azure.simpleRuntime.http.TransportRequest;
import com.azure.simpleRuntime.http.TransportResponse;
import com.azure.simpleRuntime.operation.FinalStateVia;
import com.azure.simpleRuntime.operation.Operation;
import com.azure.simpleRuntime.operation.OperationDescriptor;
import com.azure.simpleRuntime.operation.OperationRegistry;
import com.azure.simpleRuntime.operation.OperationResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PollerTest {
    private static final String WIDGET_URL = "/widgets/w1";

    private ScriptedTransport transport;
    private Poller poller;
    private OperationRegistry registry;

    @BeforeEach
    void setUp() {
        transport = new ScriptedTransport();
        poller = new Poller(transport, PollingPolicy.builder().defaultInterval(Duration.ZERO).build());
        registry = OperationRegistry.builder()
            .register(OperationDescriptor.builder("createOrUpdate", HttpVerb.PUT, "/widgets/{name}").longRunning().build())
            .register(OperationDescriptor.builder("createViaLocation", HttpVerb.PUT, "/widgets/{name}")
                .longRunning(FinalStateVia.LOCATION).build())
            .register(OperationDescriptor.builder("restart", HttpVerb.POST, "/widgets/{name}/restart").longRunning().build())
            .register(OperationDescriptor.builder("export", HttpVerb.POST, "/widgets/{name}/export")
                .longRunning(FinalStateVia.AZURE_ASYNC_OPERATION).build())
            .register(OperationDescriptor.builder("archive", HttpVerb.POST, "/widgets/{name}/archive")
                .longRunning(FinalStateVia.ORIGINAL_URI).build())
            .register(OperationDescriptor.builder("delete", HttpVerb.DELETE, "/widgets/{name}").longRunning().build())
            .register(OperationDescriptor.builder("watch", HttpVerb.GET, "/widgets/{name}").longRunning().build())
            .build();
    }

    private Operation operation(String name) throws ServiceClientException {
        return registry.resolve(name, null);
    }

    private static TransportResponse initiating(int statusCode, String json, Map<String, String> headers) {
        return ScriptedTransport.response(statusCode, json, headers);
    }

    @Test
    void putPollsResourceUntilProvisioningSucceeds() throws Exception {
        transport.respond(200, "{\"properties\": {\"provisioningState\": \"Creating\"}}")
            .respond(200, "{\"name\": \"w1\", \"properties\": {\"provisioningState\": \"Succeeded\"}}");
        PollState state = new PollState();

        OperationResult result = poller.pollToCompletion(operation("createOrUpdate"), WIDGET_URL,
            initiating(201, "{\"properties\": {\"provisioningState\": \"Accepted\"}}", Map.of()), CancellationToken.NONE, state);

        assertEquals("w1", result.body().path("name").asText());
        assertEquals(2, transport.callCount());
        assertThat(transport.requests()).extracting(TransportRequest::getUrl).containsOnly(WIDGET_URL);
        assertThat(transport.requests()).extracting(TransportRequest::getVerb).containsOnly(HttpVerb.GET);
        assertEquals(PollStatus.SUCCEEDED, state.getStatus());
        assertEquals(2, state.getPollCount());
    }

    @Test
    void alreadyTerminalResponseNeedsNoStatusCheck() throws Exception {
        OperationResult result = poller.pollToCompletion(operation("createOrUpdate"), WIDGET_URL,
            initiating(200, "{\"name\": \"w1\", \"properties\": {\"provisioningState\": \"Succeeded\"}}", Map.of()),
            CancellationToken.NONE);

        assertEquals("w1", result.body().path("name").asText());
        assertEquals(0, transport.callCount());
    }

    @Test
    void resourceWithoutProvisioningStateUsesStatusCode() throws Exception {
        transport.respond(202, null)
            .respond(200, "{\"name\": \"w1\"}");

        OperationResult result = poller.pollToCompletion(operation("createOrUpdate"), WIDGET_URL,
            initiating(201, null, Map.of()), CancellationToken.NONE);

        assertEquals(200, result.statusCode());
        assertEquals(2, transport.callCount());
    }

    @Test
    void putWithAsyncOperationHeaderPollsItThenReadsResource() throws Exception {
        transport.respond(200, "{\"status\": \"InProgress\"}")
            .respond(200, "{\"status\": \"Succeeded\"}")
            .respond(200, "{\"name\": \"w1\", \"properties\": {\"provisioningState\": \"Succeeded\"}}");

        OperationResult result = poller.pollToCompletion(operation("createOrUpdate"), WIDGET_URL,
            initiating(201, null, Map.of("Azure-AsyncOperation", "https://svc/ops/1")), CancellationToken.NONE);

        assertEquals("w1", result.body().path("name").asText());
        assertThat(transport.requests()).extracting(TransportRequest::getUrl)
            .containsExactly("https://svc/ops/1", "https://svc/ops/1", WIDGET_URL);
    }

    @Test
    void putWithLocationFinalStateReadsLocation() throws Exception {
        transport.respond(200, "{\"status\": \"Succeeded\"}")
            .respond(200, "{\"name\": \"from-location\"}");

        OperationResult result = poller.pollToCompletion(operation("createViaLocation"), WIDGET_URL,
            initiating(201, null, Map.of("azure-asyncoperation", "https://svc/ops/1", "location", "https://svc/results/1")),
            CancellationToken.NONE);

        assertEquals("from-location", result.body().path("name").asText());
        assertEquals("https://svc/results/1", transport.request(1).getUrl());
    }

    @Test
    void postPollsLocationUntilDone() throws Exception {
        transport.respond(202, null, Map.of("Location", "https://svc/ops/1?step=2"))
            .respond(200, "{\"restarted\": true}");

        OperationResult result = poller.pollToCompletion(operation("restart"), "/widgets/w1/restart",
            initiating(202, null, Map.of("Location", "https://svc/ops/1")), CancellationToken.NONE);

        assertTrue(result.body().path("restarted").asBoolean());
        assertThat(transport.requests()).extracting(TransportRequest::getUrl)
            .containsExactly("https://svc/ops/1", "https://svc/ops/1?step=2");
    }

    @Test
    void postWithAsyncOperationFetchesLocationForResult() throws Exception {
        transport.respond(200, "{\"status\": \"Running\"}")
            .respond(200, "{\"status\": \"Succeeded\"}")
            .respond(200, "{\"exported\": 3}");

        OperationResult result = poller.pollToCompletion(operation("restart"), "/widgets/w1/restart",
            initiating(202, null, Map.of("Azure-AsyncOperation", "https://svc/ops/1", "Location", "https://svc/results/1")),
            CancellationToken.NONE);

        assertEquals(3, result.body().path("exported").asInt());
        assertEquals("https://svc/results/1", transport.request(2).getUrl());
    }

    @Test
    void postWithAsyncOperationFinalStateUsesEmbeddedResult() throws Exception {
        transport.respond(200, "{\"status\": \"Succeeded\", \"properties\": {\"blobUri\": \"https://blob/1\"}}");

        OperationResult result = poller.pollToCompletion(operation("export"), "/widgets/w1/export",
            initiating(202, null, Map.of("Azure-AsyncOperation", "https://svc/ops/1", "Location", "https://svc/results/1")),
            CancellationToken.NONE);

        assertEquals("https://blob/1", result.body().path("blobUri").asText());
        assertEquals(1, transport.callCount());
    }

    @Test
    void postWithOriginalUriFinalStateReadsOriginalUrl() throws Exception {
        transport.respond(200, "{\"status\": \"Succeeded\"}")
            .respond(200, "{\"archived\": true}");

        OperationResult result = poller.pollToCompletion(operation("archive"), "/widgets/w1/archive",
            initiating(202, null, Map.of("Azure-AsyncOperation", "https://svc/ops/1")), CancellationToken.NONE);

        assertTrue(result.body().path("archived").asBoolean());
        assertEquals("/widgets/w1/archive", transport.request(1).getUrl());
    }

    @Test
    void deleteResultIsVoid() throws Exception {
        transport.respond(200, "{\"status\": \"Succeeded\"}");

        OperationResult result = poller.pollToCompletion(operation("delete"), WIDGET_URL,
            initiating(202, null, Map.of("Azure-AsyncOperation", "https://svc/ops/9")), CancellationToken.NONE);

        assertNull(result.body());
        assertFalse(result.hasBody());
    }

    @Test
    void failedOperationCarriesLastStatus() throws Exception {
        transport.respond(200, "{\"status\": \"InProgress\"}")
            .respond(200, "{\"status\": \"Failed\", \"error\": {\"code\": \"QuotaExceeded\"}}");

        Operation restart = operation("restart");
        TransportResponse accepted = initiating(202, null, Map.of("Azure-AsyncOperation", "https://svc/ops/1"));
        OperationFailedException error = assertThrows(OperationFailedException.class,
            () -> poller.pollToCompletion(restart, "/widgets/w1/restart", accepted, CancellationToken.NONE));

        assertEquals(PollStatus.FAILED, error.getStatus());
        assertEquals("QuotaExceeded", error.getLastBody().path("error").path("code").asText());
        assertEquals(2, error.getPollsCompleted().getAsInt());
    }

    @Test
    void canceledProvisioningStateFails() throws Exception {
        transport.respond(200, "{\"properties\": {\"provisioningState\": \"Canceled\"}}");

        Operation create = operation("createOrUpdate");
        TransportResponse created = initiating(201, "{\"properties\": {\"provisioningState\": \"Creating\"}}", Map.of());
        OperationFailedException error = assertThrows(OperationFailedException.class,
            () -> poller.pollToCompletion(create, WIDGET_URL, created, CancellationToken.NONE));

        assertEquals(PollStatus.CANCELED, error.getStatus());
    }

    @Test
    void verbWithoutPollingStrategyFailsWithoutCalls() throws Exception {
        Operation watch = operation("watch");
        TransportResponse ok = initiating(202, null, Map.of("Location", "https://svc/ops/1"));

        InvalidOperationVerbException error = assertThrows(InvalidOperationVerbException.class,
            () -> poller.pollToCompletion(watch, WIDGET_URL, ok, CancellationToken.NONE));

        assertEquals(HttpVerb.GET, error.getVerb());
        assertEquals(0, transport.callCount());
    }

    @Test
    void acceptedWithoutPollingHeaderIsProtocolError() throws Exception {
        Operation restart = operation("restart");
        TransportResponse accepted = initiating(202, null, Map.of());

        ServiceClientException error = assertThrows(ServiceClientException.class,
            () -> poller.pollToCompletion(restart, "/widgets/w1/restart", accepted, CancellationToken.NONE));

        assertThat(error.getMessage()).contains("Azure-AsyncOperation");
        assertEquals(0, transport.callCount());
    }

    @Test
    void cancellingMidPollStopsFurtherCalls() throws Exception {
        CancellationToken token = new CancellationToken();
        transport.respondAfter(request -> token.cancel(), 200, "{\"status\": \"InProgress\"}", Map.of())
            .respond(200, "{\"status\": \"InProgress\"}")
            .respond(200, "{\"status\": \"Succeeded\"}");

        Operation restart = operation("restart");
        TransportResponse accepted = initiating(202, null, Map.of("Azure-AsyncOperation", "https://svc/ops/1"));
        InterruptedPollException error = assertThrows(InterruptedPollException.class,
            () -> poller.pollToCompletion(restart, "/widgets/w1/restart", accepted, token));

        assertEquals(1, error.getPollsCompleted().getAsInt());
        assertEquals(1, transport.callCount());
    }

    @Test
    void serverSuggestedRetryAfterOverridesDefaultInterval() {
        Poller slowPoller = new Poller(transport, PollingPolicy.builder().defaultInterval(Duration.ofHours(1)).build());
        transport.respond(200, "{\"status\": \"InProgress\"}", Map.of("Retry-After", "0"))
            .respond(200, "{\"status\": \"Succeeded\", \"properties\": {}}");

        OperationResult result = assertTimeoutPreemptively(Duration.ofSeconds(10), () -> slowPoller.pollToCompletion(
            operation("export"), "/widgets/w1/export",
            initiating(202, null, Map.of("Azure-AsyncOperation", "https://svc/ops/1", "Retry-After", "0")),
            CancellationToken.NONE));

        assertTrue(result.hasBody());
        assertEquals(2, transport.callCount());
    }

    @Test
    void oversizedRetryAfterStillWaitsCancellably() throws Exception {
        Poller honoring = new Poller(transport, PollingPolicy.builder().defaultInterval(Duration.ZERO).build());
        CancellationToken token = new CancellationToken();
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
        try {
            scheduler.schedule(token::cancel, 50, TimeUnit.MILLISECONDS);
            Operation restart = operation("restart");
            TransportResponse accepted = initiating(202, null,
                Map.of("Azure-AsyncOperation", "https://svc/ops/1", "Retry-After", "9223372036854775807"));

            InterruptedPollException error = assertTimeoutPreemptively(Duration.ofSeconds(10), () -> assertThrows(
                InterruptedPollException.class,
                () -> honoring.pollToCompletion(restart, "/widgets/w1/restart", accepted, token)));

            assertEquals(0, error.getPollsCompleted().getAsInt());
            assertEquals(0, transport.callCount());
        } finally {
            scheduler.shutdownNow();
        }
    }

    @Test
    void operationNotMarkedLongRunningIsRejectedByName() throws Exception {
        OperationRegistry plain = OperationRegistry.builder()
            .register(OperationDescriptor.builder("replace", HttpVerb.PUT, "/widgets/{name}").build())
            .build();
        Operation replace = plain.resolve("replace", null);
        TransportResponse accepted = initiating(202, null, Map.of("Location", "https://svc/ops/1"));

        ServiceClientException error = assertThrows(ServiceClientException.class,
            () -> poller.pollToCompletion(replace, WIDGET_URL, accepted, CancellationToken.NONE));

        assertThat(error).isNotInstanceOf(InvalidOperationVerbException.class);
        assertThat(error.getMessage()).contains("replace").contains("not long running");
        assertEquals(0, transport.callCount());
    }
}
