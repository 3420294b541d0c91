package com.azure.simpleRuntime.tool.cli;

import com.azure.simpleRuntime.client.ServiceClient;
import com.azure.simpleRuntime.exceptions.ServiceClientException;
import com.azure.simpleRuntime.exceptions.ServiceResponseException;
import com.azure.simpleRuntime.http.HttpTransport;
import com.azure.simpleRuntime.http.HttpVerb;
import com.azure.simpleRuntime.http.Transport;
import com.azure.simpleRuntime.operation.FinalStateVia;
import com.azure.simpleRuntime.operation.OperationArguments;
import com.azure.simpleRuntime.operation.OperationDescriptor;
import com.azure.simpleRuntime.operation.OperationExtensions;
import com.azure.simpleRuntime.operation.OperationRegistry;
import com.azure.simpleRuntime.operation.OperationResult;
import com.azure.simpleRuntime.polling.PollingPolicy;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import picocli.CommandLine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.function.Function;

@CommandLine.Command(
    name = "simple-runtime",
    description = "Invoke a single described operation and print its JSON result",
    mixinStandardHelpOptions = true,
    version = "1.0.0-SNAPSHOT"
)
public class InvokeCommand implements Callable<Integer> {
    private static final Logger logger = LoggerFactory.getLogger(InvokeCommand.class);

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(index = "0", description = "HTTP verb: ${COMPLETION-CANDIDATES}")
    private HttpVerb verb;

    @CommandLine.Parameters(index = "1", description = "URL template, e.g. /widgets/{name}")
    private String urlTemplate;

    @CommandLine.Option(names = {"-b", "--base-url"}, required = true, description = "Service base URL")
    private String baseUrl;

    @CommandLine.Option(names = {"-o", "--operation"}, defaultValue = "invoke", description = "Operation name (default: ${DEFAULT-VALUE})")
    private String operationName;

    @CommandLine.Option(names = {"-g", "--group"}, defaultValue = "", description = "Operation group name")
    private String groupName;

    @CommandLine.Option(names = {"-P", "--path-param"}, description = "Path parameter name=value")
    private Map<String, String> pathParameters = new LinkedHashMap<>();

    @CommandLine.Option(names = {"-Q", "--query-param"}, description = "Query parameter name=value")
    private Map<String, String> queryParameters = new LinkedHashMap<>();

    @CommandLine.Option(names = {"-H", "--header"}, description = "Request header name=value")
    private Map<String, String> headers = new LinkedHashMap<>();

    @CommandLine.Option(names = {"-d", "--body"}, description = "JSON request body, or @file to read it from a file")
    private String body;

    @CommandLine.Option(names = "--pageable", description = "Follow continuation links and print every item")
    private boolean pageable;

    @CommandLine.Option(names = "--item-name", defaultValue = OperationExtensions.DEFAULT_ITEM_NAME,
        description = "Field holding the items of a page (default: ${DEFAULT-VALUE})")
    private String itemName;

    @CommandLine.Option(names = "--next-link-name", defaultValue = OperationExtensions.DEFAULT_NEXT_LINK_NAME,
        description = "Field holding the continuation link (default: ${DEFAULT-VALUE})")
    private String nextLinkName;

    @CommandLine.Option(names = "--long-running", description = "Poll the operation until it reaches a terminal state")
    private boolean longRunning;

    @CommandLine.Option(names = "--final-state-via", description = "Where the final result is read from: azure-async-operation, location, original-uri")
    private String finalStateVia;

    @CommandLine.Option(names = "--poll-interval", defaultValue = "30",
        description = "Seconds between status checks when the service suggests none (default: ${DEFAULT-VALUE})")
    private long pollIntervalSeconds;

    @CommandLine.Option(names = "--max-pages", defaultValue = "0", description = "Stop after this many pages, 0 for no limit")
    private int maxPages;

    private final Function<String, Transport> transportFactory;
    private final ObjectMapper objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    public InvokeCommand() {
        this(HttpTransport::new);
    }

    InvokeCommand(Function<String, Transport> transportFactory) {
        this.transportFactory = transportFactory;
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        try {
            OperationRegistry registry = OperationRegistry.builder()
                .group(groupName, descriptors())
                .build();
            PollingPolicy pollingPolicy = PollingPolicy.builder()
                .defaultInterval(Duration.ofSeconds(pollIntervalSeconds))
                .build();

            try (ServiceClient client = ServiceClient.builder()
                .transport(transportFactory.apply(baseUrl))
                .registry(registry)
                .pollingPolicy(pollingPolicy)
                .objectMapper(objectMapper)
                .maxPages(maxPages)
                .build()) {
                logger.debug("Invoking {} {} as {}", verb, urlTemplate, operationName);
                OperationResult result = client.invoke(operationName, groupName, arguments());
                print(out, result);
                return 0;
            }
        } catch (ServiceResponseException e) {
            logger.error("Service returned HTTP {}", e.getStatusCode(), e);
            err.println("HTTP " + e.getStatusCode() + ": " + e.getMessage());
            return 1;
        } catch (ServiceClientException | IllegalArgumentException | IllegalStateException e) {
            logger.error("Invocation failed", e);
            err.println(e.getMessage());
            return 1;
        } catch (IOException e) {
            logger.error("Could not read request body", e);
            err.println("Could not read request body: " + e.getMessage());
            return 1;
        }
    }

    private OperationDescriptor[] descriptors() {
        OperationDescriptor.Builder builder = OperationDescriptor.builder(operationName, verb, urlTemplate);
        if (longRunning) {
            if (finalStateVia != null) {
                builder.longRunning(FinalStateVia.fromValue(finalStateVia));
            } else {
                builder.longRunning();
            }
        }
        if (!pageable) {
            return new OperationDescriptor[] {builder.build()};
        }

        String nextName = operationName + "Next";
        OperationDescriptor operation = builder.pageable(itemName, nextLinkName)
            .nextOperation(nextName)
            .build();
        OperationDescriptor next = OperationDescriptor.builder(nextName, HttpVerb.GET, OperationExtensions.NEXT_LINK_URL)
            .pageable(itemName, nextLinkName)
            .build();
        return new OperationDescriptor[] {operation, next};
    }

    private OperationArguments arguments() throws IOException {
        OperationArguments.Builder builder = OperationArguments.builder().headers(headers);
        pathParameters.forEach(builder::pathParameter);
        queryParameters.forEach(builder::queryParameter);
        if (body != null) {
            String json = body.startsWith("@") ? Files.readString(Path.of(body.substring(1))) : body;
            builder.body(objectMapper.readTree(json));
        }
        return builder.build();
    }

    private void print(PrintWriter out, OperationResult result) throws JsonProcessingException {
        if (result.hasBody()) {
            JsonNode body = result.body();
            out.println(objectMapper.writeValueAsString(body));
        } else {
            out.println("HTTP " + result.statusCode() + " (no content)");
        }
        out.flush();
    }
}
