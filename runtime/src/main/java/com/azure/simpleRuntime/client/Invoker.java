package com.azure.simpleRuntime.client;

import com.azure.simpleRuntime.CancellationToken;
import com.azure.simpleRuntime.exceptions.OperationCancelledException;
import com.azure.simpleRuntime.exceptions.ServiceClientException;
import com.azure.simpleRuntime.http.HttpVerb;
import com.azure.simpleRuntime.http.Transport;
import com.azure.simpleRuntime.http.TransportRequest;
import com.azure.simpleRuntime.http.TransportResponse;
import com.azure.simpleRuntime.operation.Operation;
import com.azure.simpleRuntime.operation.OperationArguments;
import com.azure.simpleRuntime.operation.OperationCaller;
import com.azure.simpleRuntime.operation.OperationDescriptor;
import com.azure.simpleRuntime.operation.OperationResult;
import com.azure.simpleRuntime.operation.ResponseBodyKind;
import com.azure.simpleRuntime.paging.Pager;
import com.azure.simpleRuntime.parameters.ParameterGroupingTransformer;
import com.azure.simpleRuntime.polling.PollState;
import com.azure.simpleRuntime.polling.Poller;
import com.azure.simpleRuntime.polling.PollingPolicy;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Chooses between a plain call, paging and polling for an operation, and issues single calls
 * for the pager.
 */
public class Invoker implements OperationCaller {
    private static final Logger logger = LoggerFactory.getLogger(Invoker.class);
    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([^}]+)}");

    private final Transport transport;
    private final ObjectMapper objectMapper;
    private final Pager pager;
    private final Poller poller;

    public Invoker(Transport transport, ObjectMapper objectMapper, PollingPolicy pollingPolicy, int maxPages) {
        this.transport = transport;
        this.objectMapper = objectMapper;
        this.pager = new Pager(this, new ParameterGroupingTransformer(objectMapper), objectMapper, maxPages);
        this.poller = new Poller(transport, pollingPolicy);
    }

    public Pager pager() {
        return pager;
    }

    public OperationResult invoke(Operation operation, OperationArguments arguments, CancellationToken cancellationToken)
            throws ServiceClientException {
        ExecutionStrategy strategy = ExecutionStrategy.forOperation(operation);
        logger.debug("Invoking {} as {}", operation.qualifiedName(), strategy);

        switch (strategy) {
            case LONG_RUNNING:
                return invokeLongRunning(operation, arguments, cancellationToken, new PollState());
            case PAGED:
                List<JsonNode> items = pager.page(operation, arguments, JsonNode.class, cancellationToken);
                ArrayNode array = objectMapper.createArrayNode();
                array.addAll(items);
                return OperationResult.ofItems(array);
            default:
                TransportResponse response = send(operation, arguments, cancellationToken);
                return operation.descriptor().responseBodyKind() == ResponseBodyKind.NONE
                    ? OperationResult.withoutBody(response)
                    : OperationResult.of(response);
        }
    }

    /**
     * Issues the initiating request of a long running operation and polls it to completion. The
     * verb is validated before anything goes on the wire.
     */
    public OperationResult invokeLongRunning(Operation operation, OperationArguments arguments,
                                             CancellationToken cancellationToken, PollState state) throws ServiceClientException {
        operation.pollingFamily();
        String url = resolveUrl(operation, arguments);
        TransportResponse initiatingResponse = send(operation, arguments, cancellationToken);
        return poller.pollToCompletion(operation, url, initiatingResponse, cancellationToken, state);
    }

    @Override
    public TransportResponse send(Operation operation, OperationArguments arguments, CancellationToken cancellationToken)
            throws ServiceClientException {
        if (cancellationToken.isCancelled()) {
            throw new OperationCancelledException("Call to " + operation.qualifiedName() + " was cancelled");
        }
        OperationDescriptor descriptor = operation.descriptor();
        // a continuation link is fetched with GET unless the next-page operation says otherwise
        HttpVerb verb = arguments.getNextLink() != null && !descriptor.isNextLinkOperation()
            ? HttpVerb.GET
            : descriptor.httpVerb();

        TransportRequest request = new TransportRequest(verb, resolveUrl(operation, arguments))
            .headers(arguments.getHeaders())
            .body(arguments.getBody());
        if (arguments.getNextLink() == null) {
            request.queryParams(arguments.getQueryParameters());
        }
        groupedQueryParameters(arguments.getGroupedParameter()).forEach(request::queryParam);

        return transport.call(request, cancellationToken);
    }

    String resolveUrl(Operation operation, OperationArguments arguments) {
        OperationDescriptor descriptor = operation.descriptor();
        if (arguments.getNextLink() != null) {
            return arguments.getNextLink();
        }
        if (descriptor.isNextLinkOperation()) {
            throw new IllegalArgumentException("Operation " + operation.qualifiedName() + " needs a continuation link");
        }

        Matcher matcher = PLACEHOLDER.matcher(descriptor.urlTemplate());
        StringBuilder url = new StringBuilder();
        while (matcher.find()) {
            String name = matcher.group(1);
            String value = arguments.getPathParameters().get(name);
            if (value == null) {
                throw new IllegalArgumentException("Missing path parameter '" + name + "' for " + operation.qualifiedName());
            }
            String encoded = URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
            matcher.appendReplacement(url, Matcher.quoteReplacement(encoded));
        }
        matcher.appendTail(url);
        return url.toString();
    }

    private Map<String, String> groupedQueryParameters(Object groupedParameter) {
        if (groupedParameter == null) {
            return Map.of();
        }
        JsonNode tree = objectMapper.valueToTree(groupedParameter);
        Map<String, String> parameters = new LinkedHashMap<>();
        for (Iterator<Map.Entry<String, JsonNode>> fields = tree.fields(); fields.hasNext(); ) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (field.getValue().isValueNode() && !field.getValue().isNull()) {
                parameters.put(field.getKey(), field.getValue().asText());
            }
        }
        return parameters;
    }
}
