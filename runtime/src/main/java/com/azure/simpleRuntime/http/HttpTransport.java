package com.azure.simpleRuntime.http;

import com.azure.simpleRuntime.CancellationToken;
import com.azure.simpleRuntime.exceptions.OperationCancelledException;
import com.azure.simpleRuntime.exceptions.ServiceClientException;
import com.azure.simpleRuntime.exceptions.ServiceResponseException;
import com.azure.simpleRuntime.exceptions.TransportException;
import com.azure.simpleRuntime.http.retry.ExponentialBackoffStrategy;
import com.azure.simpleRuntime.http.retry.RetryPolicy;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * {@link Transport} over {@link HttpClient} exchanging JSON bodies.
 */
public class HttpTransport implements Transport {
    private static final Logger logger = LoggerFactory.getLogger(HttpTransport.class);
    private static final String USER_AGENT = "azure-simple-runtime/1.0.0";
    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(30);

    private final HttpClient httpClient;
    private final String baseUrl;
    private final RetryPolicy retryPolicy;
    private final ObjectMapper objectMapper;
    private final ExponentialBackoffStrategy backoffStrategy;

    public HttpTransport(String baseUrl) {
        this(baseUrl, RetryPolicy.DEFAULT);
    }

    public HttpTransport(String baseUrl, RetryPolicy retryPolicy) {
        this(baseUrl, retryPolicy, new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false));
    }

    public HttpTransport(String baseUrl, RetryPolicy retryPolicy, ObjectMapper objectMapper) {
        this(HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(30)).build(),
            baseUrl, retryPolicy, objectMapper, new ExponentialBackoffStrategy());
    }

    HttpTransport(HttpClient httpClient, String baseUrl, RetryPolicy retryPolicy,
                  ObjectMapper objectMapper, ExponentialBackoffStrategy backoffStrategy) {
        this.httpClient = httpClient;
        this.baseUrl = stripTrailingSlash(baseUrl);
        this.retryPolicy = retryPolicy;
        this.objectMapper = objectMapper;
        this.backoffStrategy = backoffStrategy;
    }

    @Override
    public TransportResponse call(TransportRequest request, CancellationToken cancellationToken) throws ServiceClientException {
        HttpRequest httpRequest = buildHttpRequest(request);
        Exception lastException = null;

        for (int attempt = 1; attempt <= retryPolicy.getMaxAttempts(); attempt++) {
            if (cancellationToken.isCancelled()) {
                throw new OperationCancelledException("Request cancelled before sending: " + request);
            }
            logger.debug("Sending {} {} (attempt {})", httpRequest.method(), httpRequest.uri(), attempt);

            try {
                HttpResponse<String> response = send(httpRequest, cancellationToken);
                Map<String, String> headers = firstHeaderValues(response);

                if (response.statusCode() >= 400) {
                    if (RetryPolicy.isTransientStatus(response.statusCode())
                            && retryPolicy.canRetry(attempt, RetryPolicy.Trigger.TRANSIENT_STATUS)) {
                        logger.warn("{} {} returned HTTP {}, retrying", httpRequest.method(), httpRequest.uri(), response.statusCode());
                        sleepBeforeRetry(attempt, headers, cancellationToken);
                        continue;
                    }
                    throw createServiceException(response.statusCode(), headers, response.body());
                }

                return new TransportResponse(response.statusCode(), headers, decodeBody(response.body()), response.body());
            } catch (HttpTimeoutException e) {
                lastException = e;
                if (retryPolicy.canRetry(attempt, RetryPolicy.Trigger.TIMEOUT)) {
                    sleepBeforeRetry(attempt, null, cancellationToken);
                    continue;
                }
                throw new TransportException("Request timeout: " + request, e);
            } catch (IOException e) {
                lastException = e;
                if (retryPolicy.canRetry(attempt, RetryPolicy.Trigger.NETWORK_ERROR)) {
                    sleepBeforeRetry(attempt, null, cancellationToken);
                    continue;
                }
                throw new TransportException("Network error: " + request, e);
            }
        }

        throw new TransportException("Request failed after " + retryPolicy.getMaxAttempts() + " attempts: " + request, lastException);
    }

    private HttpResponse<String> send(HttpRequest httpRequest, CancellationToken cancellationToken)
            throws IOException, OperationCancelledException {
        CompletableFuture<HttpResponse<String>> future =
            httpClient.sendAsync(httpRequest, HttpResponse.BodyHandlers.ofString());
        try (CancellationToken.Registration ignored = cancellationToken.onCancel(() -> future.cancel(true))) {
            return future.get();
        } catch (CancellationException e) {
            throw new OperationCancelledException("Request cancelled: " + httpRequest.method() + " " + httpRequest.uri(), e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new OperationCancelledException("Request interrupted: " + httpRequest.method() + " " + httpRequest.uri(), e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IOException) {
                throw (IOException) cause;
            }
            throw new IOException("Unexpected error during request execution", cause);
        }
    }

    HttpRequest buildHttpRequest(TransportRequest request) throws TransportException {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(URI.create(buildUrlWithQuery(buildFullUrl(request.getUrl()), request.getQueryParameters())))
            .timeout(REQUEST_TIMEOUT)
            .header("Accept", "application/json")
            .header("User-Agent", USER_AGENT)
            .header("x-ms-client-request-id", UUID.randomUUID().toString());

        Map<String, String> headers = new HashMap<>(request.getHeaders());
        headers.putIfAbsent("Content-Type", "application/json");
        headers.forEach(builder::setHeader);

        HttpRequest.BodyPublisher bodyPublisher = serializeBody(request.getBody());
        switch (request.getVerb()) {
            case GET:
                builder.GET();
                break;
            case PUT:
                builder.PUT(bodyPublisher);
                break;
            case POST:
                builder.POST(bodyPublisher);
                break;
            case PATCH:
                builder.method("PATCH", bodyPublisher);
                break;
            case DELETE:
                builder.DELETE();
                break;
            default:
                throw new TransportException("Unsupported HTTP method: " + request.getVerb());
        }
        return builder.build();
    }

    private HttpRequest.BodyPublisher serializeBody(Object body) throws TransportException {
        if (body == null) {
            return HttpRequest.BodyPublishers.noBody();
        }
        if (body instanceof String) {
            return HttpRequest.BodyPublishers.ofString((String) body);
        }
        try {
            return HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body));
        } catch (JsonProcessingException e) {
            throw new TransportException("Failed to serialize request body", e);
        }
    }

    private JsonNode decodeBody(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            logger.debug("Response body is not JSON, keeping it as text: {}", e.getOriginalMessage());
            return TextNode.valueOf(body);
        }
    }

    private String buildFullUrl(String url) {
        if (url.startsWith("http://") || url.startsWith("https://")) {
            return url;
        }
        return baseUrl + (url.startsWith("/") ? url : "/" + url);
    }

    private static String buildUrlWithQuery(String url, Map<String, String> queryParameters) {
        if (queryParameters.isEmpty()) {
            return url;
        }
        StringBuilder urlBuilder = new StringBuilder(url);
        urlBuilder.append(url.contains("?") ? "&" : "?");
        boolean first = true;
        for (Map.Entry<String, String> param : queryParameters.entrySet()) {
            if (!first) {
                urlBuilder.append("&");
            }
            urlBuilder.append(URLEncoder.encode(param.getKey(), StandardCharsets.UTF_8))
                .append("=")
                .append(URLEncoder.encode(param.getValue(), StandardCharsets.UTF_8));
            first = false;
        }
        return urlBuilder.toString();
    }

    private static Map<String, String> firstHeaderValues(HttpResponse<String> response) {
        Map<String, String> headers = new HashMap<>();
        response.headers().map().forEach((name, values) -> {
            if (!values.isEmpty()) {
                headers.put(name, values.get(0));
            }
        });
        return headers;
    }

    private void sleepBeforeRetry(int attempt, Map<String, String> responseHeaders, CancellationToken cancellationToken)
            throws OperationCancelledException {
        Duration delay = backoffStrategy.calculateDelay(attempt, retryPolicy, responseHeaders);
        try {
            if (cancellationToken.await(delay)) {
                throw new OperationCancelledException("Request cancelled during retry delay");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OperationCancelledException("Retry delay was interrupted", e);
        }
    }

    private ServiceResponseException createServiceException(int statusCode, Map<String, String> headers, String responseBody) {
        String errorCode = null;
        String errorMessage = "HTTP " + statusCode;

        if (responseBody != null && !responseBody.isBlank()) {
            try {
                JsonNode error = objectMapper.readTree(responseBody).path("error");
                errorCode = error.path("code").asText(null);
                errorMessage = error.path("message").asText(errorMessage);
            } catch (JsonProcessingException e) {
                logger.debug("Error response body is not JSON: {}", e.getOriginalMessage());
            }
        }
        return new ServiceResponseException(errorMessage, statusCode, headers, errorCode, responseBody);
    }

    private static String stripTrailingSlash(String url) {
        if (url == null) {
            return "";
        }
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
