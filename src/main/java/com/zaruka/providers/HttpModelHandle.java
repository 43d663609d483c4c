package com.zaruka.providers;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.zaruka.shared.model.ProviderConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Iterator;
import java.util.concurrent.CancellationException;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Shared HTTP plumbing for JSON chat APIs: request dispatch, SSE line streaming,
 * and conversion of transport failures into {@link ModelInvocationException}.
 */
abstract class HttpModelHandle implements ModelHandle {

    private static final Logger log = LoggerFactory.getLogger(HttpModelHandle.class);

    protected final ObjectMapper mapper = new ObjectMapper();
    protected final ProviderConfig config;
    private final String baseUrl;
    private final HttpClient httpClient;
    private final Duration requestTimeout;

    protected HttpModelHandle(ProviderConfig config, String baseUrl, HttpClient httpClient, Duration requestTimeout) {
        this.config = config;
        this.baseUrl = baseUrl.replaceAll("/+$", "");
        this.httpClient = httpClient;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public String providerId() {
        return config.providerId();
    }

    @Override
    public String modelId() {
        return config.modelId();
    }

    protected String baseUrl() {
        return baseUrl;
    }

    protected abstract String path();

    protected abstract void authorize(HttpRequest.Builder builder);

    protected abstract ObjectNode buildBody(ModelRequest request, boolean stream);

    abstract ModelResponse parseResponse(JsonNode root);

    abstract ModelResponse parseStream(Iterator<String> lines, Consumer<String> onTextDelta);

    @Override
    public ModelResponse chat(ModelRequest request) {
        var resp = send(buildBody(request, false), HttpResponse.BodyHandlers.ofString());
        if (resp.statusCode() != 200) {
            throw ModelInvocationException.httpError(providerId(), resp.statusCode(), resp.body());
        }
        return parseResponse(readTree(resp.body().trim()));
    }

    @Override
    public ModelResponse chatStream(ModelRequest request, Consumer<String> onTextDelta) {
        var resp = send(buildBody(request, true), HttpResponse.BodyHandlers.ofLines());
        try (var lines = resp.body()) {
            if (resp.statusCode() != 200) {
                throw ModelInvocationException.httpError(providerId(), resp.statusCode(),
                        lines.collect(Collectors.joining("\n")));
            }
            return parseStream(lines.iterator(), onTextDelta);
        } catch (UncheckedIOException e) {
            throw networkError(e.getCause());
        }
    }

    private <T> HttpResponse<T> send(ObjectNode body, HttpResponse.BodyHandler<T> handler) {
        String json;
        try {
            json = mapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize request body", e);
        }
        var builder = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path()))
                .header("Content-Type", "application/json")
                .timeout(requestTimeout)
                .POST(HttpRequest.BodyPublishers.ofString(json));
        authorize(builder);
        log.debug("POST {}{} model={}", baseUrl, path(), modelId());
        try {
            return httpClient.send(builder.build(), handler);
        } catch (IOException e) {
            throw networkError(e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while calling " + providerId());
        }
    }

    /**
     * Yields the JSON payload of each {@code data:} line, stopping at {@code [DONE]}.
     */
    protected Iterator<JsonNode> sseEvents(Iterator<String> lines) {
        return new Iterator<>() {
            private JsonNode next;
            private boolean done;

            @Override
            public boolean hasNext() {
                while (next == null && !done && lines.hasNext()) {
                    var line = lines.next().trim();
                    if (!line.startsWith("data:")) continue;
                    var data = line.substring(5).trim();
                    if (data.isEmpty()) continue;
                    if ("[DONE]".equals(data)) {
                        done = true;
                        break;
                    }
                    next = readTree(data);
                }
                return next != null;
            }

            @Override
            public JsonNode next() {
                if (!hasNext()) throw new java.util.NoSuchElementException();
                var n = next;
                next = null;
                return n;
            }
        };
    }

    protected JsonNode readTree(String json) {
        try {
            return mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ModelInvocationException(providerId(), 0,
                    "Malformed response from " + providerId() + ": " + e.getOriginalMessage(), e);
        }
    }

    protected ModelInvocationException streamError(String detail) {
        return new ModelInvocationException(providerId(), 0, "LLM stream error: " + detail);
    }

    private ModelInvocationException networkError(Throwable e) {
        var msg = e.getMessage();
        return new ModelInvocationException(providerId(), 0,
                "Network error calling " + providerId() + ": " + e.getClass().getSimpleName()
                        + (msg != null ? ": " + msg : ""), e);
    }
}
