package com.zaruka.providers;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.zaruka.shared.model.ChatMessage;
import com.zaruka.shared.model.ContentPart;
import com.zaruka.shared.model.ProviderConfig;
import com.zaruka.shared.model.Role;
import com.zaruka.shared.model.TokenUsage;
import com.zaruka.shared.model.ToolCallInfo;

import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Iterator;
import java.util.TreeMap;
import java.util.function.Consumer;

/**
 * Anthropic Messages API. Accepts either an API key or an OAuth bearer token.
 */
public class AnthropicModelHandle extends HttpModelHandle {

    static final String API_VERSION = "2023-06-01";

    public AnthropicModelHandle(ProviderConfig config, String baseUrl,
                                HttpClient httpClient, Duration requestTimeout) {
        super(config, baseUrl, httpClient, requestTimeout);
    }

    @Override
    protected String path() {
        return "/v1/messages";
    }

    @Override
    protected void authorize(HttpRequest.Builder builder) {
        var creds = config.credentials();
        builder.header("anthropic-version", API_VERSION);
        if (creds.hasAuthToken()) {
            builder.header("Authorization", "Bearer " + creds.authToken());
        } else if (creds.hasApiKey()) {
            builder.header("x-api-key", creds.apiKey());
        }
    }

    @Override
    protected ObjectNode buildBody(ModelRequest request, boolean stream) {
        var body = mapper.createObjectNode();
        body.put("model", modelId());
        body.put("max_tokens", request.maxOutputTokens());
        if (request.systemPrompt() != null && !request.systemPrompt().isBlank()) {
            body.put("system", request.systemPrompt());
        }
        var messages = body.putArray("messages");
        ArrayNode pendingToolResults = null;
        for (var msg : request.messages()) {
            if (msg.role() == Role.TOOL) {
                // consecutive tool results travel together in one user message
                if (pendingToolResults == null) {
                    pendingToolResults = messages.addObject().put("role", "user").putArray("content");
                }
                pendingToolResults.addObject()
                        .put("type", "tool_result")
                        .put("tool_use_id", msg.toolCallId())
                        .put("content", msg.text());
                continue;
            }
            pendingToolResults = null;
            appendMessage(messages, msg);
        }
        if (request.hasTools()) {
            var tools = body.putArray("tools");
            for (var t : request.tools()) {
                var tool = tools.addObject();
                tool.put("name", t.name());
                tool.put("description", t.description());
                tool.set("input_schema", t.parameters() != null ? t.parameters() : mapper.createObjectNode().put("type", "object"));
            }
        }
        if (stream) body.put("stream", true);
        return body;
    }

    private void appendMessage(ArrayNode messages, ChatMessage msg) {
        var node = messages.addObject().put("role", msg.role().wireName());
        if (!msg.isMultipart() && !msg.hasToolCalls()) {
            node.put("content", msg.text());
            return;
        }
        var content = node.putArray("content");
        for (var part : msg.parts()) {
            appendPart(content, part);
        }
        for (var tc : msg.toolCalls()) {
            var use = content.addObject()
                    .put("type", "tool_use")
                    .put("id", tc.id())
                    .put("name", tc.name());
            var args = tc.arguments() == null || tc.arguments().isBlank() ? "{}" : tc.arguments();
            use.set("input", readTree(args));
        }
    }

    private void appendPart(ArrayNode content, ContentPart part) {
        if (part instanceof ContentPart.Text t) {
            if (!t.text().isEmpty()) content.addObject().put("type", "text").put("text", t.text());
        } else if (part instanceof ContentPart.Image img) {
            content.addObject().put("type", "image").set("source", base64Source(img.mediaType(), img.bytes()));
        } else if (part instanceof ContentPart.File f) {
            if ("application/pdf".equals(f.mediaType())) {
                content.addObject().put("type", "document").set("source", base64Source(f.mediaType(), f.bytes()));
            } else if (f.mediaType().startsWith("text/")) {
                var source = mapper.createObjectNode()
                        .put("type", "text")
                        .put("media_type", "text/plain")
                        .put("data", new String(f.bytes(), StandardCharsets.UTF_8));
                var doc = content.addObject().put("type", "document");
                doc.set("source", source);
                if (f.fileName() != null) doc.put("title", f.fileName());
            } else {
                content.addObject().put("type", "text")
                        .put("text", "[file " + (f.fileName() != null ? f.fileName() : "attachment")
                                + " (" + f.mediaType() + ") cannot be read by this model]");
            }
        }
    }

    private ObjectNode base64Source(String mediaType, byte[] bytes) {
        return mapper.createObjectNode()
                .put("type", "base64")
                .put("media_type", mediaType)
                .put("data", Base64.getEncoder().encodeToString(bytes));
    }

    @Override
    ModelResponse parseResponse(JsonNode root) {
        if ("error".equals(root.path("type").asText())) {
            return ModelResponse.failed(null, "", TokenUsage.ZERO, streamError(errorText(root.path("error"))));
        }
        var text = new StringBuilder();
        var toolCalls = new ArrayList<ToolCallInfo>();
        for (var block : root.path("content")) {
            switch (block.path("type").asText()) {
                case "text" -> text.append(block.path("text").asText(""));
                case "tool_use" -> toolCalls.add(new ToolCallInfo(
                        block.path("id").asText(),
                        block.path("name").asText(),
                        block.path("input").toString()));
                default -> { }
            }
        }
        var u = root.path("usage");
        var usage = new TokenUsage(u.path("input_tokens").asInt(0), u.path("output_tokens").asInt(0));
        return new ModelResponse(root.path("model").asText(null), text.toString(), usage, toolCalls, null);
    }

    @Override
    ModelResponse parseStream(Iterator<String> lines, Consumer<String> onTextDelta) {
        var text = new StringBuilder();
        String model = null;
        int inputTokens = 0;
        int outputTokens = 0;
        // content block index -> (id, name), index -> partial JSON
        var toolBlocks = new TreeMap<Integer, String[]>();
        var toolArgs = new TreeMap<Integer, StringBuilder>();

        var events = sseEvents(lines);
        while (events.hasNext()) {
            var event = events.next();
            var type = event.path("type").asText();
            switch (type) {
                case "message_start" -> {
                    var message = event.path("message");
                    model = message.path("model").asText(null);
                    inputTokens = message.path("usage").path("input_tokens").asInt(0);
                    outputTokens = message.path("usage").path("output_tokens").asInt(0);
                }
                case "content_block_start" -> {
                    var block = event.path("content_block");
                    int idx = event.path("index").asInt();
                    if ("tool_use".equals(block.path("type").asText())) {
                        toolBlocks.put(idx, new String[]{block.path("id").asText(), block.path("name").asText()});
                        toolArgs.put(idx, new StringBuilder());
                    } else if ("text".equals(block.path("type").asText())) {
                        emit(block.path("text").asText(""), text, onTextDelta);
                    }
                }
                case "content_block_delta" -> {
                    var delta = event.path("delta");
                    int idx = event.path("index").asInt();
                    if ("text_delta".equals(delta.path("type").asText())) {
                        emit(delta.path("text").asText(""), text, onTextDelta);
                    } else if ("input_json_delta".equals(delta.path("type").asText()) && toolArgs.containsKey(idx)) {
                        toolArgs.get(idx).append(delta.path("partial_json").asText(""));
                    }
                }
                case "message_delta" -> {
                    var u = event.path("usage");
                    if (u.has("output_tokens")) outputTokens = u.path("output_tokens").asInt();
                }
                case "error" -> {
                    return ModelResponse.failed(model, text.toString(), new TokenUsage(inputTokens, outputTokens),
                            streamError(errorText(event.path("error"))));
                }
                default -> { }
            }
            if ("message_stop".equals(type)) break;
        }

        var toolCalls = new ArrayList<ToolCallInfo>();
        for (var entry : toolBlocks.entrySet()) {
            var args = toolArgs.get(entry.getKey()).toString();
            toolCalls.add(new ToolCallInfo(entry.getValue()[0], entry.getValue()[1], args.isEmpty() ? "{}" : args));
        }
        return new ModelResponse(model, text.toString(), new TokenUsage(inputTokens, outputTokens), toolCalls, null);
    }

    private static void emit(String fragment, StringBuilder text, Consumer<String> onTextDelta) {
        if (fragment.isEmpty()) return;
        text.append(fragment);
        onTextDelta.accept(fragment);
    }

    private static String errorText(JsonNode error) {
        var type = error.path("type").asText("");
        var message = error.path("message").asText(error.toString());
        return type.isEmpty() ? message : type + ": " + message;
    }
}
