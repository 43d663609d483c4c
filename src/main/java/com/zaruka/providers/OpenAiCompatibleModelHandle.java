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
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.function.Consumer;

/**
 * Chat Completions API: OpenAI itself and every provider speaking its protocol
 * (DeepSeek, Groq, xAI, Google's compatibility endpoint, Ollama and other self-hosted servers).
 */
public class OpenAiCompatibleModelHandle extends HttpModelHandle {

    public OpenAiCompatibleModelHandle(ProviderConfig config, String baseUrl,
                                       HttpClient httpClient, Duration requestTimeout) {
        super(config, baseUrl, httpClient, requestTimeout);
    }

    @Override
    protected String path() {
        return "/chat/completions";
    }

    @Override
    protected void authorize(HttpRequest.Builder builder) {
        var creds = config.credentials();
        var token = creds.hasAuthToken() ? creds.authToken()
                : creds.hasApiKey() ? creds.apiKey() : "no-key";
        builder.header("Authorization", "Bearer " + token);
    }

    @Override
    protected ObjectNode buildBody(ModelRequest request, boolean stream) {
        var body = mapper.createObjectNode();
        body.put("model", modelId());
        var messages = body.putArray("messages");
        if (request.systemPrompt() != null && !request.systemPrompt().isBlank()) {
            messages.addObject().put("role", "system").put("content", request.systemPrompt());
        }
        for (var msg : request.messages()) {
            appendMessage(messages, msg);
        }
        if (request.hasTools()) {
            var tools = body.putArray("tools");
            for (var t : request.tools()) {
                var fn = tools.addObject().put("type", "function").putObject("function");
                fn.put("name", t.name());
                fn.put("description", t.description());
                fn.set("parameters", t.parameters() != null ? t.parameters() : mapper.createObjectNode().put("type", "object"));
            }
        }
        if (stream) {
            body.put("stream", true);
            body.putObject("stream_options").put("include_usage", true);
        }
        return body;
    }

    private void appendMessage(ArrayNode messages, ChatMessage msg) {
        var node = messages.addObject().put("role", msg.role().wireName());
        if (msg.role() == Role.TOOL) {
            node.put("tool_call_id", msg.toolCallId());
            node.put("content", msg.text());
            return;
        }
        if (msg.isMultipart()) {
            var content = node.putArray("content");
            for (var part : msg.parts()) {
                appendPart(content, part);
            }
        } else if (msg.hasToolCalls() && msg.text().isEmpty()) {
            node.putNull("content");
        } else {
            node.put("content", msg.text());
        }
        if (msg.hasToolCalls()) {
            var calls = node.putArray("tool_calls");
            for (var tc : msg.toolCalls()) {
                var call = calls.addObject().put("id", tc.id()).put("type", "function");
                call.putObject("function").put("name", tc.name()).put("arguments", tc.arguments());
            }
        }
    }

    private void appendPart(ArrayNode content, ContentPart part) {
        if (part instanceof ContentPart.Text t) {
            content.addObject().put("type", "text").put("text", t.text());
        } else if (part instanceof ContentPart.Image img) {
            content.addObject().put("type", "image_url")
                    .putObject("image_url").put("url", dataUrl(img.mediaType(), img.bytes()));
        } else if (part instanceof ContentPart.File f) {
            var file = content.addObject().put("type", "file").putObject("file");
            file.put("filename", f.fileName() != null ? f.fileName() : "attachment");
            file.put("file_data", dataUrl(f.mediaType(), f.bytes()));
        }
    }

    private static String dataUrl(String mediaType, byte[] bytes) {
        return "data:" + mediaType + ";base64," + Base64.getEncoder().encodeToString(bytes);
    }

    @Override
    ModelResponse parseResponse(JsonNode root) {
        if (root.has("error")) {
            return ModelResponse.failed(root.path("model").asText(null), "", TokenUsage.ZERO,
                    streamError(errorText(root.path("error"))));
        }
        var choice = root.path("choices").path(0).path("message");
        var content = choice.path("content").asText(null);
        var model = root.path("model").asText(null);
        var toolCalls = new ArrayList<ToolCallInfo>();
        var tcNode = choice.path("tool_calls");
        if (tcNode.isArray()) {
            for (var tc : tcNode) {
                var fn = tc.path("function");
                toolCalls.add(new ToolCallInfo(
                        tc.path("id").asText(),
                        fn.path("name").asText(),
                        fn.path("arguments").asText("")));
            }
        }
        return new ModelResponse(model, content, usage(root.path("usage")), toolCalls, null);
    }

    @Override
    ModelResponse parseStream(Iterator<String> lines, Consumer<String> onTextDelta) {
        var contentBuf = new StringBuilder();
        String model = null;
        var usage = TokenUsage.ZERO;
        // index -> (id, name), index -> argument fragments
        var toolCallMap = new LinkedHashMap<Integer, String[]>();
        var toolCallArgs = new LinkedHashMap<Integer, StringBuilder>();

        var events = sseEvents(lines);
        while (events.hasNext()) {
            var node = events.next();
            if (node.has("error")) {
                return ModelResponse.failed(model, contentBuf.toString(), usage,
                        streamError(errorText(node.path("error"))));
            }
            if (model == null) model = node.path("model").asText(null);

            var u = node.path("usage");
            if (u.has("prompt_tokens")) {
                usage = usage(u);
            }

            var delta = node.path("choices").path(0).path("delta");
            var c = delta.path("content").asText(null);
            if (c != null && !c.isEmpty()) {
                contentBuf.append(c);
                onTextDelta.accept(c);
            }

            var tcs = delta.path("tool_calls");
            if (tcs.isArray()) {
                for (var tc : tcs) {
                    int idx = tc.path("index").asInt(0);
                    var id = tc.path("id").asText(null);
                    var fn = tc.path("function");
                    var name = fn.path("name").asText(null);
                    if (id != null && !toolCallMap.containsKey(idx)) {
                        toolCallMap.put(idx, new String[]{id, name});
                        toolCallArgs.put(idx, new StringBuilder());
                    }
                    var args = fn.path("arguments").asText(null);
                    if (args != null && toolCallArgs.containsKey(idx)) {
                        toolCallArgs.get(idx).append(args);
                    }
                }
            }
        }

        var toolCalls = new ArrayList<ToolCallInfo>();
        for (var entry : toolCallMap.entrySet()) {
            var v = entry.getValue();
            toolCalls.add(new ToolCallInfo(v[0], v[1], toolCallArgs.get(entry.getKey()).toString()));
        }
        return new ModelResponse(model, contentBuf.toString(), usage, toolCalls, null);
    }

    private static TokenUsage usage(JsonNode u) {
        return new TokenUsage(u.path("prompt_tokens").asInt(0), u.path("completion_tokens").asInt(0));
    }

    private static String errorText(JsonNode error) {
        if (error.isTextual()) return error.asText();
        var code = error.path("code").asText(error.path("type").asText(""));
        var message = error.path("message").asText(error.toString());
        return code.isEmpty() ? message : code + ": " + message;
    }
}
