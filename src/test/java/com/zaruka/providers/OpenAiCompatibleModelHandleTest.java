package com.zaruka.providers;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import com.zaruka.shared.model.Attachment;
import com.zaruka.shared.model.ChatMessage;
import com.zaruka.shared.model.ContentPart;
import com.zaruka.shared.model.ProviderConfig;
import com.zaruka.shared.model.ToolCallInfo;
import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OpenAiCompatibleModelHandleTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static OpenAiCompatibleModelHandle handle(ProviderConfig config) {
        return new OpenAiCompatibleModelHandle(config, "https://api.example.com/v1/",
                HttpClient.newHttpClient(), Duration.ofSeconds(5));
    }

    private static OpenAiCompatibleModelHandle handle() {
        return handle(new ProviderConfig("openai", "gpt-4o", "sk-test"));
    }

    private static String authorization(HttpModelHandle handle) {
        var builder = HttpRequest.newBuilder(URI.create("http://localhost/"));
        handle.authorize(builder);
        return builder.build().headers().firstValue("Authorization").orElse(null);
    }

    @Test
    void trimsTrailingSlashFromBaseUrl() {
        assertEquals("https://api.example.com/v1", handle().baseUrl());
    }

    @Test
    void bearerPrefersAuthTokenOverApiKey() {
        assertEquals("Bearer sk-test", authorization(handle()));
        var oauth = new ProviderConfig("openai", "gpt-4o", new ProviderConfig.Credentials("sk-test", "oauth-token"), null);
        assertEquals("Bearer oauth-token", authorization(handle(oauth)));
        var none = new ProviderConfig("openai-compatible", "llama3", ProviderConfig.Credentials.NONE, null);
        assertEquals("Bearer no-key", authorization(handle(none)));
    }

    @Test
    void buildsChatCompletionsBody() {
        var schema = MAPPER.createObjectNode().put("type", "object");
        var request = new ModelRequest("be brief", List.of(
                ChatMessage.user("weather?"),
                ChatMessage.assistant("", List.of(new ToolCallInfo("c1", "weather", "{\"city\":\"Oslo\"}"))),
                ChatMessage.toolResult("c1", "rainy")),
                List.of(new ToolDefinition("weather", "current weather", schema)), 1_000);

        var body = handle().buildBody(request, false);

        assertEquals("gpt-4o", body.path("model").asText());
        var messages = body.path("messages");
        assertEquals(4, messages.size());
        assertEquals("system", messages.path(0).path("role").asText());
        assertEquals("be brief", messages.path(0).path("content").asText());
        assertTrue(messages.path(2).path("content").isNull());
        assertEquals("weather", messages.path(2).path("tool_calls").path(0).path("function").path("name").asText());
        assertEquals("tool", messages.path(3).path("role").asText());
        assertEquals("c1", messages.path(3).path("tool_call_id").asText());
        assertEquals("function", body.path("tools").path(0).path("type").asText());
        assertEquals("object", body.path("tools").path(0).path("function").path("parameters").path("type").asText());
        assertFalse(body.has("stream"));
    }

    @Test
    void streamingBodyRequestsUsage() {
        var body = handle().buildBody(new ModelRequest("", List.of(ChatMessage.user("hi"))), true);

        assertTrue(body.path("stream").asBoolean());
        assertTrue(body.path("stream_options").path("include_usage").asBoolean());
        assertEquals(1, body.path("messages").size());
    }

    @Test
    void encodesAttachmentsAsDataUrls() {
        var message = ChatMessage.user(List.of(
                ContentPart.of(Attachment.image(new byte[]{1, 2, 3}, "image/png")),
                ContentPart.of(Attachment.file("hello".getBytes(StandardCharsets.UTF_8), "text/plain", "notes.txt")),
                new ContentPart.Text("what are these?")));

        var content = handle().buildBody(new ModelRequest("", List.of(message)), false)
                .path("messages").path(0).path("content");

        assertEquals("data:image/png;base64,AQID", content.path(0).path("image_url").path("url").asText());
        assertEquals("notes.txt", content.path(1).path("file").path("filename").asText());
        assertEquals("data:text/plain;base64,aGVsbG8=", content.path(1).path("file").path("file_data").asText());
        assertEquals("what are these?", content.path(2).path("text").asText());
    }

    @Test
    void parsesResponseWithToolCalls() throws Exception {
        var root = MAPPER.readTree("""
                {"model":"gpt-4o-2024-08-06",
                 "choices":[{"message":{"content":null,"tool_calls":[
                   {"id":"call_1","function":{"name":"weather","arguments":"{\\"city\\":\\"Oslo\\"}"}}]}}],
                 "usage":{"prompt_tokens":120,"completion_tokens":15}}""");

        var resp = handle().parseResponse(root);

        assertEquals("", resp.content());
        assertEquals("gpt-4o-2024-08-06", resp.model());
        assertEquals(List.of(new ToolCallInfo("call_1", "weather", "{\"city\":\"Oslo\"}")), resp.toolCalls());
        assertEquals(120, resp.usage().inputTokens());
        assertEquals(15, resp.usage().outputTokens());
    }

    @Test
    void errorBodyBecomesFailedResponse() throws Exception {
        var resp = handle().parseResponse(MAPPER.readTree(
                "{\"error\":{\"code\":\"rate_limit_exceeded\",\"message\":\"Rate limit reached\"}}"));

        assertTrue(resp.hasError());
        assertEquals("LLM stream error: rate_limit_exceeded: Rate limit reached", resp.error().getMessage());
    }

    @Test
    void streamsTextAndAssemblesToolCallFragments() {
        var lines = List.of(
                "data: {\"model\":\"gpt-4o\",\"choices\":[{\"delta\":{\"content\":\"Let me \"}}]}",
                "",
                "data: {\"choices\":[{\"delta\":{\"content\":\"check.\"}}]}",
                "data: {\"choices\":[{\"delta\":{\"tool_calls\":[{\"index\":0,\"id\":\"c1\",\"function\":{\"name\":\"weather\",\"arguments\":\"{\\\"ci\"}}]}}]}",
                "data: {\"choices\":[{\"delta\":{\"tool_calls\":[{\"index\":0,\"function\":{\"arguments\":\"ty\\\":\\\"Oslo\\\"}\"}}]}}]}",
                "data: {\"choices\":[],\"usage\":{\"prompt_tokens\":50,\"completion_tokens\":20}}",
                "data: [DONE]",
                "data: {\"choices\":[{\"delta\":{\"content\":\"ignored\"}}]}");
        var deltas = new ArrayList<String>();

        var resp = handle().parseStream(lines.iterator(), deltas::add);

        assertEquals(List.of("Let me ", "check."), deltas);
        assertEquals("Let me check.", resp.content());
        assertEquals("gpt-4o", resp.model());
        assertEquals(List.of(new ToolCallInfo("c1", "weather", "{\"city\":\"Oslo\"}")), resp.toolCalls());
        assertEquals(50, resp.usage().inputTokens());
        assertEquals(20, resp.usage().outputTokens());
    }

    @Test
    void streamErrorEventKeepsPartialText() {
        var lines = List.of(
                "data: {\"choices\":[{\"delta\":{\"content\":\"Partial\"}}]}",
                "data: {\"error\":{\"message\":\"server overloaded\"}}");

        var resp = handle().parseStream(lines.iterator(), d -> {});

        assertTrue(resp.hasError());
        assertEquals("Partial", resp.content());
        assertTrue(resp.error().getMessage().contains("server overloaded"));
    }

    @Test
    void malformedStreamChunkRaisesInvocationError() {
        var lines = List.of("data: {not json");

        var e = assertThrows(ModelInvocationException.class, () -> handle().parseStream(lines.iterator(), d -> {}));
        assertTrue(e.getMessage().startsWith("Malformed response from openai"));
    }

    @Test
    void nonOkStatusRaisesHttpError() throws Exception {
        var server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/v1/chat/completions", exchange -> {
            var body = "{\"error\":{\"message\":\"Rate limit reached\"}}".getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(429, body.length);
            exchange.getResponseBody().write(body);
            exchange.close();
        });
        server.start();
        try {
            var url = "http://127.0.0.1:" + server.getAddress().getPort() + "/v1";
            var handle = new OpenAiCompatibleModelHandle(new ProviderConfig("groq", "llama", "k"), url,
                    HttpClient.newHttpClient(), Duration.ofSeconds(5));

            var e = assertThrows(ModelInvocationException.class,
                    () -> handle.chat(new ModelRequest("", List.of(ChatMessage.user("hi")))));

            assertEquals(429, e.statusCode());
            assertEquals("groq", e.providerId());
            assertTrue(e.getMessage().startsWith("LLM API error 429: "));
            assertTrue(e.getMessage().contains("Rate limit reached"));
        } finally {
            server.stop(0);
        }
    }
}
