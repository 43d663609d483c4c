package com.zaruka.providers;

import com.zaruka.shared.model.ProviderConfig;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Map;

/**
 * Picks the handle variant for a provider once, when the config is resolved.
 */
public class DefaultModelHandleFactory implements ModelHandleFactory {

    static final String ANTHROPIC_BASE_URL = "https://api.anthropic.com";

    /** Known endpoints of providers speaking the Chat Completions protocol. */
    static final Map<String, String> OPENAI_COMPATIBLE_BASE_URLS = Map.of(
            "openai", "https://api.openai.com/v1",
            "deepseek", "https://api.deepseek.com",
            "groq", "https://api.groq.com/openai/v1",
            "xai", "https://api.x.ai/v1",
            "google", "https://generativelanguage.googleapis.com/v1beta/openai",
            "qwen", "https://dashscope-intl.aliyuncs.com/compatible-mode/v1",
            "openai-compatible", "http://localhost:11434/v1"
    );

    private final HttpClient httpClient;
    private final Duration requestTimeout;

    public DefaultModelHandleFactory(Duration requestTimeout) {
        this(HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build(), requestTimeout);
    }

    public DefaultModelHandleFactory(HttpClient httpClient, Duration requestTimeout) {
        this.httpClient = httpClient;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public ModelHandle create(ProviderConfig config) {
        var provider = config.providerId();
        if ("anthropic".equals(provider)) {
            return new AnthropicModelHandle(config, baseUrlOr(config, ANTHROPIC_BASE_URL), httpClient, requestTimeout);
        }
        var defaultUrl = OPENAI_COMPATIBLE_BASE_URLS.get(provider);
        if (defaultUrl == null) {
            throw new IllegalArgumentException("Unknown provider: " + provider);
        }
        return new OpenAiCompatibleModelHandle(config, baseUrlOr(config, defaultUrl), httpClient, requestTimeout);
    }

    private static String baseUrlOr(ProviderConfig config, String fallback) {
        return config.baseUrl() != null && !config.baseUrl().isBlank() ? config.baseUrl() : fallback;
    }
}
