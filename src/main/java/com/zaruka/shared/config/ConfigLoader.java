package com.zaruka.shared.config;

import com.zaruka.shared.model.ProviderConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private static final Path DEFAULT_PATH = Path.of(
        System.getProperty("user.home"), ".zaruka", "config.yaml"
    );

    private static final Duration DEFAULT_WORKING_MESSAGES_TTL = Duration.ofHours(24);

    public static ZarukaConfig load() {
        return load(DEFAULT_PATH);
    }

    public static ZarukaConfig load(Path path) {
        return load(path, System::getenv);
    }

    @SuppressWarnings("unchecked")
    static ZarukaConfig load(Path path, Env env) {
        Map<String, Object> raw;
        if (Files.exists(path)) {
            try (var in = Files.newInputStream(path)) {
                raw = new Yaml().load(in);
                if (raw == null) raw = Map.of();
            } catch (IOException e) {
                throw new RuntimeException("Failed to load config: " + path, e);
            }
        } else {
            log.info("No config at {}, using defaults", path);
            raw = Map.of();
        }

        var ai = (Map<String, Object>) raw.getOrDefault("ai", Map.of());
        var fallbacks = (List<Map<String, Object>>) raw.getOrDefault("fallbacks", List.of());
        var agent = (Map<String, Object>) raw.getOrDefault("agent", Map.of());
        var cache = (Map<String, Object>) raw.getOrDefault("cache", Map.of());

        return new ZarukaConfig(
            parsePrimary(ai, env),
            parseFallbacks(fallbacks),
            parseAgentSettings(agent),
            Duration.ofSeconds(Long.parseLong(String.valueOf(
                cache.getOrDefault("working-messages-ttl", DEFAULT_WORKING_MESSAGES_TTL.toSeconds()))))
        );
    }

    private static ProviderConfig parsePrimary(Map<String, Object> ai, Env env) {
        var provider = envOrDefault(env, "ZARUKA_PROVIDER", (String) ai.get("provider"));
        var model = envOrDefault(env, "ZARUKA_MODEL", (String) ai.get("model"));
        if (provider == null || model == null) {
            return null;
        }
        return new ProviderConfig(provider, model,
            new ProviderConfig.Credentials(
                envOrDefault(env, "ZARUKA_API_KEY", (String) ai.get("api-key")),
                envOrDefault(env, "ZARUKA_AUTH_TOKEN", (String) ai.get("auth-token"))),
            (String) ai.get("base-url"));
    }

    private static List<ProviderConfig> parseFallbacks(List<Map<String, Object>> raw) {
        var result = new ArrayList<ProviderConfig>();
        for (var entry : raw) {
            var provider = (String) entry.get("provider");
            var model = (String) entry.get("model");
            if (provider == null || model == null) {
                log.warn("Fallback entry without provider/model, skipping: {}", entry.keySet());
                continue;
            }
            result.add(new ProviderConfig(provider, model,
                new ProviderConfig.Credentials((String) entry.get("api-key"), (String) entry.get("auth-token")),
                (String) entry.get("base-url")));
        }
        return result;
    }

    private static AgentSettings parseAgentSettings(Map<String, Object> agent) {
        var defaults = AgentSettings.defaults();
        return new AgentSettings(
            intOr(agent, "max-context-tokens", defaults.maxContextTokens()),
            intOr(agent, "response-reserve", defaults.responseReserve()),
            intOr(agent, "tokens-per-tool", defaults.tokensPerTool()),
            intOr(agent, "history-char-limit", defaults.historyCharLimit()),
            intOr(agent, "image-tokens", defaults.imageTokens()),
            intOr(agent, "max-rounds", defaults.maxRounds()),
            Duration.ofSeconds(intOr(agent, "request-timeout", (int) defaults.requestTimeout().toSeconds())),
            (String) agent.getOrDefault("system-prompt", defaults.systemPrompt())
        );
    }

    private static int intOr(Map<String, Object> map, String key, int fallback) {
        return Integer.parseInt(String.valueOf(map.getOrDefault(key, fallback)));
    }

    private static String envOrDefault(Env env, String name, String fallback) {
        var val = env.get(name);
        return val != null && !val.isBlank() ? val : fallback;
    }

    @FunctionalInterface
    interface Env {
        String get(String name);
    }
}
