package com.zaruka.shared.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConfigLoaderTest {

    @TempDir
    Path dir;

    private Path write(String yaml) throws IOException {
        var file = dir.resolve("config.yaml");
        Files.writeString(file, yaml);
        return file;
    }

    private static final ConfigLoader.Env NO_ENV = name -> null;

    @Test
    void missingFileYieldsDefaultsWithoutProvider() {
        var config = ConfigLoader.load(dir.resolve("absent.yaml"), NO_ENV);

        assertFalse(config.hasProvider());
        assertTrue(config.attemptOrder().isEmpty());
        assertEquals(AgentSettings.defaults(), config.agent());
        assertEquals(Duration.ofHours(24), config.workingMessagesTtl());
    }

    @Test
    void parsesPrimaryFallbacksAndAgentSettings() throws IOException {
        var path = write("""
                ai:
                  provider: anthropic
                  model: claude-sonnet-4-5
                  auth-token: oauth-abc
                fallbacks:
                  - provider: openai
                    model: gpt-4o
                    api-key: sk-1
                  - provider: openai-compatible
                    model: llama3
                    base-url: http://localhost:11434/v1
                agent:
                  max-context-tokens: 100000
                  max-rounds: 5
                  request-timeout: 30
                  system-prompt: You are terse.
                cache:
                  working-messages-ttl: 600
                """);

        var config = ConfigLoader.load(path, NO_ENV);

        assertEquals("anthropic", config.primary().providerId());
        assertTrue(config.primary().credentials().hasAuthToken());
        assertFalse(config.primary().credentials().hasApiKey());
        assertEquals(2, config.fallbacks().size());
        assertEquals("openai/gpt-4o", config.fallbacks().get(0).label());
        assertEquals("http://localhost:11434/v1", config.fallbacks().get(1).baseUrl());
        assertEquals(3, config.attemptOrder().size());

        var agent = config.agent();
        assertEquals(100_000, agent.maxContextTokens());
        assertEquals(8_000, agent.responseReserve());
        assertEquals(5, agent.maxRounds());
        assertEquals(Duration.ofSeconds(30), agent.requestTimeout());
        assertEquals("You are terse.", agent.systemPrompt());
        assertEquals(Duration.ofMinutes(10), config.workingMessagesTtl());
    }

    @Test
    void environmentOverridesFile() throws IOException {
        var path = write("""
                ai:
                  provider: openai
                  model: gpt-4o-mini
                  api-key: from-file
                """);
        var env = Map.of("ZARUKA_MODEL", "gpt-4o", "ZARUKA_API_KEY", "from-env", "ZARUKA_PROVIDER", " ");

        var config = ConfigLoader.load(path, env::get);

        assertEquals("openai", config.primary().providerId());
        assertEquals("gpt-4o", config.primary().modelId());
        assertEquals("from-env", config.primary().credentials().apiKey());
    }

    @Test
    void environmentAloneCanConfigureProvider() {
        var env = Map.of("ZARUKA_PROVIDER", "deepseek", "ZARUKA_MODEL", "deepseek-chat");

        var config = ConfigLoader.load(dir.resolve("absent.yaml"), env::get);

        assertTrue(config.hasProvider());
        assertEquals("deepseek/deepseek-chat", config.primary().label());
    }

    @Test
    void incompleteFallbackIsSkipped() throws IOException {
        var path = write("""
                ai:
                  provider: openai
                  model: gpt-4o
                fallbacks:
                  - provider: groq
                  - provider: deepseek
                    model: deepseek-chat
                """);

        var config = ConfigLoader.load(path, NO_ENV);

        assertEquals(1, config.fallbacks().size());
        assertEquals("deepseek", config.fallbacks().get(0).providerId());
    }

    @Test
    void emptyFileIsTreatedAsDefaults() throws IOException {
        var config = ConfigLoader.load(write(""), NO_ENV);

        assertFalse(config.hasProvider());
        assertEquals(10, config.agent().maxRounds());
    }

    @Test
    void invalidAgentSettingsAreRejected() throws IOException {
        var path = write("""
                agent:
                  max-context-tokens: 1000
                  response-reserve: 2000
                """);

        assertThrows(IllegalArgumentException.class, () -> ConfigLoader.load(path, NO_ENV));
    }
}
