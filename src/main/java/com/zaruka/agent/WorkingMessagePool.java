package com.zaruka.agent;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Short "still working on it" phrases per language, generated by the model on
 * first use and kept in a time-limited cache owned by the caller.
 */
public class WorkingMessagePool {

    private static final Logger log = LoggerFactory.getLogger(WorkingMessagePool.class);

    static final String FALLBACK = "⏳…";
    static final int MIN_PHRASES = 5;
    static final int MAX_PHRASE_LENGTH = 60;

    private final AgentOrchestrator orchestrator;
    private final Cache<String, List<String>> cache;
    private final Executor executor;
    private final Set<String> pending = ConcurrentHashMap.newKeySet();

    public WorkingMessagePool(AgentOrchestrator orchestrator, Cache<String, List<String>> cache, Executor executor) {
        this.orchestrator = orchestrator;
        this.cache = cache;
        this.executor = executor;
    }

    public static Cache<String, List<String>> newCache(Duration ttl) {
        return Caffeine.newBuilder()
                .expireAfterWrite(ttl)
                .maximumSize(64)
                .build();
    }

    /**
     * A random cached phrase, or {@link #FALLBACK} while the pool for this language is being generated.
     */
    public String pick(String language) {
        var pool = cache.getIfPresent(language);
        if (pool != null && !pool.isEmpty()) {
            return pool.get(ThreadLocalRandom.current().nextInt(pool.size()));
        }
        ensureGenerated(language);
        return FALLBACK;
    }

    public void ensureGenerated(String language) {
        if (cache.getIfPresent(language) != null || !pending.add(language)) return;
        try {
            executor.execute(() -> generate(language));
        } catch (RuntimeException e) {
            pending.remove(language);
            throw e;
        }
    }

    private void generate(String language) {
        try {
            var result = orchestrator.process(AssistantRequest.of(prompt(language)));
            var lines = parse(result.text());
            if (lines.size() >= MIN_PHRASES) {
                cache.put(language, lines);
                log.info("Generated {} working messages for {}", lines.size(), language);
            } else {
                log.warn("Only {} usable working messages for {}, will retry later", lines.size(), language);
            }
        } catch (RuntimeException e) {
            log.warn("Failed to generate working messages for {}: {}", language, e.getMessage());
        } finally {
            pending.remove(language);
        }
    }

    static List<String> parse(String text) {
        return text.lines()
                .map(String::trim)
                .filter(l -> l.length() > 1 && l.length() < MAX_PHRASE_LENGTH)
                .toList();
    }

    private static String prompt(String language) {
        return "[SYSTEM - not a user message, no greeting, no conversation]\n"
                + "Generate 20 short (2-5 words each) status messages in " + language
                + " meaning \"I'm busy working on your request, please wait\". "
                + "The tone: playful, warm, varied. Each starts with one emoji. All different. "
                + "One per line, no numbering, no quotes. ONLY the messages.";
    }
}
