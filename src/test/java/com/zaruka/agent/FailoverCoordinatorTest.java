package com.zaruka.agent;

import com.zaruka.observability.AssistantMetrics;
import com.zaruka.providers.ModelInvocationException;
import com.zaruka.providers.PatternErrorClassifier;
import com.zaruka.shared.model.ChatMessage;
import com.zaruka.shared.model.ProviderConfig;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;

import static com.zaruka.agent.ScriptedModelHandle.answer;
import static org.junit.jupiter.api.Assertions.*;

class FailoverCoordinatorTest {

    private final AssistantMetrics metrics = new AssistantMetrics();

    private FailoverCoordinator coordinator(ScriptedModelHandle... handles) {
        var candidates = new ArrayList<FailoverCoordinator.Candidate>();
        for (var h : handles) {
            candidates.add(new FailoverCoordinator.Candidate(
                    new ProviderConfig(h.providerId(), h.modelId(), "key"), h));
        }
        return new FailoverCoordinator(candidates, new StepExecutor(metrics, 8_000),
                new PatternErrorClassifier(), metrics);
    }

    private static FailoverCoordinator.Attempt attempt() {
        return new FailoverCoordinator.Attempt("sys", List.of(ChatMessage.user("hi")), null, 10,
                CancellationToken.NONE, null);
    }

    @Test
    void primarySuccessReportsNoSwitch() {
        var a = new ScriptedModelHandle("openai", "gpt-4o", answer("from a"));
        var b = new ScriptedModelHandle("deepseek", "deepseek-chat", answer("from b"));

        var result = coordinator(a, b).attempt(attempt());

        assertEquals("from a", result.text());
        assertFalse(result.switched());
        assertNull(result.switchedTo());
        assertEquals("gpt-4o", result.servedBy().modelId());
        assertEquals(0, b.calls());
        assertEquals(0.0, metrics.failovers().count());
    }

    @Test
    void retriableFailureMovesToNextCandidateAndStops() {
        var a = new ScriptedModelHandle("openai", "gpt-4o",
                ModelInvocationException.httpError("openai", 429, "rate limit exceeded"));
        var b = new ScriptedModelHandle("deepseek", "deepseek-chat", answer("from b"));
        var c = new ScriptedModelHandle("groq", "llama", answer("from c"));

        var result = coordinator(a, b, c).attempt(attempt());

        assertEquals("from b", result.text());
        assertTrue(result.switched());
        assertEquals("deepseek", result.switchedTo().providerId());
        assertEquals("deepseek-chat", result.switchedTo().modelId());
        assertEquals(1, a.calls());
        assertEquals(1, b.calls());
        assertEquals(0, c.calls());
        assertEquals(1.0, metrics.failovers().count());
    }

    @Test
    void fatalFailureShortCircuits() {
        var fatal = new IllegalArgumentException("Invalid message schema");
        var a = new ScriptedModelHandle("openai", "gpt-4o", fatal);
        var b = new ScriptedModelHandle("deepseek", "deepseek-chat", answer("from b"));

        var thrown = assertThrows(IllegalArgumentException.class, () -> coordinator(a, b).attempt(attempt()));

        assertSame(fatal, thrown);
        assertEquals(0, b.calls());
    }

    @Test
    void promptTooLongIsRethrownWithoutFailover() {
        var overflow = ModelInvocationException.httpError("openai", 400,
                "{\"error\":{\"code\":\"context_length_exceeded\"}}");
        var a = new ScriptedModelHandle("openai", "gpt-4o", overflow);
        var b = new ScriptedModelHandle("deepseek", "deepseek-chat", answer("from b"));

        var thrown = assertThrows(ModelInvocationException.class, () -> coordinator(a, b).attempt(attempt()));

        assertSame(overflow, thrown);
        assertEquals(0, b.calls());
    }

    @Test
    void lastCandidateErrorIsRethrown() {
        var first = ModelInvocationException.httpError("openai", 503, "Service Unavailable");
        var last = ModelInvocationException.httpError("deepseek", 502, "Bad Gateway");
        var a = new ScriptedModelHandle("openai", "gpt-4o", first);
        var b = new ScriptedModelHandle("deepseek", "deepseek-chat", last);

        var thrown = assertThrows(ModelInvocationException.class, () -> coordinator(a, b).attempt(attempt()));

        assertSame(last, thrown);
        assertEquals(1, a.calls());
        assertEquals(1, b.calls());
    }

    @Test
    void eachCandidateTriedAtMostOnce() {
        var a = new ScriptedModelHandle("openai", "gpt-4o",
                ModelInvocationException.httpError("openai", 500, "Internal Server Error"),
                answer("would be a retry"));
        var b = new ScriptedModelHandle("deepseek", "deepseek-chat",
                ModelInvocationException.httpError("deepseek", 500, "Internal Server Error"),
                answer("would be a retry"));

        assertThrows(ModelInvocationException.class, () -> coordinator(a, b).attempt(attempt()));
        assertEquals(1, a.calls());
        assertEquals(1, b.calls());
    }

    @Test
    void countsAttemptsPerCandidate() {
        var a = new ScriptedModelHandle("openai", "gpt-4o",
                ModelInvocationException.httpError("openai", 529, "overloaded"));
        var b = new ScriptedModelHandle("deepseek", "deepseek-chat", answer("ok"));

        coordinator(a, b).attempt(attempt());

        assertEquals(1.0, metrics.attempts("openai/gpt-4o").count());
        assertEquals(1.0, metrics.attempts("deepseek/deepseek-chat").count());
    }

    @Test
    void cancellationPropagatesWithoutFailover() {
        var a = new ScriptedModelHandle("openai", "gpt-4o", new CancellationException("stopped"));
        var b = new ScriptedModelHandle("deepseek", "deepseek-chat", answer("from b"));

        assertThrows(CancellationException.class, () -> coordinator(a, b).attempt(attempt()));
        assertEquals(0, b.calls());
    }

    @Test
    void rejectsEmptyCandidateList() {
        assertThrows(IllegalArgumentException.class,
                () -> new FailoverCoordinator(List.of(), new StepExecutor(metrics, 100),
                        new PatternErrorClassifier(), metrics));
    }
}
