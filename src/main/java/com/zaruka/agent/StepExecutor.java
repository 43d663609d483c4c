package com.zaruka.agent;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zaruka.observability.AssistantMetrics;
import com.zaruka.providers.ModelHandle;
import com.zaruka.providers.ModelInvocationException;
import com.zaruka.providers.ModelRequest;
import com.zaruka.providers.ModelResponse;
import com.zaruka.providers.ToolDefinition;
import com.zaruka.shared.model.ChatMessage;
import com.zaruka.shared.model.TokenUsage;
import com.zaruka.shared.model.ToolCallInfo;
import com.zaruka.tools.Tool;
import com.zaruka.tools.ToolRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.UndeclaredThrowableException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.function.Consumer;

/**
 * Runs one attempt against one model: up to {@code maxRounds} rounds of
 * "model answers and/or calls tools, tool results go back to the model".
 */
public class StepExecutor {

    private static final Logger log = LoggerFactory.getLogger(StepExecutor.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final String ROUND_SEPARATOR = "\n\n";

    private final AssistantMetrics metrics;
    private final int maxOutputTokens;

    public StepExecutor(AssistantMetrics metrics, int maxOutputTokens) {
        this.metrics = metrics;
        this.maxOutputTokens = maxOutputTokens;
    }

    public StepResult run(ModelHandle model, String systemPrompt, List<ChatMessage> messages,
                          ToolRegistry tools, int maxRounds, CancellationToken cancellation) {
        return execute(model, systemPrompt, messages, tools, maxRounds, cancellation, null);
    }

    /**
     * Streaming variant. {@code onTextDelta} receives every non-empty fragment
     * synchronously, in generation order, with a blank line between rounds that produced text.
     */
    public StepResult runStream(ModelHandle model, String systemPrompt, List<ChatMessage> messages,
                                ToolRegistry tools, int maxRounds, CancellationToken cancellation,
                                Consumer<String> onTextDelta) {
        return execute(model, systemPrompt, messages, tools, maxRounds, cancellation, onTextDelta);
    }

    private StepResult execute(ModelHandle model, String systemPrompt, List<ChatMessage> messages,
                               ToolRegistry tools, int maxRounds, CancellationToken cancellation,
                               Consumer<String> onTextDelta) {
        var conversation = new ArrayList<>(messages);
        var toolDefs = buildToolsDef(tools);
        var roundTexts = new ArrayList<String>();
        var usage = TokenUsage.ZERO;
        boolean usedTools = false;
        String terminal = "";
        RuntimeException captured = null;
        boolean streamedText = false;

        for (int round = 0; round < maxRounds; round++) {
            cancellation.throwIfCancelled();
            var request = new ModelRequest(systemPrompt, conversation, toolDefs, maxOutputTokens);
            var sink = onTextDelta == null ? null : new RoundSink(onTextDelta, streamedText);
            ModelResponse resp;
            try {
                resp = sink == null ? model.chat(request) : model.chatStream(request, sink);
            } catch (CancellationException e) {
                throw e;
            } catch (RuntimeException e) {
                captured = lowestLevel(e, model.providerId());
                terminal = "";
                log.debug("Round {} on {} failed: {}", round + 1, model.modelId(), captured.getMessage());
                break;
            }

            if (sink != null && sink.emitted) streamedText = true;
            usage = usage.plus(resp.usage());
            roundTexts.add(resp.content());
            terminal = resp.content();
            if (resp.hasError()) {
                captured = resp.error();
                terminal = "";
                log.debug("Round {} on {} reported error: {}", round + 1, model.modelId(), captured.getMessage());
                break;
            }
            if (!resp.hasToolCalls()) {
                break;
            }

            usedTools = true;
            conversation.add(ChatMessage.assistant(resp.content(), resp.toolCalls()));
            for (var tc : resp.toolCalls()) {
                cancellation.throwIfCancelled();
                conversation.add(ChatMessage.toolResult(tc.id(), executeTool(tools, tc)));
            }
            if (round == maxRounds - 1) {
                log.warn("Round cap of {} reached on {} while the model was still calling tools",
                        maxRounds, model.modelId());
            }
        }

        var text = !terminal.isEmpty() ? terminal : joinNonEmpty(roundTexts);
        if (text.isEmpty()) {
            if (captured != null) throw captured;
            // empty success, counted apart from real answers
            metrics.emptyResponses().increment();
            log.warn("Model {} returned an empty response (usedTools={}, rounds={})",
                    model.modelId(), usedTools, roundTexts.size());
        } else if (captured != null) {
            log.warn("Returning partial text from {} after generation error: {}",
                    model.modelId(), captured.getMessage());
        }
        return new StepResult(text, usedTools, usage);
    }

    private List<ToolDefinition> buildToolsDef(ToolRegistry tools) {
        if (tools == null || tools.isEmpty()) return List.of();
        var defs = new ArrayList<ToolDefinition>();
        for (Tool t : tools.all()) {
            defs.add(new ToolDefinition(t.name(), t.description(), t.inputSchema()));
        }
        return defs;
    }

    private String executeTool(ToolRegistry tools, ToolCallInfo call) {
        if (tools == null) return "[ERROR] No tools registered";
        var tool = tools.get(call.name());
        if (tool == null) return "[ERROR] Unknown tool: " + call.name();
        metrics.toolExecutions(call.name()).increment();
        try {
            var args = call.arguments() == null || call.arguments().isBlank() ? "{}" : call.arguments();
            var result = tool.execute(MAPPER.readTree(args));
            return result.isError() ? "[ERROR] " + result.output() : result.output();
        } catch (Exception e) {
            log.warn("Tool {} failed: {}", call.name(), e.getMessage());
            return "[ERROR] " + e.getMessage();
        }
    }

    private static String joinNonEmpty(List<String> texts) {
        var parts = new ArrayList<String>();
        for (var t : texts) {
            if (t != null && !t.isEmpty()) parts.add(t);
        }
        return String.join(ROUND_SEPARATOR, parts);
    }

    /**
     * Forwards one round's deltas. A round that follows streamed text opens with
     * {@link #ROUND_SEPARATOR}, so the deltas add up to the joined round texts.
     */
    private static final class RoundSink implements Consumer<String> {
        private final Consumer<String> target;
        private final boolean separate;
        private boolean emitted;

        RoundSink(Consumer<String> target, boolean separate) {
            this.target = target;
            this.separate = separate;
        }

        @Override
        public void accept(String delta) {
            if (delta == null || delta.isEmpty()) return;
            if (!emitted && separate) target.accept(ROUND_SEPARATOR);
            emitted = true;
            target.accept(delta);
        }
    }

    /**
     * Strips generic wrappers so the provider's own error is what surfaces.
     */
    static RuntimeException lowestLevel(Throwable error, String providerId) {
        Throwable cur = error;
        while (cur.getCause() != null && cur.getCause() != cur && isWrapper(cur)) {
            cur = cur.getCause();
        }
        if (cur instanceof RuntimeException re) return re;
        return new ModelInvocationException(providerId, 0,
                cur.getMessage() != null ? cur.getMessage() : cur.getClass().getSimpleName(), cur);
    }

    private static boolean isWrapper(Throwable t) {
        return t instanceof CompletionException
                || t instanceof ExecutionException
                || t instanceof UndeclaredThrowableException
                || t instanceof InvocationTargetException
                || t.getClass() == RuntimeException.class;
    }
}
