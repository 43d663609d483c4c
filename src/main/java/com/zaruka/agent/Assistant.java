package com.zaruka.agent;

import com.zaruka.observability.AssistantMetrics;
import com.zaruka.observability.UsageRecorder;
import com.zaruka.providers.DefaultModelHandleFactory;
import com.zaruka.providers.ErrorClassifier;
import com.zaruka.providers.ModelHandleFactory;
import com.zaruka.providers.PatternErrorClassifier;
import com.zaruka.shared.config.AgentSettings;
import com.zaruka.shared.config.ZarukaConfig;
import com.zaruka.shared.model.Attachment;
import com.zaruka.shared.model.ChatMessage;
import com.zaruka.shared.model.ConversationTurn;
import com.zaruka.shared.model.ProviderConfig;
import com.zaruka.shared.model.UsageEvent;
import com.zaruka.tools.ToolRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Consumer;

/**
 * Entry point of the agent core. Builds a bounded message list, runs it across
 * the configured models, retries once without history when the prompt
 * overflows, and reports usage once per successful call.
 *
 * <p>Holds no per-request state; concurrent calls for different conversations are independent.
 */
public class Assistant implements AgentOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(Assistant.class);

    private final AgentSettings settings;
    private final ToolRegistry tools;
    private final UsageRecorder usageRecorder;
    private final ErrorClassifier classifier;
    private final AssistantMetrics metrics;
    private final MessageBudgetBuilder budgetBuilder;
    private final FailoverCoordinator coordinator;

    public Assistant(List<ProviderConfig> attemptOrder, ModelHandleFactory handleFactory,
                     ToolRegistry tools, AgentSettings settings, UsageRecorder usageRecorder) {
        this(attemptOrder, handleFactory, tools, settings, usageRecorder,
                new PatternErrorClassifier(), new AssistantMetrics());
    }

    public Assistant(List<ProviderConfig> attemptOrder, ModelHandleFactory handleFactory,
                     ToolRegistry tools, AgentSettings settings, UsageRecorder usageRecorder,
                     ErrorClassifier classifier, AssistantMetrics metrics) {
        this.settings = settings;
        this.tools = tools != null ? tools : new ToolRegistry();
        this.usageRecorder = usageRecorder;
        this.classifier = classifier;
        this.metrics = metrics;
        this.budgetBuilder = new MessageBudgetBuilder(settings);

        var candidates = new ArrayList<FailoverCoordinator.Candidate>();
        for (var config : attemptOrder) {
            candidates.add(new FailoverCoordinator.Candidate(config, handleFactory.create(config)));
        }
        this.coordinator = new FailoverCoordinator(candidates,
                new StepExecutor(metrics, settings.responseReserve()), classifier, metrics);
    }

    public static Assistant fromConfig(ZarukaConfig config, ToolRegistry tools, UsageRecorder usageRecorder) {
        if (!config.hasProvider()) {
            throw new IllegalStateException("No AI provider configured");
        }
        var settings = config.agent();
        return new Assistant(config.attemptOrder(), new DefaultModelHandleFactory(settings.requestTimeout()),
                tools, settings, usageRecorder);
    }

    public ProcessResult process(String userMessage) {
        return process(AssistantRequest.of(userMessage));
    }

    public ProcessResult process(String userMessage, List<ConversationTurn> history) {
        return process(AssistantRequest.of(userMessage, history));
    }

    public ProcessResult process(String userMessage, List<ConversationTurn> history, List<Attachment> attachments) {
        return process(new AssistantRequest(userMessage, history, attachments, null));
    }

    @Override
    public ProcessResult process(AssistantRequest request) {
        return run(request, null);
    }

    public ProcessResult processStream(String userMessage, List<ConversationTurn> history,
                                       List<Attachment> attachments, Consumer<String> onTextDelta) {
        return processStream(new AssistantRequest(userMessage, history, attachments, null), onTextDelta);
    }

    @Override
    public ProcessResult processStream(AssistantRequest request, Consumer<String> onTextDelta) {
        if (onTextDelta == null) throw new IllegalArgumentException("onTextDelta must not be null");
        return run(request, onTextDelta);
    }

    /**
     * Runs one request as one task on {@code executor}.
     */
    public CompletableFuture<ProcessResult> processAsync(AssistantRequest request, Executor executor) {
        return CompletableFuture.supplyAsync(() -> process(request), executor);
    }

    public ProviderConfig primary() {
        return coordinator.candidates().get(0).config();
    }

    private ProcessResult run(AssistantRequest request, Consumer<String> onTextDelta) {
        var sample = Timer.start(metrics.registry());
        try {
            var messages = buildMessages(request, request.history());
            ProcessResult result;
            try {
                result = coordinator.attempt(attempt(messages, request, onTextDelta));
            } catch (RuntimeException first) {
                if (!classifier.isPromptTooLong(first)) throw first;
                log.info("Prompt too long ({}), retrying with the current turn only", first.getMessage());
                metrics.promptTooLongRetries().increment();
                var truncated = buildMessages(request, List.of());
                try {
                    result = coordinator.attempt(attempt(truncated, request, onTextDelta));
                } catch (RuntimeException second) {
                    if (classifier.isPromptTooLong(second)) throw new PromptTooLongException(second);
                    throw second;
                }
            }
            reportUsage(result);
            return result;
        } finally {
            sample.stop(metrics.llmLatency());
        }
    }

    private List<ChatMessage> buildMessages(AssistantRequest request, List<ConversationTurn> history) {
        return budgetBuilder.build(settings.systemPrompt(), tools.names(), request.userMessage(),
                history, request.attachments());
    }

    private FailoverCoordinator.Attempt attempt(List<ChatMessage> messages, AssistantRequest request,
                                                Consumer<String> onTextDelta) {
        return new FailoverCoordinator.Attempt(settings.systemPrompt(), messages, tools,
                settings.maxRounds(), request.cancellation(), onTextDelta);
    }

    private void reportUsage(ProcessResult result) {
        var usage = result.usage();
        metrics.tokensUsed().increment(usage.total());
        if (usageRecorder == null) return;
        try {
            usageRecorder.report(new UsageEvent(result.servedBy().modelId(),
                    usage.inputTokens(), usage.outputTokens()));
        } catch (RuntimeException e) {
            log.error("Failed to record usage", e);
        }
    }
}
