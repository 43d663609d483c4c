package com.zaruka.agent;

import com.zaruka.observability.AssistantMetrics;
import com.zaruka.providers.ErrorCategory;
import com.zaruka.providers.ErrorClassifier;
import com.zaruka.providers.ModelHandle;
import com.zaruka.shared.model.ChatMessage;
import com.zaruka.shared.model.ProviderConfig;
import com.zaruka.tools.ToolRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.function.Consumer;

/**
 * Tries the primary model, then each fallback in order, moving on only after a
 * retriable failure. Candidates are never raced and never tried twice.
 * Context overflows are rethrown for the caller to handle.
 */
public class FailoverCoordinator {

    private static final Logger log = LoggerFactory.getLogger(FailoverCoordinator.class);

    private final List<Candidate> candidates;
    private final StepExecutor executor;
    private final ErrorClassifier classifier;
    private final AssistantMetrics metrics;

    public FailoverCoordinator(List<Candidate> candidates, StepExecutor executor,
                               ErrorClassifier classifier, AssistantMetrics metrics) {
        if (candidates.isEmpty()) throw new IllegalArgumentException("At least one model candidate is required");
        this.candidates = List.copyOf(candidates);
        this.executor = executor;
        this.classifier = classifier;
        this.metrics = metrics;
    }

    public List<Candidate> candidates() {
        return candidates;
    }

    public ProcessResult attempt(Attempt request) {
        var outcomes = new ArrayList<AttemptOutcome>();
        for (int i = 0; i < candidates.size(); i++) {
            request.cancellation().throwIfCancelled();
            var candidate = candidates.get(i);
            var label = candidate.config().label();
            metrics.attempts(label).increment();
            try {
                var step = request.onTextDelta() == null
                        ? executor.run(candidate.handle(), request.systemPrompt(), request.messages(),
                                request.tools(), request.maxRounds(), request.cancellation())
                        : executor.runStream(candidate.handle(), request.systemPrompt(), request.messages(),
                                request.tools(), request.maxRounds(), request.cancellation(), request.onTextDelta());
                outcomes.add(AttemptOutcome.success(label));
                var primary = i == 0;
                if (!primary) {
                    metrics.failovers().increment();
                    log.info("Recovered via {} after {}", label, outcomes);
                }
                return new ProcessResult(step.text(), primary ? null : candidate.config(),
                        step.usage(), candidate.config(), step.usedTools());
            } catch (CancellationException e) {
                throw e;
            } catch (RuntimeException e) {
                outcomes.add(AttemptOutcome.failure(label, e));
                var category = classifier.classify(e);
                var last = i == candidates.size() - 1;
                log.warn("Attempt {}/{} via {} failed ({}): {}", i + 1, candidates.size(), label, category, e.getMessage());
                if (category == ErrorCategory.RETRIABLE && !last) {
                    continue;
                }
                if (outcomes.size() > 1) {
                    log.warn("Giving up after {}", outcomes);
                }
                throw e;
            }
        }
        throw new IllegalStateException("unreachable");
    }

    /**
     * A provider config with its handle, resolved once when the assistant is built.
     */
    public record Candidate(ProviderConfig config, ModelHandle handle) {}

    /**
     * Input shared by every candidate of one pass. {@code onTextDelta} is null for buffered calls.
     */
    public record Attempt(
        String systemPrompt,
        List<ChatMessage> messages,
        ToolRegistry tools,
        int maxRounds,
        CancellationToken cancellation,
        Consumer<String> onTextDelta
    ) {}
}
