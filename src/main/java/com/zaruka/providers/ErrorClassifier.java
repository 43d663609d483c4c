package com.zaruka.providers;

/**
 * Decides how the agent reacts to a failed attempt.
 */
@FunctionalInterface
public interface ErrorClassifier {

    ErrorCategory classify(Throwable error);

    default boolean isPromptTooLong(Throwable error) {
        return classify(error) == ErrorCategory.PROMPT_TOO_LONG;
    }

    default boolean isRetriable(Throwable error) {
        return classify(error) == ErrorCategory.RETRIABLE;
    }
}
