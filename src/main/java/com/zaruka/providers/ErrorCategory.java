package com.zaruka.providers;

public enum ErrorCategory {
    /** The request overflowed the model's context window. */
    PROMPT_TOO_LONG,
    /** Provider or network trouble; another provider may succeed. */
    RETRIABLE,
    /** Anything else. Never retried. */
    FATAL
}
