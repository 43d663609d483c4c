package com.zaruka.agent;

import com.zaruka.shared.model.ProviderConfig;
import com.zaruka.shared.model.TokenUsage;

/**
 * Reply of a top-level assistant call. {@code switchedTo} is non-null only when
 * a fallback, not the primary, produced the reply.
 */
public record ProcessResult(
    String text,
    ProviderConfig switchedTo,
    TokenUsage usage,
    ProviderConfig servedBy,
    boolean usedTools
) {
    public boolean switched() {
        return switchedTo != null;
    }
}
