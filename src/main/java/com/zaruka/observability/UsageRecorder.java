package com.zaruka.observability;

import com.zaruka.shared.model.UsageEvent;

/**
 * Receives one event per successful assistant call. Must tolerate concurrent calls.
 */
@FunctionalInterface
public interface UsageRecorder {
    void report(UsageEvent event);
}
