package com.zaruka.agent;

/**
 * Diagnostic record of one failover attempt. Only logged.
 */
public record AttemptOutcome(
    String providerLabel,
    boolean succeeded,
    Throwable error
) {
    static AttemptOutcome success(String label) {
        return new AttemptOutcome(label, true, null);
    }

    static AttemptOutcome failure(String label, Throwable error) {
        return new AttemptOutcome(label, false, error);
    }

    @Override
    public String toString() {
        return succeeded ? providerLabel + ": ok" : providerLabel + ": " + error.getMessage();
    }
}
