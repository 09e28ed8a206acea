package com.loanorigination.rules;

/**
 * Correlation ids carried into the engine's log lines.
 */
public record ExecutionOptions(String requestId, String applicationId) {

    public static ExecutionOptions none() {
        return new ExecutionOptions(null, null);
    }

    public static ExecutionOptions forApplication(String applicationId) {
        return new ExecutionOptions(null, applicationId);
    }
}
