package com.loanorigination.rules;

import com.loanorigination.exception.ConditionEvaluationException;
import com.loanorigination.exception.RuleDefinitionException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Generic rule engine.
 *
 * Runs every registered rule against a snapshot in registration order,
 * buckets the outcomes whose condition held, accumulates their scores and
 * derives a categorical decision.
 *
 * FAULT ISOLATION:
 * ================
 * A rule whose condition throws is recorded as a FAILED outcome with HIGH
 * severity and the remaining rules still run. One bad rule never aborts a
 * whole evaluation.
 *
 * DECISION (first match wins):
 * ============================
 * 1. Any failed outcome at HIGH or CRITICAL severity -> REJECT
 * 2. Any other failed outcome                        -> CONDITIONAL
 * 3. Any conditional flag                            -> CONDITIONAL
 * 4. Any passed outcome                              -> APPROVE
 * 5. Nothing fired                                   -> PENDING
 *
 * THREAD SAFETY:
 * ==============
 * executeRules builds a fresh result on every call and never mutates the
 * rule list, so concurrent evaluations of different snapshots are safe.
 * Only the last-result pointer used by getSummary is shared.
 *
 * @param <S> snapshot type the rules read
 */
@Slf4j
public class RuleEngine<S extends RuleSnapshot> {

    private final String name;
    private final List<Rule<S>> rules = new CopyOnWriteArrayList<>();
    private volatile ExecutionResult lastResult = ExecutionResult.empty();

    public RuleEngine(String name) {
        this.name = name;
    }

    public RuleEngine(String name, List<Rule<S>> rules) {
        this(name);
        rules.forEach(this::addRule);
    }

    public String getName() {
        return name;
    }

    /**
     * Register a rule. Ids must be unique within the engine.
     *
     * @throws RuleDefinitionException if the rule is null or its id is taken
     */
    public synchronized void addRule(Rule<S> rule) {
        if (rule == null) {
            throw new RuleDefinitionException("Rule must have id, condition, and action properties");
        }
        boolean duplicate = rules.stream().anyMatch(existing -> existing.id().equals(rule.id()));
        if (duplicate) {
            throw new RuleDefinitionException("Duplicate rule id '" + rule.id() + "' in engine " + name);
        }
        rules.add(rule);
        log.debug("Registered rule {} in engine {}", rule.id(), name);
    }

    public List<Rule<S>> getRules() {
        return Collections.unmodifiableList(rules);
    }

    public ExecutionResult executeRules(S snapshot) {
        return executeRules(snapshot, ExecutionOptions.none());
    }

    public ExecutionResult executeRules(S snapshot, ExecutionOptions options) {
        if (snapshot == null) {
            throw new IllegalArgumentException("Snapshot cannot be null");
        }
        ExecutionOptions opts = options != null ? options : ExecutionOptions.none();

        List<RuleOutcome> passed = new ArrayList<>();
        List<RuleOutcome> failed = new ArrayList<>();
        List<RuleOutcome> warnings = new ArrayList<>();
        List<RuleOutcome> flags = new ArrayList<>();
        long rawScore = 0;

        for (Rule<S> rule : rules) {
            RuleOutcome outcome;
            try {
                outcome = executeRule(rule, snapshot);
            } catch (ConditionEvaluationException e) {
                log.warn("Engine {} rule {} failed [requestId={}, applicationId={}]: {}",
                        name, rule.id(), opts.requestId(), opts.applicationId(), e.getMessage());
                failed.add(RuleOutcome.failure(rule, e));
                continue;
            }

            if (!outcome.conditionMet()) {
                continue;
            }

            switch (outcome.action().bucket()) {
                case PASSED -> passed.add(outcome);
                case FAILED -> failed.add(outcome);
                case WARNINGS -> warnings.add(outcome);
                case FLAGS -> flags.add(outcome);
            }
            rawScore += outcome.score();
        }

        int score = clamp(rawScore);
        Decision decision = decide(passed, failed, flags);
        ExecutionResult result = new ExecutionResult(passed, failed, warnings, flags, score, decision);
        lastResult = result;

        log.info("Engine {} evaluated {} rules [requestId={}, applicationId={}]: decision={}, score={}, "
                        + "passed={}, failed={}, warnings={}, flags={}",
                name, rules.size(), opts.requestId(), opts.applicationId(), decision, score,
                passed.size(), failed.size(), warnings.size(), flags.size());
        return result;
    }

    /**
     * Evaluate one rule.
     *
     * @throws ConditionEvaluationException if the condition throws
     */
    RuleOutcome executeRule(Rule<S> rule, S snapshot) {
        try {
            boolean met = rule.condition().evaluate(snapshot);
            log.debug("Rule {} condition={}", rule.id(), met);
            return RuleOutcome.evaluated(rule, met);
        } catch (RuntimeException e) {
            throw new ConditionEvaluationException(rule.id(), e);
        }
    }

    static Decision decide(List<RuleOutcome> passed, List<RuleOutcome> failed, List<RuleOutcome> flags) {
        if (failed.stream().anyMatch(outcome -> outcome.severity().isBlocking())) {
            return Decision.REJECT;
        }
        if (!failed.isEmpty() || !flags.isEmpty()) {
            return Decision.CONDITIONAL;
        }
        if (!passed.isEmpty()) {
            return Decision.APPROVE;
        }
        return Decision.PENDING;
    }

    private static int clamp(long rawScore) {
        return (int) Math.max(ExecutionResult.MIN_SCORE, Math.min(ExecutionResult.MAX_SCORE, rawScore));
    }

    /**
     * Forget the last execution. Registered rules are kept.
     */
    public void resetResults() {
        lastResult = ExecutionResult.empty();
    }

    public ExecutionResult getLastResult() {
        return lastResult;
    }

    public ExecutionSummary getSummary() {
        ExecutionResult result = lastResult;
        return new ExecutionSummary(name, rules.size(),
                result.passed().size(), result.failed().size(),
                result.warnings().size(), result.flags().size(),
                result.score(), result.decision());
    }
}
