package com.neowatch.alert.evaluator;

/**
 * How a single rule left its check.
 */
public enum RuleOutcome {

    /** Threshold met outside the cooldown window; user notified and trigger recorded. */
    TRIGGERED(AlertRuleState.TRIGGERED),
    /** Threshold met but the rule fired within the cooldown window. */
    SUPPRESSED_BY_COOLDOWN(AlertRuleState.IDLE),
    /** The rule's asteroid is not part of the current feed. */
    UNMATCHED(AlertRuleState.IDLE),
    BELOW_THRESHOLD(AlertRuleState.IDLE),
    /** Notification or trigger recording failed; retried on the next cycle. */
    FAILED(AlertRuleState.IDLE),
    /** Not checked: the feed held only sample data. */
    SKIPPED_NO_REAL_DATA(AlertRuleState.IDLE);

    private final AlertRuleState endState;

    RuleOutcome(AlertRuleState endState) {
        this.endState = endState;
    }

    public AlertRuleState endState() {
        return endState;
    }
}
