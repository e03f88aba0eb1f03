package com.neowatch.alert.evaluator;

/**
 * Per-rule state within one alert cycle: {@code IDLE → CHECKING → (TRIGGERED | IDLE)}.
 */
public enum AlertRuleState {
    IDLE,
    CHECKING,
    TRIGGERED
}
