package com.neowatch.alert.repository;

import com.neowatch.common.model.AlertRule;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;

/**
 * Storage port for alert rules. The alert evaluator reads active rules and reports
 * triggers back; it never creates or deletes rules.
 */
public interface AlertRuleRepository {

    Flux<AlertRule> listActive();

    /**
     * Sets {@code lastTriggeredAt} of the rule to {@code when}. Completes empty when the
     * rule no longer exists.
     */
    Mono<Void> recordTrigger(String ruleId, Instant when);
}
