package com.neowatch.alert.repository;

import com.neowatch.common.model.AlertRule;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Comparator;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local rule store used when no external persistence is wired in.
 */
@Repository
public class InMemoryAlertRuleRepository implements AlertRuleRepository {

    private final Map<String, AlertRule> rules = new ConcurrentHashMap<>();

    public void save(AlertRule rule) {
        rules.put(rule.id(), rule);
    }

    public Optional<AlertRule> findById(String ruleId) {
        if (ruleId == null || ruleId.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(rules.get(ruleId));
    }

    @Override
    public Flux<AlertRule> listActive() {
        return Flux.defer(() -> Flux.fromIterable(rules.values().stream()
            .filter(AlertRule::active)
            .sorted(Comparator.comparing(AlertRule::id))
            .toList()));
    }

    @Override
    public Mono<Void> recordTrigger(String ruleId, Instant when) {
        return Mono.fromRunnable(() -> rules.computeIfPresent(ruleId, (id, rule) -> rule.withLastTriggeredAt(when)));
    }
}
