package com.neowatch.alert.evaluator;

import com.neowatch.alert.notification.AlertMessageFormatter;
import com.neowatch.alert.notification.NotificationSender;
import com.neowatch.alert.repository.AlertRuleRepository;
import com.neowatch.common.model.AlertRule;
import com.neowatch.common.model.FeedSnapshot;
import com.neowatch.common.model.ScoredNearEarthObject;
import com.neowatch.feed.provider.NeoFeedProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Compares active alert rules against the scored feed and notifies users.
 *
 * <p>One cycle fetches the snapshot for {@code today..today+lookahead} through the
 * cached feed provider, then checks rules one after another. A rule whose asteroid is
 * in the feed triggers when the closest approach is within its distance threshold or
 * scores at least its risk threshold, unless it already fired within the cooldown
 * window. On trigger the user is notified first and only then is
 * {@code lastTriggeredAt} recorded, so a failed notification is retried next cycle.
 *
 * <p>Rules are only judged against real feed data. When the feed could only be served
 * from the static sample set, every rule is left untouched for that cycle.
 *
 * <p>Failures never escape a cycle: a repository or feed error yields
 * {@link AlertCycleReport#empty()}, and a failure on one rule does not stop the rest.
 */
@Component
public class AlertEvaluator {

    private static final Logger log = LoggerFactory.getLogger(AlertEvaluator.class);

    private final NeoFeedProvider feedProvider;
    private final AlertRuleRepository repository;
    private final NotificationSender notificationSender;
    private final Clock clock;
    private final Duration cooldown;
    private final int lookaheadDays;

    public AlertEvaluator(NeoFeedProvider feedProvider,
                          AlertRuleRepository repository,
                          NotificationSender notificationSender,
                          Clock clock,
                          @Value("${neo.alerts.cooldown-hours:24}") long cooldownHours,
                          @Value("${neo.alerts.lookahead-days:1}") int lookaheadDays,
                          @Value("${neo.feed.max-range-days:7}") int maxRangeDays) {
        if (cooldownHours < 0) {
            throw new IllegalArgumentException("cooldown-hours must be >= 0, got " + cooldownHours);
        }
        if (lookaheadDays < 0) {
            throw new IllegalArgumentException("lookahead-days must be >= 0, got " + lookaheadDays);
        }
        if (lookaheadDays + 1 > maxRangeDays) {
            throw new IllegalArgumentException("neo.alerts.lookahead-days=" + lookaheadDays
                + " needs a " + (lookaheadDays + 1) + "-day feed but neo.feed.max-range-days=" + maxRangeDays);
        }
        this.feedProvider       = feedProvider;
        this.repository         = repository;
        this.notificationSender = notificationSender;
        this.clock              = clock;
        this.cooldown           = Duration.ofHours(cooldownHours);
        this.lookaheadDays      = lookaheadDays;
    }

    public Mono<AlertCycleReport> runAlertCycle() {
        return Mono.defer(() -> {
            Instant now = clock.instant();
            LocalDate today = LocalDate.now(clock);

            return repository.listActive()
                .filter(AlertRule::active)
                .collectList()
                .flatMap(rules -> {
                    if (rules.isEmpty()) {
                        log.debug("ALERT_CYCLE_NO_RULES");
                        return Mono.just(AlertCycleReport.empty());
                    }
                    return feedProvider.fetchFeed(today, today.plusDays(lookaheadDays))
                        .flatMap(snapshot -> evaluateAll(rules, snapshot, now));
                })
                .onErrorResume(e -> {
                    log.error("ALERT_CYCLE_SKIPPED reason={}", e.getMessage(), e);
                    return Mono.just(AlertCycleReport.empty());
                });
        });
    }

    private Mono<AlertCycleReport> evaluateAll(List<AlertRule> rules, FeedSnapshot snapshot, Instant now) {
        if (!snapshot.realData()) {
            log.warn("ALERT_CYCLE_NO_REAL_DATA status={} rules={}", snapshot.status(), rules.size());
            List<RuleOutcome> skipped = rules.stream().map(rule -> RuleOutcome.SKIPPED_NO_REAL_DATA).toList();
            return Mono.just(AlertCycleReport.of(skipped, snapshot.status()));
        }
        if (snapshot.status().isDegraded()) {
            log.warn("ALERT_CYCLE_DEGRADED_FEED status={}", snapshot.status());
        }
        return Flux.fromIterable(rules)
            .concatMap(rule -> evaluate(rule, snapshot, now))
            .collectList()
            .map(outcomes -> AlertCycleReport.of(outcomes, snapshot.status()));
    }

    Mono<RuleOutcome> evaluate(AlertRule rule, FeedSnapshot snapshot, Instant now) {
        log.debug("ALERT_RULE_STATE rule={} state={}", rule.id(), AlertRuleState.CHECKING);

        Optional<ScoredNearEarthObject> match = snapshot.findClosest(rule.asteroidId());
        if (match.isEmpty()) {
            return done(rule, RuleOutcome.UNMATCHED);
        }
        ScoredNearEarthObject object = match.get();
        if (!thresholdMet(rule, object)) {
            return done(rule, RuleOutcome.BELOW_THRESHOLD);
        }
        if (!cooldownElapsed(rule, now)) {
            log.info("ALERT_SUPPRESSED rule={} asteroid={} lastTriggeredAt={}",
                     rule.id(), rule.asteroidId(), rule.lastTriggeredAt());
            return done(rule, RuleOutcome.SUPPRESSED_BY_COOLDOWN);
        }

        return notificationSender.notify(rule.userId(),
                                         AlertMessageFormatter.subject(object),
                                         AlertMessageFormatter.body(rule, object))
            .then(Mono.defer(() -> repository.recordTrigger(rule.id(), now)))
            .doOnSuccess(v -> log.info(
                "ALERT_TRIGGERED rule={} user={} asteroid={} distanceKm={} score={}",
                rule.id(), rule.userId(), rule.asteroidId(),
                object.object().missDistanceKm(), object.score()))
            .then(done(rule, RuleOutcome.TRIGGERED))
            .onErrorResume(e -> {
                log.error("ALERT_NOTIFY_FAILED rule={} user={}", rule.id(), rule.userId(), e);
                return done(rule, RuleOutcome.FAILED);
            });
    }

    static boolean thresholdMet(AlertRule rule, ScoredNearEarthObject object) {
        return object.object().missDistanceKm() <= rule.thresholdDistanceKm()
            || object.score() >= rule.thresholdRiskScore();
    }

    boolean cooldownElapsed(AlertRule rule, Instant now) {
        Instant last = rule.lastTriggeredAt();
        return last == null || !now.isBefore(last.plus(cooldown));
    }

    private static Mono<RuleOutcome> done(AlertRule rule, RuleOutcome outcome) {
        return Mono.fromSupplier(() -> {
            log.debug("ALERT_RULE_STATE rule={} state={} outcome={}", rule.id(), outcome.endState(), outcome);
            return outcome;
        });
    }
}
