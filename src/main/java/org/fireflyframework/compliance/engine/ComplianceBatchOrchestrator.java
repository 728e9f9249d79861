/*
 * Copyright 2024-2026 Firefly Software Solutions Inc
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.fireflyframework.compliance.engine;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.compliance.event.ComplianceEvaluationEvent;
import org.fireflyframework.compliance.exception.RuleEvaluationException;
import org.fireflyframework.compliance.model.BatchEvaluationResult;
import org.fireflyframework.compliance.model.ComplianceRule;
import org.fireflyframework.compliance.model.RuleEvaluationContext;
import org.fireflyframework.compliance.model.RuleEvaluationResult;
import org.fireflyframework.compliance.model.RuleFilter;
import org.fireflyframework.compliance.source.ComplianceRuleRepository;
import org.springframework.context.ApplicationEventPublisher;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Selects the rules of an organization, evaluates them through the
 * {@link ComplianceRuleEvaluator} and aggregates a {@link BatchEvaluationResult}.
 *
 * <p>All rules of a batch share one evaluation instant taken from the injected
 * {@link Clock} at batch start. Rules are evaluated with bounded parallelism and
 * results keep selection order. A rule whose evaluation fails outright is counted as
 * skipped and never aborts the batch, so {@code totalRules == results + skipped}.</p>
 *
 * <p>When an {@link ApplicationEventPublisher} is provided, a
 * {@link ComplianceEvaluationEvent} is published after each batch.</p>
 */
@Slf4j
public class ComplianceBatchOrchestrator {

    static final Comparator<ComplianceRule> SEVERITY_THEN_NAME = Comparator
            .comparing(ComplianceRule::getSeverity, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(ComplianceRule::getName, Comparator.nullsLast(Comparator.naturalOrder()));

    private final ComplianceRuleRepository repository;
    private final ComplianceRuleEvaluator ruleEvaluator;
    private final Clock clock;
    private final int concurrency;
    private final ApplicationEventPublisher eventPublisher;

    /**
     * Creates an orchestrator without event publishing.
     *
     * @param repository    the rule store
     * @param ruleEvaluator the per-rule evaluator
     * @param clock         source of the batch evaluation instant
     * @param concurrency   maximum number of rules evaluated at once
     */
    public ComplianceBatchOrchestrator(ComplianceRuleRepository repository, ComplianceRuleEvaluator ruleEvaluator,
                                       Clock clock, int concurrency) {
        this(repository, ruleEvaluator, clock, concurrency, null);
    }

    /**
     * Creates an orchestrator with an optional event publisher.
     *
     * @param repository     the rule store
     * @param ruleEvaluator  the per-rule evaluator
     * @param clock          source of the batch evaluation instant
     * @param concurrency    maximum number of rules evaluated at once
     * @param eventPublisher the event publisher, or {@code null} to disable event publishing
     */
    public ComplianceBatchOrchestrator(ComplianceRuleRepository repository, ComplianceRuleEvaluator ruleEvaluator,
                                       Clock clock, int concurrency, ApplicationEventPublisher eventPublisher) {
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be at least 1, was " + concurrency);
        }
        this.repository = repository;
        this.ruleEvaluator = ruleEvaluator;
        this.clock = clock;
        this.concurrency = concurrency;
        this.eventPublisher = eventPublisher;
    }

    /**
     * Evaluates every active rule of the organization that matches the filter,
     * ordered by severity (most severe first) and then name.
     *
     * @param organizationId the organization
     * @param filter         optional framework/category/frequency filter
     * @param dryRun         when {@code true}, no statistics are recorded
     * @return a {@link Mono} emitting the batch result
     */
    public Mono<BatchEvaluationResult> evaluateAll(String organizationId, RuleFilter filter, boolean dryRun) {
        RuleFilter effectiveFilter = filter != null ? filter : RuleFilter.none();
        return Mono.defer(() -> {
            Instant evaluationTime = clock.instant();
            return repository.findActiveRules(organizationId, effectiveFilter)
                    .filter(ComplianceRule::isActive)
                    .filter(effectiveFilter::matches)
                    .sort(SEVERITY_THEN_NAME)
                    .collectList()
                    .flatMap(rules -> runBatch(organizationId, rules, evaluationTime, dryRun));
        });
    }

    /**
     * Evaluates the organization's rules whose check interval has elapsed. Statistics
     * are always recorded.
     *
     * @param organizationId the organization
     * @return a {@link Mono} emitting the batch result
     */
    public Mono<BatchEvaluationResult> evaluateDue(String organizationId) {
        return Mono.defer(() -> {
            Instant evaluationTime = clock.instant();
            return repository.findDueRules(organizationId, evaluationTime)
                    .filter(rule -> rule.isDueAt(evaluationTime))
                    .collectList()
                    .flatMap(rules -> {
                        log.debug("Found {} due rules for organization {}", rules.size(), organizationId);
                        return runBatch(organizationId, rules, evaluationTime, false);
                    });
        });
    }

    /**
     * Evaluates a caller-supplied list of rules in the given order. Inactive rules are
     * left out of the batch.
     *
     * @param organizationId the organization
     * @param rules          the rules to evaluate
     * @param dryRun         when {@code true}, no statistics are recorded
     * @return a {@link Mono} emitting the batch result
     */
    public Mono<BatchEvaluationResult> evaluateRules(String organizationId, List<ComplianceRule> rules, boolean dryRun) {
        List<ComplianceRule> snapshot = rules != null
                ? rules.stream().filter(ComplianceRule::isActive).toList()
                : List.of();
        return Mono.defer(() -> runBatch(organizationId, snapshot, clock.instant(), dryRun));
    }

    private Mono<BatchEvaluationResult> runBatch(String organizationId, List<ComplianceRule> rules,
                                                 Instant evaluationTime, boolean dryRun) {
        long startTime = System.currentTimeMillis();
        RuleEvaluationContext context = RuleEvaluationContext.builder()
                .organizationId(organizationId)
                .evaluationTime(evaluationTime)
                .dryRun(dryRun)
                .build();

        return Flux.fromIterable(rules)
                .flatMapSequential(rule -> evaluateIsolated(rule, context), concurrency)
                .collectList()
                .map(outcomes -> buildBatch(organizationId, evaluationTime, rules.size(), outcomes, startTime))
                .doOnNext(batch -> {
                    log.info("Evaluated {} compliance rules for organization {}: {} passed, {} failed, {} skipped in {}ms",
                            batch.getTotalRules(), organizationId, batch.getPassedRules(),
                            batch.getFailedRules(), batch.getSkippedRules(), batch.getExecutionTimeMs());
                    publishEvent(batch, dryRun);
                });
    }

    private Mono<Optional<RuleEvaluationResult>> evaluateIsolated(ComplianceRule rule, RuleEvaluationContext context) {
        return Mono.defer(() -> ruleEvaluator.evaluateRule(rule, context))
                .map(Optional::of)
                .switchIfEmpty(Mono.error(new IllegalStateException("Rule evaluator produced no result")))
                .onErrorResume(error -> {
                    RuleEvaluationException failure = new RuleEvaluationException(rule.getId(), error);
                    log.warn("Skipping rule {}: {}", rule.getName(), failure.getMessage());
                    return Mono.just(Optional.empty());
                });
    }

    private static BatchEvaluationResult buildBatch(String organizationId, Instant evaluationTime, int totalRules,
                                                    List<Optional<RuleEvaluationResult>> outcomes, long startTime) {
        List<RuleEvaluationResult> results = new ArrayList<>();
        int passed = 0;
        int failed = 0;
        int skipped = 0;

        for (Optional<RuleEvaluationResult> outcome : outcomes) {
            if (outcome.isEmpty()) {
                skipped++;
                continue;
            }
            RuleEvaluationResult result = outcome.get();
            results.add(result);
            if (result.isPassed()) {
                passed++;
            } else {
                failed++;
            }
        }

        return BatchEvaluationResult.builder()
                .organizationId(organizationId)
                .evaluatedAt(evaluationTime)
                .totalRules(totalRules)
                .passedRules(passed)
                .failedRules(failed)
                .skippedRules(skipped)
                .results(List.copyOf(results))
                .executionTimeMs(System.currentTimeMillis() - startTime)
                .build();
    }

    private void publishEvent(BatchEvaluationResult batch, boolean dryRun) {
        if (eventPublisher == null) {
            return;
        }
        try {
            eventPublisher.publishEvent(new ComplianceEvaluationEvent(batch, dryRun));
        } catch (RuntimeException e) {
            log.warn("Failed to publish compliance evaluation event for organization {}: {}",
                    batch.getOrganizationId(), e.getMessage(), e);
        }
    }
}
