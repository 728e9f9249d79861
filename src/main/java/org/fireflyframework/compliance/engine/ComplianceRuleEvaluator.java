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
import org.fireflyframework.compliance.evaluator.CustomRuleDispatcher;
import org.fireflyframework.compliance.evaluator.PatternRuleEvaluator;
import org.fireflyframework.compliance.evaluator.QueryRuleEvaluator;
import org.fireflyframework.compliance.evaluator.ThresholdRuleEvaluator;
import org.fireflyframework.compliance.evaluator.WorkflowRuleEvaluator;
import org.fireflyframework.compliance.exception.RuleEvaluationException;
import org.fireflyframework.compliance.exception.StatisticsPersistenceException;
import org.fireflyframework.compliance.model.ComplianceRule;
import org.fireflyframework.compliance.model.CustomRuleConfig;
import org.fireflyframework.compliance.model.EvaluationFinding;
import org.fireflyframework.compliance.model.EvaluationOutcome;
import org.fireflyframework.compliance.model.PatternRuleConfig;
import org.fireflyframework.compliance.model.QueryRuleConfig;
import org.fireflyframework.compliance.model.RuleConfig;
import org.fireflyframework.compliance.model.RuleEvaluationContext;
import org.fireflyframework.compliance.model.RuleEvaluationResult;
import org.fireflyframework.compliance.model.RuleWaiver;
import org.fireflyframework.compliance.model.ThresholdRuleConfig;
import org.fireflyframework.compliance.model.WorkflowRuleConfig;
import org.fireflyframework.compliance.source.ComplianceRuleRepository;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Evaluates a single {@link ComplianceRule} and records its statistics.
 *
 * <p>The returned {@link Mono} never signals an error for a failure inside the rule:
 * a broken configuration or collaborator produces a failing result instead. Statistics
 * are written only for real verdicts, never in dry-run mode and never when the
 * type evaluator reported a collaborator failure.</p>
 *
 * <p>Active waivers are recorded in {@code details.exceptions} but do not change the
 * verdict; interpreting them is left to the caller.</p>
 */
@Slf4j
public class ComplianceRuleEvaluator {

    private final ComplianceRuleRepository repository;
    private final QueryRuleEvaluator queryEvaluator;
    private final ThresholdRuleEvaluator thresholdEvaluator;
    private final PatternRuleEvaluator patternEvaluator;
    private final WorkflowRuleEvaluator workflowEvaluator;
    private final CustomRuleDispatcher customDispatcher;

    public ComplianceRuleEvaluator(ComplianceRuleRepository repository,
                                   QueryRuleEvaluator queryEvaluator,
                                   ThresholdRuleEvaluator thresholdEvaluator,
                                   PatternRuleEvaluator patternEvaluator,
                                   WorkflowRuleEvaluator workflowEvaluator,
                                   CustomRuleDispatcher customDispatcher) {
        this.repository = repository;
        this.queryEvaluator = queryEvaluator;
        this.thresholdEvaluator = thresholdEvaluator;
        this.patternEvaluator = patternEvaluator;
        this.workflowEvaluator = workflowEvaluator;
        this.customDispatcher = customDispatcher;
    }

    /**
     * Evaluates one rule in the given context.
     *
     * @param rule    the rule to evaluate
     * @param context the shared evaluation context
     * @return a {@link Mono} emitting the rule's result
     */
    public Mono<RuleEvaluationResult> evaluateRule(ComplianceRule rule, RuleEvaluationContext context) {
        long startTime = System.currentTimeMillis();

        if (!rule.isActive()) {
            log.debug("Skipping inactive rule {} ({})", rule.getId(), rule.getName());
            return Mono.just(buildResult(rule, context, startTime, false, "Rule is inactive", List.of(), List.of()));
        }

        return Mono.defer(() -> {
                    if (context.getEvaluationTime() == null) {
                        return Mono.error(new IllegalArgumentException("evaluationTime is required"));
                    }
                    List<String> waiverReasons = activeWaiverReasons(rule, context);
                    return dispatch(rule, context)
                            .flatMap(outcome -> record(rule, context, startTime, outcome, waiverReasons));
                })
                .onErrorResume(error -> {
                    String reason = RuleEvaluationException.describe(error);
                    log.warn("Rule {} ({}) could not be evaluated: {}", rule.getId(), rule.getName(), reason);
                    List<String> waiverReasons = context.getEvaluationTime() != null
                            ? activeWaiverReasons(rule, context)
                            : List.of();
                    return Mono.just(buildResult(rule, context, startTime, false, "Evaluation error: " + reason,
                            List.of(EvaluationFinding.fail("Rule Evaluation", "Evaluation error: " + reason)),
                            waiverReasons));
                });
    }

    private Mono<RuleEvaluationResult> record(ComplianceRule rule, RuleEvaluationContext context, long startTime,
                                              EvaluationOutcome outcome, List<String> waiverReasons) {
        RuleEvaluationResult result = buildResult(rule, context, startTime,
                outcome.passed(), outcome.message(), outcome.findings(), waiverReasons);
        log.debug("Rule {} evaluated: passed={}, errored={}", rule.getId(), outcome.passed(), outcome.errored());

        if (context.isDryRun() || outcome.errored()) {
            return Mono.just(result);
        }
        return recordStatistics(rule, outcome.passed(), context).thenReturn(result);
    }

    private static List<String> activeWaiverReasons(ComplianceRule rule, RuleEvaluationContext context) {
        if (rule.getRuleLogic() == null) {
            return List.of();
        }
        return rule.getRuleLogic().activeWaivers(context.getEvaluationTime()).stream()
                .map(RuleWaiver::reason)
                .toList();
    }

    private Mono<EvaluationOutcome> dispatch(ComplianceRule rule, RuleEvaluationContext context) {
        RuleConfig config = rule.getRuleLogic() != null ? rule.getRuleLogic().config() : null;
        if (config == null) {
            return Mono.error(new IllegalStateException("Rule has no configuration"));
        }

        return switch (config.ruleType()) {
            case QUERY -> queryEvaluator.evaluate((QueryRuleConfig) config, context);
            case THRESHOLD -> thresholdEvaluator.evaluate((ThresholdRuleConfig) config, context);
            case PATTERN -> patternEvaluator.evaluate((PatternRuleConfig) config, context);
            case WORKFLOW -> workflowEvaluator.evaluate((WorkflowRuleConfig) config, context);
            case CUSTOM -> customDispatcher.evaluate((CustomRuleConfig) config, context);
        };
    }

    private Mono<Void> recordStatistics(ComplianceRule rule, boolean passed, RuleEvaluationContext context) {
        return Mono.defer(() -> repository.incrementStatistics(rule.getId(), passed, context.getEvaluationTime()))
                .onErrorResume(error -> {
                    StatisticsPersistenceException failure = new StatisticsPersistenceException(rule.getId(), error);
                    log.warn(failure.getMessage(), failure);
                    return Mono.empty();
                });
    }

    private static RuleEvaluationResult buildResult(ComplianceRule rule, RuleEvaluationContext context, long startTime,
                                                    boolean passed, String message,
                                                    List<EvaluationFinding> findings, List<String> waiverReasons) {
        return RuleEvaluationResult.builder()
                .ruleId(rule.getId())
                .ruleName(rule.getName())
                .passed(passed)
                .framework(rule.getFramework())
                .category(rule.getCategory())
                .severity(rule.getSeverity())
                .evaluatedAt(context.getEvaluationTime())
                .details(RuleEvaluationResult.Details.builder()
                        .message(message)
                        .findings(findings)
                        .evidenceIds(List.of())
                        .exceptions(waiverReasons)
                        .build())
                .executionTimeMs(System.currentTimeMillis() - startTime)
                .build();
    }
}
