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

package org.fireflyframework.compliance.integration;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.fireflyframework.compliance.custom.AggregateDefinition;
import org.fireflyframework.compliance.custom.DefinedRuleEvaluator;
import org.fireflyframework.compliance.custom.EntityDataSource;
import org.fireflyframework.compliance.engine.ComplianceBatchOrchestrator;
import org.fireflyframework.compliance.engine.ComplianceRuleEvaluator;
import org.fireflyframework.compliance.engine.ComplianceSummaryCalculator;
import org.fireflyframework.compliance.evaluator.CustomRuleDispatcher;
import org.fireflyframework.compliance.evaluator.PatternRuleEvaluator;
import org.fireflyframework.compliance.evaluator.QueryRuleEvaluator;
import org.fireflyframework.compliance.evaluator.ThresholdRuleEvaluator;
import org.fireflyframework.compliance.evaluator.WorkflowRuleEvaluator;
import org.fireflyframework.compliance.event.ComplianceEvaluationEvent;
import org.fireflyframework.compliance.model.BatchEvaluationResult;
import org.fireflyframework.compliance.model.CheckFrequency;
import org.fireflyframework.compliance.model.ComplianceCategory;
import org.fireflyframework.compliance.model.ComplianceFramework;
import org.fireflyframework.compliance.model.ComplianceRule;
import org.fireflyframework.compliance.model.CustomRuleConfig;
import org.fireflyframework.compliance.model.ExpectedResult;
import org.fireflyframework.compliance.model.PatternRuleConfig;
import org.fireflyframework.compliance.model.QueryRuleConfig;
import org.fireflyframework.compliance.model.RuleConfig;
import org.fireflyframework.compliance.model.RuleEvaluationResult;
import org.fireflyframework.compliance.model.RuleLogic;
import org.fireflyframework.compliance.model.RuleSeverity;
import org.fireflyframework.compliance.model.ThresholdOperator;
import org.fireflyframework.compliance.model.ThresholdRuleConfig;
import org.fireflyframework.compliance.model.ThresholdValue;
import org.fireflyframework.compliance.model.WorkflowExecution;
import org.fireflyframework.compliance.model.WorkflowRuleConfig;
import org.fireflyframework.compliance.query.QueryCatalog;
import org.fireflyframework.compliance.query.SafeQueryExecutor;
import org.fireflyframework.compliance.registry.CustomEvaluatorRegistry;
import org.fireflyframework.compliance.resiliency.CollaboratorResiliencyRegistry;
import org.fireflyframework.compliance.source.InMemoryComplianceRuleRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Integration tests wiring the real evaluators, registry and in-memory rule store
 * behind the batch orchestrator.
 */
class ComplianceEngineIntegrationTest {

    private static final Instant NOW = Instant.parse("2025-06-01T12:00:00Z");
    private static final String ORG = "org-1";

    private InMemoryComplianceRuleRepository repository;
    private ComplianceBatchOrchestrator orchestrator;
    private ComplianceSummaryCalculator summaryCalculator;
    private final List<Object> publishedEvents = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        CollaboratorResiliencyRegistry resiliency = CollaboratorResiliencyRegistry.withTimeout(Duration.ofSeconds(5));

        EntityDataSource entities = new StubEntityDataSource();
        CustomEvaluatorRegistry customRegistry = new CustomEvaluatorRegistry();
        new DefinedRuleEvaluator(entities, new ObjectMapper(), resiliency).registerEvaluators(customRegistry);

        repository = new InMemoryComplianceRuleRepository(List.of(
                rule("r-threshold", RuleSeverity.HIGH,
                        new ThresholdRuleConfig("mfa_coverage", ThresholdOperator.GTE, ThresholdValue.of(95))),
                rule("r-pattern", RuleSeverity.CRITICAL,
                        new PatternRuleConfig("AKIA[0-9A-Z]{16}", "repositories", false)),
                rule("r-workflow", RuleSeverity.MEDIUM,
                        new WorkflowRuleConfig(List.of("review", "approve"), null, null)),
                rule("r-missing-evaluator", RuleSeverity.LOW,
                        new CustomRuleConfig("vendor_scan", Map.of())),
                rule("r-defined", RuleSeverity.MEDIUM,
                        new CustomRuleConfig(DefinedRuleEvaluator.NAME, Map.of(
                                "kind", "data_exists",
                                "entityType", "incidentResponsePlan",
                                "shouldExist", true))),
                rule("r-errored", RuleSeverity.HIGH,
                        new ThresholdRuleConfig("broken_metric", ThresholdOperator.LTE, ThresholdValue.of(3))),
                rule("r-query", RuleSeverity.HIGH,
                        new QueryRuleConfig("drop_all_tables", ExpectedResult.ZERO))));

        SafeQueryExecutor queryExecutor = new SafeQueryExecutor(QueryCatalog.defaultCatalog(), null, resiliency, clock);
        ComplianceRuleEvaluator ruleEvaluator = new ComplianceRuleEvaluator(repository,
                new QueryRuleEvaluator(queryExecutor),
                new ThresholdRuleEvaluator((metric, organizationId) -> "mfa_coverage".equals(metric)
                        ? Mono.just(97.0)
                        : Mono.error(new IllegalStateException("metrics backend down")), resiliency),
                new PatternRuleEvaluator((pattern, scope, organizationId) -> Mono.just(true), resiliency),
                new WorkflowRuleEvaluator(organizationId -> Flux.just(
                        new WorkflowExecution("wf-1", "Release 1.2", List.of("review", "approve"), List.of("cto"), 2),
                        new WorkflowExecution("wf-2", "Hotfix", List.of("review"), List.of(), 1)), resiliency),
                new CustomRuleDispatcher(customRegistry));

        orchestrator = new ComplianceBatchOrchestrator(repository, ruleEvaluator, clock, 3, publishedEvents::add);
        summaryCalculator = new ComplianceSummaryCalculator(repository);
    }

    private static ComplianceRule rule(String id, RuleSeverity severity, RuleConfig config) {
        return ComplianceRule.builder()
                .id(id)
                .organizationId(ORG)
                .name(id)
                .framework(ComplianceFramework.SOC2)
                .category(ComplianceCategory.TECHNICAL)
                .severity(severity)
                .active(true)
                .checkFrequency(CheckFrequency.DAILY)
                .ruleLogic(RuleLogic.of(config))
                .build();
    }

    private static Map<String, RuleEvaluationResult> byRule(BatchEvaluationResult batch) {
        return batch.getResults().stream()
                .collect(Collectors.toMap(RuleEvaluationResult::getRuleId, Function.identity()));
    }

    @Test
    void evaluateAll_shouldProduceVerdictPerRuleType() {
        StepVerifier.create(orchestrator.evaluateAll(ORG, null, true))
                .assertNext(batch -> {
                    Map<String, RuleEvaluationResult> results = byRule(batch);
                    assertThat(batch.getTotalRules()).isEqualTo(7);
                    assertThat(batch.getSkippedRules()).isZero();
                    assertThat(batch.getPassedRules()).isEqualTo(2);
                    assertThat(batch.getFailedRules()).isEqualTo(5);

                    assertThat(results.get("r-threshold").isPassed()).isTrue();
                    assertThat(results.get("r-defined").isPassed()).isTrue();
                    assertThat(results.get("r-pattern").getDetails().getMessage()).isEqualTo("Pattern check failed");
                    assertThat(results.get("r-workflow").getDetails().getMessage())
                            .isEqualTo("Workflow compliance check failed: 1 non-compliant workflows");
                    assertThat(results.get("r-missing-evaluator").getDetails().getMessage())
                            .isEqualTo("Custom evaluator \"vendor_scan\" not registered");
                    assertThat(results.get("r-query").getDetails().getMessage())
                            .isEqualTo("Security: Query \"drop_all_tables\" not whitelisted. "
                                    + "Contact admin to add approved queries.");
                    assertThat(results.get("r-errored").isPassed()).isFalse();
                })
                .verifyComplete();
    }

    @Test
    void dryRun_shouldBeRepeatableAndLeaveStatisticsUntouched() {
        // When
        BatchEvaluationResult first = orchestrator.evaluateAll(ORG, null, true).block();
        BatchEvaluationResult second = orchestrator.evaluateAll(ORG, null, true).block();

        // Then
        assertThat(second.getResults()).extracting(RuleEvaluationResult::getRuleId, RuleEvaluationResult::isPassed)
                .containsExactlyElementsOf(first.getResults().stream()
                        .map(result -> tuple(result.getRuleId(), result.isPassed()))
                        .toList());
        assertThat(repository.findById("r-threshold")).hasValueSatisfying(rule -> {
            assertThat(rule.getPassCount()).isZero();
            assertThat(rule.getFailCount()).isZero();
            assertThat(rule.getLastCheckedAt()).isNull();
        });
        assertThat(publishedEvents).hasSize(2)
                .allSatisfy(event -> assertThat(((ComplianceEvaluationEvent) event).isDryRun()).isTrue());
    }

    @Test
    void evaluateDue_shouldRecordStatisticsExceptForErroredRules() {
        // When
        StepVerifier.create(orchestrator.evaluateDue(ORG))
                .assertNext(batch -> assertThat(batch.getTotalRules()).isEqualTo(7))
                .verifyComplete();

        // Then - the missing evaluator is a plain failure and is counted
        assertThat(repository.findById("r-threshold").orElseThrow().getPassCount()).isEqualTo(1);
        assertThat(repository.findById("r-pattern").orElseThrow().getFailCount()).isEqualTo(1);
        assertThat(repository.findById("r-missing-evaluator").orElseThrow().getFailCount()).isEqualTo(1);
        assertThat(repository.findById("r-query").orElseThrow().getFailCount()).isEqualTo(1);
        ComplianceRule errored = repository.findById("r-errored").orElseThrow();
        assertThat(errored.getFailCount()).isZero();
        assertThat(errored.getLastCheckedAt()).isNull();
        assertThat(repository.findById("r-threshold").orElseThrow().getLastCheckedAt()).isEqualTo(NOW);

        // And only the errored rule is still due at the same instant
        StepVerifier.create(orchestrator.evaluateDue(ORG))
                .assertNext(batch -> assertThat(batch.getResults())
                        .extracting(RuleEvaluationResult::getRuleId)
                        .containsExactly("r-errored"))
                .verifyComplete();
    }

    @Test
    void summarize_shouldScoreRecordedHistory() {
        orchestrator.evaluateDue(ORG).block();

        StepVerifier.create(summaryCalculator.summarize(ORG))
                .assertNext(summary -> {
                    assertThat(summary.getActiveRules()).isEqualTo(7);
                    assertThat(summary.getPassingRules()).isEqualTo(2);
                    assertThat(summary.getFailingRules()).isEqualTo(5);
                    assertThat(summary.getComplianceScore()).isEqualTo(29);
                })
                .verifyComplete();
    }

    private static final class StubEntityDataSource implements EntityDataSource {

        @Override
        public Mono<Long> countEntities(String entityType, Map<String, Object> filter) {
            return Mono.just("incidentResponsePlan".equals(entityType) ? 1L : 0L);
        }

        @Override
        public Flux<Map<String, Object>> getEntities(String entityType, Map<String, Object> filter) {
            return Flux.empty();
        }

        @Override
        public Mono<Boolean> relationshipExists(String sourceEntity, String targetEntity, String relationshipType,
                                                String organizationId) {
            return Mono.just(false);
        }

        @Override
        public Mono<Double> aggregate(String entityType, AggregateDefinition.Function function, String field,
                                      Map<String, Object> filter) {
            return Mono.empty();
        }
    }
}
