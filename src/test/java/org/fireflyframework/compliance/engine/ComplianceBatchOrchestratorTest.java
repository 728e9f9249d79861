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

import org.fireflyframework.compliance.event.ComplianceEvaluationEvent;
import org.fireflyframework.compliance.model.BatchEvaluationResult;
import org.fireflyframework.compliance.model.CheckFrequency;
import org.fireflyframework.compliance.model.ComplianceFramework;
import org.fireflyframework.compliance.model.ComplianceRule;
import org.fireflyframework.compliance.model.RuleEvaluationContext;
import org.fireflyframework.compliance.model.RuleEvaluationResult;
import org.fireflyframework.compliance.model.RuleFilter;
import org.fireflyframework.compliance.model.RuleSeverity;
import org.fireflyframework.compliance.source.ComplianceRuleRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link ComplianceBatchOrchestrator}.
 */
@ExtendWith(MockitoExtension.class)
class ComplianceBatchOrchestratorTest {

    private static final Instant NOW = Instant.parse("2025-06-01T12:00:00Z");

    @Mock
    private ComplianceRuleRepository repository;

    @Mock
    private ComplianceRuleEvaluator ruleEvaluator;

    @Mock
    private ApplicationEventPublisher eventPublisher;

    private ComplianceBatchOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        orchestrator = new ComplianceBatchOrchestrator(repository, ruleEvaluator,
                Clock.fixed(NOW, ZoneOffset.UTC), 4, eventPublisher);
    }

    private static ComplianceRule rule(String id, String name, RuleSeverity severity) {
        return ComplianceRule.builder()
                .id(id)
                .organizationId("org-1")
                .name(name)
                .severity(severity)
                .framework(ComplianceFramework.SOX)
                .active(true)
                .checkFrequency(CheckFrequency.DAILY)
                .build();
    }

    private static RuleEvaluationResult result(ComplianceRule rule, boolean passed) {
        return RuleEvaluationResult.builder()
                .ruleId(rule.getId())
                .ruleName(rule.getName())
                .severity(rule.getSeverity())
                .passed(passed)
                .evaluatedAt(NOW)
                .build();
    }

    @Test
    void evaluateAll_shouldCountSkippedRulesWithoutAbortingBatch() {
        // Given - the second rule blows up past the rule evaluator
        ComplianceRule first = rule("r1", "Access reviews", RuleSeverity.HIGH);
        ComplianceRule broken = rule("r2", "Backups", RuleSeverity.HIGH);
        ComplianceRule third = rule("r3", "Change approval", RuleSeverity.HIGH);
        when(repository.findActiveRules(eq("org-1"), any(RuleFilter.class)))
                .thenReturn(Flux.just(first, broken, third));
        when(ruleEvaluator.evaluateRule(eq(first), any())).thenReturn(Mono.just(result(first, true)));
        when(ruleEvaluator.evaluateRule(eq(broken), any())).thenReturn(Mono.error(new IllegalStateException("boom")));
        when(ruleEvaluator.evaluateRule(eq(third), any())).thenReturn(Mono.just(result(third, false)));

        // When & Then
        StepVerifier.create(orchestrator.evaluateAll("org-1", RuleFilter.none(), false))
                .assertNext(batch -> {
                    assertThat(batch.getTotalRules()).isEqualTo(3);
                    assertThat(batch.getPassedRules()).isEqualTo(1);
                    assertThat(batch.getFailedRules()).isEqualTo(1);
                    assertThat(batch.getSkippedRules()).isEqualTo(1);
                    assertThat(batch.getTotalRules())
                            .isEqualTo(batch.getResults().size() + batch.getSkippedRules());
                    assertThat(batch.getFailures()).extracting(RuleEvaluationResult::getRuleId)
                            .containsExactly("r3");
                })
                .verifyComplete();
    }

    @Test
    void evaluateAll_shouldOrderBySeverityThenNameAndShareEvaluationTime() {
        // Given
        ComplianceRule low = rule("r1", "Awareness training", RuleSeverity.LOW);
        ComplianceRule criticalB = rule("r2", "Backups", RuleSeverity.CRITICAL);
        ComplianceRule criticalA = rule("r3", "Access reviews", RuleSeverity.CRITICAL);
        ComplianceRule medium = rule("r4", "Vendor review", RuleSeverity.MEDIUM);
        when(repository.findActiveRules(eq("org-1"), any(RuleFilter.class)))
                .thenReturn(Flux.just(low, criticalB, criticalA, medium));

        Set<Instant> evaluationTimes = ConcurrentHashMap.newKeySet();
        when(ruleEvaluator.evaluateRule(any(ComplianceRule.class), any(RuleEvaluationContext.class)))
                .thenAnswer(invocation -> {
                    ComplianceRule rule = invocation.getArgument(0);
                    RuleEvaluationContext context = invocation.getArgument(1);
                    evaluationTimes.add(context.getEvaluationTime());
                    // later rules finish first; results must still keep selection order
                    long delay = "r3".equals(rule.getId()) ? 50 : 0;
                    return Mono.delay(Duration.ofMillis(delay)).thenReturn(result(rule, true));
                });

        // When & Then
        StepVerifier.create(orchestrator.evaluateAll("org-1", null, true))
                .assertNext(batch -> {
                    assertThat(batch.getResults()).extracting(RuleEvaluationResult::getRuleId)
                            .containsExactly("r3", "r2", "r4", "r1");
                    assertThat(batch.getEvaluatedAt()).isEqualTo(NOW);
                })
                .verifyComplete();
        assertThat(evaluationTimes).containsExactly(NOW);
    }

    @Test
    void evaluateAll_shouldPublishEvaluationEvent() {
        ComplianceRule only = rule("r1", "Access reviews", RuleSeverity.HIGH);
        when(repository.findActiveRules(eq("org-1"), any(RuleFilter.class))).thenReturn(Flux.just(only));
        when(ruleEvaluator.evaluateRule(eq(only), any())).thenReturn(Mono.just(result(only, true)));

        StepVerifier.create(orchestrator.evaluateAll("org-1", RuleFilter.none(), true))
                .expectNextCount(1)
                .verifyComplete();

        ArgumentCaptor<ComplianceEvaluationEvent> captor = ArgumentCaptor.forClass(ComplianceEvaluationEvent.class);
        verify(eventPublisher).publishEvent(captor.capture());
        assertThat(captor.getValue().getOrganizationId()).isEqualTo("org-1");
        assertThat(captor.getValue().isDryRun()).isTrue();
        assertThat(captor.getValue().getBatch().getPassedRules()).isEqualTo(1);
    }

    @Test
    void evaluateDue_shouldEvaluateDueRulesWithStatistics() {
        // Given
        ComplianceRule stale = rule("r1", "Access reviews", RuleSeverity.HIGH).toBuilder()
                .lastCheckedAt(NOW.minus(Duration.ofHours(25)))
                .build();
        when(repository.findDueRules("org-1", NOW)).thenReturn(Flux.just(stale));
        when(ruleEvaluator.evaluateRule(eq(stale), any())).thenReturn(Mono.just(result(stale, false)));

        // When & Then
        StepVerifier.create(orchestrator.evaluateDue("org-1"))
                .assertNext(batch -> {
                    assertThat(batch.getTotalRules()).isEqualTo(1);
                    assertThat(batch.getFailedRules()).isEqualTo(1);
                })
                .verifyComplete();

        ArgumentCaptor<RuleEvaluationContext> context = ArgumentCaptor.forClass(RuleEvaluationContext.class);
        verify(ruleEvaluator).evaluateRule(eq(stale), context.capture());
        assertThat(context.getValue().isDryRun()).isFalse();
    }

    @Test
    void evaluateRules_shouldReturnEmptyBatchForNoRules() {
        StepVerifier.create(orchestrator.evaluateRules("org-1", List.of(), false))
                .assertNext(batch -> {
                    assertThat(batch.getTotalRules()).isZero();
                    assertThat(batch.getResults()).isEmpty();
                })
                .verifyComplete();
    }

    @Test
    void evaluateAll_shouldReturnBatchWhenEventListenerFails() {
        // Given
        ComplianceRule only = rule("r1", "Access reviews", RuleSeverity.HIGH);
        when(repository.findActiveRules(eq("org-1"), any(RuleFilter.class))).thenReturn(Flux.just(only));
        when(ruleEvaluator.evaluateRule(eq(only), any())).thenReturn(Mono.just(result(only, true)));
        doThrow(new IllegalStateException("listener failed")).when(eventPublisher).publishEvent(any(Object.class));

        // When & Then
        StepVerifier.create(orchestrator.evaluateAll("org-1", RuleFilter.none(), false))
                .assertNext(batch -> {
                    assertThat(batch.getTotalRules()).isEqualTo(1);
                    assertThat(batch.getPassedRules()).isEqualTo(1);
                })
                .verifyComplete();
    }

    @Test
    void evaluateRules_shouldLeaveInactiveRulesOutOfTheBatch() {
        // Given
        ComplianceRule active = rule("r1", "Access reviews", RuleSeverity.HIGH);
        ComplianceRule retired = rule("r2", "Fax retention", RuleSeverity.LOW).toBuilder()
                .active(false)
                .build();
        when(ruleEvaluator.evaluateRule(eq(active), any())).thenReturn(Mono.just(result(active, true)));

        // When & Then
        StepVerifier.create(orchestrator.evaluateRules("org-1", List.of(active, retired), false))
                .assertNext(batch -> {
                    assertThat(batch.getTotalRules()).isEqualTo(1);
                    assertThat(batch.getFailedRules()).isZero();
                    assertThat(batch.getResults()).extracting(RuleEvaluationResult::getRuleId)
                            .containsExactly("r1");
                })
                .verifyComplete();

        verify(ruleEvaluator, never()).evaluateRule(eq(retired), any());
    }

    @Test
    void constructor_shouldRejectNonPositiveConcurrency() {
        assertThatThrownBy(() -> new ComplianceBatchOrchestrator(repository, ruleEvaluator, Clock.systemUTC(), 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void getBySeverity_shouldFilterResults() {
        ComplianceRule high = rule("r1", "Access reviews", RuleSeverity.HIGH);
        ComplianceRule low = rule("r2", "Awareness training", RuleSeverity.LOW);
        BatchEvaluationResult batch = BatchEvaluationResult.builder()
                .results(List.of(result(high, true), result(low, false)))
                .build();

        assertThat(batch.getBySeverity(RuleSeverity.LOW)).extracting(RuleEvaluationResult::getRuleId)
                .containsExactly("r2");
    }
}
