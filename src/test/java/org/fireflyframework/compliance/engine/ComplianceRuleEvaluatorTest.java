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

import org.fireflyframework.compliance.evaluator.CustomRuleDispatcher;
import org.fireflyframework.compliance.evaluator.PatternRuleEvaluator;
import org.fireflyframework.compliance.evaluator.QueryRuleEvaluator;
import org.fireflyframework.compliance.evaluator.ThresholdRuleEvaluator;
import org.fireflyframework.compliance.evaluator.WorkflowRuleEvaluator;
import org.fireflyframework.compliance.model.CheckFrequency;
import org.fireflyframework.compliance.model.ComplianceCategory;
import org.fireflyframework.compliance.model.ComplianceFramework;
import org.fireflyframework.compliance.model.ComplianceRule;
import org.fireflyframework.compliance.model.EvaluationFinding;
import org.fireflyframework.compliance.model.EvaluationOutcome;
import org.fireflyframework.compliance.model.ExpectedResult;
import org.fireflyframework.compliance.model.FindingType;
import org.fireflyframework.compliance.model.QueryRuleConfig;
import org.fireflyframework.compliance.model.RuleEvaluationContext;
import org.fireflyframework.compliance.model.RuleLogic;
import org.fireflyframework.compliance.model.RuleSeverity;
import org.fireflyframework.compliance.model.RuleWaiver;
import org.fireflyframework.compliance.model.WaiverType;
import org.fireflyframework.compliance.source.ComplianceRuleRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link ComplianceRuleEvaluator}.
 */
@ExtendWith(MockitoExtension.class)
class ComplianceRuleEvaluatorTest {

    private static final Instant NOW = Instant.parse("2025-06-01T12:00:00Z");
    private static final QueryRuleConfig MFA_CHECK = new QueryRuleConfig("count_users_without_mfa", ExpectedResult.ZERO);

    @Mock
    private ComplianceRuleRepository repository;
    @Mock
    private QueryRuleEvaluator queryEvaluator;
    @Mock
    private ThresholdRuleEvaluator thresholdEvaluator;
    @Mock
    private PatternRuleEvaluator patternEvaluator;
    @Mock
    private WorkflowRuleEvaluator workflowEvaluator;
    @Mock
    private CustomRuleDispatcher customDispatcher;

    private ComplianceRuleEvaluator ruleEvaluator;

    @BeforeEach
    void setUp() {
        ruleEvaluator = new ComplianceRuleEvaluator(repository, queryEvaluator, thresholdEvaluator,
                patternEvaluator, workflowEvaluator, customDispatcher);
    }

    private static ComplianceRule.ComplianceRuleBuilder mfaRule() {
        return ComplianceRule.builder()
                .id("rule-mfa")
                .organizationId("org-1")
                .name("MFA enforced")
                .framework(ComplianceFramework.SOC2)
                .category(ComplianceCategory.TECHNICAL)
                .severity(RuleSeverity.HIGH)
                .active(true)
                .checkFrequency(CheckFrequency.DAILY)
                .ruleLogic(RuleLogic.of(MFA_CHECK));
    }

    private static RuleEvaluationContext context(boolean dryRun) {
        return RuleEvaluationContext.builder()
                .organizationId("org-1")
                .evaluationTime(NOW)
                .dryRun(dryRun)
                .build();
    }

    @Test
    void evaluateRule_shouldRecordPassAndBuildResult() {
        // Given
        when(queryEvaluator.evaluate(MFA_CHECK, context(false))).thenReturn(Mono.just(EvaluationOutcome.of(true,
                List.of(EvaluationFinding.pass("Query Result", "ok")), "Query compliance check passed")));
        when(repository.incrementStatistics("rule-mfa", true, NOW)).thenReturn(Mono.empty());

        // When & Then
        StepVerifier.create(ruleEvaluator.evaluateRule(mfaRule().build(), context(false)))
                .assertNext(result -> {
                    assertThat(result.isPassed()).isTrue();
                    assertThat(result.getRuleId()).isEqualTo("rule-mfa");
                    assertThat(result.getFramework()).isEqualTo(ComplianceFramework.SOC2);
                    assertThat(result.getSeverity()).isEqualTo(RuleSeverity.HIGH);
                    assertThat(result.getEvaluatedAt()).isEqualTo(NOW);
                    assertThat(result.getDetails().getMessage()).isEqualTo("Query compliance check passed");
                    assertThat(result.getDetails().getExceptions()).isEmpty();
                    assertThat(result.getExecutionTimeMs()).isNotNegative();
                })
                .verifyComplete();

        verify(repository).incrementStatistics("rule-mfa", true, NOW);
    }

    @Test
    void evaluateRule_shouldNotEvaluateInactiveRule() {
        // When & Then
        StepVerifier.create(ruleEvaluator.evaluateRule(mfaRule().active(false).build(), context(false)))
                .assertNext(result -> {
                    assertThat(result.isPassed()).isFalse();
                    assertThat(result.getDetails().getMessage()).isEqualTo("Rule is inactive");
                })
                .verifyComplete();

        verifyNoInteractions(repository, queryEvaluator);
    }

    @Test
    void evaluateRule_shouldSkipStatisticsInDryRun() {
        when(queryEvaluator.evaluate(MFA_CHECK, context(true))).thenReturn(Mono.just(EvaluationOutcome.failed(
                EvaluationFinding.fail("Query Result", "3 users"), "Query compliance check failed")));

        StepVerifier.create(ruleEvaluator.evaluateRule(mfaRule().build(), context(true)))
                .assertNext(result -> assertThat(result.isPassed()).isFalse())
                .verifyComplete();

        verifyNoInteractions(repository);
    }

    @Test
    void evaluateRule_shouldSkipStatisticsWhenCollaboratorErrored() {
        when(queryEvaluator.evaluate(MFA_CHECK, context(false))).thenReturn(Mono.just(EvaluationOutcome.errored(
                EvaluationFinding.fail("Query Execution", "Query execution failed: timeout"), "Query execution error")));

        StepVerifier.create(ruleEvaluator.evaluateRule(mfaRule().build(), context(false)))
                .assertNext(result -> {
                    assertThat(result.isPassed()).isFalse();
                    assertThat(result.getDetails().getFindings()).hasSize(1);
                })
                .verifyComplete();

        verify(repository, never()).incrementStatistics(anyString(), anyBoolean(), any());
    }

    @Test
    void evaluateRule_shouldListActiveWaiversWithoutChangingVerdict() {
        // Given - one active and one expired waiver on a failing rule
        RuleLogic logic = new RuleLogic(MFA_CHECK, List.of(
                new RuleWaiver(WaiverType.CONDITION, "SSO migration until Q3", NOW.plusSeconds(86_400), null),
                new RuleWaiver(WaiverType.ENTITY, "Expired waiver", NOW.minusSeconds(1), null)));
        when(queryEvaluator.evaluate(MFA_CHECK, context(false))).thenReturn(Mono.just(EvaluationOutcome.failed(
                EvaluationFinding.fail("Query Result", "3 users"), "Query compliance check failed")));
        when(repository.incrementStatistics("rule-mfa", false, NOW)).thenReturn(Mono.empty());

        // When & Then
        StepVerifier.create(ruleEvaluator.evaluateRule(mfaRule().ruleLogic(logic).build(), context(false)))
                .assertNext(result -> {
                    assertThat(result.isPassed()).isFalse();
                    assertThat(result.getDetails().getExceptions()).containsExactly("SSO migration until Q3");
                })
                .verifyComplete();
    }

    @Test
    void evaluateRule_shouldKeepResultWhenStatisticsWriteFails() {
        when(queryEvaluator.evaluate(MFA_CHECK, context(false))).thenReturn(Mono.just(EvaluationOutcome.of(true,
                List.of(), "Query compliance check passed")));
        when(repository.incrementStatistics("rule-mfa", true, NOW))
                .thenReturn(Mono.error(new IllegalStateException("database read-only")));

        StepVerifier.create(ruleEvaluator.evaluateRule(mfaRule().build(), context(false)))
                .assertNext(result -> assertThat(result.isPassed()).isTrue())
                .verifyComplete();
    }

    @Test
    void evaluateRule_shouldTurnDispatchFailureIntoFailingResult() {
        // Given
        when(queryEvaluator.evaluate(MFA_CHECK, context(false))).thenThrow(new IllegalStateException("unexpected"));

        // When & Then
        StepVerifier.create(ruleEvaluator.evaluateRule(mfaRule().build(), context(false)))
                .assertNext(result -> {
                    assertThat(result.isPassed()).isFalse();
                    assertThat(result.getDetails().getFindings()).singleElement().satisfies(finding -> {
                        assertThat(finding.getType()).isEqualTo(FindingType.FAIL);
                        assertThat(finding.getDescription()).isEqualTo("Evaluation error: unexpected");
                    });
                })
                .verifyComplete();

        verifyNoInteractions(repository);
    }

    @Test
    void evaluateRule_shouldFailRuleWithoutConfiguration() {
        StepVerifier.create(ruleEvaluator.evaluateRule(mfaRule().ruleLogic(null).build(), context(false)))
                .assertNext(result -> {
                    assertThat(result.isPassed()).isFalse();
                    assertThat(result.getDetails().getMessage()).startsWith("Evaluation error");
                })
                .verifyComplete();

        verifyNoInteractions(repository, queryEvaluator);
    }

    @Test
    void evaluateRule_shouldFailRuleWhenContextHasNoEvaluationTime() {
        // Given - a waiver with an expiry needs an evaluation instant to be checked
        RuleLogic logic = new RuleLogic(MFA_CHECK, List.of(
                new RuleWaiver(WaiverType.CONDITION, "Vendor migration", Instant.parse("2030-01-01T00:00:00Z"), null)));
        RuleEvaluationContext withoutTime = RuleEvaluationContext.builder()
                .organizationId("org-1")
                .build();

        // When & Then
        StepVerifier.create(ruleEvaluator.evaluateRule(mfaRule().ruleLogic(logic).build(), withoutTime))
                .assertNext(result -> {
                    assertThat(result.isPassed()).isFalse();
                    assertThat(result.getDetails().getMessage()).isEqualTo("Evaluation error: evaluationTime is required");
                    assertThat(result.getDetails().getExceptions()).isEmpty();
                })
                .verifyComplete();

        verifyNoInteractions(repository, queryEvaluator);
    }
}
