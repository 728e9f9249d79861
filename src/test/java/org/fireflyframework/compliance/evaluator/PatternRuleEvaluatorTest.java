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

package org.fireflyframework.compliance.evaluator;

import org.fireflyframework.compliance.model.FindingType;
import org.fireflyframework.compliance.model.PatternRuleConfig;
import org.fireflyframework.compliance.model.RuleEvaluationContext;
import org.fireflyframework.compliance.resiliency.CollaboratorResiliencyRegistry;
import org.fireflyframework.compliance.source.PatternSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link PatternRuleEvaluator}.
 */
@ExtendWith(MockitoExtension.class)
class PatternRuleEvaluatorTest {

    private static final RuleEvaluationContext CONTEXT = RuleEvaluationContext.builder()
            .organizationId("org-1")
            .evaluationTime(Instant.parse("2025-06-01T12:00:00Z"))
            .build();

    @Mock
    private PatternSource patternSource;

    private PatternRuleEvaluator evaluator;

    @BeforeEach
    void setUp() {
        evaluator = new PatternRuleEvaluator(patternSource,
                CollaboratorResiliencyRegistry.withTimeout(Duration.ofSeconds(5)));
    }

    @Test
    void evaluate_shouldFailWhenProhibitedPatternIsFound() {
        // Given
        when(patternSource.searchForPattern("AKIA[0-9A-Z]{16}", "repositories", "org-1"))
                .thenReturn(Mono.just(true));

        // When & Then
        StepVerifier.create(evaluator.evaluate(
                        new PatternRuleConfig("AKIA[0-9A-Z]{16}", "repositories", false), CONTEXT))
                .assertNext(outcome -> {
                    assertThat(outcome.passed()).isFalse();
                    assertThat(outcome.findings().get(0).getDescription())
                            .isEqualTo("Prohibited pattern found in repositories");
                    assertThat(outcome.findings().get(0).getRemediation())
                            .isEqualTo("Remove prohibited pattern from repositories");
                })
                .verifyComplete();
    }

    @Test
    void evaluate_shouldPassWhenRequiredPatternIsFound() {
        when(patternSource.searchForPattern("Data Processing Agreement", "contracts", "org-1"))
                .thenReturn(Mono.just(true));

        StepVerifier.create(evaluator.evaluate(
                        new PatternRuleConfig("Data Processing Agreement", "contracts", true), CONTEXT))
                .assertNext(outcome -> {
                    assertThat(outcome.passed()).isTrue();
                    assertThat(outcome.findings().get(0).getType()).isEqualTo(FindingType.PASS);
                    assertThat(outcome.findings().get(0).getDescription())
                            .isEqualTo("Required pattern found in contracts");
                })
                .verifyComplete();
    }

    @Test
    void evaluate_shouldFailWhenRequiredPatternIsMissing() {
        when(patternSource.searchForPattern("Data Processing Agreement", "contracts", "org-1"))
                .thenReturn(Mono.just(false));

        StepVerifier.create(evaluator.evaluate(
                        new PatternRuleConfig("Data Processing Agreement", "contracts", true), CONTEXT))
                .assertNext(outcome -> {
                    assertThat(outcome.passed()).isFalse();
                    assertThat(outcome.findings().get(0).getDescription())
                            .isEqualTo("Required pattern not found in contracts");
                })
                .verifyComplete();
    }

    @Test
    void evaluate_shouldReportErrorWhenSourceReturnsNothing() {
        // Given - an empty answer must not read as "pattern absent"
        when(patternSource.searchForPattern("AKIA[0-9A-Z]{16}", "repositories", "org-1"))
                .thenReturn(Mono.empty());

        // When & Then
        StepVerifier.create(evaluator.evaluate(
                        new PatternRuleConfig("AKIA[0-9A-Z]{16}", "repositories", false), CONTEXT))
                .assertNext(outcome -> {
                    assertThat(outcome.passed()).isFalse();
                    assertThat(outcome.errored()).isTrue();
                    assertThat(outcome.findings().get(0).getType()).isEqualTo(FindingType.FAIL);
                    assertThat(outcome.findings().get(0).getDescription())
                            .isEqualTo("Pattern search failed: Pattern source returned no result");
                })
                .verifyComplete();
    }
}
