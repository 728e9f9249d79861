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

package org.fireflyframework.compliance.source;

import org.fireflyframework.compliance.model.CheckFrequency;
import org.fireflyframework.compliance.model.ComplianceFramework;
import org.fireflyframework.compliance.model.ComplianceRule;
import org.fireflyframework.compliance.model.RuleFilter;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link InMemoryComplianceRuleRepository}.
 */
class InMemoryComplianceRuleRepositoryTest {

    private static final Instant NOW = Instant.parse("2025-06-01T12:00:00Z");

    private static ComplianceRule rule(String id, String organizationId, boolean active,
                                       ComplianceFramework framework, Instant lastCheckedAt) {
        return ComplianceRule.builder()
                .id(id)
                .organizationId(organizationId)
                .name("Rule " + id)
                .framework(framework)
                .active(active)
                .checkFrequency(CheckFrequency.DAILY)
                .lastCheckedAt(lastCheckedAt)
                .build();
    }

    @Test
    void findActiveRules_shouldFilterByOrganizationActivityAndFramework() {
        // Given
        InMemoryComplianceRuleRepository repository = new InMemoryComplianceRuleRepository(List.of(
                rule("r1", "org-1", true, ComplianceFramework.SOX, null),
                rule("r2", "org-1", false, ComplianceFramework.SOX, null),
                rule("r3", "org-1", true, ComplianceFramework.GDPR, null),
                rule("r4", "org-2", true, ComplianceFramework.SOX, null)));

        // When & Then
        StepVerifier.create(repository.findActiveRules("org-1",
                        RuleFilter.builder().framework(ComplianceFramework.SOX).build()))
                .assertNext(found -> assertThat(found.getId()).isEqualTo("r1"))
                .verifyComplete();
    }

    @Test
    void findDueRules_shouldApplyCheckFrequency() {
        InMemoryComplianceRuleRepository repository = new InMemoryComplianceRuleRepository(List.of(
                rule("stale", "org-1", true, ComplianceFramework.SOX, NOW.minus(Duration.ofHours(25))),
                rule("fresh", "org-1", true, ComplianceFramework.SOX, NOW.minus(Duration.ofHours(10))),
                rule("never", "org-1", true, ComplianceFramework.SOX, null)));

        StepVerifier.create(repository.findDueRules("org-1", NOW).map(ComplianceRule::getId).collectList())
                .assertNext(ids -> assertThat(ids).containsExactlyInAnyOrder("stale", "never"))
                .verifyComplete();
    }

    @Test
    void incrementStatistics_shouldUpdateOneCounterAndLastChecked() {
        // Given
        InMemoryComplianceRuleRepository repository = new InMemoryComplianceRuleRepository(List.of(
                rule("r1", "org-1", true, ComplianceFramework.SOX, null)));

        // When
        StepVerifier.create(repository.incrementStatistics("r1", false, NOW)).verifyComplete();

        // Then
        ComplianceRule updated = repository.findById("r1").orElseThrow();
        assertThat(updated.getFailCount()).isEqualTo(1);
        assertThat(updated.getPassCount()).isZero();
        assertThat(updated.getLastCheckedAt()).isEqualTo(NOW);
    }

    @Test
    void incrementStatistics_shouldNotLoseConcurrentUpdates() {
        InMemoryComplianceRuleRepository repository = new InMemoryComplianceRuleRepository(List.of(
                rule("r1", "org-1", true, ComplianceFramework.SOX, null)));

        Flux.fromStream(IntStream.range(0, 200).boxed())
                .parallel(8)
                .runOn(Schedulers.parallel())
                .flatMap(i -> repository.incrementStatistics("r1", i % 2 == 0, NOW))
                .sequential()
                .blockLast(Duration.ofSeconds(10));

        ComplianceRule updated = repository.findById("r1").orElseThrow();
        assertThat(updated.getPassCount()).isEqualTo(100);
        assertThat(updated.getFailCount()).isEqualTo(100);
    }

    @Test
    void incrementStatistics_shouldFailForUnknownRule() {
        InMemoryComplianceRuleRepository repository = new InMemoryComplianceRuleRepository();

        StepVerifier.create(repository.incrementStatistics("missing", true, NOW))
                .expectError(NoSuchElementException.class)
                .verify();
    }
}
