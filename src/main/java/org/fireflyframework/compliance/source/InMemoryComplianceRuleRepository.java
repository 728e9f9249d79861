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

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.compliance.model.ComplianceRule;
import org.fireflyframework.compliance.model.RuleFilter;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe in-memory {@link ComplianceRuleRepository}.
 *
 * <p>Suitable for development, tests and single-instance deployments. Production
 * environments should provide a repository backed by the rule catalog store.
 * Counter updates are applied per rule with {@link ConcurrentHashMap#computeIfPresent},
 * so concurrent evaluations of different rules never interfere.</p>
 */
@Slf4j
public class InMemoryComplianceRuleRepository implements ComplianceRuleRepository {

    private final Map<String, ComplianceRule> rules = new ConcurrentHashMap<>();

    public InMemoryComplianceRuleRepository() {
    }

    public InMemoryComplianceRuleRepository(List<ComplianceRule> initialRules) {
        initialRules.forEach(this::save);
    }

    /**
     * Stores or replaces a rule definition.
     *
     * @param rule the rule
     * @return the stored rule
     */
    public ComplianceRule save(ComplianceRule rule) {
        rules.put(rule.getId(), rule);
        log.debug("Stored compliance rule {} ({})", rule.getId(), rule.getName());
        return rule;
    }

    public Optional<ComplianceRule> findById(String ruleId) {
        return Optional.ofNullable(rules.get(ruleId));
    }

    @Override
    public Flux<ComplianceRule> findActiveRules(String organizationId, RuleFilter filter) {
        RuleFilter effective = filter != null ? filter : RuleFilter.none();
        return Flux.defer(() -> Flux.fromIterable(snapshot(organizationId)))
                .filter(ComplianceRule::isActive)
                .filter(effective::matches);
    }

    @Override
    public Flux<ComplianceRule> findDueRules(String organizationId, Instant now) {
        return Flux.defer(() -> Flux.fromIterable(snapshot(organizationId)))
                .filter(rule -> rule.isDueAt(now));
    }

    @Override
    public Flux<ComplianceRule> findAllRules(String organizationId) {
        return Flux.defer(() -> Flux.fromIterable(snapshot(organizationId)));
    }

    @Override
    public Mono<Void> incrementStatistics(String ruleId, boolean passed, Instant checkedAt) {
        return Mono.fromRunnable(() -> {
            ComplianceRule updated = rules.computeIfPresent(ruleId, (id, rule) -> rule.toBuilder()
                    .lastCheckedAt(checkedAt)
                    .passCount(passed ? rule.getPassCount() + 1 : rule.getPassCount())
                    .failCount(passed ? rule.getFailCount() : rule.getFailCount() + 1)
                    .build());
            if (updated == null) {
                throw new NoSuchElementException("Unknown compliance rule: " + ruleId);
            }
        });
    }

    private List<ComplianceRule> snapshot(String organizationId) {
        return rules.values().stream()
                .filter(rule -> organizationId.equals(rule.getOrganizationId()))
                .toList();
    }
}
