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

import org.fireflyframework.compliance.model.ComplianceCategory;
import org.fireflyframework.compliance.model.ComplianceFramework;
import org.fireflyframework.compliance.model.ComplianceRule;
import org.fireflyframework.compliance.model.ComplianceSummary;
import org.fireflyframework.compliance.model.ComplianceSummary.GroupTally;
import org.fireflyframework.compliance.source.ComplianceRuleRepository;
import reactor.core.publisher.Mono;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Computes an organization's {@link ComplianceSummary} from the rules' historical
 * pass/fail counters.
 */
public class ComplianceSummaryCalculator {

    private final ComplianceRuleRepository repository;

    public ComplianceSummaryCalculator(ComplianceRuleRepository repository) {
        this.repository = repository;
    }

    public Mono<ComplianceSummary> summarize(String organizationId) {
        return repository.findAllRules(organizationId)
                .collectList()
                .map(ComplianceSummaryCalculator::summarize);
    }

    static ComplianceSummary summarize(List<ComplianceRule> rules) {
        Map<ComplianceFramework, GroupTally> byFramework = new EnumMap<>(ComplianceFramework.class);
        Map<ComplianceCategory, GroupTally> byCategory = new EnumMap<>(ComplianceCategory.class);
        int active = 0;
        int passing = 0;

        for (ComplianceRule rule : rules) {
            if (!rule.isActive()) {
                continue;
            }
            active++;
            boolean isPassing = rule.isHistoricallyPassing();
            if (isPassing) {
                passing++;
            }
            if (rule.getFramework() != null) {
                byFramework.merge(rule.getFramework(), new GroupTally(0, 0).add(isPassing),
                        (current, ignored) -> current.add(isPassing));
            }
            if (rule.getCategory() != null) {
                byCategory.merge(rule.getCategory(), new GroupTally(0, 0).add(isPassing),
                        (current, ignored) -> current.add(isPassing));
            }
        }

        // no active rules means nothing is failing
        int score = active > 0 ? (int) Math.round(100.0 * passing / active) : 100;

        return ComplianceSummary.builder()
                .totalRules(rules.size())
                .activeRules(active)
                .passingRules(passing)
                .failingRules(active - passing)
                .complianceScore(score)
                .byFramework(Collections.unmodifiableMap(byFramework))
                .byCategory(Collections.unmodifiableMap(byCategory))
                .build();
    }
}
