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

package org.fireflyframework.compliance.model;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * A named compliance policy unit owned by an organization.
 *
 * <p>Definition fields are maintained by the rule authoring surface. The engine only
 * touches {@code lastCheckedAt}, {@code passCount} and {@code failCount}, and only
 * through {@link org.fireflyframework.compliance.source.ComplianceRuleRepository#incrementStatistics}.
 * Rules are never deleted by the engine; deactivation is {@code active = false}.</p>
 */
@Data
@Builder(toBuilder = true)
public class ComplianceRule {

    private final String id;
    private final String organizationId;
    private final String name;
    private final String description;
    private final ComplianceFramework framework;
    private final ComplianceCategory category;
    private final RuleSeverity severity;
    private final boolean active;
    private final CheckFrequency checkFrequency;
    private final Instant lastCheckedAt;
    private final long passCount;
    private final long failCount;
    private final RuleLogic ruleLogic;

    /**
     * Returns whether the rule's history counts as passing: more passes than failures.
     *
     * @return {@code true} if {@code passCount > failCount}
     */
    public boolean isHistoricallyPassing() {
        return passCount > failCount;
    }

    /**
     * Returns whether this rule is due for evaluation at the given instant.
     *
     * @param now the reference instant
     * @return {@code true} if active and never checked, or its check interval has elapsed
     */
    public boolean isDueAt(Instant now) {
        if (!active) {
            return false;
        }
        if (lastCheckedAt == null) {
            return true;
        }
        return checkFrequency != null && checkFrequency.isDue(lastCheckedAt, now);
    }
}
