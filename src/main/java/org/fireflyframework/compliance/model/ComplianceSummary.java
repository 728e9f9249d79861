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

import java.util.Map;

/**
 * Derived compliance posture of an organization. Never stored.
 *
 * <p>A rule counts as passing when its historical {@code passCount} exceeds its
 * {@code failCount}, not by its last result.</p>
 */
@Data
@Builder
public class ComplianceSummary {

    private final int totalRules;
    private final int activeRules;
    private final int passingRules;
    private final int failingRules;

    /** {@code round(100 * passingRules / activeRules)}, or 100 without active rules. */
    private final int complianceScore;

    private final Map<ComplianceFramework, GroupTally> byFramework;
    private final Map<ComplianceCategory, GroupTally> byCategory;

    /**
     * Active and passing rule counts of one framework or category.
     */
    public record GroupTally(int total, int passing) {

        public GroupTally add(boolean isPassing) {
            return new GroupTally(total + 1, passing + (isPassing ? 1 : 0));
        }
    }
}
