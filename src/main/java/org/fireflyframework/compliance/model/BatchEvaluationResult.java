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
import java.util.List;

/**
 * Aggregate of evaluating many rules in one batch.
 *
 * <p>{@code totalRules == results.size() + skippedRules} always holds.</p>
 */
@Data
@Builder
public class BatchEvaluationResult {

    private final String organizationId;
    private final Instant evaluatedAt;
    private final int totalRules;
    private final int passedRules;
    private final int failedRules;
    private final int skippedRules;
    private final List<RuleEvaluationResult> results;
    private final long executionTimeMs;

    /**
     * Returns only the results of rules that did not pass.
     *
     * @return failed results in batch order
     */
    public List<RuleEvaluationResult> getFailures() {
        return results.stream()
                .filter(result -> !result.isPassed())
                .toList();
    }

    /**
     * Returns results for rules of the given severity.
     *
     * @param severity the severity to filter by
     * @return matching results in batch order
     */
    public List<RuleEvaluationResult> getBySeverity(RuleSeverity severity) {
        return results.stream()
                .filter(result -> result.getSeverity() == severity)
                .toList();
    }
}
