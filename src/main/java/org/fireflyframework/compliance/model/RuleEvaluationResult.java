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
 * Outcome of evaluating one {@link ComplianceRule}. Created once per evaluation call and
 * handed to the caller, who decides whether to persist it.
 */
@Data
@Builder
public class RuleEvaluationResult {

    private final String ruleId;
    private final String ruleName;
    private final boolean passed;
    private final ComplianceFramework framework;
    private final ComplianceCategory category;
    private final RuleSeverity severity;
    private final Instant evaluatedAt;
    private final Details details;
    private final long executionTimeMs;

    /**
     * Supporting information for the verdict.
     */
    @Data
    @Builder
    public static class Details {

        private final String message;
        private final List<EvaluationFinding> findings;
        private final List<String> evidenceIds;

        /** Reasons of the waivers active at evaluation time. */
        private final List<String> exceptions;
    }
}
