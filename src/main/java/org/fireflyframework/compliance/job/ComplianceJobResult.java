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

package org.fireflyframework.compliance.job;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.Map;

/**
 * Outcome of a {@link ComplianceCheckJob} run.
 */
@Data
@Builder
public class ComplianceJobResult {

    private final String organizationId;
    private final long durationMs;
    private final boolean success;
    private final int rulesEvaluated;
    private final int violationsDetected;

    /**
     * Batch counters ({@code passed}, {@code failed}, {@code skipped},
     * {@code executionTimeMs}) on success, or {@code error} on failure.
     */
    private final Map<String, Object> details;

    private final Instant completedAt;
}
