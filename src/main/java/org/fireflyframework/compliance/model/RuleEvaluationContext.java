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
 * Per-call evaluation context. All rules in one batch share the same context and
 * therefore the same {@code evaluationTime}.
 */
@Data
@Builder(toBuilder = true)
public class RuleEvaluationContext {

    private final String organizationId;
    private final Instant evaluationTime;

    /** Suppresses every statistics update when set. */
    private final boolean dryRun;

    /** Entity ids to restrict checks to; {@code null} means all entities. */
    private final List<String> entityScope;
}
