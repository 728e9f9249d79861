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

/**
 * One structured observation produced while evaluating a rule.
 */
@Data
@Builder
public class EvaluationFinding {

    private final FindingType type;
    private final String entity;
    private final String entityId;
    private final String description;
    private final String remediation;

    public static EvaluationFinding pass(String entity, String description) {
        return of(FindingType.PASS, entity, description);
    }

    public static EvaluationFinding fail(String entity, String description) {
        return of(FindingType.FAIL, entity, description);
    }

    public static EvaluationFinding info(String entity, String description) {
        return of(FindingType.INFO, entity, description);
    }

    private static EvaluationFinding of(FindingType type, String entity, String description) {
        return EvaluationFinding.builder()
                .type(type)
                .entity(entity)
                .description(description)
                .build();
    }
}
