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

package org.fireflyframework.compliance.exception;

import lombok.Getter;

/**
 * Raised when a rule's pass/fail counters could not be recorded. The evaluation
 * result it belongs to remains valid.
 */
@Getter
public class StatisticsPersistenceException extends ComplianceEngineException {

    private final String ruleId;

    public StatisticsPersistenceException(String ruleId, Throwable cause) {
        super("Failed to record statistics for rule " + ruleId, cause);
        this.ruleId = ruleId;
    }
}
