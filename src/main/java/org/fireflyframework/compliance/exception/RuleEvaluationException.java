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
 * Wraps any failure raised while computing a rule's verdict.
 */
@Getter
public class RuleEvaluationException extends ComplianceEngineException {

    private final String ruleId;

    public RuleEvaluationException(String ruleId, Throwable cause) {
        super("Evaluation of rule " + ruleId + " failed: " + describe(cause), cause);
        this.ruleId = ruleId;
    }

    /**
     * Returns a readable description of an error, falling back to its class name
     * when it carries no message.
     *
     * @param error the error
     * @return the message or simple class name
     */
    public static String describe(Throwable error) {
        String message = error.getMessage();
        return message != null ? message : error.getClass().getSimpleName();
    }
}
