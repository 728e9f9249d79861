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

import java.util.List;

/**
 * Result of a single type evaluator.
 *
 * @param passed   whether the rule's condition holds
 * @param findings observations supporting the verdict
 * @param message  one-line summary for the result details
 * @param errored  {@code true} when a collaborator failed and the verdict is not evidence
 *                 about the underlying control; statistics are not recorded for such outcomes
 */
public record EvaluationOutcome(boolean passed, List<EvaluationFinding> findings, String message, boolean errored) {

    public EvaluationOutcome {
        findings = findings != null ? List.copyOf(findings) : List.of();
    }

    public static EvaluationOutcome of(boolean passed, List<EvaluationFinding> findings, String message) {
        return new EvaluationOutcome(passed, findings, message, false);
    }

    public static EvaluationOutcome failed(EvaluationFinding finding, String message) {
        return new EvaluationOutcome(false, List.of(finding), message, false);
    }

    public static EvaluationOutcome errored(EvaluationFinding finding, String message) {
        return new EvaluationOutcome(false, List.of(finding), message, true);
    }
}
