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
 * Rule that checks recent workflow executions for required steps, approvers and duration.
 *
 * @param requiredSteps     steps every execution must have completed
 * @param requiredApprovers approvers every execution must carry, matched exactly or by substring; may be {@code null}
 * @param maxDurationHours  upper bound on execution duration; {@code null} disables the check
 */
public record WorkflowRuleConfig(List<String> requiredSteps, List<String> requiredApprovers, Double maxDurationHours)
        implements RuleConfig {

    public WorkflowRuleConfig {
        requiredSteps = requiredSteps != null ? List.copyOf(requiredSteps) : List.of();
        requiredApprovers = requiredApprovers != null ? List.copyOf(requiredApprovers) : null;
    }

    @Override
    public RuleType ruleType() {
        return RuleType.WORKFLOW;
    }
}
