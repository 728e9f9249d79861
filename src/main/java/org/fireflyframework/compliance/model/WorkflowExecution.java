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
 * A recent run of an organizational workflow, as reported by the workflow source.
 */
public record WorkflowExecution(String id, String name, List<String> completedSteps,
                                List<String> approvers, double durationHours) {

    public WorkflowExecution {
        completedSteps = completedSteps != null ? List.copyOf(completedSteps) : List.of();
        approvers = approvers != null ? List.copyOf(approvers) : List.of();
    }
}
