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

package org.fireflyframework.compliance.event;

import lombok.Data;
import org.fireflyframework.compliance.model.BatchEvaluationResult;

import java.time.Instant;

/**
 * Event published by the {@link org.fireflyframework.compliance.engine.ComplianceBatchOrchestrator}
 * after a batch of rules has been evaluated.
 */
@Data
public class ComplianceEvaluationEvent {

    private final BatchEvaluationResult batch;
    private final boolean dryRun;
    private final Instant timestamp;

    public ComplianceEvaluationEvent(BatchEvaluationResult batch, boolean dryRun) {
        this.batch = batch;
        this.dryRun = dryRun;
        this.timestamp = Instant.now();
    }

    public String getOrganizationId() {
        return batch.getOrganizationId();
    }
}
