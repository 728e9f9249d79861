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
import org.fireflyframework.compliance.model.ComplianceCategory;
import org.fireflyframework.compliance.model.ComplianceFramework;

/**
 * Input of a {@link ComplianceCheckJob} run, as handed over by an external scheduler.
 */
@Data
@Builder
public class ComplianceJobRequest {

    private final String organizationId;

    /** Restricts the run to one framework; triggers a full evaluation instead of due-only. */
    private final ComplianceFramework framework;

    /** Restricts the run to one category; triggers a full evaluation instead of due-only. */
    private final ComplianceCategory category;

    /** Only honored for full evaluations; due-rule runs always record statistics. */
    private final boolean dryRun;

    public boolean hasFilter() {
        return framework != null || category != null;
    }
}
