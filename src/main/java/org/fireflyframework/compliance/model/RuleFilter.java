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
 * Optional filters for selecting active rules. A {@code null} field does not filter.
 */
@Data
@Builder
public class RuleFilter {

    private final ComplianceFramework framework;
    private final ComplianceCategory category;
    private final CheckFrequency frequency;

    public static RuleFilter none() {
        return RuleFilter.builder().build();
    }

    public boolean matches(ComplianceRule rule) {
        return (framework == null || framework == rule.getFramework())
                && (category == null || category == rule.getCategory())
                && (frequency == null || frequency == rule.getCheckFrequency());
    }
}
