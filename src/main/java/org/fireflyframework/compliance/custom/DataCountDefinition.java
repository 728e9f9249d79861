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

package org.fireflyframework.compliance.custom;

import org.fireflyframework.compliance.model.ThresholdOperator;
import org.fireflyframework.compliance.model.ThresholdValue;

import java.util.Map;

/**
 * Compares the number of entities matching the filter with a bound.
 */
public record DataCountDefinition(String entityType, Map<String, Object> filter, ThresholdOperator operator,
                                  ThresholdValue value, DefinitionMessages message) implements CustomRuleDefinition {

    public DataCountDefinition {
        filter = filter != null ? filter : Map.of();
        message = message != null ? message : DefinitionMessages.defaults();
    }

    @Override
    public DefinitionKind kind() {
        return DefinitionKind.DATA_COUNT;
    }
}
