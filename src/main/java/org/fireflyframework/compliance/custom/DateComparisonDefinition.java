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

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Compares a date field of every entity of a type with a reference date. Any entity
 * violating the comparison fails the rule.
 *
 * @param referenceDate {@code "now"}, {@code null} (the evaluation instant) or an ISO-8601 instant
 * @param days          day count for {@link Comparison#WITHIN_DAYS} and {@link Comparison#OLDER_THAN_DAYS}
 */
public record DateComparisonDefinition(String entityType, String dateField, Comparison comparison,
                                       String referenceDate, Integer days,
                                       DefinitionMessages message) implements CustomRuleDefinition {

    public DateComparisonDefinition {
        message = message != null ? message : DefinitionMessages.defaults();
    }

    @Override
    public DefinitionKind kind() {
        return DefinitionKind.DATE_COMPARISON;
    }

    public enum Comparison {
        @JsonProperty("before") BEFORE,
        @JsonProperty("after") AFTER,
        @JsonProperty("within_days") WITHIN_DAYS,
        @JsonProperty("older_than_days") OLDER_THAN_DAYS
    }
}
