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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Declarative rule definition carried in the parameters of a
 * {@code custom_rule} custom rule, discriminated by {@code kind}.
 *
 * <pre>{@code
 * {
 *   "kind": "data_count",
 *   "entityType": "vendor",
 *   "filter": { "riskAssessed": false },
 *   "operator": "eq",
 *   "value": 0,
 *   "message": { "pass": "All vendors assessed", "fail": "{count} vendors lack a risk assessment" }
 * }
 * }</pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = DataExistsDefinition.class, name = "data_exists"),
        @JsonSubTypes.Type(value = DataCountDefinition.class, name = "data_count"),
        @JsonSubTypes.Type(value = FieldValueDefinition.class, name = "field_value"),
        @JsonSubTypes.Type(value = DateComparisonDefinition.class, name = "date_comparison"),
        @JsonSubTypes.Type(value = RelationshipExistsDefinition.class, name = "relationship_exists"),
        @JsonSubTypes.Type(value = AggregateDefinition.class, name = "aggregate")
})
public sealed interface CustomRuleDefinition
        permits DataExistsDefinition, DataCountDefinition, FieldValueDefinition,
        DateComparisonDefinition, RelationshipExistsDefinition, AggregateDefinition {

    @JsonIgnore
    DefinitionKind kind();

    DefinitionMessages message();
}
