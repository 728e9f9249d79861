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
 * Checks a (possibly dotted) field of every entity of a type against a value. The
 * scope decides whether all, any or none of the entities must match.
 */
public record FieldValueDefinition(String entityType, String field, Operator operator, Object value, Scope scope,
                                   DefinitionMessages message) implements CustomRuleDefinition {

    public FieldValueDefinition {
        scope = scope != null ? scope : Scope.ALL;
        message = message != null ? message : DefinitionMessages.defaults();
    }

    @Override
    public DefinitionKind kind() {
        return DefinitionKind.FIELD_VALUE;
    }

    public enum Operator {
        @JsonProperty("eq") EQ,
        @JsonProperty("ne") NE,
        @JsonProperty("contains") CONTAINS,
        @JsonProperty("not_contains") NOT_CONTAINS,
        @JsonProperty("in") IN,
        @JsonProperty("not_in") NOT_IN,
        @JsonProperty("regex") REGEX
    }

    public enum Scope {
        @JsonProperty("all") ALL,
        @JsonProperty("any") ANY,
        @JsonProperty("none") NONE
    }
}
