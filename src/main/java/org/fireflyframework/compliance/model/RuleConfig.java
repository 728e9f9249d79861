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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Typed configuration of a compliance rule. Exactly one variant applies per rule.
 *
 * <p>Stored rule logic carries a {@code type} discriminator:</p>
 * <pre>{@code
 * { "type": "query", "queryId": "count_users_without_mfa", "expectedResult": "zero" }
 * { "type": "threshold", "metric": "uptime_percent", "operator": "between", "value": [99.0, 100.0] }
 * }</pre>
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = QueryRuleConfig.class, name = "query"),
        @JsonSubTypes.Type(value = ThresholdRuleConfig.class, name = "threshold"),
        @JsonSubTypes.Type(value = PatternRuleConfig.class, name = "pattern"),
        @JsonSubTypes.Type(value = WorkflowRuleConfig.class, name = "workflow"),
        @JsonSubTypes.Type(value = CustomRuleConfig.class, name = "custom")
})
public sealed interface RuleConfig
        permits QueryRuleConfig, ThresholdRuleConfig, PatternRuleConfig, WorkflowRuleConfig, CustomRuleConfig {

    /**
     * Returns the variant of this configuration.
     *
     * @return the rule type
     */
    @JsonIgnore
    RuleType ruleType();
}
