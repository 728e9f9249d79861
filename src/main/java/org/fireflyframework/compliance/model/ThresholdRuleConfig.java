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

/**
 * Rule that compares a named organization metric against a bound.
 *
 * @param metric   metric name understood by the metrics source
 * @param operator comparison operator
 * @param value    single bound, or {@code [min, max]} for {@link ThresholdOperator#BETWEEN}
 */
public record ThresholdRuleConfig(String metric, ThresholdOperator operator, ThresholdValue value)
        implements RuleConfig {

    @Override
    public RuleType ruleType() {
        return RuleType.THRESHOLD;
    }
}
