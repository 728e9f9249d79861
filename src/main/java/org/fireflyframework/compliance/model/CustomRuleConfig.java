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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Rule delegated to a custom evaluator registered under {@code evaluatorName}.
 *
 * @param evaluatorName registry key of the evaluator
 * @param parameters    free-form parameters handed to the evaluator
 */
public record CustomRuleConfig(String evaluatorName, Map<String, Object> parameters) implements RuleConfig {

    public CustomRuleConfig {
        parameters = parameters != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(parameters))
                : Map.of();
    }

    public static CustomRuleConfig of(String evaluatorName) {
        return new CustomRuleConfig(evaluatorName, Map.of());
    }

    @Override
    public RuleType ruleType() {
        return RuleType.CUSTOM;
    }
}
