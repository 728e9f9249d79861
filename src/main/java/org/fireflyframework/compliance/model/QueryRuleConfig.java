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
 * Rule that runs a whitelisted catalog query and compares its single row
 * with the expected result.
 *
 * @param queryId        id of the query in the catalog
 * @param expectedResult expected shape of the result
 */
public record QueryRuleConfig(String queryId, ExpectedResult expectedResult) implements RuleConfig {

    @Override
    public RuleType ruleType() {
        return RuleType.QUERY;
    }
}
