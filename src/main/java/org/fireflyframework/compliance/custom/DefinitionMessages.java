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

/**
 * Pass and fail descriptions of a defined rule. Messages may contain a
 * {@code {count}} or {@code {value}} placeholder.
 *
 * @param pass description used when the rule passes
 * @param fail description used when the rule fails
 */
public record DefinitionMessages(String pass, String fail) {

    public DefinitionMessages {
        pass = pass != null ? pass : "Custom rule passed";
        fail = fail != null ? fail : "Custom rule failed";
    }

    public static DefinitionMessages defaults() {
        return new DefinitionMessages(null, null);
    }

    public String select(boolean passed) {
        return passed ? pass : fail;
    }

    /**
     * Selects the message and substitutes {@code placeholder} with the given value.
     *
     * @param passed      the verdict
     * @param placeholder placeholder name without braces
     * @param value       the substituted value
     * @return the rendered message
     */
    public String render(boolean passed, String placeholder, Object value) {
        return select(passed).replace("{" + placeholder + "}", String.valueOf(value));
    }
}
