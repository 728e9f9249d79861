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

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Expected outcome of a whitelisted catalog query.
 *
 * <ul>
 *   <li>{@link #ZERO} - the returned count must be 0</li>
 *   <li>{@link #NON_ZERO} - the returned count must be greater than 0</li>
 *   <li>{@link #BOOLEAN_TRUE} / {@link #BOOLEAN_FALSE} - the returned flag must match exactly</li>
 * </ul>
 */
public enum ExpectedResult {

    @JsonProperty("zero")
    ZERO,

    @JsonProperty("non_zero")
    NON_ZERO,

    @JsonProperty("boolean_true")
    BOOLEAN_TRUE,

    @JsonProperty("boolean_false")
    BOOLEAN_FALSE;

    /**
     * Checks whether the given row satisfies this expectation. A missing row is
     * treated as a count of zero and an absent flag.
     *
     * @param row the first row returned by the catalog query, may be {@code null}
     * @return {@code true} if the row matches
     */
    public boolean matches(QueryRow row) {
        long count = row != null && row.count() != null ? row.count() : 0L;
        Boolean flag = row != null ? row.result() : null;
        return switch (this) {
            case ZERO -> count == 0;
            case NON_ZERO -> count > 0;
            case BOOLEAN_TRUE -> Boolean.TRUE.equals(flag);
            case BOOLEAN_FALSE -> Boolean.FALSE.equals(flag);
        };
    }

    public String jsonName() {
        return name().toLowerCase();
    }
}
