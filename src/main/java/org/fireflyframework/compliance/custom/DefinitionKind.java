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
 * Kinds of declarative custom rule definitions.
 */
public enum DefinitionKind {

    DATA_EXISTS("data_exists"),
    DATA_COUNT("data_count"),
    FIELD_VALUE("field_value"),
    DATE_COMPARISON("date_comparison"),
    RELATIONSHIP_EXISTS("relationship_exists"),
    AGGREGATE("aggregate");

    private final String jsonName;

    DefinitionKind(String jsonName) {
        this.jsonName = jsonName;
    }

    public String jsonName() {
        return jsonName;
    }

    public static boolean isSupported(Object kind) {
        for (DefinitionKind candidate : values()) {
            if (candidate.jsonName.equals(kind)) {
                return true;
            }
        }
        return false;
    }
}
