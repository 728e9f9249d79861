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

package org.fireflyframework.compliance.query;

import java.time.Duration;

/**
 * One whitelisted, parameterized read-only query.
 *
 * <p>The SQL always binds the organization id as its first {@code ?} parameter. When
 * {@code window} is set, a second {@code ?} parameter receives the timestamp
 * {@code now - window}.</p>
 *
 * @param id          catalog key referenced by query rules
 * @param description human-readable description shown to administrators
 * @param sql         the parameterized SQL text
 * @param resultKind  shape of the single returned row
 * @param window      lookback bound as the second parameter, or {@code null}
 */
public record CatalogQuery(String id, String description, String sql, ResultKind resultKind, Duration window) {

    /**
     * Shape of the row a catalog query returns.
     */
    public enum ResultKind {
        /** A {@code count} column. */
        COUNT,
        /** A boolean {@code result} column. */
        BOOLEAN
    }

    public static CatalogQuery count(String id, String description, String sql) {
        return new CatalogQuery(id, description, sql, ResultKind.COUNT, null);
    }

    public static CatalogQuery count(String id, String description, String sql, Duration window) {
        return new CatalogQuery(id, description, sql, ResultKind.COUNT, window);
    }

    public static CatalogQuery flag(String id, String description, String sql) {
        return new CatalogQuery(id, description, sql, ResultKind.BOOLEAN, null);
    }

    public static CatalogQuery flag(String id, String description, String sql, Duration window) {
        return new CatalogQuery(id, description, sql, ResultKind.BOOLEAN, window);
    }
}
