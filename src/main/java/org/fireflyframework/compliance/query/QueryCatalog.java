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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Fixed, named set of safe read-only queries that query rules may invoke.
 *
 * <p>This is the only way a rule can read organizational data. Rule authors pick a
 * query id; they never supply SQL. Whether a rule is safe therefore reduces to
 * whether its id is in this table. The catalog is immutable once built.</p>
 */
public final class QueryCatalog {

    private static final Duration ONE_DAY = Duration.ofHours(24);

    private final Map<String, CatalogQuery> queries;

    private QueryCatalog(Map<String, CatalogQuery> queries) {
        this.queries = Collections.unmodifiableMap(new LinkedHashMap<>(queries));
    }

    /**
     * Builds a catalog from the given queries. Ids must be unique.
     *
     * @param queries the queries
     * @return an immutable catalog
     */
    public static QueryCatalog of(List<CatalogQuery> queries) {
        Map<String, CatalogQuery> byId = new LinkedHashMap<>();
        for (CatalogQuery query : queries) {
            if (byId.putIfAbsent(query.id(), query) != null) {
                throw new IllegalArgumentException("Duplicate catalog query id: " + query.id());
            }
        }
        return new QueryCatalog(byId);
    }

    /**
     * Returns the standard catalog of security and data-protection checks.
     *
     * @return the default catalog
     */
    public static QueryCatalog defaultCatalog() {
        return of(List.of(
                CatalogQuery.count("count_users_without_mfa",
                        "Count users without MFA enabled",
                        "SELECT COUNT(*) AS count FROM \"User\" "
                                + "WHERE \"organizationId\" = ? AND \"mfaEnabled\" = false"),
                CatalogQuery.count("count_stale_api_keys",
                        "Count API keys not used in 90 days",
                        "SELECT COUNT(*) AS count FROM \"ApiKey\" "
                                + "WHERE \"organizationId\" = ? AND \"lastUsedAt\" < ?",
                        Duration.ofDays(90)),
                CatalogQuery.count("count_failed_logins",
                        "Count failed login attempts in last 24 hours",
                        "SELECT COUNT(*) AS count FROM \"AuditLog\" "
                                + "WHERE \"organizationId\" = ? AND \"action\" = 'login_failed' AND \"createdAt\" > ?",
                        ONE_DAY),
                CatalogQuery.count("count_unencrypted_credentials",
                        "Count credentials without proper encryption",
                        "SELECT COUNT(*) AS count FROM \"ConnectorCredential\" cc "
                                + "JOIN \"ConnectorInstance\" ci ON cc.\"instanceId\" = ci.id "
                                + "WHERE ci.\"organizationId\" = ? AND cc.\"keyId\" = 'legacy_unencrypted'"),
                CatalogQuery.count("count_expired_certificates",
                        "Count expired certificates",
                        "SELECT COUNT(*) AS count FROM \"Certificate\" "
                                + "WHERE \"organizationId\" = ? AND \"expiresAt\" < ?",
                        Duration.ZERO),
                CatalogQuery.count("count_orphaned_permissions",
                        "Count permissions without valid users",
                        "SELECT COUNT(*) AS count FROM \"Permission\" p "
                                + "LEFT JOIN \"User\" u ON p.\"userId\" = u.id "
                                + "WHERE p.\"organizationId\" = ? AND u.id IS NULL"),
                CatalogQuery.flag("check_backup_exists",
                        "Check if backup exists within 24 hours",
                        "SELECT EXISTS(SELECT 1 FROM \"Backup\" "
                                + "WHERE \"organizationId\" = ? AND \"createdAt\" > ?) AS result",
                        ONE_DAY),
                CatalogQuery.flag("check_audit_enabled",
                        "Check if audit logging is enabled",
                        "SELECT \"auditLoggingEnabled\" AS result FROM \"OrganizationSettings\" "
                                + "WHERE \"organizationId\" = ?"),
                CatalogQuery.count("count_data_retention_violations",
                        "Count events exceeding retention period",
                        "SELECT COUNT(*) AS count FROM \"Event\" "
                                + "WHERE \"organizationId\" = ? AND \"createdAt\" < ?",
                        Duration.ofDays(7 * 365 + 2)),
                CatalogQuery.count("count_gdpr_consent_missing",
                        "Count active persons without GDPR consent",
                        "SELECT COUNT(*) AS count FROM \"Person\" "
                                + "WHERE \"organizationId\" = ? AND \"gdprConsentGiven\" = false AND \"isActive\" = true")
        ));
    }

    public Optional<CatalogQuery> find(String queryId) {
        return queryId == null ? Optional.empty() : Optional.ofNullable(queries.get(queryId));
    }

    public boolean contains(String queryId) {
        return queryId != null && queries.containsKey(queryId);
    }

    /**
     * Lists the available checks for an administration surface, without SQL.
     *
     * @return descriptors in catalog order
     */
    public List<QueryDescriptor> listQueries() {
        return queries.values().stream()
                .map(query -> new QueryDescriptor(query.id(), query.description()))
                .toList();
    }

    public int size() {
        return queries.size();
    }
}
