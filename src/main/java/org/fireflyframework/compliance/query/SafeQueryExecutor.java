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

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.compliance.exception.UnknownQueryException;
import org.fireflyframework.compliance.model.QueryRow;
import org.fireflyframework.compliance.resiliency.CollaboratorResiliencyRegistry;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.sql.Timestamp;
import java.time.Clock;
import java.util.List;

/**
 * Executes catalog queries against the organization's relational store.
 *
 * <p>Only ids present in the {@link QueryCatalog} are executed; anything else fails
 * with {@link UnknownQueryException} before the store is touched. There is no code
 * path that accepts SQL text from a caller. The organization id and any time window
 * are bound as JDBC parameters.</p>
 */
@Slf4j
public class SafeQueryExecutor {

    private static final RowMapper<QueryRow> COUNT_ROW = (rs, rowNum) -> QueryRow.ofCount(rs.getLong("count"));

    private static final RowMapper<QueryRow> FLAG_ROW = (rs, rowNum) -> {
        boolean value = rs.getBoolean("result");
        return QueryRow.ofResult(rs.wasNull() ? null : value);
    };

    private final QueryCatalog catalog;
    private final JdbcTemplate jdbcTemplate;
    private final CollaboratorResiliencyRegistry resiliencyRegistry;
    private final Clock clock;

    /**
     * Creates an executor.
     *
     * @param catalog            the whitelist of executable queries
     * @param jdbcTemplate       the data store, or {@code null} if none is configured
     * @param resiliencyRegistry resilience decoration for store calls
     * @param clock              clock used to compute time-window parameters
     */
    public SafeQueryExecutor(QueryCatalog catalog, JdbcTemplate jdbcTemplate,
                             CollaboratorResiliencyRegistry resiliencyRegistry, Clock clock) {
        this.catalog = catalog;
        this.jdbcTemplate = jdbcTemplate;
        this.resiliencyRegistry = resiliencyRegistry;
        this.clock = clock;
    }

    /**
     * Runs a whitelisted query for one organization.
     *
     * @param queryId        the catalog key
     * @param organizationId the organization, bound as a parameter
     * @return the returned rows; fails with {@link UnknownQueryException} for ids outside the catalog
     */
    public Mono<List<QueryRow>> executeSafeQuery(String queryId, String organizationId) {
        return Mono.defer(() -> {
            CatalogQuery query = catalog.find(queryId).orElse(null);
            if (query == null) {
                log.warn("Rejected execution of non-whitelisted query '{}'", queryId);
                return Mono.error(new UnknownQueryException(queryId));
            }
            if (organizationId == null || organizationId.isBlank()) {
                return Mono.error(new IllegalArgumentException("organizationId is required"));
            }
            if (jdbcTemplate == null) {
                return Mono.error(new IllegalStateException("No JdbcTemplate configured for the query catalog"));
            }

            Object[] arguments = bindArguments(query, organizationId);
            RowMapper<QueryRow> rowMapper = query.resultKind() == CatalogQuery.ResultKind.COUNT ? COUNT_ROW : FLAG_ROW;

            log.debug("Executing catalog query '{}' for organization {}", queryId, organizationId);
            Mono<List<QueryRow>> execution = Mono.fromCallable(() -> jdbcTemplate.query(query.sql(), rowMapper, arguments))
                    .subscribeOn(Schedulers.boundedElastic());
            return resiliencyRegistry.decorate(CollaboratorResiliencyRegistry.QUERY_CATALOG, execution);
        });
    }

    public QueryCatalog getCatalog() {
        return catalog;
    }

    private Object[] bindArguments(CatalogQuery query, String organizationId) {
        if (query.window() == null) {
            return new Object[] {organizationId};
        }
        return new Object[] {organizationId, Timestamp.from(clock.instant().minus(query.window()))};
    }
}
