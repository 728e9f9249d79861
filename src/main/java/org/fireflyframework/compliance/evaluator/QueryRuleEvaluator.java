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

package org.fireflyframework.compliance.evaluator;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.compliance.exception.RuleEvaluationException;
import org.fireflyframework.compliance.exception.UnknownQueryException;
import org.fireflyframework.compliance.model.EvaluationFinding;
import org.fireflyframework.compliance.model.EvaluationOutcome;
import org.fireflyframework.compliance.model.QueryRow;
import org.fireflyframework.compliance.model.QueryRuleConfig;
import org.fireflyframework.compliance.model.RuleEvaluationContext;
import org.fireflyframework.compliance.query.SafeQueryExecutor;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Evaluates query rules through the whitelisted {@link SafeQueryExecutor}.
 *
 * <p>A query id outside the catalog is reported as a failing finding: a misconfigured
 * rule is itself a compliance gap.</p>
 */
@Slf4j
public class QueryRuleEvaluator implements RuleTypeEvaluator<QueryRuleConfig> {

    private final SafeQueryExecutor queryExecutor;

    public QueryRuleEvaluator(SafeQueryExecutor queryExecutor) {
        this.queryExecutor = queryExecutor;
    }

    @Override
    public Mono<EvaluationOutcome> evaluate(QueryRuleConfig config, RuleEvaluationContext context) {
        String queryId = config.queryId();
        if (!queryExecutor.getCatalog().contains(queryId)) {
            return Mono.just(notWhitelisted(queryId));
        }
        if (config.expectedResult() == null) {
            return Mono.just(EvaluationOutcome.failed(
                    EvaluationFinding.fail("Query Validation", "Query rule \"" + queryId + "\" has no expected result"),
                    "Query rule misconfigured"));
        }

        return queryExecutor.executeSafeQuery(queryId, context.getOrganizationId())
                .map(rows -> compare(config, rows))
                .onErrorResume(UnknownQueryException.class, error -> Mono.just(notWhitelisted(queryId)))
                .onErrorResume(error -> {
                    String reason = RuleEvaluationException.describe(error);
                    log.warn("Catalog query '{}' failed for organization {}: {}",
                            queryId, context.getOrganizationId(), reason);
                    return Mono.just(EvaluationOutcome.errored(
                            EvaluationFinding.fail("Query Execution", "Query execution failed: " + reason),
                            "Query execution error: " + reason));
                });
    }

    private EvaluationOutcome compare(QueryRuleConfig config, List<QueryRow> rows) {
        QueryRow first = rows.isEmpty() ? null : rows.get(0);
        boolean passed = config.expectedResult().matches(first);
        String expected = config.expectedResult().jsonName();

        EvaluationFinding finding = passed
                ? EvaluationFinding.pass("Query Result",
                        "Query \"" + config.queryId() + "\" returned expected result (" + expected + ")")
                : EvaluationFinding.fail("Query Result",
                        "Query \"" + config.queryId() + "\" did not return expected result. Expected: " + expected);

        return EvaluationOutcome.of(passed, List.of(finding),
                passed ? "Query compliance check passed" : "Query compliance check failed");
    }

    private static EvaluationOutcome notWhitelisted(String queryId) {
        return EvaluationOutcome.failed(
                EvaluationFinding.fail("Query Validation", "Query ID \"" + queryId
                        + "\" is not in the whitelist. Only pre-approved compliance queries are allowed."),
                "Security: Query \"" + queryId + "\" not whitelisted. Contact admin to add approved queries.");
    }
}
