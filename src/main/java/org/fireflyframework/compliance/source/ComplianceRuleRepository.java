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

package org.fireflyframework.compliance.source;

import org.fireflyframework.compliance.model.ComplianceRule;
import org.fireflyframework.compliance.model.RuleFilter;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;

/**
 * Port to the persistent rule catalog and its statistics.
 *
 * <p>Implementations back this with the organization's relational store. The
 * engine never creates, edits or deletes rule definitions through this port.</p>
 */
public interface ComplianceRuleRepository {

    /**
     * Finds every active rule of the organization matching the filter.
     *
     * @param organizationId the organization
     * @param filter         optional framework/category/frequency filter
     * @return matching active rules, in no particular order
     */
    Flux<ComplianceRule> findActiveRules(String organizationId, RuleFilter filter);

    /**
     * Finds active rules that were never checked, or whose check interval has elapsed
     * at {@code now}. See {@link org.fireflyframework.compliance.model.CheckFrequency#isDue}.
     *
     * @param organizationId the organization
     * @param now            the reference instant
     * @return due rules
     */
    Flux<ComplianceRule> findDueRules(String organizationId, Instant now);

    /**
     * Finds every rule of the organization, active or not.
     *
     * @param organizationId the organization
     * @return all rules
     */
    Flux<ComplianceRule> findAllRules(String organizationId);

    /**
     * Atomically increments the pass or fail counter of a rule (never both) and sets
     * its {@code lastCheckedAt}.
     *
     * @param ruleId    the rule
     * @param passed    which counter to increment
     * @param checkedAt the new {@code lastCheckedAt}
     * @return completion signal
     */
    Mono<Void> incrementStatistics(String ruleId, boolean passed, Instant checkedAt);
}
