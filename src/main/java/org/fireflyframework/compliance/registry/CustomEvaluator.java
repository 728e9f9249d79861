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

package org.fireflyframework.compliance.registry;

import org.fireflyframework.compliance.model.CustomRuleConfig;
import org.fireflyframework.compliance.model.RuleEvaluationContext;
import reactor.core.publisher.Mono;

/**
 * Pluggable rule behavior contributed by a domain-specific checker module.
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * registry.register("gdpr_consent", (config, context) ->
 *         consentService.countMissingConsents(context.getOrganizationId())
 *                 .map(missing -> new CustomEvaluation(missing == 0, List.of(
 *                         missing == 0
 *                                 ? EvaluationFinding.pass("Consent", "All active persons gave consent")
 *                                 : EvaluationFinding.fail("Consent", missing + " persons without consent")))));
 * }</pre>
 */
@FunctionalInterface
public interface CustomEvaluator {

    Mono<CustomEvaluation> evaluate(CustomRuleConfig config, RuleEvaluationContext context);
}
