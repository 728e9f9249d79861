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
import org.fireflyframework.compliance.exception.UnregisteredEvaluatorException;
import org.fireflyframework.compliance.model.CustomRuleConfig;
import org.fireflyframework.compliance.model.EvaluationFinding;
import org.fireflyframework.compliance.model.EvaluationOutcome;
import org.fireflyframework.compliance.model.RuleEvaluationContext;
import org.fireflyframework.compliance.registry.CustomEvaluation;
import org.fireflyframework.compliance.registry.CustomEvaluatorRegistry;
import reactor.core.publisher.Mono;

/**
 * Routes custom rules to the evaluator registered under the rule's evaluator name.
 */
@Slf4j
public class CustomRuleDispatcher implements RuleTypeEvaluator<CustomRuleConfig> {

    private final CustomEvaluatorRegistry registry;

    public CustomRuleDispatcher(CustomEvaluatorRegistry registry) {
        this.registry = registry;
    }

    @Override
    public Mono<EvaluationOutcome> evaluate(CustomRuleConfig config, RuleEvaluationContext context) {
        String name = config.evaluatorName();
        return Mono.fromCallable(() -> registry.require(name))
                .flatMap(evaluator -> evaluator.evaluate(config, context))
                .switchIfEmpty(Mono.error(new IllegalStateException("Custom evaluator \"" + name + "\" returned no result")))
                .map(CustomRuleDispatcher::toOutcome)
                .onErrorResume(UnregisteredEvaluatorException.class, error -> {
                    log.warn("Rule references unregistered custom evaluator '{}'", name);
                    return Mono.just(EvaluationOutcome.failed(
                            EvaluationFinding.fail("Custom Evaluator", error.getMessage()),
                            "Custom evaluator \"" + name + "\" not registered"));
                })
                .onErrorResume(error -> {
                    String reason = RuleEvaluationException.describe(error);
                    log.warn("Custom evaluator '{}' failed for organization {}: {}",
                            name, context.getOrganizationId(), reason);
                    return Mono.just(EvaluationOutcome.errored(
                            EvaluationFinding.fail("Custom Evaluator", "Custom evaluation failed: " + reason),
                            "Custom evaluation error: " + reason));
                });
    }

    private static EvaluationOutcome toOutcome(CustomEvaluation evaluation) {
        return EvaluationOutcome.of(evaluation.passed(), evaluation.findings(),
                evaluation.passed() ? "Custom compliance check passed" : "Custom compliance check failed");
    }
}
