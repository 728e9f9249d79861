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
import org.fireflyframework.compliance.model.EvaluationFinding;
import org.fireflyframework.compliance.model.EvaluationOutcome;
import org.fireflyframework.compliance.model.FindingType;
import org.fireflyframework.compliance.model.PatternRuleConfig;
import org.fireflyframework.compliance.model.RuleEvaluationContext;
import org.fireflyframework.compliance.resiliency.CollaboratorResiliencyRegistry;
import org.fireflyframework.compliance.source.PatternSource;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Evaluates pattern rules: passes when the pattern's presence in the scope matches
 * {@code shouldExist}.
 */
@Slf4j
public class PatternRuleEvaluator implements RuleTypeEvaluator<PatternRuleConfig> {

    private final PatternSource patternSource;
    private final CollaboratorResiliencyRegistry resiliencyRegistry;

    public PatternRuleEvaluator(PatternSource patternSource, CollaboratorResiliencyRegistry resiliencyRegistry) {
        this.patternSource = patternSource;
        this.resiliencyRegistry = resiliencyRegistry;
    }

    @Override
    public Mono<EvaluationOutcome> evaluate(PatternRuleConfig config, RuleEvaluationContext context) {
        Mono<Boolean> search = Mono.defer(() ->
                        patternSource.searchForPattern(config.pattern(), config.scope(), context.getOrganizationId()))
                .switchIfEmpty(Mono.error(new IllegalStateException("Pattern source returned no result")));

        return resiliencyRegistry.decorate(CollaboratorResiliencyRegistry.PATTERN_SOURCE, search)
                .map(found -> compare(config, found))
                .onErrorResume(error -> {
                    String reason = RuleEvaluationException.describe(error);
                    log.warn("Pattern search in scope '{}' failed for organization {}: {}",
                            config.scope(), context.getOrganizationId(), reason);
                    return Mono.just(EvaluationOutcome.errored(
                            EvaluationFinding.fail(config.scope(), "Pattern search failed: " + reason),
                            "Pattern evaluation error: " + reason));
                });
    }

    private EvaluationOutcome compare(PatternRuleConfig config, boolean found) {
        boolean passed = found == config.shouldExist();
        String description;
        if (passed) {
            description = config.shouldExist()
                    ? "Required pattern found in " + config.scope()
                    : "Prohibited pattern not found in " + config.scope();
        } else {
            description = config.shouldExist()
                    ? "Required pattern not found in " + config.scope()
                    : "Prohibited pattern found in " + config.scope();
        }

        EvaluationFinding finding = EvaluationFinding.builder()
                .type(passed ? FindingType.PASS : FindingType.FAIL)
                .entity(config.scope())
                .description(description)
                .remediation(passed ? null : config.shouldExist()
                        ? "Add required pattern to " + config.scope()
                        : "Remove prohibited pattern from " + config.scope())
                .build();

        return EvaluationOutcome.of(passed, List.of(finding),
                passed ? "Pattern check passed" : "Pattern check failed");
    }
}
