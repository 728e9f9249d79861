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

import org.fireflyframework.compliance.model.EvaluationOutcome;
import org.fireflyframework.compliance.model.RuleConfig;
import org.fireflyframework.compliance.model.RuleEvaluationContext;
import reactor.core.publisher.Mono;

/**
 * Evaluates one kind of {@link RuleConfig}.
 *
 * <p>Implementations read organizational data only through their collaborator and
 * turn collaborator failures into failing outcomes instead of error signals, so one
 * rule's broken data source never aborts a batch.</p>
 *
 * @param <C> the configuration variant handled
 */
@FunctionalInterface
public interface RuleTypeEvaluator<C extends RuleConfig> {

    Mono<EvaluationOutcome> evaluate(C config, RuleEvaluationContext context);
}
