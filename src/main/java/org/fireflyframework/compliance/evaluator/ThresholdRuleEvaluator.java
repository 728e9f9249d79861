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
import org.fireflyframework.compliance.model.RuleEvaluationContext;
import org.fireflyframework.compliance.model.ThresholdRuleConfig;
import org.fireflyframework.compliance.resiliency.CollaboratorResiliencyRegistry;
import org.fireflyframework.compliance.source.MetricsSource;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Evaluates threshold rules against the organization's metrics.
 */
@Slf4j
public class ThresholdRuleEvaluator implements RuleTypeEvaluator<ThresholdRuleConfig> {

    private final MetricsSource metricsSource;
    private final CollaboratorResiliencyRegistry resiliencyRegistry;

    public ThresholdRuleEvaluator(MetricsSource metricsSource, CollaboratorResiliencyRegistry resiliencyRegistry) {
        this.metricsSource = metricsSource;
        this.resiliencyRegistry = resiliencyRegistry;
    }

    @Override
    public Mono<EvaluationOutcome> evaluate(ThresholdRuleConfig config, RuleEvaluationContext context) {
        String metric = config.metric();
        if (config.operator() == null || !config.operator().accepts(config.value())) {
            return Mono.just(EvaluationOutcome.failed(
                    EvaluationFinding.fail(String.valueOf(metric), "Invalid threshold configuration: operator "
                            + config.operator() + " cannot be applied to value " + config.value()
                            + " (between requires [min, max], other operators a single number)"),
                    "Threshold rule misconfigured for " + metric));
        }

        Mono<Double> metricValue = Mono.defer(() -> metricsSource.getMetricValue(metric, context.getOrganizationId()))
                .switchIfEmpty(Mono.error(new IllegalStateException("Metric " + metric + " has no value")));

        return resiliencyRegistry.decorate(CollaboratorResiliencyRegistry.METRICS_SOURCE, metricValue)
                .map(value -> compare(config, value))
                .onErrorResume(error -> {
                    String reason = RuleEvaluationException.describe(error);
                    log.warn("Metric '{}' lookup failed for organization {}: {}",
                            metric, context.getOrganizationId(), reason);
                    return Mono.just(EvaluationOutcome.errored(
                            EvaluationFinding.fail(metric, "Failed to evaluate threshold: " + reason),
                            "Threshold evaluation error: " + reason));
                });
    }

    private EvaluationOutcome compare(ThresholdRuleConfig config, double value) {
        String metric = config.metric();
        boolean passed = config.operator().test(value, config.value());

        EvaluationFinding finding = EvaluationFinding.builder()
                .type(passed ? FindingType.PASS : FindingType.FAIL)
                .entity(metric)
                .description(passed
                        ? "Metric " + metric + " (" + value + ") meets threshold requirement"
                        : "Metric " + metric + " (" + value + ") does not meet threshold ("
                                + config.operator().symbol() + " " + config.value() + ")")
                .remediation(passed ? null : "Adjust " + metric + " to meet compliance threshold")
                .build();

        return EvaluationOutcome.of(passed, List.of(finding),
                passed ? "Threshold check passed for " + metric : "Threshold check failed for " + metric);
    }
}
