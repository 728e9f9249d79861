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
import org.fireflyframework.compliance.model.WorkflowExecution;
import org.fireflyframework.compliance.model.WorkflowRuleConfig;
import org.fireflyframework.compliance.resiliency.CollaboratorResiliencyRegistry;
import org.fireflyframework.compliance.source.WorkflowSource;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

/**
 * Evaluates workflow rules against the organization's recent workflow executions.
 *
 * <p>Each execution is checked for required steps, required approvers (an approver
 * matches when it equals or contains the required name) and maximum duration. Every
 * non-compliant execution yields one failing finding; when no executions exist the
 * rule passes with an informational finding.</p>
 */
@Slf4j
public class WorkflowRuleEvaluator implements RuleTypeEvaluator<WorkflowRuleConfig> {

    private final WorkflowSource workflowSource;
    private final CollaboratorResiliencyRegistry resiliencyRegistry;

    public WorkflowRuleEvaluator(WorkflowSource workflowSource, CollaboratorResiliencyRegistry resiliencyRegistry) {
        this.workflowSource = workflowSource;
        this.resiliencyRegistry = resiliencyRegistry;
    }

    @Override
    public Mono<EvaluationOutcome> evaluate(WorkflowRuleConfig config, RuleEvaluationContext context) {
        return resiliencyRegistry.decorateMany(CollaboratorResiliencyRegistry.WORKFLOW_SOURCE,
                        workflowSourceFor(context.getOrganizationId()))
                .collectList()
                .map(executions -> check(config, executions))
                .onErrorResume(error -> {
                    String reason = RuleEvaluationException.describe(error);
                    log.warn("Workflow lookup failed for organization {}: {}", context.getOrganizationId(), reason);
                    return Mono.just(EvaluationOutcome.errored(
                            EvaluationFinding.fail("Workflow Evaluation", "Failed to evaluate workflows: " + reason),
                            "Workflow evaluation error: " + reason));
                });
    }

    private Flux<WorkflowExecution> workflowSourceFor(String organizationId) {
        return Flux.defer(() -> workflowSource.getRecentWorkflowExecutions(organizationId));
    }

    private EvaluationOutcome check(WorkflowRuleConfig config, List<WorkflowExecution> executions) {
        if (executions.isEmpty()) {
            return EvaluationOutcome.of(true,
                    List.of(EvaluationFinding.info("Workflows", "No workflows found to evaluate")),
                    "No workflows to evaluate");
        }

        List<EvaluationFinding> findings = new ArrayList<>();
        for (WorkflowExecution execution : executions) {
            List<String> issues = issuesOf(config, execution);
            if (!issues.isEmpty()) {
                findings.add(EvaluationFinding.builder()
                        .type(FindingType.FAIL)
                        .entity(execution.name())
                        .entityId(execution.id())
                        .description("Workflow \"" + execution.name() + "\": " + String.join("; ", issues))
                        .remediation("Ensure workflow meets all compliance requirements")
                        .build());
            }
        }

        boolean passed = findings.isEmpty();
        if (passed) {
            findings.add(EvaluationFinding.pass("Workflows",
                    "All " + executions.size() + " workflows meet compliance requirements"));
        }
        return EvaluationOutcome.of(passed, findings, passed
                ? "Workflow compliance check passed"
                : "Workflow compliance check failed: " + findings.size() + " non-compliant workflows");
    }

    private static List<String> issuesOf(WorkflowRuleConfig config, WorkflowExecution execution) {
        List<String> issues = new ArrayList<>();

        List<String> missingSteps = config.requiredSteps().stream()
                .filter(step -> !execution.completedSteps().contains(step))
                .toList();
        if (!missingSteps.isEmpty()) {
            issues.add("missing required steps: " + String.join(", ", missingSteps));
        }

        if (config.requiredApprovers() != null) {
            List<String> missingApprovers = config.requiredApprovers().stream()
                    .filter(required -> execution.approvers().stream()
                            .noneMatch(approver -> approver.equals(required) || approver.contains(required)))
                    .toList();
            if (!missingApprovers.isEmpty()) {
                issues.add("missing required approvers: " + String.join(", ", missingApprovers));
            }
        }

        if (config.maxDurationHours() != null && execution.durationHours() > config.maxDurationHours()) {
            issues.add(String.format("exceeded time limit (%.1fh > %sh)",
                    execution.durationHours(), config.maxDurationHours()));
        }
        return issues;
    }
}
