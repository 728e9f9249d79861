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

package org.fireflyframework.compliance.job;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.compliance.engine.ComplianceBatchOrchestrator;
import org.fireflyframework.compliance.exception.RuleEvaluationException;
import org.fireflyframework.compliance.model.BatchEvaluationResult;
import org.fireflyframework.compliance.model.RuleFilter;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Entry point for scheduled compliance checks.
 *
 * <p>The library starts no timers; an external scheduler calls {@link #run} per
 * organization. Without a framework or category filter only due rules are evaluated.
 * The returned {@link Mono} never signals an error.</p>
 */
@Slf4j
public class ComplianceCheckJob {

    private final ComplianceBatchOrchestrator orchestrator;
    private final Clock clock;

    public ComplianceCheckJob(ComplianceBatchOrchestrator orchestrator, Clock clock) {
        this.orchestrator = orchestrator;
        this.clock = clock;
    }

    public Mono<ComplianceJobResult> run(ComplianceJobRequest request) {
        long startTime = System.currentTimeMillis();
        String organizationId = request.getOrganizationId();

        return Mono.defer(() -> {
                    if (organizationId == null || organizationId.isBlank()) {
                        return Mono.error(new IllegalArgumentException("organizationId is required"));
                    }
                    log.info("Starting compliance check for organization {} (filtered={}, dryRun={})",
                            organizationId, request.hasFilter(), request.isDryRun());
                    return request.hasFilter()
                            ? orchestrator.evaluateAll(organizationId, RuleFilter.builder()
                                    .framework(request.getFramework())
                                    .category(request.getCategory())
                                    .build(), request.isDryRun())
                            : orchestrator.evaluateDue(organizationId);
                })
                .map(batch -> success(organizationId, batch, startTime))
                .onErrorResume(error -> {
                    log.error("Compliance check failed for organization {}", organizationId, error);
                    return Mono.just(failure(organizationId, error, startTime));
                });
    }

    private ComplianceJobResult success(String organizationId, BatchEvaluationResult batch, long startTime) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("passed", batch.getPassedRules());
        details.put("failed", batch.getFailedRules());
        details.put("skipped", batch.getSkippedRules());
        details.put("executionTimeMs", batch.getExecutionTimeMs());

        return ComplianceJobResult.builder()
                .organizationId(organizationId)
                .durationMs(System.currentTimeMillis() - startTime)
                .success(true)
                .rulesEvaluated(batch.getTotalRules())
                .violationsDetected(batch.getFailedRules())
                .details(details)
                .completedAt(clock.instant())
                .build();
    }

    private ComplianceJobResult failure(String organizationId, Throwable error, long startTime) {
        return ComplianceJobResult.builder()
                .organizationId(organizationId)
                .durationMs(System.currentTimeMillis() - startTime)
                .success(false)
                .details(Map.of("error", RuleEvaluationException.describe(error)))
                .completedAt(clock.instant())
                .build();
    }
}
