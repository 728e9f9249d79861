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

package org.fireflyframework.compliance.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.compliance.custom.DefinedRuleEvaluator;
import org.fireflyframework.compliance.custom.EntityDataSource;
import org.fireflyframework.compliance.engine.ComplianceBatchOrchestrator;
import org.fireflyframework.compliance.engine.ComplianceRuleEvaluator;
import org.fireflyframework.compliance.engine.ComplianceSummaryCalculator;
import org.fireflyframework.compliance.evaluator.CustomRuleDispatcher;
import org.fireflyframework.compliance.evaluator.PatternRuleEvaluator;
import org.fireflyframework.compliance.evaluator.QueryRuleEvaluator;
import org.fireflyframework.compliance.evaluator.ThresholdRuleEvaluator;
import org.fireflyframework.compliance.evaluator.WorkflowRuleEvaluator;
import org.fireflyframework.compliance.job.ComplianceCheckJob;
import org.fireflyframework.compliance.query.QueryCatalog;
import org.fireflyframework.compliance.query.SafeQueryExecutor;
import org.fireflyframework.compliance.registry.CustomEvaluatorRegistrar;
import org.fireflyframework.compliance.registry.CustomEvaluatorRegistry;
import org.fireflyframework.compliance.resiliency.CollaboratorResiliencyRegistry;
import org.fireflyframework.compliance.source.ComplianceRuleRepository;
import org.fireflyframework.compliance.source.MetricsSource;
import org.fireflyframework.compliance.source.PatternSource;
import org.fireflyframework.compliance.source.WorkflowSource;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Clock;
import java.util.List;

/**
 * Auto-configuration for the compliance rule engine.
 *
 * <p>This configuration automatically sets up:</p>
 * <ul>
 *   <li>The default {@link QueryCatalog} and a {@link SafeQueryExecutor} over the application's {@link JdbcTemplate}</li>
 *   <li>The type evaluators, decorated per collaborator by a {@link CollaboratorResiliencyRegistry}</li>
 *   <li>A {@link CustomEvaluatorRegistry} populated once from every {@link CustomEvaluatorRegistrar} bean</li>
 *   <li>{@link ComplianceRuleEvaluator}, {@link ComplianceBatchOrchestrator}, {@link ComplianceSummaryCalculator}
 *       and {@link ComplianceCheckJob}</li>
 * </ul>
 *
 * <p>Collaborators the application does not provide (metrics, patterns, workflows,
 * entities, JDBC) are replaced by sources that fail every call, so rules depending on
 * them fail with an errored finding instead of preventing startup.</p>
 *
 * <p><b>Example Configuration:</b></p>
 * <pre>{@code
 * firefly:
 *   compliance:
 *     enabled: true
 *     batch:
 *       concurrency: 8
 * }</pre>
 */
@Slf4j
@AutoConfiguration(
    after = ComplianceRuleStoreAutoConfiguration.class,
    afterName = "org.springframework.boot.autoconfigure.jdbc.JdbcTemplateAutoConfiguration"
)
@ConditionalOnProperty(
    prefix = "firefly.compliance",
    name = "enabled",
    havingValue = "true",
    matchIfMissing = true
)
@EnableConfigurationProperties(ComplianceEngineProperties.class)
public class ComplianceEngineAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock complianceClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public QueryCatalog queryCatalog() {
        QueryCatalog catalog = QueryCatalog.defaultCatalog();
        log.info("Configuring compliance query catalog with {} whitelisted queries", catalog.size());
        return catalog;
    }

    @Bean
    @ConditionalOnMissingBean
    public CollaboratorResiliencyRegistry collaboratorResiliencyRegistry(ComplianceEngineProperties properties) {
        return new CollaboratorResiliencyRegistry(properties.getCollaborators(), properties.getDefaultTimeoutMs());
    }

    /**
     * Creates the whitelisted query executor.
     *
     * <p>Without a {@link JdbcTemplate} bean the executor still rejects unknown query ids,
     * but every whitelisted query fails with an errored finding.</p>
     */
    @Bean
    @ConditionalOnMissingBean
    public SafeQueryExecutor safeQueryExecutor(QueryCatalog catalog,
                                               @Autowired(required = false) JdbcTemplate jdbcTemplate,
                                               CollaboratorResiliencyRegistry resiliencyRegistry,
                                               Clock clock) {
        if (jdbcTemplate == null) {
            log.warn("No JdbcTemplate available: query rules will report execution errors");
        }
        return new SafeQueryExecutor(catalog, jdbcTemplate, resiliencyRegistry, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public DefinedRuleEvaluator definedRuleEvaluator(@Autowired(required = false) EntityDataSource entityDataSource,
                                                     @Autowired(required = false) ObjectMapper objectMapper,
                                                     CollaboratorResiliencyRegistry resiliencyRegistry) {
        return new DefinedRuleEvaluator(
                entityDataSource != null ? entityDataSource : EntityDataSource.unavailable(),
                objectMapper != null ? objectMapper : new ObjectMapper(),
                resiliencyRegistry);
    }

    /**
     * Creates the custom evaluator registry and applies every registrar once.
     *
     * @param registrars the registrars contributed by checker modules, or {@code null} if none
     * @return the populated registry
     */
    @Bean
    @ConditionalOnMissingBean
    public CustomEvaluatorRegistry customEvaluatorRegistry(
            @Autowired(required = false) List<CustomEvaluatorRegistrar> registrars) {
        CustomEvaluatorRegistry registry = new CustomEvaluatorRegistry();
        List<CustomEvaluatorRegistrar> activeRegistrars = registrars != null ? registrars : List.of();
        activeRegistrars.forEach(registrar -> registrar.registerEvaluators(registry));
        log.info("Configuring custom evaluator registry with evaluators {}", registry.listRegistered());
        return registry;
    }

    @Bean
    @ConditionalOnMissingBean
    public QueryRuleEvaluator queryRuleEvaluator(SafeQueryExecutor queryExecutor) {
        return new QueryRuleEvaluator(queryExecutor);
    }

    @Bean
    @ConditionalOnMissingBean
    public ThresholdRuleEvaluator thresholdRuleEvaluator(@Autowired(required = false) MetricsSource metricsSource,
                                                         CollaboratorResiliencyRegistry resiliencyRegistry) {
        return new ThresholdRuleEvaluator(
                metricsSource != null ? metricsSource : MetricsSource.unavailable(), resiliencyRegistry);
    }

    @Bean
    @ConditionalOnMissingBean
    public PatternRuleEvaluator patternRuleEvaluator(@Autowired(required = false) PatternSource patternSource,
                                                     CollaboratorResiliencyRegistry resiliencyRegistry) {
        return new PatternRuleEvaluator(
                patternSource != null ? patternSource : PatternSource.unavailable(), resiliencyRegistry);
    }

    @Bean
    @ConditionalOnMissingBean
    public WorkflowRuleEvaluator workflowRuleEvaluator(@Autowired(required = false) WorkflowSource workflowSource,
                                                       CollaboratorResiliencyRegistry resiliencyRegistry) {
        return new WorkflowRuleEvaluator(
                workflowSource != null ? workflowSource : WorkflowSource.unavailable(), resiliencyRegistry);
    }

    @Bean
    @ConditionalOnMissingBean
    public CustomRuleDispatcher customRuleDispatcher(CustomEvaluatorRegistry registry) {
        return new CustomRuleDispatcher(registry);
    }

    @Bean
    @ConditionalOnMissingBean
    public ComplianceRuleEvaluator complianceRuleEvaluator(ComplianceRuleRepository repository,
                                                           QueryRuleEvaluator queryRuleEvaluator,
                                                           ThresholdRuleEvaluator thresholdRuleEvaluator,
                                                           PatternRuleEvaluator patternRuleEvaluator,
                                                           WorkflowRuleEvaluator workflowRuleEvaluator,
                                                           CustomRuleDispatcher customRuleDispatcher) {
        return new ComplianceRuleEvaluator(repository, queryRuleEvaluator, thresholdRuleEvaluator,
                patternRuleEvaluator, workflowRuleEvaluator, customRuleDispatcher);
    }

    /**
     * Creates the batch orchestrator. An {@link ApplicationEventPublisher} is injected
     * when available to publish a {@code ComplianceEvaluationEvent} per batch.
     */
    @Bean
    @ConditionalOnMissingBean
    public ComplianceBatchOrchestrator complianceBatchOrchestrator(
            ComplianceRuleRepository repository,
            ComplianceRuleEvaluator ruleEvaluator,
            Clock clock,
            ComplianceEngineProperties properties,
            @Autowired(required = false) ApplicationEventPublisher eventPublisher) {
        log.info("Configuring compliance batch orchestrator with concurrency {}", properties.getBatch().getConcurrency());
        return new ComplianceBatchOrchestrator(repository, ruleEvaluator, clock,
                properties.getBatch().getConcurrency(), eventPublisher);
    }

    @Bean
    @ConditionalOnMissingBean
    public ComplianceSummaryCalculator complianceSummaryCalculator(ComplianceRuleRepository repository) {
        return new ComplianceSummaryCalculator(repository);
    }

    @Bean
    @ConditionalOnMissingBean
    public ComplianceCheckJob complianceCheckJob(ComplianceBatchOrchestrator orchestrator, Clock clock) {
        return new ComplianceCheckJob(orchestrator, clock);
    }
}
