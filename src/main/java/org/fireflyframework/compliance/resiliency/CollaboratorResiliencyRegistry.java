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

package org.fireflyframework.compliance.resiliency;

import io.github.resilience4j.bulkhead.Bulkhead;
import io.github.resilience4j.bulkhead.BulkheadConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.reactor.bulkhead.operator.BulkheadOperator;
import io.github.resilience4j.reactor.circuitbreaker.operator.CircuitBreakerOperator;
import io.github.resilience4j.reactor.ratelimiter.operator.RateLimiterOperator;
import io.github.resilience4j.reactor.retry.RetryOperator;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.compliance.exception.UnknownQueryException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeoutException;

/**
 * Registry that manages per-collaborator Resilience4j instances.
 *
 * <p>Every read a rule causes goes through one of the collaborators named by the
 * constants below. Each can have its own circuit breaker, retry, rate limiter,
 * bulkhead and timeout. Collaborators without explicit configuration only get the
 * default timeout.</p>
 *
 * <p>Decoration is applied in order: bulkhead, rate limiter, circuit breaker,
 * retry, timeout.</p>
 */
@Slf4j
public class CollaboratorResiliencyRegistry {

    public static final String QUERY_CATALOG = "query-catalog";
    public static final String METRICS_SOURCE = "metrics-source";
    public static final String PATTERN_SOURCE = "pattern-source";
    public static final String WORKFLOW_SOURCE = "workflow-source";
    public static final String ENTITY_SOURCE = "entity-source";

    private final long defaultTimeoutMs;
    private final Map<String, CollaboratorResiliencyInstances> collaboratorInstances;

    public CollaboratorResiliencyRegistry(Map<String, CollaboratorResiliencyConfig> collaboratorConfigs,
                                          long defaultTimeoutMs) {
        this.defaultTimeoutMs = defaultTimeoutMs;
        this.collaboratorInstances = new ConcurrentHashMap<>();

        collaboratorConfigs.forEach((collaborator, config) -> {
            collaboratorInstances.put(collaborator, createInstances(collaborator, config));
            log.info("Registered resilience configuration for collaborator '{}': "
                            + "circuitBreaker={}, retry={}, rateLimiter={}, bulkhead={}, timeoutMs={}",
                    collaborator,
                    config.isCircuitBreakerEnabled(),
                    config.isRetryEnabled(),
                    config.isRateLimiterEnabled(),
                    config.isBulkheadEnabled(),
                    config.getTimeoutMs());
        });

        log.info("Initialized CollaboratorResiliencyRegistry with {} collaborator-specific configurations",
                collaboratorInstances.size());
    }

    /**
     * Creates a registry that applies only the given timeout to every collaborator.
     *
     * @param timeout the per-call timeout
     * @return a registry without collaborator-specific configuration
     */
    public static CollaboratorResiliencyRegistry withTimeout(Duration timeout) {
        return new CollaboratorResiliencyRegistry(Map.of(), timeout.toMillis());
    }

    /**
     * Decorates a single-valued collaborator call.
     *
     * @param collaborator the collaborator name
     * @param operation    the reactive operation to decorate
     * @param <T>          the return type
     * @return the decorated operation
     */
    public <T> Mono<T> decorate(String collaborator, Mono<T> operation) {
        CollaboratorResiliencyInstances instances = collaboratorInstances.get(collaborator);

        if (instances == null) {
            log.debug("No collaborator-specific config for '{}', applying default timeout", collaborator);
            return operation.timeout(Duration.ofMillis(defaultTimeoutMs));
        }

        return applyCollaboratorResiliency(collaborator, operation, instances);
    }

    /**
     * Decorates a multi-valued collaborator call by collecting it first.
     *
     * @param collaborator the collaborator name
     * @param operation    the reactive operation to decorate
     * @param <T>          the element type
     * @return the decorated operation
     */
    public <T> Flux<T> decorateMany(String collaborator, Flux<T> operation) {
        return decorate(collaborator, operation.collectList()).flatMapIterable(list -> list);
    }

    /**
     * Returns whether a collaborator-specific configuration exists.
     *
     * @param collaborator the collaborator name
     * @return true if the collaborator has explicit resilience configuration
     */
    public boolean hasCollaboratorConfig(String collaborator) {
        return collaboratorInstances.containsKey(collaborator);
    }

    private <T> Mono<T> applyCollaboratorResiliency(String collaborator, Mono<T> operation,
                                                    CollaboratorResiliencyInstances instances) {
        Mono<T> decorated = operation;

        if (instances.bulkhead() != null) {
            log.debug("Applying bulkhead to collaborator '{}' call", collaborator);
            decorated = decorated.transformDeferred(BulkheadOperator.of(instances.bulkhead()));
        }

        if (instances.rateLimiter() != null) {
            log.debug("Applying rate limiter to collaborator '{}' call", collaborator);
            decorated = decorated.transformDeferred(RateLimiterOperator.of(instances.rateLimiter()));
        }

        if (instances.circuitBreaker() != null) {
            log.debug("Applying circuit breaker to collaborator '{}' call", collaborator);
            decorated = decorated.transformDeferred(CircuitBreakerOperator.of(instances.circuitBreaker()));
        }

        if (instances.retry() != null) {
            log.debug("Applying retry to collaborator '{}' call", collaborator);
            decorated = decorated.transformDeferred(RetryOperator.of(instances.retry()));
        }

        return decorated.timeout(Duration.ofMillis(instances.timeoutMs()));
    }

    private CollaboratorResiliencyInstances createInstances(String collaborator, CollaboratorResiliencyConfig config) {
        CircuitBreaker circuitBreaker = null;
        Retry retry = null;
        RateLimiter rateLimiter = null;
        Bulkhead bulkhead = null;

        if (config.isCircuitBreakerEnabled()) {
            CircuitBreakerConfig cbConfig = CircuitBreakerConfig.custom()
                    .failureRateThreshold(config.getCircuitBreakerFailureRateThreshold())
                    .slidingWindowSize(config.getCircuitBreakerSlidingWindowSize())
                    .waitDurationInOpenState(Duration.ofMillis(config.getCircuitBreakerWaitDurationInOpenStateMs()))
                    .ignoreExceptions(UnknownQueryException.class)
                    .build();
            circuitBreaker = CircuitBreaker.of(collaborator, cbConfig);
        }

        if (config.isRetryEnabled()) {
            RetryConfig retryConfig = RetryConfig.custom()
                    .maxAttempts(config.getRetryMaxAttempts())
                    .waitDuration(Duration.ofMillis(config.getRetryWaitDurationMs()))
                    .retryExceptions(Exception.class)
                    .ignoreExceptions(TimeoutException.class, UnknownQueryException.class)
                    .build();
            retry = Retry.of(collaborator, retryConfig);
        }

        if (config.isRateLimiterEnabled()) {
            RateLimiterConfig rlConfig = RateLimiterConfig.custom()
                    .limitForPeriod(config.getRateLimitForPeriod())
                    .limitRefreshPeriod(Duration.ofMillis(config.getRateLimitRefreshPeriodMs()))
                    .timeoutDuration(Duration.ZERO)
                    .build();
            rateLimiter = RateLimiter.of(collaborator, rlConfig);
        }

        if (config.isBulkheadEnabled()) {
            BulkheadConfig bhConfig = BulkheadConfig.custom()
                    .maxConcurrentCalls(config.getBulkheadMaxConcurrentCalls())
                    .build();
            bulkhead = Bulkhead.of(collaborator, bhConfig);
        }

        return new CollaboratorResiliencyInstances(
                circuitBreaker, retry, rateLimiter, bulkhead, config.getTimeoutMs()
        );
    }

    private record CollaboratorResiliencyInstances(
            CircuitBreaker circuitBreaker,
            Retry retry,
            RateLimiter rateLimiter,
            Bulkhead bulkhead,
            long timeoutMs
    ) {}
}
