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

import lombok.Data;

/**
 * Resilience settings for one external collaborator (query catalog, metrics,
 * pattern or workflow source).
 *
 * <p>Bound from {@code firefly.compliance.collaborators.<name>.*}.</p>
 */
@Data
public class CollaboratorResiliencyConfig {

    private boolean circuitBreakerEnabled = true;
    private float circuitBreakerFailureRateThreshold = 50.0f;
    private int circuitBreakerSlidingWindowSize = 20;
    private long circuitBreakerWaitDurationInOpenStateMs = 30_000;

    private boolean retryEnabled = false;
    private int retryMaxAttempts = 2;
    private long retryWaitDurationMs = 200;

    private boolean rateLimiterEnabled = false;
    private int rateLimitForPeriod = 50;
    private long rateLimitRefreshPeriodMs = 1_000;

    private boolean bulkheadEnabled = false;
    private int bulkheadMaxConcurrentCalls = 10;

    private long timeoutMs = 30_000;
}
