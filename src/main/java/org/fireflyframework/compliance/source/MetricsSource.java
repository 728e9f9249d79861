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

package org.fireflyframework.compliance.source;

import reactor.core.publisher.Mono;

/**
 * Port to the organization's metrics, used by threshold rules.
 */
@FunctionalInterface
public interface MetricsSource {

    Mono<Double> getMetricValue(String metricName, String organizationId);

    /**
     * Returns a source that fails every lookup, for deployments without metrics.
     *
     * @return an unavailable metrics source
     */
    static MetricsSource unavailable() {
        return (metricName, organizationId) ->
                Mono.error(new IllegalStateException("No MetricsSource configured"));
    }
}
