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

import lombok.Data;
import org.fireflyframework.compliance.resiliency.CollaboratorResiliencyConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration properties for the compliance engine.
 *
 * <pre>{@code
 * firefly:
 *   compliance:
 *     enabled: true
 *     default-timeout-ms: 30000
 *     batch:
 *       concurrency: 4
 *     collaborators:
 *       metrics-source:
 *         retry-enabled: true
 *         retry-max-attempts: 3
 * }</pre>
 */
@Data
@ConfigurationProperties(prefix = "firefly.compliance")
public class ComplianceEngineProperties {

    private boolean enabled = true;

    /**
     * Timeout applied to collaborators without their own configuration.
     */
    private long defaultTimeoutMs = 30000;

    private Batch batch = new Batch();

    /**
     * Resilience settings keyed by collaborator name: {@code query-catalog},
     * {@code metrics-source}, {@code pattern-source}, {@code workflow-source},
     * {@code entity-source}.
     */
    private Map<String, CollaboratorResiliencyConfig> collaborators = new LinkedHashMap<>();

    @Data
    public static class Batch {

        /**
         * Maximum number of rules evaluated at once within a batch.
         */
        private int concurrency = 4;
    }
}
