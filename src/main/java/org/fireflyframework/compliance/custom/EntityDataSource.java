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

package org.fireflyframework.compliance.custom;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Port to the organization's entity store, used by defined custom rules.
 *
 * <p>Every filter handed to this port already contains the {@code organizationId}
 * entry; implementations must honor it.</p>
 */
public interface EntityDataSource {

    Mono<Long> countEntities(String entityType, Map<String, Object> filter);

    /**
     * Returns the entities of a type as property maps. Nested properties are maps too.
     *
     * @param entityType the entity type
     * @param filter     equality filter, including {@code organizationId}
     * @return the matching entities
     */
    Flux<Map<String, Object>> getEntities(String entityType, Map<String, Object> filter);

    Mono<Boolean> relationshipExists(String sourceEntity, String targetEntity, String relationshipType,
                                     String organizationId);

    /**
     * Computes an aggregate over a numeric field.
     *
     * @param entityType the entity type
     * @param function   the aggregation
     * @param field      the aggregated field; {@code null} for {@link AggregateDefinition.Function#COUNT}
     * @param filter     equality filter, including {@code organizationId}
     * @return the aggregate value
     */
    Mono<Double> aggregate(String entityType, AggregateDefinition.Function function, String field,
                           Map<String, Object> filter);

    /**
     * Returns a source whose every call fails, for deployments without an entity store.
     *
     * @return the unavailable source
     */
    static EntityDataSource unavailable() {
        return new EntityDataSource() {
            @Override
            public Mono<Long> countEntities(String entityType, Map<String, Object> filter) {
                return Mono.error(new IllegalStateException("No EntityDataSource configured"));
            }

            @Override
            public Flux<Map<String, Object>> getEntities(String entityType, Map<String, Object> filter) {
                return Flux.error(new IllegalStateException("No EntityDataSource configured"));
            }

            @Override
            public Mono<Boolean> relationshipExists(String sourceEntity, String targetEntity,
                                                    String relationshipType, String organizationId) {
                return Mono.error(new IllegalStateException("No EntityDataSource configured"));
            }

            @Override
            public Mono<Double> aggregate(String entityType, AggregateDefinition.Function function, String field,
                                          Map<String, Object> filter) {
                return Mono.error(new IllegalStateException("No EntityDataSource configured"));
            }
        };
    }
}
