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

package org.fireflyframework.compliance.model;

import java.time.Instant;
import java.util.List;

/**
 * How a rule is checked: its typed configuration plus the waivers granted against it.
 *
 * @param config     the rule configuration
 * @param exceptions waivers granted against the rule
 */
public record RuleLogic(RuleConfig config, List<RuleWaiver> exceptions) {

    public RuleLogic {
        exceptions = exceptions != null ? List.copyOf(exceptions) : List.of();
    }

    public static RuleLogic of(RuleConfig config) {
        return new RuleLogic(config, List.of());
    }

    /**
     * Returns the waivers that apply at the given instant.
     *
     * @param instant the evaluation instant
     * @return active waivers, in declaration order
     */
    public List<RuleWaiver> activeWaivers(Instant instant) {
        return exceptions.stream()
                .filter(waiver -> waiver.isActiveAt(instant))
                .toList();
    }
}
