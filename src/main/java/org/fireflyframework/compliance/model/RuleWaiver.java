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

/**
 * Time-bounded exception granted against a compliance rule.
 *
 * <p>Waivers are advisory: active waivers are listed on the evaluation result for a
 * reviewer but never change whether the rule passed.</p>
 *
 * @param type       scope of the waiver
 * @param reason     human-readable justification, reported on the result
 * @param expiresAt  instant after which the waiver no longer applies; {@code null} for no expiry
 * @param timePeriod window during which a {@link WaiverType#TIME_PERIOD} waiver applies
 */
public record RuleWaiver(WaiverType type, String reason, Instant expiresAt, TimePeriod timePeriod) {

    /**
     * Determines whether this waiver applies at the given instant.
     *
     * <p>An expired waiver is never active. A waiver whose period contains the instant
     * (inclusive) is active. Otherwise only {@link WaiverType#CONDITION} and
     * {@link WaiverType#ENTITY} waivers are active; their finer scoping is left to the caller.</p>
     *
     * @param instant the evaluation instant
     * @return {@code true} if the waiver applies
     */
    public boolean isActiveAt(Instant instant) {
        if (expiresAt != null && expiresAt.isBefore(instant)) {
            return false;
        }
        if (timePeriod != null && timePeriod.contains(instant)) {
            return true;
        }
        return type == WaiverType.CONDITION || type == WaiverType.ENTITY;
    }

    /**
     * Closed interval {@code [start, end]}.
     */
    public record TimePeriod(Instant start, Instant end) {

        public boolean contains(Instant instant) {
            return start != null && end != null && !instant.isBefore(start) && !instant.isAfter(end);
        }
    }
}
