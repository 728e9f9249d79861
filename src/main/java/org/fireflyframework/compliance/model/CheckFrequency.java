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

import java.time.Duration;
import java.time.Instant;

/**
 * How often a rule must be re-evaluated by the scheduler.
 */
public enum CheckFrequency {

    HOURLY(Duration.ofHours(1)),
    DAILY(Duration.ofHours(24)),
    WEEKLY(Duration.ofDays(7)),
    MONTHLY(Duration.ofDays(30));

    private final Duration interval;

    CheckFrequency(Duration interval) {
        this.interval = interval;
    }

    public Duration getInterval() {
        return interval;
    }

    /**
     * Returns whether a rule last checked at {@code lastCheckedAt} is due at {@code now}:
     * never checked, or checked longer than one interval ago.
     *
     * @param lastCheckedAt last evaluation instant, or {@code null}
     * @param now           the reference instant
     * @return {@code true} if the rule is due
     */
    public boolean isDue(Instant lastCheckedAt, Instant now) {
        return lastCheckedAt == null || lastCheckedAt.isBefore(now.minus(interval));
    }
}
