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

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Comparison applied by a threshold rule between a metric and its {@link ThresholdValue}.
 */
public enum ThresholdOperator {

    @JsonProperty("gt")
    GT,

    @JsonProperty("gte")
    GTE,

    @JsonProperty("lt")
    LT,

    @JsonProperty("lte")
    LTE,

    @JsonProperty("eq")
    EQ,

    /** Inclusive on both ends. */
    @JsonProperty("between")
    BETWEEN;

    /**
     * Returns whether the operator accepts the shape of the given bound.
     * {@link #BETWEEN} needs a range, every other operator a single number.
     *
     * @param bound the configured bound
     * @return {@code true} if the bound fits this operator
     */
    public boolean accepts(ThresholdValue bound) {
        return bound != null && (this == BETWEEN) == bound.isRange();
    }

    /**
     * Applies the comparison.
     *
     * @param metric the observed metric value
     * @param bound  the configured bound, already checked with {@link #accepts(ThresholdValue)}
     * @return {@code true} if the metric satisfies the threshold
     */
    public boolean test(double metric, ThresholdValue bound) {
        return switch (this) {
            case GT -> metric > bound.value();
            case GTE -> metric >= bound.value();
            case LT -> metric < bound.value();
            case LTE -> metric <= bound.value();
            case EQ -> Double.compare(metric, bound.value()) == 0;
            case BETWEEN -> metric >= bound.min() && metric <= bound.max();
        };
    }

    public String symbol() {
        return name().toLowerCase();
    }
}
