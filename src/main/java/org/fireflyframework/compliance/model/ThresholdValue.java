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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;

/**
 * Bound of a threshold rule: either a single number or a closed {@code [min, max]} range.
 *
 * <p>In JSON a single bound is written as a number and a range as a two-element array.</p>
 */
public record ThresholdValue(double min, Double max) {

    public static ThresholdValue of(double value) {
        return new ThresholdValue(value, null);
    }

    public static ThresholdValue range(double min, double max) {
        return new ThresholdValue(min, max);
    }

    /**
     * Returns whether this value is a {@code [min, max]} range.
     *
     * @return {@code true} for a range
     */
    public boolean isRange() {
        return max != null;
    }

    /**
     * Returns the single bound. For a range this is the lower bound.
     *
     * @return the bound
     */
    public double value() {
        return min;
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    static ThresholdValue fromJson(Object raw) {
        if (raw instanceof Number) {
            return of(((Number) raw).doubleValue());
        }
        if (raw instanceof List) {
            List<?> bounds = (List<?>) raw;
            if (bounds.size() != 2 || !(bounds.get(0) instanceof Number) || !(bounds.get(1) instanceof Number)) {
                throw new IllegalArgumentException("Threshold range must be a [min, max] pair of numbers: " + raw);
            }
            return range(((Number) bounds.get(0)).doubleValue(), ((Number) bounds.get(1)).doubleValue());
        }
        throw new IllegalArgumentException("Threshold value must be a number or a [min, max] pair: " + raw);
    }

    @JsonValue
    Object toJson() {
        return isRange() ? List.of(min, max) : min;
    }

    @Override
    public String toString() {
        return isRange() ? "[" + min + ", " + max + "]" : String.valueOf(min);
    }
}
