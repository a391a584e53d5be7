/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.hittest.common;

/**
 * A closed interval [start, end] carrying an opaque payload.
 *
 * @param <T> the payload type
 * @author hal.hildebrand
 */
public record Interval<T>(float start, float end, T payload) {

    public Interval {
        if (Float.isNaN(start) || Float.isNaN(end) || start > end) {
            throw new InvalidIntervalException(start, end);
        }
    }

    /**
     * Check if the point lies within this interval, both ends inclusive
     */
    public boolean contains(float point) {
        return start <= point && point <= end;
    }

    /**
     * Check if [otherStart, otherEnd] shares at least one point with this interval
     */
    public boolean overlaps(float otherStart, float otherEnd) {
        return start <= otherEnd && otherStart <= end;
    }

    public float length() {
        return end - start;
    }

    @Override
    public String toString() {
        return String.format("Interval[%.2f, %.2f]=%s", start, end, payload);
    }
}
