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
 * Thrown when an interval is constructed with {@code start > end}, or with a bound that cannot be ordered (NaN). The
 * bounds are never clamped or swapped.
 *
 * @author hal.hildebrand
 */
public class InvalidIntervalException extends IllegalArgumentException {

    private final float start;
    private final float end;

    public InvalidIntervalException(float start, float end) {
        super(String.format("Invalid interval [%s, %s]: start must be <= end", start, end));
        this.start = start;
        this.end = end;
    }

    public float getEnd() {
        return end;
    }

    public float getStart() {
        return start;
    }
}
