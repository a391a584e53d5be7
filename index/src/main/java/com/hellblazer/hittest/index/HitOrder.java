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
package com.hellblazer.hittest.index;

import com.hellblazer.hittest.index.element.ElementHandle;

import java.util.Comparator;
import java.util.function.ToLongFunction;

/**
 * Front-to-back paint order: higher z-index first, equal z-index by ascending insertion sequence.
 *
 * @author hal.hildebrand
 */
class HitOrder<W extends ElementHandle> implements Comparator<W> {

    private final ToLongFunction<W> sequence;

    HitOrder(ToLongFunction<W> sequence) {
        this.sequence = sequence;
    }

    @Override
    public int compare(W a, W b) {
        int byZ = Integer.compare(b.getZIndex(), a.getZIndex());
        if (byZ != 0) {
            return byZ;
        }
        return Long.compare(sequence.applyAsLong(a), sequence.applyAsLong(b));
    }
}
