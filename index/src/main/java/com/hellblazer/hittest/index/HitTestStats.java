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

/**
 * Snapshot of a {@link HitTestSystem}'s counts and tree shape.
 *
 * @author hal.hildebrand
 */
public record HitTestStats(int widgetCount, int xTreeSize, int yTreeSize, int xTreeHeight, int yTreeHeight,
                           boolean xTreeBalanced, boolean yTreeBalanced) {

    public boolean isConsistent() {
        return xTreeSize == yTreeSize && widgetCount == xTreeSize && xTreeBalanced && yTreeBalanced;
    }

    /**
     * Multi-line report for debugging output
     */
    public String toReport() {
        var sb = new StringBuilder();
        sb.append("HitTestSystem Stats:\n");
        sb.append("  Widget count: ").append(widgetCount).append('\n');
        sb.append("  X-tree size: ").append(xTreeSize).append('\n');
        sb.append("  Y-tree size: ").append(yTreeSize).append('\n');
        sb.append("  X-tree balanced: ").append(xTreeBalanced).append('\n');
        sb.append("  Y-tree balanced: ").append(yTreeBalanced).append('\n');
        return sb.toString();
    }
}
