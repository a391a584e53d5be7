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
package com.hellblazer.hittest.index.element;

import javax.vecmath.Point2f;

/**
 * Axis-aligned bounding rectangle of an on-screen element. All four edges are inclusive, so adjacent elements sharing
 * an edge both contain points on it.
 * <p>
 * No validation happens here; a negative width or height is rejected when the bounds are indexed.
 *
 * @author hal.hildebrand
 */
public record ElementBounds(float x, float y, float width, float height) {

    /**
     * Create bounds spanning two corner points
     */
    public static ElementBounds fromCorners(Point2f min, Point2f max) {
        return new ElementBounds(min.x, min.y, max.x - min.x, max.y - min.y);
    }

    public static ElementBounds of(float x, float y, float width, float height) {
        return new ElementBounds(x, y, width, height);
    }

    /**
     * Check if a point is contained within these bounds
     */
    public boolean contains(float px, float py) {
        return px >= x && px <= maxX() && py >= y && py <= maxY();
    }

    public boolean contains(Point2f point) {
        return contains(point.x, point.y);
    }

    public float maxX() {
        return x + width;
    }

    public float maxY() {
        return y + height;
    }

    /**
     * Check if these bounds share at least one point with the other bounds
     */
    public boolean overlaps(ElementBounds other) {
        return x <= other.maxX() && maxX() >= other.x && y <= other.maxY() && maxY() >= other.y;
    }

    @Override
    public String toString() {
        return String.format("ElementBounds[x=%.2f, y=%.2f, w=%.2f, h=%.2f]", x, y, width, height);
    }
}
