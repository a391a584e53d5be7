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

/**
 * Reference to an element owned by the surrounding widget framework. The hit-test index stores handles and never
 * creates, mutates or destroys the elements behind them.
 * <p>
 * Implementations must provide a stable {@code equals}/{@code hashCode}: the index uses them as set keys when it
 * intersects candidates and to tell apart elements whose bounds coincide on an axis.
 *
 * @author hal.hildebrand
 */
public interface ElementHandle {

    /**
     * @return the element's current bounding rectangle
     */
    ElementBounds getBounds();

    /**
     * @return the paint order key, higher values are painted on top
     */
    int getZIndex();
}
