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

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class HitTestStatsTest {

    @Test
    void testConsistent() {
        assertTrue(new HitTestStats(3, 3, 3, 2, 2, true, true).isConsistent());
        assertTrue(new HitTestStats(0, 0, 0, 0, 0, true, true).isConsistent());
    }

    @Test
    void testTreeSizesDiffer() {
        assertFalse(new HitTestStats(3, 3, 2, 2, 2, true, true).isConsistent());
    }

    @Test
    void testCountDiffersFromTrees() {
        assertFalse(new HitTestStats(2, 3, 3, 2, 2, true, true).isConsistent());
    }

    @Test
    void testUnbalancedTree() {
        assertFalse(new HitTestStats(3, 3, 3, 3, 2, false, true).isConsistent());
        assertFalse(new HitTestStats(3, 3, 3, 2, 3, true, false).isConsistent());
    }

    @Test
    void testReport() {
        var report = new HitTestStats(4, 4, 3, 3, 2, true, false).toReport();
        assertEquals("""
                     HitTestSystem Stats:
                       Widget count: 4
                       X-tree size: 4
                       Y-tree size: 3
                       X-tree balanced: true
                       Y-tree balanced: false
                     """, report);
    }
}
