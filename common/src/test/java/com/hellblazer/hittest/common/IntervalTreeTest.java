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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class IntervalTreeTest {

    private IntervalTree<String> tree;

    @BeforeEach
    void setUp() {
        tree = new IntervalTree<>();
    }

    @Test
    void testEmptyTree() {
        assertTrue(tree.isEmpty());
        assertEquals(0, tree.size());
        assertEquals(0, tree.height());
        assertTrue(tree.query(5).isEmpty());
        assertTrue(tree.findOverlaps(0, 100).isEmpty());
        assertTrue(tree.isBalanced());
        assertTrue(tree.isConsistent());
    }

    @Test
    void testBasicInsertQuery() {
        tree.insert(0, 10, "A");
        tree.insert(5, 15, "B");
        tree.insert(20, 30, "C");

        assertEquals(3, tree.size());
        assertEquals(Set.of("A", "B"), Set.copyOf(tree.query(7)));
        assertEquals(List.of("A"), tree.query(2));
        assertEquals(List.of("C"), tree.query(25));
        assertTrue(tree.query(17).isEmpty());
    }

    @Test
    void testSingleInterval() {
        tree.insert(10, 20, "only");

        assertFalse(tree.isEmpty());
        assertEquals(1, tree.size());
        assertEquals(1, tree.height());
        assertEquals(List.of("only"), tree.query(15));
        assertTrue(tree.query(9.99f).isEmpty());
        assertTrue(tree.query(20.01f).isEmpty());
    }

    @Test
    void testClosedBoundaries() {
        tree.insert(0, 100, "A");
        tree.insert(100, 200, "B");

        assertEquals(List.of("A"), tree.query(0));
        assertEquals(Set.of("A", "B"), Set.copyOf(tree.query(100)));
        assertEquals(List.of("B"), tree.query(200));
        assertTrue(tree.query(-0.1f).isEmpty());
        assertTrue(tree.query(200.1f).isEmpty());
    }

    @Test
    void testPointIntervals() {
        tree.insert(50, 50, "point");

        assertEquals(List.of("point"), tree.query(50));
        assertTrue(tree.query(50.1f).isEmpty());
        assertTrue(tree.query(49.9f).isEmpty());
        assertEquals(List.of("point"), tree.findOverlaps(50, 50));
        assertEquals(List.of("point"), tree.findOverlaps(0, 50));
    }

    @Test
    void testInvalidInterval() {
        var e = assertThrows(InvalidIntervalException.class, () -> tree.insert(10, 5, "bad"));
        assertEquals(10, e.getStart());
        assertEquals(5, e.getEnd());
        assertThrows(InvalidIntervalException.class, () -> tree.insert(Float.NaN, 5, "nan"));
        assertThrows(InvalidIntervalException.class, () -> tree.insert(0, Float.NaN, "nan"));
        assertTrue(tree.isEmpty());
        assertEquals(0, tree.size());
    }

    @Test
    void testRemoveBasic() {
        tree.insert(0, 10, "A");
        tree.insert(5, 15, "B");
        tree.insert(20, 30, "C");

        assertTrue(tree.remove(5, 15));
        assertEquals(2, tree.size());
        assertEquals(List.of("A"), tree.query(7));
        assertEquals(List.of("C"), tree.query(25));
        assertTrue(tree.isConsistent());
    }

    @Test
    void testRemoveMissingIsNoOp() {
        tree.insert(0, 10, "A");

        assertFalse(tree.remove(0, 11));
        assertFalse(tree.remove(1, 10));
        assertFalse(tree.remove(0, 10, "B"));
        assertFalse(new IntervalTree<String>().remove(0, 10));
        assertEquals(1, tree.size());
        assertEquals(List.of("A"), tree.query(5));
    }

    @Test
    void testRemoveMatchesEndOnSharedStart() {
        tree.insert(10, 20, "short");
        tree.insert(10, 40, "long");
        tree.insert(10, 30, "middle");

        assertTrue(tree.remove(10, 40));
        assertEquals(Set.of("short", "middle"), Set.copyOf(tree.query(15)));
        assertTrue(tree.query(35).isEmpty());
        assertTrue(tree.isConsistent());
    }

    @Test
    void testRemoveByPayloadOnIdenticalIntervals() {
        tree.insert(0, 100, "first");
        tree.insert(0, 100, "second");
        tree.insert(0, 100, "third");

        assertTrue(tree.contains(0, 100, "second"));
        assertTrue(tree.remove(0, 100, "second"));
        assertFalse(tree.contains(0, 100, "second"));
        assertEquals(Set.of("first", "third"), Set.copyOf(tree.query(50)));
        assertFalse(tree.remove(0, 100, "second"));
        assertEquals(2, tree.size());
    }

    @Test
    void testRemoveTwoChildNode() {
        for (int i = 0; i < 15; i++) {
            tree.insert(i * 10, i * 10 + 5, "n" + i);
        }
        // root of a 15 node AVL tree built in order has two children
        assertTrue(tree.remove(70, 75));
        assertTrue(tree.query(72).isEmpty());
        assertEquals(14, tree.size());
        assertTrue(tree.isConsistent());
        for (int i = 0; i < 15; i++) {
            if (i != 7) {
                assertEquals(List.of("n" + i), tree.query(i * 10 + 2));
            }
        }
    }

    @Test
    void testFindOverlaps() {
        tree.insert(0, 10, "A");
        tree.insert(15, 25, "B");
        tree.insert(20, 30, "C");
        tree.insert(40, 50, "D");

        assertEquals(Set.of("A"), Set.copyOf(tree.findOverlaps(5, 12)));
        assertEquals(Set.of("B", "C"), Set.copyOf(tree.findOverlaps(18, 22)));
        assertEquals(Set.of("A", "B", "C", "D"), Set.copyOf(tree.findOverlaps(0, 50)));
        assertEquals(Set.of("C", "D"), Set.copyOf(tree.findOverlaps(30, 40)));
        assertTrue(tree.findOverlaps(31, 39).isEmpty());
        assertTrue(tree.findOverlaps(60, 70).isEmpty());
    }

    @Test
    void testFindOverlapsInvertedRange() {
        tree.insert(0, 10, "A");
        assertTrue(tree.findOverlaps(8, 2).isEmpty());
    }

    @Test
    void testOverlappingIntervals() {
        tree.insert(0, 100, "outer");
        tree.insert(10, 90, "middle");
        tree.insert(40, 60, "inner");

        assertEquals(Set.of("outer", "middle", "inner"), Set.copyOf(tree.query(50)));
        assertEquals(Set.of("outer", "middle"), Set.copyOf(tree.query(20)));
        assertEquals(Set.of("outer"), Set.copyOf(tree.query(5)));
    }

    @Test
    void testQueryResultsInStartOrder() {
        tree.insert(30, 100, "C");
        tree.insert(10, 100, "A");
        tree.insert(20, 100, "B");
        tree.insert(40, 100, "D");

        assertEquals(List.of("A", "B", "C", "D"), tree.query(50));
        var starts = tree.intervals().stream().map(Interval::start).collect(Collectors.toList());
        assertEquals(List.of(10f, 20f, 30f, 40f), starts);
    }

    @Test
    void testClearTree() {
        for (int i = 0; i < 10; i++) {
            tree.insert(i, i + 1, "n" + i);
        }
        tree.clear();

        assertTrue(tree.isEmpty());
        assertEquals(0, tree.size());
        assertTrue(tree.query(5).isEmpty());

        tree.insert(1, 2, "again");
        assertEquals(List.of("again"), tree.query(1.5f));
    }

    @Test
    void testAVLBalanceOnSortedInsertions() {
        for (int i = 0; i < 1000; i++) {
            tree.insert(i, i + 1, "n" + i);
        }
        assertTrue(tree.isBalanced());
        assertTrue(tree.isConsistent());
        // AVL height bound: 1.44 log2(n + 2)
        assertTrue(tree.height() <= 15, "height " + tree.height());
    }

    @Test
    void testMaxEndMaintainedAfterRotations() {
        // a long interval early in start order must stay reachable once rotations move it
        tree.insert(0, 1000, "long");
        for (int i = 1; i < 100; i++) {
            tree.insert(i, i + 0.5f, "short" + i);
        }
        assertTrue(tree.isConsistent());
        assertEquals(List.of("long"), tree.query(999));
        assertTrue(tree.remove(50, 50.5f));
        assertEquals(List.of("long"), tree.query(999));
        assertTrue(tree.isConsistent());
    }

    @Test
    void testDiagnosticsDetectUnbalancedTree() {
        for (int i = 0; i < 3; i++) {
            tree.insertUnbalanced(new Interval<>(i, i + 1, "n" + i));
        }
        assertEquals(3, tree.height());
        assertFalse(tree.isBalanced());
        assertFalse(tree.isConsistent());
        // queries still see every entry
        assertEquals(List.of("n1", "n2"), tree.query(2));
    }

    @Test
    void testConsistencyDetectsBrokenOrdering() {
        tree.insert(10, 11, "root");
        tree.insert(5, 6, "left");
        tree.insert(20, 100, "right");
        assertTrue(tree.isConsistent());

        // start past the right child, max end still 100, heights untouched
        tree.overwriteRoot(new Interval<>(30, 31, "moved"));
        assertTrue(tree.isBalanced());
        assertFalse(tree.isConsistent());
    }

    @Test
    void testConsistencyDetectsStaleMaxEnd() {
        tree.insert(10, 11, "root");
        tree.insert(5, 6, "left");
        tree.insert(20, 21, "right");

        tree.overwriteRoot(new Interval<>(10, 50, "longer"));
        assertTrue(tree.isBalanced());
        assertFalse(tree.isConsistent());
    }

    @Test
    void testToString() {
        tree.insert(0, 1, "a");
        assertEquals("IntervalTree[size=1, height=1]", tree.toString());
    }
}
