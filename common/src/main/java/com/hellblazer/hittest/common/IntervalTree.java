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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * AVL balanced interval tree over closed float intervals. Nodes are ordered by interval start, and every node carries
 * the maximum end of its subtree so that containment and overlap queries can prune whole subtrees. Insert, remove and
 * both query kinds run in O(log n + k), k being the number of reported intervals.
 * <p>
 * Intervals sharing a start value descend to the right on insert. Rotations may later move such an interval into the
 * left subtree of its twin, so the ordering invariant is {@code left.start <= node.start <= right.start} and removal
 * searches both sides when starts are equal. The rotation case is always chosen from the child's balance factor,
 * never from start comparisons, which keeps rebalancing well defined under duplicate starts.
 * <p>
 * Not thread safe.
 *
 * @param <T> the payload type
 * @author hal.hildebrand
 */
public class IntervalTree<T> {

    private static final class Node<T> {
        private Interval<T> interval;
        private float       maxEnd;
        private int         height = 1;
        private Node<T>     left;
        private Node<T>     right;

        private Node(Interval<T> interval) {
            this.interval = interval;
            this.maxEnd = interval.end();
        }

        @Override
        public String toString() {
            return interval + " max=" + maxEnd + " h=" + height;
        }
    }

    private static final class Removal {
        private boolean found;
    }

    private Node<T> root;
    private int     size;

    /**
     * Remove every interval
     */
    public void clear() {
        root = null;
        size = 0;
    }

    /**
     * Check if this exact entry, matched on start, end and payload equality, is in the tree
     */
    public boolean contains(float start, float end, T payload) {
        if (Float.isNaN(start)) {
            return false;
        }
        return find(root, start, matching(start, end, payload));
    }

    /**
     * Find all intervals [s, e] overlapping [start, end], that is {@code s <= end && start <= e}. Results are in
     * ascending start order. An inverted range matches nothing.
     */
    public List<T> findOverlaps(float start, float end) {
        if (root == null || Float.isNaN(start) || Float.isNaN(end) || start > end) {
            return Collections.emptyList();
        }
        var result = new ArrayList<T>();
        collectOverlaps(root, start, end, result);
        return result;
    }

    /**
     * @return the height of the tree, 0 when empty
     */
    public int height() {
        return height(root);
    }

    /**
     * Insert the interval [start, end] carrying the payload
     *
     * @throws InvalidIntervalException if start > end
     */
    public void insert(float start, float end, T payload) {
        insert(new Interval<>(start, end, payload));
    }

    /**
     * Insert an already validated interval
     */
    public void insert(Interval<T> interval) {
        root = insert(root, Objects.requireNonNull(interval, "Interval cannot be null"));
        size++;
    }

    /**
     * @return a snapshot of all intervals in ascending start order
     */
    public List<Interval<T>> intervals() {
        var result = new ArrayList<Interval<T>>(size);
        inOrder(root, result);
        return result;
    }

    /**
     * Check the AVL invariant at every node, computing heights from scratch rather than trusting stored values
     */
    public boolean isBalanced() {
        return balancedHeight(root) >= 0;
    }

    /**
     * Full structural check: AVL balance, stored heights, subtree max ends, start ordering and size. Meant for tests
     * and diagnostics.
     */
    public boolean isConsistent() {
        var count = new int[1];
        if (checkNode(root, Float.NEGATIVE_INFINITY, Float.POSITIVE_INFINITY, count) < 0) {
            return false;
        }
        return count[0] == size;
    }

    public boolean isEmpty() {
        return root == null;
    }

    /**
     * Find all intervals containing the point, both ends inclusive. Results are in ascending start order.
     */
    public List<T> query(float point) {
        if (root == null || Float.isNaN(point)) {
            return Collections.emptyList();
        }
        var result = new ArrayList<T>();
        collectContaining(root, point, result);
        return result;
    }

    /**
     * Remove one interval whose start and end match exactly. A missing interval is not an error.
     *
     * @return true if an interval was removed
     */
    public boolean remove(float start, float end) {
        return remove(start, matching(start, end));
    }

    /**
     * Remove one interval whose start, end and payload all match. Use this form when distinct payloads may share an
     * identical interval.
     *
     * @return true if an interval was removed
     */
    public boolean remove(float start, float end, T payload) {
        return remove(start, matching(start, end, payload));
    }

    public int size() {
        return size;
    }

    @Override
    public String toString() {
        return "IntervalTree[size=" + size + ", height=" + height() + "]";
    }

    /**
     * Plain BST insert that skips rebalancing, so diagnostics can be exercised on a degenerate tree
     */
    void insertUnbalanced(Interval<T> interval) {
        root = insertUnbalanced(root, interval);
        size++;
    }

    /**
     * Replace the root's interval in place, leaving ordering and max ends untouched
     */
    void overwriteRoot(Interval<T> interval) {
        root.interval = interval;
    }

    private static <T> int balance(Node<T> node) {
        return node == null ? 0 : height(node.left) - height(node.right);
    }

    private static <T> int balancedHeight(Node<T> node) {
        if (node == null) {
            return 0;
        }
        int left = balancedHeight(node.left);
        if (left < 0) {
            return -1;
        }
        int right = balancedHeight(node.right);
        if (right < 0 || Math.abs(left - right) > 1) {
            return -1;
        }
        return 1 + Math.max(left, right);
    }

    private static <T> int height(Node<T> node) {
        return node == null ? 0 : node.height;
    }

    private static <T> Predicate<Interval<T>> matching(float start, float end) {
        return interval -> interval.start() == start && interval.end() == end;
    }

    private static <T> Predicate<Interval<T>> matching(float start, float end, T payload) {
        return interval -> interval.start() == start && interval.end() == end && Objects.equals(payload,
                                                                                                interval.payload());
    }

    private static <T> Node<T> rotateLeft(Node<T> x) {
        var y = x.right;
        x.right = y.left;
        y.left = x;
        update(x);
        update(y);
        return y;
    }

    private static <T> Node<T> rotateRight(Node<T> y) {
        var x = y.left;
        y.left = x.right;
        x.right = y;
        update(y);
        update(x);
        return x;
    }

    private static <T> void update(Node<T> node) {
        node.height = 1 + Math.max(height(node.left), height(node.right));
        float max = node.interval.end();
        if (node.left != null) {
            max = Math.max(max, node.left.maxEnd);
        }
        if (node.right != null) {
            max = Math.max(max, node.right.maxEnd);
        }
        node.maxEnd = max;
    }

    /**
     * @return the computed height, or -1 if any invariant fails in this subtree
     */
    private int checkNode(Node<T> node, float lower, float upper, int[] count) {
        if (node == null) {
            return 0;
        }
        float start = node.interval.start();
        if (start < lower || start > upper) {
            return -1;
        }
        int left = checkNode(node.left, lower, start, count);
        int right = checkNode(node.right, start, upper, count);
        if (left < 0 || right < 0 || Math.abs(left - right) > 1) {
            return -1;
        }
        int computed = 1 + Math.max(left, right);
        if (computed != node.height) {
            return -1;
        }
        float max = node.interval.end();
        if (node.left != null) {
            max = Math.max(max, node.left.maxEnd);
        }
        if (node.right != null) {
            max = Math.max(max, node.right.maxEnd);
        }
        if (max != node.maxEnd) {
            return -1;
        }
        count[0]++;
        return computed;
    }

    private void collectContaining(Node<T> node, float point, List<T> result) {
        if (node == null || node.maxEnd < point) {
            return;
        }
        collectContaining(node.left, point, result);
        if (node.interval.contains(point)) {
            result.add(node.interval.payload());
        }
        // right subtree starts are >= this start, none can contain a point left of it
        if (point >= node.interval.start()) {
            collectContaining(node.right, point, result);
        }
    }

    private void collectOverlaps(Node<T> node, float start, float end, List<T> result) {
        if (node == null || node.maxEnd < start) {
            return;
        }
        collectOverlaps(node.left, start, end, result);
        if (node.interval.overlaps(start, end)) {
            result.add(node.interval.payload());
        }
        if (node.interval.start() <= end) {
            collectOverlaps(node.right, start, end, result);
        }
    }

    private Node<T> delete(Node<T> node) {
        if (node.left == null) {
            return node.right;
        }
        if (node.right == null) {
            return node.left;
        }
        var successor = node.right;
        while (successor.left != null) {
            successor = successor.left;
        }
        node.interval = successor.interval;
        node.right = removeMin(node.right);
        return rebalance(node);
    }

    private boolean find(Node<T> node, float start, Predicate<Interval<T>> match) {
        if (node == null) {
            return false;
        }
        float nodeStart = node.interval.start();
        if (start < nodeStart) {
            return find(node.left, start, match);
        }
        if (start > nodeStart) {
            return find(node.right, start, match);
        }
        return match.test(node.interval) || find(node.left, start, match) || find(node.right, start, match);
    }

    private void inOrder(Node<T> node, List<Interval<T>> result) {
        if (node == null) {
            return;
        }
        inOrder(node.left, result);
        result.add(node.interval);
        inOrder(node.right, result);
    }

    private Node<T> insert(Node<T> node, Interval<T> interval) {
        if (node == null) {
            return new Node<>(interval);
        }
        if (interval.start() < node.interval.start()) {
            node.left = insert(node.left, interval);
        } else {
            node.right = insert(node.right, interval);
        }
        return rebalance(node);
    }

    private Node<T> insertUnbalanced(Node<T> node, Interval<T> interval) {
        if (node == null) {
            return new Node<>(interval);
        }
        if (interval.start() < node.interval.start()) {
            node.left = insertUnbalanced(node.left, interval);
        } else {
            node.right = insertUnbalanced(node.right, interval);
        }
        update(node);
        return node;
    }

    private Node<T> rebalance(Node<T> node) {
        update(node);
        int balance = balance(node);
        if (balance > 1) {
            if (balance(node.left) < 0) {
                node.left = rotateLeft(node.left);
            }
            return rotateRight(node);
        }
        if (balance < -1) {
            if (balance(node.right) > 0) {
                node.right = rotateRight(node.right);
            }
            return rotateLeft(node);
        }
        return node;
    }

    private boolean remove(float start, Predicate<Interval<T>> match) {
        if (Float.isNaN(start)) {
            return false;
        }
        var removal = new Removal();
        root = remove(root, start, match, removal);
        if (removal.found) {
            size--;
        }
        return removal.found;
    }

    private Node<T> remove(Node<T> node, float start, Predicate<Interval<T>> match, Removal removal) {
        if (node == null) {
            return null;
        }
        float nodeStart = node.interval.start();
        if (start < nodeStart) {
            node.left = remove(node.left, start, match, removal);
        } else if (start > nodeStart) {
            node.right = remove(node.right, start, match, removal);
        } else if (match.test(node.interval)) {
            removal.found = true;
            return delete(node);
        } else {
            // equal starts may sit on either side once rotations have run
            node.left = remove(node.left, start, match, removal);
            if (!removal.found) {
                node.right = remove(node.right, start, match, removal);
            }
        }
        return removal.found ? rebalance(node) : node;
    }

    private Node<T> removeMin(Node<T> node) {
        if (node.left == null) {
            return node.right;
        }
        node.left = removeMin(node.left);
        return rebalance(node);
    }
}
