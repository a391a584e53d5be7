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

import com.hellblazer.hittest.common.Interval;
import com.hellblazer.hittest.common.IntervalTree;
import com.hellblazer.hittest.common.InvalidIntervalException;
import com.hellblazer.hittest.index.element.ElementBounds;
import com.hellblazer.hittest.index.element.ElementHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.vecmath.Point2f;
import java.util.*;

/**
 * Hit-testing index over axis-aligned element bounds. Two interval trees index every element, one by its horizontal
 * extent [x, x + width] and one by its vertical extent [y, y + height]. A point or rectangle query runs against each
 * tree independently, intersects the two candidate sets, re-checks the full rectangle and returns the hits front to
 * back: higher z-index first, equal z-index in insertion order.
 * <p>
 * The index cannot observe element movement. When an element's bounds change the caller reports it through
 * {@link #updateWidget(ElementHandle, ElementBounds)} with the bounds that were indexed before the change; an
 * inaccurate old bounds leaves a stale entry behind.
 * <p>
 * Single threaded. Callers that mutate and query from several threads must provide their own exclusion.
 *
 * @param <W> the element handle type
 * @author hal.hildebrand
 */
public class HitTestSystem<W extends ElementHandle> {

    private static final Logger log = LoggerFactory.getLogger(HitTestSystem.class);

    // Per handle: tie-break sequence and number of indexed entries
    private static final class Registration {
        private final long sequence;
        private int        entries;

        private Registration(long sequence) {
            this.sequence = sequence;
        }
    }

    private final IntervalTree<W>           xTree         = new IntervalTree<>();
    private final IntervalTree<W>           yTree         = new IntervalTree<>();
    private final Map<W, Registration>      registrations = new HashMap<>();
    private final HitTestConfig             config;
    private final HitOrder<W>               order;
    private       int                       count;
    private       long                      nextSequence;

    public HitTestSystem() {
        this(HitTestConfig.defaults());
    }

    public HitTestSystem(HitTestConfig config) {
        this.config = Objects.requireNonNull(config, "Config cannot be null");
        this.nextSequence = config.getInitialSequence();
        this.order = new HitOrder<>(this::sequenceOf);
    }

    private static <W> Interval<W> xInterval(ElementBounds bounds, W handle) {
        return new Interval<>(bounds.x(), bounds.maxX(), handle);
    }

    private static <W> Interval<W> yInterval(ElementBounds bounds, W handle) {
        return new Interval<>(bounds.y(), bounds.maxY(), handle);
    }

    /**
     * Remove every element from the index
     */
    public void clear() {
        xTree.clear();
        yTree.clear();
        registrations.clear();
        count = 0;
        nextSequence = config.getInitialSequence();
    }

    /**
     * Find the topmost element at the point
     */
    public Optional<W> findTopWidgetAt(float x, float y) {
        var widgets = findWidgetsAt(x, y);
        return widgets.isEmpty() ? Optional.empty() : Optional.of(widgets.get(0));
    }

    /**
     * Find all elements containing the point, edges inclusive, ordered front to back.
     * <p>
     * O(log n + k) where k is the number of per-axis candidates.
     */
    public List<W> findWidgetsAt(float x, float y) {
        if (count == 0) {
            return Collections.emptyList();
        }
        var xCandidates = xTree.query(x);
        if (xCandidates.isEmpty()) {
            return Collections.emptyList();
        }
        var yCandidates = new HashSet<>(yTree.query(y));
        var seen = new HashSet<W>();
        var result = new ArrayList<W>();
        for (var widget : xCandidates) {
            if (yCandidates.contains(widget) && (!config.isExactnessCheck() || widget.getBounds().contains(x, y))
            && seen.add(widget)) {
                result.add(widget);
            }
        }
        result.sort(order);
        return result;
    }

    public List<W> findWidgetsAt(Point2f point) {
        return findWidgetsAt(point.x, point.y);
    }

    /**
     * Find all elements overlapping the rectangle, edges inclusive, ordered front to back
     */
    public List<W> findWidgetsInRect(ElementBounds rect) {
        Objects.requireNonNull(rect, "Rectangle cannot be null");
        if (count == 0) {
            return Collections.emptyList();
        }
        var xCandidates = xTree.findOverlaps(rect.x(), rect.maxX());
        if (xCandidates.isEmpty()) {
            return Collections.emptyList();
        }
        var yCandidates = new HashSet<>(yTree.findOverlaps(rect.y(), rect.maxY()));
        var seen = new HashSet<W>();
        var result = new ArrayList<W>();
        for (var widget : xCandidates) {
            if (yCandidates.contains(widget) && (!config.isExactnessCheck() || widget.getBounds().overlaps(rect))
            && seen.add(widget)) {
                result.add(widget);
            }
        }
        result.sort(order);
        return result;
    }

    public HitTestConfig getConfig() {
        return config;
    }

    /**
     * @return a snapshot of counts, tree heights and balance status
     */
    public HitTestStats getStatistics() {
        return new HitTestStats(count, xTree.size(), yTree.size(), xTree.height(), yTree.height(),
                                xTree.isBalanced(), yTree.isBalanced());
    }

    /**
     * Human readable counts and balance status for debugging
     */
    public String getStats() {
        return getStatistics().toReport();
    }

    /**
     * The element directly under the cursor. Same as {@link #findTopWidgetAt(float, float)}.
     */
    public Optional<W> getWidgetAt(float x, float y) {
        return findTopWidgetAt(x, y);
    }

    /**
     * Index the element at its current bounds
     *
     * @throws InvalidIntervalException if the bounds have a negative width or height; the index is left unchanged
     */
    public void insertWidget(W handle) {
        var bounds = boundsOf(handle);
        var xEntry = xInterval(bounds, handle);
        var yEntry = yInterval(bounds, handle);
        xTree.insert(xEntry);
        yTree.insert(yEntry);
        register(handle);
        count++;
        log.trace("Inserted {} at {}", handle, bounds);
        afterMutation("insert");
    }

    public boolean isEmpty() {
        return count == 0;
    }

    /**
     * Clear the index and insert every element in list order. Cheaper than many incremental updates when most
     * elements moved at once.
     *
     * @throws InvalidIntervalException if any element has invalid bounds; the index is left unchanged
     */
    public void rebuildFromWidgets(Collection<? extends W> handles) {
        Objects.requireNonNull(handles, "Handles cannot be null");
        var xEntries = new ArrayList<Interval<W>>(handles.size());
        var yEntries = new ArrayList<Interval<W>>(handles.size());
        for (W handle : handles) {
            var bounds = boundsOf(handle);
            xEntries.add(xInterval(bounds, handle));
            yEntries.add(yInterval(bounds, handle));
        }
        clear();
        for (int i = 0; i < xEntries.size(); i++) {
            xTree.insert(xEntries.get(i));
            yTree.insert(yEntries.get(i));
            register(xEntries.get(i).payload());
            count++;
        }
        log.debug("Rebuilt hit-test index with {} elements, tree heights x={} y={}", count, xTree.height(),
                  yTree.height());
        afterMutation("rebuild");
    }

    /**
     * Remove the element using its current bounds. An element not indexed at exactly those bounds is left alone.
     *
     * @return true if the element was removed
     */
    public boolean removeWidget(W handle) {
        var bounds = boundsOf(handle);
        if (!isIndexedAt(handle, bounds)) {
            log.warn("Cannot remove {}: no entry at {}", handle, bounds);
            return false;
        }
        xTree.remove(bounds.x(), bounds.maxX(), handle);
        yTree.remove(bounds.y(), bounds.maxY(), handle);
        unregister(handle);
        count--;
        log.trace("Removed {} from {}", handle, bounds);
        afterMutation("remove");
        return true;
    }

    public int size() {
        return count;
    }

    @Override
    public String toString() {
        return "HitTestSystem[count=" + count + ", xTree=" + xTree + ", yTree=" + yTree + "]";
    }

    /**
     * Move the element from its previously indexed bounds to its current bounds. The element keeps its insertion
     * sequence.
     * <p>
     * If no entry exists at {@code oldBounds}, the current bounds are still indexed but whatever entry the element
     * had before stays in both trees as a stale entry that no later call can reach through the element's bounds.
     *
     * @param oldBounds the bounds the element was indexed with before it moved
     * @return true if the entry at oldBounds was found and replaced
     * @throws InvalidIntervalException if the current bounds are invalid; the index is left unchanged
     */
    public boolean updateWidget(W handle, ElementBounds oldBounds) {
        Objects.requireNonNull(oldBounds, "Old bounds cannot be null");
        var bounds = boundsOf(handle);
        var xEntry = xInterval(bounds, handle);
        var yEntry = yInterval(bounds, handle);

        boolean located = isIndexedAt(handle, oldBounds);
        if (located) {
            xTree.remove(oldBounds.x(), oldBounds.maxX(), handle);
            yTree.remove(oldBounds.y(), oldBounds.maxY(), handle);
            count--;
        } else {
            log.warn("Stale entry for {}: nothing indexed at old bounds {}", handle, oldBounds);
        }
        xTree.insert(xEntry);
        yTree.insert(yEntry);
        count++;
        if (!located) {
            register(handle);
        }
        log.trace("Updated {} from {} to {}", handle, oldBounds, bounds);
        afterMutation("update");
        return located;
    }

    /**
     * Check that both trees hold exactly {@link #size()} entries and satisfy the AVL balance invariant. Diagnostic
     * only, never throws.
     */
    public boolean verifyIntegrity() {
        if (xTree.size() != yTree.size()) {
            log.warn("Integrity check failed: x-tree size {} != y-tree size {}", xTree.size(), yTree.size());
            return false;
        }
        if (count != xTree.size()) {
            log.warn("Integrity check failed: element count {} != tree size {}", count, xTree.size());
            return false;
        }
        if (!xTree.isBalanced()) {
            log.warn("Integrity check failed: x-tree is unbalanced");
            return false;
        }
        if (!yTree.isBalanced()) {
            log.warn("Integrity check failed: y-tree is unbalanced");
            return false;
        }
        return true;
    }

    IntervalTree<W> xTree() {
        return xTree;
    }

    IntervalTree<W> yTree() {
        return yTree;
    }

    private void afterMutation(String operation) {
        if (config.isVerifyAfterMutation() && !verifyIntegrity()) {
            log.warn("Hit-test index inconsistent after {}: {}", operation, this);
        }
    }

    private ElementBounds boundsOf(W handle) {
        Objects.requireNonNull(handle, "Handle cannot be null");
        return Objects.requireNonNull(handle.getBounds(), "Handle bounds cannot be null");
    }

    private boolean isIndexedAt(W handle, ElementBounds bounds) {
        return xTree.contains(bounds.x(), bounds.maxX(), handle) && yTree.contains(bounds.y(), bounds.maxY(),
                                                                                   handle);
    }

    private void register(W handle) {
        registrations.computeIfAbsent(handle, h -> new Registration(nextSequence++)).entries++;
    }

    private long sequenceOf(W handle) {
        var registration = registrations.get(handle);
        return registration == null ? Long.MAX_VALUE : registration.sequence;
    }

    private void unregister(W handle) {
        var registration = registrations.get(handle);
        if (registration != null && --registration.entries == 0) {
            registrations.remove(handle);
        }
    }
}
