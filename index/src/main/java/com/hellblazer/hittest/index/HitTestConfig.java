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
 * Configuration for a {@link HitTestSystem}.
 *
 * @author hal.hildebrand
 */
public class HitTestConfig {

    private boolean exactnessCheck      = true;
    private boolean verifyAfterMutation = false;
    private long    initialSequence     = 0L;

    /**
     * Configuration that runs an integrity check after every mutation and logs any failure. Costs O(n) per mutation.
     */
    public static HitTestConfig debug() {
        return new HitTestConfig().withVerifyAfterMutation(true);
    }

    public static HitTestConfig defaults() {
        return new HitTestConfig();
    }

    /**
     * First insertion sequence number handed out. Sequence numbers break z-index ties, lower first.
     */
    public long getInitialSequence() {
        return initialSequence;
    }

    /**
     * Whether each candidate surviving the per-axis intersection is re-checked against its full rectangle.
     */
    public boolean isExactnessCheck() {
        return exactnessCheck;
    }

    /**
     * Whether {@link HitTestSystem#verifyIntegrity()} runs after every insert, remove, update and rebuild.
     */
    public boolean isVerifyAfterMutation() {
        return verifyAfterMutation;
    }

    public HitTestConfig withExactnessCheck(boolean check) {
        this.exactnessCheck = check;
        return this;
    }

    public HitTestConfig withInitialSequence(long sequence) {
        if (sequence < 0) {
            throw new IllegalArgumentException("Initial sequence must be non-negative");
        }
        this.initialSequence = sequence;
        return this;
    }

    public HitTestConfig withVerifyAfterMutation(boolean verify) {
        this.verifyAfterMutation = verify;
        return this;
    }

    @Override
    public String toString() {
        return String.format("HitTestConfig[exactnessCheck=%s, verifyAfterMutation=%s, initialSequence=%d]",
                             exactnessCheck, verifyAfterMutation, initialSequence);
    }
}
