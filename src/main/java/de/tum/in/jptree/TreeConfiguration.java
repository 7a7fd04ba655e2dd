/*
 * This file is part of JPTree.
 * Copyright (c) 2026 Tobias Meggendorfer.
 *
 * JPTree is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, version 3.
 *
 * JPTree is distributed in the hope that it will be useful, but
 * WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU
 * General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with JPTree. If not, see <http://www.gnu.org/licenses/>.
 */
package de.tum.in.jptree;

import org.immutables.value.Value;

@SuppressWarnings("MethodReturnAlwaysConstant")
@Value.Immutable
public class TreeConfiguration {
    public static final int DEFAULT_INITIAL_ARENA_SIZE = 64;
    public static final double DEFAULT_ARENA_GROWTH_FACTOR = 1.5d;

    @Value.Default
    public int initialArenaSize() {
        return DEFAULT_INITIAL_ARENA_SIZE;
    }

    @Value.Default
    public double growthFactor() {
        return DEFAULT_ARENA_GROWTH_FACTOR;
    }

    /**
     * The number of nodes a single tree may occupy. Operations which would exceed it fail with an
     * {@link IllegalStateException}.
     */
    @Value.Default
    public int maximalArenaSize() {
        return NodeArena.MAXIMAL_NODE_COUNT;
    }

    /**
     * Whether every mutating operation verifies the complete tree structure afterwards.
     */
    @Value.Default
    public boolean checkIntegrity() {
        return false;
    }

    @Value.Check
    protected void check() {
        Util.checkState(initialArenaSize() > 0, "Initial arena size %d is not positive", initialArenaSize());
        Util.checkState(
                initialArenaSize() <= maximalArenaSize() && maximalArenaSize() <= NodeArena.MAXIMAL_NODE_COUNT,
                "Maximal arena size %d not in [%d, %d]",
                maximalArenaSize(),
                initialArenaSize(),
                NodeArena.MAXIMAL_NODE_COUNT);
        Util.checkState(growthFactor() > 1.0d, "Growth factor %s must exceed 1", growthFactor());
    }
}
