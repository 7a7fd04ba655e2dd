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

/**
 * A child reachable from some node together with the literals fixed on the way to it.
 *
 * @see PrunableTree#branchInfo(int)
 */
public final class BranchInfo {
    private final int node;
    private final Assignment delta;

    BranchInfo(int node, Assignment delta) {
        this.node = node;
        this.delta = delta;
    }

    public int node() {
        return node;
    }

    /**
     * The literals fixed by this child relative to the node the branch info was requested for,
     * including those of single-child nodes which were skipped over.
     */
    public Assignment delta() {
        return delta;
    }

    @Override
    public String toString() {
        return node + ":" + delta;
    }
}
