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
 * Describes what the back reference of a node points to. The head of a sibling chain refers to
 * its parent, every other member of the chain to its immediate predecessor. Only the root (and
 * nodes not yet linked into a tree) have no back reference.
 */
public enum LinkKind {
    NONE,
    PARENT,
    PREVIOUS_SIBLING;

    private static final LinkKind[] VALUES = values();

    static LinkKind ofOrdinal(int ordinal) {
        return VALUES[ordinal];
    }
}
