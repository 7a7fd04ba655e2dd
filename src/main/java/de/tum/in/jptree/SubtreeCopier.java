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

import static de.tum.in.jptree.NodeArena.NOT_A_NODE;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Copies structure from one arena into another, shifting every variable by a fixed offset. Nodes
 * without a variable are not copied; their children take their place in the sibling chain. Leaves
 * of the copy are appended to the given leaf list in depth-first, first-child-before-sibling
 * order, together with their assignment. The source arena is only read.
 */
final class SubtreeCopier {
    private final NodeArena source;
    private final NodeArena target;
    private final int offset;
    private final List<PrunableTree.Leaf> leaves;

    SubtreeCopier(NodeArena source, NodeArena target, int offset, List<PrunableTree.Leaf> leaves) {
        assert offset >= 0;
        this.source = source;
        this.target = target;
        this.offset = offset;
        this.leaves = leaves;
    }

    /* Position in a source sibling chain which is being copied below targetParent. */
    private static final class Cursor {
        int current;
        final int targetParent;
        /* Last node appended below targetParent, NOT_A_NODE if none yet. */
        int last;
        final Assignment path;
        /* Splices the children of a placeholder into the chain of the cursor below it. */
        final boolean splice;
        final boolean registerLeaf;

        Cursor(int current, int targetParent, int last, Assignment path, boolean splice, boolean registerLeaf) {
            this.current = current;
            this.targetParent = targetParent;
            this.last = last;
            this.path = path;
            this.splice = splice;
            this.registerLeaf = registerLeaf;
        }
    }

    /**
     * Copies everything below the root {@code sourceRoot} below {@code targetRoot}. A root without
     * children yields no leaf.
     */
    void copyBelowRoot(int sourceRoot, int targetRoot) {
        assert target.firstChild(targetRoot) == NOT_A_NODE;
        copy(new Cursor(source.firstChild(sourceRoot), targetRoot, NOT_A_NODE, Assignment.empty(), false, false));
    }

    /**
     * Copies the children of {@code sourceNode} as the children of {@code targetNode}, which has
     * to be childless. If nothing gets copied, {@code targetNode} is registered as leaf.
     *
     * @param path The assignment leading to {@code targetNode}.
     */
    void copyChildren(int sourceNode, int targetNode, Assignment path) {
        assert target.firstChild(targetNode) == NOT_A_NODE;
        copy(new Cursor(source.firstChild(sourceNode), targetNode, NOT_A_NODE, path, false, true));
    }

    private void copy(Cursor initial) {
        // Explicit work stack, trees may be far deeper than the call stack
        Deque<Cursor> workStack = new ArrayDeque<>();
        workStack.push(initial);
        while (!workStack.isEmpty()) {
            Cursor cursor = workStack.peek();
            int current = cursor.current;
            if (current == NOT_A_NODE) {
                workStack.pop();
                if (cursor.splice) {
                    workStack.element().last = cursor.last;
                } else if (cursor.registerLeaf && cursor.last == NOT_A_NODE) {
                    leaves.add(new PrunableTree.Leaf(cursor.targetParent, cursor.path));
                }
                continue;
            }
            cursor.current = source.nextSibling(current);

            if (!source.hasVariable(current)) {
                workStack.push(new Cursor(
                        source.firstChild(current), cursor.targetParent, cursor.last, cursor.path, true, false));
                continue;
            }

            int variable = source.variableOf(current) + offset;
            boolean value = source.valueOf(current);
            int copy = target.allocate(variable, value);
            if (cursor.last == NOT_A_NODE) {
                target.attachFirstChild(cursor.targetParent, copy);
            } else {
                target.attachNextSibling(cursor.last, copy);
            }
            cursor.last = copy;

            workStack.push(new Cursor(
                    source.firstChild(current), copy, NOT_A_NODE, cursor.path.extendedBy(variable, value), false, true));
        }
    }
}
