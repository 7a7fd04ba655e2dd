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
import static de.tum.in.jptree.Util.checkArgument;

import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Constructors and combinators for {@link PrunableTree}s. Combinators never modify their operands;
 * the result lives in a new arena and uses the configuration of the first operand unless one is
 * given explicitly.
 */
public final class PrunableTrees {
    private static final Logger logger = Logger.getLogger(PrunableTrees.class.getName());

    private static final TreeConfiguration DEFAULT_CONFIGURATION = ImmutableTreeConfiguration.builder().build();

    private PrunableTrees() {}

    /**
     * Creates a tree consisting of its root only, over zero bins and without leaves.
     */
    public static PrunableTree empty() {
        return empty(DEFAULT_CONFIGURATION);
    }

    public static PrunableTree empty(TreeConfiguration configuration) {
        return new PrunableTree(configuration, 0);
    }

    /**
     * Creates a tree over {@code binCount} bins with a single leaf fixing {@code variable} to
     * {@code value}. If {@code variable} is {@link PrunableTree#NO_VARIABLE}, the tree has no leaf.
     */
    public static PrunableTree singlePath(int variable, boolean value, int binCount) {
        return singlePath(DEFAULT_CONFIGURATION, variable, value, binCount);
    }

    public static PrunableTree singlePath(TreeConfiguration configuration, int variable, boolean value, int binCount) {
        checkArgument(binCount >= 0, "Negative number of bins %d", binCount);
        checkArgument(
                variable == PrunableTree.NO_VARIABLE || (0 <= variable && variable < binCount),
                "Variable %d not in [0, %d)",
                variable,
                binCount);
        PrunableTree tree = new PrunableTree(configuration, binCount);
        tree.buildSinglePath(variable, value);
        tree.verify();
        return tree;
    }

    /**
     * Creates a tree with one leaf per distinct row. Row {@code r} assigns {@code rows.get(r)[i]} to
     * variable {@code i}; all rows must have the same length, which becomes the number of bins.
     * Nodes are shared between rows as long as their prefixes agree.
     *
     * @throws ArityMismatchException if the rows differ in length.
     */
    public static PrunableTree fromLeafTable(List<boolean[]> rows) {
        return fromLeafTable(DEFAULT_CONFIGURATION, rows);
    }

    public static PrunableTree fromLeafTable(TreeConfiguration configuration, List<boolean[]> rows) {
        Objects.requireNonNull(rows);
        int binCount = rows.isEmpty() ? 0 : rows.get(0).length;
        for (int row = 0; row < rows.size(); row++) {
            int length = rows.get(row).length;
            if (length != binCount) {
                throw new ArityMismatchException(row, binCount, length);
            }
        }
        PrunableTree tree = new PrunableTree(configuration, binCount);
        tree.buildFromRows(rows);
        tree.verify();
        logger.log(Level.FINER, "Built tree from {0} rows over {1} bins with {2} leaves and {3} nodes", new Object[] {
            rows.size(), binCount, tree.leafCount(), tree.nodeCount()
        });
        return tree;
    }

    /**
     * Vertical concatenation: the product of both trees over disjoint variables. Every leaf of a
     * copy of {@code first} is extended by a copy of {@code second} whose variables are shifted by
     * {@code first.binCount()}. The result has {@code first.binCount() + second.binCount()} bins
     * and one leaf for each pair of leaves of the operands. If either operand has no leaves, neither
     * has the result.
     */
    public static PrunableTree vcat(PrunableTree first, PrunableTree second) {
        return vcat(first.configuration(), first, second);
    }

    public static PrunableTree vcat(TreeConfiguration configuration, PrunableTree first, PrunableTree second) {
        Objects.requireNonNull(first);
        Objects.requireNonNull(second);
        int offset = first.binCount();
        PrunableTree result = new PrunableTree(configuration, Math.addExact(offset, second.binCount()));
        if (first.leafCount() == 0 || second.leafCount() == 0) {
            result.verify();
            return result;
        }

        result.copyStructureFrom(first);
        List<PrunableTree.Leaf> baseLeaves = result.takeLeafRecords();
        SubtreeCopier copier = new SubtreeCopier(second.arena(), result.arena(), offset, result.leafRecords());
        for (PrunableTree.Leaf leaf : baseLeaves) {
            copier.copyChildren(second.root(), leaf.node, leaf.assignment);
        }
        result.verify();

        logger.log(Level.FINER, "Vertical concatenation of {0} and {1} leaves yields {2} nodes", new Object[] {
            first.leafCount(), second.leafCount(), result.nodeCount()
        });
        return result;
    }

    /**
     * Horizontal concatenation: the disjoint union of the given trees. Tree {@code i} is assigned
     * the variable block {@code [offset, offset + n]}, where {@code n} is its number of bins and
     * {@code offset} the sum of the block sizes of all preceding trees. Its own variables are
     * shifted into {@code [offset, offset + n)} and variable {@code offset + n} becomes its
     * selector, which the result fixes to {@code true} above the copy of the tree. Leaves of other
     * trees leave that selector unconstrained.
     *
     * <p>Trees without leaves contribute their variable block but no selector node. In particular,
     * such a tree does not turn into a leaf that only fixes its selector: the union has no
     * assignment selecting it, so the leaf count of the result is the sum of the operands' leaf
     * counts.</p>
     */
    public static PrunableTree hcat(List<PrunableTree> trees) {
        Objects.requireNonNull(trees);
        return hcat(trees.isEmpty() ? DEFAULT_CONFIGURATION : trees.get(0).configuration(), trees);
    }

    public static PrunableTree hcat(TreeConfiguration configuration, List<PrunableTree> trees) {
        Objects.requireNonNull(trees);
        int[] offsets = new int[trees.size()];
        int binCount = 0;
        for (int i = 0; i < trees.size(); i++) {
            offsets[i] = binCount;
            binCount = Math.addExact(binCount, Math.addExact(trees.get(i).binCount(), 1));
        }

        PrunableTree result = new PrunableTree(configuration, binCount);
        NodeArena arena = result.arena();
        int previousSelector = NOT_A_NODE;
        for (int i = 0; i < trees.size(); i++) {
            PrunableTree tree = trees.get(i);
            if (tree.leafCount() == 0) {
                continue;
            }
            int selectorVariable = offsets[i] + tree.binCount();
            int selector = arena.allocate(selectorVariable, true);
            if (previousSelector == NOT_A_NODE) {
                arena.attachFirstChild(result.root(), selector);
            } else {
                arena.attachNextSibling(previousSelector, selector);
            }
            previousSelector = selector;

            new SubtreeCopier(tree.arena(), arena, offsets[i], result.leafRecords())
                    .copyChildren(tree.root(), selector, Assignment.of(Literal.of(selectorVariable, true)));
        }
        result.verify();

        logger.log(Level.FINER, "Horizontal concatenation of {0} trees yields {1} leaves and {2} nodes", new Object[] {
            trees.size(), result.leafCount(), result.nodeCount()
        });
        return result;
    }
}
