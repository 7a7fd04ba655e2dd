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
import static de.tum.in.jptree.Util.checkState;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A mutable tree of partial assignments over {@link #binCount()} boolean variables. Every path from
 * the root to a leaf fixes the variables of the nodes along it; all other variables are
 * unconstrained for that leaf. The tree keeps an index of its leaves, ordered depth-first with
 * children visited before siblings, so that the assignment of each leaf is available in constant
 * time.
 *
 * <p>Nodes are identified by {@code int} handles, which are only meaningful for the tree they were
 * obtained from and only as long as the node is not pruned and the tree not re-assigned. Trees are
 * not thread-safe; concurrent access has to be serialized externally.</p>
 *
 * @see PrunableTrees
 */
public final class PrunableTree {
    private static final Logger logger = Logger.getLogger(PrunableTree.class.getName());

    /**
     * Marks a node without a variable.
     */
    public static final int NO_VARIABLE = -1;

    static final class Leaf {
        final int node;
        final Assignment assignment;

        Leaf(int node, Assignment assignment) {
            this.node = node;
            this.assignment = assignment;
        }

        @Override
        public String toString() {
            return node + "=" + assignment;
        }
    }

    private final TreeConfiguration configuration;
    private NodeArena arena;
    private int root;
    private int binCount;
    private List<Leaf> leaves;

    PrunableTree(TreeConfiguration configuration, int binCount) {
        checkArgument(
                0 <= binCount && binCount <= NodeArena.MAXIMAL_VARIABLE + 1, "Unsupported number of bins %d", binCount);
        this.configuration = configuration;
        this.arena = createArena(configuration);
        this.root = arena.allocate(NO_VARIABLE, false);
        this.binCount = binCount;
        this.leaves = new ArrayList<>();
    }

    private static NodeArena createArena(TreeConfiguration configuration) {
        return new NodeArena(
                configuration.initialArenaSize(), configuration.growthFactor(), configuration.maximalArenaSize());
    }

    // Construction, used by PrunableTrees

    void buildSinglePath(int variable, boolean value) {
        assert leaves.isEmpty() && arena.size() == 1;
        if (variable == NO_VARIABLE) {
            return;
        }
        int child = arena.allocate(variable, value);
        arena.attachFirstChild(root, child);
        leaves.add(new Leaf(child, Assignment.of(Literal.of(variable, value))));
    }

    /* Pending part of the trie: the rows in selection still have to be placed below node. */
    private static final class BuildTask {
        final int node;
        final int[] selection;
        final int bin;
        final Assignment path;

        BuildTask(int node, int[] selection, int bin, Assignment path) {
            this.node = node;
            this.selection = selection;
            this.bin = bin;
            this.path = path;
        }
    }

    void buildFromRows(List<boolean[]> rows) {
        assert leaves.isEmpty() && arena.size() == 1;
        if (rows.isEmpty() || binCount == 0) {
            return;
        }
        int[] selection = new int[rows.size()];
        Arrays.setAll(selection, i -> i);

        // Explicit work stack, rows may be far wider than the call stack is deep. The high branch
        // is pushed first so that low leaves are registered first.
        Deque<BuildTask> workStack = new ArrayDeque<>();
        workStack.push(new BuildTask(root, selection, 0, Assignment.empty()));
        while (!workStack.isEmpty()) {
            BuildTask task = workStack.pop();
            assert task.selection.length > 0;
            int bin = task.bin;
            if (bin == binCount) {
                // Duplicate rows end up at the same node
                leaves.add(new Leaf(task.node, task.path));
                continue;
            }

            int highCount = 0;
            for (int row : task.selection) {
                if (rows.get(row)[bin]) {
                    highCount += 1;
                }
            }
            int[] low = new int[task.selection.length - highCount];
            int[] high = new int[highCount];
            int lowIndex = 0;
            int highIndex = 0;
            for (int row : task.selection) {
                if (rows.get(row)[bin]) {
                    high[highIndex++] = row;
                } else {
                    low[lowIndex++] = row;
                }
            }

            int lowNode = NOT_A_NODE;
            if (low.length > 0) {
                lowNode = arena.allocate(bin, false);
                arena.attachFirstChild(task.node, lowNode);
            }
            if (high.length > 0) {
                int highNode = arena.allocate(bin, true);
                if (lowNode == NOT_A_NODE) {
                    arena.attachFirstChild(task.node, highNode);
                } else {
                    arena.attachNextSibling(lowNode, highNode);
                }
                workStack.push(new BuildTask(highNode, high, bin + 1, task.path.extendedBy(bin, true)));
            }
            if (lowNode != NOT_A_NODE) {
                workStack.push(new BuildTask(lowNode, low, bin + 1, task.path.extendedBy(bin, false)));
            }
        }
    }

    // Package-private access for the concatenation operators

    TreeConfiguration configuration() {
        return configuration;
    }

    NodeArena arena() {
        return arena;
    }

    List<Leaf> leafRecords() {
        return leaves;
    }

    /**
     * Removes all leaf records and returns the previous ones.
     */
    List<Leaf> takeLeafRecords() {
        List<Leaf> taken = leaves;
        leaves = new ArrayList<>(taken.size());
        return taken;
    }

    /**
     * Copies the complete structure of {@code source} into this tree, which has to consist of its
     * root only.
     */
    void copyStructureFrom(PrunableTree source) {
        assert leaves.isEmpty() && arena.size() == 1;
        new SubtreeCopier(source.arena, arena, 0, leaves).copyBelowRoot(source.root, root);
    }

    void verify() {
        if (configuration.checkIntegrity()) {
            check();
        } else {
            assert check();
        }
    }

    // Copy

    /**
     * Creates a deep copy of this tree, sharing the configuration.
     */
    public PrunableTree copy() {
        PrunableTree copy = new PrunableTree(configuration, binCount);
        copy.copyStructureFrom(this);
        copy.verify();
        return copy;
    }

    /**
     * Replaces the contents of this tree with a deep copy of {@code other}. The copy is built in a
     * fresh arena, which replaces the current one only once copying finished. All handles
     * previously obtained from this tree become invalid.
     */
    public void assign(PrunableTree other) {
        Objects.requireNonNull(other);
        if (other == this) {
            return;
        }
        NodeArena newArena = createArena(configuration);
        int newRoot = newArena.allocate(NO_VARIABLE, false);
        List<Leaf> newLeaves = new ArrayList<>(other.leaves.size());
        new SubtreeCopier(other.arena, newArena, 0, newLeaves).copyBelowRoot(other.root, newRoot);

        arena.releaseAll();
        arena = newArena;
        root = newRoot;
        leaves = newLeaves;
        binCount = other.binCount;
        verify();
    }

    // Pruning

    /**
     * Removes the leaves at the given positions of the leaf index. Ancestors which become childless
     * are removed as well, up to but excluding the root. The remaining leaves keep their relative
     * order. Repeated positions are treated as one.
     *
     * @throws IndexOutOfBoundsException if any position is not in {@code [0, leafCount())}. In this
     *     case, the tree is not modified.
     */
    public void pruneLeaves(int... positions) {
        Objects.requireNonNull(positions);
        BitSet targets = new BitSet(leaves.size());
        for (int position : positions) {
            targets.set(Objects.checkIndex(position, leaves.size()));
        }
        pruneLeaves(targets);
    }

    /**
     * Collection variant of {@link #pruneLeaves(int...)}.
     */
    public void pruneLeaves(Collection<Integer> positions) {
        Objects.requireNonNull(positions);
        BitSet targets = new BitSet(leaves.size());
        for (Integer position : positions) {
            targets.set(Objects.checkIndex(position, leaves.size()));
        }
        pruneLeaves(targets);
    }

    private void pruneLeaves(BitSet targets) {
        if (targets.isEmpty()) {
            return;
        }
        int nodesBefore = arena.size();

        for (int position = targets.nextSetBit(0); position >= 0; position = targets.nextSetBit(position + 1)) {
            int node = leaves.get(position).node;
            releaseDescendants(node);
            detachAndRelease(node);
        }

        List<Leaf> remaining = new ArrayList<>(leaves.size() - targets.cardinality());
        for (int position = 0; position < leaves.size(); position++) {
            if (!targets.get(position)) {
                remaining.add(leaves.get(position));
            }
        }
        leaves = remaining;

        logger.log(Level.FINER, "Pruned {0} leaves, releasing {1} nodes", new Object[] {
            targets.cardinality(), nodesBefore - arena.size()
        });
        verify();
    }

    /**
     * Removes {@code node} together with everything below it. Ancestors which become childless are
     * removed as well. Pruning the root removes all its descendants but keeps the root itself.
     *
     * @throws IllegalArgumentException if {@code node} is not a node of this tree.
     */
    public void pruneBranch(int node) {
        checkNode(node);
        int nodesBefore = arena.size();
        releaseDescendants(node);
        if (node != root) {
            detachAndRelease(node);
        }
        // No allocation happened in between, so released handles are still invalid
        leaves.removeIf(leaf -> !arena.isNodeValid(leaf.node));

        logger.log(Level.FINER, "Pruned branch {0}, releasing {1} nodes", new Object[] {
            node, nodesBefore - arena.size()
        });
        verify();
    }

    /**
     * Releases all nodes below {@code node}. Descendants are visited depth-first, children before
     * siblings, and released in reverse order, so that no node is released while one of its
     * children is still alive.
     */
    private void releaseDescendants(int node) {
        int first = arena.firstChild(node);
        if (first == NOT_A_NODE) {
            return;
        }

        int[] workStack = new int[16];
        int workStackIndex = 0;
        int[] visited = new int[16];
        int visitedCount = 0;

        workStack[workStackIndex++] = first;
        while (workStackIndex > 0) {
            int current = workStack[--workStackIndex];
            if (visitedCount == visited.length) {
                visited = Arrays.copyOf(visited, visited.length * 2);
            }
            visited[visitedCount++] = current;

            if (workStackIndex + 2 > workStack.length) {
                workStack = Arrays.copyOf(workStack, workStack.length * 2);
            }
            int sibling = arena.nextSibling(current);
            if (sibling != NOT_A_NODE) {
                workStack[workStackIndex++] = sibling;
            }
            int child = arena.firstChild(current);
            if (child != NOT_A_NODE) {
                workStack[workStackIndex++] = child;
            }
        }

        for (int i = visitedCount - 1; i >= 0; i--) {
            arena.release(visited[i]);
        }
        arena.attachFirstChild(node, NOT_A_NODE);
    }

    /**
     * Unlinks the childless {@code node} from its parent or previous sibling and releases it. If
     * this leaves the parent without children, the parent is removed in the same way, unless it is
     * the root.
     */
    private void detachAndRelease(int node) {
        int current = node;
        while (true) {
            assert current != root;
            assert arena.firstChild(current) == NOT_A_NODE;

            int back = arena.backReference(current);
            int next = arena.nextSibling(current);
            LinkKind kind = arena.linkKind(current);
            boolean collapseParent;
            if (kind == LinkKind.PARENT) {
                arena.attachFirstChild(back, next);
                collapseParent = next == NOT_A_NODE && back != root;
            } else {
                checkState(kind == LinkKind.PREVIOUS_SIBLING, "Node %d is not linked", current);
                arena.attachNextSibling(back, next);
                collapseParent = false;
            }
            arena.release(current);

            if (!collapseParent) {
                return;
            }
            current = back;
        }
    }

    // Read access

    public int root() {
        return root;
    }

    public int binCount() {
        return binCount;
    }

    /**
     * Returns the number of live nodes, including the root.
     */
    public int nodeCount() {
        return arena.size();
    }

    public int leafCount() {
        return leaves.size();
    }

    /**
     * Returns the assignments of all leaves in leaf index order.
     */
    public List<Assignment> leafAssignments() {
        List<Assignment> assignments = new ArrayList<>(leaves.size());
        for (Leaf leaf : leaves) {
            assignments.add(leaf.assignment);
        }
        return Collections.unmodifiableList(assignments);
    }

    public Assignment leafAssignment(int position) {
        return leaves.get(Objects.checkIndex(position, leaves.size())).assignment;
    }

    public int leafNode(int position) {
        return leaves.get(Objects.checkIndex(position, leaves.size())).node;
    }

    /**
     * Returns the children of {@code node}, each with the literal it fixes. If {@code node} has a
     * single child which is not a leaf, the children of that child are returned instead, with its
     * literal prepended to their delta, and so on. The tree itself is not changed.
     */
    public List<BranchInfo> branchInfo(int node) {
        checkNode(node);
        List<BranchInfo> branches = new ArrayList<>();
        int current = node;
        Assignment delta = Assignment.empty();
        while (true) {
            branches.clear();
            for (int child = arena.firstChild(current); child != NOT_A_NODE; child = arena.nextSibling(child)) {
                Assignment childDelta =
                        arena.hasVariable(child) ? delta.extendedBy(arena.variableOf(child), arena.valueOf(child)) : delta;
                branches.add(new BranchInfo(child, childDelta));
            }
            if (branches.size() != 1) {
                break;
            }
            BranchInfo single = branches.get(0);
            if (arena.firstChild(single.node()) == NOT_A_NODE) {
                break;
            }
            current = single.node();
            delta = single.delta();
        }
        return Collections.unmodifiableList(branches);
    }

    // Structure

    private void checkNode(int node) {
        checkArgument(arena.isNodeValid(node), "Node %d is not a node of this tree", node);
    }

    public boolean isLeaf(int node) {
        checkNode(node);
        return node != root && arena.firstChild(node) == NOT_A_NODE;
    }

    public boolean hasVariable(int node) {
        checkNode(node);
        return arena.hasVariable(node);
    }

    /**
     * Gets the variable of the given {@code node} or {@link #NO_VARIABLE}.
     */
    public int variableOf(int node) {
        checkNode(node);
        return arena.variableOf(node);
    }

    public boolean valueOf(int node) {
        checkNode(node);
        return arena.valueOf(node);
    }

    /**
     * Returns the first child of {@code node} or {@link #placeholder()} if it has none.
     */
    public int firstChild(int node) {
        checkNode(node);
        return arena.firstChild(node);
    }

    /**
     * Returns the next sibling of {@code node} or {@link #placeholder()} if it is the last one.
     */
    public int nextSibling(int node) {
        checkNode(node);
        return arena.nextSibling(node);
    }

    /**
     * Returns the parent of {@code node} if it is the first of its siblings, its previous sibling
     * otherwise, and {@link #placeholder()} for the root.
     *
     * @see #backReferenceKind(int)
     */
    public int backReference(int node) {
        checkNode(node);
        return arena.backReference(node);
    }

    public LinkKind backReferenceKind(int node) {
        checkNode(node);
        return arena.linkKind(node);
    }

    public int[] children(int node) {
        checkNode(node);
        int count = 0;
        for (int child = arena.firstChild(node); child != NOT_A_NODE; child = arena.nextSibling(child)) {
            count += 1;
        }
        int[] children = new int[count];
        int index = 0;
        for (int child = arena.firstChild(node); child != NOT_A_NODE; child = arena.nextSibling(child)) {
            children[index++] = child;
        }
        return children;
    }

    /**
     * A value distinct from every node handle, returned where no node exists.
     */
    public int placeholder() {
        return NOT_A_NODE;
    }

    // Diagnostics

    /**
     * Recomputes the assignments of all leaves by traversing the tree, independently of the leaf
     * index.
     */
    public List<Assignment> propagatedLeafAssignments() {
        List<Leaf> propagated = new ArrayList<>();
        collectLeaves(propagated);
        List<Assignment> assignments = new ArrayList<>(propagated.size());
        for (Leaf leaf : propagated) {
            assignments.add(leaf.assignment);
        }
        return assignments;
    }

    /**
     * Walks the tree depth-first, children before siblings, and adds every leaf with the assignment
     * of its path to {@code sink}. Each work stack entry holds a node and the path leading to its
     * parent.
     *
     * @return The number of nodes reachable from the root.
     */
    private int collectLeaves(List<Leaf> sink) {
        int count = 1;
        Deque<Leaf> workStack = new ArrayDeque<>();
        int first = arena.firstChild(root);
        if (first != NOT_A_NODE) {
            workStack.push(new Leaf(first, Assignment.empty()));
        }
        while (!workStack.isEmpty()) {
            Leaf entry = workStack.pop();
            int node = entry.node;
            count += 1;

            Assignment path = arena.hasVariable(node)
                    ? entry.assignment.extendedBy(arena.variableOf(node), arena.valueOf(node))
                    : entry.assignment;
            int sibling = arena.nextSibling(node);
            if (sibling != NOT_A_NODE) {
                workStack.push(new Leaf(sibling, entry.assignment));
            }
            int child = arena.firstChild(node);
            if (child == NOT_A_NODE) {
                sink.add(new Leaf(node, path));
            } else {
                workStack.push(new Leaf(child, path));
            }
        }
        return count;
    }

    /**
     * Checks that the leaf index, the node count and the links of the arena agree with the tree
     * reachable from the root.
     *
     * @return True. This way, check can easily be called by an {@code assert} statement.
     * @throws IllegalStateException if an inconsistency is found.
     */
    public boolean check() {
        logger.log(Level.FINER, "Running tree integrity check");
        arena.check();

        checkState(!arena.hasVariable(root), "Root has variable %d", arena.variableOf(root));
        checkState(arena.linkKind(root) == LinkKind.NONE, "Root is linked");
        checkState(arena.nextSibling(root) == NOT_A_NODE, "Root has siblings");

        List<Leaf> reachable = new ArrayList<>();
        int reachableNodes = collectLeaves(reachable);
        checkState(
                reachableNodes == arena.size(),
                "Arena holds %d nodes, but %d are reachable",
                arena.size(),
                reachableNodes);
        checkState(
                reachable.size() == leaves.size(),
                "Leaf index holds %d leaves, but %d are reachable",
                leaves.size(),
                reachable.size());

        for (int position = 0; position < leaves.size(); position++) {
            Leaf indexed = leaves.get(position);
            Leaf propagated = reachable.get(position);
            checkState(
                    indexed.node == propagated.node,
                    "Leaf %d is node %d, expected %d",
                    position,
                    indexed.node,
                    propagated.node);
            checkState(
                    indexed.assignment.equals(propagated.assignment),
                    "Leaf %d has assignment %s, expected %s",
                    position,
                    indexed.assignment,
                    propagated.assignment);

            Assignment assignment = indexed.assignment;
            checkState(
                    assignment.support().cardinality() == assignment.size(),
                    "Leaf %d tests a variable twice: %s",
                    position,
                    assignment);
            for (int i = 0; i < assignment.size(); i++) {
                checkState(
                        assignment.variable(i) < binCount,
                        "Leaf %d uses variable %d of %d",
                        position,
                        assignment.variable(i),
                        binCount);
            }
        }
        return true;
    }

    public String statistics() {
        return arena.statistics();
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder(64 + 32 * leaves.size());
        builder.append(String.format(
                "Prunable tree:%n  bins = %d, leaves = %d, nodes = %d%n", binCount, leaves.size(), arena.size()));
        for (Leaf leaf : leaves) {
            builder.append("    Leaf:");
            for (Literal literal : leaf.assignment.sorted().literals()) {
                builder.append(' ').append(literal);
            }
            builder.append(String.format("%n"));
        }
        return builder.toString();
    }
}
