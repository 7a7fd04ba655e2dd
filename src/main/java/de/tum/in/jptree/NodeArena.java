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

import static de.tum.in.jptree.Util.checkState;

import java.util.Arrays;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Pooled storage for the nodes of a single tree. Nodes are identified by {@code int} handles into
 * a set of parallel arrays; released slots are threaded into a free list and handed out again by
 * {@link #allocate(int, boolean)}. The arena is not synchronized.
 */
final class NodeArena {
    private static final Logger logger = Logger.getLogger(NodeArena.class.getName());

    /* Bit allocated for the value of the node */
    private static final int VALUE_BIT_SIZE = 1;
    /* Bits allocated for the kind of the back reference */
    private static final int LINK_KIND_BIT_SIZE = 2;
    private static final int LINK_KIND_MASK = (1 << LINK_KIND_BIT_SIZE) - 1;
    private static final int LINK_KIND_OFFSET = VALUE_BIT_SIZE;
    /* Bits allocated for the variable number */
    private static final int VARIABLE_BIT_SIZE = 29;
    private static final int VARIABLE_OFFSET = LINK_KIND_OFFSET + LINK_KIND_BIT_SIZE;

    /* Marks free slots */
    private static final int INVALID_NODE_VARIABLE = (1 << VARIABLE_BIT_SIZE) - 1;
    /* Marks nodes without a variable, i.e. roots and placeholders */
    private static final int ABSENT_VARIABLE = INVALID_NODE_VARIABLE - 1;
    static final int MAXIMAL_VARIABLE = ABSENT_VARIABLE - 1;

    static {
        //noinspection ConstantValue
        assert VARIABLE_BIT_SIZE + LINK_KIND_BIT_SIZE + VALUE_BIT_SIZE == Integer.SIZE;
    }

    static int dataMake(int variable, boolean value) {
        int storedVariable = variable == PrunableTree.NO_VARIABLE ? ABSENT_VARIABLE : variable;
        assert 0 <= storedVariable && storedVariable < INVALID_NODE_VARIABLE;
        return (storedVariable << VARIABLE_OFFSET) | (value ? 1 : 0);
    }

    static int dataMakeInvalid() {
        return INVALID_NODE_VARIABLE << VARIABLE_OFFSET;
    }

    static boolean dataIsValid(int metadata) {
        return (metadata >>> VARIABLE_OFFSET) != INVALID_NODE_VARIABLE;
    }

    static int dataGetVariable(int metadata) {
        assert dataIsValid(metadata);
        int variable = metadata >>> VARIABLE_OFFSET;
        return variable == ABSENT_VARIABLE ? PrunableTree.NO_VARIABLE : variable;
    }

    static boolean dataGetValue(int metadata) {
        return (metadata & 1) != 0;
    }

    static LinkKind dataGetLinkKind(int metadata) {
        return LinkKind.ofOrdinal((metadata >>> LINK_KIND_OFFSET) & LINK_KIND_MASK);
    }

    static int dataSetLinkKind(int metadata, LinkKind kind) {
        return (metadata & ~(LINK_KIND_MASK << LINK_KIND_OFFSET)) | (kind.ordinal() << LINK_KIND_OFFSET);
    }

    // Use 0 as "not a node" so that freshly allocated link arrays are empty
    static final int NOT_A_NODE = 0;
    static final int FIRST_NODE = 1;

    private static final int MINIMUM_ARENA_SIZE = 8;
    static final int MAXIMAL_NODE_COUNT = Integer.MAX_VALUE / 2 - 8;

    private final int initialSize;
    private final int maximalSize;
    private final double growthFactor;

    /* Layout: <---VAR---><KIND><VALUE> */
    private int[] nodes;
    private int[] firstChild;
    /* For valid nodes the next sibling, for free slots the next free slot. */
    private int[] nextSibling;
    private int[] backReference;

    /* Head of the free list, NOT_A_NODE if the arena is full. */
    private int firstFreeNode;
    private int liveNodeCount;

    // Statistics
    private long createdNodes = 0;
    private long releasedNodes = 0;
    private long growCount = 0;
    private long bulkReleaseCount = 0;

    NodeArena(int initialSize, double growthFactor) {
        this(initialSize, growthFactor, MAXIMAL_NODE_COUNT);
    }

    /**
     * @param maximalNodeCount The number of live nodes beyond which the arena refuses to grow.
     */
    NodeArena(int initialSize, double growthFactor, int maximalNodeCount) {
        assert 0 < maximalNodeCount && maximalNodeCount <= MAXIMAL_NODE_COUNT;
        this.maximalSize = maximalNodeCount + FIRST_NODE;
        this.initialSize = Math.min(Math.max(initialSize, MINIMUM_ARENA_SIZE) + FIRST_NODE, maximalSize);
        this.growthFactor = growthFactor;
        allocateTables(this.initialSize);
    }

    private void allocateTables(int tableSize) {
        nodes = new int[tableSize];
        firstChild = new int[tableSize];
        nextSibling = new int[tableSize];
        backReference = new int[tableSize];
        Arrays.fill(nodes, dataMakeInvalid());
        chainFreeSlots(FIRST_NODE, tableSize);
        firstFreeNode = FIRST_NODE;
        liveNodeCount = 0;
    }

    private void chainFreeSlots(int from, int to) {
        for (int i = from; i < to - 1; i++) {
            nextSibling[i] = i + 1;
        }
        nextSibling[to - 1] = NOT_A_NODE;
    }

    int capacity() {
        return nodes.length - FIRST_NODE;
    }

    /**
     * Returns the number of currently live nodes.
     */
    int size() {
        return liveNodeCount;
    }

    boolean isNodeValid(int node) {
        return FIRST_NODE <= node && node < nodes.length && dataIsValid(nodes[node]);
    }

    /**
     * Creates a new, unlinked node.
     *
     * @param variable The variable of the node or {@link PrunableTree#NO_VARIABLE}.
     * @param value The value the node assigns to {@code variable}.
     * @return The handle of the new node.
     */
    int allocate(int variable, boolean value) {
        assert variable == PrunableTree.NO_VARIABLE || (0 <= variable && variable <= MAXIMAL_VARIABLE);
        if (firstFreeNode == NOT_A_NODE) {
            grow();
        }
        int node = firstFreeNode;
        assert !isNodeValid(node) : "Overwriting existing node " + node;
        firstFreeNode = nextSibling[node];

        nodes[node] = dataMake(variable, value);
        firstChild[node] = NOT_A_NODE;
        nextSibling[node] = NOT_A_NODE;
        backReference[node] = NOT_A_NODE;

        liveNodeCount += 1;
        createdNodes += 1;
        return node;
    }

    /**
     * Returns the slot of {@code node} to the pool. The node must not have any children left.
     */
    void release(int node) {
        assert isNodeValid(node);
        assert !isNodeValid(firstChild[node]) : "Releasing node " + node + " with live child";

        nodes[node] = dataMakeInvalid();
        firstChild[node] = NOT_A_NODE;
        backReference[node] = NOT_A_NODE;
        nextSibling[node] = firstFreeNode;
        firstFreeNode = node;

        liveNodeCount -= 1;
        releasedNodes += 1;
    }

    /**
     * Invalidates every node of this arena at once and shrinks it back to its initial size.
     */
    void releaseAll() {
        logger.log(Level.FINE, "Releasing all {0} nodes of {1}", new Object[] {liveNodeCount, this});
        releasedNodes += liveNodeCount;
        bulkReleaseCount += 1;
        allocateTables(initialSize);
    }

    private void grow() {
        growCount += 1;
        int oldSize = nodes.length;
        @SuppressWarnings("NumericCastThatLosesPrecision")
        int newSize = (int) Math.min(maximalSize, Math.max(oldSize + 1L, (long) Math.ceil(oldSize * growthFactor)));
        checkState(oldSize < newSize, "Arena exhausted at %d nodes", oldSize - FIRST_NODE);

        logger.log(Level.FINE, "Growing the arena {0} from {1} to {2}", new Object[] {this, oldSize, newSize});

        nodes = Arrays.copyOf(nodes, newSize); // NOPMD
        firstChild = Arrays.copyOf(firstChild, newSize); // NOPMD
        nextSibling = Arrays.copyOf(nextSibling, newSize); // NOPMD
        backReference = Arrays.copyOf(backReference, newSize); // NOPMD

        Arrays.fill(nodes, oldSize, newSize, dataMakeInvalid());
        chainFreeSlots(oldSize, newSize);
        // Only grown when the free list is empty
        firstFreeNode = oldSize;
    }

    // Node data

    int variableOf(int node) {
        assert isNodeValid(node);
        return dataGetVariable(nodes[node]);
    }

    boolean hasVariable(int node) {
        return variableOf(node) != PrunableTree.NO_VARIABLE;
    }

    boolean valueOf(int node) {
        assert isNodeValid(node);
        return dataGetValue(nodes[node]);
    }

    LinkKind linkKind(int node) {
        assert isNodeValid(node);
        return dataGetLinkKind(nodes[node]);
    }

    int firstChild(int node) {
        assert isNodeValid(node);
        return firstChild[node];
    }

    int nextSibling(int node) {
        assert isNodeValid(node);
        return nextSibling[node];
    }

    int backReference(int node) {
        assert isNodeValid(node);
        return backReference[node];
    }

    // Linking

    /**
     * Makes {@code child} the head of the children of {@code parent}, updating the back reference
     * of {@code child}. Passing {@link #NOT_A_NODE} leaves {@code parent} childless.
     */
    void attachFirstChild(int parent, int child) {
        assert isNodeValid(parent);
        firstChild[parent] = child;
        if (child != NOT_A_NODE) {
            assert isNodeValid(child);
            backReference[child] = parent;
            nodes[child] = dataSetLinkKind(nodes[child], LinkKind.PARENT);
        }
    }

    /**
     * Makes {@code sibling} the successor of {@code previous} in its sibling chain, updating the
     * back reference of {@code sibling}. Passing {@link #NOT_A_NODE} ends the chain at
     * {@code previous}.
     */
    void attachNextSibling(int previous, int sibling) {
        assert isNodeValid(previous);
        nextSibling[previous] = sibling;
        if (sibling != NOT_A_NODE) {
            assert isNodeValid(sibling);
            backReference[sibling] = previous;
            nodes[sibling] = dataSetLinkKind(nodes[sibling], LinkKind.PREVIOUS_SIBLING);
        }
    }

    // Diagnostics

    /**
     * Checks the integrity of the pool and the links between live nodes.
     *
     * @return True. This way, check can easily be called by an {@code assert} statement.
     */
    boolean check() {
        logger.log(Level.FINER, "Running arena integrity check");

        int count = 0;
        for (int node = FIRST_NODE; node < nodes.length; node++) {
            int metadata = nodes[node];
            if (!dataIsValid(metadata)) {
                continue;
            }
            count += 1;

            int child = firstChild[node];
            checkState(child == NOT_A_NODE || isNodeValid(child), "Invalid child entry (%s)", nodeToString(node));
            int sibling = nextSibling[node];
            checkState(
                    sibling == NOT_A_NODE || isNodeValid(sibling), "Invalid sibling entry (%s)", nodeToString(node));

            int back = backReference[node];
            switch (dataGetLinkKind(metadata)) {
                case NONE:
                    checkState(back == NOT_A_NODE, "Unlinked node (%s) has back reference", nodeToString(node));
                    break;
                case PARENT:
                    checkState(
                            isNodeValid(back) && firstChild[back] == node,
                            "(%s) is not the first child of its parent",
                            nodeToString(node));
                    break;
                case PREVIOUS_SIBLING:
                    checkState(
                            isNodeValid(back) && nextSibling[back] == node,
                            "(%s) is not the successor of its previous sibling",
                            nodeToString(node));
                    break;
                default:
                    throw new AssertionError();
            }
        }
        checkState(count == liveNodeCount, "Invalid # of live nodes: counted=%d, tracked=%d", count, liveNodeCount);

        int freeCount = 0;
        for (int free = firstFreeNode; free != NOT_A_NODE; free = nextSibling[free]) {
            checkState(!dataIsValid(nodes[free]), "Node %d in free node chain is valid", free);
            freeCount += 1;
            checkState(freeCount <= capacity(), "Free node chain contains a loop");
        }
        checkState(
                freeCount + liveNodeCount == capacity(),
                "Invalid # of free nodes: #live=%d, capacity=%d, free=%d",
                liveNodeCount,
                capacity(),
                freeCount);
        return true;
    }

    String statistics() {
        return String.format(
                "Node arena statistics:%n"
                        + "Capacity: %1$d, %2$d live nodes%n"
                        + "%3$d created, %4$d released, %5$d grows, %6$d bulk releases",
                capacity(), liveNodeCount, createdNodes, releasedNodes, growCount, bulkReleaseCount);
    }

    String nodeToString(int node) {
        int metadata = nodes[node];
        if (!dataIsValid(metadata)) {
            return String.format("%5d| == INVALID ==", node);
        }
        int variable = dataGetVariable(metadata);
        return String.format(
                "%5d|%3s|%s|%5d|%5d|%5d %s",
                node,
                variable == PrunableTree.NO_VARIABLE ? "-" : Integer.toString(variable),
                dataGetValue(metadata) ? "H" : "L",
                firstChild[node],
                nextSibling[node],
                backReference[node],
                dataGetLinkKind(metadata));
    }
}
