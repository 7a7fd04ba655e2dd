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

import java.util.ArrayList;
import java.util.BitSet;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

final class Generator {
    private Generator() {}

    /**
     * Draws up to {@code rowCount} pairwise distinct dense rows over {@code binCount} bins.
     */
    static List<boolean[]> distinctRows(Random random, int binCount, int rowCount) {
        int possibleRows = binCount >= 30 ? Integer.MAX_VALUE : 1 << binCount;
        int count = Math.min(rowCount, possibleRows);
        Set<BitSet> seen = new HashSet<>();
        List<boolean[]> rows = new ArrayList<>(count);
        while (rows.size() < count) {
            boolean[] row = new boolean[binCount];
            BitSet key = new BitSet(binCount);
            for (int i = 0; i < binCount; i++) {
                row[i] = random.nextBoolean();
                if (row[i]) {
                    key.set(i);
                }
            }
            if (seen.add(key)) {
                rows.add(row);
            }
        }
        return rows;
    }

    static PrunableTree randomTree(Random random, int binCount, int rowCount) {
        return PrunableTrees.fromLeafTable(distinctRows(random, binCount, rowCount));
    }

    static boolean[] row(String bits) {
        boolean[] row = new boolean[bits.length()];
        for (int i = 0; i < row.length; i++) {
            row[i] = bits.charAt(i) == '1';
        }
        return row;
    }

    /**
     * Counts the nodes reachable from the root without using the arena.
     */
    static int reachableNodes(PrunableTree tree) {
        int count = 0;
        List<Integer> pending = new ArrayList<>();
        pending.add(tree.root());
        while (!pending.isEmpty()) {
            int node = pending.remove(pending.size() - 1);
            count += 1;
            for (int child : tree.children(node)) {
                pending.add(child);
            }
        }
        return count;
    }

    static int reachableLeaves(PrunableTree tree) {
        int count = 0;
        List<Integer> pending = new ArrayList<>();
        pending.add(tree.root());
        while (!pending.isEmpty()) {
            int node = pending.remove(pending.size() - 1);
            if (tree.isLeaf(node)) {
                count += 1;
            }
            for (int child : tree.children(node)) {
                pending.add(child);
            }
        }
        return count;
    }
}
