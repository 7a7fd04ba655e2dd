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

import java.util.AbstractList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.List;
import java.util.Optional;
import javax.annotation.Nullable;

/**
 * An ordered, immutable sequence of literals as collected along a path from the root of a tree.
 * Variables which do not occur are unconstrained.
 */
public final class Assignment {
    private static final int[] EMPTY_VARIABLES = new int[0];
    private static final Assignment EMPTY = new Assignment(EMPTY_VARIABLES, new BitSet());

    private final int[] variables;
    /* Bit i is set iff the i-th literal assigns true. */
    private final BitSet values;

    private Assignment(int[] variables, BitSet values) {
        this.variables = variables;
        this.values = values;
    }

    public static Assignment empty() {
        return EMPTY;
    }

    public static Assignment of(Literal... literals) {
        return of(Arrays.asList(literals));
    }

    public static Assignment of(List<Literal> literals) {
        int[] variables = new int[literals.size()];
        BitSet values = new BitSet(literals.size());
        for (int i = 0; i < variables.length; i++) {
            Literal literal = literals.get(i);
            variables[i] = literal.variable();
            if (literal.value()) {
                values.set(i);
            }
        }
        return new Assignment(variables, values);
    }

    /**
     * Builds the dense assignment fixing variable {@code i} to {@code row[i]} for every position.
     */
    public static Assignment ofRow(boolean[] row) {
        int[] variables = new int[row.length];
        BitSet values = new BitSet(row.length);
        for (int i = 0; i < row.length; i++) {
            variables[i] = i;
            if (row[i]) {
                values.set(i);
            }
        }
        return new Assignment(variables, values);
    }

    public int size() {
        return variables.length;
    }

    public boolean isEmpty() {
        return variables.length == 0;
    }

    public int variable(int index) {
        return variables[index];
    }

    public boolean value(int index) {
        if (index < 0 || index >= variables.length) {
            throw new IndexOutOfBoundsException("Index " + index + " out of bounds for length " + variables.length);
        }
        return values.get(index);
    }

    public Literal literal(int index) {
        return Literal.of(variable(index), value(index));
    }

    public List<Literal> literals() {
        return new AbstractList<>() {
            @Override
            public Literal get(int index) {
                return literal(index);
            }

            @Override
            public int size() {
                return variables.length;
            }
        };
    }

    /**
     * Returns the set of variables constrained by this assignment.
     */
    public BitSet support() {
        BitSet support = new BitSet();
        for (int variable : variables) {
            support.set(variable);
        }
        return support;
    }

    /**
     * Returns the set of variables this assignment fixes to {@code true}.
     */
    public BitSet valuation() {
        BitSet valuation = new BitSet();
        for (int i = values.nextSetBit(0); i >= 0; i = values.nextSetBit(i + 1)) {
            valuation.set(variables[i]);
        }
        return valuation;
    }

    public boolean contains(int variable) {
        return indexOf(variable) >= 0;
    }

    public Optional<Boolean> valueOf(int variable) {
        int index = indexOf(variable);
        return index < 0 ? Optional.empty() : Optional.of(values.get(index));
    }

    private int indexOf(int variable) {
        for (int i = 0; i < variables.length; i++) {
            if (variables[i] == variable) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Returns a new assignment with the given literal appended.
     */
    public Assignment extendedBy(int variable, boolean value) {
        assert variable >= 0;
        int[] extendedVariables = Arrays.copyOf(variables, variables.length + 1);
        extendedVariables[variables.length] = variable;
        BitSet extendedValues = BitSets.copyOf(values);
        if (value) {
            extendedValues.set(variables.length);
        }
        return new Assignment(extendedVariables, extendedValues);
    }

    /**
     * Returns this assignment with its literals ordered by variable.
     */
    public Assignment sorted() {
        Literal[] literals = literals().toArray(new Literal[0]);
        Arrays.sort(literals, Literal.BY_VARIABLE);
        return of(literals);
    }

    @Override
    public boolean equals(@Nullable Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Assignment)) {
            return false;
        }
        Assignment other = (Assignment) o;
        return Arrays.equals(variables, other.variables) && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(variables) + values.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder(8 * variables.length + 2).append('[');
        for (int i = 0; i < variables.length; i++) {
            if (i > 0) {
                builder.append(", ");
            }
            builder.append('(').append(variables[i]).append(", ").append(values.get(i)).append(')');
        }
        return builder.append(']').toString();
    }
}
