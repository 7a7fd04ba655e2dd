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

import java.util.Comparator;
import javax.annotation.Nullable;

/**
 * A single variable fixed to a boolean value.
 */
public final class Literal {
    static final Comparator<Literal> BY_VARIABLE = Comparator.comparingInt(Literal::variable);

    private final int variable;
    private final boolean value;

    private Literal(int variable, boolean value) {
        this.variable = variable;
        this.value = value;
    }

    public static Literal of(int variable, boolean value) {
        if (variable < 0) {
            throw new IllegalArgumentException("Negative variable " + variable);
        }
        return new Literal(variable, value);
    }

    public int variable() {
        return variable;
    }

    public boolean value() {
        return value;
    }

    @Override
    public boolean equals(@Nullable Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Literal)) {
            return false;
        }
        Literal other = (Literal) o;
        return variable == other.variable && value == other.value;
    }

    @Override
    public int hashCode() {
        return 31 * variable + (value ? 1 : 0);
    }

    @Override
    public String toString() {
        return "(" + variable + ", " + value + ")";
    }
}
