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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.BitSet;
import java.util.Optional;
import org.junit.jupiter.api.Test;

public class AssignmentTest {
    @Test
    public void testExtension() {
        Assignment base = Assignment.of(Literal.of(4, true));
        Assignment extended = base.extendedBy(1, false).extendedBy(7, true);

        assertThat(base.size(), is(1));
        assertThat(extended.size(), is(3));
        assertThat(extended.literals(), contains(Literal.of(4, true), Literal.of(1, false), Literal.of(7, true)));
        assertThat(extended.valueOf(1), is(Optional.of(false)));
        assertThat(extended.valueOf(2), is(Optional.empty()));
        assertThat(extended.contains(7), is(true));
    }

    @Test
    public void testSets() {
        Assignment assignment = Assignment.of(Literal.of(4, true), Literal.of(1, false), Literal.of(7, true));
        BitSet support = new BitSet();
        support.set(1);
        support.set(4);
        support.set(7);
        BitSet valuation = new BitSet();
        valuation.set(4);
        valuation.set(7);

        assertThat(assignment.support(), is(support));
        assertThat(assignment.valuation(), is(valuation));
    }

    @Test
    public void testSortedAndEquality() {
        Assignment assignment = Assignment.of(Literal.of(2, true), Literal.of(0, false), Literal.of(1, true));
        Assignment sorted = assignment.sorted();

        assertThat(sorted, is(Assignment.ofRow(new boolean[] {false, true, true})));
        assertThat(sorted.equals(assignment), is(false));
        assertThat(sorted.hashCode(), is(Assignment.ofRow(new boolean[] {false, true, true}).hashCode()));
        assertThat(assignment.toString(), is("[(2, true), (0, false), (1, true)]"));
        assertThat(Assignment.empty().toString(), is("[]"));
    }

    @Test
    public void testInvalidAccess() {
        Assignment assignment = Assignment.of(Literal.of(0, true));
        assertThrows(IndexOutOfBoundsException.class, () -> assignment.value(1));
        assertThrows(IllegalArgumentException.class, () -> Literal.of(-1, true));
    }
}
