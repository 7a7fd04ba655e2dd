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
 * Thrown when the rows of a leaf table do not all have the same length.
 */
public class ArityMismatchException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    private final int row;
    private final int expectedLength;
    private final int actualLength;

    public ArityMismatchException(int row, int expectedLength, int actualLength) {
        super(String.format(
                "All leaves must have the same number of binaries: row %d has %d, expected %d",
                row, actualLength, expectedLength));
        this.row = row;
        this.expectedLength = expectedLength;
        this.actualLength = actualLength;
    }

    public int row() {
        return row;
    }

    public int expectedLength() {
        return expectedLength;
    }

    public int actualLength() {
        return actualLength;
    }
}
