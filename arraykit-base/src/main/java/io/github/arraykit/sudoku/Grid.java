/*
 * Copyright DataStax, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.github.arraykit.sudoku;

import java.util.Arrays;

/**
 * An immutable 9x9 Sudoku grid. Cells hold 1..9, or 0 for an empty cell.
 */
public final class Grid {
    /** Number of rows, columns, and distinct values. */
    public static final int SIZE = 9;
    /** Side length of a block. */
    public static final int BLOCK = 3;
    /** Value of an empty cell. */
    public static final int EMPTY = 0;

    private final int[][] cells;

    private Grid(int[][] cells) {
        this.cells = cells;
    }

    /**
     * Creates a grid from a 9x9 array, which is copied.
     *
     * @param cells the values, row-major, each in {@code [0, 9]}
     * @return the grid
     * @throws IllegalArgumentException if the shape or any value is out of range
     */
    public static Grid of(int[][] cells) {
        if (cells == null || cells.length != SIZE) {
            throw new IllegalArgumentException("Expected " + SIZE + " rows");
        }
        int[][] copy = new int[SIZE][];
        for (int row = 0; row < SIZE; row++) {
            if (cells[row] == null || cells[row].length != SIZE) {
                throw new IllegalArgumentException("Row " + row + " must have " + SIZE + " cells");
            }
            for (int col = 0; col < SIZE; col++) {
                int v = cells[row][col];
                if (v < EMPTY || v > SIZE) {
                    throw new IllegalArgumentException(String.format("Value %d at (%d,%d) is out of range", v, row, col));
                }
            }
            copy[row] = cells[row].clone();
        }
        return new Grid(copy);
    }

    /**
     * Parses a grid from text. Digits fill cells in row-major order, with {@code 0} or {@code .}
     * marking an empty cell. Whitespace and the drawing characters {@code | - +} are ignored.
     *
     * @param text the grid
     * @return the grid
     * @throws IllegalArgumentException if the text does not describe exactly 81 cells
     */
    public static Grid parse(CharSequence text) {
        int[][] cells = new int[SIZE][SIZE];
        int n = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            int value;
            if (c >= '0' && c <= '9') {
                value = c - '0';
            } else if (c == '.') {
                value = EMPTY;
            } else if (Character.isWhitespace(c) || c == '|' || c == '-' || c == '+') {
                continue;
            } else {
                throw new IllegalArgumentException("Unexpected character '" + c + "' at offset " + i);
            }
            if (n == SIZE * SIZE) {
                throw new IllegalArgumentException("More than " + SIZE * SIZE + " cells");
            }
            cells[n / SIZE][n % SIZE] = value;
            n++;
        }
        if (n != SIZE * SIZE) {
            throw new IllegalArgumentException("Expected " + SIZE * SIZE + " cells, found " + n);
        }
        return new Grid(cells);
    }

    public int get(int row, int col) {
        return cells[row][col];
    }

    public boolean isEmpty(int row, int col) {
        return cells[row][col] == EMPTY;
    }

    /**
     * @return true iff no cell is empty
     */
    public boolean isComplete() {
        for (int[] row : cells) {
            for (int v : row) {
                if (v == EMPTY) {
                    return false;
                }
            }
        }
        return true;
    }

    /**
     * @return a fresh copy of the cells
     */
    public int[][] toArray() {
        int[][] copy = new int[SIZE][];
        for (int row = 0; row < SIZE; row++) {
            copy[row] = cells[row].clone();
        }
        return copy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Grid)) return false;
        return Arrays.deepEquals(cells, ((Grid) o).cells);
    }

    @Override
    public int hashCode() {
        return Arrays.deepHashCode(cells);
    }

    /**
     * @return nine lines of nine digits
     */
    @Override
    public String toString() {
        var sb = new StringBuilder(SIZE * (SIZE + 1));
        for (int[] row : cells) {
            for (int v : row) {
                sb.append(v);
            }
            sb.append('\n');
        }
        return sb.toString();
    }
}
