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

import io.github.arraykit.annotations.VisibleForTesting;
import io.github.arraykit.array.DynamicArray;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static io.github.arraykit.sudoku.Grid.BLOCK;
import static io.github.arraykit.sudoku.Grid.EMPTY;
import static io.github.arraykit.sudoku.Grid.SIZE;

/**
 * Counts the completions of a Sudoku grid by exhaustive backtracking.
 * <p>
 * The search always branches on the first empty cell in row-major order. Its candidates are the
 * values 1..9 not already present in the cell's row, column or block, tried in ascending order.
 * There are no further heuristics.
 * <p>
 * A grid whose givens already repeat a value has no completions. A full grid counts as one
 * completion if and only if it is valid.
 */
public class SudokuSolver {
    private static final Logger logger = LoggerFactory.getLogger(SudokuSolver.class);

    /**
     * Default solution limit, configurable via the arraykit.sudoku.solution_limit system property
     */
    private static final long DEFAULT_SOLUTION_LIMIT = Long.getLong("arraykit.sudoku.solution_limit", Long.MAX_VALUE);

    private final long solutionLimit;

    /**
     * Creates a solver using the configured default solution limit (unlimited unless the
     * {@code arraykit.sudoku.solution_limit} system property is set).
     */
    public SudokuSolver() {
        this(DEFAULT_SOLUTION_LIMIT);
    }

    /**
     * @param solutionLimit stop searching once this many completions have been found
     */
    public SudokuSolver(long solutionLimit) {
        if (solutionLimit < 1) {
            throw new IllegalArgumentException("solutionLimit must be positive, got " + solutionLimit);
        }
        this.solutionLimit = solutionLimit;
    }

    public long getSolutionLimit() {
        return solutionLimit;
    }

    /**
     * Counts the completions of {@code puzzle} and remembers the first one found.
     *
     * @param puzzle the grid to solve
     * @return the result of the search
     */
    public SolveResult solve(Grid puzzle) {
        if (GridValidator.hasConflicts(puzzle)) {
            logger.debug("Givens conflict; no completions");
            return SolveResult.none();
        }
        var search = new Search(puzzle.toArray());
        long start = System.nanoTime();
        search.descend();
        if (logger.isDebugEnabled()) {
            logger.debug("Found {} completion(s){} after visiting {} nodes in {}ms",
                         search.count, search.truncated ? " (limit reached)" : "", search.visited,
                         (System.nanoTime() - start) / 1_000_000);
        }
        return new SolveResult(search.count, search.first, search.truncated);
    }

    /**
     * Returns the values that may be placed at {@code (row, col)}: 1..9 minus every value in the
     * same row, column or block, in ascending order.
     */
    @VisibleForTesting
    static DynamicArray<Integer> candidates(int[][] cells, int row, int col) {
        boolean[] used = new boolean[SIZE + 1];
        for (int i = 0; i < SIZE; i++) {
            used[cells[row][i]] = true;
            used[cells[i][col]] = true;
        }
        int blockRow = row - row % BLOCK;
        int blockCol = col - col % BLOCK;
        for (int r = blockRow; r < blockRow + BLOCK; r++) {
            for (int c = blockCol; c < blockCol + BLOCK; c++) {
                used[cells[r][c]] = true;
            }
        }

        var result = new DynamicArray<Integer>();
        for (int v = 1; v <= SIZE; v++) {
            if (!used[v]) {
                result.pushBack(v);
            }
        }
        return result;
    }

    /** State of one search; the cell array is filled and restored in place. */
    private final class Search {
        private final int[][] cells;
        private long count;
        private long visited;
        private Grid first;
        private boolean truncated;

        Search(int[][] cells) {
            this.cells = cells;
        }

        /**
         * @return false once the solution limit has been reached
         */
        boolean descend() {
            visited++;
            int empty = firstEmptyCell();
            if (empty < 0) {
                if (first == null) {
                    first = Grid.of(cells);
                }
                if (++count >= solutionLimit) {
                    truncated = true;
                    return false;
                }
                return true;
            }

            int row = empty / SIZE;
            int col = empty % SIZE;
            for (int value : candidates(cells, row, col)) {
                cells[row][col] = value;
                boolean keepGoing = descend();
                cells[row][col] = EMPTY;
                if (!keepGoing) {
                    return false;
                }
            }
            return true;
        }

        // row-major index of the first empty cell, or -1
        private int firstEmptyCell() {
            for (int row = 0; row < SIZE; row++) {
                for (int col = 0; col < SIZE; col++) {
                    if (cells[row][col] == EMPTY) {
                        return row * SIZE + col;
                    }
                }
            }
            return -1;
        }
    }
}
