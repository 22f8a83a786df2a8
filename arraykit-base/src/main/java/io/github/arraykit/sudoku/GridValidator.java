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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static io.github.arraykit.sudoku.Grid.BLOCK;
import static io.github.arraykit.sudoku.Grid.EMPTY;
import static io.github.arraykit.sudoku.Grid.SIZE;

/**
 * Checks Sudoku grids against the row, column and block constraints.
 */
public final class GridValidator {
    private static final Logger logger = LoggerFactory.getLogger(GridValidator.class);

    private GridValidator() {
    }

    /**
     * Verifies that {@code solution} is a valid completion of {@code original}: every cell holds
     * 1..9, every given of {@code original} is preserved, and no row, column or block repeats a value.
     *
     * @param original the puzzle
     * @param solution the candidate completion
     * @return true iff the solution is valid for the puzzle
     */
    public static boolean check(Grid original, Grid solution) {
        for (int row = 0; row < SIZE; row++) {
            for (int col = 0; col < SIZE; col++) {
                int v = solution.get(row, col);
                if (v < 1 || v > SIZE) {
                    logger.debug("Cell ({},{}) holds {}, outside 1..{}", row, col, v, SIZE);
                    return false;
                }
                int given = original.get(row, col);
                if (given != EMPTY && given != v) {
                    logger.debug("Cell ({},{}) changed given {} to {}", row, col, given, v);
                    return false;
                }
            }
        }
        return !hasConflicts(solution);
    }

    /**
     * Reports whether any row, column or block contains the same non-empty value twice. Empty
     * cells are ignored, so this applies to partial grids as well.
     *
     * @param grid the grid to inspect
     * @return true iff some unit repeats a value
     */
    public static boolean hasConflicts(Grid grid) {
        for (int i = 0; i < SIZE; i++) {
            int rowSeen = 0;
            int colSeen = 0;
            int blockSeen = 0;
            int blockRow = (i / BLOCK) * BLOCK;
            int blockCol = (i % BLOCK) * BLOCK;
            for (int j = 0; j < SIZE; j++) {
                rowSeen = mark(rowSeen, grid.get(i, j));
                colSeen = mark(colSeen, grid.get(j, i));
                blockSeen = mark(blockSeen, grid.get(blockRow + j / BLOCK, blockCol + j % BLOCK));
                if (rowSeen < 0 || colSeen < 0 || blockSeen < 0) {
                    logger.debug("Duplicate value in row, column or block {}", i);
                    return true;
                }
            }
        }
        return false;
    }

    // sets the bit for value, or returns -1 if it was already set
    private static int mark(int seen, int value) {
        if (seen < 0 || value == EMPTY) {
            return seen;
        }
        int bit = 1 << value;
        return (seen & bit) != 0 ? -1 : seen | bit;
    }
}
