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

import java.util.Optional;

/**
 * Outcome of {@link SudokuSolver#solve(Grid)}: how many completions were found, and the first one.
 */
public final class SolveResult {
    private final long count;
    private final Grid firstSolution;
    private final boolean truncated;

    SolveResult(long count, Grid firstSolution, boolean truncated) {
        assert (count == 0) == (firstSolution == null);
        this.count = count;
        this.firstSolution = firstSolution;
        this.truncated = truncated;
    }

    static SolveResult none() {
        return new SolveResult(0, null, false);
    }

    /**
     * @return the number of completions found; a lower bound when {@link #isTruncated()}
     */
    public long count() {
        return count;
    }

    /**
     * @return the first completion in search order, if any
     */
    public Optional<Grid> firstSolution() {
        return Optional.ofNullable(firstSolution);
    }

    /**
     * @return true if the search stopped on reaching the solution limit, so more completions may exist
     */
    public boolean isTruncated() {
        return truncated;
    }

    public boolean isUnique() {
        return count == 1 && !truncated;
    }

    @Override
    public String toString() {
        return "SolveResult(count=" + count + (truncated ? "+" : "") + ")";
    }
}
