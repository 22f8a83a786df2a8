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

/**
 * A brute-force Sudoku solver and validator.
 *
 * <p>{@link io.github.arraykit.sudoku.Grid} is an immutable 9x9 board,
 * {@link io.github.arraykit.sudoku.GridValidator} checks a proposed solution against its puzzle,
 * and {@link io.github.arraykit.sudoku.SudokuSolver} counts completions by backtracking over
 * candidate lists held in {@link io.github.arraykit.array.DynamicArray}s.
 *
 * <pre>{@code
 * Grid puzzle = Grid.parse(text);
 * SolveResult result = new SudokuSolver().solve(puzzle);
 * result.firstSolution().ifPresent(s -> System.out.println(GridValidator.check(puzzle, s)));
 * }</pre>
 */
package io.github.arraykit.sudoku;
