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

package io.github.arraykit.example;

import io.github.arraykit.sudoku.Grid;
import io.github.arraykit.sudoku.GridValidator;
import io.github.arraykit.sudoku.SolveResult;
import io.github.arraykit.sudoku.SudokuSolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.concurrent.Callable;

/**
 * Command-line front end for the Sudoku solver and validator.
 *
 * <h2>Usage Examples</h2>
 * <pre>
 * # Count completions and print the first one
 * java -jar arraykit-examples.jar puzzle.txt
 *
 * # Stop after two completions (is the puzzle unique?)
 * java -jar arraykit-examples.jar --limit 2 puzzle.txt
 *
 * # Check a proposed solution, reading the puzzle from stdin
 * java -jar arraykit-examples.jar --check solution.txt - &lt; puzzle.txt
 * </pre>
 *
 * Exit codes: 0 when the puzzle is solvable or the solution is valid, 1 when it is not, 2 when an
 * input cannot be read or parsed.
 */
@CommandLine.Command(
        name = "sudoku",
        mixinStandardHelpOptions = true,
        version = "1.0",
        description = "Count the completions of a 9x9 Sudoku grid, or check a proposed solution"
)
public class SudokuCommand implements Callable<Integer> {
    private static final Logger logger = LoggerFactory.getLogger(SudokuCommand.class);

    static final int EXIT_NO_SOLUTION = 1;
    static final int EXIT_BAD_INPUT = 2;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(
            index = "0",
            description = "Puzzle file: 81 digits, 0 or . for empty cells; '-' reads standard input"
    )
    private String puzzle;

    @CommandLine.Option(
            names = {"-c", "--check"},
            description = "Validate this solution file against the puzzle instead of solving it"
    )
    private String solution;

    @CommandLine.Option(
            names = {"-l", "--limit"},
            description = "Stop after this many completions (default: arraykit.sudoku.solution_limit, or unlimited)"
    )
    private Long limit;

    private final GridReader reader;

    public SudokuCommand() {
        this(new GridReader());
    }

    SudokuCommand(GridReader reader) {
        this.reader = reader;
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        if (limit != null && limit < 1) {
            return badInput("--limit must be positive, got " + limit);
        }

        Grid puzzleGrid;
        Grid solutionGrid = null;
        try {
            puzzleGrid = reader.read(puzzle);
            if (solution != null) {
                solutionGrid = reader.read(solution);
            }
        } catch (IOException | IllegalArgumentException e) {
            logger.warn("Cannot load grid: {}", e.getMessage());
            return badInput(e.getMessage());
        }

        if (solutionGrid != null) {
            boolean valid = GridValidator.check(puzzleGrid, solutionGrid);
            out.println(valid ? "valid" : "invalid");
            return valid ? 0 : EXIT_NO_SOLUTION;
        }

        SudokuSolver solver = limit == null ? new SudokuSolver() : new SudokuSolver(limit);
        SolveResult result = solver.solve(puzzleGrid);
        out.println("solutions: " + result.count() + (result.isTruncated() ? " (limit reached)" : ""));
        result.firstSolution().ifPresent(grid -> out.print(grid));
        out.flush();
        return result.count() > 0 ? 0 : EXIT_NO_SOLUTION;
    }

    private int badInput(String message) {
        spec.commandLine().getErr().println("error: " + message);
        return EXIT_BAD_INPUT;
    }

    /**
     * Main entry point for command-line execution.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = new CommandLine(new SudokuCommand()).execute(args);
        System.exit(exitCode);
    }
}
