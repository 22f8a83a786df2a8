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

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads {@link Grid}s from files or streams in the text format accepted by {@link Grid#parse}.
 */
public final class GridReader {
    /** Path name that stands for standard input. */
    public static final String STDIN = "-";

    private final InputStream stdin;

    public GridReader() {
        this(System.in);
    }

    GridReader(InputStream stdin) {
        this.stdin = stdin;
    }

    /**
     * Reads a grid from {@code location}, or from standard input when it is {@value #STDIN}.
     *
     * @param location a file path or {@value #STDIN}
     * @return the parsed grid
     * @throws IOException if the input cannot be read
     * @throws IllegalArgumentException if the text is not a valid grid
     */
    public Grid read(String location) throws IOException {
        if (STDIN.equals(location)) {
            return read(stdin);
        }
        return Grid.parse(Files.readString(Path.of(location), StandardCharsets.UTF_8));
    }

    /**
     * Reads all of {@code in} and parses it as a grid. The stream is not closed.
     *
     * @param in the input
     * @return the parsed grid
     * @throws IOException if the input cannot be read
     */
    public static Grid read(InputStream in) throws IOException {
        return Grid.parse(new String(in.readAllBytes(), StandardCharsets.UTF_8));
    }

    /**
     * Loads a grid bundled as a classpath resource.
     *
     * @param name the resource name
     * @return the parsed grid
     */
    public static Grid resource(String name) {
        try (var in = GridReader.class.getResourceAsStream(name)) {
            if (in == null) {
                throw new IllegalArgumentException("No such resource: " + name);
            }
            return read(in);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
