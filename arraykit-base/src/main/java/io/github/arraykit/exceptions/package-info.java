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
 * Provides custom exception types used throughout ArrayKit.
 * <p>
 * Contract violations such as an out-of-range {@code erase} position are reported with the
 * standard JDK exceptions ({@link java.lang.IndexOutOfBoundsException},
 * {@link java.util.NoSuchElementException}, {@link java.lang.IllegalArgumentException}).
 * This package only holds the conditions the JDK has no type for.
 *
 * <h2>Exception Types</h2>
 * <ul>
 *   <li>{@link io.github.arraykit.exceptions.CapacityExceededException} - An unchecked
 *       exception thrown when growth would need more than
 *       {@link io.github.arraykit.array.DynamicArray#MAX_CAPACITY} slots. It is raised before
 *       any state changes, so the container remains exactly as it was before the call.</li>
 * </ul>
 *
 * <h2>Exception Handling Example</h2>
 * <pre>{@code
 * try {
 *     array.insert(0, count, value);
 * } catch (CapacityExceededException e) {
 *     // array still holds its previous contents
 *     logger.warn("Could not insert {} elements", count, e);
 * }
 * }</pre>
 */
package io.github.arraykit.exceptions;
