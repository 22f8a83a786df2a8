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
 * A growable array container with a power-of-two capacity policy.
 *
 * <p>{@link io.github.arraykit.array.DynamicArray} is the ArrayKit counterpart of a standard
 * growable array: one contiguous buffer, a logical size, and a physical capacity that is always
 * zero or a power of two. The rules it keeps after every public operation:
 *
 * <ul>
 *   <li>capacity is zero exactly when no buffer is allocated, and otherwise a power of two;
 *   <li>{@code size <= capacity};
 *   <li>growth lands on the smallest power of two that holds the new size, never on a fixed
 *       multiple of the old capacity;
 *   <li>only {@code shrinkToFit} and {@code clear} reduce capacity;
 *   <li>copies are narrowing and never share a buffer with their source.
 * </ul>
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * DynamicArray<String> words = new DynamicArray<>(10, "abacaba"); // size 10, capacity 16
 * words.erase(6, 10);                                             // size 6, capacity 16
 * DynamicArray<String> copy = words.copy();                       // size 6, capacity 8
 * copy.pushBack("x");
 * assert !copy.equals(words);
 * }</pre>
 *
 * <p>{@link io.github.arraykit.array.ArrayView}, returned by {@code data()}, is a raw window
 * onto the current buffer. It is invalidated by any capacity change.
 */
package io.github.arraykit.array;
