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
 * Low-level helpers shared by the ArrayKit containers.
 *
 * <p>{@link io.github.arraykit.util.MathUtil} holds the power-of-two arithmetic that every
 * growth path of {@link io.github.arraykit.array.DynamicArray} goes through, so that
 * {@code pushBack}, {@code insert}, {@code resize} and {@code reserve} can never disagree on
 * the capacity they land on.
 */
package io.github.arraykit.util;
