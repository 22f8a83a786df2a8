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

package io.github.arraykit.array;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Supplier;

/**
 * One mutation applied both to a {@link DynamicArray} and to an {@link ArrayList} reference model.
 */
abstract class ArrayAction<T> {
    abstract void apply(List<T> expected, Supplier<T> defaultValue);

    abstract void apply(DynamicArray<T> actual);

    static <T> ArrayAction<T> clear() {
        return new ArrayAction<>() {
            @Override
            void apply(List<T> expected, Supplier<T> defaultValue) { expected.clear(); }
            @Override
            void apply(DynamicArray<T> actual) { actual.clear(); }
            @Override
            public String toString() { return "Clear"; }
        };
    }

    static <T> ArrayAction<T> insert(int pos, T value) {
        return new ArrayAction<>() {
            @Override
            void apply(List<T> expected, Supplier<T> defaultValue) { expected.add(pos, value); }
            @Override
            void apply(DynamicArray<T> actual) { actual.insert(pos, value); }
            @Override
            public String toString() { return "Insert value before position: " + pos + "  val: " + value; }
        };
    }

    static <T> ArrayAction<T> insert(int pos, int count, T value) {
        return new ArrayAction<>() {
            @Override
            void apply(List<T> expected, Supplier<T> defaultValue) {
                expected.addAll(pos, Collections.nCopies(count, value));
            }
            @Override
            void apply(DynamicArray<T> actual) { actual.insert(pos, count, value); }
            @Override
            public String toString() { return "Insert range before position: " + pos + "  count: " + count + "  val: " + value; }
        };
    }

    static <T> ArrayAction<T> erase(int pos) {
        return new ArrayAction<>() {
            @Override
            void apply(List<T> expected, Supplier<T> defaultValue) { expected.remove(pos); }
            @Override
            void apply(DynamicArray<T> actual) { actual.erase(pos); }
            @Override
            public String toString() { return "Erase value on position: " + pos; }
        };
    }

    static <T> ArrayAction<T> erase(int first, int last) {
        return new ArrayAction<>() {
            @Override
            void apply(List<T> expected, Supplier<T> defaultValue) { expected.subList(first, last).clear(); }
            @Override
            void apply(DynamicArray<T> actual) { actual.erase(first, last); }
            @Override
            public String toString() { return "Erase values in range: [" + first + ", " + last + ")"; }
        };
    }

    static <T> ArrayAction<T> pushBack(T value) {
        return new ArrayAction<>() {
            @Override
            void apply(List<T> expected, Supplier<T> defaultValue) { expected.add(value); }
            @Override
            void apply(DynamicArray<T> actual) { actual.pushBack(value); }
            @Override
            public String toString() { return "Push back value: " + value; }
        };
    }

    static <T> ArrayAction<T> popBack() {
        return new ArrayAction<>() {
            @Override
            void apply(List<T> expected, Supplier<T> defaultValue) { expected.remove(expected.size() - 1); }
            @Override
            void apply(DynamicArray<T> actual) { actual.popBack(); }
            @Override
            public String toString() { return "Pop back value"; }
        };
    }

    static <T> ArrayAction<T> resize(int n) {
        return new ArrayAction<>() {
            @Override
            void apply(List<T> expected, Supplier<T> defaultValue) {
                resizeList(expected, n, defaultValue);
            }
            @Override
            void apply(DynamicArray<T> actual) { actual.resize(n); }
            @Override
            public String toString() { return "Resize to size: " + n + " with default value"; }
        };
    }

    static <T> ArrayAction<T> resize(int n, T value) {
        return new ArrayAction<>() {
            @Override
            void apply(List<T> expected, Supplier<T> defaultValue) {
                resizeList(expected, n, () -> value);
            }
            @Override
            void apply(DynamicArray<T> actual) { actual.resize(n, value); }
            @Override
            public String toString() { return "Resize to size: " + n + " with value: " + value; }
        };
    }

    private static <T> void resizeList(List<T> list, int n, Supplier<T> fill) {
        if (n < list.size()) {
            list.subList(n, list.size()).clear();
        }
        while (list.size() < n) {
            list.add(fill.get());
        }
    }
}
