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

import com.carrotsearch.randomizedtesting.RandomizedTest;
import io.github.arraykit.util.MathUtil;
import org.junit.Test;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.Supplier;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

/**
 * Replays sequences of mutations against both a DynamicArray and an ArrayList, checking contents
 * and the capacity laws after every step.
 */
public class TestDynamicArrayOperations extends RandomizedTest {
    private static final int MAX_SIZE = 20_000;
    private static final int HISTORY = 16;

    private static <T> void replay(List<ArrayAction<T>> actions, Supplier<T> defaultValue) {
        List<T> expected = new ArrayList<>();
        DynamicArray<T> actual = new DynamicArray<>(defaultValue);
        Deque<String> history = new ArrayDeque<>();
        history.add("Init by default constructor");
        verify(expected, actual, history);

        for (ArrayAction<T> action : actions) {
            int capacityBefore = actual.capacity();
            action.apply(expected, defaultValue);
            action.apply(actual);

            history.addLast(action.toString());
            if (history.size() > HISTORY) {
                history.removeFirst();
            }
            verify(expected, actual, history);
            verifyCapacityChange(capacityBefore, actual, history);
        }
    }

    private static <T> void verify(List<T> expected, DynamicArray<T> actual, Deque<String> history) {
        assertEquals(describe("Different sizes", history), expected.size(), actual.size());
        assertEquals(describe("Different empty status", history), expected.isEmpty(), actual.isEmpty());
        int capacity = actual.capacity();
        assertTrue(describe("Capacity " + capacity + " is not a power of two", history),
                   capacity == 0 || MathUtil.isPowerOfTwo(capacity));
        assertTrue(describe("Size exceeds capacity", history), actual.size() <= capacity);

        ArrayView<T> data = actual.data();
        if (capacity == 0) {
            assertNull(describe("Buffer without capacity", history), data);
        } else {
            assertNotNull(describe("Capacity without buffer", history), data);
            assertEquals(describe("View length", history), actual.size(), data.length());
        }

        if (!expected.isEmpty()) {
            assertEquals(describe("Different front values", history), expected.get(0), actual.front());
            assertEquals(describe("Different back values", history), expected.get(expected.size() - 1), actual.back());
        }
        for (int i = 0; i < expected.size(); i++) {
            T value = expected.get(i);
            if (!value.equals(actual.get(i)) || !value.equals(actual.at(i)) || !value.equals(data.get(i))) {
                fail(describe("Different values on position " + i + ": expected " + value + " but was " + actual.get(i), history));
            }
        }
    }

    private static void verifyCapacityChange(int before, DynamicArray<?> actual, Deque<String> history) {
        int after = actual.capacity();
        if (history.getLast().equals("Clear")) {
            assertEquals(describe("Clear keeps a buffer", history), 0, after);
        } else if (actual.size() > before) {
            assertEquals(describe("Growth did not land on the next power of two", history),
                         MathUtil.nextPowerOfTwo(actual.size()), after);
        } else {
            assertEquals(describe("Capacity changed without growth", history), before, after);
        }
    }

    private static String describe(String error, Deque<String> history) {
        return error + "\n  after: " + String.join("\n         ", history);
    }

    private String randomString(int minLength, int maxLength) {
        int length = randomIntBetween(minLength, maxLength);
        var sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            sb.append((char) randomIntBetween('a', 'z'));
        }
        return sb.toString();
    }

    @Test
    public void testResizeExtend() {
        replay(List.of(ArrayAction.pushBack("a"),
                       ArrayAction.pushBack("b"),
                       ArrayAction.pushBack("c"),
                       ArrayAction.resize(4, "e"),
                       ArrayAction.resize(20)),
               () -> "");

        replay(List.of(ArrayAction.resize(10, 20),
                       ArrayAction.resize(100)),
               () -> 0);
    }

    @Test
    public void testResizeNarrow() {
        replay(List.of(ArrayAction.insert(0, 100, "abacaba"),
                       ArrayAction.resize(70),
                       ArrayAction.resize(10, "a"),
                       ArrayAction.resize(0)),
               () -> "");

        replay(List.of(ArrayAction.insert(0, 100, 12),
                       ArrayAction.resize(70),
                       ArrayAction.resize(10, 22),
                       ArrayAction.resize(0)),
               () -> 0);
    }

    private <T> void mixedResize(int count, Supplier<T> values, Supplier<T> defaultValue) {
        List<ArrayAction<T>> actions = new ArrayList<>();
        int size = 0;
        for (; count > 0; count--) {
            boolean extend = size == 0 || (randomBoolean() && size * 2 <= MAX_SIZE);
            if (extend) {
                size = randomBoolean() ? size * 2 : randomIntBetween(size, 2 * size);
            } else {
                size = randomBoolean() ? size / 2 : randomIntBetween(0, size);
            }
            actions.add(randomBoolean() ? ArrayAction.resize(size) : ArrayAction.resize(size, values.get()));
        }
        replay(actions, defaultValue);
    }

    @Test
    public void testResizeMixed() {
        mixedResize(1000, () -> randomString(0, 5), () -> "");
        mixedResize(1000, () -> randomIntBetween(-100, 100), () -> 0);
    }

    @Test
    public void testInsertSimple() {
        replay(List.of(ArrayAction.insert(0, 10, "abacaba"), // 10
                       ArrayAction.insert(0, "a"),           // 11
                       ArrayAction.insert(11, "b"),          // 12
                       ArrayAction.insert(12, "c"),          // 13
                       ArrayAction.insert(13, 100, "d"),     // 113
                       ArrayAction.insert(0, 10, "e")),      // 123
               () -> "");
    }

    private <T> void randomInserts(int count, Supplier<T> values, Supplier<T> defaultValue) {
        List<ArrayAction<T>> actions = new ArrayList<>();
        int size = 0;
        for (int i = 0; i < count; i++) {
            int before = randomIntBetween(0, size);
            if (randomBoolean()) {
                int n = randomIntBetween(0, 10);
                actions.add(ArrayAction.insert(before, n, values.get()));
                size += n;
            } else {
                actions.add(ArrayAction.insert(before, values.get()));
                size++;
            }
        }
        replay(actions, defaultValue);
    }

    @Test
    public void testInsertRandom() {
        randomInserts(1000, () -> randomString(0, 5), () -> "");
        randomInserts(1000, () -> getRandom().nextInt(), () -> 0);
    }

    @Test
    public void testEraseSimple() {
        List<ArrayAction<Integer>> actions = new ArrayList<>();
        for (int i = 0; i < 100; i++) {
            actions.add(ArrayAction.pushBack(i));
        }
        // 100
        actions.addAll(List.of(ArrayAction.erase(0),      // 99
                               ArrayAction.erase(98),     // 98
                               ArrayAction.erase(50),     // 97
                               ArrayAction.erase(0, 0),   // 97
                               ArrayAction.erase(97, 97), // 97
                               ArrayAction.erase(50, 50), // 97
                               ArrayAction.erase(96, 97), // 96
                               ArrayAction.erase(0, 1),   // 95
                               ArrayAction.erase(0, 10),  // 85
                               ArrayAction.erase(75, 85), // 75
                               ArrayAction.erase(30, 40), // 65
                               ArrayAction.erase(0, 65)));// 0
        replay(actions, () -> 0);
    }

    private <T> void randomErases(int count, T value, Supplier<T> defaultValue) {
        List<ArrayAction<T>> actions = new ArrayList<>();
        actions.add(ArrayAction.insert(0, MAX_SIZE, value));
        int size = MAX_SIZE;
        for (int i = 0; i < count && size > 0; i++) {
            if (randomBoolean()) {
                int first = randomIntBetween(0, size);
                int last = randomIntBetween(first, size);
                actions.add(ArrayAction.erase(first, last));
                size -= last - first;
            } else {
                actions.add(ArrayAction.erase(randomIntBetween(0, size - 1)));
                size--;
            }
        }
        replay(actions, defaultValue);
    }

    @Test
    public void testEraseRandom() {
        randomErases(1000, "abacaba", () -> "");
        randomErases(1000, 12, () -> 0);
    }

    private <T> void randomChanges(int count, Supplier<T> values, Supplier<T> defaultValue) {
        List<ArrayAction<T>> actions = new ArrayList<>();
        int size = 0;
        for (int i = 0; i < count; i++) {
            boolean expand = size == 0 || randomBoolean();
            int kind = randomIntBetween(0, 3);
            if (expand) {
                int before = randomIntBetween(0, size);
                int n = randomIntBetween(0, 20);
                switch (kind) {
                    case 0:
                        actions.add(ArrayAction.pushBack(values.get()));
                        size++;
                        break;
                    case 1:
                        actions.add(ArrayAction.insert(before, n, values.get()));
                        size += n;
                        break;
                    case 2:
                        actions.add(ArrayAction.insert(before, values.get()));
                        size++;
                        break;
                    default:
                        actions.add(ArrayAction.resize(size + n, values.get()));
                        size += n;
                        break;
                }
            } else {
                if (getRandom().nextDouble() < 0.02) {
                    actions.add(ArrayAction.clear());
                    size = 0;
                    continue;
                }
                int first = randomIntBetween(0, size);
                int last = first + randomIntBetween(0, Math.min(10, size - first));
                switch (kind) {
                    case 0:
                        actions.add(ArrayAction.popBack());
                        size--;
                        break;
                    case 1:
                        actions.add(ArrayAction.erase(randomIntBetween(0, size - 1)));
                        size--;
                        break;
                    case 2:
                        actions.add(ArrayAction.erase(first, last));
                        size -= last - first;
                        break;
                    default:
                        actions.add(ArrayAction.resize(size + first - last));
                        size -= last - first;
                        break;
                }
            }
        }
        replay(actions, defaultValue);
    }

    @Test
    public void testChangesMixed() {
        randomChanges(20_000, () -> getRandom().nextInt(), () -> 0);
        randomChanges(10_000, () -> randomString(0, 10), () -> "");
    }
}
