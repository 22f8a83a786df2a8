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

import io.github.arraykit.annotations.VisibleForTesting;
import io.github.arraykit.exceptions.CapacityExceededException;
import io.github.arraykit.util.MathUtil;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * A resizable, contiguous sequence of elements that owns its backing buffer and keeps the
 * buffer length at zero or an exact power of two.
 * <p>
 * The capacity policy is strict and shared by every growth path: whenever an operation needs
 * more slots than are allocated, the buffer is replaced by one whose length is the smallest
 * power of two that holds the new size. Capacity never shrinks as a side effect of
 * {@link #popBack()}, {@link #erase(int)} or a shrinking {@link #resize(int)}; only
 * {@link #shrinkToFit()} and {@link #clear()} give memory back. A container with capacity zero
 * holds no buffer at all.
 * <p>
 * Copies are always deep and narrowing: a copy allocates just enough power-of-two capacity for
 * the source's live elements and never shares a buffer with it. Elements themselves are copied
 * by reference, as with {@link Arrays#fill(Object[], Object)}.
 * <p>
 * Growth allocates the new buffer before touching any field, so a failed allocation
 * ({@link OutOfMemoryError} or {@link CapacityExceededException}) leaves the array exactly as it
 * was. Precondition failures are detected before any mutation for the same reason.
 * <p>
 * This class is not thread-safe. Callers that share an instance across threads must serialize
 * access themselves.
 *
 * @param <T> the element type
 */
public final class DynamicArray<T> implements Iterable<T> {
    /** The largest capacity any DynamicArray can reach. */
    public static final int MAX_CAPACITY = MathUtil.MAX_POWER_OF_TWO;

    private final Supplier<? extends T> defaultValue;

    // null iff capacity is zero
    private Object[] buffer;
    private int size;

    /**
     * Creates an empty array with no buffer. {@link #resize(int)} fills new slots with null.
     */
    public DynamicArray() {
        this(() -> null);
    }

    /**
     * Creates an empty array with no buffer.
     *
     * @param defaultValue supplies the value of every slot added by {@link #resize(int)}
     */
    public DynamicArray(Supplier<? extends T> defaultValue) {
        this.defaultValue = Objects.requireNonNull(defaultValue, "defaultValue");
    }

    /**
     * Creates an array holding {@code count} references to {@code value}, with capacity equal to
     * the smallest power of two {@code >= count}. A count of zero behaves like {@link #DynamicArray()}.
     *
     * @param count number of elements
     * @param value the value of every element
     */
    public DynamicArray(int count, T value) {
        this();
        checkCount(count, "count");
        if (count > 0) {
            buffer = new Object[capacityFor(count)];
            Arrays.fill(buffer, 0, count, value);
            size = count;
        }
    }

    /**
     * Creates a deep copy of the live elements of {@code other}. The copy's capacity is the smallest
     * power of two that holds {@code other.size()}, whatever the capacity of {@code other}.
     *
     * @param other the array to copy
     */
    public DynamicArray(DynamicArray<? extends T> other) {
        this.defaultValue = other.defaultValue;
        if (other.size > 0) {
            buffer = new Object[capacityFor(other.size)];
            System.arraycopy(other.buffer, 0, buffer, 0, other.size);
            size = other.size;
        }
    }

    /**
     * @return a narrowing deep copy of this array
     * @see #DynamicArray(DynamicArray)
     */
    public DynamicArray<T> copy() {
        return new DynamicArray<>(this);
    }

    /**
     * Replaces the contents of this array with a narrowing copy of {@code other}, releasing the
     * buffer this array held. The copy is built completely before it is swapped in, so assigning
     * an array to itself is a no-op and a failed copy leaves this array unchanged.
     *
     * @param other the array whose contents to adopt
     */
    public void assign(DynamicArray<? extends T> other) {
        if (other == this) {
            return;
        }
        DynamicArray<T> tmp = new DynamicArray<>(other);
        swap(tmp);
    }

    /**
     * Exchanges size, capacity and buffer ownership with {@code other} in constant time. No
     * elements are copied. Each array keeps its own default-value supplier.
     *
     * @param other the array to swap with
     */
    public void swap(DynamicArray<T> other) {
        Object[] otherBuffer = other.buffer;
        int otherSize = other.size;
        other.buffer = buffer;
        other.size = size;
        buffer = otherBuffer;
        size = otherSize;
    }

    /**
     * Returns the element at {@code index} without a bounds check against {@link #size()}.
     * <p>
     * Indices in {@code [0, size)} are the caller's responsibility, as with a raw array. Bounds are
     * only verified when assertions are enabled.
     *
     * @param index the element index
     * @return the element
     */
    @SuppressWarnings("unchecked")
    public T get(int index) {
        assert index >= 0 && index < size : "index=" + index + " size=" + size;
        return (T) buffer[index];
    }

    /**
     * Replaces the element at {@code index} without a bounds check against {@link #size()}.
     *
     * @param index the element index
     * @param value the new value
     * @see #get(int)
     */
    public void set(int index, T value) {
        assert index >= 0 && index < size : "index=" + index + " size=" + size;
        buffer[index] = value;
    }

    /**
     * Returns the element at {@code index}.
     *
     * @param index the element index
     * @return the element
     * @throws IndexOutOfBoundsException if {@code index} is not in {@code [0, size)}
     */
    @SuppressWarnings("unchecked")
    public T at(int index) {
        Objects.checkIndex(index, size);
        return (T) buffer[index];
    }

    /**
     * Replaces the element at {@code index}.
     *
     * @param index the element index
     * @param value the new value
     * @throws IndexOutOfBoundsException if {@code index} is not in {@code [0, size)}
     */
    public void setAt(int index, T value) {
        Objects.checkIndex(index, size);
        buffer[index] = value;
    }

    /**
     * @return the first element
     * @throws NoSuchElementException if the array is empty
     */
    @SuppressWarnings("unchecked")
    public T front() {
        if (size == 0) {
            throw new NoSuchElementException("front() on an empty array");
        }
        return (T) buffer[0];
    }

    /**
     * @return the last element
     * @throws NoSuchElementException if the array is empty
     */
    @SuppressWarnings("unchecked")
    public T back() {
        if (size == 0) {
            throw new NoSuchElementException("back() on an empty array");
        }
        return (T) buffer[size - 1];
    }

    /**
     * Returns a read/write window over the live elements of the current buffer, or null if no
     * buffer is allocated.
     * <p>
     * The view is bound to the buffer that exists when it is created. Any operation that changes
     * the capacity (growth, {@link #shrinkToFit()}, {@link #clear()}, {@link #assign}, {@link #swap})
     * detaches it from this array; reading or writing a detached view is a caller error.
     *
     * @return a view over {@code [0, size)}, or null when {@code capacity() == 0}
     */
    public ArrayView<T> data() {
        return buffer == null ? null : new ArrayView<>(buffer, size);
    }

    /**
     * @return true iff the array holds no elements
     */
    public boolean isEmpty() {
        return size == 0;
    }

    /**
     * @return the number of live elements
     */
    public int size() {
        return size;
    }

    /**
     * @return the number of allocated slots; always zero or a power of two
     */
    public int capacity() {
        return buffer == null ? 0 : buffer.length;
    }

    /**
     * Appends {@code value}, growing to the next power of two if the buffer is full.
     *
     * @param value the value to append
     */
    public void pushBack(T value) {
        if (size == capacity()) {
            reallocate(capacityFor((long) size + 1));
        }
        buffer[size++] = value;
    }

    /**
     * Removes the last element. Capacity is unchanged.
     *
     * @throws NoSuchElementException if the array is empty
     */
    public void popBack() {
        if (size == 0) {
            throw new NoSuchElementException("popBack() on an empty array");
        }
        buffer[--size] = null;
    }

    /**
     * Inserts {@code value} before position {@code pos}, shifting later elements right by one.
     *
     * @param pos insertion position in {@code [0, size]}
     * @param value the value to insert
     * @throws IndexOutOfBoundsException if {@code pos} is not in {@code [0, size]}
     */
    public void insert(int pos, T value) {
        insert(pos, 1, value);
    }

    /**
     * Inserts {@code count} references to {@code value} before position {@code pos}, shifting
     * later elements right by {@code count}.
     *
     * @param pos insertion position in {@code [0, size]}
     * @param count number of elements to insert
     * @param value the value to insert
     * @throws IndexOutOfBoundsException if {@code pos} is not in {@code [0, size]}
     * @throws IllegalArgumentException if {@code count} is negative
     */
    public void insert(int pos, int count, T value) {
        Objects.checkIndex(pos, size + 1);
        checkCount(count, "count");
        if (count == 0) {
            return;
        }
        long newSize = (long) size + count;
        if (newSize > capacity()) {
            // grow and open the gap in a single pass
            Object[] grown = new Object[capacityFor(newSize)];
            if (buffer != null) {
                System.arraycopy(buffer, 0, grown, 0, pos);
                System.arraycopy(buffer, pos, grown, pos + count, size - pos);
            }
            buffer = grown;
        } else {
            System.arraycopy(buffer, pos, buffer, pos + count, size - pos);
        }
        Arrays.fill(buffer, pos, pos + count, value);
        size = (int) newSize;
    }

    /**
     * Removes the element at {@code pos}, shifting later elements left by one. Capacity is unchanged.
     *
     * @param pos position in {@code [0, size)}
     * @throws IndexOutOfBoundsException if {@code pos} is not in {@code [0, size)}
     */
    public void erase(int pos) {
        Objects.checkIndex(pos, size);
        erase(pos, pos + 1);
    }

    /**
     * Removes the elements in {@code [first, last)}, shifting later elements left. Capacity is
     * unchanged. An empty range is a no-op.
     *
     * @param first first position to remove
     * @param last one past the last position to remove
     * @throws IndexOutOfBoundsException unless {@code 0 <= first <= last <= size}
     */
    public void erase(int first, int last) {
        Objects.checkFromToIndex(first, last, size);
        int removed = last - first;
        if (removed == 0) {
            return;
        }
        System.arraycopy(buffer, last, buffer, first, size - last);
        Arrays.fill(buffer, size - removed, size, null);
        size -= removed;
    }

    /**
     * Changes the size to {@code n}. New slots take values from this array's default-value
     * supplier, one {@code get()} per slot. Shrinking never releases capacity.
     *
     * @param n the new size
     * @throws IllegalArgumentException if {@code n} is negative
     */
    public void resize(int n) {
        checkCount(n, "n");
        if (n <= size) {
            truncate(n);
            return;
        }
        ensureCapacity(n);
        for (int i = size; i < n; i++) {
            buffer[i] = defaultValue.get();
        }
        size = n;
    }

    /**
     * Changes the size to {@code n}, filling new slots with {@code value}. Shrinking never releases
     * capacity.
     *
     * @param n the new size
     * @param value the value of every added element
     * @throws IllegalArgumentException if {@code n} is negative
     */
    public void resize(int n, T value) {
        checkCount(n, "n");
        if (n <= size) {
            truncate(n);
            return;
        }
        ensureCapacity(n);
        Arrays.fill(buffer, size, n, value);
        size = n;
    }

    private void truncate(int n) {
        if (n < size) {
            Arrays.fill(buffer, n, size, null);
            size = n;
        }
    }

    /**
     * Ensures capacity for at least {@code n} elements. If {@code n <= capacity()} this is a no-op;
     * otherwise the buffer grows to the smallest power of two {@code >= n}. Size is unchanged.
     *
     * @param n the number of elements to make room for
     * @throws IllegalArgumentException if {@code n} is negative
     */
    public void reserve(int n) {
        checkCount(n, "n");
        ensureCapacity(n);
    }

    /**
     * Reallocates the buffer to the smallest power of two that holds the current size, releasing
     * it entirely when the array is empty.
     */
    public void shrinkToFit() {
        int target = capacityFor(size);
        if (target < capacity()) {
            reallocate(target);
        }
    }

    /**
     * Removes every element and releases the buffer. Afterwards the array is indistinguishable from
     * a freshly constructed empty one.
     */
    public void clear() {
        buffer = null;
        size = 0;
    }

    private void ensureCapacity(long required) {
        if (required > capacity()) {
            reallocate(capacityFor(required));
        }
    }

    private void reallocate(int newCapacity) {
        assert newCapacity >= size && (newCapacity == 0 || MathUtil.isPowerOfTwo(newCapacity));
        if (newCapacity == 0) {
            buffer = null;
            return;
        }
        Object[] next = new Object[newCapacity];
        if (buffer != null) {
            System.arraycopy(buffer, 0, next, 0, size);
        }
        buffer = next;
    }

    /**
     * The capacity needed to hold {@code n} elements: zero for zero, otherwise the smallest power of
     * two {@code >= n}. Every growth path goes through this method.
     *
     * @param n the number of elements
     * @return the capacity to allocate
     * @throws CapacityExceededException if {@code n > MAX_CAPACITY}
     */
    @VisibleForTesting
    static int capacityFor(long n) {
        assert n >= 0 : n;
        if (n > MAX_CAPACITY) {
            throw new CapacityExceededException(n, MAX_CAPACITY);
        }
        return n == 0 ? 0 : MathUtil.nextPowerOfTwo((int) n);
    }

    private static void checkCount(int n, String name) {
        if (n < 0) {
            throw new IllegalArgumentException(name + " must be non-negative, got " + n);
        }
    }

    /**
     * @return an unmodifiable snapshot of the live elements
     */
    @SuppressWarnings("unchecked")
    public List<T> toList() {
        List<T> list = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            list.add((T) buffer[i]);
        }
        return Collections.unmodifiableList(list);
    }

    /**
     * Iterates the live elements in index order. The iterator does not detect concurrent
     * modification.
     */
    @Override
    public Iterator<T> iterator() {
        return new Iterator<>() {
            private int i;

            @Override
            public boolean hasNext() {
                return i < size;
            }

            @Override
            @SuppressWarnings("unchecked")
            public T next() {
                if (i >= size) {
                    throw new NoSuchElementException();
                }
                return (T) buffer[i++];
            }
        };
    }

    /**
     * Two arrays are equal iff they have the same size and pairwise equal elements. Capacity and
     * the default-value supplier are ignored.
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DynamicArray)) {
            return false;
        }
        DynamicArray<?> other = (DynamicArray<?>) o;
        if (size != other.size) {
            return false;
        }
        for (int i = 0; i < size; i++) {
            if (!Objects.equals(buffer[i], other.buffer[i])) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        int result = 1;
        for (int i = 0; i < size; i++) {
            result = 31 * result + Objects.hashCode(buffer[i]);
        }
        return result;
    }

    @Override
    public String toString() {
        var sb = new StringBuilder("DynamicArray(");
        sb.append(size).append("/").append(capacity()).append(") [");
        for (int i = 0; i < size; i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(buffer[i]);
        }
        sb.append("]");
        return sb.toString();
    }

    /**
     * Lexicographic three-way comparison of the live elements of two arrays. A proper prefix
     * compares as less than the longer array; capacity plays no part. All six relational
     * operators follow from the sign of the result.
     *
     * @param a the first array
     * @param b the second array
     * @param comparator element order
     * @param <T> the element type
     * @return a negative value, zero, or a positive value as {@code a} is less than, equal to, or
     *         greater than {@code b}
     */
    @SuppressWarnings("unchecked")
    public static <T> int compare(DynamicArray<? extends T> a, DynamicArray<? extends T> b, Comparator<? super T> comparator) {
        int common = Math.min(a.size, b.size);
        for (int i = 0; i < common; i++) {
            int c = comparator.compare((T) a.buffer[i], (T) b.buffer[i]);
            if (c != 0) {
                return c;
            }
        }
        return Integer.compare(a.size, b.size);
    }

    /**
     * Lexicographic comparison using the elements' natural order. Null elements, such as those
     * left by {@link #resize(int)} with the default supplier, sort before any non-null element,
     * so two arrays that are {@link #equals equal} compare as zero.
     *
     * @param a the first array
     * @param b the second array
     * @param <T> the element type
     * @return the sign of the comparison, as for {@link #compare(DynamicArray, DynamicArray, Comparator)}
     */
    public static <T extends Comparable<? super T>> int compare(DynamicArray<? extends T> a, DynamicArray<? extends T> b) {
        return compare(a, b, Comparator.nullsFirst(Comparator.<T>naturalOrder()));
    }

    /**
     * @param comparator element order
     * @param <T> the element type
     * @return a comparator that orders arrays lexicographically by {@code comparator}
     */
    public static <T> Comparator<DynamicArray<? extends T>> lexicographicOrder(Comparator<? super T> comparator) {
        Objects.requireNonNull(comparator, "comparator");
        return (a, b) -> compare(a, b, comparator);
    }
}
