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

import java.util.Arrays;

/**
 * A read/write window onto the buffer of a {@link DynamicArray}, covering the elements that were
 * live when the view was taken. Writes go straight to the owning array's storage.
 * <p>
 * A view does not own the buffer. It stays attached only until the owning array next changes its
 * capacity; after that it still refers to the old storage, and using it is a caller error.
 *
 * @param <T> the element type
 * @see DynamicArray#data()
 */
public final class ArrayView<T> {
    private final Object[] buffer;
    private final int length;

    ArrayView(Object[] buffer, int length) {
        assert buffer != null && length <= buffer.length;
        this.buffer = buffer;
        this.length = length;
    }

    /**
     * @return the number of elements covered by this view
     */
    public int length() {
        return length;
    }

    /**
     * @param index position in {@code [0, length)}; only checked when assertions are enabled
     * @return the element at {@code index}
     */
    @SuppressWarnings("unchecked")
    public T get(int index) {
        assert index >= 0 && index < length : "index=" + index + " length=" + length;
        return (T) buffer[index];
    }

    /**
     * @param index position in {@code [0, length)}; only checked when assertions are enabled
     * @param value the new element
     */
    public void set(int index, T value) {
        assert index >= 0 && index < length : "index=" + index + " length=" + length;
        buffer[index] = value;
    }

    /**
     * Returns true if both views are windows onto the same buffer. Two arrays never share a
     * buffer, so this identifies ownership across {@link DynamicArray#swap} and friends.
     *
     * @param other another view, may be null
     * @return true iff {@code other} is backed by the same storage
     */
    public boolean sharesBufferWith(ArrayView<?> other) {
        return other != null && other.buffer == buffer;
    }

    /**
     * @return a copy of the covered elements
     */
    public Object[] toArray() {
        return Arrays.copyOf(buffer, length);
    }

    @Override
    public String toString() {
        return "ArrayView(" + length + ")";
    }
}
