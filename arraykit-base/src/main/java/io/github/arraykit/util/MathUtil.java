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

package io.github.arraykit.util;

/**
 * Utility methods for power-of-two arithmetic.
 */
public class MathUtil {
    /** The largest power of two representable as a positive {@code int}. */
    public static final int MAX_POWER_OF_TWO = 1 << 30;

    /** Private constructor to prevent instantiation. */
    private MathUtil() {
    }

    /**
     * Returns true if the given value is an exact power of two.
     *
     * @param n the value to test
     * @return true iff {@code n} is 1, 2, 4, 8, ...
     */
    public static boolean isPowerOfTwo(int n) {
        return n > 0 && (n & (n - 1)) == 0;
    }

    /**
     * Returns the smallest power of two that is greater than or equal to {@code n}.
     *
     * @param n a positive value no larger than {@link #MAX_POWER_OF_TWO}
     * @return the smallest power of two {@code >= n}
     * @throws IllegalArgumentException if {@code n} is not in {@code [1, MAX_POWER_OF_TWO]}
     */
    public static int nextPowerOfTwo(int n) {
        if (n <= 0 || n > MAX_POWER_OF_TWO) {
            throw new IllegalArgumentException("No int power of two >= " + n);
        }
        return n == 1 ? 1 : Integer.highestOneBit(n - 1) << 1;
    }
}
