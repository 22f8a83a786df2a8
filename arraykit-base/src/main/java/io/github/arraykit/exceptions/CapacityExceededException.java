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

package io.github.arraykit.exceptions;

/**
 * Thrown when an operation would require a buffer larger than the largest power-of-two
 * capacity an array can address. The container that throws it is left unchanged.
 */
public class CapacityExceededException extends RuntimeException {
    private final long requested;
    private final int maximum;

    /**
     * Creates a new exception for a rejected capacity request.
     * @param requested the number of slots the operation needed
     * @param maximum the largest capacity that can be allocated
     */
    public CapacityExceededException(long requested, int maximum) {
        super(String.format("Cannot hold %d elements; maximum capacity is %d", requested, maximum));
        this.requested = requested;
        this.maximum = maximum;
    }

    /**
     * @return the number of slots the rejected operation needed
     */
    public long getRequested() {
        return requested;
    }

    /**
     * @return the largest capacity that can be allocated
     */
    public int getMaximum() {
        return maximum;
    }
}
