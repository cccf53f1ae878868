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

package io.github.triheap.util;

import java.util.Arrays;

/**
 * Methods for manipulating heap buffers.
 */
public final class ArrayUtil {

    /**
     * Maximum length for an array. Some VMs reserve header words in an array, so requesting
     * {@code Integer.MAX_VALUE} slots fails even with enough memory available.
     */
    public static final int MAX_ARRAY_LENGTH = Integer.MAX_VALUE - 8;

    private ArrayUtil() {} // no instance

    /**
     * Returns the capacity a buffer of {@code currentCapacity} slots grows to under {@code growthFactor}.
     * The result is always at least {@code currentCapacity + 1}, so that zero-length buffers and factors
     * barely above 1 still make progress, and never more than {@link #MAX_ARRAY_LENGTH}.
     *
     * @throws IllegalStateException if the buffer is already at {@link #MAX_ARRAY_LENGTH}
     */
    public static int growthCapacity(int currentCapacity, double growthFactor) {
        if (currentCapacity >= MAX_ARRAY_LENGTH) {
            throw new IllegalStateException("Cannot grow buffer beyond " + MAX_ARRAY_LENGTH + " slots");
        }
        double scaled = Math.ceil(currentCapacity * growthFactor);
        long target = Math.max((long) currentCapacity + 1, scaled >= MAX_ARRAY_LENGTH ? MAX_ARRAY_LENGTH : (long) scaled);
        return (int) Math.min(target, MAX_ARRAY_LENGTH);
    }

    /** Returns a copy of {@code array} with exactly {@code newLength} slots; new slots are null. */
    public static Object[] growExact(Object[] array, int newLength) {
        assert newLength >= array.length : newLength + " < " + array.length;
        return Arrays.copyOf(array, newLength);
    }
}
