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

import io.github.triheap.TriHeapTestCase;
import org.junit.Test;

import static org.junit.Assert.*;

public class TestArrayUtil extends TriHeapTestCase {
    @Test
    public void testGrowthCapacity() {
        assertEquals(20, ArrayUtil.growthCapacity(10, 2.0));
        assertEquals(15, ArrayUtil.growthCapacity(10, 1.5));
        assertEquals(16, ArrayUtil.growthCapacity(10, 1.55));
        // always makes progress
        assertEquals(1, ArrayUtil.growthCapacity(0, 2.0));
        assertEquals(2, ArrayUtil.growthCapacity(1, 1.01));
    }

    @Test
    public void testGrowthCapacityIsClamped() {
        assertEquals(ArrayUtil.MAX_ARRAY_LENGTH, ArrayUtil.growthCapacity(ArrayUtil.MAX_ARRAY_LENGTH / 2 + 1, 2.0));
        assertEquals(ArrayUtil.MAX_ARRAY_LENGTH, ArrayUtil.growthCapacity(ArrayUtil.MAX_ARRAY_LENGTH - 1, 1.5));
        assertThrows(IllegalStateException.class, () -> ArrayUtil.growthCapacity(ArrayUtil.MAX_ARRAY_LENGTH, 2.0));
    }

    @Test
    public void testGrowExact() {
        Object[] grown = ArrayUtil.growExact(new Object[]{"a", "b"}, 4);
        assertArrayEquals(new Object[]{"a", "b", null, null}, grown);
    }
}
