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

import java.util.Arrays;
import java.util.Comparator;

import static org.junit.Assert.*;

public class TestHeapOrder extends TriHeapTestCase {
    @Test
    public void testMin() {
        HeapOrder<Integer> order = HeapOrder.min();
        assertTrue(order.precedes(1, 2));
        assertFalse(order.precedes(2, 1));
        assertFalse(order.precedes(1, 1));
    }

    @Test
    public void testMax() {
        HeapOrder<Integer> order = HeapOrder.max();
        assertTrue(order.precedes(2, 1));
        assertFalse(order.precedes(1, 2));
        assertFalse(order.precedes(1, 1));
    }

    @Test
    public void testReversed() {
        HeapOrder<String> order = HeapOrder.<String>min().reversed();
        assertTrue(order.precedes("b", "a"));
        assertFalse(order.precedes("a", "b"));
        assertFalse(order.precedes("a", "a"));
    }

    @Test
    public void testComparator() {
        HeapOrder<String> byLength = HeapOrder.of(Comparator.comparingInt(String::length));
        assertTrue(byLength.precedes("a", "bb"));
        assertFalse(byLength.precedes("bb", "a"));
        // equal under the comparator, so neither precedes
        assertFalse(byLength.precedes("aa", "bb"));
        assertFalse(byLength.precedes("bb", "aa"));

        var heap = TernaryHeap.heapify(Arrays.asList("ccc", "a", "bb", "dddd"), byLength);
        assertEquals(Arrays.asList("a", "bb", "ccc", "dddd"), heap.drain());
    }

    @Test
    public void testNullComparator() {
        assertThrows(NullPointerException.class, () -> HeapOrder.of(null));
    }

    @Test
    public void testTaskScheduling() {
        // earliest deadline first, ties broken by lower id
        HeapOrder<Task> order = HeapOrder.of(Comparator.comparingLong((Task t) -> t.deadline).thenComparingInt(t -> t.id));
        var queue = new TernaryHeap<Task>(order, 2);
        queue.push(new Task(1, 300));
        queue.push(new Task(2, 100));
        queue.push(new Task(3, 200));
        queue.push(new Task(4, 100));

        // task 1 gets an earlier deadline
        assertTrue(queue.modify(t -> t.id == 1, new Task(1, 50)));

        var ids = new int[queue.size()];
        int i = 0;
        for (Task t : queue) {
            ids[i++] = t.id;
        }
        assertArrayEquals(new int[]{1, 2, 4, 3}, ids);
        assertEquals(4, queue.size());
    }

    private static final class Task {
        final int id;
        final long deadline;

        Task(int id, long deadline) {
            this.id = id;
            this.deadline = deadline;
        }
    }
}
