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
package io.github.triheap.bench;

import io.github.triheap.util.HeapOrder;
import io.github.triheap.util.TernaryHeap;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.PriorityQueue;
import java.util.Random;
import java.util.concurrent.TimeUnit;

@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@State(Scope.Thread)
@Fork(1)
@Warmup(iterations = 2)
@Measurement(iterations = 5)
@Threads(1)
public class TernaryHeapBenchmark {
    private static final Logger log = LoggerFactory.getLogger(TernaryHeapBenchmark.class);
    private static final HeapOrder<Integer> MIN = HeapOrder.min();

    private Integer[] values;
    @Param({"1000", "100000"})
    int numValues;
    @Param({"1.5", "2.0"})
    double growthFactor;

    @Setup
    public void setup() {
        var random = new Random(42);
        values = new Integer[numValues];
        for (int i = 0; i < numValues; i++) {
            values[i] = random.nextInt();
        }
        log.info("Generated {} random values", numValues);
    }

    @Benchmark
    public void pushThenDrain(Blackhole blackhole) {
        var heap = new TernaryHeap<Integer>(MIN, TernaryHeap.DEFAULT_INITIAL_CAPACITY, growthFactor);
        for (Integer v : values) {
            heap.push(v);
        }
        while (!heap.isEmpty()) {
            blackhole.consume(heap.pop());
        }
    }

    @Benchmark
    public void heapifyThenDrain(Blackhole blackhole) {
        // an Integer[] is copied into a fresh buffer, so values is left untouched
        var heap = TernaryHeap.heapify(values, MIN, growthFactor);
        while (!heap.isEmpty()) {
            blackhole.consume(heap.pop());
        }
    }

    @Benchmark
    public void priorityQueueBaseline(Blackhole blackhole) {
        var queue = new PriorityQueue<Integer>(TernaryHeap.DEFAULT_INITIAL_CAPACITY);
        for (Integer v : values) {
            queue.add(v);
        }
        while (!queue.isEmpty()) {
            blackhole.consume(queue.poll());
        }
    }
}
