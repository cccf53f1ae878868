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

import io.github.triheap.annotations.VisibleForTesting;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * A priority queue of arbitrary elements, ranked by a caller-supplied {@link HeapOrder}. Like all
 * priority queues it maintains a partial ordering of its elements such that the best-ranked element
 * can always be found in constant time; {@link #push} and {@link #pop} take log(size).
 * <p>
 * The heap is an implicit ternary tree laid out in a growable array: the children of slot {@code i}
 * are {@code 3i+1}, {@code 3i+2} and {@code 3i+3}, and its parent is {@code (i-1)/3}. Slots
 * {@code [0, size)} are live, the rest are null. When a push finds the array full, it is reallocated
 * to {@code capacity * growthFactor} slots.
 * <p>
 * Null elements are not permitted; {@link #peek()} and {@link #pop()} return null for an empty heap.
 * <p>
 * This class is not thread-safe.
 */
public class TernaryHeap<T> implements Iterable<T> {
    private static final Logger logger = LoggerFactory.getLogger(TernaryHeap.class);

    public static final int DEFAULT_INITIAL_CAPACITY = 10;
    public static final double DEFAULT_GROWTH_FACTOR = 2.0;

    private static final int ARITY = 3;

    private final HeapOrder<? super T> order;
    private final double growthFactor;
    private Object[] heap;
    private int size;

    /**
     * Create an empty heap with the default initial capacity and growth factor.
     */
    public TernaryHeap(HeapOrder<? super T> order) {
        this(order, DEFAULT_INITIAL_CAPACITY, DEFAULT_GROWTH_FACTOR);
    }

    public TernaryHeap(HeapOrder<? super T> order, int initialCapacity) {
        this(order, initialCapacity, DEFAULT_GROWTH_FACTOR);
    }

    /**
     * Create an empty heap.
     *
     * @param order           the ranking of elements; the best-ranked element is at the top
     * @param initialCapacity the number of slots to allocate up front
     * @param growthFactor    multiplier applied to the capacity whenever a push finds the heap full; must be > 1
     */
    public TernaryHeap(HeapOrder<? super T> order, int initialCapacity, double growthFactor) {
        this(order, new Object[checkInitialCapacity(initialCapacity)], 0, growthFactor);
    }

    private TernaryHeap(HeapOrder<? super T> order, Object[] heap, int size, double growthFactor) {
        this.order = Objects.requireNonNull(order, "order");
        this.growthFactor = checkGrowthFactor(growthFactor);
        this.heap = heap;
        this.size = size;
    }

    private static int checkInitialCapacity(int initialCapacity) {
        if (initialCapacity < 1 || initialCapacity >= ArrayUtil.MAX_ARRAY_LENGTH) {
            // Throw exception to prevent confusing OOME:
            throw new IllegalArgumentException(
                    "initialCapacity must be > 0 and < " + ArrayUtil.MAX_ARRAY_LENGTH + "; got: " + initialCapacity);
        }
        return initialCapacity;
    }

    private static double checkGrowthFactor(double growthFactor) {
        // written so that NaN fails too
        if (!(growthFactor > 1.0) || Double.isInfinite(growthFactor)) {
            throw new IllegalArgumentException("growthFactor must be a finite value > 1; got: " + growthFactor);
        }
        return growthFactor;
    }

    /**
     * Builds a heap in O(n) from an unordered array. The resulting capacity is {@code elements.length}.
     * <p>
     * A plain {@code Object[]} is adopted as the heap's buffer, so the caller must not touch it afterwards.
     * Arrays with a narrower component type are copied first, since a covariant array could reject
     * elements pushed later.
     */
    public static <T> TernaryHeap<T> heapify(T[] elements, HeapOrder<? super T> order) {
        return heapify(elements, order, DEFAULT_GROWTH_FACTOR);
    }

    public static <T> TernaryHeap<T> heapify(T[] elements, HeapOrder<? super T> order, double growthFactor) {
        for (int i = 0; i < elements.length; i++) {
            Objects.requireNonNull(elements[i], "heap elements must not be null");
        }
        Object[] buffer = elements.getClass() == Object[].class
                          ? elements
                          : Arrays.copyOf(elements, elements.length, Object[].class);
        var result = new TernaryHeap<T>(order, buffer, buffer.length, growthFactor);
        result.heapifyInPlace();
        return result;
    }

    /**
     * Builds a heap in O(n) from a copy of {@code elements}.
     */
    public static <T> TernaryHeap<T> heapify(Collection<? extends T> elements, HeapOrder<? super T> order) {
        return heapify(elements, order, DEFAULT_GROWTH_FACTOR);
    }

    public static <T> TernaryHeap<T> heapify(Collection<? extends T> elements, HeapOrder<? super T> order, double growthFactor) {
        Object[] copy = elements.toArray();
        for (Object element : copy) {
            Objects.requireNonNull(element, "heap elements must not be null");
        }
        var result = new TernaryHeap<T>(order, copy, copy.length, growthFactor);
        result.heapifyInPlace();
        return result;
    }

    private void heapifyInPlace() {
        if (size < 2) {
            return;
        }
        // every slot past the last parent is a leaf
        for (int i = parent(size - 1); i >= 0; i--) {
            downHeap(i);
        }
    }

    /**
     * Adds an element in log(size) time, or O(size) when the buffer has to grow.
     *
     * @return the element that was pushed
     */
    public T push(T element) {
        Objects.requireNonNull(element, "heap elements must not be null");
        if (size == heap.length) {
            grow();
        }
        heap[size] = element;
        upHeap(size);
        size++;
        return element;
    }

    private void grow() {
        int oldCapacity = heap.length;
        int newCapacity = ArrayUtil.growthCapacity(oldCapacity, growthFactor);
        if (newCapacity == ArrayUtil.MAX_ARRAY_LENGTH) {
            logger.warn("Heap buffer reached the maximum array length of {} slots", ArrayUtil.MAX_ARRAY_LENGTH);
        }
        heap = ArrayUtil.growExact(heap, newCapacity);
        logger.debug("Grew heap buffer from {} to {} slots", oldCapacity, newCapacity);
    }

    /**
     * Returns the best-ranked element in constant time without removing it, or null if the heap is empty.
     */
    public T peek() {
        return size == 0 ? null : elementAt(0);
    }

    /**
     * Removes and returns the best-ranked element in log(size) time, or returns null if the heap is empty.
     */
    public T pop() {
        if (size == 0) {
            return null;
        }
        T result = elementAt(0); // save first value
        size--;
        heap[0] = heap[size]; // move last to first
        heap[size] = null;
        if (size > 0) {
            downHeap(0); // adjust heap
        }
        return result;
    }

    /**
     * Replaces the first live element, in storage order, that {@code match} accepts with {@code newValue},
     * then restores the heap property. Storage order bears no relation to priority, so when several
     * elements match, which one is replaced is unspecified; callers should supply a predicate that
     * identifies a single element. O(size) to find the element, log(size) to reposition it.
     *
     * @return true if an element matched and was replaced
     */
    public boolean modify(Predicate<? super T> match, T newValue) {
        Objects.requireNonNull(newValue, "heap elements must not be null");
        for (int i = 0; i < size; i++) {
            T oldValue = elementAt(i);
            if (!match.test(oldValue)) {
                continue;
            }
            heap[i] = newValue;
            if (order.precedes(newValue, oldValue)) {
                upHeap(i);
            } else {
                downHeap(i);
            }
            return true;
        }
        return false;
    }

    /**
     * Returns a new heap holding the elements of this heap and all of {@code others}, built in O(total size).
     * None of the inputs are modified. The result uses this heap's order and growth factor; the orders of
     * {@code others} are ignored, so their elements are re-ranked under this heap's order.
     */
    @SafeVarargs
    public final TernaryHeap<T> merge(TernaryHeap<? extends T>... others) {
        long total = size;
        for (TernaryHeap<? extends T> other : others) {
            total += other.size;
        }
        if (total >= ArrayUtil.MAX_ARRAY_LENGTH) {
            throw new IllegalArgumentException("Merged heap would hold " + total + " elements; max is " + (ArrayUtil.MAX_ARRAY_LENGTH - 1));
        }

        Object[] merged = new Object[(int) total];
        System.arraycopy(heap, 0, merged, 0, size);
        int offset = size;
        for (TernaryHeap<? extends T> other : others) {
            System.arraycopy(other.heap, 0, merged, offset, other.size);
            offset += other.size;
        }

        var result = new TernaryHeap<T>(order, merged, merged.length, growthFactor);
        result.heapifyInPlace();
        logger.debug("Merged {} heaps into a heap of {} elements", others.length + 1, total);
        return result;
    }

    /**
     * Removes all elements from the heap.
     *
     * @return the number of elements removed
     */
    public int clear() {
        int removed = size;
        Arrays.fill(heap, 0, size, null);
        size = 0;
        return removed;
    }

    /**
     * Returns an independent copy with the same elements in the same slots, the same order, capacity and
     * growth factor. The elements themselves are shared, not copied.
     */
    public TernaryHeap<T> copy() {
        return new TernaryHeap<>(order, heap.clone(), size, growthFactor);
    }

    /**
     * Copies the contents and current size from `other`.  Keeps this heap's order and growth factor, so
     * the two orders must agree or the heap property may not hold afterwards.
     */
    public void copyFrom(TernaryHeap<? extends T> other) {
        if (this.heap.length < other.size) {
            this.heap = new Object[other.heap.length];
        } else {
            Arrays.fill(this.heap, other.size, this.size, null);
        }
        System.arraycopy(other.heap, 0, this.heap, 0, other.size);
        this.size = other.size;
    }

    /**
     * Pops every element into a list, best-ranked first. The heap is empty afterwards.
     */
    public List<T> drain() {
        var result = new ArrayList<T>(size);
        while (size > 0) {
            result.add(pop());
        }
        return result;
    }

    /**
     * Returns an iterator over the elements in priority order, best-ranked first. The iterator works on a
     * copy taken when this method is called, so it is unaffected by later changes to this heap and never
     * modifies it. Creating the iterator is O(size); each step is log(size).
     */
    @Override
    public Iterator<T> iterator() {
        return new AscendingIterator<>(copy());
    }

    /** Returns the number of elements currently stored in the heap. */
    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    /** @return the number of slots currently allocated */
    public int capacity() {
        return heap.length;
    }

    public double growthFactor() {
        return growthFactor;
    }

    public HeapOrder<? super T> order() {
        return order;
    }

    /**
     * Return the element at the ith slot of the heap. Use for iterating over elements when the order
     * doesn't matter. Note that the valid arguments range from [0, size).
     */
    public T get(int i) {
        Objects.checkIndex(i, size);
        return elementAt(i);
    }

    @VisibleForTesting
    Object[] getHeapArray() {
        return heap;
    }

    @Override
    public String toString() {
        return "TernaryHeap[" + size + "]";
    }

    private void upHeap(int origPos) {
        int i = origPos;
        T value = elementAt(i); // save bottom value
        while (i > 0) {
            int j = parent(i);
            T parent = elementAt(j);
            if (!order.precedes(value, parent)) {
                break;
            }
            heap[i] = parent; // shift parent down
            i = j;
        }
        heap[i] = value; // install saved value
    }

    private void downHeap(int origPos) {
        int i = origPos;
        T value = elementAt(i); // save top value
        while (true) {
            int j = bestChild(i);
            if (j < 0) {
                break;
            }
            T child = elementAt(j);
            if (!order.precedes(child, value)) {
                break;
            }
            heap[i] = child; // shift up child
            i = j;
        }
        heap[i] = value; // install saved value
    }

    /**
     * @return the slot of the best-ranked child of {@code i}, or -1 if {@code i} is a leaf.
     * Ties go to the leftmost child.
     */
    private int bestChild(int i) {
        long first = (long) ARITY * i + 1;
        if (first >= size) {
            return -1;
        }
        int best = (int) first;
        int last = (int) Math.min(first + ARITY, size);
        for (int k = best + 1; k < last; k++) {
            if (order.precedes(elementAt(k), elementAt(best))) {
                best = k;
            }
        }
        return best;
    }

    private static int parent(int i) {
        return (i - 1) / ARITY;
    }

    @SuppressWarnings("unchecked")
    private T elementAt(int i) {
        return (T) heap[i];
    }

    private static final class AscendingIterator<T> implements Iterator<T> {
        private final TernaryHeap<T> snapshot;

        AscendingIterator(TernaryHeap<T> snapshot) {
            this.snapshot = snapshot;
        }

        @Override
        public boolean hasNext() {
            return !snapshot.isEmpty();
        }

        @Override
        public T next() {
            if (snapshot.isEmpty()) {
                throw new NoSuchElementException();
            }
            return snapshot.pop();
        }
    }
}
