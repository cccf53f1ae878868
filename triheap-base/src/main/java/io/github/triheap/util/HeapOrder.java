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

import java.util.Comparator;
import java.util.Objects;

/**
 * The ranking used by a {@link TernaryHeap}: {@code precedes(a, b)} is true when {@code a} belongs
 * closer to the root than {@code b}.
 * <p>
 * Implementations must be irreflexive ({@code precedes(a, a)} is false) and consistent across calls;
 * the heap never inspects elements other than through this predicate. Equally-ranked elements
 * (neither precedes the other) are ordered arbitrarily.
 */
@FunctionalInterface
public interface HeapOrder<T> {

    boolean precedes(T a, T b);

    /**
     * @return an order with the opposite ranking; elements that precede in this order follow in the result
     */
    default HeapOrder<T> reversed() {
        return (a, b) -> precedes(b, a);
    }

    /** Smallest values at the top of the heap */
    static <T extends Comparable<? super T>> HeapOrder<T> min() {
        return (a, b) -> a.compareTo(b) < 0;
    }

    /** Largest values at the top of the heap */
    static <T extends Comparable<? super T>> HeapOrder<T> max() {
        return (a, b) -> a.compareTo(b) > 0;
    }

    /**
     * Adapts a comparator; the element that compares lower is placed closer to the root.
     */
    static <T> HeapOrder<T> of(Comparator<? super T> comparator) {
        Objects.requireNonNull(comparator, "comparator");
        return (a, b) -> comparator.compare(a, b) < 0;
    }
}
