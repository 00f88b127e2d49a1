package net.littleredcomputer.mheap;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;

import java.util.Collection;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A binary heap stored in a plain array.
 * <pre>
 *   Heap&lt;Integer&gt; h = Heap.maxHeap();
 *   h.push(3);
 *   h.push(15);
 *   h.push(1);
 *   h.pop();  // Optional[15]
 * </pre>
 * {@code push} and {@code pop} take O(log n), {@code peek} O(1). Not thread safe.
 */
public class Heap<T> extends RawHeap<T> {

    private Heap(int capacity, HeapOrder<? super T> order) {
        super(capacity, order);
    }

    /** Largest element first. */
    public static <T extends Comparable<? super T>> Heap<T> maxHeap() {
        return new Heap<>(0, HeapOrder.max());
    }

    /** Smallest element first. */
    public static <T extends Comparable<? super T>> Heap<T> minHeap() {
        return new Heap<>(0, HeapOrder.min());
    }

    public static <T> Heap<T> withOrdering(HeapOrder<? super T> order) {
        return new Heap<>(0, order);
    }

    public static <T> Heap<T> withCapacity(int capacity, HeapOrder<? super T> order) {
        return new Heap<>(capacity, order);
    }

    /**
     * Builds a heap from existing elements in O(n), by sifting down every internal node
     * from the last one back to the root.
     */
    public static <T> Heap<T> heapify(Collection<? extends T> elements, HeapOrder<? super T> order) {
        Heap<T> h = new Heap<>(elements.size(), order);
        for (T x : elements) h.append(x);
        h.rebuild();
        return h;
    }

    public void push(T x) {
        siftUp(append(x));
    }

    /**
     * Adds several elements at once. Depending on how many are added relative to the size of
     * the heap, either each new element is sifted up or the whole heap is rebuilt.
     * @throws NullPointerException if any element is null, in which case the heap is unchanged
     */
    public void pushAll(Iterable<? extends T> elements) {
        // Copying rejects nulls before anything is appended.
        ImmutableList<T> xs = ImmutableList.copyOf(elements);
        int start = n;
        ensureCapacity(n + xs.size());
        for (T x : xs) append(x);
        rebuildTail(start);
    }

    /**
     * Replaces the top element with {@code x}. Cheaper than a pop followed by a push.
     * @return the previous top, or empty if the heap was empty (in which case {@code x} is simply pushed)
     */
    public Optional<T> replaceTop(T x) {
        if (n == 0) {
            push(x);
            return Optional.empty();
        }
        T top = elt(0);
        a[0] = checkNotNull(x, "element");
        siftDown(0);
        return Optional.of(top);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("size", n)
                .add("top", peek().orElse(null))
                .toString();
    }
}
