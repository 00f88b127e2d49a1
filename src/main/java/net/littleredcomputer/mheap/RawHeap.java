package net.littleredcomputer.mheap;

import com.google.common.collect.ImmutableList;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Array-backed binary heap machinery shared by {@link Heap} and {@link IndexableHeap}.
 * <p>
 * The root lives at position 0; the children of {@code i} are {@code 2i+1} and {@code 2i+2}.
 * Every reordering goes through {@link #swap}, and every shrink through {@link #truncate},
 * so a subclass that tracks positions only needs to override those two.
 */
abstract class RawHeap<T> {
    private static final Logger log = LogManager.getFormatterLogger(RawHeap.class);
    private static final Object[] EMPTY = {};
    private static final int DEFAULT_CAPACITY = 10;

    final HeapOrder<? super T> order;
    Object[] a;
    int n;

    RawHeap(int capacity, HeapOrder<? super T> order) {
        checkArgument(capacity >= 0, "negative capacity: %s", capacity);
        this.order = checkNotNull(order, "order");
        this.a = capacity == 0 ? EMPTY : new Object[capacity];
    }

    public final int size() { return n; }

    public final boolean isEmpty() { return n == 0; }

    public final HeapOrder<? super T> order() { return order; }

    /** Number of elements the backing array holds before it has to grow. */
    public final int capacity() { return a.length; }

    public void ensureCapacity(int minCapacity) {
        if (minCapacity <= a.length) return;
        int grown = Math.max(minCapacity, Math.max(DEFAULT_CAPACITY, a.length + (a.length >> 1)));
        log.trace("growing backing array %d -> %d", a.length, grown);
        a = Arrays.copyOf(a, grown);
    }

    public void trimToSize() {
        if (n < a.length) a = n == 0 ? EMPTY : Arrays.copyOf(a, n);
    }

    /** The element that {@link #pop} would return, without removing it. */
    public final Optional<T> peek() {
        return n == 0 ? Optional.empty() : Optional.of(elt(0));
    }

    /** Removes and returns the element with the highest priority. */
    public final Optional<T> pop() {
        return n == 0 ? Optional.empty() : Optional.of(removeAt(0));
    }

    /**
     * Restores order after the caller mutated the top element in place.
     * @return the (possibly different) new top
     */
    public final Optional<T> updateTop() {
        if (n == 0) return Optional.empty();
        siftDown(0);
        return Optional.of(elt(0));
    }

    /** Pops every element; the list is in priority order and the heap is left empty. */
    public final ImmutableList<T> drain() {
        ImmutableList.Builder<T> b = ImmutableList.builderWithExpectedSize(n);
        while (n > 0) b.add(removeAt(0));
        return b.build();
    }

    public void clear() {
        Arrays.fill(a, 0, n, null);
        n = 0;
    }

    @SuppressWarnings("unchecked")
    final T elt(int pos) {
        return (T) a[pos];
    }

    /** Stores {@code x} at the first free position, without restoring order. */
    final int append(T x) {
        checkNotNull(x, "element");
        ensureCapacity(n + 1);
        a[n] = x;
        return n++;
    }

    void swap(int i, int j) {
        Object tmp = a[i];
        a[i] = a[j];
        a[j] = tmp;
    }

    /** Drops the last position. */
    void truncate() {
        a[--n] = null;
    }

    /**
     * Removes the element at {@code pos}: the last element takes its place, and is then
     * moved up or down as its new neighbours require.
     */
    final T removeAt(int pos) {
        T removed = elt(pos);
        int last = n - 1;
        if (pos != last) swap(pos, last);
        truncate();
        if (pos < n) fixupFromBottom(pos);
        return removed;
    }

    /** @return the final position of the element that started at {@code pos} */
    final int siftUp(int pos) {
        while (pos > 0) {
            int parent = (pos - 1) / 2;
            if (!order.outranks(elt(pos), elt(parent))) break;
            swap(pos, parent);
            pos = parent;
        }
        return pos;
    }

    final int siftDown(int pos) {
        int child;
        while ((child = upperChild(pos)) >= 0) {
            if (!order.outranks(elt(child), elt(pos))) break;
            swap(pos, child);
            pos = child;
        }
        return pos;
    }

    /**
     * Moves the element at {@code pos} all the way to a leaf along the path of higher-priority
     * children, without comparing against it. Cheaper than {@link #siftDown} for an element
     * that came from the bottom and will most likely go back there.
     */
    final int siftDownToBottom(int pos) {
        int child;
        while ((child = upperChild(pos)) >= 0) {
            swap(pos, child);
            pos = child;
        }
        return pos;
    }

    /** Moves the element at {@code pos} in whichever direction restores order. */
    final int fixup(int pos) {
        int up = siftUp(pos);
        // An element that moved up can't also need to move down.
        if (up != pos) return up;
        return siftDown(pos);
    }

    final int fixupFromBottom(int pos) {
        return siftUp(siftDownToBottom(pos));
    }

    /** The child of {@code pos} with the higher priority, or -1 for a leaf. */
    private int upperChild(int pos) {
        int child = 2 * pos + 1;
        if (child >= n) return -1;
        if (child + 1 < n && order.outranks(elt(child + 1), elt(child))) ++child;
        return child;
    }

    final void rebuild() {
        for (int start = n / 2 - 1; start >= 0; --start) siftDown(start);
    }

    /** Restores order after positions {@code start..n-1} were filled by {@link #append}. */
    final void rebuildTail(int start) {
        if (start == n) return;
        if (betterToRebuild(n, start)) {
            log.trace("rebuilding %d elements after appending %d", n, n - start);
            rebuild();
        } else {
            for (int i = start; i < n; ++i) siftUp(i);
        }
    }

    /**
     * Rebuilding costs about {@code 2*len} comparisons; sifting the tail up costs about
     * {@code tail*log2(start)}. Above 2048 elements the crossover was measured, not derived.
     */
    static boolean betterToRebuild(int len, int start) {
        long tail = len - start;
        if (start < tail) return true;
        if (len <= 2048) return 2L * len < tail * log2(start);
        return 2L * len < tail * 11;
    }

    private static int log2(int x) {
        return 31 - Integer.numberOfLeadingZeros(x);
    }

    /** True if no parent ranks below one of its children. */
    boolean isHeap() {
        for (int i = 1; i < n; ++i) {
            if (order.outranks(elt(i), elt((i - 1) / 2))) return false;
        }
        return true;
    }
}
