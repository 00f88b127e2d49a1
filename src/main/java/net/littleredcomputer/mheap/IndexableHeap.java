package net.littleredcomputer.mheap;

import com.google.common.base.MoreObjects;
import gnu.trove.list.array.TIntArrayList;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

/**
 * A binary heap whose elements can also be reached through a stable {@link Handle}.
 * <pre>
 *   IndexableHeap&lt;Integer&gt; h = IndexableHeap.maxHeap();
 *   Handle&lt;Integer&gt; x = h.push(42);
 *   h.push(1);
 *   h.push(100);
 *   h.replace(x, 150);
 *   h.peek();  // Optional[150]
 * </pre>
 * Besides the element array the heap keeps two tables that are inverse to each other:
 * position to handle slot, and handle slot to position. Every swap performed while sifting
 * updates both. Released slots are recycled, each release bumping the slot's generation so
 * that old handles stop matching.
 * <p>
 * If an element is changed in place, through {@link Entry#set} or by mutating a mutable
 * element, the heap is not reordered automatically; call {@link #reorder} before the next
 * {@code pop} or {@code peek}. Skipping it leaves the pop order undefined. Not thread safe.
 */
public class IndexableHeap<T> extends RawHeap<T> {
    private static final Logger log = LogManager.getFormatterLogger(IndexableHeap.class);
    private static final AtomicLong heapIds = new AtomicLong();
    private static final int FREE = -1;

    private final long id = heapIds.incrementAndGet();
    private final TIntArrayList handleAt;       // position -> slot
    private final TIntArrayList positions;      // slot -> position, or FREE
    private final TIntArrayList generations;    // slot -> generation
    private final TIntArrayList freeSlots = new TIntArrayList();

    private IndexableHeap(int capacity, HeapOrder<? super T> order) {
        super(capacity, order);
        handleAt = new TIntArrayList(Math.max(capacity, 1));
        positions = new TIntArrayList(Math.max(capacity, 1));
        generations = new TIntArrayList(Math.max(capacity, 1));
    }

    public static <T extends Comparable<? super T>> IndexableHeap<T> maxHeap() {
        return new IndexableHeap<>(0, HeapOrder.max());
    }

    public static <T extends Comparable<? super T>> IndexableHeap<T> minHeap() {
        return new IndexableHeap<>(0, HeapOrder.min());
    }

    public static <T> IndexableHeap<T> withOrdering(HeapOrder<? super T> order) {
        return new IndexableHeap<>(0, order);
    }

    public static <T> IndexableHeap<T> withCapacity(int capacity, HeapOrder<? super T> order) {
        return new IndexableHeap<>(capacity, order);
    }

    /** Adds an element, returning the handle that names it until it leaves the heap. */
    public Handle<T> push(T x) {
        int pos = append(x);
        int slot = allocate(pos);
        handleAt.add(slot);
        siftUp(pos);
        return new Handle<>(id, slot, generations.get(slot));
    }

    /** The handle of the element {@link #peek} would return. */
    public Optional<Handle<T>> peekHandle() {
        return n == 0 ? Optional.empty() : Optional.of(handleOf(0));
    }

    public boolean contains(Handle<T> h) {
        return resolve(h) != FREE;
    }

    /** The element named by {@code h}, or empty if it is no longer in this heap. */
    public Optional<T> get(Handle<T> h) {
        int pos = resolve(h);
        return pos == FREE ? Optional.empty() : Optional.of(elt(pos));
    }

    /**
     * Mutable access to the element named by {@code h}.
     * @throws IllegalArgumentException if the element is no longer in this heap
     */
    public Entry entry(Handle<T> h) {
        checkArgument(contains(h), "stale handle: %s", h);
        return new Entry(h);
    }

    /** Like {@link #entry}, but empty instead of throwing for a stale handle. */
    public Optional<Entry> findEntry(Handle<T> h) {
        return contains(h) ? Optional.of(new Entry(h)) : Optional.empty();
    }

    /**
     * Restores order after the element named by {@code h} was changed in place. The element
     * may need to move either up or down.
     * @return true if the element moved
     * @throws IllegalArgumentException if the element is no longer in this heap
     */
    public boolean reorder(Handle<T> h) {
        int pos = positionOf(h);
        return fixup(pos) != pos;
    }

    /**
     * Replaces the element named by {@code h} and restores order. The handle now names
     * the new value.
     * @return the previous value
     * @throws IllegalArgumentException if the element is no longer in this heap
     */
    public T replace(Handle<T> h, T x) {
        int pos = positionOf(h);
        T old = elt(pos);
        a[pos] = checkNotNull(x, "element");
        fixup(pos);
        return old;
    }

    /**
     * Removes the element named by {@code h}, wherever it is in the heap.
     * @return the element, or empty if it was no longer in this heap
     */
    public Optional<T> remove(Handle<T> h) {
        int pos = resolve(h);
        return pos == FREE ? Optional.empty() : Optional.of(removeAt(pos));
    }

    /** Removes every element. All outstanding handles become stale. */
    @Override
    public void clear() {
        for (int pos = 0; pos < n; ++pos) release(handleAt.get(pos));
        handleAt.resetQuick();
        super.clear();
    }

    /** Also pre-sizes the handle tables. */
    @Override
    public void ensureCapacity(int minCapacity) {
        super.ensureCapacity(minCapacity);
        handleAt.ensureCapacity(minCapacity);
        positions.ensureCapacity(minCapacity);
        generations.ensureCapacity(minCapacity);
    }

    /**
     * Also trims the handle tables. The slot tables keep one entry per slot ever issued,
     * since released slots still carry their generation.
     */
    @Override
    public void trimToSize() {
        super.trimToSize();
        handleAt.trimToSize();
        positions.trimToSize();
        generations.trimToSize();
        freeSlots.trimToSize();
    }

    @Override
    void swap(int i, int j) {
        super.swap(i, j);
        int si = handleAt.get(i);
        int sj = handleAt.get(j);
        handleAt.set(i, sj);
        handleAt.set(j, si);
        positions.set(sj, i);
        positions.set(si, j);
    }

    @Override
    void truncate() {
        release(handleAt.removeAt(n - 1));
        super.truncate();
    }

    private int allocate(int pos) {
        if (!freeSlots.isEmpty()) {
            int slot = freeSlots.removeAt(freeSlots.size() - 1);
            positions.set(slot, pos);
            return slot;
        }
        positions.add(pos);
        generations.add(0);
        return positions.size() - 1;
    }

    private void release(int slot) {
        positions.set(slot, FREE);
        int g = generations.get(slot);
        if (g == Integer.MAX_VALUE) {
            // Out of generations: retire the slot.
            log.trace("retiring slot %d", slot);
            return;
        }
        generations.set(slot, g + 1);
        freeSlots.add(slot);
    }

    /** Position of the element named by {@code h}, or FREE. */
    private int resolve(Handle<T> h) {
        checkNotNull(h, "handle");
        if (h.heapId != id) {
            log.trace("%s was issued by another heap", h);
            return FREE;
        }
        if (h.slot >= positions.size() || generations.get(h.slot) != h.generation) return FREE;
        return positions.get(h.slot);
    }

    private int positionOf(Handle<T> h) {
        int pos = resolve(h);
        checkArgument(pos != FREE, "stale handle: %s", h);
        return pos;
    }

    private Handle<T> handleOf(int pos) {
        int slot = handleAt.get(pos);
        return new Handle<>(id, slot, generations.get(slot));
    }

    /** True if the position and slot tables are mutually inverse and cover every element. */
    boolean tablesConsistent() {
        if (handleAt.size() != n) return false;
        int live = 0;
        for (int slot = 0; slot < positions.size(); ++slot) {
            int pos = positions.get(slot);
            if (pos == FREE) continue;
            ++live;
            if (pos >= n || handleAt.get(pos) != slot) return false;
        }
        return live == n;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("size", n)
                .add("slots", positions.size())
                .add("free", freeSlots.size())
                .add("top", peek().orElse(null))
                .toString();
    }

    /**
     * A cursor on one element, located through its handle on every call. {@link #set} does
     * not reorder the heap; follow it with {@link #reorder}.
     */
    public final class Entry {
        private final Handle<T> handle;

        private Entry(Handle<T> handle) {
            this.handle = handle;
        }

        public Handle<T> handle() { return handle; }

        public T get() { return elt(position()); }

        /** Overwrites the element in place. The heap is not reordered. */
        public void set(T x) {
            a[position()] = checkNotNull(x, "element");
        }

        /** @return true if the element moved */
        public boolean reorder() {
            int pos = position();
            return fixup(pos) != pos;
        }

        /** Removes the element from the heap; the entry and its handle become stale. */
        public T remove() {
            return removeAt(position());
        }

        private int position() {
            int pos = resolve(handle);
            checkState(pos != FREE, "%s is no longer in the heap", handle);
            return pos;
        }

        @Override
        public String toString() {
            int pos = resolve(handle);
            return MoreObjects.toStringHelper("Entry")
                    .add("handle", handle)
                    .add("value", pos == FREE ? null : elt(pos))
                    .toString();
        }
    }
}
