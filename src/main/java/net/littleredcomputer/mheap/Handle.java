package net.littleredcomputer.mheap;

import com.google.common.base.MoreObjects;

/**
 * An opaque reference to one element of an {@link IndexableHeap}, returned by
 * {@link IndexableHeap#push}. It keeps naming the same element however the heap reorders
 * itself, and stops resolving once that element is popped or removed. The storage slot behind
 * a dead handle may be reused, but the new occupant gets a newer generation, so the dead
 * handle never resolves to it.
 * <p>
 * Handles are plain values: holding one does not keep its element in the heap.
 */
public final class Handle<T> {
    final long heapId;
    final int slot;
    final int generation;

    Handle(long heapId, int slot, int generation) {
        this.heapId = heapId;
        this.slot = slot;
        this.generation = generation;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Handle)) return false;
        Handle<?> h = (Handle<?>) o;
        return heapId == h.heapId && slot == h.slot && generation == h.generation;
    }

    @Override
    public int hashCode() {
        return (Long.hashCode(heapId) * 31 + slot) * 31 + generation;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper("Handle")
                .add("heap", heapId)
                .add("slot", slot)
                .add("generation", generation)
                .toString();
    }
}
