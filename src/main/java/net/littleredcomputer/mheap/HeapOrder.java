package net.littleredcomputer.mheap;

import java.util.Comparator;
import java.util.function.Function;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Decides which of two elements belongs closer to the root of a heap.
 * <p>
 * {@code compare(a, b)} is positive when {@code a} has priority over {@code b}, zero when
 * they are tied and negative when {@code b} has priority. It must be a strict weak ordering:
 * transitive, and stable across repeated calls on unchanged inputs. Ties pop in no
 * particular order.
 * <p>
 * The usual policies come from the static factories:
 * <pre>
 *   HeapOrder.&lt;Integer&gt;max()                  // largest first
 *   HeapOrder.&lt;Integer&gt;min()                  // smallest first
 *   HeapOrder.maxByKey(Task::deadline)      // compare by a projected key
 *   HeapOrder.min(String.CASE_INSENSITIVE_ORDER)
 * </pre>
 */
@FunctionalInterface
public interface HeapOrder<T> {
    int compare(T a, T b);

    /** True if {@code a} must sit above {@code b}. */
    default boolean outranks(T a, T b) {
        return compare(a, b) > 0;
    }

    /** The same policy with priority inverted. */
    default HeapOrder<T> reverse() {
        HeapOrder<T> self = this;
        return (a, b) -> self.compare(b, a);
    }

    /**
     * A policy over {@code U} that projects each element through {@code key} and ranks
     * the keys with this policy.
     */
    default <U> HeapOrder<U> onResultOf(Function<? super U, ? extends T> key) {
        checkNotNull(key, "key");
        HeapOrder<T> self = this;
        return (a, b) -> self.compare(key.apply(a), key.apply(b));
    }

    static <T extends Comparable<? super T>> HeapOrder<T> max() {
        return Comparable::compareTo;
    }

    static <T extends Comparable<? super T>> HeapOrder<T> min() {
        return (a, b) -> b.compareTo(a);
    }

    static <T> HeapOrder<T> max(Comparator<? super T> comparator) {
        checkNotNull(comparator, "comparator");
        return comparator::compare;
    }

    static <T> HeapOrder<T> min(Comparator<? super T> comparator) {
        checkNotNull(comparator, "comparator");
        return (a, b) -> comparator.compare(b, a);
    }

    static <T, K extends Comparable<? super K>> HeapOrder<T> maxByKey(Function<? super T, ? extends K> key) {
        return HeapOrder.<K>max().onResultOf(key);
    }

    static <T, K extends Comparable<? super K>> HeapOrder<T> minByKey(Function<? super T, ? extends K> key) {
        return HeapOrder.<K>min().onResultOf(key);
    }
}
