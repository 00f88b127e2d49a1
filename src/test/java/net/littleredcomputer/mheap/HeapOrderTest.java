package net.littleredcomputer.mheap;

import org.junit.Test;

import java.util.Comparator;

import static org.hamcrest.Matchers.*;
import static org.junit.Assert.assertThat;

public class HeapOrderTest {

    @Test
    public void naturalDirections() {
        HeapOrder<Integer> max = HeapOrder.max();
        HeapOrder<Integer> min = HeapOrder.min();
        assertThat(max.outranks(5, 3), is(true));
        assertThat(max.outranks(3, 5), is(false));
        assertThat(min.outranks(3, 5), is(true));
        assertThat(min.outranks(5, 3), is(false));
        // Ties never outrank each other.
        assertThat(max.outranks(4, 4), is(false));
        assertThat(min.outranks(4, 4), is(false));
    }

    @Test
    public void reverseSwapsDirection() {
        HeapOrder<String> max = HeapOrder.max();
        assertThat(max.reverse().outranks("a", "b"), is(true));
        assertThat(max.reverse().reverse().outranks("a", "b"), is(false));
    }

    @Test
    public void customComparator() {
        HeapOrder<Integer> byAbs = HeapOrder.max(Comparator.comparingInt((Integer x) -> Math.abs(x)));
        assertThat(byAbs.outranks(-5, 3), is(true));
        HeapOrder<Integer> byAbsMin = HeapOrder.min(Comparator.comparingInt((Integer x) -> Math.abs(x)));
        assertThat(byAbsMin.outranks(1, -3), is(true));
        assertThat(byAbsMin.compare(-2, 2), is(0));
    }

    @Test
    public void byKey() {
        HeapOrder<String> longest = HeapOrder.maxByKey(String::length);
        HeapOrder<String> shortest = HeapOrder.minByKey(String::length);
        assertThat(longest.outranks("abc", "zz"), is(true));
        assertThat(shortest.outranks("zz", "abc"), is(true));
        assertThat(longest.compare("ab", "cd"), is(0));
    }

    @Test
    public void onResultOfComposesWithComparator() {
        HeapOrder<String> caseless = HeapOrder.min(String.CASE_INSENSITIVE_ORDER);
        HeapOrder<StringBuilder> viaToString = caseless.onResultOf(StringBuilder::toString);
        assertThat(viaToString.outranks(new StringBuilder("Apple"), new StringBuilder("banana")), is(true));
        assertThat(viaToString.compare(new StringBuilder("X"), new StringBuilder("x")), is(0));
    }

    @Test(expected = NullPointerException.class)
    public void nullComparatorThrows() {
        HeapOrder.max((Comparator<Integer>) null);
    }

    @Test(expected = NullPointerException.class)
    public void nullKeyThrows() {
        HeapOrder.<Integer>max().onResultOf(null);
    }
}
