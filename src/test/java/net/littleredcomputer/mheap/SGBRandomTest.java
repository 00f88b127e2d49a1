package net.littleredcomputer.mheap;

import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.hamcrest.Matchers.*;
import static org.junit.Assert.assertThat;

public class SGBRandomTest {

    @Test
    public void matchesGbFlip() {
        // Reference values from gb_flip.w in the Stanford GraphBase
        SGBRandom R = new SGBRandom(-314159);
        assertThat(R.nextRand(), is(119318998));
        for (int j = 1; j <= 133; j++) R.nextRand();
        assertThat(R.unifRand(0x55555555), is(748103812));
    }

    @Test
    public void shuffleIsAPermutation() {
        SGBRandom R = new SGBRandom(1009);
        List<Integer> xs = IntStream.range(0, 50).boxed().collect(Collectors.toCollection(ArrayList::new));
        R.shuffle(xs);
        assertThat(xs, hasSize(50));
        assertThat(xs, containsInAnyOrder(IntStream.range(0, 50).boxed().toArray(Integer[]::new)));
    }

    @Test
    public void intsStayInBounds() {
        assertThat(new SGBRandom(7).ints(200, 13), everyItem(both(greaterThanOrEqualTo(0)).and(lessThan(13))));
    }
}
