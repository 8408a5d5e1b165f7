package com.example.anchortargets.rpn.util;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class RandomPermutationsTest {

    @Test
    void testPermutationKeepsElements() {
        int[] values = {3, 9, 27, 81, 243};

        int[] shuffled = RandomPermutations.permutation(values, new Random(7));

        int[] sorted = shuffled.clone();
        Arrays.sort(sorted);
        assertArrayEquals(values, sorted);
        assertArrayEquals(new int[] {3, 9, 27, 81, 243}, values, "input must not be modified");
    }

    @Test
    void testPermutationIsSeedReproducible() {
        assertArrayEquals(RandomPermutations.permutation(50, new Random(99)),
            RandomPermutations.permutation(50, new Random(99)));
    }

    @Test
    void testChoiceDrawsDistinctPoolMembers() {
        int[] pool = {10, 20, 30, 40, 50, 60};

        int[] picked = RandomPermutations.choice(pool, 4, new Random(1));

        Set<Integer> seen = new HashSet<>();
        for (int value : picked) {
            assertTrue(Arrays.stream(pool).anyMatch(p -> p == value));
            assertTrue(seen.add(value));
        }
        assertEquals(4, picked.length);
    }

    @Test
    void testChoiceOfWholePoolAndOfNothing() {
        int[] pool = {1, 2, 3};

        int[] all = RandomPermutations.choice(pool, 3, new Random(2));
        Arrays.sort(all);

        assertArrayEquals(pool, all);
        assertEquals(0, RandomPermutations.choice(pool, 0, new Random(2)).length);
    }

    @Test
    void testChoiceLargerThanPoolIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> RandomPermutations.choice(new int[] {1}, 2, new Random()));
    }
}
