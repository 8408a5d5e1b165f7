package com.example.anchortargets.rpn.util;

import java.util.Random;

/**
 * Seeded permutation helpers. All randomness in the pipeline flows through
 * the {@link Random} passed in here.
 */
public final class RandomPermutations {

    private RandomPermutations() {}

    /**
     * Shuffled copy of {@code values} (Fisher-Yates).
     */
    public static int[] permutation(int[] values, Random rng) {
        int[] shuffled = values.clone();
        for (int i = shuffled.length - 1; i > 0; i--) {
            int j = rng.nextInt(i + 1);
            int tmp = shuffled[i];
            shuffled[i] = shuffled[j];
            shuffled[j] = tmp;
        }
        return shuffled;
    }

    /**
     * Shuffled {@code 0..count-1}.
     */
    public static int[] permutation(int count, Random rng) {
        int[] identity = new int[count];
        for (int i = 0; i < count; i++) {
            identity[i] = i;
        }
        return permutation(identity, rng);
    }

    /**
     * {@code size} distinct elements of {@code pool} drawn uniformly without replacement.
     */
    public static int[] choice(int[] pool, int size, Random rng) {
        if (size < 0 || size > pool.length) {
            throw new IllegalArgumentException(String.format(
                "Cannot draw %d elements without replacement from a pool of %d", size, pool.length));
        }
        int[] work = pool.clone();
        for (int i = 0; i < size; i++) {
            int j = i + rng.nextInt(work.length - i);
            int tmp = work[i];
            work[i] = work[j];
            work[j] = tmp;
        }
        int[] picked = new int[size];
        System.arraycopy(work, 0, picked, 0, size);
        return picked;
    }
}
