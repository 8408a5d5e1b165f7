package com.example.anchortargets.rpn.sampling;

import com.example.anchortargets.model.ImageRecord;
import com.example.anchortargets.model.ImageShape;
import com.example.anchortargets.rpn.util.RandomPermutations;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Image visiting order for an epoch.
 *
 * With aspect grouping the order looks like {@code [H, H, V, V, H, H, H, H, V, V]}:
 * horizontal ({@code width >= height}) and vertical images are each shuffled,
 * concatenated, cut into adjacent pairs, and the pairs are shuffled.
 */
@Component
public class BatchOrderer {

    public int[] order(List<ImageRecord> records, boolean shuffle, boolean groupByAspect, Random rng) {
        List<ImageShape> shapes = new ArrayList<>(records.size());
        for (ImageRecord record : records) {
            shapes.add(record.getEffectiveShape());
        }
        return orderShapes(shapes, shuffle, groupByAspect, rng);
    }

    public int[] orderShapes(List<ImageShape> shapes, boolean shuffle, boolean groupByAspect, Random rng) {
        int count = shapes.size();
        if (!shuffle) {
            int[] identity = new int[count];
            for (int i = 0; i < count; i++) {
                identity[i] = i;
            }
            return identity;
        }
        if (rng == null) {
            throw new IllegalArgumentException("A random source is required to shuffle the epoch order");
        }
        if (!groupByAspect) {
            return RandomPermutations.permutation(count, rng);
        }
        return groupedByAspect(shapes, rng);
    }

    private int[] groupedByAspect(List<ImageShape> shapes, Random rng) {
        List<Integer> horizontal = new ArrayList<>();
        List<Integer> vertical = new ArrayList<>();
        for (int i = 0; i < shapes.size(); i++) {
            if (shapes.get(i).isHorizontal()) {
                horizontal.add(i);
            } else {
                vertical.add(i);
            }
        }

        int[] horz = RandomPermutations.permutation(toArray(horizontal), rng);
        int[] vert = RandomPermutations.permutation(toArray(vertical), rng);
        int[] concatenated = new int[horz.length + vert.length];
        System.arraycopy(horz, 0, concatenated, 0, horz.length);
        System.arraycopy(vert, 0, concatenated, horz.length, vert.length);

        // An odd total leaves the last element as a group of one
        int groups = (concatenated.length + 1) / 2;
        int[] groupOrder = RandomPermutations.permutation(groups, rng);

        int[] order = new int[concatenated.length];
        int pos = 0;
        for (int group : groupOrder) {
            int start = group * 2;
            int end = Math.min(start + 2, concatenated.length);
            for (int i = start; i < end; i++) {
                order[pos++] = concatenated[i];
            }
        }
        return order;
    }

    /**
     * Batches in one epoch: an explicit count wins, otherwise the
     * {@code subsetPct} share of all entries (one image per batch).
     */
    public int batchesPerEpoch(int entries, int subsetPct, int explicitBatches) {
        if (subsetPct <= 0 || subsetPct > 100) {
            throw new IllegalArgumentException("subsetPct must be between 0 and 100, got " + subsetPct);
        }
        if (explicitBatches > 0) {
            return explicitBatches;
        }
        return (int) ((double) entries * subsetPct / 100);
    }

    private static int[] toArray(List<Integer> values) {
        return values.stream().mapToInt(Integer::intValue).toArray();
    }
}
