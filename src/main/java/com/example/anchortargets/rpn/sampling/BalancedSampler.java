package com.example.anchortargets.rpn.sampling;

import com.example.anchortargets.model.AnchorLabel;
import com.example.anchortargets.model.ImageRecord;
import com.example.anchortargets.model.SampleSelection;
import com.example.anchortargets.rpn.util.RandomPermutations;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Random;

/**
 * Draws a fixed-size, foreground/background balanced subset of one image's
 * labeled anchors.
 */
@Component
public class BalancedSampler {
    private static final Logger log = LoggerFactory.getLogger(BalancedSampler.class);

    /**
     * Foreground is capped at {@code floor(fgFraction * n)} and by the foreground
     * pool; background fills the rest up to the background pool size. The result
     * holds the foreground picks followed by the background picks and may be
     * shorter than {@code n} when a pool runs dry.
     *
     * @param record        unmapped record
     * @param deterministic take ascending prefixes of each pool instead of random draws
     * @param rng           seeded source, only used when not deterministic
     */
    public SampleSelection sample(ImageRecord record, int n, double fgFraction, boolean deterministic, Random rng) {
        if (!record.isUnmapped()) {
            throw new IllegalStateException("Sampling needs an unmapped record: " + record.getCacheKey());
        }
        if (n < 0) {
            throw new IllegalArgumentException("Sample size must not be negative, got " + n);
        }
        if (fgFraction < 0.0 || fgFraction > 1.0) {
            throw new IllegalArgumentException("fgFraction must be within [0, 1], got " + fgFraction);
        }

        int[] labels = record.getLabels();
        int[] fgPool = indicesWithLabel(labels, AnchorLabel.FOREGROUND);
        int[] bgPool = indicesWithLabel(labels, AnchorLabel.BACKGROUND);

        int numFg = (int) (fgFraction * n);
        int fgCount = Math.min(numFg, fgPool.length);
        int bgCount = Math.min(n - fgCount, bgPool.length);

        int[] fg;
        int[] bg;
        if (deterministic) {
            fg = Arrays.copyOf(fgPool, fgCount);
            bg = Arrays.copyOf(bgPool, bgCount);
        } else {
            if (rng == null) {
                throw new IllegalArgumentException("A random source is required for non-deterministic sampling");
            }
            fg = RandomPermutations.choice(fgPool, fgCount, rng);
            bg = RandomPermutations.choice(bgPool, bgCount, rng);
        }

        int[] indices = new int[fgCount + bgCount];
        System.arraycopy(fg, 0, indices, 0, fgCount);
        System.arraycopy(bg, 0, indices, fgCount, bgCount);

        int[] sampledLabels = new int[indices.length];
        double[][] sampledTargets = new double[indices.length][];
        for (int i = 0; i < indices.length; i++) {
            sampledLabels[i] = labels[indices[i]];
            sampledTargets[i] = record.getBboxTargets()[indices[i]].clone();
        }

        SampleSelection selection = new SampleSelection(sampledLabels, sampledTargets, indices, n, fgCount);
        if (selection.isShort()) {
            log.warn("Image {}: sampled {} of {} anchors (fg pool {}, bg pool {})",
                record.getCacheKey(), selection.size(), n, fgPool.length, bgPool.length);
        }
        return selection;
    }

    private static int[] indicesWithLabel(int[] labels, AnchorLabel label) {
        int[] found = new int[labels.length];
        int count = 0;
        for (int i = 0; i < labels.length; i++) {
            if (labels[i] == label.value()) {
                found[count++] = i;
            }
        }
        return Arrays.copyOf(found, count);
    }
}
