package com.example.anchortargets.rpn.labeling;

/**
 * Labeling result for the in-bounds anchor subset of one image. Row {@code i}
 * of every array refers to the anchor at {@code inBoundsIndices[i]} of the
 * full grid; {@code matchedGt[i]} is the ground-truth index with the highest
 * overlap, or -1 when the image has no ground truth.
 */
public record AnchorLabels(int[] labels, double[][] bboxTargets, int[] maxOverlapClasses, int[] matchedGt) {

    public int size() {
        return labels.length;
    }
}
