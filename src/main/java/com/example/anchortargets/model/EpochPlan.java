package com.example.anchortargets.model;

/**
 * Image visiting order for one epoch and how many batches of it are used.
 */
public record EpochPlan(int[] order, int batches) {

    public int imageAt(int batchIndex) {
        if (batchIndex < 0 || batchIndex >= batches) {
            throw new IllegalArgumentException(
                String.format("Batch index %d outside epoch of %d batches", batchIndex, batches));
        }
        return order[batchIndex];
    }
}
