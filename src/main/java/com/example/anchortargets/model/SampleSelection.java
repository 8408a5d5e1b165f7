package com.example.anchortargets.model;

/**
 * Anchors drawn from one image for one training iteration: foreground picks
 * first, then background picks. Never persisted.
 */
public class SampleSelection {

    private final int[] labels;
    private final double[][] targets;
    private final int[] indices;
    private final int requested;
    private final int foregroundCount;

    public SampleSelection(int[] labels, double[][] targets, int[] indices, int requested, int foregroundCount) {
        if (labels.length != indices.length || targets.length != indices.length) {
            throw new IllegalArgumentException(String.format(
                "Sample arrays must align: %d labels, %d targets, %d indices",
                labels.length, targets.length, indices.length));
        }
        this.labels = labels;
        this.targets = targets;
        this.indices = indices;
        this.requested = requested;
        this.foregroundCount = foregroundCount;
    }

    public int[] getLabels() { return labels; }
    public double[][] getTargets() { return targets; }
    public int[] getIndices() { return indices; }
    public int getRequested() { return requested; }
    public int getForegroundCount() { return foregroundCount; }

    public int getBackgroundCount() {
        return indices.length - foregroundCount;
    }

    public int size() {
        return indices.length;
    }

    /** True when the pools could not fill the requested size. */
    public boolean isShort() {
        return indices.length < requested;
    }

    public int getShortfall() {
        return Math.max(0, requested - indices.length);
    }
}
