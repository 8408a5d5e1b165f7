package com.example.anchortargets.model;

import java.util.List;

/**
 * Full-canvas supervision for one iteration, every array sized to the anchor
 * grid, plus the image metadata the proposal stage needs.
 */
public class TrainingTargets {

    private final String imageId;
    private final boolean flipped;
    private final int[] labels;
    private final int[] labelMask;
    private final double[][] bboxTargets;
    private final int[] bboxMask;
    private final double scale;
    private final ImageShape resizedShape;
    private final List<Box> scaledGtBoxes;
    private final int[] gtClasses;
    private final SampleSelection sample;

    public TrainingTargets(String imageId, boolean flipped, int[] labels, int[] labelMask,
                           double[][] bboxTargets, int[] bboxMask, double scale, ImageShape resizedShape,
                           List<Box> scaledGtBoxes, int[] gtClasses, SampleSelection sample) {
        this.imageId = imageId;
        this.flipped = flipped;
        this.labels = labels;
        this.labelMask = labelMask;
        this.bboxTargets = bboxTargets;
        this.bboxMask = bboxMask;
        this.scale = scale;
        this.resizedShape = resizedShape;
        this.scaledGtBoxes = List.copyOf(scaledGtBoxes);
        this.gtClasses = gtClasses;
        this.sample = sample;
    }

    public String getImageId() { return imageId; }
    public boolean isFlipped() { return flipped; }
    public int[] getLabels() { return labels; }
    public int[] getLabelMask() { return labelMask; }
    public double[][] getBboxTargets() { return bboxTargets; }

    /** One flag per anchor; applies to all four target components of that anchor. */
    public int[] getBboxMask() { return bboxMask; }

    public double getScale() { return scale; }
    public ImageShape getResizedShape() { return resizedShape; }
    public List<Box> getScaledGtBoxes() { return scaledGtBoxes; }
    public int[] getGtClasses() { return gtClasses; }
    public SampleSelection getSample() { return sample; }
}
