package com.example.anchortargets.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-image entry of the anchor database.
 *
 * Created from an {@link ImageRecordInput}, filled in by the labeler with
 * arrays aligned to the in-bounds anchor subset, then expanded in place to the
 * full anchor grid by the unmap step. After unmapping {@link #getLabels()},
 * {@link #getBboxTargets()} and {@link #getMaxOverlapClasses()} have
 * {@link #getTotalAnchors()} rows and the record is treated as read-only.
 */
public class ImageRecord {

    private String imageId;
    private List<Box> gtBoxes = new ArrayList<>();
    private int[] gtClasses = new int[0];
    private ImageShape imageShape;
    private boolean flipped;

    // Filled in by labeling
    private double scale;
    private ImageShape resizedShape;
    private int[] labels;
    private double[][] bboxTargets;
    private int[] maxOverlapClasses;
    private int[] inBoundsIndices;
    private int totalAnchors;
    private boolean unmapped;

    public ImageRecord() {}

    public ImageRecord(String imageId, ImageShape imageShape, List<Box> gtBoxes, int[] gtClasses, boolean flipped) {
        this.imageId = imageId;
        this.imageShape = imageShape;
        this.gtBoxes = new ArrayList<>(gtBoxes);
        this.gtClasses = gtClasses.clone();
        this.flipped = flipped;
    }

    public static ImageRecord from(ImageRecordInput input) {
        int[] classes = input.gtClasses().stream().mapToInt(Integer::intValue).toArray();
        return new ImageRecord(input.imageId(), input.imageShape(), input.gtBoxes(), classes, false);
    }

    public int countLabel(AnchorLabel label) {
        if (labels == null) {
            return 0;
        }
        int count = 0;
        for (int value : labels) {
            if (value == label.value()) {
                count++;
            }
        }
        return count;
    }

    public boolean isLabeled() {
        return labels != null;
    }

    /**
     * Shape used for aspect-ratio grouping: the resized shape once labeled,
     * the raw shape before.
     */
    public ImageShape getEffectiveShape() {
        return resizedShape != null ? resizedShape : imageShape;
    }

    public String getCacheKey() {
        return cacheKey(imageId, flipped);
    }

    public static String cacheKey(String imageId, boolean flipped) {
        return flipped ? imageId + "#flipped" : imageId;
    }

    public String getImageId() { return imageId; }
    public void setImageId(String imageId) { this.imageId = imageId; }

    public List<Box> getGtBoxes() { return gtBoxes; }
    public void setGtBoxes(List<Box> gtBoxes) { this.gtBoxes = gtBoxes; }

    public int[] getGtClasses() { return gtClasses; }
    public void setGtClasses(int[] gtClasses) { this.gtClasses = gtClasses; }

    public ImageShape getImageShape() { return imageShape; }
    public void setImageShape(ImageShape imageShape) { this.imageShape = imageShape; }

    public boolean isFlipped() { return flipped; }
    public void setFlipped(boolean flipped) { this.flipped = flipped; }

    public double getScale() { return scale; }
    public void setScale(double scale) { this.scale = scale; }

    public ImageShape getResizedShape() { return resizedShape; }
    public void setResizedShape(ImageShape resizedShape) { this.resizedShape = resizedShape; }

    public int[] getLabels() { return labels; }
    public void setLabels(int[] labels) { this.labels = labels; }

    public double[][] getBboxTargets() { return bboxTargets; }
    public void setBboxTargets(double[][] bboxTargets) { this.bboxTargets = bboxTargets; }

    public int[] getMaxOverlapClasses() { return maxOverlapClasses; }
    public void setMaxOverlapClasses(int[] maxOverlapClasses) { this.maxOverlapClasses = maxOverlapClasses; }

    public int[] getInBoundsIndices() { return inBoundsIndices; }
    public void setInBoundsIndices(int[] inBoundsIndices) { this.inBoundsIndices = inBoundsIndices; }

    public int getTotalAnchors() { return totalAnchors; }
    public void setTotalAnchors(int totalAnchors) { this.totalAnchors = totalAnchors; }

    public boolean isUnmapped() { return unmapped; }
    public void setUnmapped(boolean unmapped) { this.unmapped = unmapped; }

    @Override
    public String toString() {
        return String.format("ImageRecord{id=%s, flipped=%s, gt=%d, fg=%d, bg=%d, unmapped=%s}",
            imageId, flipped, gtBoxes.size(), countLabel(AnchorLabel.FOREGROUND),
            countLabel(AnchorLabel.BACKGROUND), unmapped);
    }
}
