package com.example.anchortargets.config;

import com.example.anchortargets.model.Box;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Anchor target pipeline settings bound from {@code anchors.*} properties.
 * Components never read this bean directly; they receive the immutable
 * {@link AnchorTargetSettings} produced by {@link #toSettings()}.
 */
@Configuration
@ConfigurationProperties(prefix = "anchors")
public class AnchorTargetProperties {

    /**
     * Image resizing
     */
    private int minSize = 600;
    private int maxSize = 1000;

    /**
     * Labeling thresholds
     */
    private double negativeOverlap = 0.3;
    private double positiveOverlap = 0.7;

    /**
     * Per-iteration sampling
     */
    private int roisPerImage = 256;
    private double fgFraction = 0.5;
    private boolean deterministic = false;

    /**
     * Epoch ordering
     */
    private boolean shuffle = true;
    private boolean aspectRatioGrouping = true;
    private int subsetPct = 100;
    private int batchesPerEpoch = 0;

    /**
     * Database construction
     */
    private boolean addFlipped = false;

    private Normalization normalization = new Normalization();
    private Grid grid = new Grid();

    public AnchorTargetSettings toSettings() {
        return new AnchorTargetSettings(
            minSize, maxSize,
            negativeOverlap, positiveOverlap,
            roisPerImage, fgFraction, deterministic,
            shuffle, aspectRatioGrouping, subsetPct, batchesPerEpoch,
            addFlipped,
            normalization.isEnabled(), normalization.isPrecomputed(),
            toArray(normalization.getMeans()), toArray(normalization.getStds()));
    }

    private static double[] toArray(List<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).toArray();
    }

    // Getters and setters
    public int getMinSize() { return minSize; }
    public void setMinSize(int minSize) { this.minSize = minSize; }

    public int getMaxSize() { return maxSize; }
    public void setMaxSize(int maxSize) { this.maxSize = maxSize; }

    public double getNegativeOverlap() { return negativeOverlap; }
    public void setNegativeOverlap(double negativeOverlap) { this.negativeOverlap = negativeOverlap; }

    public double getPositiveOverlap() { return positiveOverlap; }
    public void setPositiveOverlap(double positiveOverlap) { this.positiveOverlap = positiveOverlap; }

    public int getRoisPerImage() { return roisPerImage; }
    public void setRoisPerImage(int roisPerImage) { this.roisPerImage = roisPerImage; }

    public double getFgFraction() { return fgFraction; }
    public void setFgFraction(double fgFraction) { this.fgFraction = fgFraction; }

    public boolean isDeterministic() { return deterministic; }
    public void setDeterministic(boolean deterministic) { this.deterministic = deterministic; }

    public boolean isShuffle() { return shuffle; }
    public void setShuffle(boolean shuffle) { this.shuffle = shuffle; }

    public boolean isAspectRatioGrouping() { return aspectRatioGrouping; }
    public void setAspectRatioGrouping(boolean aspectRatioGrouping) { this.aspectRatioGrouping = aspectRatioGrouping; }

    public int getSubsetPct() { return subsetPct; }
    public void setSubsetPct(int subsetPct) { this.subsetPct = subsetPct; }

    public int getBatchesPerEpoch() { return batchesPerEpoch; }
    public void setBatchesPerEpoch(int batchesPerEpoch) { this.batchesPerEpoch = batchesPerEpoch; }

    public boolean isAddFlipped() { return addFlipped; }
    public void setAddFlipped(boolean addFlipped) { this.addFlipped = addFlipped; }


    public Normalization getNormalization() { return normalization; }
    public void setNormalization(Normalization normalization) { this.normalization = normalization; }

    public Grid getGrid() { return grid; }
    public void setGrid(Grid grid) { this.grid = grid; }

    /**
     * Class-wise regression target normalization
     */
    public static class Normalization {
        private boolean enabled = false;
        private boolean precomputed = true;
        private List<Double> means = new ArrayList<>(Arrays.asList(0.0, 0.0, 0.0, 0.0));
        private List<Double> stds = new ArrayList<>(Arrays.asList(0.1, 0.1, 0.2, 0.2));

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public boolean isPrecomputed() { return precomputed; }
        public void setPrecomputed(boolean precomputed) { this.precomputed = precomputed; }

        public List<Double> getMeans() { return means; }
        public void setMeans(List<Double> means) { this.means = means; }

        public List<Double> getStds() { return stds; }
        public void setStds(List<Double> stds) { this.stds = stds; }
    }

    /**
     * Dense anchor grid geometry. Base anchors are "xMin,yMin,xMax,yMax" strings
     * centered on the first feature cell.
     */
    public static class Grid {
        private double featureScale = 1.0 / 16;
        private int convSize = 0;
        private List<String> baseAnchors = new ArrayList<>(Arrays.asList(
            "-84,-40,99,55", "-176,-88,191,103", "-360,-184,375,199",
            "-56,-56,71,71", "-120,-120,135,135", "-248,-248,263,263",
            "-36,-80,51,95", "-80,-168,95,183", "-168,-344,183,359"));

        public double getFeatureScale() { return featureScale; }
        public void setFeatureScale(double featureScale) { this.featureScale = featureScale; }

        public int getConvSize() { return convSize; }
        public void setConvSize(int convSize) { this.convSize = convSize; }

        public List<String> getBaseAnchors() { return baseAnchors; }
        public void setBaseAnchors(List<String> baseAnchors) { this.baseAnchors = baseAnchors; }

        /** Feature map side; derived from the max image side when not set. */
        public int resolveConvSize(int maxImageSize) {
            return convSize > 0 ? convSize : (int) Math.floor(maxImageSize * featureScale);
        }

        public double getStride() {
            return 1.0 / featureScale;
        }

        public List<Box> parseBaseAnchors() {
            List<Box> boxes = new ArrayList<>();
            for (String value : baseAnchors) {
                String[] parts = value.split(",");
                if (parts.length != 4) {
                    throw new IllegalArgumentException("Base anchor must have 4 comma-separated values: " + value);
                }
                double[] coords = new double[4];
                for (int i = 0; i < 4; i++) {
                    coords[i] = Double.parseDouble(parts[i].trim());
                }
                boxes.add(Box.fromArray(coords));
            }
            return boxes;
        }
    }
}
