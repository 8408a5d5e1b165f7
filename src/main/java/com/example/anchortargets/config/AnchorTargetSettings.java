package com.example.anchortargets.config;

/**
 * Immutable snapshot of the pipeline configuration, passed into every
 * component call.
 */
public record AnchorTargetSettings(
    int minSize,
    int maxSize,
    double negativeOverlap,
    double positiveOverlap,
    int roisPerImage,
    double fgFraction,
    boolean deterministic,
    boolean shuffle,
    boolean aspectRatioGrouping,
    int subsetPct,
    int batchesPerEpoch,
    boolean addFlipped,
    boolean normalizeTargets,
    boolean normalizationPrecomputed,
    double[] normalizationMeans,
    double[] normalizationStds
) {

    public AnchorTargetSettings {
        if (minSize <= 0 || maxSize <= 0) {
            throw new IllegalArgumentException(
                String.format("minSize and maxSize must be positive, got %d and %d", minSize, maxSize));
        }
        if (negativeOverlap > positiveOverlap) {
            throw new IllegalArgumentException(String.format(
                "negativeOverlap %.3f must not exceed positiveOverlap %.3f", negativeOverlap, positiveOverlap));
        }
        if (fgFraction < 0.0 || fgFraction > 1.0) {
            throw new IllegalArgumentException("fgFraction must be within [0, 1], got " + fgFraction);
        }
        if (roisPerImage < 0) {
            throw new IllegalArgumentException("roisPerImage must not be negative, got " + roisPerImage);
        }
        if (subsetPct <= 0 || subsetPct > 100) {
            throw new IllegalArgumentException("subsetPct must be between 0 and 100, got " + subsetPct);
        }
        if (normalizationMeans.length != 4 || normalizationStds.length != 4) {
            throw new IllegalArgumentException("Normalization means and stds need exactly 4 components each");
        }
        normalizationMeans = normalizationMeans.clone();
        normalizationStds = normalizationStds.clone();
    }

    public static AnchorTargetSettings defaults() {
        return new AnchorTargetProperties().toSettings();
    }

    public AnchorTargetSettings withAddFlipped(boolean flipped) {
        return new AnchorTargetSettings(minSize, maxSize, negativeOverlap, positiveOverlap, roisPerImage,
            fgFraction, deterministic, shuffle, aspectRatioGrouping, subsetPct, batchesPerEpoch, flipped,
            normalizeTargets, normalizationPrecomputed, normalizationMeans, normalizationStds);
    }

    public AnchorTargetSettings withDeterministic(boolean deterministicSampling) {
        return new AnchorTargetSettings(minSize, maxSize, negativeOverlap, positiveOverlap, roisPerImage,
            fgFraction, deterministicSampling, shuffle, aspectRatioGrouping, subsetPct, batchesPerEpoch, addFlipped,
            normalizeTargets, normalizationPrecomputed, normalizationMeans, normalizationStds);
    }

    @Override
    public double[] normalizationMeans() {
        return normalizationMeans.clone();
    }

    @Override
    public double[] normalizationStds() {
        return normalizationStds.clone();
    }
}
