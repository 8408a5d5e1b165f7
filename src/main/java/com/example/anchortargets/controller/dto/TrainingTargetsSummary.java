package com.example.anchortargets.controller.dto;

import com.example.anchortargets.model.Box;
import com.example.anchortargets.model.TrainingTargets;

import java.util.Arrays;
import java.util.List;

/**
 * Compact view of {@link TrainingTargets}: mask counts instead of the
 * full-canvas arrays.
 */
public record TrainingTargetsSummary(
    String imageId,
    boolean flipped,
    double scale,
    int resizedWidth,
    int resizedHeight,
    int totalAnchors,
    int sampled,
    int requested,
    int labelMaskCount,
    int bboxMaskCount,
    List<Box> scaledGtBoxes,
    int[] gtClasses
) {

    public static TrainingTargetsSummary of(TrainingTargets targets) {
        return new TrainingTargetsSummary(
            targets.getImageId(),
            targets.isFlipped(),
            targets.getScale(),
            targets.getResizedShape().width(),
            targets.getResizedShape().height(),
            targets.getLabels().length,
            targets.getSample().size(),
            targets.getSample().getRequested(),
            Arrays.stream(targets.getLabelMask()).sum(),
            Arrays.stream(targets.getBboxMask()).sum(),
            targets.getScaledGtBoxes(),
            targets.getGtClasses());
    }
}
