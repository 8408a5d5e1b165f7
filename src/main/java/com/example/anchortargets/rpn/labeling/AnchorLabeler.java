package com.example.anchortargets.rpn.labeling;

import com.example.anchortargets.config.AnchorTargetSettings;
import com.example.anchortargets.model.AnchorGrid;
import com.example.anchortargets.model.AnchorLabel;
import com.example.anchortargets.model.Box;
import com.example.anchortargets.model.ImageRecord;
import com.example.anchortargets.model.OverlapMatrix;
import com.example.anchortargets.model.ScaleShape;
import com.example.anchortargets.rpn.geometry.AnchorFilter;
import com.example.anchortargets.rpn.geometry.GeometryOverlap;
import com.example.anchortargets.rpn.geometry.RegressionTargetCoder;
import com.example.anchortargets.rpn.geometry.ScaleShapeResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Assigns foreground / background / ignore labels and regression targets to
 * the in-bounds anchors of one image.
 *
 * Order of assignment:
 * 1. every anchor starts as IGNORE
 * 2. BACKGROUND where the best overlap with any gt box is below the negative threshold
 * 3. FOREGROUND for every anchor that reaches some gt box's best overlap, ties included
 * 4. FOREGROUND where the best overlap reaches the positive threshold
 *
 * Later steps overwrite earlier ones, so foreground always beats background.
 */
@Service
public class AnchorLabeler {
    private static final Logger log = LoggerFactory.getLogger(AnchorLabeler.class);

    private final GeometryOverlap geometryOverlap;
    private final AnchorFilter anchorFilter;
    private final RegressionTargetCoder targetCoder;
    private final ScaleShapeResolver scaleShapeResolver;

    public AnchorLabeler(GeometryOverlap geometryOverlap, AnchorFilter anchorFilter,
                         RegressionTargetCoder targetCoder, ScaleShapeResolver scaleShapeResolver) {
        this.geometryOverlap = geometryOverlap;
        this.anchorFilter = anchorFilter;
        this.targetCoder = targetCoder;
        this.scaleShapeResolver = scaleShapeResolver;
    }

    /**
     * Labels one image record in place. The stored arrays are aligned to the
     * in-bounds anchors; {@link SparseRemap#unmapRecord} expands them afterwards.
     */
    public ImageRecord labelRecord(ImageRecord record, AnchorGrid grid, AnchorTargetSettings settings) {
        if (record.isUnmapped()) {
            throw new IllegalStateException("Record " + record.getCacheKey() + " is already unmapped");
        }
        ScaleShape scaleShape = scaleShapeResolver.resolve(record.getImageShape(), settings.minSize(), settings.maxSize());

        int[] inside = anchorFilter.inside(grid.getAnchors(), scaleShape.shape());
        List<Box> anchors = anchorFilter.gather(grid.getAnchors(), inside);
        List<Box> scaledGt = record.getGtBoxes().stream()
            .map(box -> box.scale(scaleShape.scale()))
            .collect(Collectors.toList());

        AnchorLabels result = label(anchors, scaledGt, record.getGtClasses(), settings);

        record.setScale(scaleShape.scale());
        record.setResizedShape(scaleShape.shape());
        record.setInBoundsIndices(inside);
        record.setTotalAnchors(grid.size());
        record.setLabels(result.labels());
        record.setBboxTargets(result.bboxTargets());
        record.setMaxOverlapClasses(result.maxOverlapClasses());

        if (log.isDebugEnabled()) {
            log.debug("Image {}: shape {} scale {}, {} of {} anchors inside, fg={} bg={}",
                record.getCacheKey(), scaleShape.shape(), scaleShape.scale(), inside.length, grid.size(),
                record.countLabel(AnchorLabel.FOREGROUND), record.countLabel(AnchorLabel.BACKGROUND));
        }
        return record;
    }

    /**
     * Labels a set of anchors against ground-truth boxes that are already in
     * the same (resized) coordinate frame.
     */
    public AnchorLabels label(List<Box> anchors, List<Box> gtBoxes, int[] gtClasses, AnchorTargetSettings settings) {
        if (gtClasses.length != gtBoxes.size()) {
            throw new IllegalArgumentException(String.format(
                "gt classes (%d) must align with gt boxes (%d)", gtClasses.length, gtBoxes.size()));
        }
        int count = anchors.size();
        int[] labels = new int[count];
        double[][] targets = new double[count][4];
        int[] classes = new int[count];
        int[] matched = new int[count];
        Arrays.fill(labels, AnchorLabel.IGNORE.value());

        if (gtBoxes.isEmpty()) {
            // No columns to reduce over: every anchor counts as below the negative threshold
            Arrays.fill(labels, AnchorLabel.BACKGROUND.value());
            Arrays.fill(matched, -1);
            return new AnchorLabels(labels, targets, classes, matched);
        }

        OverlapMatrix overlaps = geometryOverlap.overlap(anchors, gtBoxes);
        float[] rowMax = overlaps.rowMax();
        int[] rowArgMax = overlaps.rowArgMax();
        float[] colMax = overlaps.colMax();
        float negative = (float) settings.negativeOverlap();
        float positive = (float) settings.positiveOverlap();

        for (int i = 0; i < count; i++) {
            if (rowMax[i] < negative) {
                labels[i] = AnchorLabel.BACKGROUND.value();
            }
        }

        for (int i = 0; i < count; i++) {
            for (int g = 0; g < overlaps.getCols(); g++) {
                if (overlaps.get(i, g) == colMax[g]) {
                    labels[i] = AnchorLabel.FOREGROUND.value();
                    break;
                }
            }
        }

        for (int i = 0; i < count; i++) {
            if (rowMax[i] >= positive) {
                labels[i] = AnchorLabel.FOREGROUND.value();
            }
        }

        // Targets are kept for every anchor; only foreground rows are consumed later
        for (int i = 0; i < count; i++) {
            int g = rowArgMax[i];
            targets[i] = targetCoder.encode(anchors.get(i), gtBoxes.get(g));
            classes[i] = gtClasses[g];
            matched[i] = g;
        }

        return new AnchorLabels(labels, targets, classes, matched);
    }
}
