package com.example.anchortargets.rpn.labeling;

import com.example.anchortargets.model.AnchorLabel;
import com.example.anchortargets.model.ImageRecord;
import org.springframework.stereotype.Component;

import java.util.Arrays;

/**
 * Scatters arrays computed over a subset of anchors back onto the full grid.
 * Each {@code unmap} is the inverse of gathering {@code full[indices]}.
 */
@Component
public class SparseRemap {

    public int[] unmap(int[] values, int total, int[] indices, int fill) {
        checkLayout(values.length, total, indices);
        int[] full = new int[total];
        Arrays.fill(full, fill);
        for (int i = 0; i < indices.length; i++) {
            full[indices[i]] = values[i];
        }
        return full;
    }

    public double[] unmap(double[] values, int total, int[] indices, double fill) {
        checkLayout(values.length, total, indices);
        double[] full = new double[total];
        Arrays.fill(full, fill);
        for (int i = 0; i < indices.length; i++) {
            full[indices[i]] = values[i];
        }
        return full;
    }

    /**
     * Row-wise variant for multi-column arrays such as regression targets.
     * Filled rows get {@code fill} in every column.
     */
    public double[][] unmapRows(double[][] values, int total, int[] indices, double fill) {
        checkLayout(values.length, total, indices);
        int columns = values.length > 0 ? values[0].length : 4;
        double[][] full = new double[total][];
        for (int r = 0; r < total; r++) {
            full[r] = new double[columns];
            Arrays.fill(full[r], fill);
        }
        for (int i = 0; i < indices.length; i++) {
            if (values[i].length != columns) {
                throw new IllegalArgumentException(String.format(
                    "Row %d has %d columns, expected %d", i, values[i].length, columns));
            }
            full[indices[i]] = values[i].clone();
        }
        return full;
    }

    public int[] gather(int[] full, int[] indices) {
        int[] subset = new int[indices.length];
        for (int i = 0; i < indices.length; i++) {
            checkIndex(indices[i], full.length);
            subset[i] = full[indices[i]];
        }
        return subset;
    }

    public double[][] gatherRows(double[][] full, int[] indices) {
        double[][] subset = new double[indices.length][];
        for (int i = 0; i < indices.length; i++) {
            checkIndex(indices[i], full.length);
            subset[i] = full[indices[i]].clone();
        }
        return subset;
    }

    /**
     * Expands a labeled record to the full grid: labels fill with IGNORE,
     * targets and classes with 0. The in-bounds indices stay on the record.
     */
    public ImageRecord unmapRecord(ImageRecord record) {
        if (record.isUnmapped()) {
            throw new IllegalStateException("Record " + record.getCacheKey() + " is already unmapped");
        }
        if (!record.isLabeled()) {
            throw new IllegalStateException("Record " + record.getCacheKey() + " has not been labeled");
        }
        int total = record.getTotalAnchors();
        int[] indices = record.getInBoundsIndices();
        record.setLabels(unmap(record.getLabels(), total, indices, AnchorLabel.IGNORE.value()));
        record.setBboxTargets(unmapRows(record.getBboxTargets(), total, indices, 0.0));
        record.setMaxOverlapClasses(unmap(record.getMaxOverlapClasses(), total, indices, 0));
        record.setUnmapped(true);
        return record;
    }

    private static void checkLayout(int valueCount, int total, int[] indices) {
        if (valueCount != indices.length) {
            throw new IllegalArgumentException(String.format(
                "Value count %d does not match index count %d", valueCount, indices.length));
        }
        if (indices.length > total) {
            throw new IllegalArgumentException(String.format(
                "Index count %d exceeds total size %d", indices.length, total));
        }
        for (int index : indices) {
            checkIndex(index, total);
        }
    }

    private static void checkIndex(int index, int total) {
        if (index < 0 || index >= total) {
            throw new IllegalArgumentException(String.format("Index %d out of range [0, %d)", index, total));
        }
    }
}
