package com.example.anchortargets.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Dense, immutable grid of anchor boxes for one feature-map size and stride.
 *
 * Anchors are laid out channel-major to match a CHW convolution output: the
 * anchor type varies slowest, then the row, then the column. The anchor of
 * type {@code k} at cell {@code (x, y)} sits at index
 * {@code k * height * width + y * width + x}.
 */
public class AnchorGrid {

    private final List<Box> anchors;
    private final int gridHeight;
    private final int gridWidth;
    private final int anchorsPerCell;
    private final double stride;

    public AnchorGrid(List<Box> anchors, int gridHeight, int gridWidth, int anchorsPerCell, double stride) {
        if (anchors.size() != gridHeight * gridWidth * anchorsPerCell) {
            throw new IllegalArgumentException(String.format(
                "Anchor count %d does not match grid %dx%d with %d anchors per cell",
                anchors.size(), gridHeight, gridWidth, anchorsPerCell));
        }
        this.anchors = Collections.unmodifiableList(new ArrayList<>(anchors));
        this.gridHeight = gridHeight;
        this.gridWidth = gridWidth;
        this.anchorsPerCell = anchorsPerCell;
        this.stride = stride;
    }

    /**
     * Shifts each base anchor across every cell of a {@code gridHeight x gridWidth}
     * feature map. Base anchors are centered on the first cell; the shift for cell
     * {@code (x, y)} is {@code (x * stride, y * stride)}.
     */
    public static AnchorGrid tile(List<Box> baseAnchors, int gridHeight, int gridWidth, double stride) {
        if (baseAnchors == null || baseAnchors.isEmpty()) {
            throw new IllegalArgumentException("At least one base anchor is required");
        }
        if (gridHeight <= 0 || gridWidth <= 0) {
            throw new IllegalArgumentException(
                String.format("Grid size must be positive, got %dx%d", gridHeight, gridWidth));
        }
        List<Box> all = new ArrayList<>(baseAnchors.size() * gridHeight * gridWidth);
        for (Box base : baseAnchors) {
            for (int y = 0; y < gridHeight; y++) {
                for (int x = 0; x < gridWidth; x++) {
                    all.add(base.shift(x * stride, y * stride));
                }
            }
        }
        return new AnchorGrid(all, gridHeight, gridWidth, baseAnchors.size(), stride);
    }

    public List<Box> getAnchors() {
        return anchors;
    }

    public Box get(int index) {
        return anchors.get(index);
    }

    public int size() {
        return anchors.size();
    }

    public int getGridHeight() {
        return gridHeight;
    }

    public int getGridWidth() {
        return gridWidth;
    }

    public int getAnchorsPerCell() {
        return anchorsPerCell;
    }

    public double getStride() {
        return stride;
    }

    @Override
    public String toString() {
        return String.format("AnchorGrid{%dx%d, k=%d, stride=%.1f, total=%d}",
            gridHeight, gridWidth, anchorsPerCell, stride, anchors.size());
    }
}
