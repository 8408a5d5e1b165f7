package com.example.anchortargets.controller.dto;

import com.example.anchortargets.model.AnchorLabel;
import com.example.anchortargets.model.ImageRecord;

public record ImageLabelStats(
    String imageId,
    boolean flipped,
    int resizedWidth,
    int resizedHeight,
    double scale,
    int inBounds,
    int foreground,
    int background,
    int ignored
) {

    public static ImageLabelStats of(ImageRecord record) {
        // Ignore count covers both out-of-bounds anchors and in-bounds anchors between thresholds
        return new ImageLabelStats(
            record.getImageId(),
            record.isFlipped(),
            record.getResizedShape().width(),
            record.getResizedShape().height(),
            record.getScale(),
            record.getInBoundsIndices().length,
            record.countLabel(AnchorLabel.FOREGROUND),
            record.countLabel(AnchorLabel.BACKGROUND),
            record.countLabel(AnchorLabel.IGNORE));
    }
}
