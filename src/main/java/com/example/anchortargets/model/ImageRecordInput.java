package com.example.anchortargets.model;

import java.util.List;

/**
 * Pre-decoded ground truth for one source image, as delivered by the
 * annotation parser. Boxes are in raw (un-resized) pixel coordinates.
 */
public record ImageRecordInput(String imageId, ImageShape imageShape, List<Box> gtBoxes, List<Integer> gtClasses) {

    public ImageRecordInput {
        if (imageId == null || imageId.isBlank()) {
            throw new IllegalArgumentException("imageId is required");
        }
        if (imageShape == null) {
            throw new IllegalArgumentException("imageShape is required for image " + imageId);
        }
        gtBoxes = gtBoxes == null ? List.of() : List.copyOf(gtBoxes);
        gtClasses = gtClasses == null ? List.of() : List.copyOf(gtClasses);
        if (gtBoxes.size() != gtClasses.size()) {
            throw new IllegalArgumentException(String.format(
                "Image %s has %d gt boxes but %d gt classes", imageId, gtBoxes.size(), gtClasses.size()));
        }
    }
}
