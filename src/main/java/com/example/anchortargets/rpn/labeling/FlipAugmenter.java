package com.example.anchortargets.rpn.labeling;

import com.example.anchortargets.model.Box;
import com.example.anchortargets.model.ImageRecord;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Horizontal-flip augmentation of unlabeled records.
 */
@Component
public class FlipAugmenter {

    /**
     * Mirror of {@code record} across its vertical center line, in raw image
     * coordinates: {@code xMin' = width - xMax - 1}, {@code xMax' = width - xMin - 1}.
     */
    public ImageRecord flip(ImageRecord record) {
        if (record.isLabeled()) {
            throw new IllegalStateException("Flip records before labeling: " + record.getCacheKey());
        }
        int width = record.getImageShape().width();
        List<Box> mirrored = new ArrayList<>(record.getGtBoxes().size());
        for (Box box : record.getGtBoxes()) {
            mirrored.add(new Box(width - box.xMax() - 1, box.yMin(), width - box.xMin() - 1, box.yMax()));
        }
        return new ImageRecord(record.getImageId(), record.getImageShape(), mirrored,
            record.getGtClasses(), !record.isFlipped());
    }

    /**
     * All originals followed by their mirrored copies, in the same order.
     */
    public List<ImageRecord> addFlipped(List<ImageRecord> records) {
        List<ImageRecord> all = new ArrayList<>(records.size() * 2);
        all.addAll(records);
        for (ImageRecord record : records) {
            all.add(flip(record));
        }
        return all;
    }
}
