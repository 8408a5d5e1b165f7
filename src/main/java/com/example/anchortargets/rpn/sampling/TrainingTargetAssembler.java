package com.example.anchortargets.rpn.sampling;

import com.example.anchortargets.model.AnchorLabel;
import com.example.anchortargets.model.Box;
import com.example.anchortargets.model.ImageRecord;
import com.example.anchortargets.model.SampleSelection;
import com.example.anchortargets.model.TrainingTargets;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Lays one iteration's sample out on the full anchor canvas, in the shape a
 * region-proposal loss consumes it.
 */
@Component
public class TrainingTargetAssembler {

    public TrainingTargets assemble(ImageRecord record, SampleSelection sample) {
        if (!record.isUnmapped()) {
            throw new IllegalStateException("Training targets need an unmapped record: " + record.getCacheKey());
        }
        int total = record.getTotalAnchors();
        int[] labels = new int[total];
        int[] labelMask = new int[total];
        int[] bboxMask = new int[total];

        int[] indices = sample.getIndices();
        int[] sampledLabels = sample.getLabels();
        for (int i = 0; i < indices.length; i++) {
            labels[indices[i]] = sampledLabels[i];
            labelMask[indices[i]] = 1;
        }
        for (int a = 0; a < total; a++) {
            if (labels[a] == AnchorLabel.FOREGROUND.value()) {
                bboxMask[a] = 1;
            }
        }

        // Full targets rather than only the sampled rows; the mask selects what is used
        double[][] source = record.getBboxTargets();
        double[][] bboxTargets = new double[total][];
        for (int a = 0; a < total; a++) {
            bboxTargets[a] = source[a].clone();
        }

        List<Box> scaledGt = new ArrayList<>(record.getGtBoxes().size());
        for (Box box : record.getGtBoxes()) {
            scaledGt.add(box.scale(record.getScale()));
        }

        return new TrainingTargets(record.getImageId(), record.isFlipped(), labels, labelMask, bboxTargets,
            bboxMask, record.getScale(), record.getResizedShape(), scaledGt, record.getGtClasses().clone(), sample);
    }
}
