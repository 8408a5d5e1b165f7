package com.example.anchortargets.rpn;

import com.example.anchortargets.config.AnchorTargetSettings;
import com.example.anchortargets.model.AnchorGrid;
import com.example.anchortargets.model.EpochPlan;
import com.example.anchortargets.model.ImageRecord;
import com.example.anchortargets.model.ImageRecordInput;
import com.example.anchortargets.model.SampleSelection;
import com.example.anchortargets.model.TrainingTargets;
import com.example.anchortargets.rpn.dataset.DatasetSource;

import java.util.List;
import java.util.Random;

public interface AnchorTargetService {
    /**
     * Build the labeled anchor database for a set of images
     * @param images Ground truth per image, raw pixel coordinates
     * @param anchorGrid Dense anchor grid shared by all images
     * @param settings Pipeline configuration
     * @return One unmapped record per image, followed by flipped copies when enabled
     */
    List<ImageRecord> buildAnchorDatabase(List<ImageRecordInput> images, AnchorGrid anchorGrid,
                                          AnchorTargetSettings settings);

    /**
     * Build the labeled anchor database for every image of a dataset, in index order
     */
    List<ImageRecord> buildAnchorDatabase(DatasetSource source, AnchorGrid anchorGrid,
                                          AnchorTargetSettings settings);

    /**
     * Draw this iteration's balanced anchor sample from one record
     * @param rng Seeded random source, ignored in deterministic mode
     */
    SampleSelection sampleTrainingBatch(ImageRecord record, AnchorTargetSettings settings, Random rng);

    /**
     * Sample and lay the result out on the full anchor canvas
     */
    TrainingTargets assembleTrainingTargets(ImageRecord record, AnchorTargetSettings settings, Random rng);

    /**
     * Visiting order and batch count for one epoch over the database
     */
    EpochPlan planEpoch(List<ImageRecord> records, AnchorTargetSettings settings, Random rng);
}
