package com.example.anchortargets.rpn;

import com.example.anchortargets.config.AnchorTargetSettings;
import com.example.anchortargets.model.AnchorGrid;
import com.example.anchortargets.model.AnchorLabel;
import com.example.anchortargets.model.EpochPlan;
import com.example.anchortargets.model.ImageRecord;
import com.example.anchortargets.model.ImageRecordInput;
import com.example.anchortargets.model.SampleSelection;
import com.example.anchortargets.model.TrainingTargets;
import com.example.anchortargets.rpn.dataset.DatasetSource;
import com.example.anchortargets.rpn.labeling.AnchorLabeler;
import com.example.anchortargets.rpn.labeling.FlipAugmenter;
import com.example.anchortargets.rpn.labeling.SparseRemap;
import com.example.anchortargets.rpn.labeling.TargetNormalizer;
import com.example.anchortargets.rpn.sampling.BalancedSampler;
import com.example.anchortargets.rpn.sampling.BatchOrderer;
import com.example.anchortargets.rpn.sampling.TrainingTargetAssembler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

@Service
public class AnchorTargetServiceImpl implements AnchorTargetService {
    private static final Logger log = LoggerFactory.getLogger(AnchorTargetServiceImpl.class);

    private final AnchorLabeler anchorLabeler;
    private final SparseRemap sparseRemap;
    private final FlipAugmenter flipAugmenter;
    private final TargetNormalizer targetNormalizer;
    private final BalancedSampler balancedSampler;
    private final BatchOrderer batchOrderer;
    private final TrainingTargetAssembler targetAssembler;

    public AnchorTargetServiceImpl(AnchorLabeler anchorLabeler, SparseRemap sparseRemap,
                                   FlipAugmenter flipAugmenter, TargetNormalizer targetNormalizer,
                                   BalancedSampler balancedSampler, BatchOrderer batchOrderer,
                                   TrainingTargetAssembler targetAssembler) {
        this.anchorLabeler = anchorLabeler;
        this.sparseRemap = sparseRemap;
        this.flipAugmenter = flipAugmenter;
        this.targetNormalizer = targetNormalizer;
        this.balancedSampler = balancedSampler;
        this.batchOrderer = batchOrderer;
        this.targetAssembler = targetAssembler;
    }

    @Override
    public List<ImageRecord> buildAnchorDatabase(List<ImageRecordInput> images, AnchorGrid anchorGrid,
                                                 AnchorTargetSettings settings) {
        log.info("Building anchor database: {} images, {} anchors, flipped={}, normalize={}",
            images.size(), anchorGrid.size(), settings.addFlipped(), settings.normalizeTargets());

        List<ImageRecord> records = new ArrayList<>(images.size());
        for (ImageRecordInput input : images) {
            records.add(ImageRecord.from(input));
        }
        if (settings.addFlipped()) {
            records = flipAugmenter.addFlipped(records);
        }

        // 1. label in-bounds anchors
        for (ImageRecord record : records) {
            anchorLabeler.labelRecord(record, anchorGrid, settings);
        }

        // 2. optional class-wise normalization, on the in-bounds arrays
        if (settings.normalizeTargets()) {
            targetNormalizer.normalize(records, settings);
        }

        // 3. expand to the full canvas the network output covers
        long fg = 0;
        long bg = 0;
        for (ImageRecord record : records) {
            sparseRemap.unmapRecord(record);
            fg += record.countLabel(AnchorLabel.FOREGROUND);
            bg += record.countLabel(AnchorLabel.BACKGROUND);
        }

        log.info("Anchor database ready: {} records, {} foreground and {} background anchors in total",
            records.size(), fg, bg);
        return records;
    }

    @Override
    public List<ImageRecord> buildAnchorDatabase(DatasetSource source, AnchorGrid anchorGrid,
                                                 AnchorTargetSettings settings) {
        List<ImageRecordInput> inputs = new ArrayList<>();
        for (String imageId : source.listImageIds()) {
            ImageRecordInput gt = source.loadGroundTruth(imageId);
            inputs.add(new ImageRecordInput(gt.imageId(), source.loadImageSize(imageId),
                gt.gtBoxes(), gt.gtClasses()));
        }
        return buildAnchorDatabase(inputs, anchorGrid, settings);
    }

    @Override
    public SampleSelection sampleTrainingBatch(ImageRecord record, AnchorTargetSettings settings, Random rng) {
        return balancedSampler.sample(record, settings.roisPerImage(), settings.fgFraction(),
            settings.deterministic(), rng);
    }

    @Override
    public TrainingTargets assembleTrainingTargets(ImageRecord record, AnchorTargetSettings settings, Random rng) {
        SampleSelection sample = sampleTrainingBatch(record, settings, rng);
        return targetAssembler.assemble(record, sample);
    }

    @Override
    public EpochPlan planEpoch(List<ImageRecord> records, AnchorTargetSettings settings, Random rng) {
        int[] order = batchOrderer.order(records, settings.shuffle(), settings.aspectRatioGrouping(), rng);
        int batches = batchOrderer.batchesPerEpoch(records.size(), settings.subsetPct(), settings.batchesPerEpoch());
        if (batches > order.length) {
            log.warn("Requested {} batches but only {} records are available; capping", batches, order.length);
            batches = order.length;
        }
        return new EpochPlan(order, batches);
    }
}
