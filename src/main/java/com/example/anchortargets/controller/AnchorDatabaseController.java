package com.example.anchortargets.controller;

import com.example.anchortargets.api.ApiResponse;
import com.example.anchortargets.config.AnchorTargetSettings;
import com.example.anchortargets.controller.dto.BuildDatabaseRequest;
import com.example.anchortargets.controller.dto.DatabaseSummary;
import com.example.anchortargets.controller.dto.ImageAnnotation;
import com.example.anchortargets.controller.dto.ImageLabelStats;
import com.example.anchortargets.controller.dto.TrainingTargetsSummary;
import com.example.anchortargets.model.AnchorGrid;
import com.example.anchortargets.model.EpochPlan;
import com.example.anchortargets.model.ImageRecord;
import com.example.anchortargets.model.ImageRecordInput;
import com.example.anchortargets.model.SampleSelection;
import com.example.anchortargets.model.TrainingTargets;
import com.example.anchortargets.rpn.AnchorTargetService;
import com.example.anchortargets.rpn.dataset.InMemoryDatasetSource;
import com.example.anchortargets.rpn.util.ImageRecordCache;
import com.example.anchortargets.service.I18nService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Random;

@RestController
@RequestMapping("/api/anchors")
public class AnchorDatabaseController {
    private static final Logger log = LoggerFactory.getLogger(AnchorDatabaseController.class);

    @Autowired
    private AnchorTargetService anchorTargetService;

    @Autowired
    private AnchorGrid anchorGrid;

    @Autowired
    private AnchorTargetSettings settings;

    @Autowired
    private ImageRecordCache imageRecordCache;

    @Autowired
    private I18nService i18nService;

    /**
     * Label every posted image against the anchor grid and cache the records
     * POST /api/anchors/database
     */
    @PostMapping("/database")
    public ResponseEntity<ApiResponse<DatabaseSummary>> buildDatabase(
            @RequestBody BuildDatabaseRequest request,
            @RequestHeader(value = "Accept-Language", required = false) String acceptLanguage) {

        if (request.getImages() == null || request.getImages().isEmpty()) {
            throw new IllegalArgumentException("At least one image annotation is required");
        }

        InMemoryDatasetSource source = new InMemoryDatasetSource();
        for (ImageAnnotation annotation : request.getImages()) {
            ImageRecordInput input = annotation.toInput();
            source.add(input);
        }

        AnchorTargetSettings effective = request.getAddFlipped() != null
            ? settings.withAddFlipped(request.getAddFlipped())
            : settings;

        List<ImageRecord> records = anchorTargetService.buildAnchorDatabase(source, anchorGrid, effective);
        imageRecordCache.replaceAll(records);

        List<ImageLabelStats> stats = new ArrayList<>(records.size());
        for (ImageRecord record : records) {
            stats.add(ImageLabelStats.of(record));
        }
        DatabaseSummary summary = new DatabaseSummary(records.size(), anchorGrid.size(), stats);

        String message = i18nService.getMessage("database.built", i18nService.resolveLanguage(acceptLanguage));
        return ResponseEntity.ok(ApiResponse.ok(message, summary));
    }

    /**
     * Draw one iteration's anchor sample for a cached image
     * GET /api/anchors/database/{imageId}/sample?seed=7&flipped=false
     */
    @GetMapping("/database/{imageId}/sample")
    public ResponseEntity<ApiResponse<SampleSelection>> sample(
            @PathVariable String imageId,
            @RequestParam(required = false) Long seed,
            @RequestParam(defaultValue = "false") boolean flipped,
            @RequestHeader(value = "Accept-Language", required = false) String acceptLanguage) {

        ImageRecord record = requireRecord(imageId, flipped);
        SampleSelection selection = anchorTargetService.sampleTrainingBatch(record, settings, randomFor(seed));

        String key = selection.isShort() ? "sample.short" : "sample.drawn";
        String message = i18nService.getMessage(key, i18nService.resolveLanguage(acceptLanguage));
        return ResponseEntity.ok(ApiResponse.ok(message, selection));
    }

    /**
     * Sample and lay out full-canvas training targets for a cached image
     * GET /api/anchors/database/{imageId}/targets?seed=7
     */
    @GetMapping("/database/{imageId}/targets")
    public ResponseEntity<ApiResponse<TrainingTargetsSummary>> targets(
            @PathVariable String imageId,
            @RequestParam(required = false) Long seed,
            @RequestParam(defaultValue = "false") boolean flipped,
            @RequestHeader(value = "Accept-Language", required = false) String acceptLanguage) {

        ImageRecord record = requireRecord(imageId, flipped);
        TrainingTargets targets = anchorTargetService.assembleTrainingTargets(record, settings, randomFor(seed));

        String message = i18nService.getMessage("targets.assembled", i18nService.resolveLanguage(acceptLanguage));
        return ResponseEntity.ok(ApiResponse.ok(message, TrainingTargetsSummary.of(targets)));
    }

    /**
     * Epoch visiting order over the cached database, as indices into build order
     * GET /api/anchors/epoch?seed=7
     */
    @GetMapping("/epoch")
    public ResponseEntity<ApiResponse<EpochPlan>> epoch(
            @RequestParam(required = false) Long seed,
            @RequestHeader(value = "Accept-Language", required = false) String acceptLanguage) {

        List<ImageRecord> records = imageRecordCache.snapshot();
        String language = i18nService.resolveLanguage(acceptLanguage);
        if (records.isEmpty()) {
            log.warn("Epoch requested before any database was built");
            return ResponseEntity.badRequest()
                .body(ApiResponse.fail(i18nService.getMessage("database.empty", language),
                    "No anchor database has been built"));
        }
        EpochPlan plan = anchorTargetService.planEpoch(records, settings, randomFor(seed));

        String message = i18nService.getMessage("epoch.planned", language);
        return ResponseEntity.ok(ApiResponse.ok(message, plan));
    }

    private ImageRecord requireRecord(String imageId, boolean flipped) {
        ImageRecord record = imageRecordCache.get(ImageRecord.cacheKey(imageId, flipped));
        if (record == null) {
            throw new NoSuchElementException("Image record not found: " + ImageRecord.cacheKey(imageId, flipped));
        }
        return record;
    }

    private Random randomFor(Long seed) {
        if (seed == null) {
            log.debug("No seed supplied; sampling with an unseeded random source");
            return new Random();
        }
        return new Random(seed);
    }
}
