package com.example.anchortargets.rpn.labeling;

import com.example.anchortargets.config.AnchorTargetSettings;
import com.example.anchortargets.model.ImageRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Optional class-wise normalization of regression targets:
 * {@code t = (t - mean[c]) / std[c]} for each anchor whose matched class
 * {@code c} is not background (class 0).
 *
 * Runs on labeled records before they are unmapped.
 */
@Component
public class TargetNormalizer {
    private static final Logger log = LoggerFactory.getLogger(TargetNormalizer.class);

    private static final double COUNT_EPS = 1e-14;

    public void normalize(List<ImageRecord> records, AnchorTargetSettings settings) {
        int numClasses = countClasses(records);
        double[][] means;
        double[][] stds;
        if (settings.normalizationPrecomputed()) {
            means = tile(settings.normalizationMeans(), numClasses);
            stds = tile(settings.normalizationStds(), numClasses);
        } else {
            Statistics stats = computeStatistics(records, numClasses);
            means = stats.means();
            stds = stats.stds();
        }
        log.info("Normalizing bbox targets over {} records and {} classes (precomputed={})",
            records.size(), numClasses, settings.normalizationPrecomputed());
        apply(records, means, stds);
    }

    /**
     * Per-class mean and standard deviation of the targets, with
     * {@code var = E[x^2] - E[x]^2}. Class 0 keeps zero statistics.
     */
    public Statistics computeStatistics(List<ImageRecord> records, int numClasses) {
        double[] counts = new double[numClasses];
        double[][] sums = new double[numClasses][4];
        double[][] squaredSums = new double[numClasses][4];
        for (int c = 0; c < numClasses; c++) {
            counts[c] = COUNT_EPS;
        }

        for (ImageRecord record : records) {
            requireLabeled(record);
            int[] classes = record.getMaxOverlapClasses();
            double[][] targets = record.getBboxTargets();
            for (int i = 0; i < classes.length; i++) {
                int c = classes[i];
                if (c < 1) {
                    continue;
                }
                counts[c] += 1;
                for (int k = 0; k < 4; k++) {
                    sums[c][k] += targets[i][k];
                    squaredSums[c][k] += targets[i][k] * targets[i][k];
                }
            }
        }

        double[][] means = new double[numClasses][4];
        double[][] stds = new double[numClasses][4];
        for (int c = 1; c < numClasses; c++) {
            for (int k = 0; k < 4; k++) {
                means[c][k] = sums[c][k] / counts[c];
                stds[c][k] = Math.sqrt(squaredSums[c][k] / counts[c] - means[c][k] * means[c][k]);
            }
        }
        return new Statistics(means, stds);
    }

    private void apply(List<ImageRecord> records, double[][] means, double[][] stds) {
        for (ImageRecord record : records) {
            requireLabeled(record);
            int[] classes = record.getMaxOverlapClasses();
            double[][] targets = record.getBboxTargets();
            for (int i = 0; i < classes.length; i++) {
                int c = classes[i];
                if (c < 1) {
                    continue;
                }
                for (int k = 0; k < 4; k++) {
                    // zero spread: center only
                    double std = stds[c][k] > 0 ? stds[c][k] : 1.0;
                    targets[i][k] = (targets[i][k] - means[c][k]) / std;
                }
            }
        }
    }

    private static void requireLabeled(ImageRecord record) {
        if (!record.isLabeled() || record.isUnmapped()) {
            throw new IllegalStateException(
                "Normalization needs labeled, not yet unmapped records: " + record.getCacheKey());
        }
    }

    private static int countClasses(List<ImageRecord> records) {
        int max = 0;
        for (ImageRecord record : records) {
            for (int c : record.getGtClasses()) {
                max = Math.max(max, c);
            }
        }
        return max + 1;
    }

    private static double[][] tile(double[] row, int times) {
        double[][] tiled = new double[times][];
        for (int i = 0; i < times; i++) {
            tiled[i] = row.clone();
        }
        return tiled;
    }

    public record Statistics(double[][] means, double[][] stds) {}
}
