package com.example.anchortargets.rpn.labeling;

import com.example.anchortargets.config.AnchorTargetProperties;
import com.example.anchortargets.config.AnchorTargetSettings;
import com.example.anchortargets.model.Box;
import com.example.anchortargets.model.ImageRecord;
import com.example.anchortargets.model.ImageShape;
import com.example.anchortargets.testsupport.TestRecords;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TargetNormalizerTest {

    private TargetNormalizer normalizer;

    @BeforeEach
    void setUp() {
        normalizer = new TargetNormalizer();
    }

    @Test
    void testPrecomputedStatisticsScaleForegroundClassesOnly() {
        // Given: rows matched to background class 0, class 1 and class 2
        ImageRecord record = labeledRecord(new int[] {0, 1, 2}, new double[][] {
            {0.1, 0.2, 0.4, 0.8},
            {0.1, 0.2, 0.4, 0.8},
            {-0.1, 0.0, 0.2, -0.2}});
        AnchorTargetProperties properties = new AnchorTargetProperties();
        properties.getNormalization().setEnabled(true);

        // When
        normalizer.normalize(List.of(record), properties.toSettings());

        // Then: default means 0, stds (0.1, 0.1, 0.2, 0.2)
        assertArrayEquals(new double[] {0.1, 0.2, 0.4, 0.8}, record.getBboxTargets()[0], 1e-12);
        assertArrayEquals(new double[] {1.0, 2.0, 2.0, 4.0}, record.getBboxTargets()[1], 1e-12);
        assertArrayEquals(new double[] {-1.0, 0.0, 1.0, -1.0}, record.getBboxTargets()[2], 1e-12);
    }

    @Test
    void testEmpiricalStatisticsPerClass() {
        ImageRecord first = labeledRecord(new int[] {1, 0}, new double[][] {{1, 1, 1, 1}, {9, 9, 9, 9}});
        ImageRecord second = labeledRecord(new int[] {1}, new double[][] {{3, 5, 3, 5}});

        TargetNormalizer.Statistics stats = normalizer.computeStatistics(Arrays.asList(first, second), 2);

        assertArrayEquals(new double[] {0, 0, 0, 0}, stats.means()[0], 0.0);
        assertArrayEquals(new double[] {2, 3, 2, 3}, stats.means()[1], 1e-9);
        assertArrayEquals(new double[] {1, 2, 1, 2}, stats.stds()[1], 1e-9);
    }

    @Test
    void testEmpiricalNormalizationCentersAndScales() {
        // Given
        ImageRecord first = labeledRecord(new int[] {1, 2}, new double[][] {{1, 1, 1, 1}, {5, 5, 5, 5}});
        ImageRecord second = labeledRecord(new int[] {1}, new double[][] {{3, 3, 3, 3}});
        AnchorTargetProperties properties = new AnchorTargetProperties();
        properties.getNormalization().setEnabled(true);
        properties.getNormalization().setPrecomputed(false);

        // When
        normalizer.normalize(Arrays.asList(first, second), properties.toSettings());

        // Then: class 1 has mean 2 and std 1; class 2 has a single sample and maps to 0
        assertArrayEquals(new double[] {-1, -1, -1, -1}, first.getBboxTargets()[0], 1e-6);
        assertArrayEquals(new double[] {1, 1, 1, 1}, second.getBboxTargets()[0], 1e-6);
        assertArrayEquals(new double[] {0, 0, 0, 0}, first.getBboxTargets()[1], 1e-6);
    }

    @Test
    void testUnmappedRecordsAreRejected() {
        ImageRecord unmapped = TestRecords.unmappedRecord("img", 1, 1, 0);
        AnchorTargetSettings settings = AnchorTargetSettings.defaults();

        assertThrows(IllegalStateException.class, () -> normalizer.normalize(List.of(unmapped), settings));
    }

    private static ImageRecord labeledRecord(int[] classes, double[][] targets) {
        int maxClass = Arrays.stream(classes).max().orElse(0);
        int[] gtClasses = new int[maxClass];
        Box[] boxes = new Box[maxClass];
        for (int c = 0; c < maxClass; c++) {
            gtClasses[c] = c + 1;
            boxes[c] = Box.of(0, 0, 9, 9);
        }
        ImageRecord record = new ImageRecord("img", new ImageShape(64, 64), Arrays.asList(boxes), gtClasses, false);
        int[] labels = new int[classes.length];
        Arrays.fill(labels, 1);
        record.setLabels(labels);
        record.setMaxOverlapClasses(classes);
        record.setBboxTargets(targets);
        record.setInBoundsIndices(new int[0]);
        return record;
    }
}
