package com.example.anchortargets.rpn.dataset;

import com.example.anchortargets.model.Box;
import com.example.anchortargets.model.ImageRecordInput;
import com.example.anchortargets.model.ImageShape;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.*;

public class InMemoryDatasetSourceTest {

    @Test
    void testListsIdsInInsertionOrder() {
        InMemoryDatasetSource source = new InMemoryDatasetSource(Arrays.asList(
            input("000009"), input("000005"), input("000007")));

        assertEquals(List.of("000009", "000005", "000007"), source.listImageIds());
        assertEquals(3, source.size());
    }

    @Test
    void testLoadsGroundTruthAndSize() {
        InMemoryDatasetSource source = new InMemoryDatasetSource();
        source.add(input("000005"));

        ImageRecordInput loaded = source.loadGroundTruth("000005");

        assertEquals(List.of(Box.of(10, 10, 50, 60)), loaded.gtBoxes());
        assertEquals(List.of(12), loaded.gtClasses());
        assertEquals(new ImageShape(500, 375), source.loadImageSize("000005"));
    }

    @Test
    void testUnknownIdThrowsNoSuchElement() {
        InMemoryDatasetSource source = new InMemoryDatasetSource();

        assertThrows(NoSuchElementException.class, () -> source.loadGroundTruth("missing"));
        assertThrows(NoSuchElementException.class, () -> source.loadImageSize("missing"));
    }

    @Test
    void testDuplicateIdIsRejected() {
        InMemoryDatasetSource source = new InMemoryDatasetSource();
        source.add(input("000005"));

        assertThrows(IllegalArgumentException.class, () -> source.add(input("000005")));
    }

    @Test
    void testMisalignedGroundTruthIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new ImageRecordInput("bad", new ImageShape(10, 10),
            List.of(Box.of(0, 0, 1, 1)), List.of()));
    }

    private static ImageRecordInput input(String id) {
        return new ImageRecordInput(id, new ImageShape(500, 375), List.of(Box.of(10, 10, 50, 60)), List.of(12));
    }
}
