package com.example.anchortargets.model;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class AnchorGridTest {

    @Test
    void testTileIsChannelMajor() {
        // Given: two base anchors on a 2 x 3 feature map
        List<Box> base = Arrays.asList(Box.of(0, 0, 15, 15), Box.of(-8, -8, 23, 23));

        // When
        AnchorGrid grid = AnchorGrid.tile(base, 2, 3, 16);

        // Then: index = k * H * W + y * W + x
        assertEquals(12, grid.size());
        assertEquals(Box.of(0, 0, 15, 15), grid.get(0));
        assertEquals(Box.of(32, 0, 47, 15), grid.get(2));
        assertEquals(Box.of(16, 16, 31, 31), grid.get(4));
        assertEquals(Box.of(-8, -8, 23, 23), grid.get(6));
        assertEquals(Box.of(24, 8, 55, 39), grid.get(6 + 1 * 3 + 2));
    }

    @Test
    void testGridIsImmutable() {
        AnchorGrid grid = AnchorGrid.tile(List.of(Box.of(0, 0, 15, 15)), 1, 1, 16);

        assertThrows(UnsupportedOperationException.class, () -> grid.getAnchors().add(Box.of(0, 0, 1, 1)));
    }

    @Test
    void testCountMustMatchDimensions() {
        assertThrows(IllegalArgumentException.class,
            () -> new AnchorGrid(List.of(Box.of(0, 0, 1, 1)), 2, 2, 1, 16));
        assertThrows(IllegalArgumentException.class, () -> AnchorGrid.tile(List.of(), 2, 2, 16));
    }

    @Test
    void testAnchorLabelValues() {
        assertEquals(-1, AnchorLabel.IGNORE.value());
        assertEquals(AnchorLabel.FOREGROUND, AnchorLabel.fromValue(1));
        assertThrows(IllegalArgumentException.class, () -> AnchorLabel.fromValue(2));
    }

    @Test
    void testEpochPlanBounds() {
        EpochPlan plan = new EpochPlan(new int[] {2, 0, 1}, 2);

        assertEquals(2, plan.imageAt(0));
        assertEquals(0, plan.imageAt(1));
        assertThrows(IllegalArgumentException.class, () -> plan.imageAt(2));
    }
}
