package com.example.anchortargets.rpn.geometry;

import com.example.anchortargets.model.ImageShape;
import com.example.anchortargets.model.ScaleShape;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ScaleShapeResolverTest {

    private final ScaleShapeResolver resolver = new ScaleShapeResolver();

    @Test
    void testMaxSideConstraintWins() {
        ScaleShape result = resolver.resolve(new ImageShape(2000, 1000), 600, 1000);

        assertEquals(0.5, result.scale(), 1e-12);
        assertEquals(new ImageShape(1000, 500), result.shape());
    }

    @Test
    void testMinSideConstraintUnclipped() {
        ScaleShape result = resolver.resolve(new ImageShape(800, 600), 600, 1000);

        assertEquals(1.0, result.scale(), 1e-12);
        assertEquals(new ImageShape(800, 600), result.shape());
    }

    @Test
    void testPortraitImageScalesOnWidth() {
        // 600 / 333 scales the long side to 900.9, which rounds to 901 and stays under 1000
        ScaleShape result = resolver.resolve(new ImageShape(333, 500), 600, 1000);

        assertEquals(600.0 / 333.0, result.scale(), 1e-12);
        assertEquals(new ImageShape(600, 901), result.shape());
    }

    @Test
    void testRepeatedCallsAgreeExactly() {
        ImageShape raw = new ImageShape(353, 500);

        ScaleShape first = resolver.resolve(raw, 600, 1000);
        ScaleShape second = resolver.resolve(raw, 600, 1000);

        assertEquals(first, second);
    }

    @Test
    void testNonPositiveShapeIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new ImageShape(0, 10));
    }
}
