package com.example.anchortargets.rpn.geometry;

import com.example.anchortargets.model.ImageShape;
import com.example.anchortargets.model.ScaleShape;
import org.springframework.stereotype.Component;

/**
 * Resize scale that brings the short side to {@code minSide} unless that would
 * push the long side past {@code maxSide}, in which case the long side is
 * pinned to {@code maxSide} instead.
 *
 * Rounding is half-to-even so database construction and iteration time,
 * which both call this, agree exactly.
 */
@Component
public class ScaleShapeResolver {

    public ScaleShape resolve(ImageShape rawShape, int minSide, int maxSide) {
        double scale = (double) minSide / (double) rawShape.minSide();
        if (Math.rint(scale * rawShape.maxSide()) > maxSide) {
            scale = (double) maxSide / (double) rawShape.maxSide();
        }
        int width = (int) Math.rint(rawShape.width() * scale);
        int height = (int) Math.rint(rawShape.height() * scale);
        return new ScaleShape(scale, new ImageShape(width, height));
    }
}
