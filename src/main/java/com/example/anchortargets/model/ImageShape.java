package com.example.anchortargets.model;

/**
 * Image size in pixels, width first.
 */
public record ImageShape(int width, int height) {

    public ImageShape {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException(
                String.format("Image shape must be positive, got %dx%d", width, height));
        }
    }

    public boolean isHorizontal() {
        return width >= height;
    }

    public int minSide() {
        return Math.min(width, height);
    }

    public int maxSide() {
        return Math.max(width, height);
    }
}
