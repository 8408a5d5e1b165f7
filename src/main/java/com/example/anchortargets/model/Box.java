package com.example.anchortargets.model;

/**
 * Axis-aligned box in pixel-inclusive coordinates: a box spanning columns
 * {@code xMin..xMax} covers {@code xMax - xMin + 1} pixels.
 */
public record Box(double xMin, double yMin, double xMax, double yMax) {

    public static Box of(double xMin, double yMin, double xMax, double yMax) {
        return new Box(xMin, yMin, xMax, yMax);
    }

    public double width() {
        return xMax - xMin + 1.0;
    }

    public double height() {
        return yMax - yMin + 1.0;
    }

    public double area() {
        return width() * height();
    }

    public Box scale(double factor) {
        return new Box(xMin * factor, yMin * factor, xMax * factor, yMax * factor);
    }

    public Box shift(double dx, double dy) {
        return new Box(xMin + dx, yMin + dy, xMax + dx, yMax + dy);
    }

    public static Box fromArray(double[] coords) {
        if (coords == null || coords.length != 4) {
            throw new IllegalArgumentException("Box needs exactly 4 coordinates (xMin, yMin, xMax, yMax)");
        }
        return new Box(coords[0], coords[1], coords[2], coords[3]);
    }
}
