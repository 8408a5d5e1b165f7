package com.example.anchortargets.controller.dto;

import com.example.anchortargets.model.Box;
import com.example.anchortargets.model.ImageRecordInput;
import com.example.anchortargets.model.ImageShape;

import java.util.ArrayList;
import java.util.List;

/**
 * One image's decoded annotation as posted by the dataset loader.
 * Boxes are {@code [xMin, yMin, xMax, yMax]} in raw, 0-based pixel coordinates.
 */
public class ImageAnnotation {
    private String imageId;
    private int width;
    private int height;
    private List<double[]> gtBoxes = new ArrayList<>();
    private List<Integer> gtClasses = new ArrayList<>();

    public ImageAnnotation() {}

    public ImageAnnotation(String imageId, int width, int height, List<double[]> gtBoxes, List<Integer> gtClasses) {
        this.imageId = imageId;
        this.width = width;
        this.height = height;
        this.gtBoxes = gtBoxes;
        this.gtClasses = gtClasses;
    }

    public ImageRecordInput toInput() {
        List<Box> boxes = new ArrayList<>();
        if (gtBoxes != null) {
            for (double[] coords : gtBoxes) {
                boxes.add(Box.fromArray(coords));
            }
        }
        return new ImageRecordInput(imageId, new ImageShape(width, height), boxes, gtClasses);
    }

    public String getImageId() { return imageId; }
    public void setImageId(String imageId) { this.imageId = imageId; }

    public int getWidth() { return width; }
    public void setWidth(int width) { this.width = width; }

    public int getHeight() { return height; }
    public void setHeight(int height) { this.height = height; }

    public List<double[]> getGtBoxes() { return gtBoxes; }
    public void setGtBoxes(List<double[]> gtBoxes) { this.gtBoxes = gtBoxes; }

    public List<Integer> getGtClasses() { return gtClasses; }
    public void setGtClasses(List<Integer> gtClasses) { this.gtClasses = gtClasses; }
}
