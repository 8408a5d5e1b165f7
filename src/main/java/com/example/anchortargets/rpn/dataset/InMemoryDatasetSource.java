package com.example.anchortargets.rpn.dataset;

import com.example.anchortargets.model.ImageRecordInput;
import com.example.anchortargets.model.ImageShape;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Dataset held in memory, in insertion order. Used for annotations posted to
 * the service and in tests.
 */
public class InMemoryDatasetSource implements DatasetSource {

    private final Map<String, ImageRecordInput> images = new LinkedHashMap<>();

    public InMemoryDatasetSource() {}

    public InMemoryDatasetSource(Collection<ImageRecordInput> inputs) {
        inputs.forEach(this::add);
    }

    public void add(ImageRecordInput input) {
        if (images.putIfAbsent(input.imageId(), input) != null) {
            throw new IllegalArgumentException("Duplicate image id: " + input.imageId());
        }
    }

    @Override
    public List<String> listImageIds() {
        return new ArrayList<>(images.keySet());
    }

    @Override
    public ImageRecordInput loadGroundTruth(String imageId) {
        ImageRecordInput input = images.get(imageId);
        if (input == null) {
            throw new NoSuchElementException("Image not found in dataset: " + imageId);
        }
        return input;
    }

    @Override
    public ImageShape loadImageSize(String imageId) {
        return loadGroundTruth(imageId).imageShape();
    }

    public int size() {
        return images.size();
    }
}
