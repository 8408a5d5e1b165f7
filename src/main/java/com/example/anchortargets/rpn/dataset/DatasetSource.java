package com.example.anchortargets.rpn.dataset;

import com.example.anchortargets.model.ImageRecordInput;
import com.example.anchortargets.model.ImageShape;

import java.util.List;

/**
 * Access to one dataset's ground truth. Implementations own annotation
 * parsing and image decoding; the anchor pipeline only sees their output.
 */
public interface DatasetSource {

    /**
     * Image ids in dataset index order
     */
    List<String> listImageIds();

    /**
     * Ground-truth boxes and classes for one image, boxes in raw pixel coordinates
     * @throws java.util.NoSuchElementException if the id is unknown
     */
    ImageRecordInput loadGroundTruth(String imageId);

    /**
     * Raw pixel size of the decoded image
     * @throws java.util.NoSuchElementException if the id is unknown
     */
    ImageShape loadImageSize(String imageId);
}
