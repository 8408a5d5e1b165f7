package com.example.anchortargets.rpn.geometry;

import com.example.anchortargets.model.Box;
import com.example.anchortargets.model.ImageShape;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Selects anchors lying entirely on the image canvas {@code [0, w) x [0, h)}.
 */
@Component
public class AnchorFilter {

    /**
     * @return ascending indices of anchors with {@code xMin >= 0}, {@code yMin >= 0},
     *         {@code xMax < width} and {@code yMax < height}
     */
    public int[] inside(List<Box> anchors, ImageShape imageShape) {
        int width = imageShape.width();
        int height = imageShape.height();
        int[] kept = new int[anchors.size()];
        int count = 0;
        for (int i = 0; i < anchors.size(); i++) {
            Box a = anchors.get(i);
            if (a.xMin() >= 0 && a.yMin() >= 0 && a.xMax() < width && a.yMax() < height) {
                kept[count++] = i;
            }
        }
        return Arrays.copyOf(kept, count);
    }

    /**
     * Gathers the anchors at {@code indices}, preserving order.
     */
    public List<Box> gather(List<Box> anchors, int[] indices) {
        List<Box> subset = new ArrayList<>(indices.length);
        for (int index : indices) {
            if (index < 0 || index >= anchors.size()) {
                throw new IllegalArgumentException(String.format(
                    "Anchor index %d out of range for %d anchors", index, anchors.size()));
            }
            subset.add(anchors.get(index));
        }
        return subset;
    }
}
