package com.example.anchortargets.rpn.geometry;

import com.example.anchortargets.model.Box;
import com.example.anchortargets.model.OverlapMatrix;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Intersection-over-union between box lists, with pixel-inclusive areas.
 */
@Component
public class GeometryOverlap {

    /**
     * Overlap of every candidate against every reference.
     *
     * @param candidates R boxes, typically anchors
     * @param references G boxes, typically ground truth; may be empty
     * @return R x G matrix, exactly 0 where a pair does not intersect
     */
    public OverlapMatrix overlap(List<Box> candidates, List<Box> references) {
        int rows = candidates.size();
        int cols = references.size();
        OverlapMatrix overlaps = new OverlapMatrix(rows, cols);

        for (int g = 0; g < cols; g++) {
            Box gt = references.get(g);
            double gtArea = (gt.xMax() - gt.xMin() + 1) * (gt.yMax() - gt.yMin() + 1);
            for (int r = 0; r < rows; r++) {
                Box box = candidates.get(r);
                double iw = Math.min(box.xMax(), gt.xMax()) - Math.max(box.xMin(), gt.xMin()) + 1;
                if (iw > 0) {
                    double ih = Math.min(box.yMax(), gt.yMax()) - Math.max(box.yMin(), gt.yMin()) + 1;
                    if (ih > 0) {
                        double union = (box.xMax() - box.xMin() + 1) * (box.yMax() - box.yMin() + 1)
                            + gtArea - iw * ih;
                        overlaps.set(r, g, (float) (iw * ih / union));
                    }
                }
            }
        }
        return overlaps;
    }

    /**
     * Overlap of a single pair, in double precision.
     */
    public double iou(Box a, Box b) {
        double iw = Math.min(a.xMax(), b.xMax()) - Math.max(a.xMin(), b.xMin()) + 1;
        if (iw <= 0) {
            return 0.0;
        }
        double ih = Math.min(a.yMax(), b.yMax()) - Math.max(a.yMin(), b.yMin()) + 1;
        if (ih <= 0) {
            return 0.0;
        }
        double intersection = iw * ih;
        return intersection / (a.area() + b.area() - intersection);
    }
}
