package com.example.anchortargets.rpn.geometry;

import com.example.anchortargets.model.Box;
import org.springframework.stereotype.Component;

/**
 * Encodes a target box relative to a reference box as center offsets and
 * log size ratios, and decodes such deltas back into a box.
 *
 * <pre>
 * dx = (cx_target - cx_ref) / w_ref
 * dy = (cy_target - cy_ref) / h_ref
 * dw = ln(w_target / w_ref)
 * dh = ln(h_target / h_ref)
 * </pre>
 *
 * Widths and heights carry a +1 epsilon so degenerate boxes never divide by zero.
 */
@Component
public class RegressionTargetCoder {

    public static final double EPS = 1.0;

    public double[] encode(Box reference, Box target) {
        double refW = reference.xMax() - reference.xMin() + EPS;
        double refH = reference.yMax() - reference.yMin() + EPS;
        double refX = reference.xMin() + 0.5 * refW;
        double refY = reference.yMin() + 0.5 * refH;

        double gtW = target.xMax() - target.xMin() + EPS;
        double gtH = target.yMax() - target.yMin() + EPS;
        double gtX = target.xMin() + 0.5 * gtW;
        double gtY = target.yMin() + 0.5 * gtH;

        return new double[] {
            (gtX - refX) / refW,
            (gtY - refY) / refH,
            Math.log(gtW / refW),
            Math.log(gtH / refH)
        };
    }

    /**
     * Inverse of {@link #encode}: {@code decode(ref, encode(ref, t))} reproduces {@code t}
     * up to floating point error.
     */
    public Box decode(Box reference, double[] delta) {
        if (delta == null || delta.length != 4) {
            throw new IllegalArgumentException("Regression delta needs exactly 4 components");
        }
        double refW = reference.xMax() - reference.xMin() + EPS;
        double refH = reference.yMax() - reference.yMin() + EPS;
        double refX = reference.xMin() + 0.5 * refW;
        double refY = reference.yMin() + 0.5 * refH;

        double cx = delta[0] * refW + refX;
        double cy = delta[1] * refH + refY;
        double w = Math.exp(delta[2]) * refW;
        double h = Math.exp(delta[3]) * refH;

        double xMin = cx - 0.5 * w;
        double yMin = cy - 0.5 * h;
        return new Box(xMin, yMin, xMin + w - EPS, yMin + h - EPS);
    }
}
