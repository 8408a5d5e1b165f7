package com.example.anchortargets.model;

import java.util.Arrays;

/**
 * Row-major R x G matrix of IoU values between R candidate boxes and G
 * reference boxes. Values are held in single precision.
 */
public class OverlapMatrix {

    private final int rows;
    private final int cols;
    private final float[] values;

    public OverlapMatrix(int rows, int cols) {
        this.rows = rows;
        this.cols = cols;
        this.values = new float[rows * cols];
    }

    public float get(int row, int col) {
        return values[row * cols + col];
    }

    public void set(int row, int col, float value) {
        values[row * cols + col] = value;
    }

    public int getRows() {
        return rows;
    }

    public int getCols() {
        return cols;
    }

    /**
     * Largest value of each row. Rows of a zero-column matrix have no maximum
     * and report negative infinity.
     */
    public float[] rowMax() {
        float[] max = new float[rows];
        for (int r = 0; r < rows; r++) {
            float best = Float.NEGATIVE_INFINITY;
            int base = r * cols;
            for (int c = 0; c < cols; c++) {
                if (values[base + c] > best) {
                    best = values[base + c];
                }
            }
            max[r] = best;
        }
        return max;
    }

    /**
     * Column index of each row's maximum, first index on ties; -1 for rows of a
     * zero-column matrix.
     */
    public int[] rowArgMax() {
        int[] arg = new int[rows];
        for (int r = 0; r < rows; r++) {
            int best = -1;
            float bestValue = Float.NEGATIVE_INFINITY;
            int base = r * cols;
            for (int c = 0; c < cols; c++) {
                if (best < 0 || values[base + c] > bestValue) {
                    best = c;
                    bestValue = values[base + c];
                }
            }
            arg[r] = best;
        }
        return arg;
    }

    /**
     * Largest value of each column; negative infinity for columns of a zero-row matrix.
     */
    public float[] colMax() {
        float[] max = new float[cols];
        Arrays.fill(max, Float.NEGATIVE_INFINITY);
        for (int r = 0; r < rows; r++) {
            int base = r * cols;
            for (int c = 0; c < cols; c++) {
                if (values[base + c] > max[c]) {
                    max[c] = values[base + c];
                }
            }
        }
        return max;
    }
}
