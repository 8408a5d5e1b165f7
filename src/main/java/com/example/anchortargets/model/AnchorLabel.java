package com.example.anchortargets.model;

/**
 * Training relevance of a single anchor. The numeric values are the ones
 * stored in label arrays.
 */
public enum AnchorLabel {
    IGNORE(-1),
    BACKGROUND(0),
    FOREGROUND(1);

    private final int value;

    AnchorLabel(int value) {
        this.value = value;
    }

    public int value() {
        return value;
    }

    public static AnchorLabel fromValue(int value) {
        for (AnchorLabel label : values()) {
            if (label.value == value) {
                return label;
            }
        }
        throw new IllegalArgumentException("Unknown anchor label value: " + value);
    }
}
