package com.project.graph.digitizer.DTOs;

/**
 * Inclusive HSV bounds selecting the pixels of one trace.
 */
public record ColorRange(HsvColor lower, HsvColor upper) {

    public ColorRange {
        if (lower == null || upper == null) {
            throw new IllegalArgumentException("Both bounds of a color range are required");
        }
        if (lower.hue() > upper.hue()
                || lower.saturation() > upper.saturation()
                || lower.value() > upper.value()) {
            throw new IllegalArgumentException("Lower bound " + lower + " exceeds upper bound " + upper);
        }
    }

    public static ColorRange parse(String lower, String upper) {
        return new ColorRange(HsvColor.parse(lower), HsvColor.parse(upper));
    }
}
