package com.project.graph.digitizer.DTOs;

/**
 * A color on the OpenCV 8-bit HSV scale: hue 0..179, saturation and value 0..255.
 */
public record HsvColor(int hue, int saturation, int value) {

    public static final int MAX_HUE = 179;
    public static final int MAX_CHANNEL = 255;

    public HsvColor {
        checkChannel("hue", hue, MAX_HUE);
        checkChannel("saturation", saturation, MAX_CHANNEL);
        checkChannel("value", value, MAX_CHANNEL);
    }

    /** Parses "h,s,v", whitespace around the numbers is ignored. */
    public static HsvColor parse(String triple) {
        if (triple == null) {
            throw new IllegalArgumentException("HSV triple is missing");
        }
        String[] parts = triple.split(",");
        if (parts.length != 3) {
            throw new IllegalArgumentException("Expected h,s,v but got: " + triple);
        }
        try {
            return new HsvColor(Integer.parseInt(parts[0].trim()),
                    Integer.parseInt(parts[1].trim()),
                    Integer.parseInt(parts[2].trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Non-numeric HSV triple: " + triple, e);
        }
    }

    private static void checkChannel(String name, int v, int max) {
        if (v < 0 || v > max) {
            throw new IllegalArgumentException(name + " must be in [0, " + max + "], was " + v);
        }
    }

    @Override
    public String toString() {
        return hue + "," + saturation + "," + value;
    }
}
