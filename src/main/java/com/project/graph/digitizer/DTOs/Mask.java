package com.project.graph.digitizer.DTOs;

import java.util.Arrays;

/**
 * Row-major W x H grid, {@code true} where a pixel matched the color range.
 * Immutable: the cells are copied in and out.
 */
public record Mask(int width, int height, boolean[] cells) {

    public Mask {
        if (cells == null || cells.length != width * height) {
            throw new IllegalArgumentException("Mask cells do not match " + width + "x" + height);
        }
        cells = cells.clone();
    }

    @Override
    public boolean[] cells() {
        return cells.clone();
    }

    public boolean isSet(int column, int row) {
        return cells[row * width + column];
    }

    public int count() {
        int n = 0;
        for (boolean c : cells) {
            if (c) n++;
        }
        return n;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Mask other)) return false;
        return width == other.width && height == other.height && Arrays.equals(cells, other.cells);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * width + height) + Arrays.hashCode(cells);
    }

    @Override
    public String toString() {
        return "Mask[" + width + "x" + height + ", " + count() + " set]";
    }
}
