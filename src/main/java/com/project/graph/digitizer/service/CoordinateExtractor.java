package com.project.graph.digitizer.service;

import com.project.graph.digitizer.DTOs.Mask;
import com.project.graph.digitizer.DTOs.PixelPoint;
import com.project.graph.digitizer.exceptions.EmptyExtractionException;

import java.util.ArrayList;
import java.util.List;

/** Lists the coordinates of every set cell of a mask. */
public class CoordinateExtractor {

    public List<PixelPoint> extract(Mask mask) {
        final int w = mask.width(), h = mask.height();
        List<PixelPoint> points = new ArrayList<>();
        for (int row = 0; row < h; row++) {
            for (int col = 0; col < w; col++) {
                if (mask.isSet(col, row)) {
                    points.add(new PixelPoint(col, row));
                }
            }
        }
        if (points.isEmpty()) {
            throw new EmptyExtractionException(
                    "No pixel in the " + w + "x" + h + " image matches the color range. Wrong range or blank image?");
        }
        return points;
    }
}
