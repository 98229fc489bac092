package com.project.graph.digitizer.service;

import com.project.graph.digitizer.DTOs.DataPoint;
import com.project.graph.digitizer.DTOs.PixelPoint;
import com.project.graph.digitizer.exceptions.InvalidInputException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Flips rows to bottom-up amplitudes and collapses every column to one {@link DataPoint}.
 * <p>
 * Stroke thickness and anti-aliasing leave several matched rows per column; they are
 * reduced with the configured {@link AggregationPolicy}. Columns without matches are
 * skipped, not interpolated. The result is sorted by x and holds each x once.
 */
public class ColumnAggregator {

    private final AggregationPolicy policy;

    public ColumnAggregator() {
        this(AggregationPolicy.MEAN);
    }

    public ColumnAggregator(AggregationPolicy policy) {
        if (policy == null) {
            throw new IllegalArgumentException("policy is required");
        }
        this.policy = policy;
    }

    public AggregationPolicy getPolicy() {
        return policy;
    }

    public List<DataPoint> aggregate(List<PixelPoint> pixelPoints, int imageHeight) {
        if (imageHeight <= 0) {
            throw new InvalidInputException("Image height must be positive, was " + imageHeight);
        }

        Map<Integer, List<Double>> columns = new TreeMap<>();
        for (PixelPoint p : pixelPoints) {
            if (p.row() < 0 || p.row() >= imageHeight) {
                throw new InvalidInputException("Row " + p.row() + " outside image of height " + imageHeight);
            }
            double y = imageHeight - 1 - p.row();
            columns.computeIfAbsent(p.column(), k -> new ArrayList<>()).add(y);
        }

        List<DataPoint> out = new ArrayList<>(columns.size());
        for (Map.Entry<Integer, List<Double>> e : columns.entrySet()) {
            List<Double> ys = e.getValue();
            double[] values = new double[ys.size()];
            for (int i = 0; i < values.length; i++) {
                values[i] = ys.get(i);
            }
            out.add(new DataPoint(e.getKey(), policy.collapse(values)));
        }
        return out;
    }
}
