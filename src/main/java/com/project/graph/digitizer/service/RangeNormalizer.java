package com.project.graph.digitizer.service;

import com.project.graph.digitizer.DTOs.DataPoint;
import com.project.graph.digitizer.DTOs.Sample;
import com.project.graph.digitizer.exceptions.DegenerateRangeException;
import com.project.graph.digitizer.exceptions.EmptyExtractionException;

import java.util.ArrayList;
import java.util.List;

/** Rescales y linearly so that the observed minimum maps to 0 and the maximum to 1. */
public class RangeNormalizer {

    public List<Sample> normalize(List<DataPoint> dataPoints) {
        if (dataPoints.isEmpty()) {
            throw new EmptyExtractionException("Nothing to normalize");
        }

        double minY = Double.POSITIVE_INFINITY;
        double maxY = Double.NEGATIVE_INFINITY;
        for (DataPoint p : dataPoints) {
            minY = Math.min(minY, p.y());
            maxY = Math.max(maxY, p.y());
        }
        if (maxY == minY) {
            throw new DegenerateRangeException(minY);
        }

        final double span = maxY - minY;
        List<Sample> samples = new ArrayList<>(dataPoints.size());
        for (DataPoint p : dataPoints) {
            samples.add(new Sample(p.x(), (p.y() - minY) / span));
        }
        return samples;
    }
}
