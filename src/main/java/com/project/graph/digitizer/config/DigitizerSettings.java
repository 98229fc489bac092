package com.project.graph.digitizer.config;

import com.project.graph.digitizer.DTOs.ColorRange;
import com.project.graph.digitizer.service.AggregationPolicy;
import com.project.graph.digitizer.service.DegenerateRangePolicy;

import java.nio.file.Path;

/**
 * Defaults handed to the digitizer and its callers. Nothing in the core reads
 * configuration by itself; everything arrives through this record.
 */
public record DigitizerSettings(
        ColorRange colorRange,
        AggregationPolicy aggregation,
        DegenerateRangePolicy degeneratePolicy,
        Path defaultOutput
) {
    public static final String DEFAULT_LOWER = "100,150,50";
    public static final String DEFAULT_UPPER = "140,255,255";
    public static final String DEFAULT_OUTPUT = "normalized_graph_data.csv";

    public static DigitizerSettings defaults() {
        return new DigitizerSettings(ColorRange.parse(DEFAULT_LOWER, DEFAULT_UPPER),
                AggregationPolicy.MEAN, DegenerateRangePolicy.REJECT, Path.of(DEFAULT_OUTPUT));
    }
}
