package com.project.graph.digitizer.DTOs;

import java.util.List;

public record DigitizationResult(
        int width,
        int height,
        ColorRange colorRange,
        List<Sample> samples,
        boolean degenerate     // true when the flat-trace fallback produced the samples
) {
    public int sampleCount() {
        return samples.size();
    }
}
