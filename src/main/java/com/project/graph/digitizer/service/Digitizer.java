package com.project.graph.digitizer.service;

import com.project.graph.digitizer.DTOs.ColorRange;
import com.project.graph.digitizer.DTOs.DataPoint;
import com.project.graph.digitizer.DTOs.Mask;
import com.project.graph.digitizer.DTOs.PixelPoint;
import com.project.graph.digitizer.DTOs.Sample;

import java.awt.image.BufferedImage;
import java.util.List;

/**
 * Recovers a normalized trace from a plot image: segment, extract, aggregate, normalize.
 * <p>
 * Stateless and free of I/O; concurrent calls on different images are safe. Failures of
 * any stage ({@code InvalidInputException}, {@code EmptyExtractionException},
 * {@code DegenerateRangeException}) propagate unchanged.
 */
public class Digitizer {

    private final ColorSegmenter segmenter;
    private final CoordinateExtractor extractor;
    private final ColumnAggregator aggregator;
    private final RangeNormalizer normalizer;

    public Digitizer(ColorSegmenter segmenter, CoordinateExtractor extractor,
                     ColumnAggregator aggregator, RangeNormalizer normalizer) {
        this.segmenter = segmenter;
        this.extractor = extractor;
        this.aggregator = aggregator;
        this.normalizer = normalizer;
    }

    public List<Sample> digitize(BufferedImage image, ColorRange colorRange) {
        return normalizer.normalize(trace(image, colorRange));
    }

    /** The aggregated, not yet normalized trace. */
    public List<DataPoint> trace(BufferedImage image, ColorRange colorRange) {
        Mask mask = segmenter.segment(image, colorRange);
        List<PixelPoint> pixels = extractor.extract(mask);
        return aggregator.aggregate(pixels, image.getHeight());
    }
}
