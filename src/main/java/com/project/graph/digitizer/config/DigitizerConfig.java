package com.project.graph.digitizer.config;

import com.project.graph.digitizer.DTOs.ColorRange;
import com.project.graph.digitizer.service.AggregationPolicy;
import com.project.graph.digitizer.service.ColorSegmenter;
import com.project.graph.digitizer.service.ColumnAggregator;
import com.project.graph.digitizer.service.CoordinateExtractor;
import com.project.graph.digitizer.service.DegenerateRangePolicy;
import com.project.graph.digitizer.service.Digitizer;
import com.project.graph.digitizer.service.ImageLoader;
import com.project.graph.digitizer.service.RangeNormalizer;
import com.project.graph.digitizer.service.SampleCsvWriter;
import com.project.graph.digitizer.service.TracePlotRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

/**
 * Wires the digitization stages from {@code app.digitizer.*} properties.
 * The stages themselves are plain classes and know nothing about Spring.
 */
@Configuration
public class DigitizerConfig {
    private static final Logger log = LoggerFactory.getLogger(DigitizerConfig.class);

    @Bean
    public DigitizerSettings digitizerSettings(
            @Value("${app.digitizer.color.lower:" + DigitizerSettings.DEFAULT_LOWER + "}") String lower,
            @Value("${app.digitizer.color.upper:" + DigitizerSettings.DEFAULT_UPPER + "}") String upper,
            @Value("${app.digitizer.aggregation:MEAN}") AggregationPolicy aggregation,
            @Value("${app.digitizer.degenerate-policy:REJECT}") DegenerateRangePolicy degeneratePolicy,
            @Value("${app.digitizer.output:" + DigitizerSettings.DEFAULT_OUTPUT + "}") String output) {
        DigitizerSettings settings = new DigitizerSettings(
                ColorRange.parse(lower, upper), aggregation, degeneratePolicy, Path.of(output));
        log.info("Digitizer settings: range [{}]..[{}], aggregation {}, degenerate policy {}",
                settings.colorRange().lower(), settings.colorRange().upper(), aggregation, degeneratePolicy);
        return settings;
    }

    @Bean
    public Digitizer digitizer(DigitizerSettings settings) {
        return new Digitizer(new ColorSegmenter(), new CoordinateExtractor(),
                new ColumnAggregator(settings.aggregation()), new RangeNormalizer());
    }

    @Bean
    public ImageLoader imageLoader() {
        return new ImageLoader();
    }

    @Bean
    public SampleCsvWriter sampleCsvWriter() {
        return new SampleCsvWriter();
    }

    @Bean
    public TracePlotRenderer tracePlotRenderer() {
        return new TracePlotRenderer();
    }
}
