package com.project.graph.digitizer.service;

import com.project.graph.digitizer.DTOs.ColorRange;
import com.project.graph.digitizer.DTOs.DataPoint;
import com.project.graph.digitizer.DTOs.DigitizationResult;
import com.project.graph.digitizer.DTOs.Sample;
import com.project.graph.digitizer.config.DigitizerSettings;
import com.project.graph.digitizer.exceptions.DegenerateRangeException;
import com.project.graph.digitizer.exceptions.InvalidInputException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.awt.image.BufferedImage;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Caller-side wrapper around {@link Digitizer}: loads images, logs, and applies the
 * configured {@link DegenerateRangePolicy}.
 */
@Service
public class DigitizationService {
    private static final Logger log = LoggerFactory.getLogger(DigitizationService.class);

    private final Digitizer digitizer;
    private final ImageLoader imageLoader;
    private final DigitizerSettings settings;

    public DigitizationService(Digitizer digitizer, ImageLoader imageLoader, DigitizerSettings settings) {
        this.digitizer = digitizer;
        this.imageLoader = imageLoader;
        this.settings = settings;
    }

    public DigitizerSettings getSettings() {
        return settings;
    }

    public DigitizationResult digitize(Path imagePath, ColorRange colorRange) {
        log.info("Loading image {}", imagePath);
        return digitize(imageLoader.load(imagePath), colorRange);
    }

    public DigitizationResult digitize(BufferedImage image, ColorRange colorRange) {
        if (image == null) {
            throw new InvalidInputException("No image supplied");
        }
        ColorRange range = colorRange != null ? colorRange : settings.colorRange();
        log.info("Digitizing {}x{} image, HSV range [{}]..[{}]",
                image.getWidth(), image.getHeight(), range.lower(), range.upper());

        try {
            List<Sample> samples = digitizer.digitize(image, range);
            log.info("Digitization completed with {} samples", samples.size());
            return new DigitizationResult(image.getWidth(), image.getHeight(), range, samples, false);
        } catch (DegenerateRangeException e) {
            if (settings.degeneratePolicy() == DegenerateRangePolicy.REJECT) {
                throw e;
            }
            log.warn("{}; emitting zero amplitudes", e.getMessage());
            // redo the aggregation to recover the matched columns
            List<DataPoint> points = digitizer.trace(image, range);
            List<Sample> flat = new ArrayList<>(points.size());
            for (DataPoint p : points) {
                flat.add(new Sample(p.x(), 0.0));
            }
            return new DigitizationResult(image.getWidth(), image.getHeight(), range, flat, true);
        }
    }
}
