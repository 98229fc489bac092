package com.project.graph.digitizer.service;

import com.project.graph.digitizer.DTOs.Sample;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Two-column CSV: {@code X,Normalized Amplitude}, x as the pixel column, y as a decimal.
 */
public class SampleCsvWriter {

    public static final String HEADER = "X,Normalized Amplitude";

    public void write(List<Sample> samples, Writer out) throws IOException {
        out.write(HEADER);
        out.write('\n');
        for (Sample s : samples) {
            out.write(Integer.toString(s.x()));
            out.write(',');
            out.write(Double.toString(s.y()));
            out.write('\n');
        }
        out.flush();
    }

    public void write(List<Sample> samples, Path target) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (BufferedWriter w = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
            write(samples, w);
        }
    }

    public byte[] toBytes(List<Sample> samples) {
        StringWriter sw = new StringWriter();
        try {
            write(samples, sw);
        } catch (IOException e) {
            // StringWriter does not throw
            throw new IllegalStateException(e);
        }
        return sw.toString().getBytes(StandardCharsets.UTF_8);
    }
}
