package com.project.graph.digitizer.DTOs;

/** A masked pixel, row counted top-down as stored in the image. */
public record PixelPoint(int column, int row) {}
