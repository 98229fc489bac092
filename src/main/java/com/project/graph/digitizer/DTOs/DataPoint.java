package com.project.graph.digitizer.DTOs;

/** A column and its bottom-up amplitude, {@code y = height - 1 - row}. */
public record DataPoint(int x, double y) {}
