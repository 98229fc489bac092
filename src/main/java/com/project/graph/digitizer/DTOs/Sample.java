package com.project.graph.digitizer.DTOs;

/** One output sample; {@code y} is normalized to [0, 1]. */
public record Sample(int x, double y) {}
