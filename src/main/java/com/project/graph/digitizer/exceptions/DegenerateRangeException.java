package com.project.graph.digitizer.exceptions;

/** All amplitudes are equal, so they cannot be rescaled to [0, 1]. */
public class DegenerateRangeException extends DigitizationException {
    private final double value;

    public DegenerateRangeException(double value) {
        super("Trace is flat (every y equals " + value + "), cannot normalize");
        this.value = value;
    }

    public double getValue() {
        return value;
    }
}
