package com.project.graph.digitizer.exceptions;

/** The color range matched no pixel. Callers may retry with another range. */
public class EmptyExtractionException extends DigitizationException {
    public EmptyExtractionException(String message) { super(message); }
}
