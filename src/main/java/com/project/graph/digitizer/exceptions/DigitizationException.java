package com.project.graph.digitizer.exceptions;

/** Base of the failures raised by the digitization stages. */
public abstract class DigitizationException extends RuntimeException {
    protected DigitizationException(String message) { super(message); }
    protected DigitizationException(String message, Throwable cause) { super(message, cause); }
}
