package com.project.graph.digitizer.exceptions;

/** Missing, empty or undecodable image. */
public class InvalidInputException extends DigitizationException {
    public InvalidInputException(String message) { super(message); }
    public InvalidInputException(String message, Throwable cause) { super(message, cause); }
}
