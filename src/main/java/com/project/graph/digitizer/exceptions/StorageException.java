package com.project.graph.digitizer.exceptions;

/** Upload or result persistence failure. */
public class StorageException extends RuntimeException {
    public StorageException(String message) { super(message); }
    public StorageException(String message, Throwable cause) { super(message, cause); }
}
