package com.project.graph.digitizer.exceptions;

import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.ui.Model;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.multipart.MaxUploadSizeExceededException;

import java.io.IOException;

@ControllerAdvice
@ConditionalOnWebApplication
public class GlobalExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(DigitizationException.class)
    public String handleDigitization(DigitizationException ex, Model model) {
        log.warn("Digitization error: {}", ex.getMessage());
        model.addAttribute("error", ex.getMessage());
        return "digitize";
    }

    @ExceptionHandler(StorageException.class)
    public String handleStorage(StorageException ex, Model model) {
        log.warn("Storage error: {}", ex.getMessage());
        model.addAttribute("error", ex.getMessage());
        return "digitize";
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public String handleMaxUploadSizeExceeded(MaxUploadSizeExceededException ex, Model model) {
        log.warn("File upload size exceeded: {}", ex.getMessage());
        model.addAttribute("error", "File too large. Maximum size: 10MB");
        return "digitize";
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public String handleValidationErrors(ConstraintViolationException ex, Model model) {
        log.warn("Validation error: {}", ex.getMessage());
        model.addAttribute("error", "Invalid parameters: " + ex.getMessage());
        return "digitize";
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public String handleIllegalArgument(IllegalArgumentException ex, Model model) {
        log.warn("Invalid argument: {}", ex.getMessage());
        model.addAttribute("error", "Invalid parameters: " + ex.getMessage());
        return "digitize";
    }

    @ExceptionHandler(IOException.class)
    public String handleIOException(IOException ex, Model model) {
        log.error("IO error occurred", ex);
        model.addAttribute("error", "Could not process the file. Please try another image.");
        return "digitize";
    }

    @ExceptionHandler(Exception.class)
    public String handleUnknownException(Exception ex, Model model) {
        log.error("Unhandled error occurred", ex);
        model.addAttribute("error", "Unexpected error. Please try again.");
        return "index";
    }
}
