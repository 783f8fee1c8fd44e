package com.project.image.carving.exceptions;

/** Domain-specific exception for carving errors. */
public class CarvingException extends RuntimeException {
    public CarvingException(String message) { super(message); }
    public CarvingException(String message, Throwable cause) { super(message, cause); }
}
