package com.project.image.carving.exceptions;

/** Image data that is not a non-empty, rectangular 3-channel grid. */
public class MalformedImageException extends CarvingException {
    public MalformedImageException(String message) { super(message); }
    public MalformedImageException(String message, Throwable cause) { super(message, cause); }
}
