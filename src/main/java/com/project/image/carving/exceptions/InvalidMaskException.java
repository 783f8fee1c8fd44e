package com.project.image.carving.exceptions;

/** A retention mask that does not mark exactly one pixel per row of the image. */
public class InvalidMaskException extends CarvingException {
    public InvalidMaskException(String message) { super(message); }
}
