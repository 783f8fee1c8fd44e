package com.project.image.carving.exceptions;

/**
 * Requested width change cannot be applied to the image (e.g. it would leave zero columns).
 * Nothing is produced when this is thrown.
 */
public class CarvingPreconditionException extends CarvingException {
    public CarvingPreconditionException(String message) { super(message); }
}
