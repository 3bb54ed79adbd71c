package com.hcl2map.transform;

/**
 * Raised when a syntax tree breaks the shape the grammar guarantees. The transformation
 * is abandoned and no partial result is returned.
 */
public class HclTransformException extends RuntimeException {
    public HclTransformException(String message) {
        super(message);
    }

    public HclTransformException(String message, Throwable cause) {
        super(message, cause);
    }
}
