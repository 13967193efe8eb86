package org.astroseq.api.transform;

/**
 * Thrown by an {@link ITransform} when a single frame cannot be processed.
 */
public class TransformException extends Exception {

    public TransformException(String message) {
        super(message);
    }

    public TransformException(String message, Throwable cause) {
        super(message, cause);
    }
}
