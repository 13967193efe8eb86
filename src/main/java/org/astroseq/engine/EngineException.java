package org.astroseq.engine;

/**
 * Thrown when a run cannot be carried out at all, e.g. because the request is inconsistent.
 * Failures of individual frames or outputs are reported through {@link RunResult} instead.
 */
public class EngineException extends RuntimeException {

    public EngineException(String message) {
        super(message);
    }

    public EngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
