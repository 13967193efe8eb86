package org.astroseq.engine.source;

import java.io.IOException;

/**
 * Thrown for every read from a container that could not be opened.
 */
public class ContainerUnavailableException extends IOException {

    public ContainerUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
