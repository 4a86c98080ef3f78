package com.packetsentinel.core.detection.classification;

/**
 * A configured classification model could not be read or is not usable.
 *
 * @since 1.0.0
 */
public class ModelLoadException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ModelLoadException(String message) {
        super(message);
    }

    public ModelLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
