package dev.interestmap.ai;

/**
 * A model artifact could not be read or is internally inconsistent.
 */
public class ModelLoadException extends RuntimeException {

    public ModelLoadException(String message) {
        super(message);
    }

    public ModelLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
