package dev.interestmap.ai;

/**
 * The artifact's expected feature layout cannot be produced, either because
 * its own tables disagree in size or because no embedding provider yields the
 * dimension its scaler was fitted on.
 */
public class ModelIncompatibleException extends ModelLoadException {

    public ModelIncompatibleException(String message) {
        super(message);
    }
}
