package dev.upgrader.error;

/**
 * An episode file (or episode) could not be mapped to the ID needed for the next call.
 */
public class ResolutionException extends UpgraderException {

    public ResolutionException(String message) {
        super(message);
    }

    public ResolutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
