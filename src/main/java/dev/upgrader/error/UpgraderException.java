package dev.upgrader.error;

/**
 * Root of the engine's unchecked exception hierarchy.
 */
public class UpgraderException extends RuntimeException {

    public UpgraderException(String message) {
        super(message);
    }

    public UpgraderException(String message, Throwable cause) {
        super(message, cause);
    }
}
