package dev.upgrader.error;

/**
 * Bad input: unknown target name, missing required field, blank catalog URL or key.
 */
public class ValidationException extends UpgraderException {

    public ValidationException(String message) {
        super(message);
    }
}
