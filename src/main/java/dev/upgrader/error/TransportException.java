package dev.upgrader.error;

/**
 * A catalog call could not reach the service (connection refused, reset, timeout)
 * and every retry was used up.
 */
public class TransportException extends UpgraderException {

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
