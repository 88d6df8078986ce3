package io.codecarver.core.carver;

/**
 * The single failure signal of {@link Carver#carve(byte[])}. Covers invalid input, address
 * collisions and post-placement anomalies alike; the message is for diagnostics only.
 * When this is thrown the ledger holds exactly what it held before the call.
 */
public class DeploymentFailedException extends RuntimeException {
    public DeploymentFailedException(String message) {
        super(message);
    }

    public DeploymentFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
