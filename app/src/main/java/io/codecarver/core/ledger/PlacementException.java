package io.codecarver.core.ledger;

/**
 * Raised when a ledger refuses a placement: occupied target, failing init code,
 * or returned code that breaks a host rule. The ledger is unchanged when this is thrown.
 */
public class PlacementException extends RuntimeException {
    public PlacementException(String message) {
        super(message);
    }
}
