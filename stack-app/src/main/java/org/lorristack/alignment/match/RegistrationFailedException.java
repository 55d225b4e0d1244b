package org.lorristack.alignment.match;

/**
 * Thrown when no consistent star pairing of sufficient size is found between two frames.
 */
public class RegistrationFailedException
        extends Exception {

    public RegistrationFailedException(final String message) {
        super(message);
    }
}
