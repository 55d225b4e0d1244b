package org.lorristack.alignment.match;

/**
 * Thrown when stars cannot be extracted from a frame
 * (e.g. the frame is too bright or the number of detected stars is out of bounds).
 */
public class ExtractFailedException
        extends Exception {

    public ExtractFailedException(final String message) {
        super(message);
    }
}
