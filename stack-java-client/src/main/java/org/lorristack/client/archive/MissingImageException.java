package org.lorristack.client.archive;

import java.io.IOException;

/**
 * Thrown when a listed frame image has not been downloaded and downloads are disabled.
 */
public class MissingImageException
        extends IOException {

    public MissingImageException(final String message) {
        super(message);
    }
}
