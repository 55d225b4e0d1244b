package org.lorristack.client.archive;

import java.io.IOException;

/**
 * Thrown when the local frame metadata cache has never been created.
 */
public class NoMetadataFileException
        extends IOException {

    public NoMetadataFileException(final String message) {
        super(message);
    }
}
