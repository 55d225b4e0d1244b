package org.lorristack.client.archive;

import java.io.File;
import java.io.IOException;
import java.util.List;

/**
 * Remote source of frame listings and frame images.
 */
public interface FrameArchive {

    /**
     * @param  pageNumber  one-based listing page number (page 1 holds the newest frames).
     *
     * @return records listed on the page (newest first), or an empty list if the page is past the end of the archive.
     */
    List<FrameMetadata> getPage(int pageNumber)
            throws IOException;

    /**
     * Writes the full size image for the specified record to a local file.
     */
    void download(FrameMetadata record,
                  File toFile)
            throws IOException;
}
