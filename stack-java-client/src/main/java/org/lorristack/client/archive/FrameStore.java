package org.lorristack.client.archive;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.StandardCopyOption;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Local directory of downloaded frame images, backed by an optional remote archive.
 */
public class FrameStore {

    public static final String IMAGE_PATH_PREFIX = "images/input/";
    public static final String METADATA_FILE_NAME = "metadata.json";

    private final File dataDirectory;
    private final FrameArchive archive;

    /**
     * @param  dataDirectory  root directory for image paths.
     * @param  archive        archive for missing images (null if downloads are never allowed).
     */
    public FrameStore(final File dataDirectory,
                      final FrameArchive archive) {
        this.dataDirectory = dataDirectory;
        this.archive = archive;
    }

    public File getMetadataFile() {
        return new File(dataDirectory, IMAGE_PATH_PREFIX + METADATA_FILE_NAME);
    }

    public File getImageFile(final FrameMetadata record) {
        return new File(dataDirectory, record.getImagePath());
    }

    /**
     * @param  record             record whose image is needed.
     * @param  downloadIfMissing  indicates whether missing images should be fetched from the archive.
     *
     * @return the local image file.
     *
     * @throws MissingImageException
     *   if the image is not local and it may not (or cannot) be downloaded.
     *
     * @throws IOException
     *   if the download fails.
     */
    public File ensureLocal(final FrameMetadata record,
                            final boolean downloadIfMissing)
            throws IOException {

        final File imageFile = getImageFile(record);

        if (! imageFile.exists()) {

            if (! downloadIfMissing) {
                throw new MissingImageException("image " + imageFile.getAbsolutePath() +
                                                " has not been downloaded, try running with --downloadMissing");
            }
            if (archive == null) {
                throw new MissingImageException("image " + imageFile.getAbsolutePath() +
                                                " has not been downloaded and no archive is configured");
            }

            final File parentDirectory = imageFile.getParentFile();
            if ((! parentDirectory.exists()) && (! parentDirectory.mkdirs())) {
                throw new IOException("failed to create directory " + parentDirectory.getAbsolutePath());
            }

            // partial downloads must never look like complete images
            final File partFile = new File(imageFile.getAbsolutePath() + ".part");
            archive.download(record, partFile);
            Files.move(partFile.toPath(), imageFile.toPath(), StandardCopyOption.REPLACE_EXISTING);

            LOG.info("ensureLocal: downloaded {} to {}", record.getUrl(), imageFile.getAbsolutePath());
        }

        return imageFile;
    }

    private static final Logger LOG = LoggerFactory.getLogger(FrameStore.class);
}
