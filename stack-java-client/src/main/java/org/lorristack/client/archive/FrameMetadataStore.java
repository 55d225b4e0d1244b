package org.lorristack.client.archive;

import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Local JSON cache of archive frame records.
 * Records are stored newest first, in the same order the archive lists them.
 */
public class FrameMetadataStore {

    private final File metadataFile;

    public FrameMetadataStore(final File metadataFile) {
        this.metadataFile = metadataFile;
    }

    public File getMetadataFile() {
        return metadataFile;
    }

    /**
     * @return all cached records, newest first.
     *
     * @throws NoMetadataFileException
     *   if the cache file does not exist.
     *
     * @throws IOException
     *   if the cache file cannot be read.
     */
    public List<FrameMetadata> load()
            throws IOException {

        if (! metadataFile.exists()) {
            throw new NoMetadataFileException("metadata file " + metadataFile.getAbsolutePath() +
                                              " does not exist, try running with --updateMetadata");
        }

        try (final Reader reader = Files.newBufferedReader(metadataFile.toPath(), StandardCharsets.UTF_8)) {
            return FrameMetadata.JSON_HELPER.fromJsonArray(reader);
        }
    }

    /**
     * Replaces the cache file content with the specified records.
     */
    public void save(final List<FrameMetadata> records)
            throws IOException {

        final File parentDirectory = metadataFile.getAbsoluteFile().getParentFile();
        if ((parentDirectory != null) && (! parentDirectory.exists()) && (! parentDirectory.mkdirs())) {
            throw new IOException("failed to create directory " + parentDirectory.getAbsolutePath());
        }

        final File tempFile = new File(metadataFile.getAbsolutePath() + ".tmp");
        try (final Writer writer = Files.newBufferedWriter(tempFile.toPath(), StandardCharsets.UTF_8)) {
            FrameMetadata.JSON_HELPER.writeJsonArray(records, writer);
        }
        Files.move(tempFile.toPath(), metadataFile.toPath(), StandardCopyOption.REPLACE_EXISTING);

        LOG.info("save: saved {} records to {}", records.size(), metadataFile.getAbsolutePath());
    }

    /**
     * Pulls listing pages (newest first) from the archive until a record matching the newest cached
     * record is found, then prepends the new records to the cache.
     *
     * @return number of new records.
     */
    public int update(final FrameArchive archive)
            throws IOException {

        LOG.info("update: entry, archive={}", archive);

        List<FrameMetadata> cachedRecords;
        try {
            cachedRecords = load();
        } catch (final NoMetadataFileException e) {
            LOG.info("update: no existing metadata, fetching full listing");
            cachedRecords = new ArrayList<>();
        }

        final Long newestCachedTimestamp = cachedRecords.isEmpty() ? null : cachedRecords.get(0).getTimestamp();

        final List<FrameMetadata> updatedRecords = new ArrayList<>();
        boolean foundCachedRecord = false;
        for (int pageNumber = 1; ! foundCachedRecord; pageNumber++) {

            final List<FrameMetadata> pageRecords = archive.getPage(pageNumber);
            if (pageRecords.isEmpty()) {
                break;
            }

            for (final FrameMetadata record : pageRecords) {
                if ((newestCachedTimestamp != null) && (record.getTimestamp() == newestCachedTimestamp)) {
                    foundCachedRecord = true;
                    break;
                }
                updatedRecords.add(record);
            }
        }

        final int newRecordCount = updatedRecords.size();
        updatedRecords.addAll(cachedRecords);
        save(updatedRecords);

        LOG.info("update: exit, found {} new records", newRecordCount);

        return newRecordCount;
    }

    /**
     * @param  from             earliest capture time (epoch seconds, inclusive) or null for no lower bound.
     * @param  to               latest capture time (epoch seconds, inclusive) or null for no upper bound.
     * @param  exposurePattern  pattern the full exposure label must match or null to accept all exposures.
     *
     * @return matching cached records ordered oldest first.
     */
    public List<FrameMetadata> listMetadata(final Long from,
                                            final Long to,
                                            final Pattern exposurePattern)
            throws IOException {

        final List<FrameMetadata> matchingRecords = load().stream()
                .filter(r -> (from == null) || (r.getTimestamp() >= from))
                .filter(r -> (to == null) || (r.getTimestamp() <= to))
                .filter(r -> (exposurePattern == null) ||
                             ((r.getExposure() != null) && exposurePattern.matcher(r.getExposure()).matches()))
                .sorted(Comparator.comparingLong(FrameMetadata::getTimestamp))
                .collect(Collectors.toList());

        LOG.info("listMetadata: found {} records between {} and {} with exposure matching {}",
                 matchingRecords.size(), from, to, exposurePattern);

        return matchingRecords;
    }

    private static final Logger LOG = LoggerFactory.getLogger(FrameMetadataStore.class);
}
