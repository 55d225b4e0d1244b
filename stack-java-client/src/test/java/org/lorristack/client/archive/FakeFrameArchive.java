package org.lorristack.client.archive;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * In memory archive for tests.
 */
class FakeFrameArchive
        implements FrameArchive {

    private final List<List<FrameMetadata>> pages;
    private final List<Integer> requestedPages;
    private final List<FrameMetadata> downloadedRecords;

    @SafeVarargs
    FakeFrameArchive(final List<FrameMetadata>... pages) {
        this.pages = new ArrayList<>();
        Collections.addAll(this.pages, pages);
        this.requestedPages = new ArrayList<>();
        this.downloadedRecords = new ArrayList<>();
    }

    @Override
    public List<FrameMetadata> getPage(final int pageNumber) {
        requestedPages.add(pageNumber);
        return pageNumber <= pages.size() ? pages.get(pageNumber - 1) : Collections.emptyList();
    }

    @Override
    public void download(final FrameMetadata record,
                         final File toFile)
            throws IOException {
        downloadedRecords.add(record);
        Files.write(toFile.toPath(), record.getUrl().getBytes(StandardCharsets.UTF_8));
    }

    List<Integer> getRequestedPages() {
        return requestedPages;
    }

    List<FrameMetadata> getDownloadedRecords() {
        return downloadedRecords;
    }

    static FrameMetadata buildRecord(final long timestamp,
                                     final String exposure) {
        final ArchivePageParser parser = new ArchivePageParser("http://archive.test/", FrameStore.IMAGE_PATH_PREFIX);
        return new FrameMetadata("http://archive.test/lor_" + timestamp + ".jpg",
                                 timestamp,
                                 parser.buildImagePath(timestamp),
                                 exposure);
    }
}
