package org.lorristack.client.archive;

import java.io.File;
import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Collections;
import java.util.List;

import org.apache.http.client.methods.HttpGet;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClientBuilder;
import org.lorristack.client.request.WaitingRetryHandler;
import org.lorristack.client.response.FileResponseHandler;
import org.lorristack.client.response.TextResponseHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP client for the public frame archive web site.
 * Every request is counted against (and paced by) a shared {@link RequestBudget}.
 */
public class FrameArchiveClient
        implements FrameArchive {

    public static final String DEFAULT_ARCHIVE_URL = "http://pluto.jhuapl.edu/soc/Pluto-Encounter/";

    private final String archiveUrl;
    private final ArchivePageParser pageParser;
    private final RequestBudget requestBudget;
    private final CloseableHttpClient httpClient;

    /**
     * @param  archiveUrl       base URL of the archive (listing pages and images are relative to it).
     * @param  imagePathPrefix  prefix for local image paths of parsed records.
     * @param  requestBudget    budget for all requests sent by this client.
     */
    public FrameArchiveClient(final String archiveUrl,
                              final String imagePathPrefix,
                              final RequestBudget requestBudget) {
        this(archiveUrl,
             imagePathPrefix,
             requestBudget,
             HttpClientBuilder.create().setRetryHandler(new WaitingRetryHandler()).build());
    }

    public FrameArchiveClient(final String archiveUrl,
                              final String imagePathPrefix,
                              final RequestBudget requestBudget,
                              final CloseableHttpClient httpClient) {
        this.archiveUrl = archiveUrl.endsWith("/") ? archiveUrl : archiveUrl + "/";
        this.pageParser = new ArchivePageParser(this.archiveUrl, imagePathPrefix);
        this.requestBudget = requestBudget;
        this.httpClient = httpClient;
    }

    public String getPageUrlString(final int pageNumber) {
        return archiveUrl + "index.php?page=" + pageNumber;
    }

    @Override
    public List<FrameMetadata> getPage(final int pageNumber)
            throws IOException {

        final URI uri = getUri(getPageUrlString(pageNumber));
        final HttpGet httpGet = new HttpGet(uri);
        final String requestContext = "GET " + uri;
        final TextResponseHandler responseHandler = new TextResponseHandler(requestContext);

        LOG.info("getPage: submitting {}", requestContext);

        requestBudget.acquire();
        final String pageText;
        try {
            pageText = httpClient.execute(httpGet, responseHandler);
        } finally {
            requestBudget.pause();
        }

        final List<FrameMetadata> records = pageParser.parsePage(pageText);
        if (records == null) {
            LOG.info("getPage: page {} has no listing, assuming end of archive", pageNumber);
            return Collections.emptyList();
        }

        return records;
    }

    @Override
    public void download(final FrameMetadata record,
                         final File toFile)
            throws IOException {

        final URI uri = getUri(record.getUrl());
        final HttpGet httpGet = new HttpGet(uri);
        final String requestContext = "GET " + uri;
        final FileResponseHandler responseHandler = new FileResponseHandler(requestContext, toFile);

        LOG.info("download: submitting {}, writing to {}", requestContext, toFile.getAbsolutePath());

        requestBudget.acquire();
        try {
            httpClient.execute(httpGet, responseHandler);
        } finally {
            requestBudget.pause();
        }
    }

    @Override
    public String toString() {
        return archiveUrl;
    }

    private URI getUri(final String forString)
            throws IOException {
        final URI uri;
        try {
            uri = new URI(forString);
        } catch (final URISyntaxException e) {
            throw new IOException("failed to create URI for '" + forString + "'", e);
        }
        return uri;
    }

    private static final Logger LOG = LoggerFactory.getLogger(FrameArchiveClient.class);
}
