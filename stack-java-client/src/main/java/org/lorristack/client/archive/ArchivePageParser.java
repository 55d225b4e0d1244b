package org.lorristack.client.archive;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Parses frame records out of the archive's thumbnail listing pages.
 *
 * A listing page embeds its records in a single script line that starts with {@code StatusArr.push}
 * and contains {@code ;} separated statements like:
 * <pre>
 *   thumbArr.push("thumbnails/lor_0299000001_0x630_sci_1.jpg");
 *   UTCArr.push("2015-07-13&lt;br&gt;12:34:56 UTC");
 *   ExpArr.push("150");
 * </pre>
 * Each {@code ExpArr.push} statement completes one record.
 */
public class ArchivePageParser {

    public static final String LISTING_LINE_PREFIX = "StatusArr.push";

    public static final DateTimeFormatter ARCHIVE_TIME_FORMATTER =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'<br>'HH:mm:ss 'UTC'");

    public static final DateTimeFormatter IMAGE_NAME_FORMATTER =
            DateTimeFormatter.ofPattern("yyyy-MM-dd_HHmmss_'UTC.jpg'").withZone(ZoneOffset.UTC);

    private final String imageUrlPrefix;
    private final String imagePathPrefix;

    /**
     * @param  imageUrlPrefix   prefix for full size image URLs (thumbnail paths are relative to it).
     * @param  imagePathPrefix  prefix for local image paths (e.g. "images/input/").
     */
    public ArchivePageParser(final String imageUrlPrefix,
                             final String imagePathPrefix) {
        this.imageUrlPrefix = imageUrlPrefix;
        this.imagePathPrefix = imagePathPrefix;
    }

    /**
     * @param  pageText  full text of a listing page.
     *
     * @return records parsed from the page's listing line or null if the page has no listing line.
     *
     * @throws IllegalArgumentException
     *   if the listing line is malformed.
     */
    public List<FrameMetadata> parsePage(final String pageText)
            throws IllegalArgumentException {
        if (pageText != null) {
            for (final String line : pageText.split("\\r?\\n")) {
                if (line.startsWith(LISTING_LINE_PREFIX)) {
                    return parseListingLine(line);
                }
            }
        }
        return null;
    }

    public List<FrameMetadata> parseListingLine(final String line)
            throws IllegalArgumentException {

        final List<FrameMetadata> records = new ArrayList<>();

        String url = null;
        Long timestamp = null;
        for (final String statement : line.split(";")) {
            final String command = statement.trim();
            if (command.startsWith("thumbArr.push")) {
                url = imageUrlPrefix + getQuotedValue(command).replace("thumbnails/", "");
            } else if (command.startsWith("UTCArr.push")) {
                timestamp = parseTimestamp(getQuotedValue(command));
            } else if (command.startsWith("ExpArr.push")) {
                if ((url == null) || (timestamp == null)) {
                    throw new IllegalArgumentException("exposure listed before image url and time in '" + line + "'");
                }
                records.add(new FrameMetadata(url, timestamp, buildImagePath(timestamp), getQuotedValue(command)));
                url = null;
                timestamp = null;
            }
        }

        return records;
    }

    public String buildImagePath(final long timestamp) {
        return imagePathPrefix + IMAGE_NAME_FORMATTER.format(Instant.ofEpochSecond(timestamp));
    }

    static long parseTimestamp(final String archiveTime)
            throws IllegalArgumentException {
        try {
            return LocalDateTime.parse(archiveTime, ARCHIVE_TIME_FORMATTER).toEpochSecond(ZoneOffset.UTC);
        } catch (final DateTimeParseException e) {
            throw new IllegalArgumentException("invalid archive time '" + archiveTime + "'", e);
        }
    }

    private static String getQuotedValue(final String command)
            throws IllegalArgumentException {
        final int start = command.indexOf('"');
        final int stop = start < 0 ? -1 : command.indexOf('"', start + 1);
        if (stop < 0) {
            throw new IllegalArgumentException("missing quoted value in '" + command + "'");
        }
        return command.substring(start + 1, stop);
    }
}
