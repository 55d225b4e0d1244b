package org.lorristack.alignment.stack;

import ij.process.ImageProcessor;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

import org.lorristack.alignment.match.StarSet;

/**
 * A captured frame: its raster, capture time and (if extraction succeeded) its stars.
 */
public class Frame {

    public static final DateTimeFormatter ID_FORMATTER =
            DateTimeFormatter.ofPattern("yyyy-MM-dd_HHmmss_'UTC'").withZone(ZoneOffset.UTC);

    private final String id;
    private final long timestamp;
    private final ImageProcessor raster;
    private final StarSet stars;
    private final String extractionFailure;

    /**
     * @param  timestamp  capture time in epoch seconds.
     * @param  raster     8-bit frame pixels.
     * @param  stars      stars extracted from the raster.
     */
    public Frame(final long timestamp,
                 final ImageProcessor raster,
                 final StarSet stars) {
        this(buildId(timestamp), timestamp, raster, stars, null);
    }

    public Frame(final String id,
                 final long timestamp,
                 final ImageProcessor raster,
                 final StarSet stars,
                 final String extractionFailure) {
        this.id = id;
        this.timestamp = timestamp;
        this.raster = raster;
        this.stars = stars;
        this.extractionFailure = extractionFailure;
    }

    /**
     * @return frame whose stars could not be extracted.
     */
    public static Frame withoutStars(final long timestamp,
                                     final ImageProcessor raster,
                                     final String extractionFailure) {
        return new Frame(buildId(timestamp), timestamp, raster, null, extractionFailure);
    }

    public static String buildId(final long timestamp) {
        return ID_FORMATTER.format(Instant.ofEpochSecond(timestamp));
    }

    public String getId() {
        return id;
    }

    public long getTimestamp() {
        return timestamp;
    }

    public ImageProcessor getRaster() {
        return raster;
    }

    public int getWidth() {
        return raster.getWidth();
    }

    public int getHeight() {
        return raster.getHeight();
    }

    public boolean hasStars() {
        return stars != null;
    }

    public StarSet getStars() {
        return stars;
    }

    public String getExtractionFailure() {
        return extractionFailure;
    }

    @Override
    public String toString() {
        return id;
    }
}
