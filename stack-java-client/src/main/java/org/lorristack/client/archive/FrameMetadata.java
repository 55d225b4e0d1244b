package org.lorristack.client.archive;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Objects;

import org.lorristack.alignment.json.JsonUtils;

/**
 * Archive listing details for one captured frame.
 */
public class FrameMetadata
        implements Serializable {

    private final String url;
    private final long timestamp;
    @JsonProperty("image_path")
    private final String imagePath;
    private final String exposure;

    // no-arg constructor needed for JSON deserialization
    @SuppressWarnings("unused")
    private FrameMetadata() {
        this(null, 0, null, null);
    }

    /**
     * @param  url        location of the full size image in the archive.
     * @param  timestamp  capture time in epoch seconds.
     * @param  imagePath  local image path relative to the data directory.
     * @param  exposure   exposure label as listed by the archive.
     */
    public FrameMetadata(final String url,
                         final long timestamp,
                         final String imagePath,
                         final String exposure) {
        this.url = url;
        this.timestamp = timestamp;
        this.imagePath = imagePath;
        this.exposure = exposure;
    }

    public String getUrl() {
        return url;
    }

    public long getTimestamp() {
        return timestamp;
    }

    public String getImagePath() {
        return imagePath;
    }

    public String getExposure() {
        return exposure;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final FrameMetadata that = (FrameMetadata) o;
        return (timestamp == that.timestamp) &&
               Objects.equals(url, that.url) &&
               Objects.equals(imagePath, that.imagePath) &&
               Objects.equals(exposure, that.exposure);
    }

    @Override
    public int hashCode() {
        return Objects.hash(url, timestamp, imagePath, exposure);
    }

    @Override
    public String toString() {
        return JSON_HELPER.toJson(this);
    }

    public static final JsonUtils.Helper<FrameMetadata> JSON_HELPER =
            new JsonUtils.Helper<>(JsonUtils.FAST_MAPPER, FrameMetadata.class);
}
