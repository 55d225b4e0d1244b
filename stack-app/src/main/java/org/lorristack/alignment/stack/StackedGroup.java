package org.lorristack.alignment.stack;

import ij.process.ByteProcessor;

/**
 * Composite raster for one group of temporally close frames.
 */
public class StackedGroup {

    private final long lastTimestamp;
    private final int frameCount;
    private final BoundingRect rect;
    private final ByteProcessor image;

    public StackedGroup(final long lastTimestamp,
                        final int frameCount,
                        final BoundingRect rect,
                        final ByteProcessor image) {
        this.lastTimestamp = lastTimestamp;
        this.frameCount = frameCount;
        this.rect = rect;
        this.image = image;
    }

    /**
     * @return capture time (epoch seconds) of the last frame folded into this group.
     */
    public long getLastTimestamp() {
        return lastTimestamp;
    }

    public int getFrameCount() {
        return frameCount;
    }

    public BoundingRect getRect() {
        return rect;
    }

    public ByteProcessor getImage() {
        return image;
    }

    /**
     * @return output name derived from the last frame's capture time.
     */
    public String getName() {
        return Frame.buildId(lastTimestamp);
    }

    @Override
    public String toString() {
        return getName() + " (" + frameCount + " frames, " + rect + ")";
    }
}
