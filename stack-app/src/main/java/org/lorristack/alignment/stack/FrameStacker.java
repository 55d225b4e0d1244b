package org.lorristack.alignment.stack;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Splits registered frames into groups of temporally close frames and composites each group.
 *
 * A group is closed after a frame when no later frame was captured at the same time or within maxFrameInterval
 * seconds of it.  Each group is painted onto its own canvas so groups can be composited in parallel.
 */
public class FrameStacker {

    public static final long DEFAULT_MAX_FRAME_INTERVAL = 4 * 60 * 60;

    private final long maxFrameInterval;
    private final BoundingRect cropRect;
    private final int numberOfThreads;

    /**
     * @param  maxFrameInterval  maximum gap (in seconds) between consecutive frames of the same group.
     * @param  cropRect          optional reference space rectangle to restrict output to (null for none).
     * @param  numberOfThreads   number of groups to composite concurrently.
     */
    public FrameStacker(final long maxFrameInterval,
                        final BoundingRect cropRect,
                        final int numberOfThreads)
            throws IllegalArgumentException {
        if (maxFrameInterval < 0) {
            throw new IllegalArgumentException("maxFrameInterval must not be negative");
        }
        if (numberOfThreads < 1) {
            throw new IllegalArgumentException("numberOfThreads must be positive");
        }
        this.maxFrameInterval = maxFrameInterval;
        this.cropRect = cropRect;
        this.numberOfThreads = numberOfThreads;
    }

    /**
     * @param  registeredFrames  successfully registered frames in time order.
     *
     * @return groups of frames, in time order.
     */
    public List<List<RegisteredFrame>> groupFrames(final List<RegisteredFrame> registeredFrames) {

        final List<List<RegisteredFrame>> groups = new ArrayList<>();
        List<RegisteredFrame> currentGroup = new ArrayList<>();

        for (int i = 0; i < registeredFrames.size(); i++) {
            final RegisteredFrame registeredFrame = registeredFrames.get(i);
            currentGroup.add(registeredFrame);
            if (! hasCloseSuccessor(registeredFrames, i)) {
                groups.add(currentGroup);
                currentGroup = new ArrayList<>();
            }
        }

        return groups;
    }

    /**
     * @param  registeredFrames  successfully registered frames in time order.
     *
     * @return one composite per group (in group order); groups entirely outside the crop rectangle are omitted.
     */
    public List<StackedGroup> stack(final List<RegisteredFrame> registeredFrames)
            throws InterruptedException, ExecutionException {

        final List<List<RegisteredFrame>> groups = groupFrames(registeredFrames);

        LOG.info("stack: entry, compositing {} groups from {} frames with {} threads",
                 groups.size(), registeredFrames.size(), numberOfThreads);

        final List<StackedGroup> stackedGroups = new ArrayList<>();

        final ExecutorService executorService = Executors.newFixedThreadPool(numberOfThreads);
        try {
            final List<Future<StackedGroup>> futures = new ArrayList<>();
            for (final List<RegisteredFrame> group : groups) {
                futures.add(executorService.submit(() -> stackGroup(group)));
            }
            for (final Future<StackedGroup> future : futures) {
                final StackedGroup stackedGroup = future.get();
                if (stackedGroup != null) {
                    stackedGroups.add(stackedGroup);
                }
            }
        } finally {
            executorService.shutdownNow();
        }

        LOG.info("stack: exit, created {} composites", stackedGroups.size());

        return stackedGroups;
    }

    /**
     * @return composite for the specified group or null if the group lies entirely outside the crop rectangle.
     */
    StackedGroup stackGroup(final List<RegisteredFrame> group) {

        final RegisteredFrame lastFrame = group.get(group.size() - 1);
        BoundingRect rect = Compositor.boundingRect(group);

        if (cropRect != null) {
            final BoundingRect croppedRect = rect.crop(cropRect);
            if (croppedRect == null) {
                LOG.warn("stackGroup: skipping group ending with frame {} because its bounds {} do not overlap crop {}",
                         lastFrame, rect, cropRect);
                return null;
            }
            rect = croppedRect;
        }

        final StackCanvas canvas = Compositor.composite(rect, group);

        LOG.info("stackGroup: composited {} frames ending with frame {} into {}x{} canvas",
                 group.size(), lastFrame, canvas.getImage().getWidth(), canvas.getImage().getHeight());

        return new StackedGroup(lastFrame.getFrame().getTimestamp(), group.size(), rect, canvas.getImage());
    }

    private boolean hasCloseSuccessor(final List<RegisteredFrame> registeredFrames,
                                      final int index) {
        final long t = registeredFrames.get(index).getFrame().getTimestamp();
        for (int j = index + 1; j < registeredFrames.size(); j++) {
            final long laterTime = registeredFrames.get(j).getFrame().getTimestamp();
            if ((laterTime >= t) && (laterTime <= t + maxFrameInterval)) {
                return true;
            }
        }
        return false;
    }

    private static final Logger LOG = LoggerFactory.getLogger(FrameStacker.class);
}
