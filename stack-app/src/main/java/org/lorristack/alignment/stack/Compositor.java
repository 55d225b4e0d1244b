package org.lorristack.alignment.stack;

import java.util.List;

import org.lorristack.alignment.transform.RigidTransform2D;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Utilities for sizing and painting composite canvases from registered frames.
 */
public class Compositor {

    /**
     * @param  registeredFrames  frames with transforms that map reference coordinates to frame coordinates.
     *
     * @return smallest reference space rectangle that contains every corner of every frame.
     *
     * @throws IllegalArgumentException
     *   if no frames are specified.
     */
    public static BoundingRect boundingRect(final List<RegisteredFrame> registeredFrames)
            throws IllegalArgumentException {

        if ((registeredFrames == null) || registeredFrames.isEmpty()) {
            throw new IllegalArgumentException("at least one registered frame is required to derive bounds");
        }

        double minX = Double.POSITIVE_INFINITY;
        double minY = Double.POSITIVE_INFINITY;
        double maxX = Double.NEGATIVE_INFINITY;
        double maxY = Double.NEGATIVE_INFINITY;

        for (final RegisteredFrame registeredFrame : registeredFrames) {

            final RigidTransform2D inverse = registeredFrame.getTransform().createInverse();
            final double w = registeredFrame.getFrame().getWidth();
            final double h = registeredFrame.getFrame().getHeight();

            for (final double[] corner : new double[][] {{0, 0}, {w, 0}, {0, h}, {w, h}}) {
                final double[] reference = inverse.apply(corner[0], corner[1]);
                minX = Math.min(minX, reference[0]);
                minY = Math.min(minY, reference[1]);
                maxX = Math.max(maxX, reference[0]);
                maxY = Math.max(maxY, reference[1]);
            }
        }

        final BoundingRect rect = new BoundingRect(minX, minY, maxX - minX, maxY - minY);

        LOG.debug("boundingRect: returning {} for {} frames", rect, registeredFrames.size());

        return rect;
    }

    /**
     * Paints the specified frames (in list order) onto a new canvas covering the specified rectangle.
     */
    public static StackCanvas composite(final BoundingRect rect,
                                        final List<RegisteredFrame> registeredFrames) {
        final StackCanvas canvas = new StackCanvas(rect);
        for (final RegisteredFrame registeredFrame : registeredFrames) {
            canvas.addImage(registeredFrame.getFrame().getRaster(), registeredFrame.getTransform());
        }
        return canvas;
    }

    private static final Logger LOG = LoggerFactory.getLogger(Compositor.class);
}
