package org.lorristack.alignment.stack;

import ij.process.ByteProcessor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.junit.Assert;
import org.junit.Test;
import org.lorristack.alignment.transform.RigidTransform2D;

/**
 * Tests the {@link Compositor} class.
 */
public class CompositorTest {

    @Test
    public void testSingleIdentityFrame() {

        final List<RegisteredFrame> frames =
                Collections.singletonList(buildRegisteredFrame(0, 40, 30, RigidTransform2D.identity()));

        final BoundingRect rect = Compositor.boundingRect(frames);

        Assert.assertEquals("invalid x", 0.0, rect.getX(), 1e-12);
        Assert.assertEquals("invalid y", 0.0, rect.getY(), 1e-12);
        Assert.assertEquals("invalid width", 40.0, rect.getWidth(), 1e-12);
        Assert.assertEquals("invalid height", 30.0, rect.getHeight(), 1e-12);
    }

    @Test
    public void testTranslatedFrame() {

        // frame coordinates are reference coordinates shifted by (10, 5)
        final List<RegisteredFrame> frames = new ArrayList<>();
        frames.add(buildRegisteredFrame(0, 40, 30, RigidTransform2D.identity()));
        frames.add(buildRegisteredFrame(60, 40, 30, RigidTransform2D.translation(10, 5)));

        final BoundingRect rect = Compositor.boundingRect(frames);

        Assert.assertEquals("invalid x", -10.0, rect.getX(), 1e-12);
        Assert.assertEquals("invalid y", -5.0, rect.getY(), 1e-12);
        Assert.assertEquals("invalid width", 50.0, rect.getWidth(), 1e-12);
        Assert.assertEquals("invalid height", 35.0, rect.getHeight(), 1e-12);
    }

    @Test
    public void testRotatedFramesAreContained() {

        final List<RegisteredFrame> frames = new ArrayList<>();
        frames.add(buildRegisteredFrame(0, 64, 48, RigidTransform2D.identity()));
        frames.add(buildRegisteredFrame(60, 64, 48, RigidTransform2D.fromAngleAndTranslation(0.4, -7, 12)));
        frames.add(buildRegisteredFrame(120, 64, 48, RigidTransform2D.fromAngleAndTranslation(-1.1, 30, 2)));

        final BoundingRect rect = Compositor.boundingRect(frames);

        for (final RegisteredFrame frame : frames) {
            final RigidTransform2D inverse = frame.getTransform().createInverse();
            for (final double[] corner : new double[][] {{0, 0}, {64, 0}, {0, 48}, {64, 48}}) {
                final double[] reference = inverse.apply(corner[0], corner[1]);
                Assert.assertTrue("corner " + reference[0] + "," + reference[1] + " of frame " + frame +
                                  " is outside " + rect,
                                  rect.contains(reference[0], reference[1]));
            }
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testEmptyInput() {
        Compositor.boundingRect(new ArrayList<>());
    }

    @Test
    public void testCompositeSingleFrameIsCopy() {

        final RegisteredFrame frame = buildRegisteredFrame(0, 12, 9, RigidTransform2D.identity());
        final ByteProcessor raster = (ByteProcessor) frame.getFrame().getRaster();
        for (int y = 0; y < raster.getHeight(); y++) {
            for (int x = 0; x < raster.getWidth(); x++) {
                raster.set(x, y, (x * 20 + y) % 256);
            }
        }

        final List<RegisteredFrame> frames = Collections.singletonList(frame);
        final StackCanvas canvas = Compositor.composite(Compositor.boundingRect(frames), frames);

        Assert.assertEquals("invalid canvas width", 12, canvas.getImage().getWidth());
        Assert.assertEquals("invalid canvas height", 9, canvas.getImage().getHeight());
        for (int y = 0; y < raster.getHeight(); y++) {
            for (int x = 0; x < raster.getWidth(); x++) {
                Assert.assertEquals("invalid pixel (" + x + "," + y + ")",
                                    raster.get(x, y), canvas.getImage().get(x, y));
            }
        }
    }

    static RegisteredFrame buildRegisteredFrame(final long timestamp,
                                                final int width,
                                                final int height,
                                                final RigidTransform2D transform) {
        return new RegisteredFrame(new Frame(timestamp, new ByteProcessor(width, height), null), transform);
    }
}
