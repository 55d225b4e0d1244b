package org.lorristack.alignment.stack;

import ij.process.ByteProcessor;

import org.junit.Assert;
import org.junit.Test;
import org.lorristack.alignment.transform.RigidTransform2D;

/**
 * Tests the {@link StackCanvas} class.
 */
public class StackCanvasTest {

    @Test
    public void testUncoveredPixelsAreUntouched() {

        final StackCanvas canvas = new StackCanvas(new BoundingRect(-5, -5, 20, 20));
        canvas.addImage(buildConstantImage(10, 10, 50), RigidTransform2D.identity());

        final ByteProcessor image = canvas.getImage();
        Assert.assertEquals("invalid canvas width", 20, image.getWidth());
        Assert.assertEquals("pixel before frame should be untouched", 0, image.get(0, 0));
        Assert.assertEquals("first frame pixel not painted", 50, image.get(5, 5));
        Assert.assertEquals("last frame pixel not painted", 50, image.get(14, 14));
        Assert.assertEquals("pixel after frame should be untouched", 0, image.get(15, 15));
        Assert.assertEquals("invalid image count", 1, canvas.getImageCount());
    }

    @Test
    public void testLastWriteWins() {

        final StackCanvas canvas = new StackCanvas(new BoundingRect(0, 0, 20, 10));
        canvas.addImage(buildConstantImage(20, 10, 100), RigidTransform2D.identity());

        // second frame covers reference x >= 10
        canvas.addImage(buildConstantImage(10, 10, 200), RigidTransform2D.translation(-10, 0));

        final ByteProcessor image = canvas.getImage();
        Assert.assertEquals("pixel only covered by first frame changed", 100, image.get(5, 5));
        Assert.assertEquals("pixel covered by both frames should hold second frame value", 200, image.get(15, 5));
    }

    @Test
    public void testBilinearSampling() {

        final ByteProcessor source = new ByteProcessor(2, 1);
        source.set(0, 0, 0);
        source.set(1, 0, 100);

        final StackCanvas canvas = new StackCanvas(new BoundingRect(0, 0, 1, 1));
        canvas.addImage(source, RigidTransform2D.translation(0.5, 0));

        Assert.assertEquals("invalid interpolated value", 50, canvas.getImage().get(0, 0));
    }

    @Test
    public void testRectOffset() {

        final ByteProcessor source = new ByteProcessor(20, 20);
        source.set(7, 9, 99);

        final StackCanvas canvas = new StackCanvas(new BoundingRect(5, 5, 10, 10));
        canvas.addImage(source, RigidTransform2D.identity());

        Assert.assertEquals("canvas origin should map to rect origin", 99, canvas.getImage().get(2, 4));
    }

    private static ByteProcessor buildConstantImage(final int width,
                                                    final int height,
                                                    final int value) {
        final ByteProcessor image = new ByteProcessor(width, height);
        image.setValue(value);
        image.fill();
        return image;
    }
}
