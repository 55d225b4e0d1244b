package org.lorristack.alignment.stack;

import ij.process.ByteProcessor;
import ij.process.ImageProcessor;

import org.lorristack.alignment.transform.RigidTransform2D;

/**
 * 8-bit canvas covering a {@link BoundingRect} into which registered frames are painted.
 * Canvas pixel (0, 0) corresponds to reference coordinate (rect.x, rect.y).
 *
 * Painting overwrites: where frames overlap, the most recently added frame wins.
 * A canvas must only be written by one thread at a time.
 */
public class StackCanvas {

    private final BoundingRect rect;
    private final ByteProcessor image;
    private int imageCount;

    public StackCanvas(final BoundingRect rect) {
        this.rect = rect;
        this.image = new ByteProcessor(Math.max(1, rect.getPixelWidth()), Math.max(1, rect.getPixelHeight()));
        this.imageCount = 0;
    }

    public BoundingRect getRect() {
        return rect;
    }

    public ByteProcessor getImage() {
        return image;
    }

    public int getImageCount() {
        return imageCount;
    }

    /**
     * Resamples the source into this canvas.  Each canvas pixel is mapped to reference
     * coordinates, then through the transform into source coordinates where the source is
     * bilinearly sampled.  Canvas pixels that map outside the source are left unchanged.
     *
     * @param  source     frame pixels.
     * @param  transform  maps reference coordinates to source frame coordinates.
     */
    public void addImage(final ImageProcessor source,
                         final RigidTransform2D transform) {

        // translate canvas pixel locations to reference coordinates before applying the frame transform
        final RigidTransform2D canvasToSource =
                transform.concatenate(RigidTransform2D.translation(rect.getX(), rect.getY()));

        final double a = canvasToSource.get(0, 0);
        final double b = canvasToSource.get(0, 1);
        final double tx = canvasToSource.get(0, 2);
        final double c = canvasToSource.get(1, 0);
        final double d = canvasToSource.get(1, 1);
        final double ty = canvasToSource.get(1, 2);

        final int sourceMaxX = source.getWidth() - 1;
        final int sourceMaxY = source.getHeight() - 1;
        final int width = image.getWidth();
        final int height = image.getHeight();

        for (int cy = 0; cy < height; cy++) {
            for (int cx = 0; cx < width; cx++) {
                final double sx = (a * cx) + (b * cy) + tx;
                final double sy = (c * cx) + (d * cy) + ty;
                if ((sx >= 0) && (sy >= 0) && (sx <= sourceMaxX) && (sy <= sourceMaxY)) {
                    image.set(cx, cy, (int) Math.round(sampleBilinear(source, sx, sy)));
                }
            }
        }

        imageCount++;
    }

    static double sampleBilinear(final ImageProcessor source,
                                 final double x,
                                 final double y) {
        final int x0 = (int) x;
        final int y0 = (int) y;
        final int x1 = Math.min(x0 + 1, source.getWidth() - 1);
        final int y1 = Math.min(y0 + 1, source.getHeight() - 1);
        final double fx = x - x0;
        final double fy = y - y0;

        final double top = ((1 - fx) * source.getf(x0, y0)) + (fx * source.getf(x1, y0));
        final double bottom = ((1 - fx) * source.getf(x0, y1)) + (fx * source.getf(x1, y1));
        return ((1 - fy) * top) + (fy * bottom);
    }
}
