package org.lorristack.alignment.stack;

import java.io.Serializable;

/**
 * Axis aligned rectangle in sequence anchor (reference) coordinates.
 */
public class BoundingRect
        implements Serializable {

    /** Tolerance for floating point noise from back-projected frame corners. */
    public static final double PIXEL_EPSILON = 1.0e-6;

    private final double x;
    private final double y;
    private final double width;
    private final double height;

    public BoundingRect(final double x,
                        final double y,
                        final double width,
                        final double height)
            throws IllegalArgumentException {
        if ((width < 0) || (height < 0)) {
            throw new IllegalArgumentException("width and height must not be negative");
        }
        this.x = x;
        this.y = y;
        this.width = width;
        this.height = height;
    }

    /**
     * @param  value  rectangle formatted as "x,y,w,h".
     *
     * @throws IllegalArgumentException
     *   if the value is malformed.
     */
    public static BoundingRect parse(final String value)
            throws IllegalArgumentException {

        final String[] tokens = value == null ? new String[0] : value.split(",");
        if (tokens.length != 4) {
            throw new IllegalArgumentException("rectangle '" + value + "' must be formatted as x,y,w,h");
        }

        final double[] parsed = new double[4];
        for (int i = 0; i < tokens.length; i++) {
            try {
                parsed[i] = Double.parseDouble(tokens[i].trim());
            } catch (final NumberFormatException e) {
                throw new IllegalArgumentException("rectangle '" + value + "' contains non-numeric value '" +
                                                   tokens[i] + "'", e);
            }
        }

        return new BoundingRect(parsed[0], parsed[1], parsed[2], parsed[3]);
    }

    public double getX() {
        return x;
    }

    public double getY() {
        return y;
    }

    public double getWidth() {
        return width;
    }

    public double getHeight() {
        return height;
    }

    public double getMaxX() {
        return x + width;
    }

    public double getMaxY() {
        return y + height;
    }

    /**
     * @return number of pixel columns needed to cover this rectangle
     *         (sizes within {@link #PIXEL_EPSILON} of a whole pixel are not rounded up).
     */
    public int getPixelWidth() {
        return (int) Math.ceil(width - PIXEL_EPSILON);
    }

    /**
     * @return number of pixel rows needed to cover this rectangle
     *         (sizes within {@link #PIXEL_EPSILON} of a whole pixel are not rounded up).
     */
    public int getPixelHeight() {
        return (int) Math.ceil(height - PIXEL_EPSILON);
    }

    public boolean contains(final double px,
                            final double py) {
        return (px >= x) && (px <= getMaxX()) && (py >= y) && (py <= getMaxY());
    }

    /**
     * @return intersection of this rectangle with the crop rectangle or null if they do not overlap.
     */
    public BoundingRect crop(final BoundingRect cropRect) {
        final double minX = Math.max(x, cropRect.x);
        final double minY = Math.max(y, cropRect.y);
        final double maxX = Math.min(getMaxX(), cropRect.getMaxX());
        final double maxY = Math.min(getMaxY(), cropRect.getMaxY());
        if ((maxX <= minX) || (maxY <= minY)) {
            return null;
        }
        return new BoundingRect(minX, minY, maxX - minX, maxY - minY);
    }

    @Override
    public String toString() {
        return String.format("[%.1f, %.1f, %.1f, %.1f]", x, y, width, height);
    }
}
