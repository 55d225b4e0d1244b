package org.lorristack.alignment.match;

import ij.process.ByteProcessor;
import ij.process.FloodFiller;
import ij.process.ImageProcessor;
import ij.process.ShortProcessor;

import java.util.ArrayList;
import java.util.List;

import org.lorristack.alignment.match.parameters.StarExtractionParameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Detects stars in an 8-bit frame.
 *
 * The frame is thresholded so that only a small fraction of its pixels remain, the thresholded mask
 * is dilated so that fragments of one star merge, and every 8-connected region of the dilated mask
 * becomes one star located at the intensity weighted centroid of the original pixels inside the region.
 *
 * Instances hold no mutable state and may be shared across threads.
 */
public class StarExtractor {

    /** Mask value of thresholded pixels. */
    static final int FOREGROUND = 255;

    private final StarExtractionParameters parameters;

    public StarExtractor(final StarExtractionParameters parameters)
            throws IllegalArgumentException {
        parameters.validate();
        this.parameters = parameters;
    }

    /**
     * @param  image  frame to extract stars from (values are read as 8-bit intensities).
     *
     * @return the detected stars.
     *
     * @throws ExtractFailedException
     *   if no usable threshold level exists or the number of detected stars is out of bounds.
     */
    public StarSet extract(final ImageProcessor image)
            throws ExtractFailedException {

        final ByteProcessor gray = image.convertToByteProcessor(false);

        final int level = findThresholdLevel(gray.getHistogram()) + parameters.thresholdBias;

        final ByteProcessor mask = (ByteProcessor) gray.duplicate();
        mask.applyTable(buildThresholdTable(level));

        dilate(mask, parameters.dilationSize);

        final List<Region> regions = findRegions(mask, gray);

        if (regions.size() > parameters.maxStars) {
            throw new ExtractFailedException("too many stars (" + regions.size() + "), maximum is " +
                                             parameters.maxStars);
        }
        if (regions.size() < parameters.minStars) {
            throw new ExtractFailedException("too few stars (" + regions.size() + "), minimum is " +
                                             parameters.minStars);
        }

        final List<Star> stars = new ArrayList<>(regions.size());
        for (final Region region : regions) {
            if (region.weight > 0) {
                stars.add(new Star(region.weightedX / region.weight, region.weightedY / region.weight));
            }
        }

        LOG.debug("extract: found {} stars using threshold level {}", stars.size(), level);

        return new StarSet(stars);
    }

    /**
     * @param  histogram  256 bin intensity histogram of a frame.
     *
     * @return lowest level k for which fewer than thresholdFraction of all pixels are brighter than k.
     */
    int findThresholdLevel(final int[] histogram)
            throws ExtractFailedException {

        int pixelCount = 0;
        for (final int count : histogram) {
            pixelCount += count;
        }

        final double maxBrighterCount = pixelCount * parameters.thresholdFraction;
        int brighterCount = pixelCount - histogram[0];
        for (int k = 0; k < histogram.length; k++) {
            if (brighterCount < maxBrighterCount) {
                return k;
            }
            if (k + 1 < histogram.length) {
                brighterCount -= histogram[k + 1];
            }
        }

        throw new ExtractFailedException("image too bright");
    }

    /**
     * @return lookup table mapping levels above the specified level to {@link #FOREGROUND} and all others to 0.
     */
    static int[] buildThresholdTable(final int level) {
        final int[] table = new int[256];
        for (int i = Math.max(0, level + 1); i < table.length; i++) {
            table[i] = FOREGROUND;
        }
        return table;
    }

    /**
     * Dilates the {@link #FOREGROUND} pixels of a binary mask in place with a centered size x size square,
     * built from repeated 3x3 maximum filters.
     *
     * @param  size  odd width of the square.
     */
    static void dilate(final ByteProcessor mask,
                       final int size) {
        for (int pass = 0; pass < (size - 1) / 2; pass++) {
            mask.filter(ImageProcessor.MAX);
        }
    }

    /**
     * Labels the 8-connected {@link #FOREGROUND} regions of a binary mask.
     *
     * @param  mask     binary mask.
     * @param  weights  intensities used to weight each region's centroid.
     *
     * @return every region with more than one pixel, in scan order of each region's first pixel.
     */
    static List<Region> findRegions(final ByteProcessor mask,
                                    final ImageProcessor weights) {

        final int width = mask.getWidth();
        final int height = mask.getHeight();

        // labels start above the foreground value so unvisited pixels stay distinguishable
        final ShortProcessor labels = mask.convertToShortProcessor(false);
        final FloodFiller filler = new FloodFiller(labels);

        final List<Region> allRegions = new ArrayList<>();
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                if (labels.get(x, y) == FOREGROUND) {
                    final int label = FOREGROUND + 1 + allRegions.size();
                    if (label > MAX_LABEL) {
                        throw new IllegalStateException("mask has more than " + (MAX_LABEL - FOREGROUND) +
                                                        " regions");
                    }
                    labels.setValue(label);
                    filler.fill8(x, y);
                    allRegions.add(new Region());
                }
            }
        }

        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                final int label = labels.get(x, y);
                if (label > FOREGROUND) {
                    allRegions.get(label - FOREGROUND - 1).add(x, y, weights.getf(x, y));
                }
            }
        }

        final List<Region> regions = new ArrayList<>(allRegions.size());
        for (final Region region : allRegions) {
            // single pixel regions are noise
            if (region.pixelCount > 1) {
                regions.add(region);
            }
        }

        return regions;
    }

    /**
     * Pixel count and intensity moments of one labelled region.
     */
    static class Region {

        private int pixelCount;
        private double weight;
        private double weightedX;
        private double weightedY;

        private void add(final int x,
                         final int y,
                         final double value) {
            pixelCount++;
            weight += value;
            weightedX += value * x;
            weightedY += value * y;
        }

        int getPixelCount() {
            return pixelCount;
        }
    }

    private static final int MAX_LABEL = 65535;

    private static final Logger LOG = LoggerFactory.getLogger(StarExtractor.class);
}
