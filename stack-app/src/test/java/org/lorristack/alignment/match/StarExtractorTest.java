package org.lorristack.alignment.match;

import ij.process.ByteProcessor;

import java.util.List;

import org.junit.Assert;
import org.junit.Test;
import org.lorristack.alignment.match.parameters.StarExtractionParameters;

/**
 * Tests the {@link StarExtractor} class.
 */
public class StarExtractorTest {

    @Test
    public void testExtract() throws Exception {

        final int[][] centers = {
                {20, 20}, {60, 25}, {110, 18}, {160, 30}, {30, 80},
                {90, 90}, {150, 85}, {40, 150}, {100, 160}, {170, 170}
        };

        final StarSet stars = new StarExtractor(new StarExtractionParameters()).extract(buildSky(centers));

        Assert.assertEquals("invalid number of stars", centers.length, stars.size());

        for (final int[] center : centers) {
            boolean found = false;
            for (final Star star : stars.getStars()) {
                if ((Math.abs(star.getX() - center[0]) < 1e-6) && (Math.abs(star.getY() - center[1]) < 1e-6)) {
                    found = true;
                    break;
                }
            }
            Assert.assertTrue("missing star at " + center[0] + "," + center[1] + " in " + stars.getStars(), found);
        }
    }

    @Test
    public void testTooFewStars() {
        final int[][] centers = {{20, 20}, {100, 100}, {170, 30}};
        try {
            new StarExtractor(new StarExtractionParameters()).extract(buildSky(centers));
            Assert.fail("extraction should fail for " + centers.length + " stars");
        } catch (final ExtractFailedException e) {
            Assert.assertTrue("invalid message " + e.getMessage(), e.getMessage().startsWith("too few stars (3)"));
        }
    }

    @Test
    public void testTooManyStars() {
        final int[][] centers = new int[60][];
        for (int i = 0; i < centers.length; i++) {
            centers[i] = new int[] { 10 + (i % 9) * 20, 10 + (i / 9) * 20 };
        }
        try {
            new StarExtractor(new StarExtractionParameters()).extract(buildSky(centers));
            Assert.fail("extraction should fail for " + centers.length + " stars");
        } catch (final ExtractFailedException e) {
            Assert.assertTrue("invalid message " + e.getMessage(), e.getMessage().startsWith("too many stars (60)"));
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testEvenDilationSizeIsRejected() {
        final StarExtractionParameters parameters = new StarExtractionParameters();
        parameters.dilationSize = 8;
        new StarExtractor(parameters);
    }

    @Test
    public void testFindThresholdLevel() throws Exception {

        final int[] histogram = new int[256];
        histogram[10] = 90;
        histogram[200] = 10;

        final StarExtractor extractor = new StarExtractor(new StarExtractionParameters());
        Assert.assertEquals("invalid level when 10% of pixels are bright", 200, extractor.findThresholdLevel(histogram));

        histogram[200] = 2;
        histogram[10] = 98;
        Assert.assertEquals("invalid level when 2% of pixels are bright", 10, extractor.findThresholdLevel(histogram));
    }

    @Test
    public void testDilationMergesNearbyPixels() {

        final ByteProcessor mask = new ByteProcessor(30, 10);
        mask.set(5, 5, StarExtractor.FOREGROUND);
        mask.set(12, 5, StarExtractor.FOREGROUND);
        mask.set(25, 5, StarExtractor.FOREGROUND);

        StarExtractor.dilate(mask, 9);
        final List<StarExtractor.Region> regions = StarExtractor.findRegions(mask, mask);

        Assert.assertEquals("pixels 7 apart should merge while pixel 13 away stays separate", 2, regions.size());
    }

    @Test
    public void testDilationUsesSquare() {

        final ByteProcessor mask = new ByteProcessor(30, 20);
        mask.set(15, 10, StarExtractor.FOREGROUND);

        StarExtractor.dilate(mask, 9);

        Assert.assertEquals("corner of square should be set", StarExtractor.FOREGROUND, mask.get(11, 6));
        Assert.assertEquals("corner of square should be set", StarExtractor.FOREGROUND, mask.get(19, 14));
        Assert.assertEquals("pixel outside square should not be set", 0, mask.get(20, 10));

        final List<StarExtractor.Region> regions = StarExtractor.findRegions(mask, mask);
        Assert.assertEquals("invalid number of regions", 1, regions.size());
        Assert.assertEquals("invalid region size", 81, regions.get(0).getPixelCount());
    }

    @Test
    public void testSinglePixelRegionsAreDropped() {

        final ByteProcessor mask = new ByteProcessor(10, 10);
        mask.set(2, 2, StarExtractor.FOREGROUND);
        mask.set(6, 6, StarExtractor.FOREGROUND);
        mask.set(7, 7, StarExtractor.FOREGROUND);

        final List<StarExtractor.Region> regions = StarExtractor.findRegions(mask, mask);

        Assert.assertEquals("only the diagonal pair should remain", 1, regions.size());
        Assert.assertEquals("invalid region size", 2, regions.get(0).getPixelCount());
    }

    /**
     * @return 200x200 frame with a dim background and a symmetric 5x5 blob at each center.
     */
    private static ByteProcessor buildSky(final int[][] centers) {
        final ByteProcessor sky = new ByteProcessor(200, 200);
        sky.setValue(10);
        sky.fill();
        for (final int[] center : centers) {
            for (int dy = -2; dy <= 2; dy++) {
                for (int dx = -2; dx <= 2; dx++) {
                    sky.set(center[0] + dx, center[1] + dy, 250 - (30 * (Math.abs(dx) + Math.abs(dy))));
                }
            }
        }
        return sky;
    }
}
