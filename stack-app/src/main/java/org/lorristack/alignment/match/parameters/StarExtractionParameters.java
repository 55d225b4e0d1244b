package org.lorristack.alignment.match.parameters;

import com.beust.jcommander.Parameter;

import java.io.Serializable;

/**
 * Parameters for extracting stars from a raw frame.
 * Frames are thresholded at {@code k + thresholdBias}, where k is the lowest level
 * leaving fewer than {@code thresholdFraction} of all pixels brighter than k.
 */
public class StarExtractionParameters
        implements Serializable {

    @Parameter(
            names = "--thresholdFraction",
            description = "Fraction of frame pixels allowed above the base threshold level")
    public Double thresholdFraction;

    @Parameter(
            names = "--thresholdBias",
            description = "Amount added to the base threshold level")
    public Integer thresholdBias;

    @Parameter(
            names = "--dilationSize",
            description = "Odd width and height of the square used to dilate thresholded pixels so that blobs from one star merge")
    public Integer dilationSize;

    @Parameter(
            names = "--minStars",
            description = "Minimum number of stars a frame must contain")
    public Integer minStars;

    @Parameter(
            names = "--maxStars",
            description = "Maximum number of stars a frame may contain")
    public Integer maxStars;

    public StarExtractionParameters() {
        setDefaults();
    }

    public void setDefaults() {
        if (thresholdFraction == null) {
            thresholdFraction = 0.025;
        }
        if (thresholdBias == null) {
            thresholdBias = 2;
        }
        if (dilationSize == null) {
            dilationSize = 9;
        }
        if (minStars == null) {
            minStars = 8;
        }
        if (maxStars == null) {
            maxStars = 50;
        }
    }

    public void validate()
            throws IllegalArgumentException {

        setDefaults();

        if ((thresholdFraction <= 0.0) || (thresholdFraction >= 1.0)) {
            throw new IllegalArgumentException("thresholdFraction must be between 0 and 1");
        }
        if ((dilationSize < 1) || (dilationSize % 2 == 0)) {
            throw new IllegalArgumentException("dilationSize must be a positive odd number");
        }
        if (minStars > maxStars) {
            throw new IllegalArgumentException("minStars (" + minStars + ") must not exceed maxStars (" +
                                               maxStars + ")");
        }
    }
}
