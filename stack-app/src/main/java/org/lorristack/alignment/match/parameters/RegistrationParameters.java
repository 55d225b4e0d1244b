package org.lorristack.alignment.match.parameters;

import com.beust.jcommander.Parameter;

import java.io.Serializable;
import java.util.Random;

/**
 * Parameters for registering one star set against another and for chaining registrations across a sequence.
 */
public class RegistrationParameters
        implements Serializable {

    @Parameter(
            names = "--maxIterations",
            description = "Maximum number of random candidate models to try before a pairwise registration fails")
    public Integer maxIterations;

    @Parameter(
            names = "--maxDistance",
            description = "Maximum difference (in pixels) between corresponding star distances in two frames")
    public Double maxDistance;

    @Parameter(
            names = "--minPairedStars",
            description = "Minimum number of consistently paired stars needed to accept a registration")
    public Integer minPairedStars;

    @Parameter(
            names = "--registrationRetries",
            description = "Number of recently registered frames to try as anchors when registration with the first frame fails")
    public Integer registrationRetries;

    @Parameter(
            names = "--allowReflection",
            description = "Accept fitted transforms that mirror the frame instead of forcing a proper rotation")
    public boolean allowReflection = false;

    @Parameter(
            names = "--randomSeed",
            description = "Seed for candidate model sampling (omit for a different seed on every run)")
    public Long randomSeed;

    public RegistrationParameters() {
        setDefaults();
    }

    public void setDefaults() {
        if (maxIterations == null) {
            maxIterations = 100000;
        }
        if (maxDistance == null) {
            maxDistance = 3.0;
        }
        if (minPairedStars == null) {
            minPairedStars = 4;
        }
        if (registrationRetries == null) {
            registrationRetries = 3;
        }
    }

    /**
     * @throws IllegalArgumentException
     *   if any parameter value is out of range.
     */
    public void validate()
            throws IllegalArgumentException {

        setDefaults();

        if (maxIterations < 1) {
            throw new IllegalArgumentException("maxIterations must be positive");
        }
        if (maxDistance < 0.0) {
            throw new IllegalArgumentException("maxDistance must not be negative");
        }
        if (minPairedStars < 2) {
            throw new IllegalArgumentException("minPairedStars must be at least 2");
        }
        if (registrationRetries < 0) {
            throw new IllegalArgumentException("registrationRetries must not be negative");
        }
    }

    public Random buildRandom() {
        return randomSeed == null ? new Random() : new Random(randomSeed);
    }

}
