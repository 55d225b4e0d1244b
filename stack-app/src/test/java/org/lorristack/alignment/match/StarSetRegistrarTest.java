package org.lorristack.alignment.match;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import org.junit.Assert;
import org.junit.Test;
import org.lorristack.alignment.match.parameters.RegistrationParameters;
import org.lorristack.alignment.transform.RigidTransform2D;

/**
 * Tests the {@link StarSetRegistrar} class.
 */
public class StarSetRegistrarTest {

    @Test
    public void testSelfRegistration() throws Exception {

        final StarSet stars = StarSet.fromCoordinates(TRUE_REFERENCE_STARS);
        final StarSetRegistrar registrar = new StarSetRegistrar(new RegistrationParameters(), new Random(1));

        final RigidTransform2D transform = registrar.register(stars, stars);

        Assert.assertTrue("self registration should be identity but was " + transform,
                          transform.isWithinEpsilon(RigidTransform2D.identity(), 1e-6));
    }

    @Test
    public void testRecoverNoisyTransform() throws Exception {

        final StarSet reference = StarSet.fromCoordinates(concat(TRUE_REFERENCE_STARS, SPURIOUS_REFERENCE_STARS));
        final StarSet target = StarSet.fromCoordinates(concat(TRUE_TARGET_STARS, SPURIOUS_TARGET_STARS));

        for (final long seed : new long[] { 1, 2, 3 }) {

            final StarSetRegistrar registrar = new StarSetRegistrar(new RegistrationParameters(), new Random(seed));
            final RigidTransform2D transform = registrar.register(reference, target);

            Assert.assertEquals("invalid angle for seed " + seed,
                                Math.toRadians(12), transform.getRotationAngle(), 1e-3);
            Assert.assertEquals("invalid x translation for seed " + seed,
                                -17.5, transform.getTranslateX(), 0.1);
            Assert.assertEquals("invalid y translation for seed " + seed,
                                9.25, transform.getTranslateY(), 0.1);
        }
    }

    @Test
    public void testPairingConsistency() throws Exception {

        final StarSet reference = StarSet.fromCoordinates(concat(TRUE_REFERENCE_STARS, SPURIOUS_REFERENCE_STARS));
        final StarSet target = StarSet.fromCoordinates(concat(TRUE_TARGET_STARS, SPURIOUS_TARGET_STARS));

        final RegistrationParameters parameters = new RegistrationParameters();
        final StarSetRegistrar registrar = new StarSetRegistrar(parameters, new Random(42));

        final StarPairing pairing = registrar.findPairing(reference, target);
        final List<StarPair> pairs = pairing.getPairs();

        Assert.assertTrue("too few pairs", pairs.size() >= parameters.minPairedStars);

        for (int i = 0; i < pairs.size(); i++) {
            for (int j = i + 1; j < pairs.size(); j++) {
                final StarPair a = pairs.get(i);
                final StarPair b = pairs.get(j);
                Assert.assertNotSame("reference star paired twice", a.getReference(), b.getReference());
                Assert.assertNotSame("target star paired twice", a.getTarget(), b.getTarget());
                final double referenceDistance = a.getReference().distanceTo(b.getReference());
                final double targetDistance = a.getTarget().distanceTo(b.getTarget());
                Assert.assertTrue("pairs " + a + " and " + b + " are not distance consistent",
                                  Math.abs(referenceDistance - targetDistance) <= parameters.maxDistance);
            }
        }
    }

    @Test
    public void testInsufficientOverlapFails() {

        final RegistrationParameters parameters = new RegistrationParameters();
        parameters.maxIterations = 5000;
        final StarSetRegistrar registrar = new StarSetRegistrar(parameters, new Random(7));

        try {
            registrar.register(StarSet.fromCoordinates(THREE_SHARED_A), StarSet.fromCoordinates(THREE_SHARED_B));
            Assert.fail("registration with only three shared stars should fail");
        } catch (final RegistrationFailedException e) {
            Assert.assertTrue("message should mention iterations", e.getMessage().contains("5000"));
        }
    }

    @Test(expected = RegistrationFailedException.class)
    public void testTooFewStarsFails() throws Exception {
        final StarSet tiny = StarSet.fromCoordinates(new double[][] {{1, 2}, {30, 40}, {50, 5}});
        new StarSetRegistrar(new RegistrationParameters(), new Random(1)).register(tiny, tiny);
    }

    @Test
    public void testReflectionHandling() {

        final StarPairing mirroredPairing = new StarPairing(3.0);
        for (final double[] xy : TRUE_REFERENCE_STARS) {
            Assert.assertTrue("mirrored pair should fit",
                              mirroredPairing.addIfFits(new StarPair(new Star(xy[0], xy[1]),
                                                                     new Star(-xy[0], xy[1]))));
        }

        final RegistrationParameters parameters = new RegistrationParameters();

        final RigidTransform2D properFit = new StarSetRegistrar(parameters, new Random(1)).fitTransform(mirroredPairing);
        Assert.assertEquals("reflection should be removed", 1.0, properFit.getRotationDeterminant(), 1e-9);

        parameters.allowReflection = true;
        final RigidTransform2D mirrorFit = new StarSetRegistrar(parameters, new Random(1)).fitTransform(mirroredPairing);
        Assert.assertEquals("reflection should be kept", -1.0, mirrorFit.getRotationDeterminant(), 1e-9);

        final double[] mapped = mirrorFit.apply(TRUE_REFERENCE_STARS[3][0], TRUE_REFERENCE_STARS[3][1]);
        Assert.assertEquals("invalid mirrored x", -TRUE_REFERENCE_STARS[3][0], mapped[0], 1e-6);
        Assert.assertEquals("invalid mirrored y", TRUE_REFERENCE_STARS[3][1], mapped[1], 1e-6);
    }

    @Test
    public void testFitKnownTransform() {

        final RigidTransform2D expected = RigidTransform2D.fromAngleAndTranslation(Math.toRadians(-33), 4.5, 60.0);

        final StarPairing pairing = new StarPairing(0.001);
        for (final double[] xy : TRUE_REFERENCE_STARS) {
            final double[] moved = expected.apply(xy[0], xy[1]);
            pairing.addIfFits(new StarPair(new Star(xy[0], xy[1]), new Star(moved[0], moved[1])));
        }

        final RigidTransform2D fit = new StarSetRegistrar(new RegistrationParameters(), new Random(1)).fitTransform(pairing);

        Assert.assertTrue("expected " + expected + " but fit " + fit, fit.isWithinEpsilon(expected, 1e-9));
    }

    static double[][] concat(final double[][] a,
                             final double[][] b) {
        final List<double[]> list = new ArrayList<>();
        for (final double[] xy : a) {
            list.add(xy);
        }
        for (final double[] xy : b) {
            list.add(xy);
        }
        return list.toArray(new double[0][]);
    }

    // target stars are the reference stars rotated by 12 degrees, translated by (-17.5, 9.25)
    // and perturbed by up to 0.2 pixels
    static final double[][] TRUE_REFERENCE_STARS = {
            {238.0, 246.6}, {145.5, 78.5}, {0.1, 198.8}, {141.1, 227.9}, {111.9, 231.0}, {81.8, 240.6},
            {218.9, 124.2}, {161.5, 204.6}, {57.9, 166.1}, {241.5, 79.7}, {241.0, 205.7}, {253.3, 100.7}
    };

    static final double[][] SPURIOUS_REFERENCE_STARS = {
            {27.9, 240.1}, {241.4, 133.6}, {28.1, 59.1}, {190.5, 87.4}
    };

    static final double[][] TRUE_TARGET_STARS = {
            {164.228, 299.844}, {108.349, 116.486}, {-58.635, 203.827}, {72.934, 261.306},
            {43.977, 258.317}, {12.689, 261.649}, {170.694, 176.398}, {98.082, 242.907},
            {4.551, 183.658}, {202.252, 137.619}, {175.266, 260.662}, {209.328, 160.213}
    };

    static final double[][] SPURIOUS_TARGET_STARS = {
            {285.4, 176.6}, {60.3, 196.6}, {108.1, 279.8}, {272.9, 154.4}
    };

    private static final double[][] THREE_SHARED_A = {
            {3.7, 33.7}, {117.9, 205.2}, {41.6, 33.7}, {69.5, 227.3},
            {44.2, 222.2}, {198.6, 41.0}, {160.7, 134.3}, {123.8, 298.9}
    };

    private static final double[][] THREE_SHARED_B = {
            {25.003, 40.402}, {190.972, 162.501}, {60.617, 27.44}, {27.9, 6.1},
            {281.9, 120.9}, {59.5, 99.1}, {109.5, 286.5}, {63.1, 65.1}
    };
}
