package org.lorristack.alignment.match;

import java.util.List;
import java.util.Random;

import Jama.Matrix;
import Jama.SingularValueDecomposition;

import org.lorristack.alignment.match.parameters.RegistrationParameters;
import org.lorristack.alignment.transform.RigidTransform2D;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registers one star set against another.
 *
 * A pairing is found by random sample consensus: two reference stars and two target stars are drawn,
 * the candidate is kept if both pairs preserve their separation, and it is then grown greedily with
 * every remaining pair that preserves its distance to all stars already paired.  The first pairing
 * with at least {@code minPairedStars} pairs is accepted and the least squares rigid transform for
 * it is derived by solving the orthogonal Procrustes problem.
 *
 * Instances hold a random source and are therefore not thread safe.
 */
public class StarSetRegistrar {

    private final int maxIterations;
    private final double maxDistance;
    private final int minPairedStars;
    private final boolean allowReflection;
    private final Random random;

    public StarSetRegistrar(final RegistrationParameters parameters) {
        this(parameters, parameters.buildRandom());
    }

    /**
     * @param  parameters  registration parameters.
     * @param  random      source for candidate sampling (inject a seeded instance for reproducible results).
     */
    public StarSetRegistrar(final RegistrationParameters parameters,
                            final Random random)
            throws IllegalArgumentException {
        parameters.validate();
        this.maxIterations = parameters.maxIterations;
        this.maxDistance = parameters.maxDistance;
        this.minPairedStars = parameters.minPairedStars;
        this.allowReflection = parameters.allowReflection;
        this.random = random;
    }

    /**
     * @param  reference  stars in the reference frame.
     * @param  target     stars in the target frame.
     *
     * @return transform mapping reference frame coordinates to target frame coordinates.
     *
     * @throws RegistrationFailedException
     *   if no consistent pairing of sufficient size can be found.
     */
    public RigidTransform2D register(final StarSet reference,
                                     final StarSet target)
            throws RegistrationFailedException {
        return fitTransform(findPairing(reference, target));
    }

    /**
     * @return the first pairing with at least {@code minPairedStars} mutually consistent pairs.
     *
     * @throws RegistrationFailedException
     *   if either set has too few stars or the iteration budget is exhausted.
     */
    public StarPairing findPairing(final StarSet reference,
                                   final StarSet target)
            throws RegistrationFailedException {

        if ((reference.size() < minPairedStars) || (target.size() < minPairedStars)) {
            throw new RegistrationFailedException(
                    "need at least " + minPairedStars + " stars in each frame but reference has " +
                    reference.size() + " and target has " + target.size());
        }

        final List<Star> referenceStars = reference.getStars();
        final List<Star> targetStars = target.getStars();

        for (int iteration = 0; iteration < maxIterations; iteration++) {

            final StarPairing pairing = pickRandomModel(referenceStars, targetStars);
            if (pairing == null) {
                continue;
            }

            for (final Star referenceStar : referenceStars) {
                if (pairing.isReferenceUsed(referenceStar)) {
                    continue;
                }
                for (final Star targetStar : targetStars) {
                    if (pairing.addIfFits(new StarPair(referenceStar, targetStar))) {
                        break;
                    }
                }
            }

            if (pairing.size() >= minPairedStars) {
                LOG.debug("findPairing: found {} pairs after {} iterations", pairing.size(), iteration + 1);
                return pairing;
            }
        }

        throw new RegistrationFailedException("failed to pair " + minPairedStars + " stars within " +
                                              maxIterations + " iterations");
    }

    /**
     * Solves the orthogonal Procrustes problem for the specified pairing:
     * with the reference stars as rows of P1 and the target stars as rows of P2 (both centered),
     * the cross-covariance P1' * P2 = U * S * V' gives the rotation R = (U * V')' = V * U'.
     * The transpose is needed because the derivation assumes row vectors while the
     * resulting transform is applied to column vectors.
     *
     * @return least squares rigid transform mapping the reference stars onto the target stars.
     */
    public RigidTransform2D fitTransform(final StarPairing pairing) {

        final List<StarPair> pairs = pairing.getPairs();
        final int n = pairs.size();
        if (n < 2) {
            throw new IllegalArgumentException("at least 2 pairs are needed to fit a rigid transform");
        }

        final Matrix p1 = new Matrix(n, 2);
        final Matrix p2 = new Matrix(n, 2);
        for (int row = 0; row < n; row++) {
            final StarPair pair = pairs.get(row);
            p1.set(row, 0, pair.getReference().getX());
            p1.set(row, 1, pair.getReference().getY());
            p2.set(row, 0, pair.getTarget().getX());
            p2.set(row, 1, pair.getTarget().getY());
        }

        final double[] c1 = centroid(p1);
        final double[] c2 = centroid(p2);
        center(p1, c1);
        center(p2, c2);

        final Matrix crossCovariance = p1.transpose().times(p2);
        final SingularValueDecomposition svd = crossCovariance.svd();
        final Matrix u = svd.getU();
        final Matrix v = svd.getV();

        Matrix r = u.times(v.transpose()).transpose();

        if ((! allowReflection) && (r.det() < 0)) {
            // singular values are sorted in decreasing order, so the last column of V is the smallest
            final Matrix flip = Matrix.identity(2, 2);
            flip.set(1, 1, -1.0);
            r = v.times(flip).times(u.transpose());
            LOG.debug("fitTransform: corrected reflection in fit for {} pairs", n);
        }

        final double tx = c2[0] - ((r.get(0, 0) * c1[0]) + (r.get(0, 1) * c1[1]));
        final double ty = c2[1] - ((r.get(1, 0) * c1[0]) + (r.get(1, 1) * c1[1]));

        return new RigidTransform2D(r.get(0, 0), r.get(0, 1), tx,
                                    r.get(1, 0), r.get(1, 1), ty);
    }

    /**
     * @return two pair candidate model if its pairs are distance consistent, otherwise null.
     */
    private StarPairing pickRandomModel(final List<Star> referenceStars,
                                        final List<Star> targetStars) {

        final int[] referenceIndexes = pickTwoDistinct(referenceStars.size());
        final int[] targetIndexes = pickTwoDistinct(targetStars.size());

        final StarPairing model = new StarPairing(maxDistance);
        model.addIfFits(new StarPair(referenceStars.get(referenceIndexes[0]), targetStars.get(targetIndexes[0])));
        final boolean consistent =
                model.addIfFits(new StarPair(referenceStars.get(referenceIndexes[1]),
                                             targetStars.get(targetIndexes[1])));

        return consistent ? model : null;
    }

    private int[] pickTwoDistinct(final int size) {
        final int first = random.nextInt(size);
        int second = random.nextInt(size - 1);
        if (second >= first) {
            second++;
        }
        return new int[] { first, second };
    }

    private static double[] centroid(final Matrix points) {
        final int n = points.getRowDimension();
        final double[] c = new double[2];
        for (int row = 0; row < n; row++) {
            c[0] += points.get(row, 0);
            c[1] += points.get(row, 1);
        }
        c[0] /= n;
        c[1] /= n;
        return c;
    }

    private static void center(final Matrix points,
                               final double[] centroid) {
        for (int row = 0; row < points.getRowDimension(); row++) {
            points.set(row, 0, points.get(row, 0) - centroid[0]);
            points.set(row, 1, points.get(row, 1) - centroid[1]);
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(StarSetRegistrar.class);
}
