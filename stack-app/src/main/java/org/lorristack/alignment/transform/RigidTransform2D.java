package org.lorristack.alignment.transform;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.io.Serializable;
import java.util.Arrays;

import Jama.Matrix;

import org.lorristack.alignment.json.JsonUtils;

/**
 * A 2D rotation plus translation stored as a 3x3 homogeneous matrix.
 * The transform maps reference coordinates (column vectors) to target coordinates:
 *
 * <pre>
 *   | r00 r01 tx |
 *   | r10 r11 ty |
 *   |  0   0   1 |
 * </pre>
 *
 * Instances are immutable.  The bottom row is always [0, 0, 1].
 */
public class RigidTransform2D
        implements Serializable {

    /** Row major 3x3 values. */
    private final double[] values;

    // no-arg constructor needed for JSON deserialization
    @SuppressWarnings("unused")
    private RigidTransform2D() {
        this(1, 0, 0, 0, 1, 0);
    }

    public RigidTransform2D(final double r00,
                            final double r01,
                            final double tx,
                            final double r10,
                            final double r11,
                            final double ty) {
        this.values = new double[] {
                r00, r01, tx,
                r10, r11, ty,
                0.0, 0.0, 1.0
        };
    }

    /**
     * @param  homogeneousMatrix  3x3 matrix whose bottom row is ignored and replaced with [0, 0, 1].
     *
     * @throws IllegalArgumentException
     *   if the matrix is not 3x3.
     */
    public static RigidTransform2D fromMatrix(final Matrix homogeneousMatrix)
            throws IllegalArgumentException {
        if ((homogeneousMatrix.getRowDimension() != 3) || (homogeneousMatrix.getColumnDimension() != 3)) {
            throw new IllegalArgumentException("homogeneous matrix must be 3x3");
        }
        return new RigidTransform2D(homogeneousMatrix.get(0, 0), homogeneousMatrix.get(0, 1), homogeneousMatrix.get(0, 2),
                                    homogeneousMatrix.get(1, 0), homogeneousMatrix.get(1, 1), homogeneousMatrix.get(1, 2));
    }

    public static RigidTransform2D identity() {
        return new RigidTransform2D(1, 0, 0, 0, 1, 0);
    }

    /**
     * @return transform that rotates counter-clockwise (in a y-up frame) by the specified angle
     *         about the origin and then translates.
     */
    public static RigidTransform2D fromAngleAndTranslation(final double radians,
                                                           final double tx,
                                                           final double ty) {
        final double cos = Math.cos(radians);
        final double sin = Math.sin(radians);
        return new RigidTransform2D(cos, -sin, tx, sin, cos, ty);
    }

    public static RigidTransform2D translation(final double tx,
                                               final double ty) {
        return new RigidTransform2D(1, 0, tx, 0, 1, ty);
    }

    public double get(final int row,
                      final int column) {
        return values[(row * 3) + column];
    }

    @JsonIgnore
    public double getTranslateX() {
        return values[2];
    }

    @JsonIgnore
    public double getTranslateY() {
        return values[5];
    }

    @JsonIgnore
    public double getRotationAngle() {
        return Math.atan2(values[3], values[0]);
    }

    /**
     * @return determinant of the 2x2 rotation block (+1 for a proper rotation, -1 for a reflection).
     */
    @JsonIgnore
    public double getRotationDeterminant() {
        return (values[0] * values[4]) - (values[1] * values[3]);
    }

    @JsonIgnore
    public Matrix getMatrix() {
        return new Matrix(values, 3).transpose();
    }

    /**
     * @return location of the specified reference point in target coordinates.
     */
    public double[] apply(final double x,
                          final double y) {
        return new double[] {
                (values[0] * x) + (values[1] * y) + values[2],
                (values[3] * x) + (values[4] * y) + values[5]
        };
    }

    /**
     * @return location of the specified target point in reference coordinates.
     */
    public double[] applyInverse(final double x,
                                 final double y) {
        return createInverse().apply(x, y);
    }

    /**
     * @return inverse transform (mapping target coordinates back to reference coordinates).
     *
     * @throws IllegalStateException
     *   if the rotation block is singular.
     */
    public RigidTransform2D createInverse()
            throws IllegalStateException {

        final double det = getRotationDeterminant();
        if (Math.abs(det) < SINGULAR_THRESHOLD) {
            throw new IllegalStateException("cannot invert singular transform " + this);
        }

        final double i00 = values[4] / det;
        final double i01 = -values[1] / det;
        final double i10 = -values[3] / det;
        final double i11 = values[0] / det;
        final double itx = -((i00 * values[2]) + (i01 * values[5]));
        final double ity = -((i10 * values[2]) + (i11 * values[5]));

        return new RigidTransform2D(i00, i01, itx, i10, i11, ity);
    }

    /**
     * @return matrix product (this * other), i.e. a transform that first applies other and then this.
     */
    public RigidTransform2D concatenate(final RigidTransform2D other) {
        final Matrix product = getMatrix().times(other.getMatrix());
        return fromMatrix(product);
    }

    /**
     * @return true if every matrix element of this transform is within epsilon of the other transform's element.
     */
    public boolean isWithinEpsilon(final RigidTransform2D other,
                                   final double epsilon) {
        for (int i = 0; i < values.length; i++) {
            if (Math.abs(values[i] - other.values[i]) > epsilon) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final RigidTransform2D that = (RigidTransform2D) o;
        return Arrays.equals(values, that.values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return String.format("[[%.6f, %.6f, %.3f], [%.6f, %.6f, %.3f], [0, 0, 1]]",
                             values[0], values[1], values[2], values[3], values[4], values[5]);
    }

    public String toJson() {
        return JSON_HELPER.toJson(this);
    }

    public static RigidTransform2D fromJson(final String json) {
        return JSON_HELPER.fromJson(json);
    }

    private static final double SINGULAR_THRESHOLD = 1.0e-12;

    private static final JsonUtils.Helper<RigidTransform2D> JSON_HELPER =
            new JsonUtils.Helper<>(RigidTransform2D.class);
}
