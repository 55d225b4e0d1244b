package org.lorristack.alignment.match;

import java.io.Serializable;

/**
 * A reference frame star believed to be the same physical star as a target frame star.
 */
public class StarPair
        implements Serializable {

    private final Star reference;
    private final Star target;

    public StarPair(final Star reference,
                    final Star target) {
        this.reference = reference;
        this.target = target;
    }

    public Star getReference() {
        return reference;
    }

    public Star getTarget() {
        return target;
    }

    /**
     * @return true if this pair preserves (within maxDistance) the distance between the stars of the other pair.
     *         A rigid motion preserves all distances so every two pairs of a valid pairing must satisfy this.
     */
    public boolean isDistanceConsistentWith(final StarPair other,
                                            final double maxDistance) {
        final double referenceDistance = reference.distanceTo(other.reference);
        final double targetDistance = target.distanceTo(other.target);
        return Math.abs(referenceDistance - targetDistance) <= maxDistance;
    }

    @Override
    public String toString() {
        return reference + " -> " + target;
    }
}
