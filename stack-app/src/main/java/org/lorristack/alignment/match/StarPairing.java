package org.lorristack.alignment.match;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Partial one-to-one mapping between the stars of a reference frame and the stars of a target frame.
 * Every pair added to the pairing must be distance consistent with every pair already in it,
 * and each star may appear at most once on either side.
 */
public class StarPairing
        implements Serializable {

    private final double maxDistance;
    private final List<StarPair> pairs;
    private final Map<Star, Boolean> usedReferenceStars;
    private final Map<Star, Boolean> usedTargetStars;

    public StarPairing(final double maxDistance) {
        this.maxDistance = maxDistance;
        this.pairs = new ArrayList<>();
        this.usedReferenceStars = new IdentityHashMap<>();
        this.usedTargetStars = new IdentityHashMap<>();
    }

    public double getMaxDistance() {
        return maxDistance;
    }

    public List<StarPair> getPairs() {
        return Collections.unmodifiableList(pairs);
    }

    public int size() {
        return pairs.size();
    }

    public boolean isReferenceUsed(final Star star) {
        return usedReferenceStars.containsKey(star);
    }

    public boolean isTargetUsed(final Star star) {
        return usedTargetStars.containsKey(star);
    }

    /**
     * @return true if the specified pair uses no paired star and is distance consistent with every existing pair.
     */
    public boolean fits(final StarPair candidate) {
        if (isReferenceUsed(candidate.getReference()) || isTargetUsed(candidate.getTarget())) {
            return false;
        }
        for (final StarPair pair : pairs) {
            if (! candidate.isDistanceConsistentWith(pair, maxDistance)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Adds the specified pair if it {@link #fits}.
     *
     * @return true if the pair was added.
     */
    public boolean addIfFits(final StarPair candidate) {
        final boolean added = fits(candidate);
        if (added) {
            pairs.add(candidate);
            usedReferenceStars.put(candidate.getReference(), Boolean.TRUE);
            usedTargetStars.put(candidate.getTarget(), Boolean.TRUE);
        }
        return added;
    }

    @Override
    public String toString() {
        return "{\"size\": " + pairs.size() + ", \"maxDistance\": " + maxDistance + '}';
    }
}
