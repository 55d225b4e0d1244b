package org.lorristack.alignment.match;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Stars detected in a single frame.
 * Order carries no meaning but is stable so that seeded registrations are reproducible.
 */
public class StarSet
        implements Serializable {

    private final List<Star> stars;

    public StarSet(final Collection<Star> stars) {
        this.stars = Collections.unmodifiableList(new ArrayList<>(stars));
    }

    public static StarSet fromCoordinates(final double[][] xyPairs) {
        final List<Star> list = new ArrayList<>(xyPairs.length);
        for (final double[] xy : xyPairs) {
            list.add(new Star(xy[0], xy[1]));
        }
        return new StarSet(list);
    }

    public List<Star> getStars() {
        return stars;
    }

    public Star get(final int index) {
        return stars.get(index);
    }

    public int size() {
        return stars.size();
    }

    @Override
    public String toString() {
        return "{\"size\": " + stars.size() + '}';
    }
}
