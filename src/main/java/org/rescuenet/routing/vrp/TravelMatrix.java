package org.rescuenet.routing.vrp;

/**
 * Square matrix of travel distances between indexed locations.
 *
 * <p>Unconnected pairs report {@link Double#POSITIVE_INFINITY}.</p>
 */
public interface TravelMatrix {

    /**
     * @return number of indexed locations.
     */
    int size();

    /**
     * Travel distance from one location to another.
     *
     * @param from source location index.
     * @param to target location index.
     * @return distance in meters, {@code 0} on the diagonal.
     */
    double distanceMeters(int from, int to);
}
