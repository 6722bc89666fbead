package org.rescuenet.routing.vrp;

import org.rescuenet.routing.geo.GeoDistance;
import org.rescuenet.routing.geo.GeoPoint;

import java.util.List;
import java.util.Objects;

/**
 * Haversine distances between locations, computed eagerly.
 */
public final class GreatCircleTravelMatrix implements TravelMatrix {
    private final double[][] meters;

    private GreatCircleTravelMatrix(double[][] meters) {
        this.meters = meters;
    }

    public static GreatCircleTravelMatrix of(List<GeoPoint> locations) {
        Objects.requireNonNull(locations, "locations");
        int n = locations.size();
        double[][] meters = new double[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                double d = GeoDistance.greatCircleMeters(locations.get(i), locations.get(j));
                meters[i][j] = d;
                meters[j][i] = d;
            }
        }
        return new GreatCircleTravelMatrix(meters);
    }

    @Override
    public int size() {
        return meters.length;
    }

    @Override
    public double distanceMeters(int from, int to) {
        return meters[from][to];
    }
}
