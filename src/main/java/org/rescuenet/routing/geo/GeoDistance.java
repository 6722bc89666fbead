package org.rescuenet.routing.geo;

import lombok.experimental.UtilityClass;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.LineString;

import java.util.Collection;

/**
 * Numeric helpers for great-circle distances and metric/degree conversions.
 */
@UtilityClass
public class GeoDistance {
    public static final double EARTH_MEAN_RADIUS_METERS = 6_371_008.8d;
    private static final double METERS_PER_DEGREE_LAT = Math.PI * EARTH_MEAN_RADIUS_METERS / 180.0d;
    private static final double MIN_COS_LAT = 0.01d;

    /**
     * Computes great-circle distance in meters using haversine formulation.
     */
    public static double greatCircleMeters(double lon1Deg, double lat1Deg, double lon2Deg, double lat2Deg) {
        double lat1Rad = Math.toRadians(lat1Deg);
        double lat2Rad = Math.toRadians(lat2Deg);
        double deltaLatRad = Math.toRadians(lat2Deg - lat1Deg);
        double deltaLonRad = Math.toRadians(normalizeDeltaLongitudeDegrees(lon2Deg - lon1Deg));

        double sinHalfLat = Math.sin(deltaLatRad * 0.5d);
        double sinHalfLon = Math.sin(deltaLonRad * 0.5d);

        double a = sinHalfLat * sinHalfLat
                + Math.cos(lat1Rad) * Math.cos(lat2Rad) * sinHalfLon * sinHalfLon;
        double clampedA = clamp(a, 0.0d, 1.0d);
        double c = 2.0d * Math.asin(Math.sqrt(clampedA));
        return EARTH_MEAN_RADIUS_METERS * c;
    }

    public static double greatCircleMeters(GeoPoint from, GeoPoint to) {
        return greatCircleMeters(from.lon(), from.lat(), to.lon(), to.lat());
    }

    public static double greatCircleMeters(Coordinate from, Coordinate to) {
        return greatCircleMeters(from.getX(), from.getY(), to.getX(), to.getY());
    }

    /**
     * Sums great-circle lengths of consecutive vertices of a lon/lat line.
     */
    public static double lineLengthMeters(LineString line) {
        double total = 0.0d;
        Coordinate[] coordinates = line.getCoordinates();
        for (int i = 1; i < coordinates.length; i++) {
            total += greatCircleMeters(coordinates[i - 1], coordinates[i]);
        }
        return total;
    }

    /**
     * Returns the envelope of the given points grown by {@code radiusMeters} on every side.
     */
    public static Envelope expandedEnvelope(Collection<GeoPoint> points, double radiusMeters) {
        if (points == null || points.isEmpty()) {
            throw new IllegalArgumentException("points must be non-empty");
        }
        if (!Double.isFinite(radiusMeters) || radiusMeters < 0.0d) {
            throw new IllegalArgumentException("radiusMeters must be finite and >= 0, got " + radiusMeters);
        }
        Envelope envelope = new Envelope();
        for (GeoPoint point : points) {
            envelope.expandToInclude(point.lon(), point.lat());
        }
        double widestLat = Math.max(Math.abs(envelope.getMinY()), Math.abs(envelope.getMaxY()));
        double deltaLat = radiusMeters / METERS_PER_DEGREE_LAT;
        double deltaLon = radiusMeters / (METERS_PER_DEGREE_LAT * Math.max(MIN_COS_LAT, Math.cos(Math.toRadians(widestLat))));
        envelope.expandBy(deltaLon, deltaLat);
        return envelope;
    }

    /**
     * Normalizes delta-longitude into the principal range {@code (-180, 180]}.
     */
    static double normalizeDeltaLongitudeDegrees(double deltaLonDeg) {
        double normalized = ((deltaLonDeg + 540.0d) % 360.0d) - 180.0d;
        if (normalized == -180.0d) {
            return 180.0d;
        }
        return normalized;
    }

    private static double clamp(double value, double min, double max) {
        if (value < min) {
            return min;
        }
        if (value > max) {
            return max;
        }
        return value;
    }
}
