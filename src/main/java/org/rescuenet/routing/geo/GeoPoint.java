package org.rescuenet.routing.geo;

import org.locationtech.jts.geom.Coordinate;

/**
 * Immutable WGS84 position. Longitude maps to JTS {@code x}, latitude to {@code y}.
 *
 * @param lon longitude in degrees, {@code [-180, 180]}.
 * @param lat latitude in degrees, {@code [-90, 90]}.
 */
public record GeoPoint(double lon, double lat) {

    public GeoPoint {
        if (!Double.isFinite(lon) || lon < -180.0d || lon > 180.0d) {
            throw new IllegalArgumentException("lon must be finite and within [-180, 180], got " + lon);
        }
        if (!Double.isFinite(lat) || lat < -90.0d || lat > 90.0d) {
            throw new IllegalArgumentException("lat must be finite and within [-90, 90], got " + lat);
        }
    }

    public static GeoPoint of(double lon, double lat) {
        return new GeoPoint(lon, lat);
    }

    public static GeoPoint of(Coordinate coordinate) {
        return new GeoPoint(coordinate.getX(), coordinate.getY());
    }

    public Coordinate toCoordinate() {
        return new Coordinate(lon, lat);
    }

    @Override
    public String toString() {
        return String.format("(%.6f, %.6f)", lon, lat);
    }
}
