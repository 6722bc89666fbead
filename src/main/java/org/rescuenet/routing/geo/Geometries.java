package org.rescuenet.routing.geo;

import lombok.experimental.UtilityClass;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.geom.PrecisionModel;

/**
 * Shared WGS84 geometry factory and small constructors for road and zone shapes.
 */
@UtilityClass
public class Geometries {
    public static final int SRID_WGS84 = 4326;

    private static final GeometryFactory FACTORY = new GeometryFactory(new PrecisionModel(), SRID_WGS84);

    public static GeometryFactory factory() {
        return FACTORY;
    }

    public static LineString line(GeoPoint... points) {
        if (points == null || points.length < 2) {
            throw new IllegalArgumentException("a line needs at least two points");
        }
        Coordinate[] coordinates = new Coordinate[points.length];
        for (int i = 0; i < points.length; i++) {
            coordinates[i] = points[i].toCoordinate();
        }
        return FACTORY.createLineString(coordinates);
    }

    public static LineString line(double... lonLatPairs) {
        if (lonLatPairs == null || lonLatPairs.length < 4 || (lonLatPairs.length & 1) != 0) {
            throw new IllegalArgumentException("expected an even number of lon/lat values (>= 4)");
        }
        Coordinate[] coordinates = new Coordinate[lonLatPairs.length / 2];
        for (int i = 0; i < coordinates.length; i++) {
            coordinates[i] = new Coordinate(lonLatPairs[i * 2], lonLatPairs[(i * 2) + 1]);
        }
        return FACTORY.createLineString(coordinates);
    }

    /**
     * Axis-aligned rectangle polygon in lon/lat degrees.
     */
    public static Polygon rectangle(double minLon, double minLat, double maxLon, double maxLat) {
        if (minLon >= maxLon || minLat >= maxLat) {
            throw new IllegalArgumentException("rectangle bounds must satisfy min < max");
        }
        return FACTORY.createPolygon(new Coordinate[]{
                new Coordinate(minLon, minLat),
                new Coordinate(maxLon, minLat),
                new Coordinate(maxLon, maxLat),
                new Coordinate(minLon, maxLat),
                new Coordinate(minLon, minLat)
        });
    }
}
