package com.securityops.coordination.dto;

import com.securityops.coordination.util.GeoMath;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.geom.PrecisionModel;
import org.locationtech.jts.operation.distance.DistanceOp;

/**
 * In-memory representation of a site geofence used on the ingest hot path.
 *
 * The SiteGeofence entity is JPA-managed and heavyweight; this record only carries what
 * point-in-boundary checks need and is immutable, so it can be shared between ingest threads.
 *
 * @param geofenceId      Database ID of the geofence
 * @param siteId          Site the geofence belongs to
 * @param name            Geofence name
 * @param shape           CIRCLE (center + radius) or POLYGON
 * @param centerLatitude  Circle center latitude, null for polygons
 * @param centerLongitude Circle center longitude, null for polygons
 * @param radiusMeters    Circle radius in meters, null for polygons
 * @param boundary        JTS polygon (x = longitude, y = latitude), null for circles
 * @param securityLevel   Security-level tag of the site
 */
public record CachedGeofenceRecord(
    Long geofenceId,
    String siteId,
    String name,
    GeofenceShape shape,
    Double centerLatitude,
    Double centerLongitude,
    Double radiusMeters,
    Polygon boundary,
    String securityLevel
) {

    private static final GeometryFactory GEOMETRY_FACTORY = new GeometryFactory(new PrecisionModel(), 4326);

    public static CachedGeofenceRecord circle(
        Long geofenceId, String siteId, String name,
        double centerLatitude, double centerLongitude, double radiusMeters, String securityLevel
    ) {
        return new CachedGeofenceRecord(geofenceId, siteId, name, GeofenceShape.CIRCLE,
            centerLatitude, centerLongitude, radiusMeters, null, securityLevel);
    }

    public static CachedGeofenceRecord polygon(
        Long geofenceId, String siteId, String name, Polygon boundary, String securityLevel
    ) {
        return new CachedGeofenceRecord(geofenceId, siteId, name, GeofenceShape.POLYGON,
            null, null, null, boundary, securityLevel);
    }

    /**
     * Tests a GPS point against this geofence.
     *
     * Circles: haversine distance to the center, O(1).
     * Polygons: JTS {@code covers} (boundary points count as inside), O(vertices); the distance
     * outside is measured to the nearest point on the boundary.
     */
    public GeofenceEvaluation evaluate(double latitude, double longitude) {
        if (shape == GeofenceShape.CIRCLE) {
            double distance = GeoMath.haversineMeters(latitude, longitude, centerLatitude, centerLongitude);
            if (distance <= radiusMeters) {
                return GeofenceEvaluation.insideOf(radiusMeters);
            }
            return new GeofenceEvaluation(false, distance - radiusMeters, radiusMeters);
        }

        double referenceRadius = referenceRadiusMeters();
        Point point = GEOMETRY_FACTORY.createPoint(new Coordinate(longitude, latitude));
        if (boundary.covers(point)) {
            return GeofenceEvaluation.insideOf(referenceRadius);
        }

        Coordinate nearest = DistanceOp.nearestPoints(boundary, point)[0];
        double outside = GeoMath.haversineMeters(latitude, longitude, nearest.getY(), nearest.getX());
        return new GeofenceEvaluation(false, outside, referenceRadius);
    }

    /**
     * Radius used to grade violation severity. For polygons this is the largest
     * distance from the centroid to a vertex.
     */
    public double referenceRadiusMeters() {
        if (shape == GeofenceShape.CIRCLE) {
            return radiusMeters;
        }
        Point centroid = boundary.getCentroid();
        double max = 0.0;
        for (Coordinate vertex : boundary.getExteriorRing().getCoordinates()) {
            max = Math.max(max, GeoMath.haversineMeters(centroid.getY(), centroid.getX(), vertex.getY(), vertex.getX()));
        }
        return max;
    }

    public String toLogString() {
        return String.format("Geofence[id=%d, site=%s, shape=%s, name=%s]", geofenceId, siteId, shape, name);
    }
}
