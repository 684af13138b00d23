package com.securityops.coordination.dto;

import com.securityops.coordination.util.GeoMath;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.Polygon;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class CachedGeofenceRecordTest {

    private static final double LAT = 40.7128;
    private static final double LON = -74.0060;

    private final CachedGeofenceRecord circle =
            CachedGeofenceRecord.circle(1L, "S1", "HQ", LAT, LON, 100.0, "HIGH");

    @Test
    void circleContainsPointsWithinRadius() {
        assertThat(circle.evaluate(LAT, LON).inside()).isTrue();
        assertThat(circle.evaluate(GeoMath.offsetLatitude(LAT, 99), LON).inside()).isTrue();
    }

    @Test
    void pointExactlyOnCircleIsInside() {
        double lat = GeoMath.offsetLatitude(LAT, 100);
        double radius = GeoMath.haversineMeters(lat, LON, LAT, LON);
        CachedGeofenceRecord exact = CachedGeofenceRecord.circle(2L, "S1", "Edge", LAT, LON, radius, null);

        GeofenceEvaluation evaluation = exact.evaluate(lat, LON);

        assertThat(evaluation.inside()).isTrue();
        assertThat(evaluation.distanceOutsideMeters()).isZero();
    }

    @Test
    void distanceOutsideCircleIsMeasuredFromTheEdge() {
        GeofenceEvaluation evaluation = circle.evaluate(GeoMath.offsetLatitude(LAT, 160), LON);

        assertThat(evaluation.inside()).isFalse();
        assertThat(evaluation.distanceOutsideMeters()).isCloseTo(60.0, within(0.5));
        assertThat(evaluation.severity()).isEqualTo(ViolationSeverity.MEDIUM);
    }

    @Test
    void severityGradesByExcessOverRadius() {
        assertThat(circle.evaluate(GeoMath.offsetLatitude(LAT, 140), LON).severity()).isEqualTo(ViolationSeverity.LOW);
        assertThat(circle.evaluate(GeoMath.offsetLatitude(LAT, 250), LON).severity()).isEqualTo(ViolationSeverity.HIGH);
    }

    @Test
    void polygonBoundaryIsInclusive() {
        CachedGeofenceRecord square = CachedGeofenceRecord.polygon(3L, "S2", "Yard", square(0.0, 0.0, 0.01), "LOW");

        assertThat(square.evaluate(0.005, 0.005).inside()).isTrue();
        assertThat(square.evaluate(0.0, 0.005).inside()).isTrue();
        assertThat(square.evaluate(0.01, 0.01).inside()).isTrue();
    }

    @Test
    void distanceOutsidePolygonIsToTheNearestEdge() {
        CachedGeofenceRecord square = CachedGeofenceRecord.polygon(3L, "S2", "Yard", square(0.0, 0.0, 0.01), "LOW");
        double latitude = GeoMath.offsetLatitude(0.01, 200);

        GeofenceEvaluation evaluation = square.evaluate(latitude, 0.005);

        assertThat(evaluation.inside()).isFalse();
        assertThat(evaluation.distanceOutsideMeters()).isCloseTo(200.0, within(1.0));
        assertThat(evaluation.referenceRadiusMeters()).isGreaterThan(700.0);
    }

    private static Polygon square(double lat, double lon, double size) {
        GeometryFactory factory = new GeometryFactory();
        return factory.createPolygon(new Coordinate[]{
                new Coordinate(lon, lat),
                new Coordinate(lon + size, lat),
                new Coordinate(lon + size, lat + size),
                new Coordinate(lon, lat + size),
                new Coordinate(lon, lat)
        });
    }
}
