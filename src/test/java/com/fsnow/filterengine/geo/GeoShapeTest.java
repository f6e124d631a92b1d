package com.fsnow.filterengine.geo;

import org.bson.Document;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GeoShapeTest {

    private static final GeoPoint MONTPELLIER = new GeoPoint(43.6108, 3.8767);
    private static final GeoPoint PARIS = new GeoPoint(48.8566, 2.3522);

    @Test
    void testDistanceBetweenPoints() {
        // about 595 km
        assertThat(MONTPELLIER.distanceTo(PARIS)).isBetween(590_000.0, 600_000.0);
        assertThat(PARIS.distanceTo(PARIS)).isEqualTo(0.0);
    }

    @Test
    void testBoundingBox() {
        GeoShape box = GeoShape.fromStandardized(GeoShape.BOUNDING_BOX,
                new Document("top", 44.0).append("left", 3.0).append("bottom", 43.0).append("right", 4.0));

        assertThat(box.contains(MONTPELLIER)).isTrue();
        assertThat(box.contains(PARIS)).isFalse();
        assertThat(box.contains(new GeoPoint(44.0, 3.0))).isTrue();
    }

    @Test
    void testBoundingBoxCrossingAntimeridian() {
        BoundingBox box = new BoundingBox(10, 170, -10, -170);

        assertThat(box.contains(new GeoPoint(0, 175))).isTrue();
        assertThat(box.contains(new GeoPoint(0, -175))).isTrue();
        assertThat(box.contains(new GeoPoint(0, 0))).isFalse();
    }

    @Test
    void testCircle() {
        GeoShape circle = GeoShape.fromStandardized(GeoShape.DISTANCE,
                new Document("lat", MONTPELLIER.getLat()).append("lon", MONTPELLIER.getLon())
                        .append("distance", 10_000.0));

        assertThat(circle.contains(MONTPELLIER)).isTrue();
        assertThat(circle.contains(PARIS)).isFalse();
    }

    @Test
    void testAnnulus() {
        GeoShape annulus = GeoShape.fromStandardized(GeoShape.DISTANCE_RANGE,
                new Document("lat", MONTPELLIER.getLat()).append("lon", MONTPELLIER.getLon())
                        .append("from", 500_000.0).append("to", 700_000.0));

        assertThat(annulus.contains(PARIS)).isTrue();
        assertThat(annulus.contains(MONTPELLIER)).isFalse();
    }

    @Test
    void testPolygon() {
        GeoShape polygon = GeoShape.fromStandardized(GeoShape.POLYGON, List.of(
                List.of(43.0, 3.0), List.of(44.0, 3.0), List.of(44.0, 4.0), List.of(43.0, 4.0)));

        assertThat(polygon.contains(MONTPELLIER)).isTrue();
        assertThat(polygon.contains(PARIS)).isFalse();
        // on an edge
        assertThat(polygon.contains(new GeoPoint(43.0, 3.5))).isTrue();
    }

    @Test
    void testUnknownShape() {
        assertThatThrownBy(() -> GeoShape.fromStandardized("geoTriangle", new Document()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
