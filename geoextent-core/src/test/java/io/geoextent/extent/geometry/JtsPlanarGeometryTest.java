/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.geoextent.extent.geometry;

import io.geoextent.extent.model.BoundingBox;
import io.geoextent.extent.model.InvalidGeometryException;
import io.geoextent.extent.model.Vertex;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("JtsPlanarGeometry")
class JtsPlanarGeometryTest {

    private final JtsPlanarGeometry geometry = new JtsPlanarGeometry();

    @Nested
    @DisplayName("envelope and union")
    class Envelope {

        @Test
        @DisplayName("should take the envelope across all parts of a union")
        void shouldEnvelopeUnion() {
            Footprint union = geometry.union(List.of(
                geometry.rectangle(new BoundingBox(0, 0, 1, 1)),
                geometry.rectangle(new BoundingBox(-3, 2, -2, 5))));

            assertThat(union.partCount()).isEqualTo(2);
            assertThat(geometry.envelope(union)).isEqualTo(new BoundingBox(-3, 0, 1, 5));
        }

        @Test
        @DisplayName("should refuse the envelope of nothing")
        void shouldRejectEmpty() {
            assertThatThrownBy(() -> geometry.envelope(geometry.union(List.of())))
                .isInstanceOf(InvalidGeometryException.class);
        }
    }

    @Nested
    @DisplayName("convex hull")
    class Hull {

        @Test
        @DisplayName("should return a closed ring without interior points")
        void shouldReturnClosedRing() {
            List<Vertex> ring = geometry.convexHull(Footprint.of(List.of(
                new Vertex(0, 0), new Vertex(4, 0), new Vertex(2, 1), new Vertex(4, 4), new Vertex(0, 4))));

            assertThat(ring.get(0)).isEqualTo(ring.get(ring.size() - 1));
            assertThat(new HashSet<>(ring)).containsExactlyInAnyOrder(
                new Vertex(0, 0), new Vertex(4, 0), new Vertex(4, 4), new Vertex(0, 4));
        }

        @Test
        @DisplayName("should report collinear input as degenerate")
        void shouldRejectCollinear() {
            assertThatThrownBy(() -> geometry.convexHull(Footprint.of(List.of(
                new Vertex(0, 0), new Vertex(1, 1), new Vertex(2, 2)))))
                .isInstanceOfSatisfying(DegenerateHullException.class, e -> {
                    assertThat(e.getDistinctPoints()).isEqualTo(3);
                    assertThat(e.getResultType()).isEqualTo("LineString");
                });
        }

        @Test
        @DisplayName("should report a single repeated point as degenerate")
        void shouldRejectPoint() {
            assertThatThrownBy(() -> geometry.convexHull(Footprint.of(List.of(new Vertex(1, 1), new Vertex(1, 1)))))
                .isInstanceOfSatisfying(DegenerateHullException.class, e -> {
                    assertThat(e.getDistinctPoints()).isEqualTo(1);
                    assertThat(e.getResultType()).isEqualTo("Point");
                });
        }
    }

    @Nested
    @DisplayName("reprojection")
    class Reprojection {

        @Test
        @DisplayName("should map the web mercator antimeridian to 180 degrees")
        void shouldMapAntimeridian() {
            List<Vertex> out = geometry.reproject(
                List.of(new Vertex(20037508.342789244, 0), new Vertex(0, 0)),
                CrsCode.parse("EPSG:3857"), CrsCode.WGS84);

            assertThat(out.get(0).x()).isCloseTo(180, within(1e-6));
            assertThat(out.get(0).y()).isCloseTo(0, within(1e-9));
            assertThat(out.get(1).x()).isCloseTo(0, within(1e-9));
            assertThat(out.get(1).y()).isCloseTo(0, within(1e-9));
        }

        @Test
        @DisplayName("should pass vertices through for identical references")
        void shouldPassThrough() {
            List<Vertex> in = List.of(new Vertex(1, 2));

            assertThat(geometry.reproject(in, CrsCode.WGS84, CrsCode.parse("4326"))).isEqualTo(in);
        }

        @Test
        @DisplayName("should wrap unknown codes")
        void shouldWrapUnknownCodes() {
            assertThatThrownBy(() -> geometry.reproject(List.of(new Vertex(1, 2)),
                CrsCode.parse("EPSG:999999"), CrsCode.WGS84))
                .isInstanceOfSatisfying(ReprojectionException.class,
                    e -> assertThat(e.getSourceCrs()).isEqualTo("999999"));
        }
    }
}
