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

package io.geoextent.extent;

import io.geoextent.extent.geometry.JtsPlanarGeometry;
import io.geoextent.extent.geometry.ReprojectionException;
import io.geoextent.extent.model.BoundingBox;
import io.geoextent.extent.model.Vertex;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("CoordinateNormalizer")
class CoordinateNormalizerTest {

    private static final double WEB_MERCATOR_HALF_WORLD = 20037508.342789244;

    private final CoordinateNormalizer normalizer = new CoordinateNormalizer(new JtsPlanarGeometry());

    @Test
    @DisplayName("should return the input when both codes name the same reference")
    void shouldShortCircuitSameReference() {
        BoundingBox box = new BoundingBox(1, 2, 3, 4);

        assertThat(normalizer.normalize(box, "EPSG:4326", "4326")).isSameAs(box);
        assertThat(CoordinateNormalizer.sameReference("urn:ogc:def:crs:EPSG::4326", "epsg:04326")).isTrue();
        assertThat(CoordinateNormalizer.sameReference("4326", "3857")).isFalse();
        assertThat(CoordinateNormalizer.sameReference("4326", "bogus")).isFalse();
    }

    @Test
    @DisplayName("should reproject web mercator corners to longitude and latitude")
    void shouldReprojectWebMercator() {
        BoundingBox box = new BoundingBox(0, 0, WEB_MERCATOR_HALF_WORLD, 1118889.9748579594);

        BoundingBox normalized = normalizer.normalize(box, "3857", "4326");

        assertThat(normalized.minX()).isCloseTo(0, within(1e-9));
        assertThat(normalized.minY()).isCloseTo(0, within(1e-9));
        assertThat(normalized.maxX()).isCloseTo(180, within(1e-6));
        assertThat(normalized.maxY()).isCloseTo(10, within(1e-4));
    }

    @Test
    @DisplayName("should reproject UTM vertices")
    void shouldReprojectUtm() {
        List<Vertex> vertices = normalizer.normalizeVertices(List.of(new Vertex(500000, 0)), "EPSG:32633", "EPSG:4326");

        assertThat(vertices).hasSize(1);
        assertThat(vertices.get(0).x()).isCloseTo(15, within(1e-6));
        assertThat(vertices.get(0).y()).isCloseTo(0, within(1e-6));
    }

    @Test
    @DisplayName("should raise a reprojection error for unusable codes")
    void shouldRejectInvalidCodes() {
        BoundingBox box = new BoundingBox(0, 0, 1, 1);

        assertThatThrownBy(() -> normalizer.normalize(box, "not-a-crs", "4326"))
            .isInstanceOfSatisfying(ReprojectionException.class, e -> {
                assertThat(e.getSourceCrs()).isEqualTo("not-a-crs");
                assertThat(e.getTargetCrs()).isEqualTo("4326");
            });
        assertThatThrownBy(() -> normalizer.normalize(box, "EPSG:999999", "4326"))
            .isInstanceOf(ReprojectionException.class);
    }
}
