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

package io.geoextent.selection;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("GeospatialFileFilter")
class GeospatialFileFilterTest {

    private static CandidateFile file(String name) {
        return new CandidateFile(name, null, 10);
    }

    @Test
    @DisplayName("should keep geospatial files in input order")
    void shouldKeepGeospatialFiles() {
        CandidateFile geojson = file("stations.geojson");
        CandidateFile readme = file("README.md");
        CandidateFile tif = file("dem/elevation.TIF");
        CandidateFile pdf = file("paper.pdf");
        CandidateFile archive = file("bundle.tar.gz");

        List<CandidateFile> kept = new GeospatialFileFilter().filter(List.of(geojson, readme, tif, pdf, archive));

        assertThat(kept).containsExactly(geojson, tif, archive);
    }

    @Test
    @DisplayName("should accept additional extensions")
    void shouldAcceptAdditionalExtensions() {
        GeospatialFileFilter filter = new GeospatialFileFilter(List.of("LAS", ".laz"));

        assertThat(filter.isGeospatial("cloud.las")).isTrue();
        assertThat(filter.isGeospatial("cloud.LAZ")).isTrue();
        assertThat(new GeospatialFileFilter().isGeospatial("cloud.las")).isFalse();
        assertThat(filter.getExtensions()).contains(".las", ".laz", ".shp");
    }

    @Test
    @DisplayName("should return an empty list when nothing is geospatial")
    void shouldReturnEmpty() {
        assertThat(new GeospatialFileFilter().filter(List.of(file("notes.txt"), file("photo.png")))).isEmpty();
        assertThat(new GeospatialFileFilter().filter(List.of())).isEmpty();
    }

    @Test
    @DisplayName("should not accept a name that is only an extension")
    void shouldRejectBareExtension() {
        assertThat(new GeospatialFileFilter().isGeospatial(".csv")).isFalse();
    }
}
