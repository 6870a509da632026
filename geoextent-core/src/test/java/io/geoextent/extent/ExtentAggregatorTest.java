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

import io.geoextent.extent.model.AggregateExtent;
import io.geoextent.extent.model.BoundingBox;
import io.geoextent.extent.model.ExtentRecord;
import io.geoextent.extent.model.MergedExtent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("ExtentAggregator")
class ExtentAggregatorTest {

    private final ExtentAggregator aggregator = new ExtentAggregator();

    @Test
    @DisplayName("should merge space and time independently")
    void shouldMergeSpaceAndTime() {
        List<ExtentRecord> records = List.of(
            new ExtentRecord("a.geojson", new double[]{0, 0, 2, 2}, "4326", new String[]{"2001-01-01", "2001-02-01"}, null),
            ExtentRecord.spatial("b.tif", new double[]{1, 1, 4, 3}, "4326"),
            ExtentRecord.temporal("c.csv", "1999-12-31", "2000-01-01"));

        AggregateExtent extent = aggregator.aggregate(records, SpatialMergeOptions.DEFAULT.withOrigin("dir"));

        assertThat(extent.spatial().bbox()).isEqualTo(new BoundingBox(0, 0, 4, 3));
        assertThat(extent.temporalExtent()).isPresent();
        assertThat(extent.temporal().toStrings()).containsExactly("1999-12-31", "2001-02-01");
        assertThat(extent.recordCount()).isEqualTo(3);
        assertThat(extent.isEmpty()).isFalse();
    }

    @Test
    @DisplayName("should return an empty aggregate for records without extents")
    void shouldReturnEmpty() {
        AggregateExtent extent = aggregator.aggregate(
            List.of(new ExtentRecord("empty", null, null, null, null)), SpatialMergeOptions.DEFAULT);

        assertThat(extent.spatial()).isEqualTo(MergedExtent.EMPTY);
        assertThat(extent.temporalExtent()).isEmpty();
        assertThat(extent.isEmpty()).isTrue();
        assertThat(extent.recordCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("should reject an invalid target reference")
    void shouldRejectInvalidTarget() {
        SpatialMergeOptions options = SpatialMergeOptions.DEFAULT.withTargetCrs("wgs84");

        assertThatThrownBy(() -> aggregator.aggregate(List.of(), options))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
