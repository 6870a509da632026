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

package io.geoextent.extent.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("ExtentRecord")
class ExtentRecordTest {

    @Test
    @DisplayName("should copy arrays so callers cannot mutate the record")
    void shouldCopyArrays() {
        double[] bbox = {0, 0, 1, 1};
        ExtentRecord record = ExtentRecord.spatial("a", bbox, "4326");

        bbox[0] = 99;
        record.bbox()[1] = 99;

        assertThat(record.bbox()).containsExactly(0, 0, 1, 1);
    }

    @Test
    @DisplayName("should compare array contents in equals")
    void shouldCompareContents() {
        ExtentRecord first = new ExtentRecord("a", new double[]{0, 0, 1, 1}, "4326", new String[]{"2000-01-01", "2000-01-02"}, null);
        ExtentRecord second = new ExtentRecord("a", new double[]{0, 0, 1, 1}, "4326", new String[]{"2000-01-01", "2000-01-02"}, null);

        assertThat(first).isEqualTo(second).hasSameHashCodeAs(second);
    }

    @Test
    @DisplayName("should report which extents are present")
    void shouldReportPresence() {
        ExtentRecord hull = ExtentRecord.withHull("h", List.of(new Vertex(0, 0)), "4326");
        ExtentRecord dates = ExtentRecord.temporal("t", "2000-01-01", "2000-12-31");

        assertThat(hull.hasHull()).isTrue();
        assertThat(hull.hasBbox()).isFalse();
        assertThat(dates.hasTbox()).isTrue();
        assertThat(dates.hasBbox()).isFalse();
        assertThat(dates.tbox()).containsExactly("2000-01-01", "2000-12-31");
    }
}
