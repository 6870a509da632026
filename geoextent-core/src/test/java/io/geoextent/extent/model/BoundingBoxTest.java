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
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("BoundingBox")
class BoundingBoxTest {

    @Nested
    @DisplayName("construction")
    class Construction {

        @Test
        @DisplayName("should reject min greater than max")
        void shouldRejectInvertedBox() {
            assertThatThrownBy(() -> new BoundingBox(2, 0, 1, 1))
                .isInstanceOf(InvalidGeometryException.class)
                .hasMessageContaining("min must not exceed max");
        }

        @Test
        @DisplayName("should reject non-finite ordinates")
        void shouldRejectNonFinite() {
            assertThatThrownBy(() -> new BoundingBox(0, 0, Double.POSITIVE_INFINITY, 1))
                .isInstanceOf(InvalidGeometryException.class);
            assertThatThrownBy(() -> BoundingBox.parse(new double[]{0, Double.NaN, 1, 1}))
                .isInstanceOf(InvalidGeometryException.class);
        }

        @Test
        @DisplayName("should parse four ordinates and order swapped corners")
        void shouldParse() {
            assertThat(BoundingBox.parse(new double[]{-10, -20, 10, 20})).isEqualTo(new BoundingBox(-10, -20, 10, 20));
            assertThat(BoundingBox.parse(new double[]{10, 20, -10, -20})).isEqualTo(new BoundingBox(-10, -20, 10, 20));
        }

        @Test
        @DisplayName("should reject arrays of the wrong length")
        void shouldRejectWrongLength() {
            assertThatThrownBy(() -> BoundingBox.parse(new double[]{1, 2, 3}))
                .isInstanceOf(InvalidGeometryException.class)
                .hasMessageContaining("4 ordinates");
            assertThatThrownBy(() -> BoundingBox.parse(null))
                .isInstanceOf(InvalidGeometryException.class);
        }

        @Test
        @DisplayName("should enclose a vertex list")
        void shouldEnclose() {
            BoundingBox box = BoundingBox.enclosing(List.of(new Vertex(3, -1), new Vertex(-2, 4), new Vertex(0, 0)));

            assertThat(box).isEqualTo(new BoundingBox(-2, -1, 3, 4));
            assertThatThrownBy(() -> BoundingBox.enclosing(List.of())).isInstanceOf(InvalidGeometryException.class);
        }
    }

    @Nested
    @DisplayName("degenerate boxes")
    class Degenerate {

        @Test
        @DisplayName("should widen only zero-length axes")
        void shouldWidenZeroAxes() {
            BoundingBox line = new BoundingBox(1, 0, 1, 10);

            assertThat(line.isDegenerate()).isTrue();
            assertThat(line.expandDegenerate(0.5)).isEqualTo(new BoundingBox(0.5, 0, 1.5, 10));
        }

        @Test
        @DisplayName("should widen a point on both axes")
        void shouldWidenPoint() {
            assertThat(new BoundingBox(2, 2, 2, 2).expandDegenerate(1)).isEqualTo(new BoundingBox(1, 1, 3, 3));
        }

        @Test
        @DisplayName("should leave a proper box unchanged")
        void shouldLeaveProperBox() {
            BoundingBox box = new BoundingBox(0, 0, 1, 1);

            assertThat(box.isDegenerate()).isFalse();
            assertThat(box.expandDegenerate(5)).isEqualTo(box);
        }
    }

    @Test
    @DisplayName("should list corners counter-clockwise from the lower left")
    void shouldListCorners() {
        assertThat(new BoundingBox(0, 0, 2, 1).corners()).containsExactly(
            new Vertex(0, 0), new Vertex(2, 0), new Vertex(2, 1), new Vertex(0, 1));
        assertThat(new BoundingBox(0, 0, 2, 1).toArray()).containsExactly(0, 0, 2, 1);
    }
}
