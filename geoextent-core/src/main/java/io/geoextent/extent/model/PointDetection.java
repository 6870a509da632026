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

/// Outcome of a point degeneracy check.
///
/// @param isPoint true if the geometry collapses to one coordinate within tolerance
/// @param point the collapsed coordinate, or null when `isPoint` is false
public record PointDetection(boolean isPoint, Vertex point) {

    /// The result for a geometry with real width or height.
    public static final PointDetection NOT_A_POINT = new PointDetection(false, null);

    public PointDetection {
        if (isPoint && point == null) {
            throw new IllegalArgumentException("A point detection must carry the point");
        }
        if (!isPoint && point != null) {
            throw new IllegalArgumentException("Only a point detection may carry a point");
        }
    }

    public static PointDetection at(Vertex point) {
        return new PointDetection(true, point);
    }
}
