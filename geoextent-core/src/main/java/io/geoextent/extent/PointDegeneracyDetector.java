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

import io.geoextent.extent.model.BoundingBox;
import io.geoextent.extent.model.PointDetection;
import io.geoextent.extent.model.Vertex;

import java.util.List;

/// Recognizes geometries that collapse to a single coordinate, such as the extent of
/// one sampling station, so they can be presented as a point instead of a zero-area
/// rectangle.
public final class PointDegeneracyDetector {

    /// Default per-axis tolerance, in output reference units.
    public static final double DEFAULT_TOLERANCE = 1e-6;

    private PointDegeneracyDetector() {
    }

    public static PointDetection detect(BoundingBox bbox) {
        return detect(bbox, DEFAULT_TOLERANCE);
    }

    /// A box is a point when both its width and its height are within tolerance.
    /// @param bbox the box to check
    /// @param tolerance the maximum span per axis
    /// @return the detection, with the lower left corner as the point
    public static PointDetection detect(BoundingBox bbox, double tolerance) {
        requireTolerance(tolerance);
        if (Math.abs(bbox.minX() - bbox.maxX()) <= tolerance && Math.abs(bbox.minY() - bbox.maxY()) <= tolerance) {
            return PointDetection.at(bbox.lowerLeft());
        }
        return PointDetection.NOT_A_POINT;
    }

    public static PointDetection detect(List<Vertex> vertices) {
        return detect(vertices, DEFAULT_TOLERANCE);
    }

    /// A vertex list is a point when every vertex is within tolerance of the first one,
    /// on each axis independently. An empty list is not a point.
    /// @param vertices hull or ring vertices
    /// @param tolerance the maximum difference per axis
    /// @return the detection, with the first vertex as the point
    public static PointDetection detect(List<Vertex> vertices, double tolerance) {
        requireTolerance(tolerance);
        if (vertices == null || vertices.isEmpty()) {
            return PointDetection.NOT_A_POINT;
        }
        Vertex first = vertices.get(0);
        for (Vertex vertex : vertices) {
            if (!vertex.near(first, tolerance)) {
                return PointDetection.NOT_A_POINT;
            }
        }
        return PointDetection.at(first);
    }

    private static void requireTolerance(double tolerance) {
        if (!(tolerance >= 0.0) || Double.isInfinite(tolerance)) {
            throw new IllegalArgumentException("Tolerance must be a finite non-negative number: " + tolerance);
        }
    }
}
