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

/// A single planar coordinate, in the units of whatever reference system the
/// owning extent declares. For geographic references x is longitude and y is latitude.
///
/// @param x the easting or longitude
/// @param y the northing or latitude
public record Vertex(double x, double y) {

    /// @return true if both ordinates are finite numbers
    public boolean isFinite() {
        return Double.isFinite(x) && Double.isFinite(y);
    }

    /// Check whether this vertex lies within a tolerance of another, on each axis independently.
    /// @param other the vertex to compare with
    /// @param tolerance the maximum allowed difference per axis
    /// @return true if both axis differences are within the tolerance
    public boolean near(Vertex other, double tolerance) {
        return Math.abs(x - other.x) <= tolerance && Math.abs(y - other.y) <= tolerance;
    }

    @Override
    public String toString() {
        return "[" + x + "," + y + "]";
    }
}
