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
import io.geoextent.extent.model.Vertex;

import java.util.List;

/// The handful of planar geometry operations extent merging needs.
///
/// Implementations must be safe for concurrent use; they may cache immutable
/// lookups but must not keep per-call state between invocations.
public interface PlanarGeometry {

    /// Build the four-corner rectangle of a bounding box.
    /// @param box the rectangle bounds
    /// @return a one-part footprint
    Footprint rectangle(BoundingBox box);

    /// Collect several footprints into one multi-part footprint.
    /// @param parts the footprints to combine
    /// @return a footprint holding every part of every input
    Footprint union(List<Footprint> parts);

    /// Axis-aligned envelope of every vertex in a footprint.
    /// @param footprint a non-empty footprint
    /// @return the enclosing bounding box
    /// @throws io.geoextent.extent.model.InvalidGeometryException if the footprint is empty
    BoundingBox envelope(Footprint footprint);

    /// Convex hull of the full vertex set of a footprint.
    /// @param footprint the shape to enclose
    /// @return the closed exterior ring of the hull polygon
    /// @throws DegenerateHullException if the hull is not a polygon
    List<Vertex> convexHull(Footprint footprint);

    /// Transform vertices between two reference systems.
    /// @param vertices the vertices to transform
    /// @param source the reference the vertices are expressed in
    /// @param target the reference to express them in
    /// @return the transformed vertices, in input order
    /// @throws ReprojectionException if either reference is unsupported or a result is not finite
    List<Vertex> reproject(List<Vertex> vertices, CrsCode source, CrsCode target);
}
