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

import java.util.List;

/// The spatial extent of many records, expressed in the common output reference.
///
/// When `isPoint` is true the bounding box and hull still hold the degenerate
/// rectangle or ring they were computed as, but consumers should present `point`.
///
/// @param bbox the merged bounding box, or null when no record contributed
/// @param crs the output reference code, null exactly when `bbox` is null
/// @param hull the closed ring of the merged convex hull, or null in bounding box mode
/// @param isPoint true if the merged geometry collapses to one coordinate
/// @param point the collapsed coordinate when `isPoint` is true
public record MergedExtent(BoundingBox bbox, String crs, List<Vertex> hull, boolean isPoint, Vertex point) {

    /// Result of a merge where nothing contributed a usable geometry.
    public static final MergedExtent EMPTY = new MergedExtent(null, null, null, false, null);

    public MergedExtent {
        if (bbox == null && crs != null) {
            throw new IllegalArgumentException("An extent without a bounding box has no reference system");
        }
        if (bbox != null && crs == null) {
            throw new IllegalArgumentException("A bounding box requires a reference system");
        }
        if (isPoint && point == null) {
            throw new IllegalArgumentException("A point extent must carry the point");
        }
        hull = hull != null ? List.copyOf(hull) : null;
    }

    /// @param bbox the merged bounding box
    /// @param crs the output reference
    /// @param detection the degeneracy check of the bounding box
    /// @return a bounding box extent
    public static MergedExtent ofBox(BoundingBox bbox, String crs, PointDetection detection) {
        return new MergedExtent(bbox, crs, null, detection.isPoint(), detection.point());
    }

    /// @param hull the closed hull ring
    /// @param crs the output reference
    /// @param detection the degeneracy check of the hull vertices
    /// @return a convex hull extent whose bounding box encloses the hull
    public static MergedExtent ofHull(List<Vertex> hull, String crs, PointDetection detection) {
        return new MergedExtent(BoundingBox.enclosing(hull), crs, hull, detection.isPoint(), detection.point());
    }

    public boolean isEmpty() {
        return bbox == null;
    }

    public boolean isConvexHull() {
        return hull != null;
    }
}
