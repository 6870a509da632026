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

import io.geoextent.extent.geometry.CrsCode;
import io.geoextent.extent.geometry.PlanarGeometry;
import io.geoextent.extent.geometry.ReprojectionException;
import io.geoextent.extent.model.BoundingBox;
import io.geoextent.extent.model.Vertex;

import java.util.List;

/// Brings bounding boxes and hull vertices into a common reference system.
///
/// Bounding boxes are reprojected through their two diagonal corners only, with
/// min/max re-derived from the transformed pair. Under a projection that is not a
/// similarity transform the true envelope of the reprojected rectangle can be larger
/// than that; the two-corner result is kept as is.
public class CoordinateNormalizer {

    private final PlanarGeometry geometry;

    public CoordinateNormalizer(PlanarGeometry geometry) {
        this.geometry = geometry;
    }

    /// Reproject a bounding box.
    /// @param bbox the box in `sourceCrs` units
    /// @param sourceCrs the reference code the box is expressed in
    /// @param targetCrs the reference code to express it in
    /// @return the same box when both codes name the same reference, otherwise the two-corner reprojection
    /// @throws ReprojectionException if a code is invalid or unsupported, or the transform fails
    public BoundingBox normalize(BoundingBox bbox, String sourceCrs, String targetCrs) {
        CrsCode source = parse(sourceCrs, sourceCrs, targetCrs);
        CrsCode target = parse(targetCrs, sourceCrs, targetCrs);
        if (source.equals(target)) {
            return bbox;
        }
        List<Vertex> corners = geometry.reproject(List.of(bbox.lowerLeft(), bbox.upperRight()), source, target);
        return BoundingBox.fromCorners(corners.get(0), corners.get(1));
    }

    /// Reproject every vertex of a hull or vertex list.
    /// @param vertices the vertices in `sourceCrs` units
    /// @param sourceCrs the reference code the vertices are expressed in
    /// @param targetCrs the reference code to express them in
    /// @return the transformed vertices, in input order
    /// @throws ReprojectionException if a code is invalid or unsupported, or the transform fails
    public List<Vertex> normalizeVertices(List<Vertex> vertices, String sourceCrs, String targetCrs) {
        CrsCode source = parse(sourceCrs, sourceCrs, targetCrs);
        CrsCode target = parse(targetCrs, sourceCrs, targetCrs);
        if (source.equals(target)) {
            return List.copyOf(vertices);
        }
        return geometry.reproject(vertices, source, target);
    }

    /// @param first a reference code
    /// @param second another reference code
    /// @return true if both codes parse and name the same reference
    public static boolean sameReference(String first, String second) {
        try {
            return CrsCode.parse(first).equals(CrsCode.parse(second));
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    private static CrsCode parse(String code, String sourceCrs, String targetCrs) {
        try {
            return CrsCode.parse(code);
        } catch (IllegalArgumentException e) {
            throw new ReprojectionException(sourceCrs, targetCrs, e);
        }
    }
}
