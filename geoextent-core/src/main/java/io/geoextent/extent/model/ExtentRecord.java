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

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/// The known extent of one file, or of one sub-aggregate such as a dataset inside a
/// multi-dataset request, exactly as an extractor delivered it.
///
/// Values are kept raw. A bounding box with the wrong arity, a reference code nobody
/// understands or a date that does not parse are only discovered when the record is
/// merged, and only cost that one record.
///
/// @param name a label for the source of this extent, used in log messages
/// @param bbox `[minX, minY, maxX, maxY]` in units of `crs`, or null
/// @param crs a reference code such as `4326` or `EPSG:3857`, or null
/// @param tbox `[start, end]` calendar dates as `YYYY-MM-DD`, or null
/// @param hull the vertices of a previously computed convex hull, or null
public record ExtentRecord(String name, double[] bbox, String crs, String[] tbox, List<Vertex> hull) {

    public ExtentRecord {
        bbox = bbox != null ? bbox.clone() : null;
        tbox = tbox != null ? tbox.clone() : null;
        hull = hull != null ? List.copyOf(hull) : null;
    }

    /// Create a record with only a spatial bounding box.
    /// @param name the source label
    /// @param bbox the bounding box ordinates
    /// @param crs the reference code
    /// @return a new record
    public static ExtentRecord spatial(String name, double[] bbox, String crs) {
        return new ExtentRecord(name, bbox, crs, null, null);
    }

    /// Create a record with only a temporal range.
    /// @param name the source label
    /// @param start the first date
    /// @param end the last date
    /// @return a new record
    public static ExtentRecord temporal(String name, String start, String end) {
        return new ExtentRecord(name, null, null, new String[]{start, end}, null);
    }

    /// Create a record carrying a previously computed hull.
    /// @param name the source label
    /// @param hull the hull vertices
    /// @param crs the reference code
    /// @return a new record
    public static ExtentRecord withHull(String name, List<Vertex> hull, String crs) {
        return new ExtentRecord(name, null, crs, null, hull);
    }

    @Override
    public double[] bbox() {
        return bbox != null ? bbox.clone() : null;
    }

    @Override
    public String[] tbox() {
        return tbox != null ? tbox.clone() : null;
    }

    public boolean hasBbox() {
        return bbox != null;
    }

    public boolean hasHull() {
        return hull != null && !hull.isEmpty();
    }

    public boolean hasTbox() {
        return tbox != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ExtentRecord)) return false;
        ExtentRecord that = (ExtentRecord) o;
        return Objects.equals(name, that.name)
            && Arrays.equals(bbox, that.bbox)
            && Objects.equals(crs, that.crs)
            && Arrays.equals(tbox, that.tbox)
            && Objects.equals(hull, that.hull);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(name, crs, hull);
        result = 31 * result + Arrays.hashCode(bbox);
        result = 31 * result + Arrays.hashCode(tbox);
        return result;
    }

    @Override
    public String toString() {
        return "ExtentRecord{name=" + name
            + ", bbox=" + Arrays.toString(bbox)
            + ", crs=" + crs
            + ", tbox=" + Arrays.toString(tbox)
            + ", hull=" + hull + "}";
    }
}
