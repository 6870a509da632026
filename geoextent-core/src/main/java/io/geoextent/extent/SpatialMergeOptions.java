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

/**
 * Immutable configuration for one spatial merge.
 *
 * @param mode                how extents are combined
 * @param targetCrs           the reference code every extent is normalized into
 * @param degeneracyTolerance per-axis tolerance for point detection, in target units
 * @param rectangleEpsilon    half-width given to zero-width or zero-height rectangles in hull mode
 * @param assumeWgs84         treat records without a reference code as EPSG:4326 instead of skipping them
 * @param origin              label of the directory or request being merged, for log messages
 */
public record SpatialMergeOptions(
    Mode mode,
    String targetCrs,
    double degeneracyTolerance,
    double rectangleEpsilon,
    boolean assumeWgs84,
    String origin
) {

    /**
     * Spatial merge strategies.
     */
    public enum Mode {
        /** Envelope of all bounding boxes. */
        BOUNDING_BOX,
        /** Convex hull of every contributing vertex, falling back to {@link #BOUNDING_BOX}. */
        CONVEX_HULL
    }

    public static final double DEFAULT_RECTANGLE_EPSILON = 1e-10;

    /**
     * Bounding box mode into WGS 84 with default tolerances.
     */
    public static final SpatialMergeOptions DEFAULT = new SpatialMergeOptions(
        Mode.BOUNDING_BOX,
        CrsCode.WGS84.toString(),
        PointDegeneracyDetector.DEFAULT_TOLERANCE,
        DEFAULT_RECTANGLE_EPSILON,
        false,
        "input"
    );

    /**
     * Compact constructor with validation.
     */
    public SpatialMergeOptions {
        if (mode == null) {
            throw new IllegalArgumentException("Merge mode must not be null");
        }
        if (targetCrs == null || targetCrs.isBlank()) {
            throw new IllegalArgumentException("Target reference code must not be blank");
        }
        if (!(degeneracyTolerance >= 0.0) || Double.isInfinite(degeneracyTolerance)) {
            throw new IllegalArgumentException("Degeneracy tolerance must be finite and non-negative: " + degeneracyTolerance);
        }
        if (!(rectangleEpsilon > 0.0) || Double.isInfinite(rectangleEpsilon)) {
            throw new IllegalArgumentException("Rectangle epsilon must be finite and positive: " + rectangleEpsilon);
        }
        origin = origin != null ? origin : "input";
    }

    public SpatialMergeOptions withMode(Mode mode) {
        return new SpatialMergeOptions(mode, targetCrs, degeneracyTolerance, rectangleEpsilon, assumeWgs84, origin);
    }

    public SpatialMergeOptions withTargetCrs(String targetCrs) {
        return new SpatialMergeOptions(mode, targetCrs, degeneracyTolerance, rectangleEpsilon, assumeWgs84, origin);
    }

    public SpatialMergeOptions withDegeneracyTolerance(double degeneracyTolerance) {
        return new SpatialMergeOptions(mode, targetCrs, degeneracyTolerance, rectangleEpsilon, assumeWgs84, origin);
    }

    public SpatialMergeOptions withRectangleEpsilon(double rectangleEpsilon) {
        return new SpatialMergeOptions(mode, targetCrs, degeneracyTolerance, rectangleEpsilon, assumeWgs84, origin);
    }

    public SpatialMergeOptions withAssumeWgs84(boolean assumeWgs84) {
        return new SpatialMergeOptions(mode, targetCrs, degeneracyTolerance, rectangleEpsilon, assumeWgs84, origin);
    }

    public SpatialMergeOptions withOrigin(String origin) {
        return new SpatialMergeOptions(mode, targetCrs, degeneracyTolerance, rectangleEpsilon, assumeWgs84, origin);
    }

    /**
     * Returns a debuggable string representation.
     */
    @Override
    public String toString() {
        return "mode=" + mode + ", targetCrs=" + targetCrs + ", tolerance=" + degeneracyTolerance
            + ", epsilon=" + rectangleEpsilon + ", assumeWgs84=" + assumeWgs84;
    }
}
