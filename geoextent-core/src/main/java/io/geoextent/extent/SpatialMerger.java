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
import io.geoextent.extent.geometry.DegenerateHullException;
import io.geoextent.extent.geometry.Footprint;
import io.geoextent.extent.geometry.JtsPlanarGeometry;
import io.geoextent.extent.geometry.PlanarGeometry;
import io.geoextent.extent.geometry.ReprojectionException;
import io.geoextent.extent.model.BoundingBox;
import io.geoextent.extent.model.ExtentRecord;
import io.geoextent.extent.model.InvalidGeometryException;
import io.geoextent.extent.model.MergedExtent;
import io.geoextent.extent.model.Vertex;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/// Combines per-file spatial extents into one extent in a common reference system.
///
/// ## Bounding box mode
/// Every record with a parsable bounding box and a known reference is normalized and
/// turned into a rectangle; the envelope of all rectangles is the result.
///
/// ## Convex hull mode
/// Every record contributes its prior hull, or else its rectangle. Zero-width or
/// zero-height rectangles are widened by the configured epsilon first. The hull is
/// taken over the full vertex set of all contributions. When that hull is not a
/// polygon the result is the bounding box of those same contributions, so records
/// that only carry a prior hull still count.
///
/// A record that cannot be used costs only itself: it is logged and skipped. When no
/// record contributes, the result is [MergedExtent#EMPTY].
public class SpatialMerger {

    private static final Logger logger = LogManager.getLogger(SpatialMerger.class);

    private final PlanarGeometry geometry;
    private final CoordinateNormalizer normalizer;

    /// Create a merger backed by [JtsPlanarGeometry].
    public SpatialMerger() {
        this(new JtsPlanarGeometry());
    }

    /// Create a merger over a specific geometry backing.
    /// @param geometry the planar geometry operations to use
    public SpatialMerger(PlanarGeometry geometry) {
        this.geometry = geometry;
        this.normalizer = new CoordinateNormalizer(geometry);
    }

    public MergedExtent merge(List<ExtentRecord> records) {
        return merge(records, SpatialMergeOptions.DEFAULT);
    }

    /// Merge the spatial extents of many records.
    /// @param records the per-file extents
    /// @param options merge mode, target reference and tolerances
    /// @return the merged extent, never null
    /// @throws IllegalArgumentException if the target reference code is not a valid code
    public MergedExtent merge(List<ExtentRecord> records, SpatialMergeOptions options) {
        String target = CrsCode.parse(options.targetCrs()).toString();
        if (records == null || records.isEmpty()) {
            logger.debug("{} has no records to merge", options.origin());
            return MergedExtent.EMPTY;
        }
        switch (options.mode()) {
            case CONVEX_HULL:
                return mergeHulls(records, options, target);
            case BOUNDING_BOX:
            default:
                return mergeBoxes(records, options, target);
        }
    }

    private MergedExtent mergeBoxes(List<ExtentRecord> records, SpatialMergeOptions options, String target) {
        List<Footprint> rectangles = new ArrayList<>();
        for (int i = 0; i < records.size(); i++) {
            ExtentRecord record = records.get(i);
            String label = label(record, i);
            if (!record.hasBbox()) {
                logger.debug("{} does not have an identifiable geographic extent (bbox)", label);
                continue;
            }
            String crs = sourceCrs(record, options);
            if (crs == null) {
                logger.debug("{} does not have an identifiable geographic extent (crs)", label);
                continue;
            }
            try {
                BoundingBox box = normalizer.normalize(BoundingBox.parse(record.bbox()), crs, target);
                rectangles.add(geometry.rectangle(box));
            } catch (InvalidGeometryException e) {
                logger.warn("Skipping {}: invalid bounding box: {}", label, e.getMessage());
            } catch (ReprojectionException e) {
                logger.warn("Skipping {}: reference system {} may be invalid: {}", label, crs, e.getMessage());
            }
        }

        if (rectangles.isEmpty()) {
            logger.debug("{} does not have geometries with identifiable geographic extent", options.origin());
            return MergedExtent.EMPTY;
        }
        logger.debug("{} contains {} geometries out of {} with identifiable geographic extent",
            options.origin(), rectangles.size(), records.size());

        BoundingBox envelope = geometry.envelope(geometry.union(rectangles));
        return MergedExtent.ofBox(envelope, target,
            PointDegeneracyDetector.detect(envelope, options.degeneracyTolerance()));
    }

    private MergedExtent mergeHulls(List<ExtentRecord> records, SpatialMergeOptions options, String target) {
        List<Footprint> shapes = new ArrayList<>();
        for (int i = 0; i < records.size(); i++) {
            ExtentRecord record = records.get(i);
            String label = label(record, i);
            if (!record.hasHull() && !record.hasBbox()) {
                logger.debug("{} does not have an identifiable geographic extent for a convex hull", label);
                continue;
            }
            String crs = sourceCrs(record, options);
            if (crs == null) {
                logger.debug("{} does not have an identifiable geographic extent (crs)", label);
                continue;
            }
            try {
                if (record.hasHull()) {
                    List<Vertex> vertices = normalizer.normalizeVertices(requireFinite(record.hull()), crs, target);
                    if (vertices.size() == 1) {
                        BoundingBox single = BoundingBox.enclosing(vertices);
                        shapes.add(geometry.rectangle(single.expandDegenerate(options.rectangleEpsilon())));
                    } else {
                        shapes.add(Footprint.of(vertices));
                    }
                } else {
                    BoundingBox box = normalizer.normalize(BoundingBox.parse(record.bbox()), crs, target);
                    if (box.isDegenerate()) {
                        box = box.expandDegenerate(options.rectangleEpsilon());
                    }
                    shapes.add(geometry.rectangle(box));
                }
            } catch (InvalidGeometryException e) {
                logger.warn("Skipping {}: invalid geometry for convex hull: {}", label, e.getMessage());
            } catch (ReprojectionException e) {
                logger.warn("Skipping {}: reference system {} may be invalid: {}", label, crs, e.getMessage());
            }
        }

        if (shapes.isEmpty()) {
            logger.debug("{} does not have geometries with identifiable geographic extent for convex hull",
                options.origin());
            return MergedExtent.EMPTY;
        }

        List<Vertex> hull;
        try {
            hull = geometry.convexHull(geometry.union(shapes));
        } catch (DegenerateHullException e) {
            logger.warn("Could not calculate convex hull for merged geometries from {}: {}. "
                + "Falling back to bounding box.", options.origin(), e.getMessage());
            BoundingBox envelope = geometry.envelope(geometry.union(shapes));
            return MergedExtent.ofBox(envelope, target,
                PointDegeneracyDetector.detect(envelope, options.degeneracyTolerance()));
        }
        logger.debug("{} contains {} geometries with convex hull merged", options.origin(), shapes.size());
        return MergedExtent.ofHull(hull, target, PointDegeneracyDetector.detect(hull, options.degeneracyTolerance()));
    }

    private static String sourceCrs(ExtentRecord record, SpatialMergeOptions options) {
        if (record.crs() != null && !record.crs().isBlank()) {
            return record.crs();
        }
        return options.assumeWgs84() ? CrsCode.WGS84.toString() : null;
    }

    private static List<Vertex> requireFinite(List<Vertex> vertices) {
        for (Vertex vertex : vertices) {
            if (!vertex.isFinite()) {
                throw new InvalidGeometryException("hull vertex is not finite: " + vertex);
            }
        }
        return vertices;
    }

    private static String label(ExtentRecord record, int index) {
        return record.name() != null ? record.name() : "record #" + index;
    }
}
