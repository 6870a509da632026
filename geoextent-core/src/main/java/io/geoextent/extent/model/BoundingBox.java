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

/**
 * Axis-aligned rectangle {@code [minX, minY, maxX, maxY]}.
 *
 * @param minX the smallest x ordinate
 * @param minY the smallest y ordinate
 * @param maxX the largest x ordinate
 * @param maxY the largest y ordinate
 */
public record BoundingBox(double minX, double minY, double maxX, double maxY) {

    /**
     * Compact constructor with validation.
     */
    public BoundingBox {
        if (!Double.isFinite(minX) || !Double.isFinite(minY) || !Double.isFinite(maxX) || !Double.isFinite(maxY)) {
            throw new InvalidGeometryException(
                "Bounding box ordinates must be finite: [" + minX + "," + minY + "," + maxX + "," + maxY + "]");
        }
        if (minX > maxX || minY > maxY) {
            throw new InvalidGeometryException(
                "Bounding box min must not exceed max: [" + minX + "," + minY + "," + maxX + "," + maxY + "]");
        }
    }

    /**
     * Builds a box from two arbitrary opposite corners, ordering the ordinates.
     */
    public static BoundingBox fromCorners(double x1, double y1, double x2, double y2) {
        return new BoundingBox(Math.min(x1, x2), Math.min(y1, y2), Math.max(x1, x2), Math.max(y1, y2));
    }

    /**
     * Builds a box from two arbitrary opposite corners, ordering the ordinates.
     */
    public static BoundingBox fromCorners(Vertex a, Vertex b) {
        return fromCorners(a.x(), a.y(), b.x(), b.y());
    }

    /**
     * Parses a raw {@code [minX, minY, maxX, maxY]} array as delivered by an extractor.
     * Swapped corners are ordered rather than rejected.
     *
     * @throws InvalidGeometryException if the array is null, not four elements long, or holds non-finite values
     */
    public static BoundingBox parse(double[] raw) {
        if (raw == null) {
            throw new InvalidGeometryException("Bounding box is missing");
        }
        if (raw.length != 4) {
            throw new InvalidGeometryException("Bounding box must have 4 ordinates, got " + raw.length);
        }
        return fromCorners(raw[0], raw[1], raw[2], raw[3]);
    }

    /**
     * Smallest box enclosing every vertex.
     *
     * @throws InvalidGeometryException if the list is empty
     */
    public static BoundingBox enclosing(List<Vertex> vertices) {
        if (vertices == null || vertices.isEmpty()) {
            throw new InvalidGeometryException("Cannot enclose an empty vertex list");
        }
        double minX = Double.POSITIVE_INFINITY;
        double minY = Double.POSITIVE_INFINITY;
        double maxX = Double.NEGATIVE_INFINITY;
        double maxY = Double.NEGATIVE_INFINITY;
        for (Vertex v : vertices) {
            minX = Math.min(minX, v.x());
            minY = Math.min(minY, v.y());
            maxX = Math.max(maxX, v.x());
            maxY = Math.max(maxY, v.y());
        }
        return new BoundingBox(minX, minY, maxX, maxY);
    }

    public double width() {
        return maxX - minX;
    }

    public double height() {
        return maxY - minY;
    }

    /**
     * True for a line or a point: zero width or zero height.
     */
    public boolean isDegenerate() {
        return width() == 0.0 || height() == 0.0;
    }

    /**
     * Widens each zero-length axis by {@code epsilon} on both sides. Axes with a
     * non-zero span are left untouched.
     */
    public BoundingBox expandDegenerate(double epsilon) {
        double ex = width() == 0.0 ? epsilon : 0.0;
        double ey = height() == 0.0 ? epsilon : 0.0;
        return new BoundingBox(minX - ex, minY - ey, maxX + ex, maxY + ey);
    }

    public Vertex lowerLeft() {
        return new Vertex(minX, minY);
    }

    public Vertex upperRight() {
        return new Vertex(maxX, maxY);
    }

    /**
     * The four corners, counter-clockwise from the lower left.
     */
    public List<Vertex> corners() {
        return List.of(
            new Vertex(minX, minY),
            new Vertex(maxX, minY),
            new Vertex(maxX, maxY),
            new Vertex(minX, maxY));
    }

    public double[] toArray() {
        return new double[]{minX, minY, maxX, maxY};
    }

    @Override
    public String toString() {
        return "[" + minX + "," + minY + "," + maxX + "," + maxY + "]";
    }
}
