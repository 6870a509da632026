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

import io.geoextent.extent.model.Vertex;

import java.util.ArrayList;
import java.util.List;

/// A library-neutral planar shape: one or more parts, each an ordered vertex list
/// such as a rectangle's corners or a hull ring. This is what crosses the
/// [PlanarGeometry] seam, so callers never see the backing geometry library.
///
/// @param parts the vertex lists making up this shape
public record Footprint(List<List<Vertex>> parts) {

    public Footprint {
        if (parts == null) {
            throw new IllegalArgumentException("parts must not be null");
        }
        List<List<Vertex>> copy = new ArrayList<>(parts.size());
        for (List<Vertex> part : parts) {
            if (part == null || part.isEmpty()) {
                throw new IllegalArgumentException("footprint parts must be non-empty");
            }
            copy.add(List.copyOf(part));
        }
        parts = List.copyOf(copy);
    }

    /// @param vertices the single part
    /// @return a one-part footprint
    public static Footprint of(List<Vertex> vertices) {
        return new Footprint(List.of(vertices));
    }

    public boolean isEmpty() {
        return parts.isEmpty();
    }

    public int partCount() {
        return parts.size();
    }

    /// @return every vertex of every part, in part order
    public List<Vertex> vertices() {
        List<Vertex> all = new ArrayList<>();
        parts.forEach(all::addAll);
        return all;
    }
}
