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
import io.geoextent.extent.model.InvalidGeometryException;
import io.geoextent.extent.model.Vertex;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.locationtech.jts.algorithm.ConvexHull;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.MultiPoint;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.proj4j.CRSFactory;
import org.locationtech.proj4j.CoordinateReferenceSystem;
import org.locationtech.proj4j.CoordinateTransform;
import org.locationtech.proj4j.CoordinateTransformFactory;
import org.locationtech.proj4j.ProjCoordinate;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/// [PlanarGeometry] backed by JTS for envelopes and hulls, and by proj4j for reprojection.
///
/// Parsed reference systems are cached; a fresh [CoordinateTransform] is built for each
/// [#reproject] call because proj4j transforms keep scratch state and are not thread safe.
public class JtsPlanarGeometry implements PlanarGeometry {

    private static final Logger logger = LogManager.getLogger(JtsPlanarGeometry.class);

    private final GeometryFactory geometryFactory;
    private final CRSFactory crsFactory = new CRSFactory();
    private final CoordinateTransformFactory transformFactory = new CoordinateTransformFactory();
    private final Map<CrsCode, CoordinateReferenceSystem> referenceSystems = new ConcurrentHashMap<>();

    public JtsPlanarGeometry() {
        this(new GeometryFactory());
    }

    public JtsPlanarGeometry(GeometryFactory geometryFactory) {
        this.geometryFactory = geometryFactory;
    }

    @Override
    public Footprint rectangle(BoundingBox box) {
        return Footprint.of(box.corners());
    }

    @Override
    public Footprint union(List<Footprint> parts) {
        List<List<Vertex>> all = new ArrayList<>();
        for (Footprint part : parts) {
            all.addAll(part.parts());
        }
        return new Footprint(all);
    }

    @Override
    public BoundingBox envelope(Footprint footprint) {
        if (footprint.isEmpty()) {
            throw new InvalidGeometryException("Cannot take the envelope of an empty footprint");
        }
        MultiPoint points = geometryFactory.createMultiPointFromCoords(toCoordinates(footprint.vertices()));
        Envelope envelope = points.getEnvelopeInternal();
        return new BoundingBox(envelope.getMinX(), envelope.getMinY(), envelope.getMaxX(), envelope.getMaxY());
    }

    @Override
    public List<Vertex> convexHull(Footprint footprint) {
        Coordinate[] coordinates = toCoordinates(footprint.vertices());
        Geometry hull = new ConvexHull(coordinates, geometryFactory).getConvexHull();
        if (!(hull instanceof Polygon) || hull.isEmpty()) {
            int distinct = new HashSet<>(Arrays.asList(coordinates)).size();
            throw new DegenerateHullException(distinct, hull.getGeometryType());
        }
        Coordinate[] ring = ((Polygon) hull).getExteriorRing().getCoordinates();
        List<Vertex> vertices = new ArrayList<>(ring.length);
        for (Coordinate c : ring) {
            vertices.add(new Vertex(c.getX(), c.getY()));
        }
        return vertices;
    }

    @Override
    public List<Vertex> reproject(List<Vertex> vertices, CrsCode source, CrsCode target) {
        if (source.equals(target)) {
            return List.copyOf(vertices);
        }
        CoordinateTransform transform =
            transformFactory.createTransform(lookup(source, source, target), lookup(target, source, target));
        List<Vertex> out = new ArrayList<>(vertices.size());
        ProjCoordinate result = new ProjCoordinate();
        for (Vertex vertex : vertices) {
            try {
                transform.transform(new ProjCoordinate(vertex.x(), vertex.y()), result);
            } catch (RuntimeException e) {
                throw new ReprojectionException(source.toString(), target.toString(), e);
            }
            Vertex transformed = new Vertex(result.x, result.y);
            if (!transformed.isFinite()) {
                throw new ReprojectionException(source.toString(), target.toString(),
                    "vertex " + vertex + " has no finite image");
            }
            out.add(transformed);
        }
        return out;
    }

    private CoordinateReferenceSystem lookup(CrsCode code, CrsCode source, CrsCode target) {
        CoordinateReferenceSystem crs = referenceSystems.get(code);
        if (crs != null) {
            return crs;
        }
        try {
            crs = crsFactory.createFromName(code.qualifiedName());
        } catch (RuntimeException e) {
            throw new ReprojectionException(source.toString(), target.toString(), e);
        }
        if (crs == null) {
            throw new ReprojectionException(source.toString(), target.toString(),
                "no definition for " + code.qualifiedName());
        }
        logger.debug("Resolved reference system {} as {}", code.qualifiedName(), crs.getName());
        referenceSystems.putIfAbsent(code, crs);
        return crs;
    }

    private static Coordinate[] toCoordinates(List<Vertex> vertices) {
        Coordinate[] coordinates = new Coordinate[vertices.size()];
        for (int i = 0; i < coordinates.length; i++) {
            Vertex v = vertices.get(i);
            coordinates[i] = new Coordinate(v.x(), v.y());
        }
        return coordinates;
    }
}
