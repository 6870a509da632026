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

package io.geoextent.selection;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/// Drops candidate files that cannot hold geospatial data, judged by extension, so
/// that budget selection only spends bytes on files an extractor can use.
public class GeospatialFileFilter {

    private static final Logger logger = LogManager.getLogger(GeospatialFileFilter.class);

    /// Extensions of vector, raster, tabular and archive formats that may carry extents.
    public static final Set<String> DEFAULT_EXTENSIONS = Set.of(
        ".geojson", ".json", ".shp", ".shx", ".dbf", ".prj", ".cpg", ".sbn", ".sbx", ".shp.xml",
        ".gpkg", ".kml", ".kmz", ".gml", ".gpx", ".fgb", ".topojson", ".geojsonl",
        ".tif", ".tiff", ".geotiff", ".tfw", ".jp2", ".asc", ".img", ".vrt", ".nc", ".nc4", ".hdf", ".h5",
        ".csv", ".tsv",
        ".zip", ".tar", ".tar.gz", ".tgz", ".7z"
    );

    private final Set<String> extensions;

    public GeospatialFileFilter() {
        this(List.of());
    }

    /// @param additionalExtensions extensions to accept on top of [#DEFAULT_EXTENSIONS], with or without a leading dot
    public GeospatialFileFilter(Collection<String> additionalExtensions) {
        LinkedHashSet<String> all = new LinkedHashSet<>(DEFAULT_EXTENSIONS);
        for (String extension : additionalExtensions) {
            all.add(CompositeFormat.normalizeExtension(extension));
        }
        this.extensions = Set.copyOf(all);
    }

    /// @param fileName a file name or relative path
    /// @return true if the name ends with an accepted extension, ignoring case
    public boolean isGeospatial(String fileName) {
        String lower = fileName.toLowerCase(Locale.ROOT);
        for (String extension : extensions) {
            if (lower.length() > extension.length() && lower.endsWith(extension)) {
                return true;
            }
        }
        return false;
    }

    /// Keep only geospatial candidates, preserving input order. An empty result is
    /// logged as a warning and returned as is.
    /// @param files the candidates
    /// @return the geospatial subset
    public List<CandidateFile> filter(List<CandidateFile> files) {
        List<CandidateFile> kept = files.stream()
            .filter(file -> isGeospatial(file.name()))
            .collect(Collectors.toList());
        if (kept.size() < files.size()) {
            logger.debug("Skipping {} of {} files without a geospatial extension", files.size() - kept.size(), files.size());
        }
        if (kept.isEmpty() && !files.isEmpty()) {
            logger.warn("None of the {} candidate files has a geospatial extension", files.size());
        }
        return kept;
    }

    public Set<String> getExtensions() {
        return extensions;
    }
}
