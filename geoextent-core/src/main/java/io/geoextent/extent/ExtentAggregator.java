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

import io.geoextent.extent.model.AggregateExtent;
import io.geoextent.extent.model.ExtentRecord;
import io.geoextent.extent.model.MergedExtent;
import io.geoextent.extent.model.TemporalExtent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;

/// Runs the spatial and temporal merges over the same set of records, producing the
/// overall coverage of a directory, a repository or a multi-file request.
public class ExtentAggregator {

    private static final Logger logger = LogManager.getLogger(ExtentAggregator.class);

    private final SpatialMerger spatialMerger;

    public ExtentAggregator() {
        this(new SpatialMerger());
    }

    public ExtentAggregator(SpatialMerger spatialMerger) {
        this.spatialMerger = spatialMerger;
    }

    /// @param records the per-file extents
    /// @param options spatial merge configuration, whose origin also labels temporal log messages
    /// @return the combined coverage
    public AggregateExtent aggregate(List<ExtentRecord> records, SpatialMergeOptions options) {
        List<ExtentRecord> input = records != null ? records : List.of();
        MergedExtent spatial = spatialMerger.merge(input, options);
        TemporalExtent temporal = TemporalMerger.merge(input, options.origin()).orElse(null);
        if (spatial.isEmpty() && temporal == null) {
            logger.info("No geographic or temporal extent found in {} ({} records)", options.origin(), input.size());
        } else {
            logger.info("Extent of {}: bbox={} crs={} tbox={}{}", options.origin(), spatial.bbox(), spatial.crs(),
                temporal, spatial.isPoint() ? " (point " + spatial.point() + ")" : "");
        }
        return new AggregateExtent(spatial, temporal, input.size());
    }
}
