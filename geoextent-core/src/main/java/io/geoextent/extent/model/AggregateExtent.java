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

import java.util.Optional;

/// Spatial and temporal coverage of one directory, repository or multi-file request.
///
/// @param spatial the merged spatial extent, [MergedExtent#EMPTY] if nothing contributed
/// @param temporal the merged date range, or null if nothing contributed
/// @param recordCount how many records were offered to the merge
public record AggregateExtent(MergedExtent spatial, TemporalExtent temporal, int recordCount) {

    public AggregateExtent {
        if (spatial == null) {
            throw new IllegalArgumentException("spatial extent must not be null, use MergedExtent.EMPTY");
        }
        if (recordCount < 0) {
            throw new IllegalArgumentException("record count must be non-negative: " + recordCount);
        }
    }

    public Optional<TemporalExtent> temporalExtent() {
        return Optional.ofNullable(temporal);
    }

    public boolean isEmpty() {
        return spatial.isEmpty() && temporal == null;
    }
}
