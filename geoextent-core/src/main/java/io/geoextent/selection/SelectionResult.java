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

import java.util.List;

/// The files to download, and the ones left out by the budget.
///
/// @param selected files to fetch: accepted units first, then every file of unknown size
/// @param totalBytes summed size of the selected files with a known size
/// @param skipped files rejected by the budget walk, in walk order
public record SelectionResult(List<CandidateFile> selected, long totalBytes, List<CandidateFile> skipped) {

    public SelectionResult {
        selected = List.copyOf(selected);
        skipped = List.copyOf(skipped);
        if (totalBytes < 0) {
            throw new IllegalArgumentException("Total bytes must be non-negative: " + totalBytes);
        }
    }

    public boolean hasSkipped() {
        return !skipped.isEmpty();
    }
}
