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

/// What the budget walk accepts or rejects as a whole: either one atomic group of
/// files forming a single dataset, or one standalone file.
///
/// @param files the member files, one for a standalone unit
/// @param atomic true for a group of two or more files that must travel together
public record SelectionUnit(List<CandidateFile> files, boolean atomic) {

    public SelectionUnit {
        if (files == null || files.isEmpty()) {
            throw new IllegalArgumentException("A selection unit needs at least one file");
        }
        if (atomic && files.size() < 2) {
            throw new IllegalArgumentException("An atomic group needs at least two files: " + files);
        }
        if (!atomic && files.size() != 1) {
            throw new IllegalArgumentException("A standalone unit holds exactly one file: " + files);
        }
        files = List.copyOf(files);
    }

    public static SelectionUnit standalone(CandidateFile file) {
        return new SelectionUnit(List.of(file), false);
    }

    public static SelectionUnit group(List<CandidateFile> files) {
        return new SelectionUnit(files, true);
    }

    /// @return the summed size of all member files
    public long size() {
        long total = 0;
        for (CandidateFile file : files) {
            total += file.size();
        }
        return total;
    }

    @Override
    public String toString() {
        return (atomic ? "group" : "file") + files;
    }
}
