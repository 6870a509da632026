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

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/// Groups the components of multi-file formats so they are selected or skipped together.
///
/// A file belongs to a composite format when its name ends with one of the format's
/// extensions (the longest matching one wins, ignoring case). Files of the same format
/// sharing the remaining base name form a group. Groups of two or more files become
/// atomic units with members ordered by name; a lone component is a standalone file.
public final class FileGrouper {

    private FileGrouper() {
    }

    public static FileGrouping group(List<CandidateFile> files) {
        return group(files, List.of(CompositeFormat.SHAPEFILE));
    }

    /// @param files the files to group, in input order
    /// @param formats the composite formats to recognize
    /// @return the units, each placed at the input position of its first member
    public static FileGrouping group(List<CandidateFile> files, List<CompositeFormat> formats) {
        List<List<CandidateFile>> buckets = new ArrayList<>();
        List<Boolean> composite = new ArrayList<>();
        Map<String, List<CandidateFile>> byBaseName = new HashMap<>();

        for (CandidateFile file : files) {
            Optional<String> key = groupKey(file.name(), formats);
            if (key.isPresent()) {
                List<CandidateFile> bucket = byBaseName.get(key.get());
                if (bucket == null) {
                    bucket = new ArrayList<>();
                    byBaseName.put(key.get(), bucket);
                    buckets.add(bucket);
                    composite.add(true);
                }
                bucket.add(file);
            } else {
                buckets.add(List.of(file));
                composite.add(false);
            }
        }

        List<SelectionUnit> units = new ArrayList<>(buckets.size());
        for (int i = 0; i < buckets.size(); i++) {
            List<CandidateFile> bucket = buckets.get(i);
            if (composite.get(i) && bucket.size() > 1) {
                List<CandidateFile> members = new ArrayList<>(bucket);
                members.sort(Comparator.comparing(CandidateFile::name));
                units.add(SelectionUnit.group(members));
            } else {
                bucket.forEach(file -> units.add(SelectionUnit.standalone(file)));
            }
        }
        return new FileGrouping(units);
    }

    private static Optional<String> groupKey(String fileName, List<CompositeFormat> formats) {
        CompositeFormat best = null;
        String bestExtension = null;
        for (CompositeFormat format : formats) {
            Optional<String> extension = format.matchExtension(fileName);
            if (extension.isPresent() && (bestExtension == null || extension.get().length() > bestExtension.length())) {
                best = format;
                bestExtension = extension.get();
            }
        }
        if (best == null) {
            return Optional.empty();
        }
        String base = fileName.substring(0, fileName.length() - bestExtension.length());
        return Optional.of(best.name() + ":" + base);
    }
}
