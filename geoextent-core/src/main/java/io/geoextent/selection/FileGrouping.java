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
import java.util.stream.Collectors;

/// Files partitioned into atomic groups and standalone files.
///
/// @param units every unit, ordered by the input position of its first member
public record FileGrouping(List<SelectionUnit> units) {

    public FileGrouping {
        units = List.copyOf(units);
    }

    /// @return the atomic groups, in unit order
    public List<SelectionUnit> groups() {
        return units.stream().filter(SelectionUnit::atomic).collect(Collectors.toList());
    }

    /// @return the files that belong to no group, in unit order
    public List<CandidateFile> standalones() {
        return units.stream()
            .filter(unit -> !unit.atomic())
            .map(unit -> unit.files().get(0))
            .collect(Collectors.toList());
    }
}
