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

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;

/// A closed calendar date range. No time of day, no zone.
///
/// @param start the first day
/// @param end the last day, not before `start`
public record TemporalExtent(LocalDate start, LocalDate end) {

    /// Output format for both ends of the range.
    public static final DateTimeFormatter FORMAT = DateTimeFormatter.ISO_LOCAL_DATE;

    public TemporalExtent {
        if (start == null || end == null) {
            throw new IllegalArgumentException("Temporal extent needs both a start and an end");
        }
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("Temporal extent ends before it starts: " + start + " > " + end);
        }
    }

    /// @return `[start, end]` as `YYYY-MM-DD` strings
    public String[] toStrings() {
        return new String[]{FORMAT.format(start), FORMAT.format(end)};
    }

    @Override
    public String toString() {
        return FORMAT.format(start) + "/" + FORMAT.format(end);
    }
}
