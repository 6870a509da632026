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

import io.geoextent.extent.model.ExtentRecord;
import io.geoextent.extent.model.TemporalExtent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Optional;

/// Combines per-file date ranges into one range spanning all of them.
/// Calendar-date granularity only.
public final class TemporalMerger {

    private static final Logger logger = LogManager.getLogger(TemporalMerger.class);

    private TemporalMerger() {
    }

    public static Optional<TemporalExtent> merge(List<ExtentRecord> records) {
        return merge(records, "input");
    }

    /// Merge the temporal extents of many records. Records whose `tbox` is missing, does
    /// not hold exactly two entries, or holds an entry that is not a `YYYY-MM-DD` date are
    /// ignored.
    /// @param records the per-file extents
    /// @param origin a label for log messages
    /// @return the earliest and latest dates across all contributing records, or empty
    public static Optional<TemporalExtent> merge(List<ExtentRecord> records, String origin) {
        LocalDate min = null;
        LocalDate max = null;
        int contributing = 0;
        int total = records != null ? records.size() : 0;

        for (int i = 0; i < total; i++) {
            ExtentRecord record = records.get(i);
            String[] tbox = record.tbox();
            if (tbox == null) {
                continue;
            }
            if (tbox.length != 2) {
                logger.debug("Ignoring temporal extent of {}: expected 2 dates, got {}", name(record, i), tbox.length);
                continue;
            }
            LocalDate start;
            LocalDate end;
            try {
                start = LocalDate.parse(String.valueOf(tbox[0]), TemporalExtent.FORMAT);
                end = LocalDate.parse(String.valueOf(tbox[1]), TemporalExtent.FORMAT);
            } catch (DateTimeParseException e) {
                logger.debug("Ignoring temporal extent of {}: {}", name(record, i), e.getMessage());
                continue;
            }
            contributing++;
            for (LocalDate date : new LocalDate[]{start, end}) {
                if (min == null || date.isBefore(min)) {
                    min = date;
                }
                if (max == null || date.isAfter(max)) {
                    max = date;
                }
            }
        }

        if (contributing == 0) {
            logger.debug("{} does not have files with identifiable temporal extent", origin);
            return Optional.empty();
        }
        logger.debug("{} contains {} files out of {} with identifiable temporal extent", origin, contributing, total);
        return Optional.of(new TemporalExtent(min, max));
    }

    private static String name(ExtentRecord record, int index) {
        return record.name() != null ? record.name() : "record #" + index;
    }
}
