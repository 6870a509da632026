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

package io.geoextent.command.extent.subcommands;

import io.geoextent.command.common.VerbosityOption;
import io.geoextent.command.extent.ExtentDocuments;
import io.geoextent.extent.ExtentAggregator;
import io.geoextent.extent.PointDegeneracyDetector;
import io.geoextent.extent.SpatialMergeOptions;
import io.geoextent.extent.model.AggregateExtent;
import io.geoextent.extent.model.ExtentRecord;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/// Merge per-file extents into one overall extent.
@CommandLine.Command(name = "merge",
    header = "Merge per-file spatial and temporal extents into one extent",
    description = "Reads a JSON array of extent records, each with optional 'name', 'bbox' [minx,miny,maxx,maxy],\n" +
        "'crs', 'tbox' [start,end] and 'hull' [[x,y],...], and prints the merged extent as JSON.\n" +
        "Records that cannot be used are skipped and logged.")
public class CMD_extent_merge implements Callable<Integer> {

    private static final Logger logger = LogManager.getLogger(CMD_extent_merge.class);

    @CommandLine.Parameters(paramLabel = "RECORDS", description = "JSON file with an array of extent records")
    private Path recordsFile;

    @CommandLine.Option(names = {"--convex-hull"},
        description = "Merge into a convex hull instead of a bounding box")
    private boolean convexHull = false;

    @CommandLine.Option(names = {"--assume-wgs84"},
        description = "Treat records without a 'crs' as EPSG:4326 instead of skipping them")
    private boolean assumeWgs84 = false;

    @CommandLine.Option(names = {"--tolerance"}, paramLabel = "D",
        description = "Maximum span per axis for an extent to count as a point (default: ${DEFAULT-VALUE})")
    private double tolerance = PointDegeneracyDetector.DEFAULT_TOLERANCE;

    @CommandLine.Option(names = {"--epsilon"}, paramLabel = "D",
        description = "Widening applied to zero-width or zero-height boxes in convex hull mode (default: ${DEFAULT-VALUE})")
    private double epsilon = SpatialMergeOptions.DEFAULT_RECTANGLE_EPSILON;

    @CommandLine.Mixin
    private VerbosityOption verbosityOption = new VerbosityOption();

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        SpatialMergeOptions options;
        List<ExtentRecord> records;
        try {
            verbosityOption.validate();
            options = SpatialMergeOptions.DEFAULT
                .withMode(convexHull ? SpatialMergeOptions.Mode.CONVEX_HULL : SpatialMergeOptions.Mode.BOUNDING_BOX)
                .withAssumeWgs84(assumeWgs84)
                .withDegeneracyTolerance(tolerance)
                .withRectangleEpsilon(epsilon)
                .withOrigin(recordsFile.getFileName().toString());
            if (!Files.isRegularFile(recordsFile)) {
                throw new IllegalArgumentException("Records file not found: " + recordsFile);
            }
            records = ExtentDocuments.toRecords(ExtentDocuments.readArray(recordsFile));
        } catch (IllegalArgumentException | IllegalStateException | IOException e) {
            spec.commandLine().getErr().printf("Unable to read %s: %s%n", recordsFile, e.getMessage());
            logger.debug("merge input failure", e);
            return 1;
        }

        logger.debug("Merging {} records from {} with {}", records.size(), recordsFile, options);
        AggregateExtent extent = new ExtentAggregator().aggregate(records, options);

        if (extent.isEmpty()) {
            verbosityOption.warn("No usable extent in %d records of %s", records.size(), recordsFile);
        }
        verbosityOption.summarize("Merged %d records: bbox=%s tbox=%s%s",
            records.size(),
            extent.spatial().bbox(),
            extent.temporal(),
            extent.spatial().isPoint() ? " (point)" : "");
        spec.commandLine().getOut().println(ExtentDocuments.toJson(extent).toPrettyString());
        return 0;
    }
}
