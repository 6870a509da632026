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

import io.geoextent.command.common.DownloadSizeOption;
import io.geoextent.command.common.RandomSeedOption;
import io.geoextent.command.common.SelectionMethodOption;
import io.geoextent.command.common.VerbosityOption;
import io.geoextent.command.extent.ExtentDocuments;
import io.geoextent.selection.BudgetedSelector;
import io.geoextent.selection.ByteSize;
import io.geoextent.selection.CandidateFile;
import io.geoextent.selection.DownloadSizeExceededException;
import io.geoextent.selection.GeospatialFileFilter;
import io.geoextent.selection.SelectionOptions;
import io.geoextent.selection.SelectionPolicy;
import io.geoextent.selection.SelectionResult;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/// Choose which candidate files to download under a cumulative size budget.
@CommandLine.Command(name = "select",
    header = "Select candidate files to download under a cumulative size budget",
    description = "Reads a JSON array of candidate files, each with 'name', optional 'url' and 'size' in bytes\n" +
        "(missing or 0 means unknown), and prints the selected and skipped files as JSON.\n" +
        "Shapefile components sharing a base name are selected together or not at all.\n" +
        "Exits with code 2 when --hard-limit is set and the budget cannot cover every file.")
public class CMD_extent_select implements Callable<Integer> {

    private static final Logger logger = LogManager.getLogger(CMD_extent_select.class);

    /// Exit code for a budget violation under `--hard-limit`.
    public static final int EXIT_SIZE_EXCEEDED = 2;

    @CommandLine.Parameters(paramLabel = "CANDIDATES", description = "JSON file with an array of candidate files")
    private Path candidatesFile;

    @CommandLine.Mixin
    private DownloadSizeOption downloadSizeOption = new DownloadSizeOption();

    @CommandLine.Mixin
    private SelectionMethodOption selectionMethodOption = new SelectionMethodOption();

    @CommandLine.Mixin
    private RandomSeedOption randomSeedOption = new RandomSeedOption();

    @CommandLine.Option(names = {"--hard-limit"},
        description = "Fail instead of truncating when the budget cannot cover every file")
    private boolean hardLimit = false;

    @CommandLine.Option(names = {"--source"}, paramLabel = "NAME",
        description = "Name of the data source for messages (default: the candidates file name)")
    private String sourceName;

    @CommandLine.Option(names = {"--skip-nogeo"},
        description = "Drop files without a geospatial extension before selecting")
    private boolean skipNoGeo = false;

    @CommandLine.Option(names = {"--nogeo-ext"}, paramLabel = "EXT", split = ",",
        description = "Additional extensions to treat as geospatial with --skip-nogeo, e.g. las,laz")
    private List<String> additionalExtensions = new ArrayList<>();

    @CommandLine.Mixin
    private VerbosityOption verbosityOption = new VerbosityOption();

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        List<CandidateFile> candidates;
        GeospatialFileFilter filter;
        try {
            verbosityOption.validate();
            filter = new GeospatialFileFilter(additionalExtensions);
            if (!Files.isRegularFile(candidatesFile)) {
                throw new IllegalArgumentException("Candidates file not found: " + candidatesFile);
            }
            candidates = ExtentDocuments.toCandidates(ExtentDocuments.readArray(candidatesFile));
        } catch (IllegalArgumentException | IllegalStateException | IOException e) {
            spec.commandLine().getErr().printf("Unable to read %s: %s%n", candidatesFile, e.getMessage());
            logger.debug("select input failure", e);
            return 1;
        }

        if (skipNoGeo) {
            int before = candidates.size();
            candidates = filter.filter(candidates);
            if (candidates.isEmpty() && before > 0) {
                verbosityOption.warn("None of the %d candidate files has a geospatial extension", before);
            }
        }

        if (randomSeedOption.isSeedSpecified() && selectionMethodOption.getPolicy() != SelectionPolicy.RANDOM) {
            verbosityOption.warn("--seed %s has no effect with %s selection", randomSeedOption, selectionMethodOption);
        }

        SelectionOptions options = SelectionOptions.DEFAULT
            .withBudgetBytes(downloadSizeOption.getBudgetBytes())
            .withPolicy(selectionMethodOption.getPolicy())
            .withSeed(randomSeedOption.getSeed())
            .withHardLimit(hardLimit)
            .withSourceName(sourceName != null ? sourceName : candidatesFile.getFileName().toString());
        logger.debug("Selecting from {} candidates with {}", candidates.size(), options);

        SelectionResult result;
        try {
            result = BudgetedSelector.select(candidates, options);
        } catch (DownloadSizeExceededException e) {
            spec.commandLine().getErr().println(e.getMessage());
            return EXIT_SIZE_EXCEEDED;
        }

        if (result.hasSkipped()) {
            verbosityOption.warn("Download budget %s reached: skipped %d of %d files",
                downloadSizeOption, result.skipped().size(), candidates.size());
        }
        if (options.policy() == SelectionPolicy.RANDOM) {
            verbosityOption.summarize("Selected %d files totaling %s using %s selection (seed %s)",
                result.selected().size(), ByteSize.format(result.totalBytes()), selectionMethodOption, randomSeedOption);
        } else {
            verbosityOption.summarize("Selected %d files totaling %s using %s selection",
                result.selected().size(), ByteSize.format(result.totalBytes()), selectionMethodOption);
        }
        spec.commandLine().getOut().println(ExtentDocuments.toJson(result).toPrettyString());
        return 0;
    }
}
