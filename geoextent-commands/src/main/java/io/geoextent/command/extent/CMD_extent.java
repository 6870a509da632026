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

package io.geoextent.command.extent;

import io.geoextent.command.extent.subcommands.CMD_extent_merge;
import io.geoextent.command.extent.subcommands.CMD_extent_select;
import picocli.CommandLine;

import java.util.concurrent.Callable;

/// Merge extents and plan budgeted downloads
@CommandLine.Command(name = "extent",
    header = "Merge geospatial extents and plan budgeted downloads",
    description = "Contains subcommands to combine per-file extents and to choose which remote files to fetch",
    subcommands = {
        CMD_extent_merge.class,
        CMD_extent_select.class,
        CommandLine.HelpCommand.class
    })
public class CMD_extent implements Callable<Integer> {

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }
}
