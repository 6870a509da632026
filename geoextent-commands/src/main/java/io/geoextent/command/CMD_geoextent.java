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

package io.geoextent.command;

import io.geoextent.command.extent.CMD_extent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.util.concurrent.Callable;

/// Entry point of the geoextent command line
@CommandLine.Command(name = "geoextent",
    mixinStandardHelpOptions = true,
    versionProvider = CMD_geoextent.VersionProvider.class,
    header = "Geospatial and temporal extent tools",
    subcommands = {
        CMD_extent.class,
        CommandLine.HelpCommand.class
    })
public class CMD_geoextent implements Callable<Integer> {

    private static final Logger logger = LogManager.getLogger(CMD_geoextent.class);

    /// Exit code for unreadable input and invalid options.
    public static final int EXIT_INPUT_ERROR = 1;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    /// Run the geoextent command line
    /// @param args Command line arguments
    public static void main(String[] args) {
        int exitCode = newCommandLine().execute(args);
        logger.debug("exiting with {}", exitCode);
        System.exit(exitCode);
    }

    /// Usage errors exit with [#EXIT_INPUT_ERROR] so that exit code 2 stays reserved for
    /// a download budget violation.
    /// @return a command line with case-insensitive options and enum values
    public static CommandLine newCommandLine() {
        return new CommandLine(new CMD_geoextent())
            .setCaseInsensitiveEnumValuesAllowed(true)
            .setOptionsCaseInsensitive(true)
            .setParameterExceptionHandler(CMD_geoextent::handleParameterException);
    }

    private static int handleParameterException(CommandLine.ParameterException ex, String[] args) {
        CommandLine commandLine = ex.getCommandLine();
        commandLine.getErr().println(ex.getMessage());
        if (!CommandLine.UnmatchedArgumentException.printSuggestions(ex, commandLine.getErr())) {
            commandLine.usage(commandLine.getErr());
        }
        return EXIT_INPUT_ERROR;
    }

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    /// Reads the version from the jar manifest, when there is one.
    public static class VersionProvider implements CommandLine.IVersionProvider {
        @Override
        public String[] getVersion() {
            String version = CMD_geoextent.class.getPackage().getImplementationVersion();
            return new String[]{"geoextent " + (version != null ? version : "development build")};
        }
    }
}
