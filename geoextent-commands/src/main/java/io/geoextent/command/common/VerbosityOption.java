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

package io.geoextent.command.common;

import picocli.CommandLine;

import java.io.PrintWriter;

/// `-v/--verbose` and `-q/--quiet` for the extent commands.
///
/// Input warnings (empty merges, budget truncation) go to the command's error stream
/// unless quiet; the one-line run summary goes there only when verbose. The JSON
/// result on stdout is written either way.
public class VerbosityOption {

    @CommandLine.Spec(CommandLine.Spec.Target.MIXEE)
    private CommandLine.Model.CommandSpec mixee;

    @CommandLine.Option(
        names = {"-v", "--verbose"},
        description = "Print a one-line summary of the run to stderr"
    )
    private boolean verbose = false;

    @CommandLine.Option(
        names = {"-q", "--quiet"},
        description = "Suppress input warnings on stderr; errors are still printed"
    )
    private boolean quiet = false;

    /// @throws IllegalStateException if both flags were given
    public void validate() {
        if (verbose && quiet) {
            throw new IllegalStateException("Cannot specify both --verbose and --quiet options");
        }
    }

    /// Print a warning about the input, unless `--quiet` was given.
    ///
    /// @param format a [String#format] pattern, without the trailing newline
    /// @param args the pattern arguments
    /// @return whether anything was printed
    public boolean warn(String format, Object... args) {
        if (quiet) {
            return false;
        }
        print(format, args);
        return true;
    }

    /// Print the run summary, only when `--verbose` was given.
    ///
    /// @param format a [String#format] pattern, without the trailing newline
    /// @param args the pattern arguments
    /// @return whether anything was printed
    public boolean summarize(String format, Object... args) {
        if (!verbose || quiet) {
            return false;
        }
        print(format, args);
        return true;
    }

    private void print(String format, Object... args) {
        PrintWriter err = mixee.commandLine().getErr();
        err.printf(format + "%n", args);
        err.flush();
    }
}
