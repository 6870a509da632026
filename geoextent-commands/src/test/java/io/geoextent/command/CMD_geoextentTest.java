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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("geoextent")
class CMD_geoextentTest {

    @Test
    @DisplayName("should list subcommands when run without arguments")
    void shouldPrintUsage() {
        CommandRun root = CommandRun.execute();
        CommandRun extent = CommandRun.execute("extent");

        assertThat(root.exitCode()).isZero();
        assertThat(root.out()).contains("extent");
        assertThat(extent.exitCode()).isZero();
        assertThat(extent.out()).contains("merge").contains("select");
    }

    @Test
    @DisplayName("should exit with code 1 for unknown options and subcommands")
    void shouldRejectUnknownArguments() {
        CommandRun run = CommandRun.execute("extent", "mrege");

        assertThat(run.exitCode()).isEqualTo(CMD_geoextent.EXIT_INPUT_ERROR);
        assertThat(run.err()).isNotEmpty();
        assertThat(CommandRun.execute("extent", "merge", "--no-such-option", "x.json").exitCode()).isEqualTo(1);
    }
}
