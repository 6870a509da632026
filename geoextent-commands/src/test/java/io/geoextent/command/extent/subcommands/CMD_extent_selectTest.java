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

import com.fasterxml.jackson.databind.JsonNode;
import io.geoextent.command.CommandRun;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("geoextent extent select")
class CMD_extent_selectTest {

    private static final String CANDIDATES = CommandRun.fixture("candidates.json").toString();

    @TempDir
    Path tempDir;

    private static List<String> names(JsonNode files) {
        List<String> names = new ArrayList<>();
        files.forEach(file -> names.add(file.get("name").asText()));
        return names;
    }

    @Test
    @DisplayName("should select everything without a budget")
    void shouldSelectAllWithoutBudget() {
        CommandRun run = CommandRun.execute("extent", "select", CANDIDATES);

        assertThat(run.exitCode()).isZero();
        assertThat(names(run.json().get("selected"))).containsExactly("a.csv", "b.csv", "c.csv", "README.md");
        assertThat(run.json().get("totalBytes").asLong()).isEqualTo(230);
        assertThat(run.json().get("skipped").size()).isZero();
    }

    @Test
    @DisplayName("should stop at the first file that exceeds the budget")
    void shouldApplyBudgetInOrder() {
        CommandRun run = CommandRun.execute("extent", "select", "--max-download-size", "170B", CANDIDATES);

        assertThat(run.exitCode()).isZero();
        assertThat(names(run.json().get("selected"))).containsExactly("a.csv", "README.md");
        assertThat(names(run.json().get("skipped"))).containsExactly("b.csv", "c.csv");
        assertThat(run.json().get("totalBytes").asLong()).isEqualTo(100);
        assertThat(run.json().get("selected").get(0).get("url").asText()).isEqualTo("https://example.org/files/a.csv");
        assertThat(run.err()).contains("skipped 2 of 4 files");
    }

    @Test
    @DisplayName("should accept the method in any case")
    void shouldSelectSmallestFirst() {
        CommandRun run = CommandRun.execute("extent", "select", "-m", "170B", "--method", "SMALLEST", CANDIDATES);

        assertThat(run.exitCode()).isZero();
        assertThat(names(run.json().get("selected"))).containsExactly("c.csv", "b.csv", "README.md");
        assertThat(run.json().get("totalBytes").asLong()).isEqualTo(130);
    }

    @Test
    @DisplayName("should give the same random selection for the same seed")
    void shouldBeReproducible() {
        CommandRun first = CommandRun.execute("extent", "select", "-m", "150B", "--method", "random", "--seed", "11", CANDIDATES);
        CommandRun second = CommandRun.execute("extent", "select", "-m", "150B", "--method", "random", "--seed", "11", CANDIDATES);

        assertThat(first.exitCode()).isZero();
        assertThat(first.out()).isEqualTo(second.out());
        assertThat(first.json().get("totalBytes").asLong()).isLessThanOrEqualTo(150);
    }

    @Test
    @DisplayName("should exit with code 2 when a hard limit is exceeded")
    void shouldFailOnHardLimit() {
        CommandRun run = CommandRun.execute("extent", "select", "-m", "170B", "--hard-limit", "--source", "zenodo", CANDIDATES);

        assertThat(run.exitCode()).isEqualTo(2);
        assertThat(run.out()).isEmpty();
        assertThat(run.err()).contains("zenodo").contains("230").contains("170");
    }

    @Test
    @DisplayName("should drop files without a geospatial extension")
    void shouldSkipNonGeospatialFiles() {
        CommandRun run = CommandRun.execute("extent", "select", "--skip-nogeo", CANDIDATES);

        assertThat(run.exitCode()).isZero();
        assertThat(names(run.json().get("selected"))).containsExactly("a.csv", "b.csv", "c.csv");
    }

    @Test
    @DisplayName("should keep extra extensions when skipping non-geospatial files")
    void shouldKeepExtraExtensions() {
        CommandRun run = CommandRun.execute("extent", "select", "--skip-nogeo", "--nogeo-ext", "md", CANDIDATES);

        assertThat(names(run.json().get("selected"))).contains("README.md");
    }

    @Test
    @DisplayName("should select shapefile components together")
    void shouldKeepShapefileTogether() throws IOException {
        Path candidates = tempDir.resolve("shapes.json");
        Files.writeString(candidates, "["
            + "{\"name\": \"roads.shp\", \"size\": 40},"
            + "{\"name\": \"roads.dbf\", \"size\": 35},"
            + "{\"name\": \"data.csv\", \"size\": 50}]");

        CommandRun run = CommandRun.execute("extent", "select", "-m", "70B", candidates.toString());

        assertThat(run.exitCode()).isZero();
        assertThat(run.json().get("selected").size()).isZero();
        assertThat(names(run.json().get("skipped"))).containsExactly("roads.dbf", "roads.shp", "data.csv");
    }

    @Test
    @DisplayName("should fail with exit code 1 for invalid input")
    void shouldFailForInvalidInput() throws IOException {
        assertThat(CommandRun.execute("extent", "select", "-m", "lots", CANDIDATES).exitCode()).isEqualTo(1);
        assertThat(CommandRun.execute("extent", "select", "--method", "biggest", CANDIDATES).exitCode()).isEqualTo(1);
        assertThat(CommandRun.execute("extent", "select", "--seed", "x", CANDIDATES).exitCode()).isEqualTo(1);

        Path negative = tempDir.resolve("negative.json");
        Files.writeString(negative, "[{\"name\": \"a.csv\", \"size\": -5}]");
        CommandRun run = CommandRun.execute("extent", "select", negative.toString());
        assertThat(run.exitCode()).isEqualTo(1);
        assertThat(run.err()).contains("non-negative");
    }

    @Test
    @DisplayName("should summarize the run and name the seed only for random selection")
    void shouldSummarizeWhenVerbose() {
        CommandRun defaultSeed = CommandRun.execute("extent", "select", "--verbose", "--method", "random", CANDIDATES);
        CommandRun explicitSeed = CommandRun.execute("extent", "select", "-v", "--method", "random", "--seed", "11", CANDIDATES);
        CommandRun ordered = CommandRun.execute("extent", "select", "-v", CANDIDATES);

        assertThat(defaultSeed.err()).contains("Selected 4 files totaling", "using random selection (seed 42 (default))");
        assertThat(explicitSeed.err()).contains("using random selection (seed 11)");
        assertThat(ordered.err()).contains("using ordered selection").doesNotContain("seed");
        assertThat(CommandRun.execute("extent", "select", CANDIDATES).err()).isEmpty();
    }

    @Test
    @DisplayName("should warn when a seed is given for a non-random method")
    void shouldWarnAboutIgnoredSeed() {
        CommandRun run = CommandRun.execute("extent", "select", "--seed", "7", "--method", "smallest", CANDIDATES);

        assertThat(run.exitCode()).isZero();
        assertThat(run.err()).contains("--seed 7 has no effect with smallest selection");
    }

    @Test
    @DisplayName("should keep stderr silent under --quiet and reject it with --verbose")
    void shouldHonorQuiet() {
        CommandRun quiet = CommandRun.execute("extent", "select", "-q", "-m", "170B", "--seed", "7", CANDIDATES);

        assertThat(quiet.exitCode()).isZero();
        assertThat(names(quiet.json().get("skipped"))).containsExactly("b.csv", "c.csv");
        assertThat(quiet.err()).isEmpty();

        CommandRun both = CommandRun.execute("extent", "select", "-q", "-v", CANDIDATES);
        assertThat(both.exitCode()).isEqualTo(1);
        assertThat(both.err()).contains("Cannot specify both --verbose and --quiet");
    }
}
