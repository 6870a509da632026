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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Random;

/// Chooses which candidate files to download under a cumulative byte budget.
///
/// The budget applies to the total of all files combined, not to individual files.
/// Sized files are grouped into units (atomic multi-file groups or standalone files),
/// ordered by the configured policy and walked greedily: a unit is accepted while the
/// running total stays within the budget, and the first unit that does not fit ends the
/// walk. Every later unit is skipped, even one that would still fit on its own.
///
/// Files of unknown size (`size == 0`) cannot be checked against the budget. They are
/// always selected and never counted.
public final class BudgetedSelector {

    private static final Logger logger = LogManager.getLogger(BudgetedSelector.class);

    private BudgetedSelector() {
    }

    public static SelectionResult select(List<CandidateFile> files, long budgetBytes) {
        return select(files, SelectionOptions.DEFAULT.withBudgetBytes(budgetBytes));
    }

    /// Select the files to download.
    /// @param files candidate files in source order
    /// @param options budget, policy, seed, limit mode and grouping formats
    /// @return the selection, with `skipped` populated when the budget truncated it
    /// @throws DownloadSizeExceededException under a hard limit when any unit had to be skipped
    public static SelectionResult select(List<CandidateFile> files, SelectionOptions options) {
        List<CandidateFile> input = files != null ? files : List.of();

        if (!options.hasBudget()) {
            long known = input.stream().filter(CandidateFile::hasKnownSize).mapToLong(CandidateFile::size).sum();
            return new SelectionResult(input, known, List.of());
        }
        long budget = options.budgetBytes();

        List<CandidateFile> sized = new ArrayList<>();
        List<CandidateFile> unsized = new ArrayList<>();
        for (CandidateFile file : input) {
            (file.hasKnownSize() ? sized : unsized).add(file);
        }

        List<SelectionUnit> units = new ArrayList<>(FileGrouper.group(sized, options.formats()).units());
        order(units, options.policy(), options.seed());

        List<CandidateFile> selected = new ArrayList<>();
        List<CandidateFile> skipped = new ArrayList<>();
        long runningTotal = 0;
        boolean limitReached = false;

        for (SelectionUnit unit : units) {
            if (!limitReached && unit.size() <= budget - runningTotal) {
                selected.addAll(unit.files());
                runningTotal += unit.size();
                logger.debug("Selected {}: {} bytes", unit, unit.size());
            } else {
                if (!limitReached) {
                    logger.debug("Cumulative limit reached at {}. Skipping it and all remaining files.", unit);
                    limitReached = true;
                }
                skipped.addAll(unit.files());
            }
        }

        selected.addAll(unsized);

        if (!skipped.isEmpty()) {
            long estimated = units.stream().mapToLong(SelectionUnit::size).sum();
            if (options.hardLimit()) {
                throw new DownloadSizeExceededException(estimated, budget, options.sourceName());
            }
            logger.info("Cumulative download size limit reached for {} ({}).", options.sourceName(), ByteSize.format(budget));
            logger.info("Selected {} files totaling {}; skipped {} files due to cumulative size limit.",
                selected.size(), ByteSize.format(runningTotal), skipped.size());
        }
        if (!unsized.isEmpty()) {
            logger.debug("{} files of unknown size from {} were selected without a budget check",
                unsized.size(), options.sourceName());
        }
        return new SelectionResult(selected, runningTotal, skipped);
    }

    private static void order(List<SelectionUnit> units, SelectionPolicy policy, long seed) {
        switch (policy) {
            case RANDOM:
                Collections.shuffle(units, new Random(seed));
                break;
            case SMALLEST:
                units.sort(Comparator.comparingLong(SelectionUnit::size));
                break;
            case LARGEST:
                units.sort(Comparator.comparingLong(SelectionUnit::size).reversed());
                break;
            case ORDERED:
            default:
                break;
        }
    }
}
