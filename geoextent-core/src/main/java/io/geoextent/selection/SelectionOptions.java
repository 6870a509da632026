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

import java.util.List;

/**
 * Immutable configuration for one budgeted selection.
 *
 * @param budgetBytes maximum cumulative bytes of files with a known size, or null for no limit
 * @param policy      ordering applied before the budget walk
 * @param seed        shuffle seed, only used by {@link SelectionPolicy#RANDOM}
 * @param hardLimit   raise {@link DownloadSizeExceededException} instead of truncating
 * @param sourceName  label of the source being selected from, carried by the exceeded condition
 * @param formats     composite formats whose components are kept together
 */
public record SelectionOptions(
    Long budgetBytes,
    SelectionPolicy policy,
    long seed,
    boolean hardLimit,
    String sourceName,
    List<CompositeFormat> formats
) {

    /**
     * Default seed for reproducible random sampling.
     */
    public static final long DEFAULT_SEED = 42L;

    /**
     * No budget, input order, soft limit, shapefile grouping.
     */
    public static final SelectionOptions DEFAULT = new SelectionOptions(
        null, SelectionPolicy.ORDERED, DEFAULT_SEED, false, "source", List.of(CompositeFormat.SHAPEFILE));

    /**
     * Compact constructor with validation.
     */
    public SelectionOptions {
        if (budgetBytes != null && budgetBytes < 0) {
            throw new IllegalArgumentException("Download budget must be non-negative: " + budgetBytes);
        }
        if (policy == null) {
            throw new IllegalArgumentException("Selection policy must not be null");
        }
        sourceName = sourceName != null ? sourceName : "source";
        formats = formats != null ? List.copyOf(formats) : List.of();
    }

    public SelectionOptions withBudgetBytes(Long budgetBytes) {
        return new SelectionOptions(budgetBytes, policy, seed, hardLimit, sourceName, formats);
    }

    public SelectionOptions withPolicy(SelectionPolicy policy) {
        return new SelectionOptions(budgetBytes, policy, seed, hardLimit, sourceName, formats);
    }

    public SelectionOptions withSeed(long seed) {
        return new SelectionOptions(budgetBytes, policy, seed, hardLimit, sourceName, formats);
    }

    public SelectionOptions withHardLimit(boolean hardLimit) {
        return new SelectionOptions(budgetBytes, policy, seed, hardLimit, sourceName, formats);
    }

    public SelectionOptions withSourceName(String sourceName) {
        return new SelectionOptions(budgetBytes, policy, seed, hardLimit, sourceName, formats);
    }

    public SelectionOptions withFormats(List<CompositeFormat> formats) {
        return new SelectionOptions(budgetBytes, policy, seed, hardLimit, sourceName, formats);
    }

    /**
     * Checks if a budget is configured.
     */
    public boolean hasBudget() {
        return budgetBytes != null;
    }

    /**
     * Returns a debuggable string representation.
     */
    @Override
    public String toString() {
        return "budget=" + (budgetBytes != null ? ByteSize.format(budgetBytes) : "unlimited")
            + ", policy=" + policy + ", seed=" + seed + ", hardLimit=" + hardLimit + ", source=" + sourceName;
    }
}
