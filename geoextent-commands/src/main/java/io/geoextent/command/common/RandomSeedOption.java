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

import io.geoextent.selection.SelectionOptions;
import picocli.CommandLine;

/**
 * Shared random seed option using {@link Seed} record with automatic parsing.
 * Random sampling is reproducible by default: an unspecified seed is
 * {@link SelectionOptions#DEFAULT_SEED}, never the clock.
 */
public class RandomSeedOption {

    /**
     * Immutable random seed specification.
     *
     * @param value the seed value, or null for the default seed
     */
    public record Seed(Long value) {

        public Seed(long value) {
            this(Long.valueOf(value));
        }

        /**
         * Creates a Seed that falls back to the default.
         */
        public Seed() {
            this((Long) null);
        }

        /**
         * Gets the effective seed value.
         */
        public long effective() {
            return value != null ? value : SelectionOptions.DEFAULT_SEED;
        }

        /**
         * Checks if this seed was explicitly specified.
         */
        public boolean isExplicit() {
            return value != null;
        }

        @Override
        public String toString() {
            return value != null ? String.valueOf(value) : SelectionOptions.DEFAULT_SEED + " (default)";
        }
    }

    /**
     * Picocli type converter for {@link Seed} specifications.
     */
    public static class SeedConverter implements CommandLine.ITypeConverter<Seed> {

        @Override
        public Seed convert(String value) {
            if (value == null || value.trim().isEmpty()) {
                return new Seed();
            }
            try {
                return new Seed(Long.parseLong(value.trim()));
            } catch (NumberFormatException e) {
                throw new CommandLine.TypeConversionException(
                    "Invalid seed value: " + value + ". Must be a valid long integer.");
            }
        }
    }

    @CommandLine.Option(
        names = {"-s", "--seed"},
        description = "Seed for the random selection method (default: " + SelectionOptions.DEFAULT_SEED + ")",
        converter = SeedConverter.class
    )
    private Seed seed;

    private Seed seedOrDefault() {
        return seed != null ? seed : new Seed();
    }

    public long getSeed() {
        return seedOrDefault().effective();
    }

    /**
     * Checks if {@code --seed} was given on the command line.
     *
     * @return true only for an explicit seed
     */
    public boolean isSeedSpecified() {
        return seedOrDefault().isExplicit();
    }

    @Override
    public String toString() {
        return seedOrDefault().toString();
    }
}
