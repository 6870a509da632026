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

import io.geoextent.selection.SelectionPolicy;
import picocli.CommandLine;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Shared selection method option, converting {@code ordered|random|smallest|largest}
 * to a {@link SelectionPolicy} regardless of case.
 */
public class SelectionMethodOption {

    /**
     * Picocli type converter for {@link SelectionPolicy} names.
     */
    public static class SelectionPolicyConverter implements CommandLine.ITypeConverter<SelectionPolicy> {

        @Override
        public SelectionPolicy convert(String value) {
            if (value == null || value.trim().isEmpty()) {
                return SelectionPolicy.ORDERED;
            }
            try {
                return SelectionPolicy.valueOf(value.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new CommandLine.TypeConversionException(
                    "Invalid selection method: " + value + ". Expected one of " + names() + ".");
            }
        }

        private static String names() {
            return Arrays.stream(SelectionPolicy.values())
                .map(policy -> policy.name().toLowerCase(Locale.ROOT))
                .collect(Collectors.joining(", "));
        }
    }

    @CommandLine.Option(
        names = {"--method", "--download-method"},
        paramLabel = "METHOD",
        description = "Order in which files are considered against the budget: "
            + "ordered, random, smallest, largest (default: ordered)",
        converter = SelectionPolicyConverter.class
    )
    private SelectionPolicy policy = SelectionPolicy.ORDERED;

    public SelectionPolicy getPolicy() {
        return policy;
    }

    @Override
    public String toString() {
        return policy.name().toLowerCase(Locale.ROOT);
    }
}
