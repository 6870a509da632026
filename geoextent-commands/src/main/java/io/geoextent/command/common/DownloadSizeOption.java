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

import io.geoextent.selection.ByteSize;
import picocli.CommandLine;

/**
 * Shared cumulative download budget option using {@link DownloadSize} record with automatic parsing.
 * Accepts sizes such as {@code 100MB}, {@code 1.5GB} or {@code 512KiB}.
 */
public class DownloadSizeOption {

    /**
     * Immutable download budget.
     *
     * @param bytes the budget in bytes, always positive
     * @param text the size as the user wrote it
     */
    public record DownloadSize(long bytes, String text) {

        /**
         * Compact constructor with validation.
         */
        public DownloadSize {
            if (bytes <= 0) {
                throw new IllegalArgumentException("Download size must be positive, got: " + bytes);
            }
        }

        /**
         * Parses a human-readable size.
         */
        public static DownloadSize parse(String text) {
            return new DownloadSize(ByteSize.parse(text), text.trim());
        }

        @Override
        public String toString() {
            return text + " (" + bytes + " bytes)";
        }
    }

    /**
     * Picocli type converter for {@link DownloadSize} specifications.
     */
    public static class DownloadSizeConverter implements CommandLine.ITypeConverter<DownloadSize> {

        @Override
        public DownloadSize convert(String value) {
            try {
                return DownloadSize.parse(value);
            } catch (IllegalArgumentException e) {
                throw new CommandLine.TypeConversionException(e.getMessage());
            }
        }
    }

    @CommandLine.Option(
        names = {"-m", "--max-download-size"},
        paramLabel = "SIZE",
        description = "Cumulative download budget across all files, e.g. 100MB, 2GB, 512KiB (default: unlimited)",
        converter = DownloadSizeConverter.class
    )
    private DownloadSize downloadSize;

    public DownloadSize getDownloadSize() {
        return downloadSize;
    }

    public boolean isSpecified() {
        return downloadSize != null;
    }

    /**
     * Gets the budget in bytes, or null when no budget was given.
     */
    public Long getBudgetBytes() {
        return downloadSize != null ? downloadSize.bytes() : null;
    }

    @Override
    public String toString() {
        return downloadSize != null ? downloadSize.toString() : "unlimited";
    }
}
