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

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Human-readable byte sizes such as `100MB`, `1.5GB` or `512KiB`.
///
/// Decimal units (`KB`, `MB`, ...) are powers of 1000, binary units (`KiB`, `MiB`, ...)
/// are powers of 1024. Units are case-insensitive; a bare number is bytes.
public final class ByteSize {

    private static final Pattern SIZE = Pattern.compile("^\\s*(\\d+(?:\\.\\d+)?|\\.\\d+)\\s*([A-Za-z]*)\\s*$");

    private static final Map<String, Long> UNITS = Map.ofEntries(
        Map.entry("", 1L),
        Map.entry("b", 1L),
        Map.entry("kb", 1_000L),
        Map.entry("mb", 1_000_000L),
        Map.entry("gb", 1_000_000_000L),
        Map.entry("tb", 1_000_000_000_000L),
        Map.entry("pb", 1_000_000_000_000_000L),
        Map.entry("kib", 1L << 10),
        Map.entry("mib", 1L << 20),
        Map.entry("gib", 1L << 30),
        Map.entry("tib", 1L << 40),
        Map.entry("pib", 1L << 50)
    );

    private static final String[] DISPLAY_UNITS = {"B", "KB", "MB", "GB", "TB", "PB"};

    private ByteSize() {
    }

    /// Parse a size string into bytes, rounding fractional results down.
    /// @param text the size, e.g. `100MB`
    /// @return the size in bytes, always positive
    /// @throws IllegalArgumentException if the text is empty, malformed, uses an unknown unit,
    ///     overflows a long, or does not describe a positive size
    public static long parse(String text) {
        if (text == null || text.trim().isEmpty()) {
            throw new IllegalArgumentException(
                "Download size cannot be empty. Please use format like '100MB', '2GB', etc.");
        }
        Matcher matcher = SIZE.matcher(text);
        if (!matcher.matches()) {
            throw new IllegalArgumentException(invalid(text));
        }
        Long multiplier = UNITS.get(matcher.group(2).toLowerCase(Locale.ROOT));
        if (multiplier == null) {
            throw new IllegalArgumentException(invalid(text));
        }
        BigDecimal bytes = new BigDecimal(matcher.group(1))
            .multiply(BigDecimal.valueOf(multiplier))
            .setScale(0, RoundingMode.DOWN);
        if (bytes.signum() <= 0) {
            throw new IllegalArgumentException("Download size must be positive, got: " + text.trim());
        }
        try {
            return bytes.longValueExact();
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("Download size is too large: " + text.trim());
        }
    }

    /// Render a byte count with a decimal unit, e.g. `1.5 MB`.
    /// @param bytes the byte count
    /// @return a display string
    public static String format(long bytes) {
        if (bytes < 1000) {
            return bytes + " B";
        }
        double value = bytes;
        int unit = 0;
        while (value >= 1000 && unit < DISPLAY_UNITS.length - 1) {
            value /= 1000;
            unit++;
        }
        return String.format(Locale.ROOT, "%.1f %s", value, DISPLAY_UNITS[unit]);
    }

    private static String invalid(String text) {
        return "Invalid download size format: '" + text.trim() + "'. "
            + "Please use format like '100MB', '2GB', '500KB', '1.5TB', etc. "
            + "Supported units: B, KB, MB, GB, TB, PB, KiB, MiB, GiB, TiB, PiB.";
    }
}
