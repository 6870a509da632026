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

import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A file format whose datasets span several files sharing one base name, such as a
 * shapefile's {@code .shp}, {@code .shx} and {@code .dbf}.
 *
 * @param name       a label for log messages
 * @param extensions the component extensions, lower-cased, each starting with a dot
 */
public record CompositeFormat(String name, Set<String> extensions) {

    /**
     * ESRI shapefile components.
     */
    public static final CompositeFormat SHAPEFILE = new CompositeFormat("shapefile",
        Set.of(".shp", ".shx", ".dbf", ".prj", ".sbn", ".sbx", ".cpg", ".shp.xml"));

    /**
     * Compact constructor with validation and normalization.
     */
    public CompositeFormat {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Composite format name must not be blank");
        }
        if (extensions == null || extensions.isEmpty()) {
            throw new IllegalArgumentException("Composite format '" + name + "' needs at least one extension");
        }
        LinkedHashSet<String> normalized = new LinkedHashSet<>();
        for (String extension : extensions) {
            normalized.add(normalizeExtension(extension));
        }
        extensions = Set.copyOf(normalized);
    }

    /**
     * Creates a format from extension strings, with or without leading dots.
     */
    public static CompositeFormat of(String name, List<String> extensions) {
        return new CompositeFormat(name, new LinkedHashSet<>(extensions));
    }

    /**
     * Normalizes an extension to lower case with a leading dot.
     *
     * @throws IllegalArgumentException for a blank extension
     */
    public static String normalizeExtension(String extension) {
        if (extension == null || extension.trim().isEmpty() || extension.trim().equals(".")) {
            throw new IllegalArgumentException("Extension must not be blank");
        }
        String trimmed = extension.trim().toLowerCase(Locale.ROOT);
        return trimmed.startsWith(".") ? trimmed : "." + trimmed;
    }

    /**
     * Finds the longest component extension that ends the file name, ignoring case.
     * A name consisting of nothing but the extension does not match.
     */
    public Optional<String> matchExtension(String fileName) {
        String lower = fileName.toLowerCase(Locale.ROOT);
        return extensions.stream()
            .filter(ext -> lower.length() > ext.length() && lower.endsWith(ext))
            .max(Comparator.comparingInt(String::length));
    }

    @Override
    public String toString() {
        return name + extensions.stream().sorted().collect(Collectors.joining(",", "[", "]"));
    }
}
