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

package io.geoextent.extent.geometry;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A coordinate reference code in canonical form.
 * Accepts a bare EPSG number ({@code 4326}), an authority-qualified code
 * ({@code EPSG:4326}, {@code esri:54009}) or an OGC URN ({@code urn:ogc:def:crs:EPSG::4326}).
 *
 * @param authority the upper-cased authority name, e.g. {@code EPSG}
 * @param code the code within the authority
 */
public record CrsCode(String authority, String code) {

    public static final String EPSG = "EPSG";

    private static final Pattern BARE = Pattern.compile("^\\d+$");
    private static final Pattern QUALIFIED = Pattern.compile("^([A-Za-z][A-Za-z0-9_-]*):(\\d+)$");
    private static final Pattern URN = Pattern.compile("^urn:ogc:def:crs:([A-Za-z][A-Za-z0-9_-]*):[^:]*:(\\d+)$",
        Pattern.CASE_INSENSITIVE);

    /** WGS 84 geographic, longitude/latitude order. */
    public static final CrsCode WGS84 = new CrsCode(EPSG, "4326");

    public CrsCode {
        if (authority == null || authority.isBlank()) {
            throw new IllegalArgumentException("Reference authority must not be blank");
        }
        if (code == null || !BARE.matcher(code).matches()) {
            throw new IllegalArgumentException("Reference code must be numeric: " + code);
        }
        authority = authority.toUpperCase(Locale.ROOT);
    }

    /**
     * Parses a reference code.
     *
     * @throws IllegalArgumentException if the text is not a recognized reference code
     */
    public static CrsCode parse(String text) {
        if (text == null || text.trim().isEmpty()) {
            throw new IllegalArgumentException("Reference code must not be empty");
        }
        String trimmed = text.trim();
        if (BARE.matcher(trimmed).matches()) {
            return new CrsCode(EPSG, stripLeadingZeros(trimmed));
        }
        Matcher qualified = QUALIFIED.matcher(trimmed);
        if (qualified.matches()) {
            return new CrsCode(qualified.group(1), stripLeadingZeros(qualified.group(2)));
        }
        Matcher urn = URN.matcher(trimmed);
        if (urn.matches()) {
            return new CrsCode(urn.group(1), stripLeadingZeros(urn.group(2)));
        }
        throw new IllegalArgumentException("Unrecognized reference code: " + text);
    }

    private static String stripLeadingZeros(String digits) {
        return digits.replaceFirst("^0+(?=\\d)", "");
    }

    /**
     * @return the {@code AUTHORITY:code} name understood by projection libraries
     */
    public String qualifiedName() {
        return authority + ":" + code;
    }

    /**
     * EPSG codes render as the bare number, others as {@code AUTHORITY:code}.
     */
    @Override
    public String toString() {
        return EPSG.equals(authority) ? code : qualifiedName();
    }
}
