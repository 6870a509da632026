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

/// One file discoverable at a remote source.
///
/// @param name the file name, possibly with a relative directory prefix
/// @param url where the file can be fetched from
/// @param size the size in bytes, `0` when the source could not tell
public record CandidateFile(String name, String url, long size) {

    /// Size sentinel for files whose size is not known upstream.
    public static final long UNKNOWN_SIZE = 0L;

    public CandidateFile {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Candidate file name must not be empty");
        }
        if (size < 0) {
            throw new IllegalArgumentException("Candidate file size must be non-negative: " + name + "=" + size);
        }
    }

    public boolean hasKnownSize() {
        return size > 0;
    }

    @Override
    public String toString() {
        return name + "(" + (hasKnownSize() ? size + "B" : "unknown size") + ")";
    }
}
