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

import java.util.Locale;

/// Raised instead of truncating a selection when a hard download limit is configured
/// and the candidate files do not fit.
public class DownloadSizeExceededException extends RuntimeException {

    private final long estimatedBytes;
    private final long limitBytes;
    private final String sourceName;

    public DownloadSizeExceededException(long estimatedBytes, long limitBytes, String sourceName) {
        super(String.format(Locale.ROOT, "%s: estimated download size %,d bytes exceeds limit of %,d bytes",
            sourceName, estimatedBytes, limitBytes));
        this.estimatedBytes = estimatedBytes;
        this.limitBytes = limitBytes;
        this.sourceName = sourceName;
    }

    /// @return the total size of every file with a known size, selected or not
    public long getEstimatedBytes() {
        return estimatedBytes;
    }

    public long getLimitBytes() {
        return limitBytes;
    }

    public String getSourceName() {
        return sourceName;
    }
}
