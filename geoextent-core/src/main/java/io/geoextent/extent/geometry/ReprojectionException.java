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

/// Thrown when a coordinate reference code is unknown or unsupported, or when a
/// transform produces non-finite coordinates.
public class ReprojectionException extends RuntimeException {

    private final String sourceCrs;
    private final String targetCrs;

    public ReprojectionException(String sourceCrs, String targetCrs, String message) {
        super(String.format("Unable to reproject from '%s' to '%s': %s", sourceCrs, targetCrs, message));
        this.sourceCrs = sourceCrs;
        this.targetCrs = targetCrs;
    }

    public ReprojectionException(String sourceCrs, String targetCrs, Throwable cause) {
        super(String.format("Unable to reproject from '%s' to '%s': %s", sourceCrs, targetCrs, cause.getMessage()), cause);
        this.sourceCrs = sourceCrs;
        this.targetCrs = targetCrs;
    }

    public String getSourceCrs() {
        return sourceCrs;
    }

    public String getTargetCrs() {
        return targetCrs;
    }
}
