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

/// Thrown when a convex hull cannot be built as a polygon, which happens when the
/// collected points are all collinear or fewer than three of them are distinct.
public class DegenerateHullException extends RuntimeException {

    private final int distinctPoints;
    private final String resultType;

    public DegenerateHullException(int distinctPoints, String resultType) {
        super(String.format("Convex hull of %d distinct points is a %s, not a polygon", distinctPoints, resultType));
        this.distinctPoints = distinctPoints;
        this.resultType = resultType;
    }

    public int getDistinctPoints() {
        return distinctPoints;
    }

    public String getResultType() {
        return resultType;
    }
}
