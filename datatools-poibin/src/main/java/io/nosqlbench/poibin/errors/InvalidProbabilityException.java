package io.nosqlbench.poibin.errors;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

/// Thrown when a success probability lies outside `[0, 1]` or is NaN.
public class InvalidProbabilityException extends PoissonBinomialException {

    private final int index;
    private final double value;

    public InvalidProbabilityException(int index, double value) {
        super(String.format("Success probability at index %d must be within [0, 1], got: %s",
              index, value));
        this.index = index;
        this.value = value;
    }

    /// @return the position of the offending probability in the input
    public int getIndex() {
        return index;
    }

    /// @return the offending probability
    public double getValue() {
        return value;
    }
}
