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

/// Thrown when a query value is not an integer in `[0, n]`.
public class IndexOutOfRangeException extends PoissonBinomialException {

    private final Number value;
    private final int trials;

    public IndexOutOfRangeException(Number value, int trials) {
        super(String.format("Number of successes must be an integer within [0, %d], got: %s",
              trials, value));
        this.value = value;
        this.trials = trials;
    }

    public Number getValue() {
        return value;
    }

    public int getTrials() {
        return trials;
    }
}
