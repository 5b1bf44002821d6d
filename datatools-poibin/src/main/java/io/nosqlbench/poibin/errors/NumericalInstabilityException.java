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

/// Thrown at construction when the transformed probability mass function fails a
/// post-processing check: non-finite values, imaginary residue, negative mass beyond
/// the clipping tolerance, a total that is not close to one, or tail sums that
/// disagree with the cumulative distribution.
public class NumericalInstabilityException extends PoissonBinomialException {

    private final String reason;

    public NumericalInstabilityException(int trials, String reason) {
        super(String.format("Unstable probability mass function for %d trials: %s", trials, reason));
        this.reason = reason;
    }

    /// @return a short description of the check that failed
    public String getReason() {
        return reason;
    }
}
