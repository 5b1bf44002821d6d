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

/// Base type of every error raised while building or querying a Poisson binomial
/// distribution.
///
/// Construction errors ([EmptyInputException], [InvalidProbabilityException],
/// [NumericalInstabilityException]) mean no distribution was produced. Query errors
/// ([IndexOutOfRangeException], [DegenerateDistributionException]) leave the
/// distribution usable.
public class PoissonBinomialException extends RuntimeException {

    public PoissonBinomialException(String message) {
        super(message);
    }
}
