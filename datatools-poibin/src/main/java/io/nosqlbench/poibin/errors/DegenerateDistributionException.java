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

/// Thrown when a moment is requested that does not exist for a point-mass
/// distribution, i.e. when every success probability is exactly 0 or 1.
public class DegenerateDistributionException extends PoissonBinomialException {

    public DegenerateDistributionException(String statistic) {
        super(String.format("%s is undefined: variance is zero (every probability is 0 or 1)",
              statistic));
    }
}
