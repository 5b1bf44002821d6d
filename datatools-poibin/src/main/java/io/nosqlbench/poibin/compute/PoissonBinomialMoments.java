package io.nosqlbench.poibin.compute;

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

import io.nosqlbench.poibin.errors.DegenerateDistributionException;
import io.nosqlbench.poibin.model.ProbabilityVector;

import java.util.Objects;

/**
 * Closed-form moments of a Poisson binomial sum, computed directly from the
 * success probabilities.
 *
 * <h2>Moments</h2>
 *
 * <pre>{@code
 * Mean     = Σ p_i
 * Variance = Σ p_i(1 - p_i)
 * StdDev   = √Variance
 * Skewness = Σ p_i(1 - p_i)(1 - 2p_i) / Variance^1.5
 * }</pre>
 *
 * <p>The sums are accumulated once at construction in a single pass.
 */
public final class PoissonBinomialMoments {

    private final double mean;
    private final double variance;
    private final double thirdCentralMoment;

    private PoissonBinomialMoments(double mean, double variance, double thirdCentralMoment) {
        this.mean = mean;
        this.variance = variance;
        this.thirdCentralMoment = thirdCentralMoment;
    }

    /**
     * Computes the moments for the given probabilities.
     *
     * @param probabilities the success probabilities
     * @return the moments
     */
    public static PoissonBinomialMoments of(ProbabilityVector probabilities) {
        Objects.requireNonNull(probabilities, "probabilities cannot be null");
        double mean = 0.0;
        double variance = 0.0;
        double third = 0.0;
        for (int i = 0; i < probabilities.size(); i++) {
            double p = probabilities.get(i);
            double pq = p * (1.0 - p);
            mean += p;
            variance += pq;
            third += pq * (1.0 - 2.0 * p);
        }
        return new PoissonBinomialMoments(mean, variance, third);
    }

    public double mean() {
        return mean;
    }

    public double variance() {
        return variance;
    }

    public double stdDev() {
        return Math.sqrt(variance);
    }

    /**
     * Returns the skewness.
     *
     * @return the standardized third central moment
     * @throws DegenerateDistributionException if the variance is zero
     */
    public double skewness() {
        if (variance == 0.0) {
            throw new DegenerateDistributionException("Skewness");
        }
        // Math.pow(variance, 1.5) underflows for subnormal variances
        return thirdCentralMoment / variance / Math.sqrt(variance);
    }

    /**
     * @return true if the variance is zero
     */
    public boolean isDegenerate() {
        return variance == 0.0;
    }
}
