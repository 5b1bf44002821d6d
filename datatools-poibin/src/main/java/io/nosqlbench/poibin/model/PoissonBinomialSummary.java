package io.nosqlbench.poibin.model;

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

import com.google.gson.annotations.SerializedName;
import io.nosqlbench.poibin.config.PoibinGsonConfig;

import java.util.Arrays;

/**
 * JSON-serializable snapshot of a Poisson binomial distribution.
 *
 * <pre>{@code
 * {
 *   "trials": 4,
 *   "mean": 2.0,
 *   "variance": 1.0,
 *   "std_dev": 1.0,
 *   "skewness": 0.0,
 *   "mode": 2,
 *   "mode_mass": 0.375,
 *   "pmf": [0.0625, 0.25, 0.375, 0.25, 0.0625]
 * }
 * }</pre>
 *
 * <p>{@code skewness} is null for a point-mass distribution.
 */
public final class PoissonBinomialSummary {

    @SerializedName("trials")
    private final int trials;

    @SerializedName("mean")
    private final double mean;

    @SerializedName("variance")
    private final double variance;

    @SerializedName("std_dev")
    private final double stdDev;

    @SerializedName("skewness")
    private final Double skewness;

    @SerializedName("mode")
    private final int mode;

    @SerializedName("mode_mass")
    private final double modeMass;

    @SerializedName("pmf")
    private final double[] pmf;

    public PoissonBinomialSummary(int trials, double mean, double variance, double stdDev,
                                  Double skewness, int mode, double modeMass, double[] pmf) {
        this.trials = trials;
        this.mean = mean;
        this.variance = variance;
        this.stdDev = stdDev;
        this.skewness = skewness;
        this.mode = mode;
        this.modeMass = modeMass;
        this.pmf = pmf.clone();
    }

    public int getTrials() {
        return trials;
    }

    public double getMean() {
        return mean;
    }

    public double getVariance() {
        return variance;
    }

    public double getStdDev() {
        return stdDev;
    }

    /**
     * @return the skewness, or null when the distribution is a point mass
     */
    public Double getSkewness() {
        return skewness;
    }

    public int getMode() {
        return mode;
    }

    public double getModeMass() {
        return modeMass;
    }

    public double[] getPmf() {
        return pmf.clone();
    }

    public String toJson() {
        return PoibinGsonConfig.gson().toJson(this);
    }

    public static PoissonBinomialSummary fromJson(String json) {
        return PoibinGsonConfig.gson().fromJson(json, PoissonBinomialSummary.class);
    }

    @Override
    public String toString() {
        return "PoissonBinomialSummary[trials=" + trials + ", mean=" + mean
            + ", variance=" + variance + ", mode=" + mode + ", pmf=" + Arrays.toString(pmf) + "]";
    }
}
