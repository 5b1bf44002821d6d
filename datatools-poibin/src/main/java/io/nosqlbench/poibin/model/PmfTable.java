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

import java.util.Objects;

/// Immutable lookup tables over the support `0..n` of a discrete distribution.
///
/// # Tables
///
/// ```text
///   index k:      0        1        2      ...      n
///   mass      pmf[0]   pmf[1]   pmf[2]   ...   pmf[n]
///   cumulative  P(X<=0)  P(X<=1)  ...            1
///   survival      1      P(X>=1)  P(X>=2) ...  pmf[n]
/// ```
///
/// The cumulative table is a left-to-right running sum and the survival table a
/// right-to-left running sum, both compensated (Kahan). Summing the small tail
/// directly keeps right-tail p-values accurate where `1 - cdf` would cancel.
///
/// Both running sums are capped at one, `cumulative[n]` and `survival[0]` are
/// exactly one. The mass array must already be non-negative and normalized.
///
/// # Mode
///
/// The mode is the smallest index carrying the largest mass. Masses within a relative
/// `1e-12` of the maximum count as tied with it, so transform rounding noise cannot
/// move the mode off the first of two equal peaks.
public final class PmfTable {

    /// Relative distance from the largest mass within which a value ties with it.
    static final double MODE_TIE_TOLERANCE = 1e-12;

    private final double[] mass;
    private final double[] cumulative;
    private final double[] survival;
    private final int modeIndex;
    private final double modeMass;

    private PmfTable(double[] mass) {
        this.mass = mass;
        this.cumulative = runningSumFromLeft(mass);
        this.survival = runningSumFromRight(mass);
        this.modeMass = max(mass);
        this.modeIndex = firstIndexNear(mass, modeMass);
    }

    /// Builds the tables from a non-negative mass array that sums to one.
    ///
    /// @param mass probability of each value `0..n`; copied
    /// @return the tables
    /// @throws IllegalArgumentException if the array is empty
    public static PmfTable of(double[] mass) {
        Objects.requireNonNull(mass, "mass cannot be null");
        if (mass.length == 0) {
            throw new IllegalArgumentException("mass cannot be empty");
        }
        return new PmfTable(mass.clone());
    }

    private static double[] runningSumFromLeft(double[] mass) {
        double[] out = new double[mass.length];
        double sum = 0.0;
        double c = 0.0;
        for (int k = 0; k < mass.length; k++) {
            double y = mass[k] - c;
            double t = sum + y;
            c = (t - sum) - y;
            sum = t;
            out[k] = Math.min(sum, 1.0);
        }
        out[mass.length - 1] = 1.0;
        return out;
    }

    private static double[] runningSumFromRight(double[] mass) {
        double[] out = new double[mass.length];
        double sum = 0.0;
        double c = 0.0;
        for (int k = mass.length - 1; k >= 0; k--) {
            double y = mass[k] - c;
            double t = sum + y;
            c = (t - sum) - y;
            sum = t;
            out[k] = Math.min(sum, 1.0);
        }
        out[0] = 1.0;
        return out;
    }

    private static double max(double[] mass) {
        double max = mass[0];
        for (int k = 1; k < mass.length; k++) {
            if (mass[k] > max) {
                max = mass[k];
            }
        }
        return max;
    }

    private static int firstIndexNear(double[] mass, double max) {
        double floor = max - max * MODE_TIE_TOLERANCE;
        for (int k = 0; k < mass.length; k++) {
            if (mass[k] >= floor) {
                return k;
            }
        }
        return 0;
    }

    /// @return the largest support value `n`
    public int maxValue() {
        return mass.length - 1;
    }

    /// @return `P(X = k)`
    public double mass(int k) {
        return mass[k];
    }

    /// @return `P(X <= k)`
    public double cumulative(int k) {
        return cumulative[k];
    }

    /// @return `P(X >= k)`
    public double survival(int k) {
        return survival[k];
    }

    /// @return the smallest `k` with the largest mass
    public int modeIndex() {
        return modeIndex;
    }

    /// @return the largest mass
    public double modeMass() {
        return modeMass;
    }

    /// Returns the largest gap between the directly summed right tail and the
    /// complement of the cumulative table, `|P(X >= k) - (1 - P(X <= k-1))|`
    /// over `k = 1..n`.
    ///
    /// @return the largest disagreement, zero for a single-point support
    public double maxTailDisagreement() {
        double worst = 0.0;
        for (int k = 1; k < mass.length; k++) {
            double gap = Math.abs(survival[k] - (1.0 - cumulative[k - 1]));
            if (gap > worst) {
                worst = gap;
            }
        }
        return worst;
    }

    /// Returns the first moment implied by the mass table, `sum k * pmf[k]`.
    ///
    /// @return the mean of the tabulated distribution
    public double impliedMean() {
        double sum = 0.0;
        for (int k = 1; k < mass.length; k++) {
            sum += k * mass[k];
        }
        return sum;
    }

    /// @return a copy of the mass table
    public double[] massValues() {
        return mass.clone();
    }

    /// @return a copy of the cumulative table
    public double[] cumulativeValues() {
        return cumulative.clone();
    }

    /// @return a copy of the survival table
    public double[] survivalValues() {
        return survival.clone();
    }
}
