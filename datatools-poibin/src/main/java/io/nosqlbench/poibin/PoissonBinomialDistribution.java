package io.nosqlbench.poibin;

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

import io.nosqlbench.poibin.compute.CommonsMathFourierTransform;
import io.nosqlbench.poibin.compute.PmfBuilder;
import io.nosqlbench.poibin.compute.PoissonBinomialMoments;
import io.nosqlbench.poibin.config.PoissonBinomialConfig;
import io.nosqlbench.poibin.errors.DegenerateDistributionException;
import io.nosqlbench.poibin.errors.IndexOutOfRangeException;
import io.nosqlbench.poibin.model.PmfTable;
import io.nosqlbench.poibin.model.PoissonBinomialSummary;
import io.nosqlbench.poibin.model.ProbabilityVector;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.IntToDoubleFunction;

/**
 * Distribution of the number of successes among {@code n} independent Bernoulli
 * trials with individual success probabilities {@code p_1..p_n}.
 *
 * <h2>Purpose</h2>
 *
 * <p>The full probability mass function over {@code 0..n} is computed once, at
 * construction, by inverting the characteristic function with a discrete Fourier
 * transform (Hong 2013). All queries afterwards are lookups into immutable tables.
 *
 * <h2>Queries</h2>
 *
 * <ul>
 *   <li><b>pmf(k)</b>: {@code P(X = k)}</li>
 *   <li><b>cdf(k)</b>: {@code P(X <= k)}</li>
 *   <li><b>pval(k)</b>: right-tailed p-value {@code P(X >= k)}, {@code pval(0) = 1}</li>
 *   <li><b>amax() / argmax()</b>: largest mass and the smallest k carrying it</li>
 *   <li><b>mean, variance, stdDev, skewness</b>: closed form from the probabilities</li>
 * </ul>
 *
 * <p>Every query takes a single value or a sequence and answers in the same shape.
 * Values must be integers in {@code [0, n]}; anything else raises
 * {@link IndexOutOfRangeException} and leaves the distribution usable.
 *
 * <h2>Usage</h2>
 *
 * <pre>{@code
 * PoissonBinomialDistribution dist = PoissonBinomialDistribution.of(0.1, 0.5, 0.9);
 *
 * double exactlyTwo = dist.pmf(2);
 * double[] atMost = dist.cdf(new int[]{0, 1, 2});
 * double tail = dist.pval(3);
 *
 * // Custom numerical settings
 * PoissonBinomialConfig config = PoissonBinomialConfig.load(Path.of("poibin.json"));
 * PoissonBinomialDistribution tuned = new PoissonBinomialDistribution(
 *     ProbabilityVector.of(probabilities), config);
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 *
 * <p>Instances are immutable and may be queried from any number of threads.
 *
 * @see PmfBuilder
 * @see PoissonBinomialMoments
 */
public final class PoissonBinomialDistribution {

    private final ProbabilityVector probabilities;
    private final PmfTable table;
    private final PoissonBinomialMoments moments;

    /**
     * Builds the distribution with default numerical settings.
     *
     * @param probabilities the success probability of each trial
     * @throws io.nosqlbench.poibin.errors.EmptyInputException if no probabilities are given
     * @throws io.nosqlbench.poibin.errors.InvalidProbabilityException if an entry is outside [0, 1]
     * @throws io.nosqlbench.poibin.errors.NumericalInstabilityException if the computed pmf fails verification
     */
    public PoissonBinomialDistribution(double[] probabilities) {
        this(ProbabilityVector.of(probabilities), new PmfBuilder());
    }

    /**
     * Builds the distribution with the given numerical settings.
     *
     * @param probabilities validated success probabilities
     * @param config numerical settings
     */
    public PoissonBinomialDistribution(ProbabilityVector probabilities, PoissonBinomialConfig config) {
        this(probabilities, new PmfBuilder(config, new CommonsMathFourierTransform()));
    }

    /**
     * Builds the distribution with the given builder.
     *
     * @param probabilities validated success probabilities
     * @param builder the pmf builder
     */
    public PoissonBinomialDistribution(ProbabilityVector probabilities, PmfBuilder builder) {
        this.probabilities = Objects.requireNonNull(probabilities, "probabilities cannot be null");
        this.table = Objects.requireNonNull(builder, "builder cannot be null").build(probabilities);
        this.moments = PoissonBinomialMoments.of(probabilities);
    }

    /**
     * Builds the distribution with default numerical settings.
     *
     * @param probabilities the success probability of each trial
     * @return the distribution
     */
    public static PoissonBinomialDistribution of(double... probabilities) {
        return new PoissonBinomialDistribution(probabilities);
    }

    /**
     * Builds the distribution with default numerical settings.
     *
     * @param probabilities the success probability of each trial, in iteration order
     * @return the distribution
     */
    public static PoissonBinomialDistribution of(Collection<? extends Number> probabilities) {
        return new PoissonBinomialDistribution(ProbabilityVector.of(probabilities), new PmfBuilder());
    }

    // ==================== Probability queries ====================

    /**
     * @param k number of successes
     * @return {@code P(X = k)}
     * @throws IndexOutOfRangeException if k is outside [0, n]
     */
    public double pmf(int k) {
        return lookup(table::mass, k);
    }

    /**
     * @param ks numbers of successes
     * @return {@code P(X = k)} for each k, in order
     * @throws IndexOutOfRangeException if any k is outside [0, n]
     */
    public double[] pmf(int[] ks) {
        return lookup(table::mass, ks);
    }

    /**
     * @param k number of successes; must be integral
     * @return {@code P(X = k)}
     * @throws IndexOutOfRangeException if k is not an integer in [0, n]
     */
    public double pmf(Number k) {
        return lookup(table::mass, toIndex(k));
    }

    /**
     * @param ks numbers of successes; each must be integral
     * @return {@code P(X = k)} for each k, in order
     * @throws IndexOutOfRangeException if any k is not an integer in [0, n]
     */
    public List<Double> pmf(List<? extends Number> ks) {
        return boxed(lookup(table::mass, toIndices(ks)));
    }

    /**
     * @param k number of successes
     * @return {@code P(X <= k)}
     * @throws IndexOutOfRangeException if k is outside [0, n]
     */
    public double cdf(int k) {
        return lookup(table::cumulative, k);
    }

    /**
     * @param ks numbers of successes
     * @return {@code P(X <= k)} for each k, in order
     * @throws IndexOutOfRangeException if any k is outside [0, n]
     */
    public double[] cdf(int[] ks) {
        return lookup(table::cumulative, ks);
    }

    /**
     * @param k number of successes; must be integral
     * @return {@code P(X <= k)}
     * @throws IndexOutOfRangeException if k is not an integer in [0, n]
     */
    public double cdf(Number k) {
        return lookup(table::cumulative, toIndex(k));
    }

    /**
     * @param ks numbers of successes; each must be integral
     * @return {@code P(X <= k)} for each k, in order
     * @throws IndexOutOfRangeException if any k is not an integer in [0, n]
     */
    public List<Double> cdf(List<? extends Number> ks) {
        return boxed(lookup(table::cumulative, toIndices(ks)));
    }

    /**
     * Returns the right-tailed p-value {@code P(X >= k) = 1 - cdf(k - 1)}.
     *
     * <p>The tail is summed directly from the mass table rather than taken as a
     * complement, so small p-values keep their relative precision.
     *
     * @param k observed number of successes
     * @return {@code P(X >= k)}; exactly 1 for k = 0
     * @throws IndexOutOfRangeException if k is outside [0, n]
     */
    public double pval(int k) {
        return lookup(table::survival, k);
    }

    /**
     * @param ks observed numbers of successes
     * @return {@code P(X >= k)} for each k, in order
     * @throws IndexOutOfRangeException if any k is outside [0, n]
     */
    public double[] pval(int[] ks) {
        return lookup(table::survival, ks);
    }

    /**
     * @param k observed number of successes; must be integral
     * @return {@code P(X >= k)}
     * @throws IndexOutOfRangeException if k is not an integer in [0, n]
     */
    public double pval(Number k) {
        return lookup(table::survival, toIndex(k));
    }

    /**
     * @param ks observed numbers of successes; each must be integral
     * @return {@code P(X >= k)} for each k, in order
     * @throws IndexOutOfRangeException if any k is not an integer in [0, n]
     */
    public List<Double> pval(List<? extends Number> ks) {
        return boxed(lookup(table::survival, toIndices(ks)));
    }

    // ==================== Mode ====================

    /**
     * @return the largest probability mass
     */
    public double amax() {
        return table.modeMass();
    }

    /**
     * @return the smallest number of successes carrying the largest mass
     */
    public int argmax() {
        return table.modeIndex();
    }

    // ==================== Moments ====================

    /**
     * @return {@code Σ p_i}
     */
    public double mean() {
        return moments.mean();
    }

    /**
     * @return {@code Σ p_i(1 - p_i)}
     */
    public double variance() {
        return moments.variance();
    }

    /**
     * @return the square root of the variance
     */
    public double stdDev() {
        return moments.stdDev();
    }

    /**
     * @return {@code Σ p_i(1 - p_i)(1 - 2p_i) / variance^1.5}
     * @throws DegenerateDistributionException if every probability is 0 or 1
     */
    public double skewness() {
        return moments.skewness();
    }

    // ==================== Accessors ====================

    /**
     * @return the number of trials n
     */
    public int getTrials() {
        return probabilities.size();
    }

    /**
     * @return the validated success probabilities
     */
    public ProbabilityVector getProbabilities() {
        return probabilities;
    }

    /**
     * @return a copy of {@code P(X = k)} for k = 0..n
     */
    public double[] pmfValues() {
        return table.massValues();
    }

    /**
     * @return a copy of {@code P(X <= k)} for k = 0..n
     */
    public double[] cdfValues() {
        return table.cumulativeValues();
    }

    /**
     * @return a copy of {@code P(X >= k)} for k = 0..n
     */
    public double[] survivalValues() {
        return table.survivalValues();
    }

    /**
     * Returns a JSON-serializable snapshot of this distribution.
     *
     * @return the summary; skewness is null for a point mass
     */
    public PoissonBinomialSummary summary() {
        Double skew = moments.isDegenerate() ? null : moments.skewness();
        return new PoissonBinomialSummary(getTrials(), mean(), variance(), stdDev(),
            skew, argmax(), amax(), table.massValues());
    }

    @Override
    public String toString() {
        return String.format("PoissonBinomialDistribution[n=%d, mean=%.6g, variance=%.6g, mode=%d]",
            getTrials(), mean(), variance(), argmax());
    }

    // ==================== Input handling ====================

    private double lookup(IntToDoubleFunction values, int k) {
        return lookup(values, new int[]{k})[0];
    }

    private double[] lookup(IntToDoubleFunction values, int[] ks) {
        Objects.requireNonNull(ks, "values cannot be null");
        int n = getTrials();
        for (int k : ks) {
            if (k < 0 || k > n) {
                throw new IndexOutOfRangeException(k, n);
            }
        }
        double[] out = new double[ks.length];
        for (int i = 0; i < ks.length; i++) {
            out[i] = values.applyAsDouble(ks[i]);
        }
        return out;
    }

    private int[] toIndices(List<? extends Number> ks) {
        Objects.requireNonNull(ks, "values cannot be null");
        int[] out = new int[ks.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = toIndex(ks.get(i));
        }
        return out;
    }

    private int toIndex(Number k) {
        Objects.requireNonNull(k, "value cannot be null");
        int n = getTrials();
        if (k instanceof Integer || k instanceof Short || k instanceof Byte) {
            return k.intValue();
        }
        if (k instanceof Long) {
            long v = k.longValue();
            if (v < 0 || v > n) {
                throw new IndexOutOfRangeException(k, n);
            }
            return (int) v;
        }
        if (k instanceof BigInteger) {
            return toIndex((BigInteger) k, k);
        }
        if (k instanceof BigDecimal) {
            BigInteger exact;
            try {
                exact = ((BigDecimal) k).toBigIntegerExact();
            } catch (ArithmeticException e) {
                throw new IndexOutOfRangeException(k, n);
            }
            return toIndex(exact, k);
        }
        double v = k.doubleValue();
        if (!Double.isFinite(v) || v != Math.rint(v) || v < 0 || v > n) {
            throw new IndexOutOfRangeException(k, n);
        }
        return (int) v;
    }

    private int toIndex(BigInteger v, Number original) {
        int n = getTrials();
        if (v.signum() < 0 || v.compareTo(BigInteger.valueOf(n)) > 0) {
            throw new IndexOutOfRangeException(original, n);
        }
        return v.intValue();
    }

    private static List<Double> boxed(double[] values) {
        List<Double> out = new ArrayList<>(values.length);
        for (double v : values) {
            out.add(v);
        }
        return Collections.unmodifiableList(out);
    }
}
