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

import io.nosqlbench.poibin.errors.DegenerateDistributionException;
import io.nosqlbench.poibin.errors.EmptyInputException;
import io.nosqlbench.poibin.errors.IndexOutOfRangeException;
import io.nosqlbench.poibin.errors.InvalidProbabilityException;
import io.nosqlbench.poibin.model.PoissonBinomialSummary;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link PoissonBinomialDistribution}.
 *
 * <p>This test class verifies:
 * <ol>
 *   <li>Known closed forms: single trial, fair coins, point masses</li>
 *   <li>Scalar and sequence query shapes for pmf, cdf and pval</li>
 *   <li>Construction and query error reporting</li>
 *   <li>Moment accessors and the JSON summary</li>
 * </ol>
 */
@Tag("unit")
public class PoissonBinomialDistributionTest {

    private static final double TOLERANCE = 1e-12;

    // ==================== Closed Forms ====================

    @Test
    void singleTrial() {
        PoissonBinomialDistribution dist = PoissonBinomialDistribution.of(0.3);

        assertEquals(1, dist.getTrials());
        assertEquals(0.7, dist.pmf(0), TOLERANCE);
        assertEquals(0.3, dist.pmf(1), TOLERANCE);
        assertEquals(0, dist.argmax());
        assertEquals(0.7, dist.amax(), TOLERANCE);
    }

    @Test
    void fourFairCoinsMatchBinomial() {
        PoissonBinomialDistribution dist = PoissonBinomialDistribution.of(0.5, 0.5, 0.5, 0.5);

        double[] expected = {0.0625, 0.25, 0.375, 0.25, 0.0625};
        double[] actual = dist.pmfValues();
        assertEquals(expected.length, actual.length);
        for (int k = 0; k < expected.length; k++) {
            assertEquals(expected[k], actual[k], TOLERANCE, "pmf(" + k + ")");
        }
        assertEquals(2, dist.argmax());
        assertEquals(0.375, dist.amax(), TOLERANCE);
        assertEquals(0.0, dist.skewness(), TOLERANCE);
    }

    @ParameterizedTest(name = "n={0}")
    @ValueSource(ints = {3, 15, 31, 33, 37, 101})
    void tiedModesResolveToLowerIndex(int n) {
        double[] p = new double[n];
        Arrays.fill(p, 0.5);
        PoissonBinomialDistribution dist = PoissonBinomialDistribution.of(p);

        // odd n: pmf(n/2) == pmf(n/2 + 1) exactly, up to transform rounding
        assertEquals(n / 2, dist.argmax());
        assertEquals(dist.pmf(n / 2 + 1), dist.amax(), 1e-15);
        assertThat(dist.amax()).isGreaterThanOrEqualTo(dist.pmf(n / 2));
    }

    @Test
    void allOnesIsPointMassAtN() {
        PoissonBinomialDistribution dist = PoissonBinomialDistribution.of(1.0, 1.0, 1.0, 1.0, 1.0);

        double[] pmf = dist.pmfValues();
        for (int k = 0; k < 5; k++) {
            assertEquals(0.0, pmf[k], TOLERANCE, "pmf(" + k + ")");
        }
        assertEquals(1.0, pmf[5], TOLERANCE);
        assertEquals(5.0, dist.mean());
        assertEquals(0.0, dist.variance());
        assertEquals(5, dist.argmax());
        assertThrows(DegenerateDistributionException.class, dist::skewness);
    }

    @Test
    void allZerosIsPointMassAtZero() {
        PoissonBinomialDistribution dist = PoissonBinomialDistribution.of(0.0, 0.0, 0.0);

        assertEquals(1.0, dist.pmf(0), TOLERANCE);
        assertEquals(1.0, dist.cdf(0), TOLERANCE);
        assertEquals(0.0, dist.pval(1), TOLERANCE);
        assertEquals(0, dist.argmax());
        assertThrows(DegenerateDistributionException.class, dist::skewness);
    }

    @Test
    void mixedCertainOutcomesShiftTheSupport() {
        // two certain successes plus one fair coin: X is 2 or 3
        PoissonBinomialDistribution dist = PoissonBinomialDistribution.of(1.0, 0.5, 1.0, 0.0);

        assertThat(dist.pmfValues()).containsExactly(new double[]{0.0, 0.0, 0.5, 0.5, 0.0}, within(TOLERANCE));
        assertEquals(2.5, dist.mean(), TOLERANCE);
        assertEquals(0.25, dist.variance(), TOLERANCE);
        assertEquals(0.0, dist.skewness(), TOLERANCE);
    }

    // ==================== Cumulative and Tail ====================

    @Test
    void cdfAndPvalBoundaries() {
        PoissonBinomialDistribution dist = PoissonBinomialDistribution.of(0.2, 0.4, 0.6, 0.8, 0.1);

        assertEquals(1.0, dist.cdf(5));
        assertEquals(1.0, dist.pval(0));
        assertEquals(dist.pmf(0), dist.cdf(0), TOLERANCE);
        assertEquals(dist.pmf(5), dist.pval(5), TOLERANCE);
    }

    @Test
    void pvalIsComplementOfPreviousCdf() {
        PoissonBinomialDistribution dist = PoissonBinomialDistribution.of(
            0.05, 0.15, 0.25, 0.35, 0.45, 0.55, 0.65, 0.75, 0.85, 0.95, 0.5);

        for (int x = 1; x <= dist.getTrials(); x++) {
            assertEquals(1.0 - dist.cdf(x - 1), dist.pval(x), 1e-9, "pval(" + x + ")");
        }
    }

    @Test
    void cdfIsNonDecreasing() {
        PoissonBinomialDistribution dist = PoissonBinomialDistribution.of(
            0.01, 0.99, 0.3, 0.7, 0.5, 0.5, 0.2);

        double[] cdf = dist.cdfValues();
        for (int k = 1; k < cdf.length; k++) {
            assertTrue(cdf[k] >= cdf[k - 1], "cdf must not decrease at k=" + k);
        }
    }

    // ==================== Query Shapes ====================

    @Test
    void arrayQueriesPreserveOrder() {
        PoissonBinomialDistribution dist = PoissonBinomialDistribution.of(0.1, 0.5, 0.9);
        int[] ks = {3, 0, 2, 2};

        double[] pmf = dist.pmf(ks);
        double[] cdf = dist.cdf(ks);
        double[] pval = dist.pval(ks);

        for (int i = 0; i < ks.length; i++) {
            assertEquals(dist.pmf(ks[i]), pmf[i]);
            assertEquals(dist.cdf(ks[i]), cdf[i]);
            assertEquals(dist.pval(ks[i]), pval[i]);
        }
    }

    @Test
    void listQueriesReturnMatchingList() {
        PoissonBinomialDistribution dist = PoissonBinomialDistribution.of(Arrays.asList(0.1, 0.5, 0.9));

        List<Double> pmf = dist.pmf(List.of(0, 1L, 2.0));
        List<Double> pval = dist.pval(List.of(0, 3));

        assertThat(pmf).hasSize(3);
        assertEquals(dist.pmf(0), pmf.get(0).doubleValue());
        assertEquals(dist.pmf(1), pmf.get(1).doubleValue());
        assertEquals(dist.pmf(2), pmf.get(2).doubleValue());
        assertThat(pval).containsExactly(1.0, dist.pmf(3));
        assertThat(dist.cdf(List.<Integer>of())).isEmpty();
    }

    @Test
    void integralNumbersAreAccepted() {
        PoissonBinomialDistribution dist = PoissonBinomialDistribution.of(0.1, 0.5, 0.9);

        assertEquals(dist.pmf(2), dist.pmf(Integer.valueOf(2)));
        assertEquals(dist.pmf(2), dist.pmf(2L));
        assertEquals(dist.pmf(2), dist.pmf(2.0));
        assertEquals(dist.cdf(1), dist.cdf(BigInteger.ONE));
        assertEquals(dist.pval(3), dist.pval(new BigDecimal("3.000")));
    }

    // ==================== Errors ====================

    @Test
    void emptyInputIsRejected() {
        assertThrows(EmptyInputException.class, () -> PoissonBinomialDistribution.of());
        assertThrows(EmptyInputException.class, () -> PoissonBinomialDistribution.of(List.<Double>of()));
    }

    @Test
    void invalidProbabilityIdentifiesOffender() {
        InvalidProbabilityException high = assertThrows(InvalidProbabilityException.class,
            () -> PoissonBinomialDistribution.of(0.2, 1.5, 0.3));
        assertEquals(1, high.getIndex());
        assertEquals(1.5, high.getValue());

        InvalidProbabilityException negative = assertThrows(InvalidProbabilityException.class,
            () -> PoissonBinomialDistribution.of(0.2, 0.3, -0.01));
        assertEquals(2, negative.getIndex());

        assertThrows(InvalidProbabilityException.class, () -> PoissonBinomialDistribution.of(Double.NaN));
    }

    @Test
    void outOfRangeQueriesAreRejected() {
        PoissonBinomialDistribution dist = PoissonBinomialDistribution.of(0.1, 0.5, 0.9);

        assertThrows(IndexOutOfRangeException.class, () -> dist.pmf(-1));
        assertThrows(IndexOutOfRangeException.class, () -> dist.pmf(4));
        assertThrows(IndexOutOfRangeException.class, () -> dist.cdf(4));
        assertThrows(IndexOutOfRangeException.class, () -> dist.pval(-1));
        assertThrows(IndexOutOfRangeException.class, () -> dist.pmf(new int[]{0, 1, 7}));
        assertThrows(IndexOutOfRangeException.class, () -> dist.pmf(Long.MAX_VALUE));
        assertThrows(IndexOutOfRangeException.class, () -> dist.pmf(BigInteger.TEN));

        // the distribution stays usable after a rejected query
        assertEquals(1.0, dist.pval(0));
    }

    @Test
    void nonIntegralQueriesAreRejected() {
        PoissonBinomialDistribution dist = PoissonBinomialDistribution.of(0.1, 0.5, 0.9);

        assertThatThrownBy(() -> dist.pmf(1.5))
            .isInstanceOf(IndexOutOfRangeException.class)
            .hasMessageContaining("1.5");
        assertThrows(IndexOutOfRangeException.class, () -> dist.cdf(Double.NaN));
        assertThrows(IndexOutOfRangeException.class, () -> dist.pval(Double.POSITIVE_INFINITY));
        assertThrows(IndexOutOfRangeException.class, () -> dist.pval(new BigDecimal("0.5")));
        assertThrows(IndexOutOfRangeException.class, () -> dist.pmf(List.of(1, 2.25)));

        IndexOutOfRangeException e = assertThrows(IndexOutOfRangeException.class, () -> dist.cdf(2.5f));
        assertEquals(3, e.getTrials());
        assertEquals(2.5f, e.getValue());
    }

    // ==================== Moments and Summary ====================

    @Test
    void momentsFollowClosedForm() {
        double[] p = {0.1, 0.2, 0.7, 0.9};
        PoissonBinomialDistribution dist = PoissonBinomialDistribution.of(p);

        double mean = 0.1 + 0.2 + 0.7 + 0.9;
        double variance = 0.1 * 0.9 + 0.2 * 0.8 + 0.7 * 0.3 + 0.9 * 0.1;
        double third = 0.1 * 0.9 * 0.8 + 0.2 * 0.8 * 0.6 + 0.7 * 0.3 * -0.4 + 0.9 * 0.1 * -0.8;

        assertEquals(mean, dist.mean(), TOLERANCE);
        assertEquals(variance, dist.variance(), TOLERANCE);
        assertEquals(Math.sqrt(variance), dist.stdDev(), TOLERANCE);
        assertEquals(third / Math.pow(variance, 1.5), dist.skewness(), TOLERANCE);
    }

    @Test
    void inputArrayIsCopied() {
        double[] p = {0.2, 0.4};
        PoissonBinomialDistribution dist = PoissonBinomialDistribution.of(p);
        p[0] = 1.0;

        assertEquals(0.6, dist.mean(), TOLERANCE);
        double[] pmf = dist.pmfValues();
        pmf[0] = 42.0;
        assertEquals(0.8 * 0.6, dist.pmf(0), TOLERANCE);
    }

    @Test
    void summaryRoundTripsThroughJson() {
        PoissonBinomialDistribution dist = PoissonBinomialDistribution.of(0.5, 0.5, 0.5, 0.5);

        PoissonBinomialSummary summary = dist.summary();
        PoissonBinomialSummary restored = PoissonBinomialSummary.fromJson(summary.toJson());

        assertThat(summary.toJson()).contains("\"std_dev\"", "\"mode_mass\"");
        assertEquals(4, restored.getTrials());
        assertEquals(2.0, restored.getMean(), TOLERANCE);
        assertEquals(1.0, restored.getVariance(), TOLERANCE);
        assertEquals(2, restored.getMode());
        assertArrayEquals(dist.pmfValues(), restored.getPmf());
    }

    @Test
    void summaryOfPointMassHasNoSkewness() {
        PoissonBinomialSummary summary = PoissonBinomialDistribution.of(1.0, 0.0).summary();

        assertNull(summary.getSkewness());
        assertEquals(1, summary.getMode());
        assertEquals(1.0, summary.getModeMass(), TOLERANCE);
    }
}
