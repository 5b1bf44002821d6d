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

import io.nosqlbench.poibin.config.PoissonBinomialConfig;
import io.nosqlbench.poibin.errors.NumericalInstabilityException;
import io.nosqlbench.poibin.model.PmfTable;
import io.nosqlbench.poibin.model.ProbabilityVector;
import org.apache.commons.math3.complex.Complex;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;
import java.util.concurrent.ForkJoinPool;

/**
 * Builds the probability mass function of a Poisson binomial sum by inverting its
 * characteristic function (Hong 2013).
 *
 * <h2>Pipeline</h2>
 *
 * <pre>{@code
 * ┌───────────────────────────────────────────────────────────────────┐
 * │ 1. Sample φ(k), k = 0..n        CharacteristicFunction (serial or  │
 * │                                 ForkJoinPool above the threshold)  │
 * └───────────────────────────────────────────────────────────────────┘
 *          ↓
 * ┌───────────────────────────────────────────────────────────────────┐
 * │ 2. pmf[j] = (1/(n+1)) Σ_k φ(k)·e^(-2πi·jk/(n+1))   FourierTransform │
 * └───────────────────────────────────────────────────────────────────┘
 *          ↓
 * ┌───────────────────────────────────────────────────────────────────┐
 * │ 3. Verify: finite, imaginary residue within tolerance              │
 * │ 4. Clip negative noise in [-tol, 0) to zero, reject anything lower │
 * │ 5. Verify the sum is near one, then divide by it                   │
 * │ 6. Tabulate cdf and survival, verify their tails agree             │
 * └───────────────────────────────────────────────────────────────────┘
 * }</pre>
 *
 * <p>Any failed check raises {@link NumericalInstabilityException}; a corrupted
 * table is never returned.
 *
 * <p>Instances are stateless apart from their settings and may be shared.
 *
 * @see CharacteristicFunction
 * @see PoissonBinomialConfig
 */
public final class PmfBuilder {

    private static final Logger logger = LogManager.getLogger(PmfBuilder.class);

    private final PoissonBinomialConfig config;
    private final FourierTransform transform;

    /**
     * Creates a builder with default settings and the commons-math3 transform.
     */
    public PmfBuilder() {
        this(PoissonBinomialConfig.defaults(), new CommonsMathFourierTransform());
    }

    /**
     * Creates a builder with the given settings and transform.
     *
     * @param config numerical settings; validated here
     * @param transform the DFT implementation
     */
    public PmfBuilder(PoissonBinomialConfig config, FourierTransform transform) {
        this.config = Objects.requireNonNull(config, "config cannot be null").validate();
        this.transform = Objects.requireNonNull(transform, "transform cannot be null");
    }

    public PoissonBinomialConfig getConfig() {
        return config;
    }

    /**
     * Computes the mass table for the given probabilities.
     *
     * @param probabilities validated success probabilities
     * @return the verified tables over {@code 0..n}
     * @throws NumericalInstabilityException if the transformed output fails a check
     */
    public PmfTable build(ProbabilityVector probabilities) {
        Objects.requireNonNull(probabilities, "probabilities cannot be null");
        int n = probabilities.size();
        long startTime = System.nanoTime();
        boolean parallel = config.isParallelFor(n);

        Complex[] chi = parallel ? sampleParallel(probabilities) : CharacteristicFunction.sample(probabilities);
        double scale = 1.0 / (n + 1);
        for (int k = 0; k <= n; k++) {
            chi[k] = chi[k].multiply(scale);
        }

        Complex[] xi = transform.forward(chi);
        double[] mass = realParts(xi, n);
        clipNegativeNoise(mass, n);
        normalize(mass, n);

        PmfTable table = PmfTable.of(mass);
        double tailGap = table.maxTailDisagreement();
        if (tailGap > config.getTailAgreementTolerance()) {
            throw unstable(n, String.format("survival sum and 1 - cdf disagree by %.3e", tailGap));
        }

        if (logger.isDebugEnabled()) {
            logger.debug("Built pmf for {} trials via {} ({}) in {} ms",
                n, transform.name(), parallel ? "parallel x" + config.getParallelism() : "serial",
                String.format("%.3f", (System.nanoTime() - startTime) / 1e6));
        }
        return table;
    }

    private Complex[] sampleParallel(ProbabilityVector probabilities) {
        ForkJoinPool pool = new ForkJoinPool(config.getParallelism());
        try {
            return CharacteristicFunction.sample(probabilities, pool);
        } finally {
            pool.shutdown();
        }
    }

    private double[] realParts(Complex[] xi, int n) {
        double[] mass = new double[xi.length];
        double worstImaginary = 0.0;
        for (int j = 0; j < xi.length; j++) {
            double re = xi[j].getReal();
            double im = xi[j].getImaginary();
            if (!Double.isFinite(re) || !Double.isFinite(im)) {
                throw unstable(n, "non-finite value at k=" + j);
            }
            worstImaginary = Math.max(worstImaginary, Math.abs(im));
            mass[j] = re;
        }
        if (worstImaginary > config.getImaginaryTolerance()) {
            throw unstable(n, String.format("pmf values have to be real, imaginary residue %.3e", worstImaginary));
        }
        return mass;
    }

    private void clipNegativeNoise(double[] mass, int n) {
        double tolerance = config.getNegativeClipTolerance();
        int clipped = 0;
        for (int k = 0; k < mass.length; k++) {
            if (mass[k] < 0.0) {
                if (mass[k] < -tolerance) {
                    throw unstable(n, String.format("negative mass %.3e at k=%d", mass[k], k));
                }
                mass[k] = 0.0;
                clipped++;
            }
        }
        if (clipped > 0) {
            logger.trace("Clipped {} negative rounding residues to zero for {} trials", clipped, n);
        }
    }

    private void normalize(double[] mass, int n) {
        double sum = 0.0;
        double c = 0.0;
        for (double m : mass) {
            double y = m - c;
            double t = sum + y;
            c = (t - sum) - y;
            sum = t;
        }
        if (Math.abs(sum - 1.0) > config.getNormalizationTolerance()) {
            throw unstable(n, String.format("total mass %.12f is not 1", sum));
        }
        for (int k = 0; k < mass.length; k++) {
            mass[k] /= sum;
        }
    }

    private static NumericalInstabilityException unstable(int n, String reason) {
        logger.warn("Rejecting pmf for {} trials: {}", n, reason);
        return new NumericalInstabilityException(n, reason);
    }
}
