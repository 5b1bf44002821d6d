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

import io.nosqlbench.poibin.model.ProbabilityVector;
import org.apache.commons.math3.complex.Complex;

import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ForkJoinPool;
import java.util.stream.IntStream;

/// Samples the characteristic function of a Poisson binomial sum on the `n + 1`
/// roots of unity.
///
/// # Definition
///
/// ```text
///   ω    = 2π / (n + 1)
///   φ(k) = Π_i (1 - p_i + p_i·e^(iωk)),      k = 0..n
/// ```
///
/// # Stabilized Accumulation
///
/// Multiplying `n` complex factors directly underflows or loses precision when
/// the factor moduli spread over many orders of magnitude. Each factor is split
/// into modulus and argument instead, and only the sums are carried:
///
/// ```text
///   z_i        = (1 - p_i + p_i·cos ωk) + i·(p_i·sin ωk)
///   logMod(k)  = Σ_i ln|z_i|
///   arg(k)     = Σ_i atan2(Im z_i, Re z_i)
///   φ(k)       = e^logMod(k) · (cos arg(k) + i·sin arg(k))
/// ```
///
/// Every factor has modulus at most one, so `logMod(k) <= 0`. A factor of
/// modulus zero (`p_i = 0.5` at `ωk = π`) drives `logMod(k)` to `-∞` and
/// `φ(k)` to exactly zero.
///
/// # Symmetry
///
/// `φ(0) = 1` and `φ(n + 1 - k) = conj(φ(k))`, so only `k = 1..ceil(n/2)` is
/// evaluated. Frequencies are independent of each other and can be evaluated
/// on a [ForkJoinPool]; each one writes its own slot, so serial and parallel
/// evaluation produce identical arrays.
public final class CharacteristicFunction {

    private CharacteristicFunction() {
        // Utility class
    }

    /// Evaluates `φ(k)` for `k = 0..n` on the calling thread.
    ///
    /// @param probabilities the success probabilities
    /// @return `n + 1` samples
    public static Complex[] sample(ProbabilityVector probabilities) {
        Objects.requireNonNull(probabilities, "probabilities cannot be null");
        double[] p = probabilities.toArray();
        int n = p.length;
        int half = halfSpan(n);
        Complex[] chi = new Complex[n + 1];
        for (int k = 1; k <= half; k++) {
            chi[k] = atFrequency(p, k);
        }
        return mirror(chi, n, half);
    }

    /// Evaluates `φ(k)` for `k = 0..n`, spreading frequencies over a pool.
    ///
    /// @param probabilities the success probabilities
    /// @param pool the pool to run on
    /// @return `n + 1` samples, identical to [#sample(ProbabilityVector)]
    public static Complex[] sample(ProbabilityVector probabilities, ForkJoinPool pool) {
        Objects.requireNonNull(probabilities, "probabilities cannot be null");
        Objects.requireNonNull(pool, "pool cannot be null");
        double[] p = probabilities.toArray();
        int n = p.length;
        int half = halfSpan(n);
        Complex[] chi = new Complex[n + 1];
        try {
            pool.submit(() -> IntStream.rangeClosed(1, half)
                .parallel()
                .forEach(k -> chi[k] = atFrequency(p, k))
            ).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while sampling characteristic function", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Characteristic function sampling failed", e.getCause());
        }
        return mirror(chi, n, half);
    }

    /// Evaluates one frequency by log-modulus and argument accumulation.
    ///
    /// @param p the success probabilities
    /// @param k the frequency index in `0..n`
    /// @return `φ(k)`
    static Complex atFrequency(double[] p, int k) {
        double omegaK = 2.0 * Math.PI * k / (p.length + 1);
        double cos = Math.cos(omegaK);
        double sin = Math.sin(omegaK);

        double logModulus = 0.0;
        double argument = 0.0;
        for (double pi : p) {
            double re = 1.0 - pi + pi * cos;
            double im = pi * sin;
            logModulus += Math.log(Math.hypot(re, im));
            argument += Math.atan2(im, re);
        }

        double modulus = Math.exp(logModulus);
        return new Complex(modulus * Math.cos(argument), modulus * Math.sin(argument));
    }

    private static int halfSpan(int n) {
        return n / 2 + n % 2;
    }

    private static Complex[] mirror(Complex[] chi, int n, int half) {
        chi[0] = Complex.ONE;
        for (int k = half + 1; k <= n; k++) {
            chi[k] = chi[n + 1 - k].conjugate();
        }
        return chi;
    }
}
