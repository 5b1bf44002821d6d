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

import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.transform.DftNormalization;
import org.apache.commons.math3.transform.FastFourierTransformer;
import org.apache.commons.math3.transform.TransformType;
import org.apache.commons.math3.util.ArithmeticUtils;

import java.util.Objects;

/// [FourierTransform] backed by the commons-math3 radix-2 FFT.
///
/// # Arbitrary Lengths
///
/// [FastFourierTransformer] only accepts power-of-two lengths, while a distribution
/// over `n` trials needs a transform of length `n + 1`. Other lengths go through
/// Bluestein's chirp-z identity, which turns a length-`N` DFT into a circular
/// convolution of power-of-two length `M >= 2N - 1`:
///
/// ```text
///   jk = (j² + k² - (k-j)²) / 2
///
///   w[j]  = e^(-πi·j²/N)                      chirp
///   a[j]  = x[j]·w[j]            j < N,  0 otherwise
///   b[j]  = conj(w[j])           j < N
///   b[M-j] = conj(w[j])          0 < j < N,  0 elsewhere
///
///   X[k]  = w[k] · (a ⊛ b)[k]                 ⊛ = circular convolution via FFT
/// ```
///
/// `j²` is reduced modulo `2N` before the chirp angle is formed, so the angle stays
/// in `[0, 2π)` and keeps full precision for large `N`.
///
/// The inverse transform is `conj(forward(conj(x)))`.
public final class CommonsMathFourierTransform implements FourierTransform {

    private final FastFourierTransformer fft = new FastFourierTransformer(DftNormalization.STANDARD);

    @Override
    public Complex[] forward(Complex[] input) {
        Objects.requireNonNull(input, "input cannot be null");
        if (input.length == 0) {
            throw new IllegalArgumentException("input cannot be empty");
        }
        if (ArithmeticUtils.isPowerOfTwo(input.length)) {
            return fft.transform(input.clone(), TransformType.FORWARD);
        }
        return bluestein(input);
    }

    @Override
    public Complex[] inverse(Complex[] input) {
        Objects.requireNonNull(input, "input cannot be null");
        return conjugateAll(forward(conjugateAll(input)));
    }

    @Override
    public String name() {
        return "commons-math3 radix-2/bluestein";
    }

    private Complex[] bluestein(Complex[] x) {
        int n = x.length;
        int m = Integer.highestOneBit(2 * n - 1);
        if (m < 2 * n - 1) {
            m <<= 1;
        }

        Complex[] chirp = new Complex[n];
        long period = 2L * n;
        for (int j = 0; j < n; j++) {
            long r = ((long) j * j) % period;
            double angle = -Math.PI * r / n;
            chirp[j] = new Complex(Math.cos(angle), Math.sin(angle));
        }

        Complex[] a = new Complex[m];
        Complex[] b = new Complex[m];
        for (int j = 0; j < m; j++) {
            a[j] = Complex.ZERO;
            b[j] = Complex.ZERO;
        }
        for (int j = 0; j < n; j++) {
            a[j] = x[j].multiply(chirp[j]);
        }
        b[0] = chirp[0].conjugate();
        for (int j = 1; j < n; j++) {
            Complex c = chirp[j].conjugate();
            b[j] = c;
            b[m - j] = c;
        }

        Complex[] fa = fft.transform(a, TransformType.FORWARD);
        Complex[] fb = fft.transform(b, TransformType.FORWARD);
        for (int j = 0; j < m; j++) {
            fa[j] = fa[j].multiply(fb[j]);
        }
        // STANDARD normalization scales the inverse by 1/m
        Complex[] conv = fft.transform(fa, TransformType.INVERSE);

        Complex[] out = new Complex[n];
        for (int k = 0; k < n; k++) {
            out[k] = conv[k].multiply(chirp[k]);
        }
        return out;
    }

    private static Complex[] conjugateAll(Complex[] values) {
        Complex[] out = new Complex[values.length];
        for (int i = 0; i < values.length; i++) {
            out[i] = values[i].conjugate();
        }
        return out;
    }
}
