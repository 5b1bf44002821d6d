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

/// Discrete Fourier transform over complex sequences of any positive length.
///
/// Both directions are unnormalized:
///
/// ```text
///   forward:  X[k] = Σ_j x[j] · e^(-2πi·jk/N)
///   inverse:  x[j] = Σ_k X[k] · e^(+2πi·jk/N)
/// ```
///
/// so `inverse(forward(x)) = N · x`. Callers apply the `1/N` scaling.
///
/// @see CommonsMathFourierTransform
public interface FourierTransform {

    /// @param input the sequence to transform; not modified
    /// @return a new array of the same length
    Complex[] forward(Complex[] input);

    /// @param input the sequence to transform; not modified
    /// @return a new array of the same length
    Complex[] inverse(Complex[] input);

    /// @return a short name for log messages
    default String name() {
        return getClass().getSimpleName();
    }
}
