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

/// # Poisson Binomial Distribution
///
/// Exact distribution of the number of successes among independent Bernoulli
/// trials that each have their own success probability.
///
/// ```text
///   p_1..p_n  ──► ProbabilityVector ──► PmfBuilder ──► PmfTable ──► pmf / cdf / pval
///                       │                                     └──► amax / argmax
///                       └──► PoissonBinomialMoments ──► mean / variance / stdDev / skewness
/// ```
///
/// ## Packages
///
/// - `io.nosqlbench.poibin` – [io.nosqlbench.poibin.PoissonBinomialDistribution], the entry point
/// - `io.nosqlbench.poibin.model` – validated input and immutable result tables
/// - `io.nosqlbench.poibin.compute` – characteristic function, Fourier transform, moments
/// - `io.nosqlbench.poibin.config` – numerical tolerances and parallelism, JSON-loadable
/// - `io.nosqlbench.poibin.errors` – the exception hierarchy
///
/// ## Reference
///
/// Yili Hong, On computing the distribution function for the Poisson binomial
/// distribution, Computational Statistics & Data Analysis 59 (2013) 41-51.
package io.nosqlbench.poibin;
