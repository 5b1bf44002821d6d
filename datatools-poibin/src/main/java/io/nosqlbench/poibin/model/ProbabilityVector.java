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

import io.nosqlbench.poibin.errors.EmptyInputException;
import io.nosqlbench.poibin.errors.InvalidProbabilityException;

import java.util.Arrays;
import java.util.Collection;
import java.util.Objects;

/**
 * Validated, immutable success probabilities of {@code n} independent Bernoulli trials.
 *
 * <p>Every entry lies in {@code [0, 1]} and there is at least one entry. The backing
 * array is copied on the way in and on the way out.
 *
 * <pre>{@code
 * ProbabilityVector p = ProbabilityVector.of(0.1, 0.5, 0.9);
 * p.size();   // 3
 * p.get(1);   // 0.5
 * }</pre>
 */
public final class ProbabilityVector {

    private final double[] probabilities;

    private ProbabilityVector(double[] probabilities) {
        this.probabilities = probabilities;
    }

    /**
     * Validates and wraps the given probabilities.
     *
     * @param probabilities success probabilities, one per trial
     * @return the validated vector
     * @throws EmptyInputException if no probabilities are given
     * @throws InvalidProbabilityException if an entry is NaN or outside [0, 1]
     */
    public static ProbabilityVector of(double... probabilities) {
        Objects.requireNonNull(probabilities, "probabilities cannot be null");
        double[] copy = probabilities.clone();
        validate(copy);
        return new ProbabilityVector(copy);
    }

    /**
     * Validates and wraps the given probabilities, in iteration order.
     *
     * @param probabilities success probabilities, one per trial
     * @return the validated vector
     * @throws EmptyInputException if the collection is empty
     * @throws InvalidProbabilityException if an entry is NaN or outside [0, 1]
     * @throws NullPointerException if the collection or one of its entries is null
     */
    public static ProbabilityVector of(Collection<? extends Number> probabilities) {
        Objects.requireNonNull(probabilities, "probabilities cannot be null");
        double[] values = new double[probabilities.size()];
        int i = 0;
        for (Number p : probabilities) {
            Objects.requireNonNull(p, "probability at index " + i + " cannot be null");
            values[i++] = p.doubleValue();
        }
        validate(values);
        return new ProbabilityVector(values);
    }

    private static void validate(double[] values) {
        if (values.length == 0) {
            throw new EmptyInputException();
        }
        for (int i = 0; i < values.length; i++) {
            double p = values[i];
            // NaN fails both comparisons
            if (!(p >= 0.0 && p <= 1.0)) {
                throw new InvalidProbabilityException(i, p);
            }
        }
    }

    /**
     * Returns the number of trials.
     * @return n
     */
    public int size() {
        return probabilities.length;
    }

    /**
     * Returns the success probability of one trial.
     *
     * @param index the trial index in [0, n)
     * @return the success probability
     */
    public double get(int index) {
        return probabilities[index];
    }

    /**
     * Returns a copy of the probabilities.
     * @return a new array
     */
    public double[] toArray() {
        return probabilities.clone();
    }

    /**
     * Returns whether every probability is exactly 0 or 1, which makes the
     * sum a point mass.
     *
     * @return true if the vector is degenerate
     */
    public boolean isDegenerate() {
        for (double p : probabilities) {
            if (p != 0.0 && p != 1.0) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ProbabilityVector)) return false;
        return Arrays.equals(probabilities, ((ProbabilityVector) o).probabilities);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(probabilities);
    }

    @Override
    public String toString() {
        if (probabilities.length <= 8) {
            return "ProbabilityVector" + Arrays.toString(probabilities);
        }
        return String.format("ProbabilityVector[n=%d, %s, %s, ..., %s]",
            probabilities.length, probabilities[0], probabilities[1],
            probabilities[probabilities.length - 1]);
    }
}
