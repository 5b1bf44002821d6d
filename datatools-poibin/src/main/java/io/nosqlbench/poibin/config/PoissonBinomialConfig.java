package io.nosqlbench.poibin.config;

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

import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * JSON-serializable numerical settings for building a Poisson binomial distribution.
 *
 * <h2>Purpose</h2>
 *
 * <p>The transform-based construction leaves floating-point residue in its output.
 * These settings decide which residue is silently corrected and which is treated
 * as a failed construction, and when the characteristic function is sampled on
 * several threads.
 *
 * <h2>JSON Schema</h2>
 *
 * <pre>{@code
 * {
 *   "negative_clip_tolerance": 1.0E-10,
 *   "normalization_tolerance": 1.0E-8,
 *   "imaginary_tolerance": 1.0E-9,
 *   "tail_agreement_tolerance": 1.0E-9,
 *   "parallel_threshold": 2048,
 *   "parallelism": 8
 * }
 * }</pre>
 *
 * <p>Every field is optional in a file; missing fields keep their defaults.
 *
 * @see PoibinGsonConfig
 */
public class PoissonBinomialConfig {

    /** Raw pmf entries in [-tolerance, 0) are clipped to zero; anything lower is unstable. */
    public static final double DEFAULT_NEGATIVE_CLIP_TOLERANCE = 1e-10;

    /** The clipped pmf must sum to one within this tolerance before renormalization. */
    public static final double DEFAULT_NORMALIZATION_TOLERANCE = 1e-8;

    /** Largest imaginary part accepted in the transformed output. */
    public static final double DEFAULT_IMAGINARY_TOLERANCE = 1e-9;

    /** Allowed gap between the survival sum and the complement of the cdf. */
    public static final double DEFAULT_TAIL_AGREEMENT_TOLERANCE = 1e-9;

    /** Trial count at which characteristic function sampling goes parallel. */
    public static final int DEFAULT_PARALLEL_THRESHOLD = 2048;

    @SerializedName("negative_clip_tolerance")
    private double negativeClipTolerance = DEFAULT_NEGATIVE_CLIP_TOLERANCE;

    @SerializedName("normalization_tolerance")
    private double normalizationTolerance = DEFAULT_NORMALIZATION_TOLERANCE;

    @SerializedName("imaginary_tolerance")
    private double imaginaryTolerance = DEFAULT_IMAGINARY_TOLERANCE;

    @SerializedName("tail_agreement_tolerance")
    private double tailAgreementTolerance = DEFAULT_TAIL_AGREEMENT_TOLERANCE;

    @SerializedName("parallel_threshold")
    private int parallelThreshold = DEFAULT_PARALLEL_THRESHOLD;

    @SerializedName("parallelism")
    private int parallelism = Runtime.getRuntime().availableProcessors();

    public PoissonBinomialConfig() {
    }

    /**
     * Returns a new config holding the default settings.
     */
    public static PoissonBinomialConfig defaults() {
        return new PoissonBinomialConfig();
    }

    public double getNegativeClipTolerance() {
        return negativeClipTolerance;
    }

    public PoissonBinomialConfig setNegativeClipTolerance(double negativeClipTolerance) {
        this.negativeClipTolerance = negativeClipTolerance;
        return this;
    }

    public double getNormalizationTolerance() {
        return normalizationTolerance;
    }

    public PoissonBinomialConfig setNormalizationTolerance(double normalizationTolerance) {
        this.normalizationTolerance = normalizationTolerance;
        return this;
    }

    public double getImaginaryTolerance() {
        return imaginaryTolerance;
    }

    public PoissonBinomialConfig setImaginaryTolerance(double imaginaryTolerance) {
        this.imaginaryTolerance = imaginaryTolerance;
        return this;
    }

    public double getTailAgreementTolerance() {
        return tailAgreementTolerance;
    }

    public PoissonBinomialConfig setTailAgreementTolerance(double tailAgreementTolerance) {
        this.tailAgreementTolerance = tailAgreementTolerance;
        return this;
    }

    public int getParallelThreshold() {
        return parallelThreshold;
    }

    public PoissonBinomialConfig setParallelThreshold(int parallelThreshold) {
        this.parallelThreshold = parallelThreshold;
        return this;
    }

    public int getParallelism() {
        return parallelism;
    }

    public PoissonBinomialConfig setParallelism(int parallelism) {
        this.parallelism = parallelism;
        return this;
    }

    /**
     * Returns whether a distribution over the given number of trials should sample
     * its characteristic function on several threads.
     *
     * @param trials the number of Bernoulli trials
     * @return true if parallel sampling applies
     */
    public boolean isParallelFor(int trials) {
        return parallelism > 1 && trials >= parallelThreshold;
    }

    /**
     * Checks that every setting is usable.
     *
     * @return this config
     * @throws IllegalArgumentException if a tolerance is not positive and finite,
     *         or parallelism or the parallel threshold is below one
     */
    public PoissonBinomialConfig validate() {
        requirePositive("negative_clip_tolerance", negativeClipTolerance);
        requirePositive("normalization_tolerance", normalizationTolerance);
        requirePositive("imaginary_tolerance", imaginaryTolerance);
        requirePositive("tail_agreement_tolerance", tailAgreementTolerance);
        if (parallelThreshold < 1) {
            throw new IllegalArgumentException("parallel_threshold must be at least 1, got: " + parallelThreshold);
        }
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be at least 1, got: " + parallelism);
        }
        return this;
    }

    private static void requirePositive(String name, double value) {
        if (!(value > 0) || Double.isInfinite(value)) {
            throw new IllegalArgumentException(name + " must be positive and finite, got: " + value);
        }
    }

    /**
     * Serializes this config to JSON.
     *
     * @return the JSON string
     */
    public String toJson() {
        return PoibinGsonConfig.gson().toJson(this);
    }

    /**
     * Writes this config as JSON.
     *
     * @param writer the destination
     */
    public void toJson(Writer writer) {
        PoibinGsonConfig.gson().toJson(this, writer);
    }

    /**
     * Parses and validates a config from JSON.
     *
     * @param json the JSON string
     * @return the parsed config
     * @throws IllegalArgumentException if the JSON is malformed or a setting is invalid
     */
    public static PoissonBinomialConfig fromJson(String json) {
        Objects.requireNonNull(json, "json cannot be null");
        return parsed(json, null);
    }

    /**
     * Parses and validates a config from a reader.
     *
     * @param reader the JSON source
     * @return the parsed config
     * @throws IllegalArgumentException if the JSON is malformed or a setting is invalid
     */
    public static PoissonBinomialConfig fromJson(Reader reader) {
        Objects.requireNonNull(reader, "reader cannot be null");
        return parsed(null, reader);
    }

    private static PoissonBinomialConfig parsed(String json, Reader reader) {
        PoissonBinomialConfig config;
        try {
            config = json != null
                ? PoibinGsonConfig.gson().fromJson(json, PoissonBinomialConfig.class)
                : PoibinGsonConfig.gson().fromJson(reader, PoissonBinomialConfig.class);
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("Malformed poibin config: " + e.getMessage(), e);
        }
        if (config == null) {
            return defaults();
        }
        return config.validate();
    }

    /**
     * Loads a config from a JSON file.
     *
     * @param path the file to read
     * @return the loaded config
     * @throws IOException if the file cannot be read
     */
    public static PoissonBinomialConfig load(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path)) {
            return fromJson(reader);
        }
    }

    /**
     * Saves this config to a JSON file.
     *
     * @param path the file to write
     * @throws IOException if the file cannot be written
     */
    public void save(Path path) throws IOException {
        try (Writer writer = Files.newBufferedWriter(path)) {
            toJson(writer);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PoissonBinomialConfig)) return false;
        PoissonBinomialConfig that = (PoissonBinomialConfig) o;
        return Double.compare(negativeClipTolerance, that.negativeClipTolerance) == 0
            && Double.compare(normalizationTolerance, that.normalizationTolerance) == 0
            && Double.compare(imaginaryTolerance, that.imaginaryTolerance) == 0
            && Double.compare(tailAgreementTolerance, that.tailAgreementTolerance) == 0
            && parallelThreshold == that.parallelThreshold
            && parallelism == that.parallelism;
    }

    @Override
    public int hashCode() {
        return Objects.hash(negativeClipTolerance, normalizationTolerance, imaginaryTolerance,
            tailAgreementTolerance, parallelThreshold, parallelism);
    }

    @Override
    public String toString() {
        return "PoissonBinomialConfig[clip=" + negativeClipTolerance
            + ", normalization=" + normalizationTolerance
            + ", imaginary=" + imaginaryTolerance
            + ", tail=" + tailAgreementTolerance
            + ", parallelThreshold=" + parallelThreshold
            + ", parallelism=" + parallelism + "]";
    }
}
