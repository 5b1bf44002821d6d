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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class PoissonBinomialConfigTest {

    @Test
    void defaultsAreValid() {
        PoissonBinomialConfig config = PoissonBinomialConfig.defaults();

        assertEquals(1e-10, config.getNegativeClipTolerance());
        assertEquals(1e-8, config.getNormalizationTolerance());
        assertEquals(1e-9, config.getImaginaryTolerance());
        assertEquals(1e-9, config.getTailAgreementTolerance());
        assertEquals(2048, config.getParallelThreshold());
        assertEquals(Runtime.getRuntime().availableProcessors(), config.getParallelism());
        assertSame(config, config.validate());
    }

    @Test
    void jsonRoundTrip() {
        PoissonBinomialConfig config = PoissonBinomialConfig.defaults()
            .setNegativeClipTolerance(1e-12)
            .setParallelThreshold(64)
            .setParallelism(3);

        String json = config.toJson();

        assertThat(json).contains("\"negative_clip_tolerance\"", "\"parallel_threshold\": 64");
        assertEquals(config, PoissonBinomialConfig.fromJson(json));
    }

    @Test
    void missingFieldsKeepDefaults() {
        PoissonBinomialConfig config = PoissonBinomialConfig.fromJson("{\"imaginary_tolerance\": 1e-6}");

        assertEquals(1e-6, config.getImaginaryTolerance());
        assertEquals(PoissonBinomialConfig.DEFAULT_NEGATIVE_CLIP_TOLERANCE, config.getNegativeClipTolerance());
        assertEquals(PoissonBinomialConfig.DEFAULT_PARALLEL_THRESHOLD, config.getParallelThreshold());
    }

    @Test
    void emptyDocumentGivesDefaults() {
        assertEquals(PoissonBinomialConfig.defaults(), PoissonBinomialConfig.fromJson(""));
    }

    @Test
    void malformedJsonIsRejected() {
        assertThatThrownBy(() -> PoissonBinomialConfig.fromJson("{\"parallelism\": "))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Malformed");
    }

    @Test
    void invalidSettingsAreRejected() {
        assertThatThrownBy(() -> PoissonBinomialConfig.fromJson("{\"normalization_tolerance\": 0}"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("normalization_tolerance");
        assertThrows(IllegalArgumentException.class,
            () -> PoissonBinomialConfig.defaults().setTailAgreementTolerance(Double.NaN).validate());
        assertThrows(IllegalArgumentException.class,
            () -> PoissonBinomialConfig.defaults().setNegativeClipTolerance(Double.POSITIVE_INFINITY).validate());
        assertThrows(IllegalArgumentException.class,
            () -> PoissonBinomialConfig.defaults().setParallelism(0).validate());
        assertThrows(IllegalArgumentException.class,
            () -> PoissonBinomialConfig.defaults().setParallelThreshold(0).validate());
    }

    @Test
    void parallelOnlyAboveThresholdWithSeveralThreads() {
        PoissonBinomialConfig config = PoissonBinomialConfig.defaults()
            .setParallelThreshold(100)
            .setParallelism(2);

        assertFalse(config.isParallelFor(99));
        assertTrue(config.isParallelFor(100));
        assertFalse(config.setParallelism(1).isParallelFor(10_000));
    }

    @Test
    void saveAndLoad(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("poibin.json");
        PoissonBinomialConfig config = PoissonBinomialConfig.defaults()
            .setTailAgreementTolerance(5e-10)
            .setParallelism(2);

        config.save(file);

        assertTrue(Files.exists(file));
        assertEquals(config, PoissonBinomialConfig.load(file));
    }
}
