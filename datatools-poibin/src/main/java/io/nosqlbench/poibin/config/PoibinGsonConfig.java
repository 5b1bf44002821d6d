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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

/// Centralized Gson configuration for poibin JSON documents.
///
/// ## Purpose
///
/// Provides one configured [Gson] instance for:
///
/// - [PoissonBinomialConfig] files (tolerances and parallelism)
/// - [io.nosqlbench.poibin.model.PoissonBinomialSummary] reports
///
/// ## Configuration
///
/// | Feature | Setting | Purpose |
/// |---------|---------|---------|
/// | Pretty printing | Enabled | Human-readable files |
/// | HTML escaping | Disabled | Cleaner numeric output |
/// | Special floats | Enabled | NaN and Infinity survive a round trip |
///
/// ## Thread Safety
///
/// The [Gson] instance is thread-safe and shared.
public final class PoibinGsonConfig {

    private static final Gson INSTANCE = builder().create();

    private PoibinGsonConfig() {
        // Utility class
    }

    /// Returns the shared pretty-printing Gson instance.
    ///
    /// @return the shared Gson instance
    public static Gson gson() {
        return INSTANCE;
    }

    /// Creates a new GsonBuilder with poibin defaults.
    ///
    /// @return a new GsonBuilder
    public static GsonBuilder builder() {
        return new GsonBuilder()
            .setPrettyPrinting()
            .disableHtmlEscaping()
            .serializeSpecialFloatingPointValues();
    }
}
