/*
 * Copyright 2024, Seqera Labs
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package nextflow.desugar.config;

import java.util.List;

import nextflow.desugar.util.JsonUtils;
import nextflow.desugar.util.Logger;

/**
 * Settings of the desugaring pass.
 *
 * @param definitionKeywords the method names that introduce a process definition
 * @param debug whether to log each rewrite
 */
public record DesugarConfiguration(
    List<String> definitionKeywords,
    boolean debug
) {

    public static DesugarConfiguration defaults() {
        return new DesugarConfiguration(
            List.of("process"),
            false
        );
    }

    /**
     * Read the configuration from JSON settings, e.g.:
     *
     * <pre>
     * { "nextflow": { "debug": true, "desugar": { "definitions": ["process"] } } }
     * </pre>
     *
     * Missing or mistyped settings keep the value of the
     * given configuration. The debug setting also switches
     * debug logging.
     *
     * @param settings
     * @param configuration
     */
    public static DesugarConfiguration fromSettings(Object settings, DesugarConfiguration configuration) {
        var debug = JsonUtils.getBoolean(settings, "nextflow.debug");
        if( debug != null )
            Logger.setDebugEnabled(debug);

        var keywords = JsonUtils.getStringArray(settings, "nextflow.desugar.definitions");
        return new DesugarConfiguration(
            keywords != null && !keywords.isEmpty() ? List.copyOf(keywords) : configuration.definitionKeywords(),
            withDefault(JsonUtils.getBoolean(settings, "nextflow.debug"), configuration.debug())
        );
    }

    private static <T> T withDefault(T value, T defaultValue) {
        return value != null ? value : defaultValue;
    }

}
