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
package nextflow.desugar.diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Keep reported diagnostics in order of arrival.
 */
public class DiagnosticCollector implements DiagnosticSink {

    private final List<DiagnosticMessage> diagnostics = new ArrayList<>();

    @Override
    public void report(DiagnosticMessage diagnostic) {
        diagnostics.add(diagnostic);
    }

    public List<DiagnosticMessage> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    public boolean hasErrors() {
        return !diagnostics.isEmpty();
    }

}
