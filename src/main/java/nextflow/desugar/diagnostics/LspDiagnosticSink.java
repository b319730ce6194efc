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

import nextflow.desugar.util.Logger;
import nextflow.desugar.util.Positions;
import org.eclipse.lsp4j.Diagnostic;
import org.eclipse.lsp4j.DiagnosticSeverity;

/**
 * Collect diagnostics in the form published to a language
 * client.
 */
public class LspDiagnosticSink implements DiagnosticSink {

    private static Logger log = Logger.getInstance();

    private final String uri;

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    public LspDiagnosticSink(String uri) {
        this.uri = uri;
    }

    @Override
    public void report(DiagnosticMessage diagnostic) {
        var message = diagnostic.message();
        var range = Positions.groovyToLspRange(diagnostic.line(), diagnostic.column(), diagnostic.endLine(), diagnostic.endColumn());
        if( range == null ) {
            log.error(uri + ": invalid range for error: " + message);
            return;
        }
        diagnostics.add(new Diagnostic(range, message, DiagnosticSeverity.Error, "nextflow"));
    }

    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

}
