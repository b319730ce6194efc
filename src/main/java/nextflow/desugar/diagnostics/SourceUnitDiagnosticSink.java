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

import org.codehaus.groovy.control.SourceUnit;
import org.codehaus.groovy.control.messages.SyntaxErrorMessage;
import org.codehaus.groovy.syntax.SyntaxException;

/**
 * Add diagnostics to the error collector of a source unit
 * without failing the compilation.
 */
public class SourceUnitDiagnosticSink implements DiagnosticSink {

    private final SourceUnit sourceUnit;

    public SourceUnitDiagnosticSink(SourceUnit sourceUnit) {
        this.sourceUnit = sourceUnit;
    }

    @Override
    public void report(DiagnosticMessage diagnostic) {
        var cause = new DefinitionSyntaxError(diagnostic);
        var errorMessage = new SyntaxErrorMessage(cause, sourceUnit);
        sourceUnit.getErrorCollector().addErrorAndContinue(errorMessage);
    }

    public static class DefinitionSyntaxError extends SyntaxException {

        public DefinitionSyntaxError(DiagnosticMessage diagnostic) {
            super(diagnostic.message(), diagnostic.line(), diagnostic.column(), diagnostic.endLine(), diagnostic.endColumn());
        }
    }

}
