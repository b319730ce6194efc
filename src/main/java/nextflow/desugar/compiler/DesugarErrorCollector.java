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
package nextflow.desugar.compiler;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.List;

import nextflow.desugar.diagnostics.DiagnosticMessage;
import org.codehaus.groovy.control.CompilerConfiguration;
import org.codehaus.groovy.control.ErrorCollector;
import org.codehaus.groovy.control.messages.Message;
import org.codehaus.groovy.control.messages.SyntaxErrorMessage;

/**
 * Error collector that does not throw exceptions.
 */
public class DesugarErrorCollector extends ErrorCollector {

    private static final long serialVersionUID = 1L;

    public DesugarErrorCollector(CompilerConfiguration configuration) {
        super(configuration);
    }

    @Override
    protected void failIfErrors() {
    }

    /**
     * Get the collected errors as diagnostics. Errors without
     * a source position have line and column -1.
     */
    public List<DiagnosticMessage> getDiagnostics() {
        var result = new ArrayList<DiagnosticMessage>();
        if( errors == null )
            return result;
        for( var message : errors )
            result.add(toDiagnostic(message));
        return result;
    }

    private static DiagnosticMessage toDiagnostic(Message message) {
        if( message instanceof SyntaxErrorMessage sem ) {
            var cause = sem.getCause();
            return new DiagnosticMessage(cause.getOriginalMessage(), cause.getStartLine(), cause.getStartColumn(), cause.getEndLine(), cause.getEndColumn());
        }
        var writer = new StringWriter();
        message.write(new PrintWriter(writer));
        return new DiagnosticMessage(writer.toString().trim(), -1, -1);
    }

}
