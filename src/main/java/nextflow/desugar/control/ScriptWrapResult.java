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
package nextflow.desugar.control;

import java.util.List;

import nextflow.desugar.diagnostics.DiagnosticMessage;
import org.codehaus.groovy.ast.stmt.Statement;

/**
 * The process body after the script has been wrapped.
 *
 * @param statements the new body statements
 * @param scriptMode whether the body ends with a script closure
 * @param diagnostic the error to report, or null
 */
public record ScriptWrapResult(
    List<Statement> statements,
    boolean scriptMode,
    DiagnosticMessage diagnostic
) {

    public boolean hasDiagnostic() {
        return diagnostic != null;
    }

}
