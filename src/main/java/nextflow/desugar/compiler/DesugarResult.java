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

import java.util.List;

import nextflow.desugar.diagnostics.DiagnosticMessage;
import org.codehaus.groovy.ast.ModuleNode;
import org.codehaus.groovy.control.SourceUnit;

/**
 * The outcome of desugaring a script.
 *
 * @param sourceUnit the compiled source
 * @param module the desugared AST, or null if the script could not be parsed
 * @param diagnostics the parse and definition errors, in order
 */
public record DesugarResult(
    SourceUnit sourceUnit,
    ModuleNode module,
    List<DiagnosticMessage> diagnostics
) {

    public boolean isParsed() {
        return module != null;
    }

    public boolean hasErrors() {
        return !diagnostics.isEmpty();
    }

}
