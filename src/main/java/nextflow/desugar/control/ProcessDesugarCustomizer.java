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

import nextflow.desugar.config.DesugarConfiguration;
import nextflow.desugar.diagnostics.SourceUnitDiagnosticSink;
import org.codehaus.groovy.ast.ClassNode;
import org.codehaus.groovy.classgen.GeneratorContext;
import org.codehaus.groovy.control.CompilationFailedException;
import org.codehaus.groovy.control.CompilePhase;
import org.codehaus.groovy.control.SourceUnit;
import org.codehaus.groovy.control.customizers.CompilationCustomizer;

/**
 * Compilation customizer that desugars process definitions,
 * for scripts compiled with a {@code CompilerConfiguration}:
 *
 * <pre>
 *     var config = new CompilerConfiguration();
 *     config.addCompilationCustomizers(new ProcessDesugarCustomizer());
 * </pre>
 */
public class ProcessDesugarCustomizer extends CompilationCustomizer {

    private final DesugarConfiguration configuration;

    public ProcessDesugarCustomizer() {
        this(DesugarConfiguration.defaults());
    }

    public ProcessDesugarCustomizer(DesugarConfiguration configuration) {
        super(CompilePhase.CONVERSION);
        this.configuration = configuration;
    }

    @Override
    public void call(SourceUnit source, GeneratorContext context, ClassNode classNode) throws CompilationFailedException {
        var sink = new SourceUnitDiagnosticSink(source);
        new ProcessDesugarVisitor(source, configuration, sink).visitClass(classNode);
    }

}
