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

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import groovy.lang.GroovyClassLoader;
import nextflow.desugar.config.DesugarConfiguration;
import nextflow.desugar.control.ProcessDesugarVisitor;
import nextflow.desugar.diagnostics.CompositeDiagnosticSink;
import nextflow.desugar.diagnostics.DiagnosticCollector;
import nextflow.desugar.diagnostics.SourceUnitDiagnosticSink;
import nextflow.desugar.util.Logger;
import org.codehaus.groovy.control.CompilationFailedException;
import org.codehaus.groovy.control.CompilerConfiguration;
import org.codehaus.groovy.control.SourceUnit;
import org.codehaus.groovy.control.io.StringReaderSource;

/**
 * Parse a script far enough to build the AST, then desugar
 * its process definitions.
 *
 * Syntax errors and invalid process definitions are returned
 * as diagnostics. A {@code GroovyBugError} raised while
 * desugaring is propagated to the caller.
 */
public class DslCompiler {

    private static Logger log = Logger.getInstance();

    private CompilerConfiguration configuration;

    private GroovyClassLoader classLoader;

    private DesugarConfiguration desugarConfiguration;

    public DslCompiler(DesugarConfiguration desugarConfiguration) {
        this(new CompilerConfiguration(), new GroovyClassLoader(), desugarConfiguration);
    }

    public DslCompiler(CompilerConfiguration configuration, GroovyClassLoader classLoader, DesugarConfiguration desugarConfiguration) {
        this.configuration = configuration;
        this.classLoader = classLoader;
        this.desugarConfiguration = desugarConfiguration;
    }

    public DesugarResult compile(Path path) throws IOException {
        return compile(path.toString(), Files.readString(path));
    }

    /**
     * Compile a script.
     *
     * @param name
     * @param contents
     */
    public DesugarResult compile(String name, String contents) {
        var errorCollector = new DesugarErrorCollector(configuration);
        var sourceUnit = new SourceUnit(
                name,
                new StringReaderSource(contents, configuration),
                configuration,
                classLoader,
                errorCollector);

        if( !parse(sourceUnit) )
            return new DesugarResult(sourceUnit, null, errorCollector.getDiagnostics());

        var module = sourceUnit.getAST();
        var diagnostics = new DiagnosticCollector();
        var sink = new CompositeDiagnosticSink(diagnostics, new SourceUnitDiagnosticSink(sourceUnit));
        new ProcessDesugarVisitor(sourceUnit, desugarConfiguration, sink).visit(module);
        return new DesugarResult(sourceUnit, module, diagnostics.getDiagnostics());
    }

    /**
     * Build the AST of a source file, deferring any syntax
     * errors to the error collector.
     *
     * @param sourceUnit
     */
    protected boolean parse(SourceUnit sourceUnit) {
        try {
            sourceUnit.parse();
            sourceUnit.buildAST();
        }
        catch( CompilationFailedException e ) {
            log.error("Failed to parse " + sourceUnit.getName() + ": " + e.getMessage());
            return false;
        }
        return !sourceUnit.getErrorCollector().hasErrors();
    }

}
