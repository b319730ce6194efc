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
import org.codehaus.groovy.ast.ASTNode;
import org.codehaus.groovy.ast.ClassNode;
import org.codehaus.groovy.ast.ModuleNode;
import org.codehaus.groovy.control.CompilePhase;
import org.codehaus.groovy.control.SourceUnit;
import org.codehaus.groovy.transform.ASTTransformation;
import org.codehaus.groovy.transform.GroovyASTTransformation;

/**
 * Apply the process desugaring to the classes given by the
 * Groovy compiler. Errors are added to the source unit.
 *
 * When triggered by {@link ProcessDesugar} the nodes are the
 * annotation and the annotated class.
 */
@GroovyASTTransformation(phase = CompilePhase.CONVERSION)
public class ProcessDesugarTransform implements ASTTransformation {

    private final DesugarConfiguration configuration;

    public ProcessDesugarTransform() {
        this(DesugarConfiguration.defaults());
    }

    public ProcessDesugarTransform(DesugarConfiguration configuration) {
        this.configuration = configuration;
    }

    @Override
    public void visit(ASTNode[] astNodes, SourceUnit unit) {
        var visitor = new ProcessDesugarVisitor(unit, configuration, new SourceUnitDiagnosticSink(unit));
        for( var node : astNodes ) {
            if( node instanceof ClassNode cn ) {
                visitor.visitClass(cn);
            }
            else if( node instanceof ModuleNode mn ) {
                for( var classNode : mn.getClasses() )
                    visitor.visitClass(classNode);
            }
        }
    }

}
