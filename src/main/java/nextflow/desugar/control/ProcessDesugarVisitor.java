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
import nextflow.desugar.diagnostics.DiagnosticSink;
import org.codehaus.groovy.ast.ClassCodeVisitorSupport;
import org.codehaus.groovy.ast.ModuleNode;
import org.codehaus.groovy.ast.expr.MethodCallExpression;
import org.codehaus.groovy.control.SourceUnit;

import static nextflow.desugar.ast.ASTHelpers.isThisCall;

/**
 * Find the process definitions of a script and rewrite them
 * into their canonical form.
 *
 * Definitions are rewritten in place, one at a time, in the
 * order they are visited. Definitions nested in closures are
 * rewritten as well.
 */
public class ProcessDesugarVisitor extends ClassCodeVisitorSupport {

    private SourceUnit sourceUnit;

    private DesugarConfiguration configuration;

    private DefinitionNormalizer normalizer;

    public ProcessDesugarVisitor(SourceUnit sourceUnit, DesugarConfiguration configuration, DiagnosticSink sink) {
        this.sourceUnit = sourceUnit;
        this.configuration = configuration;
        this.normalizer = new DefinitionNormalizer(sink);
    }

    @Override
    protected SourceUnit getSourceUnit() {
        return sourceUnit;
    }

    /**
     * Visit the top-level statements and the methods of a script
     * without creating the script class.
     *
     * @param module
     */
    public void visit(ModuleNode module) {
        module.getStatementBlock().visit(this);
        for( var method : module.getMethods() ) {
            if( method.getCode() != null )
                method.getCode().visit(this);
        }
    }

    @Override
    public void visitMethodCallExpression(MethodCallExpression call) {
        if( isThisCall(call, configuration.definitionKeywords()) )
            normalizer.normalize(call);
        super.visitMethodCallExpression(call);
    }

}
