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

import java.util.ArrayList;
import java.util.List;

import nextflow.desugar.diagnostics.DiagnosticSink;
import nextflow.desugar.util.Logger;
import org.codehaus.groovy.GroovyBugError;
import org.codehaus.groovy.ast.expr.ArgumentListExpression;
import org.codehaus.groovy.ast.expr.ClosureExpression;
import org.codehaus.groovy.ast.expr.ConstantExpression;
import org.codehaus.groovy.ast.expr.Expression;
import org.codehaus.groovy.ast.expr.MapExpression;
import org.codehaus.groovy.ast.expr.MethodCallExpression;
import org.codehaus.groovy.ast.expr.TupleExpression;
import org.codehaus.groovy.ast.stmt.BlockStatement;
import org.codehaus.groovy.ast.stmt.ExpressionStatement;

import static nextflow.desugar.ast.ASTHelpers.asMethodCallArguments;

/**
 * Transform a process definition as written by the user:
 *
 * <pre>
 *     process foo ( named: args, .. ) { code .. }
 * </pre>
 *
 * into the call expected by the runtime:
 *
 * <pre>
 *     process ( [named: args, ..], 'foo', .., scriptMode ) { code .. }
 * </pre>
 *
 * The process body is rewritten along the way (see
 * {@link DeclarationRewriter} and {@link ScriptWrapper}).
 */
public class DefinitionNormalizer {

    private static Logger log = Logger.getInstance();

    private final DiagnosticSink sink;

    public DefinitionNormalizer(DiagnosticSink sink) {
        this.sink = sink;
    }

    public void normalize(MethodCallExpression definition) {
        var keyword = definition.getMethodAsString();
        var nested = nestedDefinition(definition);
        var name = nested.getMethodAsString();
        log.debug("desugar > " + keyword + " " + name);

        var nameX = new ConstantExpression(name);
        nameX.setSourcePosition(nested.getMethod());
        var arguments = insertName(asMethodCallArguments(nested), nameX);

        var lastArg = arguments.isEmpty() ? null : arguments.get(arguments.size() - 1);
        if( lastArg instanceof ClosureExpression closure && closure.getCode() instanceof BlockStatement block ) {
            var scriptMode = normalizeBody(definition, block);
            arguments.add(arguments.size() - 1, new ConstantExpression(scriptMode, true));
        }
        else {
            log.debug("desugar > " + keyword + " " + name + " has no body");
        }

        var result = new ArgumentListExpression(arguments);
        result.setSourcePosition(nested.getArguments());
        definition.setArguments(result);
    }

    /**
     * Rewrite the declarations of a process body and wrap its
     * script, returning whether the body ends with a script.
     *
     * @param definition
     * @param block
     */
    protected boolean normalizeBody(MethodCallExpression definition, BlockStatement block) {
        var classified = SectionClassifier.classify(block.getStatements());

        for( var entry : classified.retained() ) {
            if( entry.statement() instanceof ExpressionStatement stmt )
                stmt.setExpression(DeclarationRewriter.rewrite(entry.section(), stmt.getExpression()));
        }

        var result = ScriptWrapper.wrap(
            definition,
            classified.retainedStatements(),
            classified.scriptStatements(),
            block.getVariableScope());

        var statements = block.getStatements();
        statements.clear();
        statements.addAll(result.statements());

        if( result.hasDiagnostic() )
            sink.report(result.diagnostic());
        return result.scriptMode();
    }

    /**
     * Get the call that holds the process name, i.e. {@code foo(..)}
     * in {@code process foo(..) { .. }}.
     *
     * @param definition
     */
    protected static MethodCallExpression nestedDefinition(MethodCallExpression definition) {
        if( !(definition.getArguments() instanceof TupleExpression tuple) )
            throw malformed(definition, "arguments are not a tuple");
        var expressions = tuple.getExpressions();
        if( expressions.size() != 1 )
            throw malformed(definition, "expected 1 argument but found " + expressions.size());
        if( !(expressions.get(0) instanceof MethodCallExpression nested) )
            throw malformed(definition, "argument is not a method call: " + expressions.get(0).getClass().getSimpleName());
        if( nested.getMethodAsString() == null )
            throw malformed(definition, "name is not a constant");
        return nested;
    }

    private static GroovyBugError malformed(MethodCallExpression definition, String reason) {
        var message = String.format(
            "Unexpected `%s` definition at line %d, column %d -- %s",
            definition.getMethodAsString(),
            definition.getLineNumber(),
            definition.getColumnNumber(),
            reason);
        return new GroovyBugError(message);
    }

    /**
     * Add the process name to the definition arguments, after the
     * named arguments if there are any.
     *
     * @param arguments
     * @param name
     */
    public static List<Expression> insertName(List<Expression> arguments, Expression name) {
        var result = new ArrayList<Expression>(arguments);
        if( !result.isEmpty() && result.get(0) instanceof MapExpression )
            result.add(1, name);
        else
            result.add(0, name);
        return result;
    }

}
