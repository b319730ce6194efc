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

import nextflow.desugar.diagnostics.DiagnosticMessage;
import nextflow.desugar.util.Logger;
import org.codehaus.groovy.ast.VariableScope;
import org.codehaus.groovy.ast.expr.ClosureExpression;
import org.codehaus.groovy.ast.expr.ConstantExpression;
import org.codehaus.groovy.ast.expr.Expression;
import org.codehaus.groovy.ast.expr.GStringExpression;
import org.codehaus.groovy.ast.expr.MethodCallExpression;
import org.codehaus.groovy.ast.stmt.BlockStatement;
import org.codehaus.groovy.ast.stmt.ExpressionStatement;
import org.codehaus.groovy.ast.stmt.ReturnStatement;
import org.codehaus.groovy.ast.stmt.Statement;

import static nextflow.desugar.ast.ASTHelpers.hasPosition;
import static nextflow.desugar.ast.ASTHelpers.thunkX;

/**
 * Wrap the script of a process body in a closure, so that
 * it is evaluated when the task runs instead of when the
 * process is defined.
 *
 * <pre>
 *     process foo {
 *         input:
 *         val x
 *
 *         "echo $x"
 *     }
 * </pre>
 *
 * becomes:
 *
 * <pre>
 *     process foo {
 *         input:
 *         val x
 *
 *         { -> "echo $x" }
 *     }
 * </pre>
 */
public class ScriptWrapper {

    private static Logger log = Logger.getInstance();

    public static String terminationMessage(String keyword) {
        return String.format("%s must terminate with a quoted script expression or explicit exec/script section", keyword);
    }

    /**
     * Wrap the script of a process body.
     *
     * @param definition the process definition call, used for error positions
     * @param retained the body statements outside the exec/script sections
     * @param scriptStatements the statements of the exec/script sections
     * @param scope the variable scope of the body
     */
    public static ScriptWrapResult wrap(MethodCallExpression definition, List<Statement> retained, List<Statement> scriptStatements, VariableScope scope) {
        var statements = new ArrayList<Statement>(retained);

        if( !scriptStatements.isEmpty() ) {
            var first = scriptStatements.get(0);
            var closureScope = new VariableScope(scope);
            var code = new BlockStatement(new ArrayList<>(scriptStatements), closureScope);
            code.setSourcePosition(first);
            statements.add(stmtAt(thunkX(code, closureScope, first), first));
            log.debug("desugar > wrapped " + scriptStatements.size() + " script statement(s)");
            return new ScriptWrapResult(statements, true, null);
        }

        var keyword = definition.getMethodAsString();
        if( statements.isEmpty() ) {
            log.debug("desugar > empty " + keyword + " body");
            return new ScriptWrapResult(statements, false, DiagnosticMessage.at(terminationMessage(keyword), definition));
        }

        // the script label can be omitted when the body ends with a string
        var last = statements.get(statements.size() - 1);
        var expr = expressionOf(last);

        if( expr instanceof GStringExpression || expr instanceof ConstantExpression ) {
            var closure = thunkX(new ExpressionStatement(expr), new VariableScope(scope), last);
            statements.set(statements.size() - 1, stmtAt(closure, last));
            return new ScriptWrapResult(statements, true, null);
        }

        if( expr instanceof ClosureExpression )
            return new ScriptWrapResult(statements, true, null);

        log.debug("desugar > invalid " + keyword + " script: " + last.getText());
        var position = hasPosition(last) ? last : definition;
        return new ScriptWrapResult(statements, false, DiagnosticMessage.at(terminationMessage(keyword), position));
    }

    private static Statement stmtAt(Expression expression, Statement position) {
        var result = new ExpressionStatement(expression);
        result.setSourcePosition(position);
        return result;
    }

    private static Expression expressionOf(Statement statement) {
        if( statement instanceof ExpressionStatement es )
            return es.getExpression();
        if( statement instanceof ReturnStatement rs )
            return rs.getExpression();
        return null;
    }

}
