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
package nextflow.desugar.ast;

import java.util.Collections;
import java.util.List;

import org.codehaus.groovy.ast.ASTNode;
import org.codehaus.groovy.ast.Parameter;
import org.codehaus.groovy.ast.VariableScope;
import org.codehaus.groovy.ast.expr.ClosureExpression;
import org.codehaus.groovy.ast.expr.ConstantExpression;
import org.codehaus.groovy.ast.expr.Expression;
import org.codehaus.groovy.ast.expr.MethodCallExpression;
import org.codehaus.groovy.ast.expr.TupleExpression;
import org.codehaus.groovy.ast.expr.VariableExpression;
import org.codehaus.groovy.ast.stmt.Statement;

/**
 * Utility methods for querying and building the
 * process AST.
 */
public class ASTHelpers {

    public static List<Expression> asMethodCallArguments(MethodCallExpression call) {
        return call.getArguments() instanceof TupleExpression te
            ? te.getExpressions()
            : Collections.emptyList();
    }

    /**
     * Get the label written closest to a statement, or null
     * if the statement is not labeled. The parser adds labels
     * from the innermost outwards.
     *
     * @param statement
     */
    public static String explicitLabel(Statement statement) {
        var labels = statement.getStatementLabels();
        if( labels == null || labels.isEmpty() )
            return null;
        return labels.get(0);
    }

    /**
     * Determine whether a method call is a call to one of the
     * given names on the (implicit or explicit) script object,
     * e.g. {@code process foo { ... }}.
     *
     * @param call
     * @param names
     */
    public static boolean isThisCall(MethodCallExpression call, Iterable<String> names) {
        if( !(call.getMethod() instanceof ConstantExpression) )
            return false;
        if( !(call.getObjectExpression() instanceof VariableExpression ve) || !ve.isThisExpression() )
            return false;
        var name = call.getMethodAsString();
        for( var candidate : names ) {
            if( candidate.equals(name) )
                return true;
        }
        return false;
    }

    /**
     * Create a closure with no parameters, i.e. a body that is
     * evaluated only when the closure is called.
     *
     * @param code
     * @param variableScope
     * @param position
     */
    public static ClosureExpression thunkX(Statement code, VariableScope variableScope, ASTNode position) {
        var result = new ClosureExpression(Parameter.EMPTY_ARRAY, code);
        result.setVariableScope(variableScope);
        if( position != null )
            result.setSourcePosition(position);
        return result;
    }

    public static boolean hasPosition(ASTNode node) {
        return node != null && node.getLineNumber() > 0;
    }

}
