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

import nextflow.desugar.ast.Section;
import nextflow.desugar.util.Logger;
import org.codehaus.groovy.ast.expr.ArgumentListExpression;
import org.codehaus.groovy.ast.expr.ConstantExpression;
import org.codehaus.groovy.ast.expr.Expression;
import org.codehaus.groovy.ast.expr.MethodCallExpression;
import org.codehaus.groovy.ast.expr.TupleExpression;
import org.codehaus.groovy.ast.expr.VariableExpression;

import static nextflow.desugar.ast.ASTHelpers.asMethodCallArguments;

/**
 * Rewrite the declarations of the input, output and share
 * sections into their canonical method calls.
 *
 * For example, in the input section:
 *
 * <pre>
 *   val x
 *   file 'data.txt'
 * </pre>
 *
 * becomes:
 *
 * <pre>
 *   _in_val(true, 'x')
 *   _in_file(false, 'data.txt')
 * </pre>
 *
 * A variable name is replaced by its name as a string so that
 * a declaration can name a variable that does not exist yet.
 */
public class DeclarationRewriter {

    private static Logger log = Logger.getInstance();

    /**
     * Rewrite a declaration statement expression. Every call
     * in a chain such as {@code file x into y} is rewritten.
     * The given expression is not modified, and is returned
     * as is when no call in the chain is a declaration.
     *
     * @param section
     * @param expression
     */
    public static Expression rewrite(Section section, Expression expression) {
        if( !(expression instanceof MethodCallExpression call) )
            return expression;

        var name = call.getMethodAsString();
        var policy = DeclarationPolicies.lookup(section, name);
        var receiver = rewrite(section, call.getObjectExpression());
        if( policy == null && receiver == call.getObjectExpression() )
            return call;

        var method = call.getMethod();
        var arguments = call.getArguments();
        if( policy != null ) {
            log.debug("desugar > " + section.getLabel() + " declaration: " + name);
            if( policy.canonicalName() != null ) {
                method = new ConstantExpression(policy.canonicalName());
                method.setSourcePosition(call.getMethod());
            }
            arguments = encodeArguments(call, policy);
        }

        var result = new MethodCallExpression(receiver, method, arguments);
        result.setImplicitThis(call.isImplicitThis());
        result.setSafe(call.isSafe());
        result.setSpreadSafe(call.isSpreadSafe());
        result.setGenericsTypes(call.getGenericsTypes());
        result.setSourcePosition(call);
        result.copyNodeMetaData(call);
        return result;
    }

    private static Expression encodeArguments(MethodCallExpression call, DeclarationPolicy policy) {
        var encoded = encode(asMethodCallArguments(call), policy);
        var original = call.getArguments();
        var result = original instanceof ArgumentListExpression || !(original instanceof TupleExpression)
            ? new ArgumentListExpression(encoded)
            : new TupleExpression(encoded);
        result.setSourcePosition(original);
        return result;
    }

    /**
     * Replace a variable argument with a constant holding the
     * variable name, optionally preceded by a flag telling whether
     * the replacement took place.
     *
     * @param arguments
     * @param policy
     */
    public static List<Expression> encode(List<Expression> arguments, DeclarationPolicy policy) {
        var result = new ArrayList<Expression>(arguments.size() + 1);
        for( int i = 0; i < arguments.size(); i++ ) {
            var arg = arguments.get(i);
            if( i != policy.index() ) {
                result.add(arg);
                continue;
            }
            var isVariable = arg instanceof VariableExpression;
            if( policy.flagVariable() )
                result.add(new ConstantExpression(isVariable, true));
            result.add(isVariable ? nameX((VariableExpression) arg) : arg);
        }
        return result;
    }

    private static Expression nameX(VariableExpression variable) {
        var result = new ConstantExpression(variable.getName());
        result.setSourcePosition(variable);
        return result;
    }

}
