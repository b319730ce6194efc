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

import nextflow.desugar.diagnostics.DiagnosticCollector;
import org.codehaus.groovy.GroovyBugError;
import org.codehaus.groovy.ast.expr.ClosureExpression;
import org.codehaus.groovy.ast.expr.ConstantExpression;
import org.codehaus.groovy.ast.expr.GStringExpression;
import org.codehaus.groovy.ast.expr.MapExpression;
import org.codehaus.groovy.ast.expr.MethodCallExpression;
import org.codehaus.groovy.ast.stmt.ExpressionStatement;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static nextflow.desugar.control.AstFixtures.*;
import static org.codehaus.groovy.ast.tools.GeneralUtils.*;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DefinitionNormalizerTest {

    private DiagnosticCollector diagnostics;

    private DefinitionNormalizer normalizer;

    @BeforeEach
    void setUp() {
        diagnostics = new DiagnosticCollector();
        normalizer = new DefinitionNormalizer(diagnostics);
    }

    @Test
    @DisplayName("the name goes after the named arguments")
    void insertNameAfterMap() {
        var map = mapX(List.of(entryX(constX("cpus"), constX(2))));
        var a = varX("a");
        var b = varX("b");
        var name = constX("foo");

        var result = DefinitionNormalizer.insertName(List.of(map, a, b), name);

        assertEquals(List.of(map, name, a, b), result);
    }

    @Test
    @DisplayName("the name goes first without named arguments")
    void insertNameFirst() {
        var a = varX("a");
        var b = varX("b");
        var name = constX("foo");

        assertEquals(List.of(name, a, b), DefinitionNormalizer.insertName(List.of(a, b), name));
        assertEquals(List.of(name), DefinitionNormalizer.insertName(List.of(), name));
    }

    @Test
    @DisplayName("input: val x  output: file 'y'  \"echo $x > y\"")
    void canonicalForm() {
        var body = body(
            labeled("input", stmt(callThisX("val", args(varX("x"))))),
            labeled("output", stmt(callThisX("file", args(constX("y"))))),
            stmt(gstringX("echo ", "x", " > y")));
        var definition = processX("foo", body);

        normalizer.normalize(definition);

        var args = arguments(definition);
        assertEquals(3, args.size());
        assertEquals("foo", ((ConstantExpression) args.get(0)).getValue());
        assertEquals(true, ((ConstantExpression) args.get(1)).getValue());

        var statements = closureStatements((ClosureExpression) args.get(2));
        assertEquals(3, statements.size());
        var input = ((ExpressionStatement) statements.get(0)).getExpression();
        assertEquals("_in_val", ((MethodCallExpression) input).getMethodAsString());
        assertEquals(List.of(true, "x"), describeArguments(input));
        var output = ((ExpressionStatement) statements.get(1)).getExpression();
        assertEquals("_out_file", ((MethodCallExpression) output).getMethodAsString());
        assertEquals(List.of("y"), describeArguments(output));
        var script = (ClosureExpression) ((ExpressionStatement) statements.get(2)).getExpression();
        assertInstanceOf(GStringExpression.class, ((ExpressionStatement) script.getCode()).getExpression());

        assertTrue(diagnostics.getDiagnostics().isEmpty());
    }

    @Test
    void namedArgumentsStayFirst() {
        var options = mapX(List.of(entryX(constX("cpus"), constX(2))));
        var definition = processX("foo", options, closureX(body(stmt(constX("echo hello")))));

        normalizer.normalize(definition);

        var args = arguments(definition);
        assertEquals(4, args.size());
        assertSame(options, args.get(0));
        assertInstanceOf(MapExpression.class, args.get(0));
        assertEquals("foo", ((ConstantExpression) args.get(1)).getValue());
        assertEquals(true, ((ConstantExpression) args.get(2)).getValue());
        assertInstanceOf(ClosureExpression.class, args.get(3));
    }

    @Test
    @DisplayName("an invalid body is reported and flagged")
    void invalidBody() {
        var last = at(stmt(plusX(varX("x"), constX(1))), 3, 5);
        var definition = processX("foo", body(
            labeled("input", stmt(callThisX("val", args(varX("x"))))),
            last));

        normalizer.normalize(definition);

        var args = arguments(definition);
        assertEquals(false, ((ConstantExpression) args.get(1)).getValue());
        assertEquals(2, closureStatements(lastClosure(definition)).size());
        assertEquals(1, diagnostics.getDiagnostics().size());
        assertEquals(3, diagnostics.getDiagnostics().get(0).line());
        assertEquals(5, diagnostics.getDiagnostics().get(0).column());
    }

    @Test
    void definitionWithoutBody() {
        var definition = processX("foo", constX(1));

        normalizer.normalize(definition);

        var args = arguments(definition);
        assertEquals(2, args.size());
        assertEquals("foo", ((ConstantExpression) args.get(0)).getValue());
        assertEquals(1, ((ConstantExpression) args.get(1)).getValue());
        assertTrue(diagnostics.getDiagnostics().isEmpty());
    }

    @Test
    @DisplayName("a definition without a nested call is an internal error")
    void malformedDefinition() {
        var withConstant = callThisX("process", args(constX("foo")));
        var withTwoArguments = callThisX("process", args(callThisX("foo"), callThisX("bar")));

        assertThrows(GroovyBugError.class, () -> normalizer.normalize(withConstant));
        assertThrows(GroovyBugError.class, () -> normalizer.normalize(withTwoArguments));
        assertTrue(diagnostics.getDiagnostics().isEmpty());
    }

    @Test
    void malformedDefinitionMessageHasPosition() {
        var definition = at(callThisX("process", args(varX("foo"))), 12, 1);

        var error = assertThrows(GroovyBugError.class, () -> normalizer.normalize(definition));

        assertTrue(error.getMessage().contains("line 12"), error.getMessage());
    }

}
