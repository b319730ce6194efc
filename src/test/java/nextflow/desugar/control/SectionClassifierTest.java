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
import org.codehaus.groovy.ast.stmt.Statement;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static nextflow.desugar.control.AstFixtures.labeled;
import static org.codehaus.groovy.ast.tools.GeneralUtils.*;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SectionClassifierTest {

    private static Statement call(String name) {
        return stmt(callThisX(name, args(varX("x"))));
    }

    @Test
    @DisplayName("an unlabeled statement inherits the previous label")
    void stickyLabels() {
        var statements = List.of(
            call("before"),
            labeled("input", call("val")),
            call("file"),
            labeled("output", call("val")),
            call("file"),
            call("stdout"));

        assertEquals(
            List.of(Section.NONE, Section.INPUT, Section.INPUT, Section.OUTPUT, Section.OUTPUT, Section.OUTPUT),
            SectionClassifier.sections(statements));
    }

    @Test
    @DisplayName("an unknown label ends the current section")
    void unknownLabel() {
        var statements = List.of(
            labeled("input", call("val")),
            labeled("when", call("check")),
            call("other"));

        assertEquals(
            List.of(Section.INPUT, Section.NONE, Section.NONE),
            SectionClassifier.sections(statements));
    }

    @Test
    void scriptStatementsAreSeparated() {
        var input = labeled("input", call("val"));
        var exec1 = labeled("exec", call("first"));
        var exec2 = call("second");
        var script = labeled("script", call("third"));

        var result = SectionClassifier.classify(List.of(input, exec1, exec2, script));

        assertEquals(1, result.retained().size());
        assertSame(input, result.retained().get(0).statement());
        assertEquals(Section.INPUT, result.retained().get(0).section());
        assertEquals(List.of(exec1, exec2, script), result.scriptStatements());
    }

    @Test
    void statementsAfterScriptSectionStayInScript() {
        var exec = labeled("exec", call("first"));
        var next = call("second");
        var output = labeled("output", call("val"));

        var result = SectionClassifier.classify(List.of(exec, next, output));

        assertEquals(List.of(exec, next), result.scriptStatements());
        assertEquals(List.of(output), result.retainedStatements());
    }

    @Test
    void statementListIsNotModified() {
        var statements = new ArrayList<Statement>();
        statements.add(labeled("input", call("val")));
        statements.add(labeled("exec", call("run")));

        SectionClassifier.classify(statements);

        assertEquals(2, statements.size());
    }

    @Test
    void emptyBlock() {
        var result = SectionClassifier.classify(List.of());

        assertTrue(result.retained().isEmpty());
        assertTrue(result.scriptStatements().isEmpty());
    }

    @Test
    void cursorKeepsSectionForUnlabeledStatement() {
        var cursor = SectionCursor.start().next(labeled("share", call("val")));

        assertEquals(Section.SHARE, cursor.current());
        assertSame(cursor, cursor.next(call("file")));
    }

}
