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

/**
 * Assign each statement of a process body to its section
 * and pull out the statements of the exec/script sections.
 *
 * The statement list is not modified.
 */
public class SectionClassifier {

    public static ClassifiedBlock classify(List<Statement> statements) {
        var retained = new ArrayList<ClassifiedBlock.Entry>();
        var scriptStatements = new ArrayList<Statement>();
        var cursor = SectionCursor.start();
        for( var stmt : statements ) {
            cursor = cursor.next(stmt);
            var section = cursor.current();
            if( section.isScript() )
                scriptStatements.add(stmt);
            else
                retained.add(new ClassifiedBlock.Entry(stmt, section));
        }
        return new ClassifiedBlock(retained, scriptStatements);
    }

    /**
     * Get the effective section of every statement, in order.
     *
     * @param statements
     */
    public static List<Section> sections(List<Statement> statements) {
        var result = new ArrayList<Section>(statements.size());
        var cursor = SectionCursor.start();
        for( var stmt : statements ) {
            cursor = cursor.next(stmt);
            result.add(cursor.current());
        }
        return result;
    }

}
