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
import java.util.stream.Collectors;

import nextflow.desugar.ast.Section;
import org.codehaus.groovy.ast.stmt.Statement;

/**
 * A process body split into the statements that stay in
 * the body and the statements of the exec/script sections.
 */
public record ClassifiedBlock(
    List<Entry> retained,
    List<Statement> scriptStatements
) {

    public record Entry(Statement statement, Section section) {}

    public List<Statement> retainedStatements() {
        return retained.stream()
            .map(Entry::statement)
            .collect(Collectors.toList());
    }

}
