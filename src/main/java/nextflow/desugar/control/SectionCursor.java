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

import nextflow.desugar.ast.Section;
import org.codehaus.groovy.ast.stmt.Statement;

import static nextflow.desugar.ast.ASTHelpers.explicitLabel;

/**
 * The current section while walking a process body.
 *
 * A label applies to the labeled statement and to every
 * following unlabeled statement, until the next label.
 */
public record SectionCursor(Section current) {

    public static SectionCursor start() {
        return new SectionCursor(Section.NONE);
    }

    public SectionCursor next(Statement statement) {
        var label = explicitLabel(statement);
        return label != null
            ? new SectionCursor(Section.of(label))
            : this;
    }

}
