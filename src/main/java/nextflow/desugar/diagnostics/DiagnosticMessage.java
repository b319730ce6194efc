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
package nextflow.desugar.diagnostics;

import org.codehaus.groovy.ast.ASTNode;

/**
 * An error in a process definition, spanning from the start
 * position to the end position (1-based, end exclusive).
 */
public record DiagnosticMessage(
    String message,
    int line,
    int column,
    int endLine,
    int endColumn
) {

    public DiagnosticMessage(String message, int line, int column) {
        this(message, line, column, line, column);
    }

    /**
     * Create a diagnostic that spans the given node, or only
     * its start position if the node has no end position.
     *
     * @param message
     * @param node
     */
    public static DiagnosticMessage at(String message, ASTNode node) {
        if( node.getLastLineNumber() <= 0 )
            return new DiagnosticMessage(message, node.getLineNumber(), node.getColumnNumber());
        return new DiagnosticMessage(message, node.getLineNumber(), node.getColumnNumber(), node.getLastLineNumber(), node.getLastColumnNumber());
    }

    @Override
    public String toString() {
        return String.format("%s @ line %d, column %d", message, line, column);
    }

}
