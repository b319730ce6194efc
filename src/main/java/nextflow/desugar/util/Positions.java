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
package nextflow.desugar.util;

import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.Range;

/**
 * Map Groovy source positions (1-based) to LSP positions
 * (0-based).
 */
public class Positions {

    public static int groovyToLspLine(int groovyLine) {
        return groovyLine > 0 ? groovyLine - 1 : -1;
    }

    public static int groovyToLspCharacter(int groovyColumn) {
        return groovyColumn > 0 ? groovyColumn - 1 : 0;
    }

    public static Position groovyToLspPosition(int groovyLine, int groovyColumn) {
        int lspLine = groovyToLspLine(groovyLine);
        if( lspLine == -1 )
            return null;
        return new Position(
                lspLine,
                groovyToLspCharacter(groovyColumn));
    }

    /**
     * Get the range between two Groovy positions. The range is
     * empty when the end position is missing.
     *
     * @param line
     * @param column
     * @param lastLine
     * @param lastColumn
     */
    public static Range groovyToLspRange(int line, int column, int lastLine, int lastColumn) {
        var start = groovyToLspPosition(line, column);
        if( start == null )
            return null;
        var end = groovyToLspPosition(lastLine, lastColumn);
        if( end == null )
            end = start;
        return new Range(start, end);
    }

}
