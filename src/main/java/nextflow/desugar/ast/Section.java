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

/**
 * The labeled sections of a process body.
 */
public enum Section {
    NONE(null),
    INPUT("input"),
    OUTPUT("output"),
    SHARE("share"),
    EXEC("exec"),
    SCRIPT("script");

    private final String label;

    Section(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Whether statements in this section make up the
     * process script.
     */
    public boolean isScript() {
        return this == EXEC || this == SCRIPT;
    }

    /**
     * Get the section for a statement label. Unknown labels
     * are mapped to {@link #NONE}.
     *
     * @param label
     */
    public static Section of(String label) {
        if( label == null )
            return NONE;
        for( var section : values() ) {
            if( label.equals(section.label) )
                return section;
        }
        return NONE;
    }

}
