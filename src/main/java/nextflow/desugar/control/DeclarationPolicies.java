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

import java.util.Collections;
import java.util.Map;

import nextflow.desugar.ast.Section;

import static nextflow.desugar.control.DeclarationPolicy.keep;
import static nextflow.desugar.control.DeclarationPolicy.rename;

/**
 * The declaration methods recognized in each section.
 */
public class DeclarationPolicies {

    private static final Map<String,DeclarationPolicy> INPUT = Map.of(
        "val",   rename("_in_val", true),
        "env",   rename("_in_env", true),
        "file",  rename("_in_file", true),
        "each",  rename("_in_each", true),
        "stdin", keep(true),
        "_as",   keep(false)
    );

    private static final Map<String,DeclarationPolicy> OUTPUT = Map.of(
        "val",    rename("_out_val", false),
        "file",   rename("_out_file", false),
        "to",     keep(false),
        "stdout", keep(false)
    );

    private static final Map<String,DeclarationPolicy> SHARE = Map.of(
        "val",  rename("_share_val", true),
        "file", rename("_share_file", true),
        "to",   keep(false),
        "_as",  keep(false)
    );

    public static Map<String,DeclarationPolicy> forSection(Section section) {
        return switch( section ) {
            case INPUT -> INPUT;
            case OUTPUT -> OUTPUT;
            case SHARE -> SHARE;
            default -> Collections.emptyMap();
        };
    }

    /**
     * Get the policy for a method in a section, or null if
     * the method is not a declaration of that section.
     *
     * @param section
     * @param methodName
     */
    public static DeclarationPolicy lookup(Section section, String methodName) {
        if( methodName == null )
            return null;
        return forSection(section).get(methodName);
    }

}
