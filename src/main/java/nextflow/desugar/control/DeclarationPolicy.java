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

/**
 * How a declaration method is rewritten.
 *
 * @param canonicalName the new method name, or null to keep the original name
 * @param flagVariable whether to prepend a boolean telling if the argument was a variable
 * @param index the position of the argument that may be a variable reference
 */
public record DeclarationPolicy(
    String canonicalName,
    boolean flagVariable,
    int index
) {

    public static DeclarationPolicy rename(String canonicalName, boolean flagVariable) {
        return new DeclarationPolicy(canonicalName, flagVariable, 0);
    }

    public static DeclarationPolicy keep(boolean flagVariable) {
        return new DeclarationPolicy(null, flagVariable, 0);
    }

    public String methodName(String originalName) {
        return canonicalName != null ? canonicalName : originalName;
    }

}
