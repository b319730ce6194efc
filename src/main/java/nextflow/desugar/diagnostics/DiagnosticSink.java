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

/**
 * Receives the errors found in process definitions.
 *
 * Line and column numbers are the 1-based positions of the
 * Groovy AST.
 */
@FunctionalInterface
public interface DiagnosticSink {

    void report(DiagnosticMessage diagnostic);

}
