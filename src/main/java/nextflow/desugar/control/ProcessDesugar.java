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

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

import org.codehaus.groovy.transform.GroovyASTTransformationClass;

/**
 * Marks a script class whose process definitions are desugared
 * by {@link ProcessDesugarTransform}.
 *
 * The transform runs in the conversion phase, before any local
 * transform declared in the source is collected, so it is applied
 * to scripts with an {@code ASTTransformationCustomizer}:
 *
 * <pre>
 *     var config = new CompilerConfiguration();
 *     config.addCompilationCustomizers(new ASTTransformationCustomizer(ProcessDesugar.class));
 * </pre>
 */
@Retention(RetentionPolicy.SOURCE)
@Target(ElementType.TYPE)
@GroovyASTTransformationClass("nextflow.desugar.control.ProcessDesugarTransform")
public @interface ProcessDesugar {
}
