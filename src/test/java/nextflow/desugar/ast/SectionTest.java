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

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SectionTest {

    @Test
    void labels() {
        assertEquals(Section.INPUT, Section.of("input"));
        assertEquals(Section.OUTPUT, Section.of("output"));
        assertEquals(Section.SHARE, Section.of("share"));
        assertEquals(Section.EXEC, Section.of("exec"));
        assertEquals(Section.SCRIPT, Section.of("script"));
        assertEquals(Section.NONE, Section.of("when"));
        assertEquals(Section.NONE, Section.of(null));
    }

    @Test
    void scriptSections() {
        assertTrue(Section.EXEC.isScript());
        assertTrue(Section.SCRIPT.isScript());
        assertFalse(Section.INPUT.isScript());
        assertFalse(Section.NONE.isScript());
    }

}
