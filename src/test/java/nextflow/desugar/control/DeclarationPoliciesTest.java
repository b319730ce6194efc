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
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DeclarationPoliciesTest {

    @Test
    void sameNameDiffersBySection() {
        assertEquals("_in_val", DeclarationPolicies.lookup(Section.INPUT, "val").methodName("val"));
        assertEquals("_out_val", DeclarationPolicies.lookup(Section.OUTPUT, "val").methodName("val"));
        assertEquals("_share_val", DeclarationPolicies.lookup(Section.SHARE, "val").methodName("val"));
    }

    @Test
    void keptNames() {
        var stdin = DeclarationPolicies.lookup(Section.INPUT, "stdin");
        assertEquals("stdin", stdin.methodName("stdin"));
        assertTrue(stdin.flagVariable());
        assertFalse(DeclarationPolicies.lookup(Section.OUTPUT, "stdout").flagVariable());
        assertFalse(DeclarationPolicies.lookup(Section.SHARE, "to").flagVariable());
    }

    @Test
    void noPolicy() {
        assertNull(DeclarationPolicies.lookup(Section.INPUT, "to"));
        assertNull(DeclarationPolicies.lookup(Section.OUTPUT, "_as"));
        assertNull(DeclarationPolicies.lookup(Section.EXEC, "val"));
        assertNull(DeclarationPolicies.lookup(Section.NONE, "val"));
        assertNull(DeclarationPolicies.lookup(Section.INPUT, null));
    }

}
