/*
 * Copyright 2024 the miniscriptj developers
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.miniscriptj.script;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class FragmentAnnotationsTest {

    @Test
    public void testKnownFragments() {
        assertEquals("uses a conditional branch (OP_IF)", FragmentAnnotations.annotationFor("or_i"));
        assertEquals("uses a multi-check operation (OP_CHECKMULTISIG)", FragmentAnnotations.annotationFor("multi"));
        assertEquals(Integer.valueOf(3), FragmentAnnotations.expectedArity("andor"));
        assertEquals(Integer.valueOf(FragmentAnnotations.VARIADIC), FragmentAnnotations.expectedArity("thresh"));
    }

    @Test
    public void testUnknownFragment() {
        assertNull(FragmentAnnotations.annotationFor("frobnicate"));
        assertNull(FragmentAnnotations.expectedArity("frobnicate"));
    }

    @Test
    public void testCounted() {
        assertTrue(FragmentAnnotations.isCounted("thresh"));
        assertTrue(FragmentAnnotations.isCounted("threshold"));
        assertTrue(FragmentAnnotations.isCounted("multi_a"));
        assertFalse(FragmentAnnotations.isCounted("and_v"));
    }
}
