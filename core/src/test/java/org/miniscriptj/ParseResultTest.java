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

package org.miniscriptj;

import org.junit.Test;
import org.miniscriptj.core.ExpressionError;
import org.miniscriptj.core.ExpressionException;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

public class ParseResultTest {

    @Test
    public void testOk() {
        ParseResult<String> result = ParseResult.ok("pk(A)");
        assertTrue(result.isOk());
        assertEquals("pk(A)", result.getValue());
        assertNull(result.getError());
        assertNull(result.getMessage());
    }

    @Test
    public void testEmptyIsShared() {
        ParseResult<String> a = ParseResult.empty();
        ParseResult<Integer> b = ParseResult.empty();
        assertSame(a, b);
        assertTrue(a.isEmpty());
        assertEquals(ParseResult.Status.EMPTY, a.getStatus());
    }

    @Test
    public void testError() {
        ParseResult<String> result = ParseResult.error(
                new ExpressionException(ExpressionError.DANGLING_WRAPPER, "Wrapper 'v:' is not followed by anything"));
        assertTrue(result.isError());
        assertFalse(result.isOk());
        assertEquals(ExpressionError.DANGLING_WRAPPER, result.getError());
        assertEquals("Wrapper 'v:' is not followed by anything", result.getMessage());
    }

    @Test
    public void testPropagate() {
        ParseResult<String> failed = ParseResult.error(new ExpressionException(ExpressionError.EMPTY_ARGUMENT, "x"));
        ParseResult<Integer> carried = ParseResult.propagate(failed);
        assertTrue(carried.isError());
        assertEquals(ExpressionError.EMPTY_ARGUMENT, carried.getError());
        assertEquals("x", carried.getMessage());
        assertTrue(ParseResult.<Integer>propagate(ParseResult.<String>empty()).isEmpty());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testPropagateRejectsValues() {
        ParseResult.propagate(ParseResult.ok("pk(A)"));
    }

    @Test(expected = IllegalStateException.class)
    public void testNoValueOnError() {
        ParseResult.error(new ExpressionException(ExpressionError.MALFORMED_TREE, "x")).getValue();
    }

    @Test(expected = IllegalStateException.class)
    public void testNoValueWhenEmpty() {
        ParseResult.empty().getValue();
    }
}
