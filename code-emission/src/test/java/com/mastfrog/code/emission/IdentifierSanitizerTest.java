/*
 * The MIT License
 *
 * Copyright 2022 Mastfrog Technologies.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package com.mastfrog.code.emission;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import org.junit.jupiter.api.Test;

/**
 *
 * @author Tim Boudreau
 */
public class IdentifierSanitizerTest {

    @Test
    public void testSwiftReservedWords() {
        IdentifierSanitizer san = new IdentifierSanitizer();
        assertEquals("`repeat`", san.sanitize("repeat"));
        assertEquals("`internal`", san.sanitize("internal"));
        assertEquals("foo", san.sanitize("foo"));
        assertEquals("Repeat", san.sanitize("Repeat"), "Matching is case sensitive");
        assertEquals("repeatCount", san.sanitize("repeatCount"));
        assertEquals("", san.sanitize(""));
    }

    @Test
    public void testUnreservedIdentifierIsReturnedAsIs() {
        String id = new String("sampler");
        assertSame(id, new IdentifierSanitizer().sanitize(id));
    }

    @Test
    public void testCustomDialect() {
        EmissionSettings kotlin = EmissionSettings.builder()
                .reserving("object", "fun", "in")
                .build();
        IdentifierSanitizer san = new IdentifierSanitizer(kotlin);
        assertEquals("`object`", san.sanitize("object"));
        assertEquals("`in`", san.sanitize("in"));
        assertEquals("repeat", san.sanitize("repeat"));

        EmissionSettings csharp = EmissionSettings.builder()
                .escapingWith("@", "")
                .reserving("params")
                .build();
        assertEquals("@params", new IdentifierSanitizer(csharp).sanitize("params"));
    }
}
