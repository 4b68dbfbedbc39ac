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
import org.junit.jupiter.api.Test;

/**
 *
 * @author Tim Boudreau
 */
public class IndenterTest {

    private final Indenter indenter = new Indenter(EmissionSettings.swift());

    @Test
    public void testEveryLineIsIndented() {
        assertEquals("    let a = 1\n    let b = 2", indenter.indent("let a = 1\nlet b = 2"));
        assertEquals("    x", indenter.indent("x"));
    }

    @Test
    public void testBlankLinesGetTheIndentUnit() {
        String result = indenter.indent("a\n\nb");
        String[] lines = result.split("\n", -1);
        assertEquals(3, lines.length, result);
        assertEquals("    ", lines[1], "Blank line should consist solely of the indent unit");

        assertEquals("    a\n    ", indenter.indent("a\n"));
        assertEquals("    \n    a", indenter.indent("\na"));
        assertEquals("    ", indenter.indent(""));
    }

    @Test
    public void testIndentationCompounds() {
        String twice = indenter.indent(indenter.indent("x\n\ny"));
        assertEquals("        x\n        \n        y", twice);
    }

    @Test
    public void testCustomUnit() {
        assertEquals("\tfoo();\n\tbar();", new Indenter("\t").indent("foo();\nbar();"));
        Indenter two = new Indenter(EmissionSettings.builder().indentingBy(2).build());
        assertEquals("  foo", two.indent("foo"));
        assertEquals("  ", two.indentUnit());
        assertEquals("a\nb", new Indenter("").indent("a\nb"));
    }
}
