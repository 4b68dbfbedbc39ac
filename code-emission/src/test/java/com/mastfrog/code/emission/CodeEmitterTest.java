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

import java.util.Arrays;
import java.util.List;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import org.junit.jupiter.api.Test;

/**
 *
 * @author Tim Boudreau
 */
public class CodeEmitterTest {

    private final CodeEmitter swift = CodeEmitter.swift();

    @Test
    public void testGenerateEnum() {
        List<String> values = Arrays.asList("undefined", "repeat", "mirror repeat", "clamp to edge");
        boolean hasUndefined = values.contains("undefined");
        String result = swift.block("public enum " + swift.pascalCase("address mode") + ": UInt32", body -> {
            body.addEach(values, v -> "case " + swift.safeCamelCase(v));
            body.add("");
            body.block("public init(_ raw: WGPUAddressMode)", init -> {
                init.addEither(hasUndefined,
                        "self = Self(rawValue: raw.rawValue) ?? .undefined",
                        "self = Self(rawValue: raw.rawValue)!");
            });
        });
        assertEquals("public enum AddressMode: UInt32 {\n"
                + "    case undefined\n"
                + "    case `repeat`\n"
                + "    case mirrorRepeat\n"
                + "    case clampToEdge\n"
                + "    \n"
                + "    public init(_ raw: WGPUAddressMode) {\n"
                + "        self = Self(rawValue: raw.rawValue) ?? .undefined\n"
                + "    }\n"
                + "}", result);
    }

    @Test
    public void testThreeLevelsOfNesting() {
        String result = swift.code(file -> {
            file.add("import WebGPU");
            file.block("extension Device", ext -> {
                ext.block("func poll()", fn -> {
                    fn.block("while busy", loop -> loop.add("tick()"));
                });
            });
        });
        String[] lines = result.split("\n");
        assertEquals("import WebGPU", lines[0]);
        assertEquals("extension Device {", lines[1]);
        assertEquals("    func poll() {", lines[2]);
        assertEquals("        while busy {", lines[3]);
        assertEquals("            tick()", lines[4]);
        assertEquals("        }", lines[5]);
        assertEquals("    }", lines[6]);
        assertEquals("}", lines[7]);
        assertEquals(8, lines.length);
    }

    @Test
    public void testIndentedAndBareBlock() {
        assertEquals("    a\n    b", swift.indented(c -> c.add("a").add("b")));
        assertEquals("{\n    a\n}", swift.block(c -> c.add("a")));
        assertEquals("do {\n    try x()\n}", swift.formatBlock("do", "try x()"));
        assertEquals("    z", swift.indent("z"));
    }

    @Test
    public void testIdentifierHelpers() {
        assertEquals("renderPipeline", swift.camelCase("RENDER PIPELINE"));
        assertEquals("RENDERPipeline", swift.camelCase("RENDER pipeline", true));
        assertEquals("RenderPipeline", swift.pascalCase("render pipeline"));
        assertEquals("RENDERPipeline", swift.pascalCase("RENDER pipeline", true));
        assertEquals("`internal`", swift.safe("internal"));
        assertEquals("`internal`", swift.safeCamelCase("INTERNAL"));
        assertEquals("internalFormat", swift.safeCamelCase("internal format"));
    }

    @Test
    public void testCustomDialect() {
        EmissionSettings kotlin = EmissionSettings.builder()
                .indentingBy(2)
                .reserving("object", "fun")
                .build();
        CodeEmitter emitter = CodeEmitter.forSettings(kotlin);
        assertSame(kotlin, emitter.settings());
        String result = emitter.block("class Holder", body -> {
            body.add("val " + emitter.safe("object") + " = Any()");
            body.block("fun go()", fn -> fn.add("println(1)"));
        });
        assertEquals("class Holder {\n"
                + "  val `object` = Any()\n"
                + "  fun go() {\n"
                + "    println(1)\n"
                + "  }\n"
                + "}", result);
    }

    @Test
    public void testComposerIsBoundToEmitterSettings() {
        CodeEmitter tabs = CodeEmitter.forSettings(EmissionSettings.builder().indentingWith("\t").build());
        String result = tabs.composer().block("a", c -> c.add("b")).build();
        assertEquals("a {\n\tb\n}", result);
        assertTrue(CodeEmitter.swift().toString().contains("swift"));
    }
}
