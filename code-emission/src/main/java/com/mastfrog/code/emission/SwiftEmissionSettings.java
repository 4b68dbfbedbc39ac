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
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 *
 * @author Tim Boudreau
 */
final class SwiftEmissionSettings implements EmissionSettings {

    static final String INDENT_UNIT = "    ";
    static final String ESCAPE = "`";
    static final SwiftEmissionSettings INSTANCE = new SwiftEmissionSettings();

    private static final Set<String> RESERVED
            = Collections.unmodifiableSet(new LinkedHashSet<>(
                    Arrays.asList("repeat", "internal")));

    private SwiftEmissionSettings() {
    }

    @Override
    public String indentUnit() {
        return INDENT_UNIT;
    }

    @Override
    public Set<String> reservedWords() {
        return RESERVED;
    }

    @Override
    public String escapeOpen() {
        return ESCAPE;
    }

    @Override
    public String escapeClose() {
        return ESCAPE;
    }

    @Override
    public char blockOpen() {
        return '{';
    }

    @Override
    public char blockClose() {
        return '}';
    }

    @Override
    public String toString() {
        return "swift";
    }
}
