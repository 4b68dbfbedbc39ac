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

import static com.mastfrog.code.emission.util.Utils.iterate;
import static com.mastfrog.code.emission.util.Utils.lines;
import static com.mastfrog.util.preconditions.Checks.notNull;

/**
 * Shifts a fragment right by one indent unit. Every line gets the prefix,
 * including empty ones, so a blank line inside a block comes out as a line
 * holding only the indent unit; existing output depends on those exact bytes.
 * Nesting is done by indenting once per enclosing block.
 *
 * @author Tim Boudreau
 */
public final class Indenter {

    private final String indentUnit;

    public Indenter(String indentUnit) {
        this.indentUnit = notNull("indentUnit", indentUnit);
    }

    public Indenter(EmissionSettings settings) {
        this(notNull("settings", settings).indentUnit());
    }

    public String indentUnit() {
        return indentUnit;
    }

    public String indent(String fragment) {
        notNull("fragment", fragment);
        StringBuilder sb = new StringBuilder(fragment.length() + indentUnit.length() * 8);
        iterate(lines(fragment), (line, first, last) -> {
            sb.append(indentUnit).append(line);
            if (!last) {
                sb.append('\n');
            }
        });
        return sb.toString();
    }
}
