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

import static com.mastfrog.util.preconditions.Checks.notNull;
import java.util.function.Consumer;

/**
 * Wraps a body in an optional header line and a pair of braces:
 * <pre>
 * struct Foo {
 *     x
 * }
 * </pre>
 * The header is emitted exactly as passed, so identifiers in it must already be
 * cased and sanitized. Only the direct body is indented, so blocks nested in
 * the body come out indented once per level of nesting.
 *
 * @author Tim Boudreau
 */
public final class BlockFormatter {

    private final EmissionSettings settings;
    private final Indenter indenter;

    public BlockFormatter(EmissionSettings settings) {
        this.settings = notNull("settings", settings);
        this.indenter = new Indenter(settings);
    }

    public String formatBlock(String header, String body) {
        notNull("body", body);
        StringBuilder sb = new StringBuilder(body.length() + 32);
        if (header != null) {
            sb.append(header).append(' ');
        }
        sb.append(settings.blockOpen()).append('\n');
        sb.append(indenter.indent(body)).append('\n');
        return sb.append(settings.blockClose()).toString();
    }

    public String formatBlock(String header, FragmentGenerator body) {
        return formatBlock(header, notNull("body", body).generate());
    }

    public String formatBlock(String body) {
        return formatBlock(null, body);
    }

    /**
     * Format a block whose body is populated by the passed consumer.
     *
     * @param header The header, or null
     * @param body Populates the body
     * @return A fragment
     */
    public String block(String header, Consumer<? super FragmentComposer> body) {
        return formatBlock(header, compose(body));
    }

    public String indented(Consumer<? super FragmentComposer> body) {
        return indenter.indent(compose(body));
    }

    public FragmentComposer composer() {
        return new FragmentComposer(this);
    }

    String compose(Consumer<? super FragmentComposer> body) {
        notNull("body", body);
        FragmentComposer composer = composer();
        body.accept(composer);
        return composer.build();
    }

    public Indenter indenter() {
        return indenter;
    }
}
