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
 * Entry point for generators: binds one set of {@link EmissionSettings} to case
 * conversion, identifier sanitizing, indentation and block formatting.
 * <pre>
 * CodeEmitter swift = CodeEmitter.swift();
 * String src = swift.block("public struct " + swift.pascalCase("texture view"), body -&gt; {
 *     body.addEach(fields, f -&gt; "public var " + swift.safeCamelCase(f) + ": Int");
 * });
 * </pre>
 * Instances are immutable and may be shared between threads.
 *
 * @author Tim Boudreau
 */
public final class CodeEmitter {

    private static final CodeEmitter SWIFT = new CodeEmitter(EmissionSettings.swift());
    private final EmissionSettings settings;
    private final BlockFormatter formatter;
    private final IdentifierSanitizer sanitizer;

    private CodeEmitter(EmissionSettings settings) {
        this.settings = settings;
        this.formatter = new BlockFormatter(settings);
        this.sanitizer = new IdentifierSanitizer(settings);
    }

    public static CodeEmitter swift() {
        return SWIFT;
    }

    public static CodeEmitter forSettings(EmissionSettings settings) {
        return new CodeEmitter(notNull("settings", settings));
    }

    public EmissionSettings settings() {
        return settings;
    }

    public FragmentComposer composer() {
        return formatter.composer();
    }

    /**
     * Compose a sequence of sibling fragments.
     *
     * @param body Populates the composer
     * @return The joined fragment
     */
    public String code(Consumer<? super FragmentComposer> body) {
        return formatter.compose(body);
    }

    public String indented(Consumer<? super FragmentComposer> body) {
        return formatter.indented(body);
    }

    public String indent(String fragment) {
        return formatter.indenter().indent(fragment);
    }

    public String block(String header, Consumer<? super FragmentComposer> body) {
        return formatter.block(header, body);
    }

    public String block(Consumer<? super FragmentComposer> body) {
        return formatter.block(null, body);
    }

    public String formatBlock(String header, String body) {
        return formatter.formatBlock(header, body);
    }

    public String camelCase(String phrase) {
        return CaseConverter.toCamelCase(phrase);
    }

    public String camelCase(String phrase, boolean preserveWordCasing) {
        return CaseConverter.toCamelCase(phrase, preserveWordCasing);
    }

    public String pascalCase(String phrase) {
        return CaseConverter.toPascalCase(phrase);
    }

    public String pascalCase(String phrase, boolean preserveWordCasing) {
        return CaseConverter.toPascalCase(phrase, preserveWordCasing);
    }

    public String safe(String identifier) {
        return sanitizer.sanitize(identifier);
    }

    /**
     * Camel-case a phrase, then quote it if the result is a reserved word -
     * the usual treatment for member and argument names.
     *
     * @param phrase A phrase
     * @return An identifier usable verbatim
     */
    public String safeCamelCase(String phrase) {
        return safe(camelCase(phrase));
    }

    @Override
    public String toString() {
        return "CodeEmitter(" + settings + ")";
    }
}
