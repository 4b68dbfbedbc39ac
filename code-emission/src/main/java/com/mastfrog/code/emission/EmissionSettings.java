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
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Cross-dialect settings for how emitted code is indented, how blocks are
 * delimited and which identifiers must be quoted to be used verbatim.
 *
 * @author Tim Boudreau
 */
public interface EmissionSettings {

    /**
     * The string prefixed to each line of a block body, once per level of
     * nesting.
     *
     * @return An indent unit, possibly empty, never null
     */
    String indentUnit();

    /**
     * Identifiers which collide with keywords of the target language.
     *
     * @return An unmodifiable set
     */
    Set<String> reservedWords();

    String escapeOpen();

    String escapeClose();

    char blockOpen();

    char blockClose();

    default boolean isReserved(String identifier) {
        return reservedWords().contains(identifier);
    }

    /**
     * Settings for emitting Swift: four space indent, braces, and backtick
     * quoting of <code>repeat</code> and <code>internal</code>.
     *
     * @return The Swift settings
     */
    static EmissionSettings swift() {
        return SwiftEmissionSettings.INSTANCE;
    }

    static Builder builder() {
        return new Builder();
    }

    /**
     * Builds settings for some other dialect; starts out with the Swift
     * defaults.
     */
    final class Builder {

        private String indentUnit = SwiftEmissionSettings.INDENT_UNIT;
        private String escapeOpen = SwiftEmissionSettings.ESCAPE;
        private String escapeClose = SwiftEmissionSettings.ESCAPE;
        private char blockOpen = '{';
        private char blockClose = '}';
        private final Set<String> reserved = new LinkedHashSet<>();

        Builder() {
        }

        public Builder indentingWith(String indentUnit) {
            this.indentUnit = notNull("indentUnit", indentUnit);
            return this;
        }

        public Builder indentingBy(int spaces) {
            if (spaces < 0) {
                throw new IllegalArgumentException("Negative indent: " + spaces);
            }
            char[] c = new char[spaces];
            Arrays.fill(c, ' ');
            this.indentUnit = new String(c);
            return this;
        }

        public Builder escapingWith(String delimiter) {
            return escapingWith(delimiter, delimiter);
        }

        /**
         * Set the quoting of reserved words; the closing delimiter may be empty
         * for prefix-style escapes such as C#'s <code>@</code>.
         *
         * @param open Prepended to reserved words
         * @param close Appended to reserved words
         * @return this
         */
        public Builder escapingWith(String open, String close) {
            if (notNull("open", open).isEmpty()) {
                throw new IllegalArgumentException("Empty opening escape delimiter");
            }
            this.escapeOpen = open;
            this.escapeClose = notNull("close", close);
            return this;
        }

        public Builder delimitingBlocksWith(char open, char close) {
            this.blockOpen = open;
            this.blockClose = close;
            return this;
        }

        public Builder reserving(String... words) {
            return reserving(Arrays.asList(words));
        }

        public Builder reserving(Collection<String> words) {
            for (String w : notNull("words", words)) {
                if (notNull("word", w).isEmpty()) {
                    throw new IllegalArgumentException("Empty reserved word in " + words);
                }
                reserved.add(w);
            }
            return this;
        }

        public EmissionSettings build() {
            return new CustomEmissionSettings(indentUnit, escapeOpen, escapeClose,
                    blockOpen, blockClose,
                    Collections.unmodifiableSet(new LinkedHashSet<>(reserved)));
        }
    }
}
