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

import com.mastfrog.code.emission.error.EmptyWordException;
import static com.mastfrog.code.emission.util.Utils.splitKeepingEmpty;
import static com.mastfrog.util.preconditions.Checks.notNull;
import java.util.List;
import java.util.Locale;

/**
 * Converts space-delimited phrases such as <code>"render pass encoder"</code>
 * into identifiers like <code>renderPassEncoder</code> or
 * <code>RenderPassEncoder</code>.
 * <p>
 * Unless word casing is preserved, the whole phrase is lower-cased first, so
 * <code>"TEXTURE VIEW"</code> becomes <code>textureView</code>; with casing
 * preserved only the first character of each word is touched.
 * </p>
 *
 * @author Tim Boudreau
 */
public final class CaseConverter {

    private CaseConverter() {
        throw new AssertionError();
    }

    public static String toCamelCase(String phrase) {
        return toCamelCase(phrase, false);
    }

    /**
     * Convert a phrase to camel case: the first word is kept as-is and each
     * following word has its first character upper-cased.
     *
     * @param phrase A phrase of single-space-separated words
     * @param preserveWordCasing If false, lower-case the phrase first
     * @return An identifier
     * @throws EmptyWordException if the phrase contains a zero-length word
     */
    public static String toCamelCase(String phrase, boolean preserveWordCasing) {
        List<String> words = words(phrase, preserveWordCasing);
        StringBuilder sb = new StringBuilder(phrase.length());
        sb.append(words.get(0));
        for (int i = 1; i < words.size(); i++) {
            capitalizeInto(words.get(i), sb);
        }
        return sb.toString();
    }

    public static String toPascalCase(String phrase) {
        return toPascalCase(phrase, false);
    }

    /**
     * Convert a phrase to Pascal case: every word, including the first, has
     * its first character upper-cased.
     *
     * @param phrase A phrase of single-space-separated words
     * @param preserveWordCasing If false, lower-case the phrase first
     * @return An identifier
     * @throws EmptyWordException if the phrase contains a zero-length word
     */
    public static String toPascalCase(String phrase, boolean preserveWordCasing) {
        List<String> words = words(phrase, preserveWordCasing);
        StringBuilder sb = new StringBuilder(phrase.length());
        for (String word : words) {
            capitalizeInto(word, sb);
        }
        return sb.toString();
    }

    public static List<String> words(String phrase) {
        return words(phrase, true);
    }

    /**
     * Split a phrase on single spaces, failing on any empty word.
     *
     * @param phrase A phrase
     * @param preserveWordCasing If false, lower-case the phrase first
     * @return A non-empty list of non-empty words
     * @throws EmptyWordException if the phrase contains a zero-length word
     */
    public static List<String> words(String phrase, boolean preserveWordCasing) {
        String text = notNull("phrase", phrase);
        if (!preserveWordCasing) {
            text = text.toLowerCase(Locale.ROOT);
        }
        List<String> words = splitKeepingEmpty(' ', text);
        for (int i = 0; i < words.size(); i++) {
            if (words.get(i).isEmpty()) {
                throw new EmptyWordException(text, i);
            }
        }
        return words;
    }

    private static void capitalizeInto(String word, StringBuilder into) {
        // first code point, not first char, so surrogate pairs stay whole
        int firstLength = Character.charCount(word.codePointAt(0));
        into.append(word.substring(0, firstLength).toUpperCase(Locale.ROOT))
                .append(word, firstLength, word.length());
    }
}
