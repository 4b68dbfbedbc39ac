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
package com.mastfrog.code.emission.error;

/**
 * Thrown when a phrase passed for case conversion contains a zero-length word,
 * as happens with leading, trailing or doubled spaces, or an empty phrase.
 *
 * @author Tim Boudreau
 */
public final class EmptyWordException extends IllegalArgumentException {

    private final String phrase;
    private final int wordIndex;

    public EmptyWordException(String phrase, int wordIndex) {
        super("Empty word at index " + wordIndex + " in '" + phrase + "'");
        this.phrase = phrase;
        this.wordIndex = wordIndex;
    }

    /**
     * The phrase as it was split, after any lower-casing.
     *
     * @return The phrase
     */
    public String phrase() {
        return phrase;
    }

    public int wordIndex() {
        return wordIndex;
    }
}
