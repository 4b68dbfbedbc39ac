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

import java.util.Set;

/**
 * Settings produced by {@link EmissionSettings.Builder}.
 *
 * @author Tim Boudreau
 */
final class CustomEmissionSettings implements EmissionSettings {

    private final String indentUnit;
    private final String escapeOpen;
    private final String escapeClose;
    private final char blockOpen;
    private final char blockClose;
    private final Set<String> reserved;

    CustomEmissionSettings(String indentUnit, String escapeOpen, String escapeClose,
            char blockOpen, char blockClose, Set<String> reserved) {
        this.indentUnit = indentUnit;
        this.escapeOpen = escapeOpen;
        this.escapeClose = escapeClose;
        this.blockOpen = blockOpen;
        this.blockClose = blockClose;
        this.reserved = reserved;
    }

    @Override
    public String indentUnit() {
        return indentUnit;
    }

    @Override
    public Set<String> reservedWords() {
        return reserved;
    }

    @Override
    public String escapeOpen() {
        return escapeOpen;
    }

    @Override
    public String escapeClose() {
        return escapeClose;
    }

    @Override
    public char blockOpen() {
        return blockOpen;
    }

    @Override
    public char blockClose() {
        return blockClose;
    }

    @Override
    public String toString() {
        return "indent '" + indentUnit + "' escape " + escapeOpen + escapeClose
                + " blocks " + blockOpen + blockClose + " reserved " + reserved;
    }
}
