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
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Quotes identifiers which collide with a reserved word of the target language,
 * using its verbatim-identifier syntax (backticks in Swift).
 *
 * @author Tim Boudreau
 */
public final class IdentifierSanitizer {

    private static final Logger LOG = Logger.getLogger(IdentifierSanitizer.class.getName());
    private final EmissionSettings settings;

    public IdentifierSanitizer(EmissionSettings settings) {
        this.settings = notNull("settings", settings);
    }

    public IdentifierSanitizer() {
        this(EmissionSettings.swift());
    }

    public String sanitize(String identifier) {
        notNull("identifier", identifier);
        if (!settings.isReserved(identifier)) {
            return identifier;
        }
        LOG.log(Level.FINE, "Escaping reserved word {0}", identifier);
        return settings.escapeOpen() + identifier + settings.escapeClose();
    }
}
