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
package com.mastfrog.code.emission.util;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * Line splitting and joining helpers shared by the emission classes.
 *
 * @author Tim Boudreau
 */
public final class Utils {

    private Utils() {
        throw new AssertionError();
    }

    /**
     * Split a string on the passed delimiter, <i>keeping</i> empty strings
     * before, between and after delimiters, so a trailing delimiter yields a
     * trailing empty element and the empty string yields one empty element.
     *
     * @param delimiter The delimiter
     * @param text Some text
     * @return A list of at least one element
     */
    public static List<String> splitKeepingEmpty(char delimiter, String text) {
        List<String> result = new ArrayList<>();
        int start = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == delimiter) {
                result.add(text.substring(start, i));
                start = i + 1;
            }
        }
        result.add(text.substring(start));
        return result;
    }

    public static List<String> lines(String text) {
        return splitKeepingEmpty('\n', text);
    }

    /**
     * Iterate a collection, passing elements to an IterationConsumer - when
     * joining lines, the last element is treated specially with regard to
     * appending delimiters.
     *
     * @param <T> A type
     * @param collection A collection of objects
     * @param consumer A consumer
     * @return the number of items the consumer was called for
     */
    public static <T> int iterate(Iterable<? extends T> collection, IterationConsumer<? super T> consumer) {
        boolean first = true;
        int result = 0;
        for (Iterator<? extends T> it = collection.iterator(); it.hasNext();) {
            T obj = it.next();
            boolean last = !it.hasNext();
            consumer.onItem(obj, first, last);
            result++;
            first = false;
        }
        return result;
    }

    public static String join(char delimiter, Iterable<? extends Object> objs) {
        StringBuilder into = new StringBuilder();
        iterate(objs, (obj, first, last) -> {
            into.append(Objects.toString(obj));
            if (!last) {
                into.append(delimiter);
            }
        });
        return into.toString();
    }

    /**
     * Join with newlines, never appending a trailing one.
     *
     * @param lines Some lines
     * @return A string
     */
    public static String joinLines(Iterable<? extends Object> lines) {
        return join('\n', lines);
    }

    /**
     * A Consumer-like interface for iterating a collection, which is told
     * whether the element it is being passed is the first and if it is the last
     * element.
     *
     * @param <T> The type
     */
    public interface IterationConsumer<T> {

        void onItem(T item, boolean first, boolean last);
    }
}
