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

import static com.mastfrog.code.emission.util.Utils.joinLines;
import static com.mastfrog.util.preconditions.Checks.notNull;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Accumulates sibling fragments in order and joins them with newlines, so a
 * block body can be written as a series of calls instead of explicit string
 * concatenation:
 * <pre>
 * String body = emitter.code(c -&gt; {
 *     c.add("let x = 1")
 *      .addIf(mutable, "x += 1")
 *      .addEither(async, "await run(x)", "run(x)")
 *      .addEach(members, m -&gt; "case " + m)
 *      .block("if x &gt; 0", inner -&gt; inner.add("print(x)"));
 * });
 * </pre>
 * A fragment which is not added (a false condition, the unselected branch, an
 * empty collection) contributes neither a line nor a separator. Adding the empty
 * string <i>does</i> contribute a blank line.
 * <p>
 * Composition is purely structural: no indentation is applied to added
 * fragments and nothing is reordered or de-duplicated. Instances are not
 * thread-safe; the strings they produce are.
 * </p>
 *
 * @author Tim Boudreau
 */
public final class FragmentComposer implements FragmentGenerator {

    private final List<String> fragments = new ArrayList<>();
    private final BlockFormatter formatter;

    public FragmentComposer() {
        this(new BlockFormatter(EmissionSettings.swift()));
    }

    public FragmentComposer(BlockFormatter formatter) {
        this.formatter = notNull("formatter", formatter);
    }

    public FragmentComposer add(String fragment) {
        fragments.add(notNull("fragment", fragment));
        return this;
    }

    public FragmentComposer add(FragmentGenerator generator) {
        return add(notNull("generator", generator).generate());
    }

    public FragmentComposer addAll(Iterable<? extends String> fragments) {
        for (String frag : notNull("fragments", fragments)) {
            add(frag);
        }
        return this;
    }

    public FragmentComposer addIf(boolean condition, String fragment) {
        notNull("fragment", fragment);
        if (condition) {
            add(fragment);
        }
        return this;
    }

    /**
     * Add the output of a generator if the condition is true; the generator is
     * not invoked otherwise.
     *
     * @param condition Whether to add anything
     * @param generator A generator
     * @return this
     */
    public FragmentComposer addIf(boolean condition, FragmentGenerator generator) {
        notNull("generator", generator);
        if (condition) {
            add(generator);
        }
        return this;
    }

    /**
     * Add exactly one of two alternatives.
     *
     * @param condition Which one
     * @param ifTrue Added if the condition is true
     * @param ifFalse Added if the condition is false
     * @return this
     */
    public FragmentComposer addEither(boolean condition, String ifTrue, String ifFalse) {
        notNull("ifTrue", ifTrue);
        notNull("ifFalse", ifFalse);
        return add(condition ? ifTrue : ifFalse);
    }

    public FragmentComposer addEither(boolean condition, FragmentGenerator ifTrue, FragmentGenerator ifFalse) {
        notNull("ifTrue", ifTrue);
        notNull("ifFalse", ifFalse);
        return add(condition ? ifTrue : ifFalse);
    }

    /**
     * Add one fragment per element of a collection, in iteration order.
     *
     * @param <T> The element type
     * @param items The elements
     * @param toFragment Converts an element to a fragment
     * @return this
     */
    public <T> FragmentComposer addEach(Iterable<? extends T> items, Function<? super T, String> toFragment) {
        notNull("items", items);
        notNull("toFragment", toFragment);
        for (T item : items) {
            add(toFragment.apply(item));
        }
        return this;
    }

    /**
     * Add a brace-delimited block with the passed header, whose body is
     * composed by the consumer and indented one level.
     *
     * @param header The header line, or null for a bare opening brace
     * @param body Populates the body
     * @return this
     */
    public FragmentComposer block(String header, Consumer<? super FragmentComposer> body) {
        return add(formatter.block(header, body));
    }

    public FragmentComposer block(Consumer<? super FragmentComposer> body) {
        return block(null, body);
    }

    /**
     * Add the composed body indented one level, with no braces.
     *
     * @param body Populates the body
     * @return this
     */
    public FragmentComposer indented(Consumer<? super FragmentComposer> body) {
        return add(formatter.indented(body));
    }

    public boolean isEmpty() {
        return fragments.isEmpty();
    }

    public int size() {
        return fragments.size();
    }

    public List<String> fragments() {
        return Collections.unmodifiableList(fragments);
    }

    /**
     * Join everything added so far with newlines; the empty string if nothing
     * was added.
     *
     * @return A fragment
     */
    public String build() {
        return joinLines(fragments);
    }

    @Override
    public String generate() {
        return build();
    }

    @Override
    public String toString() {
        return build();
    }
}
