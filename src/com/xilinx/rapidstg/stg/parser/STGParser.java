/*
 * Copyright (c) 2026, Advanced Micro Devices, Inc.
 * All rights reserved.
 *
 * This file is part of RapidSTG.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 */

package com.xilinx.rapidstg.stg.parser;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import com.xilinx.rapidstg.stg.SignalKind;

/**
 * A parser for the textual .g STG format (as written by petrify and Workcraft):
 *
 * <pre>
 * .model name
 * .inputs a b
 * .outputs c
 * .internal x
 * .dummy d
 * .graph
 * a+ c+
 * c+ p0 x-
 * ...
 * .marking { p0 &lt;c-,a+&gt; p1=2 }
 * .capacity p1=2
 * .end
 * </pre>
 *
 * The parser only checks the shape of the text. Name resolution and every
 * structural check is done by {@link com.xilinx.rapidstg.stg.STGBuilder}.
 */
public class STGParser implements AutoCloseable {

    public static final String MODEL = ".model";
    public static final String INPUTS = ".inputs";
    public static final String OUTPUTS = ".outputs";
    public static final String INTERNAL = ".internal";
    public static final String DUMMY = ".dummy";
    public static final String GRAPH = ".graph";
    public static final String MARKING = ".marking";
    public static final String CAPACITY = ".capacity";
    public static final String END = ".end";

    private static final Pattern NAME = Pattern.compile("[a-zA-Z_][a-zA-Z_0-9]*");

    private static final Pattern NODE = Pattern.compile("[a-zA-Z_][a-zA-Z_0-9+\\-~/]*");

    private static final Pattern IMPLICIT = Pattern.compile(NODE.pattern() + "," + NODE.pattern());

    private static final Pattern VALUE = Pattern.compile("[0-9]+");

    private final STGTokenizer tokenizer;

    public STGParser(Reader in) {
        this.tokenizer = new STGTokenizer(in);
    }

    public STGParser(Path fileName) throws IOException {
        this(Files.newBufferedReader(fileName, StandardCharsets.UTF_8));
    }

    public STGParser(String fileName) throws IOException {
        this(Paths.get(fileName));
    }

    /**
     * Parses STG text held in memory.
     * @param text Contents of a .g file.
     * @return The parsed description.
     */
    public static STGDescription parseString(String text) {
        STGParser p = new STGParser(new StringReader(text));
        return p.parseSTG();
    }

    private STGToken expect(STGToken.Type type, String text) {
        STGToken t = tokenizer.next();
        if (!t.is(type, text)) {
            throw STGParseException.unexpected("'" + text + "'", t);
        }
        return t;
    }

    private String expectWord(Pattern shape, String what) {
        STGToken t = tokenizer.next();
        if (t.type != STGToken.Type.WORD || !shape.matcher(t.text).matches()) {
            throw STGParseException.unexpected(what, t);
        }
        return t.text;
    }

    private void expectLineEnd() {
        STGToken t = tokenizer.next();
        if (t.type != STGToken.Type.NEWLINE && t.type != STGToken.Type.EOF) {
            throw STGParseException.unexpected("end of line", t);
        }
    }

    private void skipNewLines() {
        while (tokenizer.peek().type == STGToken.Type.NEWLINE) {
            tokenizer.next();
        }
    }

    private boolean atLineEnd() {
        STGToken.Type type = tokenizer.peek().type;
        return type == STGToken.Type.NEWLINE || type == STGToken.Type.EOF;
    }

    public STGDescription parseSTG() {
        skipNewLines();
        expect(STGToken.Type.WORD, MODEL);
        STGDescription stg = new STGDescription(expectWord(NAME, "model name"));
        expectLineEnd();

        while (true) {
            skipNewLines();
            STGToken t = tokenizer.next();
            if (t.type == STGToken.Type.EOF) {
                throw new STGParseException(t, "Parse Error: Missing " + END);
            }
            if (!t.isDirective()) {
                throw STGParseException.unexpected("a section directive", t);
            }
            switch (t.text) {
                case INPUTS:
                    parseSignalList(stg, SignalKind.INPUT, t);
                    break;
                case OUTPUTS:
                    parseSignalList(stg, SignalKind.OUTPUT, t);
                    break;
                case INTERNAL:
                    parseSignalList(stg, SignalKind.INTERNAL, t);
                    break;
                case DUMMY:
                    parseSignalList(stg, SignalKind.DUMMY, t);
                    break;
                case GRAPH:
                    parseGraph(stg);
                    break;
                case MARKING:
                    parseMarking(stg);
                    break;
                case CAPACITY:
                    parseCapacity(stg, t);
                    break;
                case END:
                    skipNewLines();
                    STGToken eof = tokenizer.next();
                    if (eof.type != STGToken.Type.EOF) {
                        throw new STGParseException(eof, "Expected EOF but found " + eof);
                    }
                    return stg;
                default:
                    throw new STGParseException(t, "Parse Error: Unsupported directive " + t.text);
            }
        }
    }

    private void parseSignalList(STGDescription stg, SignalKind kind, STGToken directive) {
        if (atLineEnd()) {
            throw new STGParseException(directive, "Parse Error: " + directive.text + " lists no signals");
        }
        while (!atLineEnd()) {
            stg.addSignal(kind, expectWord(NAME, "signal name"));
        }
        expectLineEnd();
    }

    private void parseGraph(STGDescription stg) {
        stg.addGraphSection();
        expectLineEnd();
        while (true) {
            skipNewLines();
            STGToken first = tokenizer.peek();
            if (first.type != STGToken.Type.WORD || first.isDirective()) {
                return;
            }
            String source = expectWord(NODE, "transition or place");
            List<String> destinations = new ArrayList<>();
            while (!atLineEnd()) {
                destinations.add(expectWord(NODE, "transition or place"));
            }
            stg.addArc(new STGArc(source, destinations, first.line));
            expectLineEnd();
        }
    }

    private STGOverride parseOverride() {
        STGToken first = tokenizer.peek();
        String name;
        boolean implicit = false;
        if (first.is(STGToken.Type.SYMBOL, "<")) {
            tokenizer.next();
            name = expectWord(IMPLICIT, "implicit place <transition,transition>");
            expect(STGToken.Type.SYMBOL, ">");
            implicit = true;
        } else {
            name = expectWord(NAME, "place name");
        }
        String value = null;
        if (tokenizer.peek().is(STGToken.Type.SYMBOL, "=")) {
            tokenizer.next();
            value = expectWord(VALUE, "integer value");
        }
        return new STGOverride(name, implicit, value, first.line);
    }

    private void parseMarking(STGDescription stg) {
        expect(STGToken.Type.SYMBOL, "{");
        skipNewLines();
        int count = 0;
        while (!tokenizer.peek().is(STGToken.Type.SYMBOL, "}")) {
            stg.addMarking(parseOverride());
            count++;
            skipNewLines();
        }
        STGToken close = tokenizer.next();
        if (count == 0) {
            throw new STGParseException(close, "Parse Error: " + MARKING + " lists no places");
        }
        expectLineEnd();
    }

    private void parseCapacity(STGDescription stg, STGToken directive) {
        if (atLineEnd()) {
            throw new STGParseException(directive, "Parse Error: " + CAPACITY + " lists no places");
        }
        while (!atLineEnd()) {
            stg.addCapacity(parseOverride());
        }
        expectLineEnd();
    }

    @Override
    public void close() throws IOException {
        tokenizer.close();
    }
}
