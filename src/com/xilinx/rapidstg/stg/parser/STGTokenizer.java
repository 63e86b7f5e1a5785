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
import java.io.UncheckedIOException;

/**
 * Splits .g text into words, single-character symbols and line ends. Comments
 * start with '#' and run to the end of the line. Words may contain the
 * characters used by directives, transition labels and implicit place names.
 */
public class STGTokenizer implements AutoCloseable {

    private final Reader in;

    private int line = 1;

    private int lookahead = -2;

    private STGToken peeked;

    public STGTokenizer(Reader in) {
        this.in = in;
    }

    public int getLine() {
        return line;
    }

    private int read() {
        if (lookahead != -2) {
            int c = lookahead;
            lookahead = -2;
            return c;
        }
        try {
            return in.read();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private void unread(int c) {
        lookahead = c;
    }

    static boolean isWordChar(int c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9')
                || c == '_' || c == '+' || c == '-' || c == '~' || c == '/' || c == '.' || c == ',';
    }

    static boolean isSymbol(int c) {
        return c == '{' || c == '}' || c == '<' || c == '>' || c == '=';
    }

    /**
     * Returns the next token without consuming it.
     */
    public STGToken peek() {
        if (peeked == null) {
            peeked = readToken();
        }
        return peeked;
    }

    /**
     * Consumes and returns the next token. Once the input is exhausted, EOF tokens
     * are returned indefinitely.
     */
    public STGToken next() {
        STGToken t = peek();
        peeked = null;
        return t;
    }

    private STGToken readToken() {
        int c = read();
        while (true) {
            if (c == '#') {
                while (c != '\n' && c != -1) {
                    c = read();
                }
            } else if (c == ' ' || c == '\t' || c == '\r' || c == '\f') {
                c = read();
            } else {
                break;
            }
        }
        if (c == -1) {
            return new STGToken("", STGToken.Type.EOF, line);
        }
        if (c == '\n') {
            return new STGToken("\n", STGToken.Type.NEWLINE, line++);
        }
        if (isSymbol(c)) {
            return new STGToken(String.valueOf((char) c), STGToken.Type.SYMBOL, line);
        }
        if (!isWordChar(c)) {
            throw new STGParseException("Unexpected character '" + (char) c + "'", line);
        }
        StringBuilder sb = new StringBuilder();
        while (isWordChar(c)) {
            sb.append((char) c);
            c = read();
        }
        unread(c);
        return new STGToken(sb.toString(), STGToken.Type.WORD, line);
    }

    @Override
    public void close() throws IOException {
        in.close();
    }
}
