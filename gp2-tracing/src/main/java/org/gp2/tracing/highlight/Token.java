/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements. See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership. The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License. You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied. See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */
package org.gp2.tracing.highlight;

import java.util.Objects;

/**
 * A match of a lexeme against a range of the program text. Tokens are shared
 * with the program editor, which renders the emphasis flag as a background
 * highlight.
 */
public class Token {

    private final int startPos;
    private final int endPos;
    private final ProgramLexeme lexeme;
    private final String text;
    private final String description;
    private boolean emphasised;

    public Token(int startPos, int endPos, ProgramLexeme lexeme, String text) {
        this(startPos, endPos, lexeme, text, null);
    }

    public Token(int startPos, int endPos, ProgramLexeme lexeme, String text, String description) {
        this.startPos = startPos;
        this.endPos = endPos;
        this.lexeme = Objects.requireNonNull(lexeme, "lexeme");
        this.text = text;
        this.description = description;
    }

    public int getStartPos() {
        return startPos;
    }

    public int getEndPos() {
        return endPos;
    }

    public ProgramLexeme getLexeme() {
        return lexeme;
    }

    public String getText() {
        return text;
    }

    /**
     * @return extra detail, such as the message of an {@link ProgramLexeme#ERROR} token
     */
    public String getDescription() {
        return description;
    }

    public boolean isEmphasised() {
        return emphasised;
    }

    public void setEmphasised(boolean emphasised) {
        this.emphasised = emphasised;
    }

    public boolean is(ProgramLexeme expectedLexeme, String expectedText) {
        return lexeme == expectedLexeme && Objects.equals(text, expectedText);
    }

    @Override
    public String toString() {
        return String.format("%s '%s' [%d, %d)", lexeme, text, startPos, endPos);
    }
}
