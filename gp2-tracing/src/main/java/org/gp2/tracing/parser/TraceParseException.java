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
package org.gp2.tracing.parser;

/**
 * Raised when a tracefile cannot be opened or decoded. Decode failures are
 * fatal to the session that hit them.
 */
public class TraceParseException extends RuntimeException {

    public enum Kind {
        /** The tracefile could not be opened or read. */
        STREAM_OPEN,
        /** Missing or wrong root element, or a malformed match/apply block. */
        MALFORMED_LOG,
        /** An element name with no step type. */
        UNKNOWN_ELEMENT
    }

    private final Kind kind;
    private final int lineNumber;
    private final int columnNumber;

    public TraceParseException(Kind kind, String message, Throwable cause) {
        this(kind, message, -1, -1, cause);
    }

    public TraceParseException(Kind kind, String message, int lineNumber, int columnNumber, Throwable cause) {
        super(format(message, lineNumber, columnNumber), cause);
        this.kind = kind;
        this.lineNumber = lineNumber;
        this.columnNumber = columnNumber;
    }

    public Kind getKind() {
        return kind;
    }

    public int getLineNumber() {
        return lineNumber;
    }

    public int getColumnNumber() {
        return columnNumber;
    }

    private static String format(String message, int line, int column) {
        if (line < 0) {
            return message;
        }
        return String.format("Line %d, column %d: %s", line, column, message);
    }
}
