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
package org.gp2.tracing.runner;

import java.io.Reader;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.gp2.tracing.graph.Graph;
import org.gp2.tracing.highlight.Token;
import org.gp2.tracing.parser.TraceParser;

/**
 * Builder for a fully initialised {@link TraceRunner}. Every {@code build()}
 * starts a fresh session with its own decoder, step sequence, context stack
 * and highlight stack.
 *
 * <p>Replaying a tracefile:</p>
 * <pre>{@code
 * TraceRunner runner = TraceSessionConfiguration.builder()
 *     .tracefile(Paths.get("gp2.trace"))
 *     .graph(hostGraph)
 *     .programTokens(tokens)
 *     .listener(panel)
 *     .build();
 * }</pre>
 *
 * <p>Replaying from any reader:</p>
 * <pre>{@code
 * TraceRunner runner = TraceSessionConfiguration.builder()
 *     .reader(new StringReader(xml))
 *     .graph(new InMemoryGraph())
 *     .build();
 * }</pre>
 */
public final class TraceSessionConfiguration {

    public static final String DEFAULT_COMPILER_PREFIX = "Main_";

    private TraceSessionConfiguration() {
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {

        private SourceType sourceType;
        private Path tracefile;
        private Reader reader;
        private Graph graph;
        private List<Token> programTokens = List.of();
        private String compilerPrefix = DEFAULT_COMPILER_PREFIX;
        private final List<ReplayListener> listeners = new ArrayList<>();

        private Builder() {
        }

        public Builder tracefile(Path tracefile) {
            this.sourceType = SourceType.FILE;
            this.tracefile = tracefile;
            return this;
        }

        public Builder reader(Reader reader) {
            this.sourceType = SourceType.READER;
            this.reader = reader;
            return this;
        }

        public Builder graph(Graph graph) {
            this.graph = graph;
            return this;
        }

        public Builder programTokens(List<Token> programTokens) {
            this.programTokens = programTokens;
            return this;
        }

        public Builder compilerPrefix(String compilerPrefix) {
            this.compilerPrefix = compilerPrefix;
            return this;
        }

        public Builder listener(ReplayListener listener) {
            this.listeners.add(listener);
            return this;
        }

        public TraceRunner build() {
            if (graph == null) {
                throw new IllegalStateException("A graph is required to replay a trace");
            }
            if (sourceType == null) {
                throw new IllegalStateException("Either a tracefile or a reader is required");
            }
            TraceParser parser = switch (sourceType) {
                case FILE -> {
                    if (tracefile == null) {
                        throw new IllegalStateException("Tracefile path must not be null");
                    }
                    yield TraceParser.open(tracefile);
                }
                case READER -> {
                    if (reader == null) {
                        throw new IllegalStateException("Reader must not be null");
                    }
                    yield new TraceParser(reader);
                }
            };
            List<Token> tokens = programTokens != null ? programTokens : List.of();
            try {
                return new TraceRunner(parser, graph, tokens, compilerPrefix, listeners);
            } catch (RuntimeException e) {
                parser.close();
                throw e;
            }
        }

        private enum SourceType {
            FILE, READER
        }
    }
}
