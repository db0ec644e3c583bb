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

import java.io.FilterReader;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

import javax.xml.stream.Location;
import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;

import org.gp2.tracing.graph.EdgeItem;
import org.gp2.tracing.graph.Label;
import org.gp2.tracing.graph.NodeItem;
import org.gp2.tracing.parser.TraceParseException.Kind;
import org.gp2.tracing.step.GraphChange;
import org.gp2.tracing.step.GraphChangeType;
import org.gp2.tracing.step.TraceStep;
import org.gp2.tracing.step.TraceStepType;
import org.gp2.tracing.step.TraceSteps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decodes a GP2 tracefile into {@link TraceStep}s, one step per call, reading
 * no further into the stream than the step needs.
 *
 * <p>Usage:
 * <pre>{@code
 *   try (TraceParser parser = TraceParser.open(Path.of("program.gptrace"))) {
 *       TraceStep step;
 *       while ((step = parser.parseNextStep()) != null) {
 *           System.out.println(step);
 *       }
 *   }
 * }</pre>
 *
 * <p>A tracefile that stops in the middle of an element (the traced program was
 * killed) ends the trace cleanly. Any other XML error, an unknown element or a
 * malformed {@code <match>}/{@code <apply>} block raises a
 * {@link TraceParseException}.</p>
 */
public class TraceParser implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(TraceParser.class);

    private static final String ROOT_ELEMENT = "trace";
    private static final String MATCH_ELEMENT = "match";
    private static final String APPLY_ELEMENT = "apply";
    private static final int TRUNCATED = -1;

    private final EndTrackingReader source;
    private final XMLStreamReader xml;
    private final List<TraceStep> namedContexts = new ArrayList<>();
    private long sequenceCounter;
    private boolean parseComplete;

    public TraceParser(Reader reader) {
        this.source = new EndTrackingReader(reader);
        XMLInputFactory factory = XMLInputFactory.newFactory();
        factory.setProperty(XMLInputFactory.SUPPORT_DTD, Boolean.FALSE);
        factory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, Boolean.FALSE);
        try {
            this.xml = factory.createXMLStreamReader(source);
        } catch (XMLStreamException e) {
            throw new TraceParseException(Kind.MALFORMED_LOG,
                    "Expected a <trace> element but the tracefile could not be read: " + e.getMessage(), e);
        }
        readRootElement();
    }

    /**
     * Opens a tracefile from disk.
     *
     * @throws TraceParseException with {@link Kind#STREAM_OPEN} if the file cannot be read,
     *                             or {@link Kind#MALFORMED_LOG} if it is not a tracefile
     */
    public static TraceParser open(Path tracefile) {
        Reader reader;
        try {
            reader = Files.newBufferedReader(tracefile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new TraceParseException(Kind.STREAM_OPEN,
                    "Error reading tracefile " + tracefile + ": " + e.getMessage(), e);
        }
        try {
            return new TraceParser(reader);
        } catch (RuntimeException e) {
            try {
                reader.close();
            } catch (IOException closeFailure) {
                e.addSuppressed(closeFailure);
            }
            throw e;
        }
    }

    /**
     * Returns true once every token of the tracefile has been consumed, or the
     * tracefile was found to be truncated.
     */
    public boolean isParseComplete() {
        return parseComplete;
    }

    /**
     * Number of steps decoded so far.
     */
    public long getStepCount() {
        return sequenceCounter;
    }

    /**
     * Decodes the next step, skipping any tokens that do not produce one.
     *
     * @return the next step, or {@code null} once the end of the trace has been reached
     * @throws TraceParseException if the tracefile is malformed
     */
    public TraceStep parseNextStep() {
        while (!parseComplete) {
            int event = nextToken();
            switch (event) {
                case XMLStreamConstants.START_ELEMENT: {
                    TraceStep step = parseStartElement();
                    if (step != null) {
                        return step;
                    }
                    break;
                }
                case XMLStreamConstants.END_ELEMENT: {
                    TraceStep step = parseEndElement();
                    if (step != null) {
                        return step;
                    }
                    break;
                }
                case XMLStreamConstants.END_DOCUMENT:
                    LOG.debug("Found end of document");
                    parseComplete = true;
                    break;
                default:
                    break;
            }
        }
        return null;
    }

    @Override
    public void close() {
        try {
            xml.close();
        } catch (XMLStreamException e) {
            LOG.debug("Failed to release XML reader", e);
        }
        try {
            source.close();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to close tracefile", e);
        }
    }

    private void readRootElement() {
        try {
            while (xml.hasNext()) {
                if (xml.next() == XMLStreamConstants.START_ELEMENT) {
                    String rootName = xml.getLocalName();
                    if (!ROOT_ELEMENT.equals(rootName)) {
                        throw error(Kind.MALFORMED_LOG,
                                "Expected a <trace> element but got <" + rootName + "> instead");
                    }
                    return;
                }
            }
        } catch (XMLStreamException e) {
            throw new TraceParseException(Kind.MALFORMED_LOG, "Expected a <trace> element: " + e.getMessage(),
                    lineOf(e.getLocation()), columnOf(e.getLocation()), e);
        }
        throw new TraceParseException(Kind.MALFORMED_LOG,
                "Expected a <trace> element but got an empty tracefile", null);
    }

    /**
     * Reads the next XML token, turning an error caused by the stream ending
     * mid-element into {@link #TRUNCATED}.
     */
    private int nextToken() {
        try {
            if (!xml.hasNext()) {
                return XMLStreamConstants.END_DOCUMENT;
            }
            return xml.next();
        } catch (XMLStreamException e) {
            if (source.isTruncatedAt(e.getLocation())) {
                LOG.info("Tracefile is incomplete; parsing will end here ({})", e.getMessage());
                parseComplete = true;
                return TRUNCATED;
            }
            throw new TraceParseException(Kind.MALFORMED_LOG, e.getMessage(),
                    lineOf(e.getLocation()), columnOf(e.getLocation()), e);
        }
    }

    private TraceStep parseStartElement() {
        String name = xml.getLocalName();
        TraceStepType type = TraceStepType.fromElementName(name);
        LOG.debug("Found start element <{}>", name);

        switch (type) {
            case RULE_MATCH:
                return parseMatch();
            case RULE_APPLICATION:
                return parseApplication();
            case UNKNOWN:
                throw error(Kind.UNKNOWN_ELEMENT, "Unknown element <" + name + ">");
            default:
                if (!type.isContext()) {
                    return TraceStep.leaf(nextSequenceNumber(), type);
                }
                String contextName = null;
                if (type.isNamed()) {
                    contextName = xml.getAttributeValue(null, "name");
                    if (contextName == null) {
                        LOG.warn("<{}> at line {} has no name attribute", name, xml.getLocation().getLineNumber());
                    }
                }
                TraceStep step = TraceStep.opening(nextSequenceNumber(), type, contextName);
                if (type.isNamed()) {
                    namedContexts.add(step);
                }
                return step;
        }
    }

    private TraceStep parseEndElement() {
        String name = xml.getLocalName();
        if (ROOT_ELEMENT.equals(name)) {
            LOG.debug("Found end of trace");
            parseComplete = true;
            return null;
        }

        // Leaf elements such as <skip/> come back as a start and an end token;
        // only contexts produce an end-of-context step.
        TraceStepType type = TraceStepType.fromElementName(name);
        if (!type.isContext()) {
            return null;
        }

        LOG.debug("Found end of context <{}>", name);
        String contextName = null;
        if (type.isNamed()) {
            TraceStep opening = TraceSteps.findOpeningStep(namedContexts, namedContexts.size(), type);
            if (opening == null) {
                LOG.warn("No open <{}> matches the end element at line {}", name, xml.getLocation().getLineNumber());
            } else {
                contextName = opening.getContextName();
            }
        }
        TraceStep step = TraceStep.closing(nextSequenceNumber(), type, contextName);
        if (type.isNamed()) {
            namedContexts.add(step);
        }
        return step;
    }

    private TraceStep parseMatch() {
        boolean success = "true".equals(xml.getAttributeValue(null, "success"));
        List<GraphChange> morphism = new ArrayList<>();

        boolean complete = readFlatBlock(MATCH_ELEMENT, element -> {
            if ("node".equals(element)) {
                morphism.add(GraphChange.morphismEntry(NodeItem.ofId(requireAttribute("id"))));
            } else if ("edge".equals(element)) {
                morphism.add(GraphChange.morphismEntry(EdgeItem.ofId(requireAttribute("id"))));
            } else {
                LOG.debug("Skipping <{}> inside <match>", element);
            }
        });
        if (!complete) {
            return null;
        }

        LOG.debug("Found <match> with {} items", morphism.size());
        if (!success) {
            return TraceStep.withChanges(nextSequenceNumber(), TraceStepType.RULE_MATCH_FAILED, List.of());
        }
        return TraceStep.withChanges(nextSequenceNumber(), TraceStepType.RULE_MATCH, morphism);
    }

    private TraceStep parseApplication() {
        List<GraphChange> changes = new ArrayList<>();

        boolean complete = readFlatBlock(APPLY_ELEMENT, element -> {
            GraphChange change = parseGraphChange(element);
            if (change != null) {
                changes.add(change);
            }
        });
        if (!complete) {
            return null;
        }

        LOG.debug("Found <apply> with {} graph changes", changes.size());
        return TraceStep.withChanges(nextSequenceNumber(), TraceStepType.RULE_APPLICATION, changes);
    }

    /**
     * Consumes the children of a {@code <match>} or {@code <apply>} block up to
     * its end element. Children must be flat: one start and one end token each.
     *
     * @return false if the tracefile ended before the block was closed
     */
    private boolean readFlatBlock(String blockName, Consumer<String> childHandler) {
        boolean insideChild = false;
        while (true) {
            int event = nextToken();
            switch (event) {
                case TRUNCATED:
                    LOG.info("Dropping incomplete <{}> block", blockName);
                    return false;
                case XMLStreamConstants.START_ELEMENT:
                    if (insideChild) {
                        throw error(Kind.MALFORMED_LOG,
                                "Unexpected nested element <" + xml.getLocalName() + "> inside <" + blockName + ">");
                    }
                    insideChild = true;
                    childHandler.accept(xml.getLocalName());
                    break;
                case XMLStreamConstants.END_ELEMENT:
                    if (insideChild) {
                        insideChild = false;
                        break;
                    }
                    if (!blockName.equals(xml.getLocalName())) {
                        throw error(Kind.MALFORMED_LOG,
                                "Expected </" + blockName + "> but found </" + xml.getLocalName() + ">");
                    }
                    return true;
                case XMLStreamConstants.END_DOCUMENT:
                    throw error(Kind.MALFORMED_LOG, "Unterminated <" + blockName + "> block");
                default:
                    break;
            }
        }
    }

    private GraphChange parseGraphChange(String element) {
        GraphChangeType type = GraphChangeType.fromElementName(element);
        return switch (type) {
            case ADD_EDGE -> GraphChange.addEdge(parseEdge());
            case ADD_NODE -> GraphChange.addNode(parseNode());
            case DELETE_EDGE -> GraphChange.deleteEdge(parseEdge());
            case DELETE_NODE -> GraphChange.deleteNode(parseNode());
            case RELABEL_EDGE -> GraphChange.relabelEdge(requireAttribute("id"),
                    Label.parse(attribute("old"), null), Label.parse(attribute("new"), null));
            case RELABEL_NODE -> GraphChange.relabelNode(requireAttribute("id"),
                    Label.parse(attribute("old"), null), Label.parse(attribute("new"), null));
            case REMARK_EDGE -> GraphChange.remarkEdge(requireAttribute("id"),
                    Label.parse(null, attribute("old")), Label.parse(null, attribute("new")));
            case REMARK_NODE -> GraphChange.remarkNode(requireAttribute("id"),
                    Label.parse(null, attribute("old")), Label.parse(null, attribute("new")));
            case SET_ROOT -> GraphChange.setRoot(requireAttribute("id"));
            case REMOVE_ROOT -> GraphChange.removeRoot(requireAttribute("id"));
            default -> {
                LOG.debug("Skipping unrecognised element <{}> inside <apply>", element);
                yield null;
            }
        };
    }

    private NodeItem parseNode() {
        return new NodeItem(requireAttribute("id"),
                Label.parse(attribute("label"), attribute("mark")),
                "true".equals(attribute("root")),
                null);
    }

    private EdgeItem parseEdge() {
        return new EdgeItem(requireAttribute("id"),
                requireAttribute("source"),
                requireAttribute("target"),
                Label.parse(attribute("label"), attribute("mark")));
    }

    private String attribute(String name) {
        return xml.getAttributeValue(null, name);
    }

    private String requireAttribute(String name) {
        String value = attribute(name);
        if (value == null) {
            throw error(Kind.MALFORMED_LOG, "<" + xml.getLocalName() + "> is missing the " + name + " attribute");
        }
        return value;
    }

    private long nextSequenceNumber() {
        return ++sequenceCounter;
    }

    private TraceParseException error(Kind kind, String message) {
        Location location = xml.getLocation();
        return new TraceParseException(kind, message, lineOf(location), columnOf(location), null);
    }

    private static int lineOf(Location location) {
        return location != null ? location.getLineNumber() : -1;
    }

    private static int columnOf(Location location) {
        return location != null ? location.getColumnNumber() : -1;
    }

    /**
     * Remembers whether the underlying stream has been read to its end, so that
     * an XML error raised at that point can be told apart from a malformed file.
     */
    private static final class EndTrackingReader extends FilterReader {

        private long charsRead;
        private boolean endReached;

        EndTrackingReader(Reader in) {
            super(in);
        }

        @Override
        public int read() throws IOException {
            int c = super.read();
            if (c < 0) {
                endReached = true;
            } else {
                charsRead++;
            }
            return c;
        }

        @Override
        public int read(char[] buffer, int offset, int length) throws IOException {
            int n = super.read(buffer, offset, length);
            if (n < 0) {
                endReached = true;
            } else {
                charsRead += n;
            }
            return n;
        }

        boolean isTruncatedAt(Location location) {
            if (!endReached) {
                return false;
            }
            int offset = location != null ? location.getCharacterOffset() : -1;
            return offset < 0 || offset >= charsRead - 1;
        }
    }
}
