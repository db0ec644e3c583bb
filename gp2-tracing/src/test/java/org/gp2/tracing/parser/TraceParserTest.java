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

import java.io.StringReader;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.gp2.tracing.graph.Mark;
import org.gp2.tracing.step.GraphChange;
import org.gp2.tracing.step.GraphChangeType;
import org.gp2.tracing.step.TraceStep;
import org.gp2.tracing.step.TraceStepType;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TraceParserTest {

    private static TraceParser parserFor(String xml) {
        return new TraceParser(new StringReader(xml));
    }

    private static List<TraceStep> parseAll(String xml) {
        List<TraceStep> steps = new ArrayList<>();
        try (TraceParser parser = parserFor(xml)) {
            TraceStep step;
            while ((step = parser.parseNextStep()) != null) {
                steps.add(step);
            }
            assertThat(parser.isParseComplete()).isTrue();
        }
        return steps;
    }

    @Test
    void shouldDecodeRuleWithMatchAndApplication() {
        List<TraceStep> steps = parseAll("<trace><rule name=\"R\">"
                + "<match success=\"true\"><node id=\"n1\"/><edge id=\"e1\"/></match>"
                + "<apply><createNode id=\"n2\" label=\"1:a\" mark=\"0\" root=\"false\"/></apply>"
                + "</rule></trace>");

        assertThat(steps).extracting(TraceStep::getType).containsExactly(
                TraceStepType.RULE, TraceStepType.RULE_MATCH, TraceStepType.RULE_APPLICATION, TraceStepType.RULE);
        assertThat(steps.get(0).isEndOfContext()).isFalse();
        assertThat(steps.get(0).getContextName()).isEqualTo("R");
        assertThat(steps.get(3).isEndOfContext()).isTrue();
        assertThat(steps.get(3).getContextName()).isEqualTo("R");

        assertThat(steps.get(1).getMorphism().nodeIds()).containsExactly("n1");
        assertThat(steps.get(1).getMorphism().edgeIds()).containsExactly("e1");

        GraphChange created = steps.get(2).getGraphChanges().get(0);
        assertThat(created.getType()).isEqualTo(GraphChangeType.ADD_NODE);
        assertThat(created.getNewNode().label().atoms()).containsExactly("1", "a");
        assertThat(created.getNewNode().label().mark()).isEqualTo(Mark.NONE);
        assertThat(created.getNewNode().root()).isFalse();
    }

    @Test
    void shouldNumberStepsInOrder() {
        List<TraceStep> steps = parseAll("<trace><loop><iteration><skip/></iteration></loop></trace>");

        assertThat(steps).extracting(TraceStep::getSequenceNumber).containsExactly(1L, 2L, 3L, 4L, 5L);
    }

    @Test
    void shouldDecodeFailedMatchWithoutChanges() {
        List<TraceStep> steps = parseAll("<trace><rule name=\"R\"><match success=\"false\"/></rule></trace>");

        assertThat(steps.get(1).getType()).isEqualTo(TraceStepType.RULE_MATCH_FAILED);
        assertThat(steps.get(1).getGraphChanges()).isEmpty();
        assertThat(steps.get(1).getMorphism().isEmpty()).isTrue();
    }

    @Test
    void shouldDecodeEveryChangeType() {
        List<TraceStep> steps = parseAll("<trace><apply>"
                + "<createNode id=\"n1\" label=\"x\" mark=\"1\" root=\"true\"/>"
                + "<createEdge id=\"e1\" source=\"n1\" target=\"n1\" label=\"\" mark=\"4\"/>"
                + "<deleteEdge id=\"e0\" source=\"n0\" target=\"n0\" label=\"7\"/>"
                + "<deleteNode id=\"n0\" label=\"1:2:3\" mark=\"3\" root=\"false\"/>"
                + "<relabelNode id=\"n1\" old=\"x\" new=\"y:z\"/>"
                + "<relabelEdge id=\"e1\" old=\"\" new=\"q\"/>"
                + "<remarkNode id=\"n1\" old=\"1\" new=\"2\"/>"
                + "<remarkEdge id=\"e1\" old=\"4\" new=\"0\"/>"
                + "<setRoot id=\"n2\"/>"
                + "<removeRoot id=\"n1\"/>"
                + "</apply></trace>");

        List<GraphChange> changes = steps.get(0).getGraphChanges();
        assertThat(changes).extracting(GraphChange::getType).containsExactly(
                GraphChangeType.ADD_NODE, GraphChangeType.ADD_EDGE, GraphChangeType.DELETE_EDGE,
                GraphChangeType.DELETE_NODE, GraphChangeType.RELABEL_NODE, GraphChangeType.RELABEL_EDGE,
                GraphChangeType.REMARK_NODE, GraphChangeType.REMARK_EDGE, GraphChangeType.SET_ROOT,
                GraphChangeType.REMOVE_ROOT);

        assertThat(changes.get(0).getNewNode().root()).isTrue();
        assertThat(changes.get(0).getNewNode().label().mark()).isEqualTo(Mark.RED);
        assertThat(changes.get(1).getNewEdge().label().atoms()).isEmpty();
        assertThat(changes.get(1).getNewEdge().label().mark()).isEqualTo(Mark.DASHED);
        assertThat(changes.get(2).getExistingEdge().source()).isEqualTo("n0");
        assertThat(changes.get(3).getExistingNode().label().atoms()).containsExactly("1", "2", "3");
        assertThat(changes.get(3).getExistingNode().label().mark()).isEqualTo(Mark.BLUE);
        assertThat(changes.get(4).getExistingNode().label().atoms()).containsExactly("x");
        assertThat(changes.get(4).getNewNode().label().atoms()).containsExactly("y", "z");
        assertThat(changes.get(6).getExistingNode().label().mark()).isEqualTo(Mark.RED);
        assertThat(changes.get(6).getNewNode().label().mark()).isEqualTo(Mark.GREEN);
        assertThat(changes.get(7).getNewEdge().label().mark()).isEqualTo(Mark.NONE);
        assertThat(changes.get(8).getExistingNode().root()).isFalse();
        assertThat(changes.get(8).getNewNode().root()).isTrue();
        assertThat(changes.get(9).getExistingNode().root()).isTrue();
        assertThat(changes.get(9).getNewNode().root()).isFalse();
    }

    @Test
    void shouldEmitLeafStepsOnceWithoutEndOfContext() {
        List<TraceStep> steps = parseAll("<trace><skip/><break></break><fail/></trace>");

        assertThat(steps).extracting(TraceStep::getType)
                .containsExactly(TraceStepType.SKIP, TraceStepType.BREAK, TraceStepType.FAIL);
        assertThat(steps).noneMatch(TraceStep::isEndOfContext);
    }

    @Test
    void shouldResolveNamesOfNestedProcedures() {
        List<TraceStep> steps = parseAll("<trace>"
                + "<procedure name=\"Main_outer\">"
                + "<procedure name=\"Main_inner\"><skip/></procedure>"
                + "<rule name=\"Main_r\"><match success=\"false\"/></rule>"
                + "</procedure></trace>");

        List<String> endNames = new ArrayList<>();
        for (TraceStep step : steps) {
            if (step.isContextExit()) {
                endNames.add(step.getContextName());
            }
        }
        assertThat(endNames).containsExactly("Main_inner", "Main_r", "Main_outer");
    }

    @Test
    void shouldDecodeBranchAndOrContexts() {
        List<TraceStep> steps = parseAll("<trace>"
                + "<if><condition><skip/></condition><then><skip/></then></if>"
                + "<or><leftBranch><skip/></leftBranch></or>"
                + "<try><condition/><else/></try>"
                + "<ruleset><rule name=\"a\"><match success=\"false\"/></rule></ruleset>"
                + "</trace>");

        assertThat(steps).extracting(TraceStep::getType).containsSubsequence(
                TraceStepType.IF_CONTEXT, TraceStepType.BRANCH_CONDITION, TraceStepType.SKIP,
                TraceStepType.BRANCH_CONDITION, TraceStepType.THEN_BRANCH, TraceStepType.SKIP,
                TraceStepType.THEN_BRANCH, TraceStepType.IF_CONTEXT, TraceStepType.OR_CONTEXT,
                TraceStepType.OR_LEFT, TraceStepType.TRY_CONTEXT, TraceStepType.ELSE_BRANCH,
                TraceStepType.RULE_SET, TraceStepType.RULE);
        long opens = steps.stream().filter(TraceStep::isContextEntry).count();
        long closes = steps.stream().filter(TraceStep::isContextExit).count();
        assertThat(opens).isEqualTo(closes);
    }

    @Test
    void shouldSkipUnknownChildrenOfApply() {
        List<TraceStep> steps = parseAll("<trace><apply>"
                + "<annotation text=\"ignored\"/><setRoot id=\"n1\"/>"
                + "</apply></trace>");

        assertThat(steps.get(0).getGraphChanges()).extracting(GraphChange::getType)
                .containsExactly(GraphChangeType.SET_ROOT);
    }

    @Test
    void shouldRejectUnknownElement() {
        try (TraceParser parser = parserFor("<trace>\n<jump/></trace>")) {
            assertThatThrownBy(parser::parseNextStep)
                    .isInstanceOf(TraceParseException.class)
                    .hasMessageContaining("Line 2")
                    .hasMessageContaining("<jump>")
                    .extracting(e -> ((TraceParseException) e).getKind())
                    .isEqualTo(TraceParseException.Kind.UNKNOWN_ELEMENT);
        }
    }

    @Test
    void shouldRejectNestedElementsInsideApply() {
        try (TraceParser parser = parserFor(
                "<trace><apply><createNode id=\"n1\"><deleteNode id=\"n2\"/></createNode></apply></trace>")) {
            assertThatThrownBy(parser::parseNextStep)
                    .isInstanceOf(TraceParseException.class)
                    .extracting(e -> ((TraceParseException) e).getKind())
                    .isEqualTo(TraceParseException.Kind.MALFORMED_LOG);
        }
    }

    @Test
    void shouldRejectChangeWithoutId() {
        try (TraceParser parser = parserFor("<trace><apply><setRoot/></apply></trace>")) {
            assertThatThrownBy(parser::parseNextStep)
                    .isInstanceOf(TraceParseException.class)
                    .hasMessageContaining("missing the id attribute");
        }
    }

    @Test
    void shouldEndCleanlyWhenTraceIsTruncated() {
        try (TraceParser parser = parserFor("<trace><rule name=\"R\"><match success=\"true\"><node id=\"n1\"/>")) {
            TraceStep first = parser.parseNextStep();

            assertThat(first.getType()).isEqualTo(TraceStepType.RULE);
            assertThat(parser.parseNextStep()).isNull();
            assertThat(parser.isParseComplete()).isTrue();
            assertThat(parser.parseNextStep()).isNull();
        }
    }

    @Test
    void shouldRejectWrongRootElement() {
        assertThatThrownBy(() -> parserFor("<program><rule name=\"R\"/></program>"))
                .isInstanceOf(TraceParseException.class)
                .hasMessageContaining("Expected a <trace> element but got <program>")
                .extracting(e -> ((TraceParseException) e).getKind())
                .isEqualTo(TraceParseException.Kind.MALFORMED_LOG);
    }

    @Test
    void shouldRejectEmptyTracefile() {
        assertThatThrownBy(() -> parserFor(""))
                .isInstanceOf(TraceParseException.class)
                .extracting(e -> ((TraceParseException) e).getKind())
                .isEqualTo(TraceParseException.Kind.MALFORMED_LOG);
    }

    @Test
    void shouldReportMissingTracefileAsStreamOpenError() {
        Path missing = Path.of("target", "does-not-exist.gptrace");

        assertThatThrownBy(() -> TraceParser.open(missing))
                .isInstanceOf(TraceParseException.class)
                .hasMessageContaining("does-not-exist.gptrace")
                .extracting(e -> ((TraceParseException) e).getKind())
                .isEqualTo(TraceParseException.Kind.STREAM_OPEN);
    }

    @Test
    void shouldReturnNullForEmptyTrace() {
        try (TraceParser parser = parserFor("<trace></trace>")) {
            assertThat(parser.parseNextStep()).isNull();
            assertThat(parser.isParseComplete()).isTrue();
            assertThat(parser.getStepCount()).isZero();
        }
    }
}
