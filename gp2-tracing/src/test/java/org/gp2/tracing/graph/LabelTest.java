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
package org.gp2.tracing.graph;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LabelTest {

    @Test
    void shouldSplitAtomsLiterally() {
        Label label = Label.parse("1:\"a\":-3", "0");

        assertThat(label.atoms()).containsExactly("1", "\"a\"", "-3");
        assertThat(label.mark()).isEqualTo(Mark.NONE);
    }

    @Test
    void shouldTreatMissingOrEmptyLabelAsEmptyList() {
        assertThat(Label.parse(null, null)).isEqualTo(Label.EMPTY);
        assertThat(Label.parse("", null).atoms()).isEmpty();
    }

    @Test
    void shouldMapTraceMarks() {
        assertThat(Mark.fromTraceValue("1")).isEqualTo(Mark.RED);
        assertThat(Mark.fromTraceValue("2")).isEqualTo(Mark.GREEN);
        assertThat(Mark.fromTraceValue("3")).isEqualTo(Mark.BLUE);
        assertThat(Mark.fromTraceValue("4")).isEqualTo(Mark.DASHED);
        assertThat(Mark.fromTraceValue("5")).isEqualTo(Mark.NONE);
        assertThat(Mark.fromTraceValue("red")).isEqualTo(Mark.NONE);
        assertThat(Mark.fromTraceValue(null)).isEqualTo(Mark.NONE);
    }

    @Test
    void shouldPrintMarkAfterAtoms() {
        assertThat(Label.parse("a:b", "3")).hasToString("a:b#blue");
        assertThat(Label.parse("a", null)).hasToString("a");
    }
}
