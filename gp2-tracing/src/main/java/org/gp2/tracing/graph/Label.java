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

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * A GP2 label: an ordered list of atoms plus a mark. Atoms are kept as the
 * literal substrings of the tracefile attribute.
 */
public record Label(List<String> atoms, Mark mark) {

    public static final Label EMPTY = new Label(List.of(), Mark.NONE);

    private static final String ATOM_SEPARATOR = ":";

    public Label {
        atoms = List.copyOf(atoms);
        Objects.requireNonNull(mark, "mark");
    }

    /**
     * Parses a {@code label}/{@code mark} attribute pair. The label is one or
     * more atoms joined by {@code :}; an empty or missing label is the empty list.
     */
    public static Label parse(String label, String mark) {
        if (label == null || label.isEmpty()) {
            // no atoms, not a single empty atom
            return new Label(List.of(), Mark.fromTraceValue(mark));
        }
        return new Label(Arrays.asList(label.split(ATOM_SEPARATOR, -1)), Mark.fromTraceValue(mark));
    }

    public Label withAtoms(List<String> newAtoms) {
        return new Label(newAtoms, mark);
    }

    public Label withMark(Mark newMark) {
        return new Label(atoms, newMark);
    }

    @Override
    public String toString() {
        String text = String.join(ATOM_SEPARATOR, atoms);
        return mark == Mark.NONE ? text : text + "#" + mark.getDisplayName();
    }
}
