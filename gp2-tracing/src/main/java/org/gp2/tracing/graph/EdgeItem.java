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

import java.util.Objects;

/**
 * Value of an edge: identity, endpoint node ids and label.
 */
public record EdgeItem(String id, String source, String target, Label label) implements GraphItem {

    public EdgeItem {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(label, "label");
    }

    public static EdgeItem ofId(String id) {
        return new EdgeItem(id, null, null, Label.EMPTY);
    }

    public EdgeItem withLabel(Label newLabel) {
        return new EdgeItem(id, source, target, newLabel);
    }
}
