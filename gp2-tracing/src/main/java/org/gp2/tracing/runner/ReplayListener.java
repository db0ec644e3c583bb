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

import org.gp2.tracing.step.TraceDirection;
import org.gp2.tracing.step.TraceStep;

/**
 * Receives replay notifications from a {@link TraceRunner}. Both methods
 * default to doing nothing.
 */
public interface ReplayListener {

    /**
     * Called after a step has been replayed.
     *
     * @param step the step that was replayed
     * @param direction the direction it was replayed in
     * @param position the cursor position after the step
     */
    default void onStep(TraceStep step, TraceDirection direction, int position) {
    }

    /**
     * Called with a short notice for the user, such as a failed match or a rollback.
     */
    default void onMessage(String message) {
    }
}
