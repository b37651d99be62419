/*
 * Copyright 2026 Aleksei Kuleshov
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
 * Contact: alex@kuleshov.tech
 */
package me.golemcore.handoff.domain.model;

import lombok.Data;

/**
 * Mutable per-request state of the handoff loop. Owned and mutated exclusively
 * by {@link me.golemcore.handoff.domain.loop.HandoffLoopController}; never
 * shared between requests.
 */
@Data
public class LoopState {

    private int handoffCount;
    private AgentIdentity currentAgent;
    private AgentIdentity previousAgent;
    private HandoffPayload pendingHandoff;
    private LoopPhase phase = LoopPhase.SELECTING;

    public static LoopState start(AgentIdentity initialAgent) {
        LoopState state = new LoopState();
        state.setCurrentAgent(initialAgent);
        return state;
    }

    /**
     * Returns the pending handoff payload and clears it, so each payload is
     * injected into exactly one prompt.
     */
    public HandoffPayload consumePendingHandoff() {
        HandoffPayload payload = pendingHandoff;
        pendingHandoff = null;
        return payload;
    }

    /**
     * Applies a detected handoff: the current agent becomes the previous one,
     * the payload target becomes current and the counter advances by one.
     */
    public void recordHandoff(HandoffPayload payload) {
        previousAgent = currentAgent;
        currentAgent = payload.getTargetAgent();
        pendingHandoff = payload;
        handoffCount++;
        phase = LoopPhase.HANDING_OFF;
    }
}
