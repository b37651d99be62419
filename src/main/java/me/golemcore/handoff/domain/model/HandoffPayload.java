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

import lombok.Builder;
import lombok.Value;

/**
 * Structured context carried from one agent to the other when control is
 * transferred. Produced by the handoff capability, consumed once by the prompt
 * of the next iteration and then discarded.
 */
@Value
@Builder
public class HandoffPayload {

    AgentIdentity targetAgent;
    AgentIdentity fromAgent;
    String reason;
    String summary;
    String pendingRequest;
}
