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
package me.golemcore.handoff.domain.capability;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.handoff.domain.model.AgentIdentity;
import me.golemcore.handoff.domain.model.CapabilityDefinition;
import me.golemcore.handoff.domain.model.CapabilityResult;
import me.golemcore.handoff.domain.model.HandoffPayload;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Capability that transfers the conversation to the other agent.
 *
 * <p>
 * Pure signal: it touches no data and returns a
 * {@link me.golemcore.handoff.domain.model.CapabilityResultKind#HANDOFF}
 * result carrying the {@link HandoffPayload}.
 * {@link me.golemcore.handoff.domain.loop.HandoffDetector} recognizes the result
 * in the stream, the session is cancelled and the target agent continues with
 * the payload injected into its prompt.
 *
 * <p>
 * When the target agent is the one that just handed off to the owner, the
 * description carries a warning against handing straight back.
 */
@Slf4j
public class HandoffCapability implements Capability {

    public static final String NAME = "handoff";

    private final AgentIdentity owner;
    private final AgentIdentity target;
    private final AgentIdentity previousAgent;

    public HandoffCapability(AgentIdentity owner, AgentIdentity previousAgent) {
        this.owner = owner;
        this.target = owner.other();
        this.previousAgent = previousAgent;
    }

    public AgentIdentity getTarget() {
        return target;
    }

    @Override
    public CapabilityDefinition getDefinition() {
        return CapabilityDefinition.builder()
                .name(NAME)
                .description(buildDescription())
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "reason", Map.of(
                                        "type", "string",
                                        "description", "Brief explanation of why the handoff is needed"),
                                "summary", Map.of(
                                        "type", "string",
                                        "description",
                                        "Summary of the conversation so far relevant to the next agent"),
                                "pendingRequest", Map.of(
                                        "type", "string",
                                        "description",
                                        "The specific user request that needs to be fulfilled by the other agent")),
                        "required", List.of("reason", "summary", "pendingRequest")))
                .build();
    }

    private String buildDescription() {
        String label = target.getLabel();
        StringBuilder description = new StringBuilder()
                .append("Transfer the conversation to the ").append(label).append(" Agent. ")
                .append("Use this ONLY when the user's request clearly requires the other agent's tools and capabilities. ")
                .append("Do NOT hand off for general questions you can partially address.");
        if (previousAgent == target) {
            description.append(" WARNING: The ").append(label)
                    .append(" Agent just transferred to you. Do NOT hand back unless the user explicitly changed topics.");
        }
        return description.toString();
    }

    @Override
    public CompletableFuture<CapabilityResult> execute(Map<String, Object> parameters) {
        CapabilityArguments args = CapabilityArguments.of(parameters);
        HandoffPayload payload = HandoffPayload.builder()
                .targetAgent(target)
                .fromAgent(owner)
                .reason(nullToEmpty(args.optionalString("reason")))
                .summary(nullToEmpty(args.optionalString("summary")))
                .pendingRequest(nullToEmpty(args.optionalString("pendingRequest")))
                .build();

        log.info("[Handoff] {} -> {} (reason: {})", owner.getWireValue(), target.getWireValue(),
                payload.getReason());

        return CompletableFuture.completedFuture(CapabilityResult.handoff(payload));
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
