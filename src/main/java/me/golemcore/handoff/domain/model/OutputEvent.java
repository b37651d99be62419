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

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * One event of the response stream. Which fields are set depends on
 * {@link #getType()}; absent fields are omitted from the serialized form.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OutputEvent {

    public static final String FINISH_STOP = "stop";
    public static final String FINISH_TOOL_CALLS = "tool-calls";
    public static final String FINISH_MAX_STEPS = "max-steps";

    OutputEventType type;
    String text;
    String callId;
    String capabilityName;
    Map<String, Object> arguments;
    CapabilityResult result;
    String finishReason;
    Integer stepIndex;

    /** Set on {@code stream-finished} only: the agent that produced the final output. */
    AgentIdentity agent;

    public static OutputEvent textDelta(String text) {
        return OutputEvent.builder().type(OutputEventType.TEXT_DELTA).text(text).build();
    }

    public static OutputEvent invocation(String callId, String capabilityName, Map<String, Object> arguments) {
        return OutputEvent.builder()
                .type(OutputEventType.CAPABILITY_INVOCATION)
                .callId(callId)
                .capabilityName(capabilityName)
                .arguments(arguments)
                .build();
    }

    public static OutputEvent result(String callId, String capabilityName, CapabilityResult result) {
        return OutputEvent.builder()
                .type(OutputEventType.CAPABILITY_RESULT)
                .callId(callId)
                .capabilityName(capabilityName)
                .result(result)
                .build();
    }

    public static OutputEvent stepFinished(int stepIndex, String finishReason) {
        return OutputEvent.builder()
                .type(OutputEventType.STEP_FINISHED)
                .stepIndex(stepIndex)
                .finishReason(finishReason)
                .build();
    }

    public static OutputEvent streamFinished(String finishReason, AgentIdentity agent) {
        return OutputEvent.builder()
                .type(OutputEventType.STREAM_FINISHED)
                .finishReason(finishReason)
                .agent(agent)
                .build();
    }

    public boolean is(OutputEventType candidate) {
        return type == candidate;
    }
}
