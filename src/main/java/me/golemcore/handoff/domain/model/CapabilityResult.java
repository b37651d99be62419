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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

/**
 * Result of a capability execution, tagged with its {@link CapabilityResultKind}.
 * Results are sent back to the model as tool messages and forwarded to the
 * caller as {@code capability-result} events, except handoff results which are
 * never forwarded.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CapabilityResult {

    CapabilityResultKind kind;
    String output;
    Object data;
    String error;
    HandoffPayload handoffPayload;

    public boolean isSuccess() {
        return kind != CapabilityResultKind.ERROR;
    }

    @JsonIgnore
    public boolean isHandoff() {
        return kind == CapabilityResultKind.HANDOFF && handoffPayload != null;
    }

    /**
     * Creates a successful result with output text.
     */
    public static CapabilityResult success(String output) {
        return CapabilityResult.builder()
                .kind(CapabilityResultKind.SUCCESS)
                .output(output)
                .build();
    }

    /**
     * Creates a successful result with output text and structured data.
     */
    public static CapabilityResult success(String output, Object data) {
        return CapabilityResult.builder()
                .kind(CapabilityResultKind.SUCCESS)
                .output(output)
                .data(data)
                .build();
    }

    /**
     * Creates a failed result. Failures are recoverable: the model sees the error
     * and the session continues.
     */
    public static CapabilityResult failure(String error) {
        return CapabilityResult.builder()
                .kind(CapabilityResultKind.ERROR)
                .error(error)
                .build();
    }

    public static CapabilityResult handoff(HandoffPayload payload) {
        return CapabilityResult.builder()
                .kind(CapabilityResultKind.HANDOFF)
                .output("Transferring to " + payload.getTargetAgent().getLabel() + " Agent")
                .handoffPayload(payload)
                .build();
    }

    /**
     * Text the model sees as the tool message for this result.
     */
    @JsonIgnore
    public String toModelText() {
        if (kind == CapabilityResultKind.ERROR) {
            return "Error: " + error;
        }
        return output != null ? output : "";
    }
}
