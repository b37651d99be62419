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
package me.golemcore.handoff.domain.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.handoff.domain.model.AgentIdentity;
import me.golemcore.handoff.domain.model.ConversationMessage;
import me.golemcore.handoff.domain.model.GapRecord;
import me.golemcore.handoff.domain.model.TenantContext;
import me.golemcore.handoff.infrastructure.config.HandoffProperties;
import me.golemcore.handoff.port.outbound.GapTelemetryPort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Records unmatched requests: completed turns where the final agent used none
 * of its mutating capabilities although the user asked for something
 * substantial.
 *
 * <p>
 * Recording is fire-and-forget. Nothing here may fail or delay the response,
 * so every error is logged at WARN and dropped.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class GapTelemetryRecorder {

    private final GapTelemetryPort telemetryPort;
    private final HandoffProperties properties;
    private final Clock clock;

    /**
     * Evaluates the finished turn and, when it is a gap, hands a record to the
     * telemetry port without waiting for the write.
     *
     * @param capabilitiesInvoked
     *            names of every capability invoked during the request, including
     *            invocations of sessions aborted by a handoff
     * @return the record submitted, if any
     */
    public Optional<GapRecord> recordIfGap(AgentIdentity finalAgent, List<String> capabilitiesInvoked,
            List<ConversationMessage> conversation, TenantContext tenant) {
        try {
            Optional<GapRecord> gap = evaluate(finalAgent, capabilitiesInvoked, conversation, tenant);
            gap.ifPresent(this::submit);
            return gap;
        } catch (RuntimeException e) {
            log.warn("[GapTelemetry] Failed to evaluate gap for customer {}: {}", tenant.getCustomerId(),
                    e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<GapRecord> evaluate(AgentIdentity finalAgent, List<String> capabilitiesInvoked,
            List<ConversationMessage> conversation, TenantContext tenant) {
        HandoffProperties.OrchestratorProperties config = properties.getOrchestrator();
        if (!config.getGapDetectionAgents().contains(finalAgent)) {
            return Optional.empty();
        }

        Set<String> readOnly = config.getReadOnlyCapabilities();
        boolean usedMutatingCapability = capabilitiesInvoked.stream().anyMatch(name -> !readOnly.contains(name));
        if (usedMutatingCapability) {
            return Optional.empty();
        }

        String lastUserMessage = lastUserMessage(conversation);
        if (lastUserMessage.length() <= config.getGapMinMessageLength()) {
            return Optional.empty();
        }

        int maxChars = config.getGapDescriptionMaxChars();
        String description = lastUserMessage.length() > maxChars
                ? lastUserMessage.substring(0, maxChars)
                : lastUserMessage;

        return Optional.of(GapRecord.builder()
                .tenantId(tenant.getCustomerId())
                .userId(tenant.getUserId())
                .agent(finalAgent)
                .description(description)
                .capabilitiesInvoked(new ArrayList<>(capabilitiesInvoked))
                .recordedAt(clock.instant())
                .build());
    }

    private void submit(GapRecord record) {
        telemetryPort.recordGap(record).whenComplete((ignored, error) -> {
            if (error != null) {
                log.warn("[GapTelemetry] Failed to record gap for customer {}: {}", record.getTenantId(),
                        error.getMessage());
            } else {
                log.debug("[GapTelemetry] Recorded gap for customer {} ({} capabilities invoked)",
                        record.getTenantId(), record.getCapabilitiesInvoked().size());
            }
        });
    }

    private static String lastUserMessage(List<ConversationMessage> conversation) {
        for (int i = conversation.size() - 1; i >= 0; i--) {
            if (conversation.get(i).isUser()) {
                return conversation.get(i).getText();
            }
        }
        return "";
    }
}
