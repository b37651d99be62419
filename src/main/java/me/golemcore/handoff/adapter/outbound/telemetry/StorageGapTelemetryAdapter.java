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
package me.golemcore.handoff.adapter.outbound.telemetry;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.handoff.domain.model.GapRecord;
import me.golemcore.handoff.port.outbound.GapTelemetryPort;
import me.golemcore.handoff.port.outbound.StoragePort;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * Appends gap records as JSON lines to
 * {@code telemetry/unmatched-requests.jsonl}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StorageGapTelemetryAdapter implements GapTelemetryPort {

    static final String DIRECTORY = "telemetry";
    static final String FILE_NAME = "unmatched-requests.jsonl";

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;

    @Override
    public CompletableFuture<Void> recordGap(GapRecord record) {
        String line;
        try {
            line = objectMapper.writeValueAsString(record) + "\n";
        } catch (JsonProcessingException e) {
            return CompletableFuture.failedFuture(new IllegalStateException("Failed to serialize gap record", e));
        }
        log.debug("[GapTelemetry] Appending gap record for customer {}", record.getTenantId());
        return storagePort.appendText(DIRECTORY, FILE_NAME, line);
    }
}
