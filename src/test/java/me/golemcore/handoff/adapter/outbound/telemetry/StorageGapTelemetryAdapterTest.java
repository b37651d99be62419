package me.golemcore.handoff.adapter.outbound.telemetry;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.handoff.domain.model.AgentIdentity;
import me.golemcore.handoff.domain.model.GapRecord;
import me.golemcore.handoff.infrastructure.config.OrchestratorConfiguration;
import me.golemcore.handoff.port.outbound.StoragePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class StorageGapTelemetryAdapterTest {

    private StoragePort storagePort;
    private ObjectMapper objectMapper;
    private StorageGapTelemetryAdapter adapter;

    @BeforeEach
    void setUp() {
        storagePort = mock(StoragePort.class);
        when(storagePort.appendText(anyString(), anyString(), anyString()))
                .thenReturn(CompletableFuture.completedFuture(null));
        objectMapper = OrchestratorConfiguration.objectMapper();
        adapter = new StorageGapTelemetryAdapter(storagePort, objectMapper);
    }

    @Test
    void shouldAppendRecordAsJsonLine() throws Exception {
        GapRecord record = GapRecord.builder()
                .tenantId("acme")
                .userId("u1")
                .agent(AgentIdentity.PRODUCT_MGMT)
                .description("Build me a pricing calculator")
                .capabilitiesInvoked(List.of("listProjects"))
                .recordedAt(Instant.parse("2026-03-01T10:00:00Z"))
                .build();

        adapter.recordGap(record).get();

        ArgumentCaptor<String> line = ArgumentCaptor.forClass(String.class);
        verify(storagePort).appendText(eq("telemetry"), eq("unmatched-requests.jsonl"), line.capture());
        assertTrue(line.getValue().endsWith("\n"));
        assertEquals(1, line.getValue().split("\n").length);
        JsonNode json = objectMapper.readTree(line.getValue());
        assertEquals("acme", json.get("tenantId").asText());
        assertEquals("product_mgmt", json.get("agent").asText());
        assertEquals("2026-03-01T10:00:00Z", json.get("recordedAt").asText());
        assertEquals("listProjects", json.get("capabilitiesInvoked").get(0).asText());
    }
}
