package me.golemcore.handoff.domain.service;

import me.golemcore.handoff.domain.model.AgentIdentity;
import me.golemcore.handoff.domain.model.ConversationMessage;
import me.golemcore.handoff.domain.model.GapRecord;
import me.golemcore.handoff.domain.model.TenantContext;
import me.golemcore.handoff.infrastructure.config.HandoffProperties;
import me.golemcore.handoff.port.outbound.GapTelemetryPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class GapTelemetryRecorderTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final TenantContext TENANT = TenantContext.builder().customerId("c1").userId("u1").build();
    private static final String LONG_REQUEST = "Please build a pricing calculator for my customer";

    private GapTelemetryPort telemetryPort;
    private HandoffProperties properties;
    private GapTelemetryRecorder recorder;

    @BeforeEach
    void setUp() {
        telemetryPort = mock(GapTelemetryPort.class);
        when(telemetryPort.recordGap(any())).thenReturn(CompletableFuture.completedFuture(null));
        properties = new HandoffProperties();
        recorder = new GapTelemetryRecorder(telemetryPort, properties, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void shouldRecordGapWhenOnlyReadOnlyCapabilitiesWereUsed() {
        Optional<GapRecord> gap = recorder.recordIfGap(AgentIdentity.PRODUCT_MGMT,
                List.of("handoff", "listProjects"), conversation(LONG_REQUEST), TENANT);

        assertTrue(gap.isPresent());
        ArgumentCaptor<GapRecord> captor = ArgumentCaptor.forClass(GapRecord.class);
        verify(telemetryPort).recordGap(captor.capture());
        GapRecord record = captor.getValue();
        assertEquals("c1", record.getTenantId());
        assertEquals("u1", record.getUserId());
        assertEquals(AgentIdentity.PRODUCT_MGMT, record.getAgent());
        assertEquals(LONG_REQUEST, record.getDescription());
        assertEquals(List.of("handoff", "listProjects"), record.getCapabilitiesInvoked());
        assertEquals(NOW, record.getRecordedAt());
    }

    @Test
    void shouldNotRecordWhenMutatingCapabilityWasUsed() {
        Optional<GapRecord> gap = recorder.recordIfGap(AgentIdentity.PRODUCT_MGMT,
                List.of("listProjects", "createArtifact"), conversation(LONG_REQUEST), TENANT);

        assertTrue(gap.isEmpty());
        verify(telemetryPort, never()).recordGap(any());
    }

    @Test
    void shouldNotRecordForAgentOutsideDetectionSet() {
        Optional<GapRecord> gap = recorder.recordIfGap(AgentIdentity.CUSTOMER_MGMT, List.of(),
                conversation(LONG_REQUEST), TENANT);

        assertTrue(gap.isEmpty());
        verify(telemetryPort, never()).recordGap(any());
    }

    @Test
    void shouldNotRecordShortMessages() {
        String exactlyTwenty = "12345678901234567890";

        assertTrue(recorder.recordIfGap(AgentIdentity.PRODUCT_MGMT, List.of(), conversation(exactlyTwenty), TENANT)
                .isEmpty());
        assertTrue(recorder.recordIfGap(AgentIdentity.PRODUCT_MGMT, List.of(), conversation(exactlyTwenty + "1"),
                TENANT).isPresent());
    }

    @Test
    void shouldTruncateDescription() {
        String longMessage = "x".repeat(800);

        GapRecord record = recorder.recordIfGap(AgentIdentity.PRODUCT_MGMT, List.of(), conversation(longMessage),
                TENANT).orElseThrow();

        assertEquals(500, record.getDescription().length());
    }

    @Test
    void shouldUseLastUserMessage() {
        List<ConversationMessage> conversation = List.of(
                ConversationMessage.user("An older request that is long enough"),
                ConversationMessage.assistant("answer", AgentIdentity.PRODUCT_MGMT),
                ConversationMessage.user(LONG_REQUEST),
                ConversationMessage.assistant("trailing", AgentIdentity.PRODUCT_MGMT));

        GapRecord record = recorder.recordIfGap(AgentIdentity.PRODUCT_MGMT, List.of(), conversation, TENANT)
                .orElseThrow();

        assertEquals(LONG_REQUEST, record.getDescription());
    }

    @Test
    void shouldSwallowSinkFailure() {
        when(telemetryPort.recordGap(any()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("disk full")));

        Optional<GapRecord> gap = recorder.recordIfGap(AgentIdentity.PRODUCT_MGMT, List.of(),
                conversation(LONG_REQUEST), TENANT);

        assertTrue(gap.isPresent());
    }

    @Test
    void shouldSwallowSynchronousSinkException() {
        when(telemetryPort.recordGap(any())).thenThrow(new IllegalStateException("boom"));

        Optional<GapRecord> gap = recorder.recordIfGap(AgentIdentity.PRODUCT_MGMT, List.of(),
                conversation(LONG_REQUEST), TENANT);

        assertTrue(gap.isEmpty());
    }

    private static List<ConversationMessage> conversation(String lastUserMessage) {
        return List.of(ConversationMessage.user(lastUserMessage));
    }
}
