package me.golemcore.handoff.domain.capability.customer;

import me.golemcore.handoff.domain.model.ActionItem;
import me.golemcore.handoff.domain.model.CapabilityResult;
import me.golemcore.handoff.domain.model.CapabilityResultKind;
import me.golemcore.handoff.domain.model.CustomerEvent;
import me.golemcore.handoff.domain.model.CustomerRecord;
import me.golemcore.handoff.domain.model.TenantContext;
import me.golemcore.handoff.port.outbound.DomainContextPort;
import me.golemcore.handoff.testsupport.InMemoryCustomerDataPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class CustomerCapabilitiesTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final String CUSTOMER_ID = "acme";

    private InMemoryCustomerDataPort customerData;
    private Clock clock;

    @BeforeEach
    void setUp() {
        customerData = new InMemoryCustomerDataPort();
        customerData.save(CustomerRecord.builder().id(CUSTOMER_ID).name("Acme Corp").build());
        clock = Clock.fixed(NOW, ZoneOffset.UTC);
    }

    @Test
    void shouldUpdateStatusAndLogStatusChangeEvent() throws Exception {
        CapabilityResult result = new UpdateCustomerStatusCapability(CUSTOMER_ID, customerData, clock)
                .execute(Map.of("newStatus", "negotiation", "reason", "Pricing call went well")).get();

        assertTrue(result.isSuccess());
        assertEquals("Status changed from lead to negotiation", result.getOutput());
        CustomerRecord customer = customerData.get(CUSTOMER_ID);
        assertEquals(CustomerRecord.Status.NEGOTIATION, customer.getStatus());
        CustomerEvent event = customer.getEvents().get(0);
        assertEquals(CustomerEvent.TYPE_STATUS_CHANGE, event.getEventType());
        assertEquals("Status changed: lead → negotiation", event.getTitle());
        assertEquals("Pricing call went well", event.getDescription());
        assertEquals(NOW, event.getEventDate());
    }

    @Test
    void shouldRejectInvalidStatus() throws Exception {
        CapabilityResult result = new UpdateCustomerStatusCapability(CUSTOMER_ID, customerData, clock)
                .execute(Map.of("newStatus", "churned", "reason", "x")).get();

        assertEquals(CapabilityResultKind.ERROR, result.getKind());
        assertTrue(result.getError().startsWith("Invalid Status: churned"));
    }

    @Test
    void shouldFailWhenCustomerMissing() throws Exception {
        CapabilityResult result = new UpdateCustomerStatusCapability("ghost", customerData, clock)
                .execute(Map.of("newStatus", "live", "reason", "x")).get();

        assertEquals("Customer not found or not authorized", result.getError());
    }

    @Test
    void shouldMergeInfoUpdates() throws Exception {
        customerData.get(CUSTOMER_ID).setInfo(new LinkedHashMap<>(Map.of("vertical", "Retail")));

        CapabilityResult result = new UpdateCustomerInfoCapability(CUSTOMER_ID, customerData, clock)
                .execute(Map.of("updates", Map.of("persona", "Ops lead"))).get();

        assertTrue(result.isSuccess());
        Map<String, Object> info = customerData.get(CUSTOMER_ID).getInfo();
        assertEquals("Retail", info.get("vertical"));
        assertEquals("Ops lead", info.get("persona"));
    }

    @Test
    void shouldRejectEmptyInfoUpdates() throws Exception {
        CapabilityResult result = new UpdateCustomerInfoCapability(CUSTOMER_ID, customerData, clock)
                .execute(Map.of("updates", Map.of())).get();

        assertEquals(CapabilityResultKind.ERROR, result.getKind());
    }

    @Test
    void shouldLogEventWithExplicitDate() throws Exception {
        CapabilityResult result = new CreateEventLogEntryCapability(CUSTOMER_ID, customerData, clock)
                .execute(Map.of(
                        "eventType", "meeting",
                        "title", "Quarterly review",
                        "participants", List.of("Dana", "Lee"),
                        "eventDate", "2026-02-15")).get();

        assertTrue(result.isSuccess());
        CustomerEvent event = customerData.get(CUSTOMER_ID).getEvents().get(0);
        assertEquals("meeting", event.getEventType());
        assertEquals(List.of("Dana", "Lee"), event.getParticipants());
        assertEquals(Instant.parse("2026-02-15T00:00:00Z"), event.getEventDate());
    }

    @Test
    void shouldRejectUnparseableEventDate() throws Exception {
        CapabilityResult result = new CreateEventLogEntryCapability(CUSTOMER_ID, customerData, clock)
                .execute(Map.of("eventType", "call", "title", "Call", "eventDate", "last tuesday")).get();

        assertEquals("Invalid eventDate: last tuesday", result.getError());
        assertTrue(customerData.get(CUSTOMER_ID).getEvents().isEmpty());
    }

    @Test
    void shouldReturnContextAsSummary() throws Exception {
        DomainContextPort domainContext = mock(DomainContextPort.class);
        TenantContext tenant = TenantContext.builder().customerId(CUSTOMER_ID).build();
        when(domainContext.buildContext(tenant)).thenReturn("## Current Customer Context");

        CapabilityResult result = new GetCustomerSummaryCapability(tenant, customerData, domainContext, clock)
                .execute(Map.of()).get();

        assertEquals("## Current Customer Context", result.getOutput());
    }

    @Test
    void shouldCreateActionItemWithDefaultsAndLogUpdate() throws Exception {
        CapabilityResult result = new CreateActionItemCapability(CUSTOMER_ID, customerData, clock)
                .execute(Map.of("description", "Send revised proposal", "due_date", "2026-03-10")).get();

        assertTrue(result.isSuccess());
        CustomerRecord customer = customerData.get(CUSTOMER_ID);
        ActionItem item = customer.getActionItems().get(0);
        assertEquals(ActionItem.Type.FOLLOW_UP, item.getType());
        assertEquals(ActionItem.Status.TODO, item.getStatus());
        assertEquals(LocalDate.of(2026, 3, 10), item.getDueDate());
        assertEquals("Action item created: Send revised proposal", customer.getEvents().get(0).getTitle());
    }

    @Test
    void shouldRejectMalformedDueDate() throws Exception {
        CapabilityResult result = new CreateActionItemCapability(CUSTOMER_ID, customerData, clock)
                .execute(Map.of("description", "x", "due_date", "10/03/2026")).get();

        assertEquals(CapabilityResultKind.ERROR, result.getKind());
        assertTrue(customerData.get(CUSTOMER_ID).getActionItems().isEmpty());
    }

    @Test
    void shouldUpdateActionItemStatus() throws Exception {
        customerData.get(CUSTOMER_ID).getActionItems().add(ActionItem.builder()
                .id("ai-1").type(ActionItem.Type.MEETING).description("Book workshop").build());

        CapabilityResult result = new UpdateActionItemStatusCapability(CUSTOMER_ID, customerData, clock)
                .execute(Map.of("actionItemId", "ai-1", "status", "done")).get();

        assertTrue(result.isSuccess());
        assertEquals(ActionItem.Status.DONE, customerData.get(CUSTOMER_ID).getActionItems().get(0).getStatus());
        assertEquals("Action item done: Book workshop", customerData.get(CUSTOMER_ID).getEvents().get(0).getTitle());
    }

    @Test
    void shouldReportMissingActionItem() throws Exception {
        CapabilityResult result = new UpdateActionItemStatusCapability(CUSTOMER_ID, customerData, clock)
                .execute(Map.of("actionItemId", "nope", "status", "done")).get();

        assertEquals("Action item not found", result.getError());
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldListActionItemsByDueDateWithUndatedLast() throws Exception {
        List<ActionItem> items = customerData.get(CUSTOMER_ID).getActionItems();
        items.add(ActionItem.builder().id("undated").description("a").build());
        items.add(ActionItem.builder().id("late").description("b").dueDate(LocalDate.of(2026, 4, 1)).build());
        items.add(ActionItem.builder().id("early").description("c").dueDate(LocalDate.of(2026, 3, 2)).build());
        items.add(ActionItem.builder().id("closed").description("d").status(ActionItem.Status.DONE).build());

        CapabilityResult result = new ListActionItemsCapability(CUSTOMER_ID, customerData, clock)
                .execute(Map.of("status", "todo")).get();

        Map<String, Object> data = (Map<String, Object>) result.getData();
        List<Map<String, Object>> listed = (List<Map<String, Object>>) data.get("action_items");
        assertEquals(List.of("early", "late", "undated"), listed.stream().map(view -> view.get("id")).toList());
        assertEquals(3, data.get("count"));
    }
}
