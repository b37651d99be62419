package me.golemcore.handoff.adapter.outbound.customer;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.handoff.adapter.outbound.storage.LocalStorageAdapter;
import me.golemcore.handoff.domain.model.ActionItem;
import me.golemcore.handoff.domain.model.CustomerRecord;
import me.golemcore.handoff.infrastructure.config.HandoffProperties;
import me.golemcore.handoff.infrastructure.config.OrchestratorConfiguration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LocalCustomerDataAdapterTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @TempDir
    Path tempDir;

    private LocalCustomerDataAdapter adapter;

    @BeforeEach
    void setUp() {
        HandoffProperties properties = new HandoffProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.toString());
        LocalStorageAdapter storage = new LocalStorageAdapter(properties);
        storage.init();
        ObjectMapper objectMapper = OrchestratorConfiguration.objectMapper();
        adapter = new LocalCustomerDataAdapter(storage, Clock.fixed(NOW, ZoneOffset.UTC), objectMapper);
    }

    @Test
    void shouldSaveAndReadBackCustomer() {
        CustomerRecord customer = CustomerRecord.builder().id("acme").name("Acme Corp")
                .status(CustomerRecord.Status.ON_HOLD).build();
        customer.getActionItems().add(ActionItem.builder().id("ai-1").type(ActionItem.Type.PROPOSAL)
                .description("Send proposal").dueDate(LocalDate.of(2026, 3, 10)).build());

        adapter.save(customer);
        CustomerRecord loaded = adapter.findById("acme").orElseThrow();

        assertEquals("Acme Corp", loaded.getName());
        assertEquals(CustomerRecord.Status.ON_HOLD, loaded.getStatus());
        assertEquals(LocalDate.of(2026, 3, 10), loaded.getActionItems().get(0).getDueDate());
        assertEquals(ActionItem.Type.PROPOSAL, loaded.getActionItems().get(0).getType());
        assertEquals(NOW, loaded.getCreatedAt());
    }

    @Test
    void shouldStoreWireValuesInJson() throws Exception {
        adapter.save(CustomerRecord.builder().id("acme").name("Acme").status(CustomerRecord.Status.ON_HOLD).build());

        String json = Files.readString(tempDir.resolve("customers").resolve("acme.json"));

        assertTrue(json.contains("\"status\":\"on_hold\""));
        assertTrue(json.contains("\"createdAt\":\"2026-03-01T10:00:00Z\""));
    }

    @Test
    void shouldApplyUpdate() {
        adapter.save(CustomerRecord.builder().id("acme").name("Acme").build());

        adapter.update("acme", customer -> {
            customer.setStatus(CustomerRecord.Status.LIVE);
            return customer;
        });

        assertEquals(CustomerRecord.Status.LIVE, adapter.findById("acme").orElseThrow().getStatus());
    }

    @Test
    void shouldReturnEmptyForUnknownCustomer() {
        assertTrue(adapter.findById("ghost").isEmpty());
    }

    @Test
    void shouldThrowWhenUpdatingUnknownCustomer() {
        assertThrows(NoSuchElementException.class, () -> adapter.update("ghost", customer -> customer));
    }

    @Test
    void shouldRejectUnsafeIds() {
        assertThrows(IllegalArgumentException.class, () -> adapter.findById("../secrets"));
        assertThrows(IllegalArgumentException.class, () -> adapter.findById(null));
    }

    @Test
    void shouldReportCorruptDocument() throws Exception {
        Files.writeString(tempDir.resolve("customers").resolve("broken.json"), "{not json");

        assertThrows(IllegalStateException.class, () -> adapter.findById("broken"));
    }

    @Test
    void shouldKeepLockCountFixedAcrossCustomers() {
        Set<Object> locks = Collections.newSetFromMap(new IdentityHashMap<>());
        for (int i = 0; i < 1_000; i++) {
            locks.add(adapter.lockFor("customer-" + i));
        }

        assertTrue(locks.size() <= LocalCustomerDataAdapter.LOCK_STRIPES);
        assertSame(adapter.lockFor("acme"), adapter.lockFor("acme"));
    }

    @Test
    void shouldNotLoseConcurrentUpdates() throws Exception {
        adapter.save(CustomerRecord.builder().id("acme").name("Acme Corp").build());
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 20; i++) {
                String itemId = "ai-" + i;
                futures.add(executor.submit(() -> adapter.update("acme", customer -> {
                    customer.getActionItems().add(ActionItem.builder().id(itemId)
                            .type(ActionItem.Type.FOLLOW_UP).description("Follow up").build());
                    return customer;
                })));
            }
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(20, adapter.findById("acme").orElseThrow().getActionItems().size());
    }
}
