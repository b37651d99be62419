package me.golemcore.handoff.domain.capability.product;

import me.golemcore.handoff.domain.capability.Capability;
import me.golemcore.handoff.domain.model.Artifact;
import me.golemcore.handoff.domain.model.CapabilityResult;
import me.golemcore.handoff.domain.model.CapabilityResultKind;
import me.golemcore.handoff.domain.model.CustomerEvent;
import me.golemcore.handoff.domain.model.CustomerRecord;
import me.golemcore.handoff.domain.model.Project;
import me.golemcore.handoff.domain.model.TenantContext;
import me.golemcore.handoff.port.outbound.CustomerDataPort;
import me.golemcore.handoff.testsupport.InMemoryCustomerDataPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doCallRealMethod;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.when;

class ProductCapabilitiesTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final String CUSTOMER_ID = "acme";

    private InMemoryCustomerDataPort customerData;
    private Clock clock;

    @BeforeEach
    void setUp() {
        customerData = new InMemoryCustomerDataPort();
        CustomerRecord customer = CustomerRecord.builder().id(CUSTOMER_ID).name("Acme Corp").build();
        customer.getProjects().add(Project.builder().id("p1").name("Onboarding").updatedAt(NOW).build());
        customerData.save(customer);
        clock = Clock.fixed(NOW, ZoneOffset.UTC);
    }

    @Test
    void shouldExposeWorkspaceAndAuthoringTools() {
        List<Capability> capabilities = new ProductMgmtCapabilityProvider(customerData, clock)
                .createCapabilities(TenantContext.builder().customerId(CUSTOMER_ID).build());

        Set<String> names = new HashSet<>();
        capabilities.forEach(capability -> names.add(capability.getName()));
        assertEquals(21, capabilities.size());
        assertEquals(21, names.size());
        assertTrue(names.containsAll(List.of("createProject", "createArtifact", "updateArtifact", "listProjects",
                "listArtifacts", "createProductStrategy", "prioritizeItems", "designAiFeature")));
    }

    @Test
    void shouldCreateProject() throws Exception {
        CapabilityResult result = new CreateProjectCapability(CUSTOMER_ID, customerData, clock)
                .execute(Map.of("name", "Pricing revamp", "description", "New tiers")).get();

        assertTrue(result.isSuccess());
        Project project = customerData.get(CUSTOMER_ID).getProjects().get(1);
        assertEquals("Pricing revamp", project.getName());
        assertEquals(Project.STATUS_ACTIVE, project.getStatus());
        assertEquals(NOW, project.getCreatedAt());
    }

    @Test
    void shouldCreateDraftArtifactAndLogDelivery() throws Exception {
        CapabilityResult result = new CreateArtifactCapability(CUSTOMER_ID, customerData, clock)
                .execute(Map.of("projectId", "p1", "type", "roadmap", "title", "Q3 Roadmap",
                        "content", "# Q3")).get();

        assertTrue(result.isSuccess());
        CustomerRecord customer = customerData.get(CUSTOMER_ID);
        Artifact artifact = customer.getArtifacts().get(0);
        assertEquals("roadmap", artifact.getType());
        assertEquals(Artifact.Status.DRAFT, artifact.getStatus());
        CustomerEvent event = customer.getEvents().get(0);
        assertEquals(CustomerEvent.TYPE_DELIVERY, event.getEventType());
        assertEquals("Created artifact: Q3 Roadmap", event.getTitle());
    }

    @Test
    void shouldFailArtifactForUnknownProject() throws Exception {
        CapabilityResult result = new CreateArtifactCapability(CUSTOMER_ID, customerData, clock)
                .execute(Map.of("projectId", "p-missing", "type", "roadmap", "title", "T", "content", "C")).get();

        assertEquals(CapabilityResultKind.ERROR, result.getKind());
        assertEquals("Project not found: p-missing", result.getError());
        assertTrue(customerData.get(CUSTOMER_ID).getArtifacts().isEmpty());
    }

    @Test
    void shouldAuthorArtifactWithMetadata() throws Exception {
        ArtifactAuthoringCapability capability = new ArtifactAuthoringCapability(ArtifactAuthoring.PRIORITIZE_ITEMS,
                CUSTOMER_ID, customerData, clock);

        CapabilityResult result = capability.execute(Map.of("projectId", "p1", "title", "Backlog ranking",
                "content", "# RICE", "framework", "rice")).get();

        assertTrue(result.isSuccess());
        assertEquals("prioritizeItems", capability.getName());
        CustomerRecord customer = customerData.get(CUSTOMER_ID);
        Artifact artifact = customer.getArtifacts().get(0);
        assertEquals("prioritization", artifact.getType());
        assertEquals(Map.of("framework", "rice"), artifact.getMetadata());
        assertEquals("Created prioritization: Backlog ranking", customer.getEvents().get(0).getTitle());
    }

    @Test
    void shouldKeepArtifactWhenEventLogFails() throws Exception {
        CustomerDataPort flaky = spy(customerData);
        ArtifactAuthoringCapability capability = new ArtifactAuthoringCapability(ArtifactAuthoring.SCOPE_MVP,
                CUSTOMER_ID, flaky, clock);
        // First update stores the artifact, the event write fails
        doCallRealMethod()
                .doThrow(new IllegalStateException("write failed"))
                .when(flaky).update(eq(CUSTOMER_ID), any());

        CapabilityResult result = capability.execute(Map.of("projectId", "p1", "title", "MVP", "content", "C"))
                .get();

        assertTrue(result.isSuccess());
        assertEquals(1, customerData.get(CUSTOMER_ID).getArtifacts().size());
        assertTrue(customerData.get(CUSTOMER_ID).getEvents().isEmpty());
    }

    @Test
    void shouldUpdateArtifact() throws Exception {
        customerData.get(CUSTOMER_ID).getArtifacts().add(Artifact.builder().id("a1").projectId("p1")
                .type("strategy").title("Old").content("old").build());

        CapabilityResult result = new UpdateArtifactCapability(CUSTOMER_ID, customerData, clock)
                .execute(Map.of("artifactId", "a1", "title", "New", "status", "review")).get();

        assertTrue(result.isSuccess());
        Artifact artifact = customerData.get(CUSTOMER_ID).getArtifacts().get(0);
        assertEquals("New", artifact.getTitle());
        assertEquals("old", artifact.getContent());
        assertEquals(Artifact.Status.REVIEW, artifact.getStatus());
        assertEquals(NOW, artifact.getUpdatedAt());
    }

    @Test
    void shouldReportMissingArtifact() throws Exception {
        CapabilityResult result = new UpdateArtifactCapability(CUSTOMER_ID, customerData, clock)
                .execute(Map.of("artifactId", "nope", "title", "x")).get();

        assertEquals("Artifact not found: nope", result.getError());
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldListArtifactsOfProjectNewestFirst() throws Exception {
        List<Artifact> artifacts = customerData.get(CUSTOMER_ID).getArtifacts();
        artifacts.add(Artifact.builder().id("old").projectId("p1").type("roadmap").title("Old")
                .updatedAt(NOW.minusSeconds(60)).build());
        artifacts.add(Artifact.builder().id("new").projectId("p1").type("roadmap").title("New")
                .updatedAt(NOW).build());
        artifacts.add(Artifact.builder().id("other").projectId("p2").type("roadmap").title("Other")
                .updatedAt(NOW).build());

        CapabilityResult result = new ListArtifactsCapability(CUSTOMER_ID, customerData, clock)
                .execute(Map.of("projectId", "p1")).get();

        List<Map<String, Object>> listed = (List<Map<String, Object>>) ((Map<String, Object>) result.getData())
                .get("artifacts");
        assertEquals(List.of("new", "old"), listed.stream().map(view -> view.get("id")).toList());
    }

    @Test
    void shouldFailListingForUnknownCustomer() throws Exception {
        CapabilityResult result = new ListProjectsCapability("ghost", customerData, clock).execute(Map.of()).get();

        assertEquals("Customer not found or not authorized", result.getError());
    }

    @Test
    void shouldMapMissingCustomerOnUpdateToNotFound() throws Exception {
        CustomerDataPort missing = mock(CustomerDataPort.class);
        when(missing.update(eq(CUSTOMER_ID), any())).thenThrow(new NoSuchElementException(CUSTOMER_ID));

        CapabilityResult result = new CreateProjectCapability(CUSTOMER_ID, missing, clock)
                .execute(Map.of("name", "x")).get();

        assertEquals("Customer not found or not authorized", result.getError());
    }
}
