package me.golemcore.handoff.domain.service;

import me.golemcore.handoff.domain.capability.DomainCapabilityProvider;
import me.golemcore.handoff.domain.model.AgentIdentity;
import me.golemcore.handoff.domain.model.TenantContext;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AgentCatalogTest {

    @Test
    void shouldDelegateToProviderOfAgent() {
        DomainCapabilityProvider customer = provider(AgentIdentity.CUSTOMER_MGMT);
        DomainCapabilityProvider product = provider(AgentIdentity.PRODUCT_MGMT);
        TenantContext tenant = TenantContext.builder().customerId("c1").build();
        when(product.createCapabilities(tenant)).thenReturn(List.of());

        AgentCatalog catalog = new AgentCatalog(List.of(customer, product));

        assertTrue(catalog.domainCapabilities(AgentIdentity.PRODUCT_MGMT, tenant).isEmpty());
        verify(product).createCapabilities(tenant);
    }

    @Test
    void shouldRejectMissingProvider() {
        List<DomainCapabilityProvider> providers = List.of(provider(AgentIdentity.CUSTOMER_MGMT));

        assertThrows(IllegalStateException.class, () -> new AgentCatalog(providers));
    }

    @Test
    void shouldRejectDuplicateProvider() {
        List<DomainCapabilityProvider> providers = List.of(
                provider(AgentIdentity.CUSTOMER_MGMT),
                provider(AgentIdentity.CUSTOMER_MGMT),
                provider(AgentIdentity.PRODUCT_MGMT));

        assertThrows(IllegalStateException.class, () -> new AgentCatalog(providers));
    }

    private static DomainCapabilityProvider provider(AgentIdentity agent) {
        DomainCapabilityProvider provider = mock(DomainCapabilityProvider.class);
        when(provider.getAgent()).thenReturn(agent);
        return provider;
    }
}
