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
package me.golemcore.handoff.domain.capability;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.handoff.domain.model.CapabilityResult;
import me.golemcore.handoff.domain.model.CustomerEvent;
import me.golemcore.handoff.domain.model.CustomerRecord;
import me.golemcore.handoff.port.outbound.CustomerDataPort;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Base class for domain capabilities bound to one customer. The customer id is
 * fixed at construction, so the model never supplies it.
 *
 * <p>
 * Argument errors and missing records are turned into failed results here;
 * anything else propagates and is reported by the generation session.
 */
@Slf4j
public abstract class AbstractCustomerCapability implements Capability {

    protected static final String CUSTOMER_NOT_FOUND = "Customer not found or not authorized";

    protected final String customerId;
    protected final CustomerDataPort customerData;
    protected final Clock clock;

    protected AbstractCustomerCapability(String customerId, CustomerDataPort customerData, Clock clock) {
        this.customerId = customerId;
        this.customerData = customerData;
        this.clock = clock;
    }

    @Override
    public final CompletableFuture<CapabilityResult> execute(Map<String, Object> parameters) {
        log.debug("[Capability] Executing {} for customer {}", getName(), customerId);
        try {
            return CompletableFuture.completedFuture(doExecute(CapabilityArguments.of(parameters)));
        } catch (IllegalArgumentException e) {
            return CompletableFuture.completedFuture(CapabilityResult.failure(e.getMessage()));
        } catch (NoSuchElementException e) {
            return CompletableFuture.completedFuture(CapabilityResult.failure(CUSTOMER_NOT_FOUND));
        }
    }

    protected abstract CapabilityResult doExecute(CapabilityArguments args);

    protected CustomerRecord requireCustomer() {
        return customerData.findById(customerId).orElseThrow(() -> new NoSuchElementException(customerId));
    }

    protected Instant now() {
        return clock.instant();
    }

    protected static String newId() {
        return UUID.randomUUID().toString();
    }

    protected CustomerEvent event(String type, String title, String description) {
        return CustomerEvent.builder()
                .id(newId())
                .eventType(type)
                .title(title)
                .description(description)
                .eventDate(now())
                .build();
    }

    /**
     * Appends an event in a separate write. A failure is logged and does not fail
     * the capability that produced the event.
     */
    protected void logEventBestEffort(CustomerEvent event) {
        try {
            customerData.update(customerId, customer -> {
                customer.getEvents().add(event);
                return customer;
            });
        } catch (RuntimeException e) {
            log.warn("[Capability] Failed to log {} event for customer {}: {}", event.getEventType(), customerId,
                    e.getMessage());
        }
    }

    protected static String abbreviate(String text, int maxLength) {
        if (text == null || text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength);
    }
}
