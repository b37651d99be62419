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
package me.golemcore.handoff.adapter.outbound.customer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.handoff.domain.model.CustomerRecord;
import me.golemcore.handoff.port.outbound.CustomerDataPort;
import me.golemcore.handoff.port.outbound.StoragePort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.concurrent.CompletionException;
import java.util.function.UnaryOperator;
import java.util.regex.Pattern;
import java.util.stream.IntStream;

/**
 * Customer workspace stored as one JSON document per customer at
 * {@code customers/<customerId>.json}.
 *
 * <p>
 * Updates are read-modify-write cycles serialized per customer through a
 * fixed set of striped locks; every mutation works on a fresh copy of the
 * stored document.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LocalCustomerDataAdapter implements CustomerDataPort {

    private static final String DIRECTORY = "customers";
    private static final Pattern SAFE_ID = Pattern.compile("[A-Za-z0-9_-]{1,128}");
    static final int LOCK_STRIPES = 64;

    private final StoragePort storagePort;
    private final Clock clock;
    private final ObjectMapper objectMapper;
    private final Object[] locks = IntStream.range(0, LOCK_STRIPES).mapToObj(i -> new Object()).toArray();

    @Override
    public Optional<CustomerRecord> findById(String customerId) {
        return Optional.ofNullable(read(requireSafeId(customerId)));
    }

    @Override
    public CustomerRecord update(String customerId, UnaryOperator<CustomerRecord> mutation) {
        String id = requireSafeId(customerId);
        synchronized (lockFor(id)) {
            CustomerRecord current = read(id);
            if (current == null) {
                throw new NoSuchElementException("Customer not found: " + id);
            }
            CustomerRecord updated = mutation.apply(current);
            updated.setId(id);
            updated.setUpdatedAt(clock.instant());
            write(updated);
            return updated;
        }
    }

    @Override
    public CustomerRecord save(CustomerRecord customer) {
        String id = requireSafeId(customer.getId());
        synchronized (lockFor(id)) {
            if (customer.getCreatedAt() == null) {
                customer.setCreatedAt(clock.instant());
            }
            customer.setUpdatedAt(clock.instant());
            write(customer);
            log.debug("[Customer] Saved customer {}", id);
            return customer;
        }
    }

    private CustomerRecord read(String id) {
        String json;
        try {
            json = storagePort.getText(DIRECTORY, fileName(id)).join();
        } catch (CompletionException e) {
            throw new IllegalStateException("Failed to read customer " + id, e.getCause());
        }
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(json, CustomerRecord.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt customer document: " + id, e);
        }
    }

    private void write(CustomerRecord customer) {
        try {
            String json = objectMapper.writeValueAsString(customer);
            storagePort.putTextAtomic(DIRECTORY, fileName(customer.getId()), json).join();
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize customer " + customer.getId(), e);
        } catch (CompletionException e) {
            throw new IllegalStateException("Failed to write customer " + customer.getId(), e.getCause());
        }
    }

    // Fixed stripes: customers sharing a stripe also share its lock
    Object lockFor(String id) {
        return locks[Math.floorMod(id.hashCode(), LOCK_STRIPES)];
    }

    private static String fileName(String id) {
        return id + ".json";
    }

    private static String requireSafeId(String customerId) {
        if (customerId == null || !SAFE_ID.matcher(customerId).matches()) {
            throw new IllegalArgumentException("Invalid customer id: " + customerId);
        }
        return customerId;
    }
}
