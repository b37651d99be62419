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
package me.golemcore.handoff.port.outbound;

import me.golemcore.handoff.domain.model.CustomerRecord;

import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Port for the customer workspace. Reads are snapshots; writes go through
 * {@link #update(String, UnaryOperator)} so concurrent mutations of the same
 * customer are serialized.
 */
public interface CustomerDataPort {

    Optional<CustomerRecord> findById(String customerId);

    /**
     * Applies {@code mutation} to the stored record and persists the result.
     *
     * @return the persisted record
     * @throws java.util.NoSuchElementException
     *             if the customer does not exist
     */
    CustomerRecord update(String customerId, UnaryOperator<CustomerRecord> mutation);

    /**
     * Creates or replaces a customer record.
     */
    CustomerRecord save(CustomerRecord customer);
}
