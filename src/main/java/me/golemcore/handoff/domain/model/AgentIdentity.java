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
package me.golemcore.handoff.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The two agent roles a conversation can be routed between. Attached to
 * assistant messages to record which agent authored them.
 */
public enum AgentIdentity {

    CUSTOMER_MGMT("customer_mgmt", "Customer Management"),

    PRODUCT_MGMT("product_mgmt", "Product Management");

    private final String wireValue;
    private final String label;

    AgentIdentity(String wireValue, String label) {
        this.wireValue = wireValue;
        this.label = label;
    }

    @JsonValue
    public String getWireValue() {
        return wireValue;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Returns the counterpart agent. Exactly two roles exist, so a handoff always
     * targets the other one.
     */
    public AgentIdentity other() {
        return this == CUSTOMER_MGMT ? PRODUCT_MGMT : CUSTOMER_MGMT;
    }

    /**
     * Resolves an agent from its wire value ({@code customer_mgmt},
     * {@code product_mgmt}).
     *
     * @throws IllegalArgumentException
     *             if the value names no known agent
     */
    @JsonCreator
    public static AgentIdentity fromWire(String value) {
        for (AgentIdentity identity : values()) {
            if (identity.wireValue.equals(value)) {
                return identity;
            }
        }
        throw new IllegalArgumentException("Unknown agent type: " + value);
    }
}
