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

import me.golemcore.handoff.domain.model.CapabilityDefinition;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Immutable, ordered, name-keyed collection of capabilities offered to one
 * generation session.
 */
public final class CapabilitySet {

    private final Map<String, Capability> capabilities;

    private CapabilitySet(Map<String, Capability> capabilities) {
        this.capabilities = Collections.unmodifiableMap(capabilities);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<Capability> find(String name) {
        return Optional.ofNullable(capabilities.get(name));
    }

    public boolean contains(String name) {
        return capabilities.containsKey(name);
    }

    public Set<String> names() {
        return capabilities.keySet();
    }

    public Collection<Capability> all() {
        return capabilities.values();
    }

    public List<CapabilityDefinition> definitions() {
        return capabilities.values().stream()
                .map(Capability::getDefinition)
                .collect(Collectors.toList());
    }

    public int size() {
        return capabilities.size();
    }

    public static final class Builder {

        private final Map<String, Capability> capabilities = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * @throws IllegalStateException
         *             if a capability with the same name was already added
         */
        public Builder add(Capability capability) {
            String name = capability.getName();
            if (capabilities.putIfAbsent(name, capability) != null) {
                throw new IllegalStateException("Duplicate capability name: " + name);
            }
            return this;
        }

        public Builder addAll(Collection<? extends Capability> all) {
            all.forEach(this::add);
            return this;
        }

        public CapabilitySet build() {
            return new CapabilitySet(new LinkedHashMap<>(capabilities));
        }
    }
}
