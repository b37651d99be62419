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

import me.golemcore.handoff.domain.model.AgentIdentity;
import me.golemcore.handoff.domain.model.TenantContext;

import java.util.List;

/**
 * Supplies the domain tool catalog of one agent, bound to a tenant. Exactly one
 * provider exists per {@link AgentIdentity}.
 */
public interface DomainCapabilityProvider {

    AgentIdentity getAgent();

    List<Capability> createCapabilities(TenantContext tenant);
}
