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
import me.golemcore.handoff.domain.model.CapabilityResult;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * An operation the model can invoke during a generation session. Capabilities
 * expose their JSON Schema definition to the model via function calling and
 * implement the execution logic. Instances are bound to one tenant and built
 * fresh for every loop iteration.
 */
public interface Capability {

    /**
     * Returns the definition with JSON Schema for function calling.
     *
     * @return the capability definition
     */
    CapabilityDefinition getDefinition();

    /**
     * Executes the capability with the arguments supplied by the model.
     * Recoverable problems (bad arguments, missing records) are reported as a
     * failed {@link CapabilityResult}, not as an exceptional future.
     *
     * @param parameters
     *            the execution parameters as a map
     * @return a future containing the execution result
     */
    CompletableFuture<CapabilityResult> execute(Map<String, Object> parameters);

    default String getName() {
        return getDefinition().getName();
    }
}
