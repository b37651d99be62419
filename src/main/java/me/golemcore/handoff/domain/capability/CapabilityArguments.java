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

import me.golemcore.handoff.domain.model.WireValues;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Typed access to model-supplied capability arguments. Violations raise
 * {@link IllegalArgumentException}, which capabilities report as failed
 * results.
 */
public final class CapabilityArguments {

    private final Map<String, Object> parameters;

    private CapabilityArguments(Map<String, Object> parameters) {
        this.parameters = parameters != null ? parameters : Collections.emptyMap();
    }

    public static CapabilityArguments of(Map<String, Object> parameters) {
        return new CapabilityArguments(parameters);
    }

    public String requireString(String name) {
        String value = optionalString(name);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " is required");
        }
        return value;
    }

    public String optionalString(String name) {
        Object value = parameters.get(name);
        if (value == null) {
            return null;
        }
        return value instanceof String ? (String) value : String.valueOf(value);
    }

    public <E extends Enum<E>> E requireEnum(String name, Class<E> type) {
        return WireValues.parse(type, requireString(name));
    }

    public <E extends Enum<E>> E optionalEnum(String name, Class<E> type, E defaultValue) {
        String value = optionalString(name);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        return WireValues.parse(type, value);
    }

    public List<String> optionalStringList(String name) {
        Object value = parameters.get(name);
        if (value == null) {
            return null;
        }
        if (!(value instanceof List<?> list)) {
            throw new IllegalArgumentException(name + " must be an array");
        }
        List<String> result = new ArrayList<>(list.size());
        for (Object item : list) {
            result.add(String.valueOf(item));
        }
        return result;
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> requireObject(String name) {
        Object value = parameters.get(name);
        if (!(value instanceof Map<?, ?>)) {
            throw new IllegalArgumentException(name + " must be an object");
        }
        return new LinkedHashMap<>((Map<String, Object>) value);
    }

    public Object raw(String name) {
        return parameters.get(name);
    }
}
