package me.golemcore.handoff.testsupport;

import me.golemcore.handoff.domain.capability.Capability;
import me.golemcore.handoff.domain.model.CapabilityDefinition;
import me.golemcore.handoff.domain.model.CapabilityResult;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Capability that returns a fixed result and records every invocation.
 */
public class RecordingCapability implements Capability {

    private final String name;
    private final CapabilityResult result;
    private final List<Map<String, Object>> invocations = Collections.synchronizedList(new ArrayList<>());

    public RecordingCapability(String name, CapabilityResult result) {
        this.name = name;
        this.result = result;
    }

    @Override
    public CapabilityDefinition getDefinition() {
        return CapabilityDefinition.simple(name, "Test capability " + name);
    }

    @Override
    public CompletableFuture<CapabilityResult> execute(Map<String, Object> parameters) {
        invocations.add(parameters);
        return CompletableFuture.completedFuture(result);
    }

    public List<Map<String, Object>> getInvocations() {
        return invocations;
    }
}
