package com.autonomous.orchestrator.service;

import com.autonomous.orchestrator.exception.AgentNotFoundException;
import com.autonomous.orchestrator.model.AgentDescriptor;
import com.autonomous.orchestrator.model.AgentType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps each agent type to its descriptor. Populated once at startup, then frozen.
 */
@Slf4j
@Service
public class CapabilityRegistry {

    private final Map<AgentType, AgentDescriptor> descriptors = new ConcurrentHashMap<>();
    private volatile boolean frozen;

    public void register(AgentType type, AgentDescriptor descriptor) {
        if (frozen) {
            throw new IllegalStateException("Capability registry is frozen, cannot register " + type);
        }
        if (type == null || descriptor == null) {
            throw new IllegalArgumentException("Agent type and descriptor are required");
        }
        descriptor.setType(type);
        AgentDescriptor previous = descriptors.put(type, descriptor);
        if (previous != null) {
            log.warn("Replaced agent descriptor. type={}, previous={}, current={}",
                type, previous.getName(), descriptor.getName());
        } else {
            log.info("Registered agent. type={}, name={}, capabilities={}",
                type, descriptor.getName(), descriptor.getCapabilities().size());
        }
    }

    public AgentDescriptor resolve(AgentType type) {
        AgentDescriptor descriptor = type == null ? null : descriptors.get(type);
        if (descriptor == null) {
            throw new AgentNotFoundException(type);
        }
        return descriptor;
    }

    public Optional<AgentDescriptor> find(AgentType type) {
        return Optional.ofNullable(type == null ? null : descriptors.get(type));
    }

    public List<AgentDescriptor> list() {
        List<AgentDescriptor> all = new ArrayList<>(descriptors.values());
        all.sort((a, b) -> a.getType().compareTo(b.getType()));
        return all;
    }

    public void freeze() {
        frozen = true;
    }
}
