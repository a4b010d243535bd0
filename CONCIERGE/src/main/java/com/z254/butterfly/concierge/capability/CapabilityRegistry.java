package com.z254.butterfly.concierge.capability;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only mapping from capability name to capability.
 * <p>
 * Every name in {@link CapabilityNames#ALL} has an entry, which may be absent. The general
 * capability must be present, since it is the target of every reroute and fallback.
 */
@Component
@Slf4j
public class CapabilityRegistry {

    private final Map<String, Capability> capabilities;

    @Autowired
    public CapabilityRegistry(List<Capability> capabilities) {
        this(index(capabilities));
    }

    private CapabilityRegistry(Map<String, Capability> capabilities) {
        if (capabilities.get(CapabilityNames.GENERAL) == null) {
            throw new IllegalStateException("No capability registered under '" + CapabilityNames.GENERAL + "'");
        }
        Map<String, Capability> entries = new LinkedHashMap<>();
        for (String name : CapabilityNames.ALL) {
            entries.put(name, capabilities.get(name));
        }
        capabilities.forEach((name, capability) -> {
            if (!entries.containsKey(name)) {
                entries.put(name, capability);
            }
        });
        this.capabilities = Collections.unmodifiableMap(entries);

        entries.forEach((name, capability) -> log.info("Capability[{}]: {}",
                name, capability != null ? capability.getClass().getSimpleName() : "absent"));
    }

    /**
     * Build a registry from explicit entries. Null values mark absent capabilities.
     *
     * @param capabilities name to capability
     * @return the registry
     * @throws IllegalStateException if no general capability is given
     */
    public static CapabilityRegistry of(Map<String, Capability> capabilities) {
        return new CapabilityRegistry(new LinkedHashMap<>(capabilities));
    }

    public Optional<Capability> find(String name) {
        return Optional.ofNullable(capabilities.get(name));
    }

    public Capability getGeneral() {
        return capabilities.get(CapabilityNames.GENERAL);
    }

    /**
     * All registered names, including those whose capability is absent.
     */
    public Set<String> getNames() {
        return capabilities.keySet();
    }

    private static Map<String, Capability> index(List<Capability> capabilities) {
        Map<String, Capability> byName = new LinkedHashMap<>();
        for (Capability capability : capabilities) {
            Capability previous = byName.put(capability.getName(), capability);
            if (previous != null) {
                throw new IllegalStateException("Duplicate capability '" + capability.getName() + "': "
                        + previous.getClass().getSimpleName() + " and " + capability.getClass().getSimpleName());
            }
        }
        return byName;
    }
}
