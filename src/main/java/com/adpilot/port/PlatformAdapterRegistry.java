package com.adpilot.port;

import com.adpilot.error.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Looks up the {@link PlatformAdapter} bean of each ad platform.
 */
@Component
public class PlatformAdapterRegistry {

    private static final Logger log = LoggerFactory.getLogger(PlatformAdapterRegistry.class);

    private final Map<AdPlatform, PlatformAdapter> adapters = new EnumMap<>(AdPlatform.class);

    public PlatformAdapterRegistry(List<PlatformAdapter> adapters) {
        for (PlatformAdapter adapter : adapters) {
            PlatformAdapter existing = this.adapters.putIfAbsent(adapter.platform(), adapter);
            if (existing != null) {
                throw new IllegalStateException("Duplicate PlatformAdapter for " + adapter.platform() + ": "
                        + existing.getClass().getName() + " and " + adapter.getClass().getName());
            }
        }
        log.info("Registered platform adapters: {}", this.adapters.keySet());
    }

    /**
     * @throws ConfigurationException when no adapter is registered for the platform
     */
    public PlatformAdapter adapterFor(AdPlatform platform) {
        PlatformAdapter adapter = adapters.get(platform);
        if (adapter == null) {
            throw new ConfigurationException("No platform adapter configured for " + platform);
        }
        return adapter;
    }

    public boolean supports(AdPlatform platform) {
        return adapters.containsKey(platform);
    }
}
