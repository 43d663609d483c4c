package com.zaruka.shared.config;

import com.zaruka.shared.model.ProviderConfig;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

public record ZarukaConfig(
    ProviderConfig primary,
    List<ProviderConfig> fallbacks,
    AgentSettings agent,
    Duration workingMessagesTtl
) {
    public ZarukaConfig {
        fallbacks = fallbacks != null ? List.copyOf(fallbacks) : List.of();
    }

    /** Primary first, then fallbacks in configured order. */
    public List<ProviderConfig> attemptOrder() {
        var order = new ArrayList<ProviderConfig>();
        if (primary != null) order.add(primary);
        order.addAll(fallbacks);
        return order;
    }

    public boolean hasProvider() {
        return primary != null;
    }
}
