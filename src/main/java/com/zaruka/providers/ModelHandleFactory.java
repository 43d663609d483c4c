package com.zaruka.providers;

import com.zaruka.shared.model.ProviderConfig;

@FunctionalInterface
public interface ModelHandleFactory {
    ModelHandle create(ProviderConfig config);
}
