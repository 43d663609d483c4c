package com.zaruka.shared.model;

import java.util.Objects;

/**
 * Identifies one invocable model. Immutable; the primary and its fallbacks are fixed at assistant construction.
 */
public record ProviderConfig(
    String providerId,
    String modelId,
    Credentials credentials,
    String baseUrl
) {
    public ProviderConfig {
        Objects.requireNonNull(providerId, "providerId");
        Objects.requireNonNull(modelId, "modelId");
        credentials = credentials != null ? credentials : Credentials.NONE;
    }

    public ProviderConfig(String providerId, String modelId, String apiKey) {
        this(providerId, modelId, new Credentials(apiKey, null), null);
    }

    public String label() {
        return providerId + "/" + modelId;
    }

    /**
     * Either an API key or an OAuth bearer token. Never printed.
     */
    public record Credentials(String apiKey, String authToken) {
        public static final Credentials NONE = new Credentials(null, null);

        public boolean hasAuthToken() {
            return authToken != null && !authToken.isBlank();
        }

        public boolean hasApiKey() {
            return apiKey != null && !apiKey.isBlank();
        }

        @Override
        public String toString() {
            return "Credentials[apiKey=" + (hasApiKey() ? "***" : "none")
                    + ", authToken=" + (hasAuthToken() ? "***" : "none") + "]";
        }
    }
}
