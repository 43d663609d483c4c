package com.zaruka.providers;

import java.util.function.Consumer;

/**
 * An invocable model bound to one {@link com.zaruka.shared.model.ProviderConfig}.
 * Each call is a single round; the agent drives the tool loop.
 */
public interface ModelHandle {
    String providerId();
    String modelId();

    ModelResponse chat(ModelRequest request);

    /**
     * Same as {@link #chat} but hands every non-empty text fragment to
     * {@code onTextDelta} on the calling thread, in arrival order.
     */
    ModelResponse chatStream(ModelRequest request, Consumer<String> onTextDelta);
}
