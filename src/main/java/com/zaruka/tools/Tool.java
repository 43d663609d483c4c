package com.zaruka.tools;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * An externally defined capability the model may call mid-conversation.
 * Argument validation against {@link #inputSchema()} is the implementation's job.
 * Implementations may be called concurrently.
 */
public interface Tool {
    String name();
    String description();
    JsonNode inputSchema();
    ToolResult execute(JsonNode input);
}
