package com.zaruka.shared.model;

/**
 * A tool invocation requested by the model. {@code arguments} is the raw JSON text.
 */
public record ToolCallInfo(
    String id,
    String name,
    String arguments
) {}
