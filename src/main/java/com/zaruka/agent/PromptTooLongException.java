package com.zaruka.agent;

/**
 * The request overflowed the model's context even with all history dropped.
 */
public class PromptTooLongException extends RuntimeException {

    static final String MESSAGE = "Your request is too long for the model even without the conversation history. "
            + "Please shorten the message or disconnect some optional tools (MCP servers) and try again.";

    public PromptTooLongException(Throwable cause) {
        super(MESSAGE, cause);
    }
}
