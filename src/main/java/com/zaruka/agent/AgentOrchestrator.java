package com.zaruka.agent;

import java.util.function.Consumer;

public interface AgentOrchestrator {
    ProcessResult process(AssistantRequest request);
    ProcessResult processStream(AssistantRequest request, Consumer<String> onTextDelta);
}
