package me.golemcore.coursemate.domain.system.toolloop;

import me.golemcore.coursemate.domain.model.LlmResponse;
import me.golemcore.coursemate.domain.model.RunContext;

import java.util.List;

/**
 * Appends loop messages to the run's message list.
 */
public interface HistoryWriter {

    void appendAssistantToolCalls(RunContext context, LlmResponse llmResponse);

    void appendToolOutcomes(RunContext context, List<ToolExecutionOutcome> outcomes);
}
