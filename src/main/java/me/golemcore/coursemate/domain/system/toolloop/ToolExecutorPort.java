package me.golemcore.coursemate.domain.system.toolloop;

import me.golemcore.coursemate.domain.model.Message;
import me.golemcore.coursemate.domain.model.RunContext;

/**
 * Executes a single tool call on behalf of the loop. Implementations may throw;
 * the loop turns any exception into a failed outcome.
 */
public interface ToolExecutorPort {

    ToolExecutionOutcome execute(RunContext context, Message.ToolCall toolCall);
}
