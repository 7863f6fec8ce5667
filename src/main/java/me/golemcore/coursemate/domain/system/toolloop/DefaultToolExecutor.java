package me.golemcore.coursemate.domain.system.toolloop;

import me.golemcore.coursemate.domain.model.Message;
import me.golemcore.coursemate.domain.model.RunContext;
import me.golemcore.coursemate.domain.service.ToolRegistry;

/**
 * Default ToolExecutorPort implementation based on {@link ToolRegistry}.
 * Sources recorded by tools land in the run's own citation list.
 */
public class DefaultToolExecutor implements ToolExecutorPort {

    private final ToolRegistry toolRegistry;

    public DefaultToolExecutor(ToolRegistry toolRegistry) {
        this.toolRegistry = toolRegistry;
    }

    @Override
    public ToolExecutionOutcome execute(RunContext context, Message.ToolCall toolCall) {
        String content = toolRegistry.execute(toolCall.getName(), toolCall.getArguments(), context.getSources());
        return ToolExecutionOutcome.success(toolCall, content);
    }
}
