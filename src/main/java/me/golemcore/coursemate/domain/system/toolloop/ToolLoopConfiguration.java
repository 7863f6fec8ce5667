package me.golemcore.coursemate.domain.system.toolloop;

import me.golemcore.coursemate.domain.service.ToolRegistry;
import me.golemcore.coursemate.infrastructure.config.CoursemateProperties;
import me.golemcore.coursemate.port.outbound.LlmPort;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/** Spring wiring for ToolLoopSystem (domain orchestrator + ports). */
@Configuration
public class ToolLoopConfiguration {

    @Bean
    public ToolExecutorPort toolExecutorPort(ToolRegistry toolRegistry) {
        return new DefaultToolExecutor(toolRegistry);
    }

    @Bean
    public HistoryWriter toolLoopHistoryWriter(Clock clock) {
        return new DefaultHistoryWriter(clock);
    }

    @Bean
    public ToolLoopSystem toolLoopSystem(LlmPort llmPort, ToolExecutorPort toolExecutorPort,
            HistoryWriter historyWriter, ToolRegistry toolRegistry, CoursemateProperties properties) {
        LlmPort logged = new UsageLoggingLlmPortDecorator(llmPort);
        return new DefaultToolLoopSystem(logged, toolExecutorPort, historyWriter, toolRegistry,
                properties.getLlm());
    }
}
