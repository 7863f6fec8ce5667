package me.golemcore.coursemate.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;
import me.golemcore.coursemate.domain.component.ToolComponent;
import me.golemcore.coursemate.domain.exception.ToolExecutionException;
import me.golemcore.coursemate.domain.exception.ToolNotFoundException;
import me.golemcore.coursemate.domain.model.Source;
import me.golemcore.coursemate.domain.model.ToolDefinition;
import me.golemcore.coursemate.infrastructure.config.CoursemateProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Name-keyed registry of the tools the LLM may call.
 *
 * <p>
 * Tools discovered as Spring beans are registered at startup in bean order.
 * Definitions are validated on registration, so a malformed schema or a
 * duplicate name fails the application context instead of a query. After
 * startup the registry is only read.
 */
@Component
@Slf4j
public class ToolRegistry {

    private static final Pattern TOOL_NAME = Pattern.compile("[a-zA-Z0-9_-]{1,64}");

    private final Map<String, ToolComponent> tools = new ConcurrentHashMap<>();
    private final CoursemateProperties properties;
    private volatile List<ToolDefinition> definitions = List.of();

    public ToolRegistry(List<ToolComponent> toolComponents, CoursemateProperties properties) {
        this.properties = properties;
        if (toolComponents != null) {
            toolComponents.forEach(this::register);
        }
    }

    /**
     * Adds a tool.
     *
     * @throws IllegalArgumentException
     *             when the definition is malformed
     * @throws IllegalStateException
     *             when a tool with the same name is already registered
     */
    public synchronized void register(ToolComponent tool) {
        ToolDefinition definition = tool.getDefinition();
        validate(definition);

        String name = definition.getName();
        if (tools.containsKey(name)) {
            throw new IllegalStateException("Tool already registered: " + name);
        }
        tools.put(name, tool);

        List<ToolDefinition> updated = new ArrayList<>(definitions);
        updated.add(definition);
        definitions = List.copyOf(updated);
        log.info("[Tools] Registered tool: {}", name);
    }

    /**
     * Definitions of all registered tools, in registration order.
     */
    public List<ToolDefinition> definitions() {
        return definitions;
    }

    /**
     * Dispatches a tool call by name.
     *
     * @return the tool's text output, including tool-reported {@code Error:}
     *         strings
     * @throws ToolNotFoundException
     *             when no tool has that name
     * @throws ToolExecutionException
     *             when required arguments are missing or the tool throws
     */
    public String execute(String name, Map<String, Object> arguments, List<Source> sources) {
        String toolName = sanitizeToolName(name);
        ToolComponent tool = toolName != null ? tools.get(toolName) : null;
        if (tool == null) {
            throw new ToolNotFoundException(name);
        }

        Map<String, Object> args = arguments != null ? arguments : Map.of();
        List<String> missing = tool.getDefinition().getRequired().stream()
                .filter(key -> args.get(key) == null)
                .toList();
        if (!missing.isEmpty()) {
            throw new ToolExecutionException(toolName,
                    "Missing required argument(s) for tool '" + toolName + "': " + String.join(", ", missing));
        }

        String output;
        try {
            output = tool.execute(args, sources);
        } catch (RuntimeException e) {
            log.error("[Tools] Tool '{}' failed", toolName, e);
            throw new ToolExecutionException(toolName,
                    "Tool '" + toolName + "' failed: " + safeCauseMessage(e), e);
        }
        return truncateToolResult(output != null ? output : "", toolName);
    }

    String truncateToolResult(String content, String toolName) {
        int maxChars = properties.getToolLoop().getMaxToolResultChars();
        if (maxChars <= 0 || content.length() <= maxChars) {
            return content;
        }

        String suffix = "\n\n[OUTPUT TRUNCATED: " + content.length() + " chars total, showing first "
                + maxChars + " chars. Try a more specific query or a course/lesson filter.]";
        int cutPoint = Math.max(0, maxChars - suffix.length());
        log.warn("[Tools] Truncating '{}' result: {} chars -> ~{} chars",
                toolName, content.length(), cutPoint + suffix.length());
        return content.substring(0, cutPoint) + suffix;
    }

    private static void validate(ToolDefinition definition) {
        if (definition == null) {
            throw new IllegalArgumentException("Tool definition is required");
        }
        String name = definition.getName();
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Tool name must not be blank");
        }
        if (!TOOL_NAME.matcher(name).matches()) {
            throw new IllegalArgumentException("Invalid tool name: " + name);
        }
        Map<String, Object> schema = definition.getInputSchema();
        if (schema == null || !"object".equals(schema.get("type"))) {
            throw new IllegalArgumentException("Input schema of tool '" + name + "' must be of type object");
        }
        Object required = schema.get("required");
        if (required != null && !(required instanceof List<?>)) {
            throw new IllegalArgumentException("'required' of tool '" + name + "' must be a list");
        }
        Map<String, Object> properties = definition.getProperties();
        for (String key : definition.getRequired()) {
            if (!properties.containsKey(key)) {
                throw new IllegalArgumentException(
                        "Tool '" + name + "' requires undeclared property '" + key + "'");
            }
        }
    }

    /**
     * Strip special tokens and garbage from tool names. Some models leak tokens
     * like {@code <|channel|>} into tool call names.
     */
    private static String sanitizeToolName(String name) {
        if (name == null) {
            return null;
        }
        String sanitized = name.replaceAll("[^a-zA-Z0-9_-].*", "");
        if (!sanitized.equals(name)) {
            log.warn("[Tools] Sanitized tool name: '{}' -> '{}'", name, sanitized);
        }
        return sanitized;
    }

    private static String safeCauseMessage(Throwable error) {
        Throwable cursor = error;
        Throwable cause = cursor.getCause();
        while (cause != null && !cause.equals(cursor)) {
            cursor = cause;
            cause = cursor.getCause();
        }

        String message = cursor.getMessage();
        if (message == null || message.isBlank()) {
            message = cursor.getClass().getSimpleName();
        }
        return message;
    }
}
