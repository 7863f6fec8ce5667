package me.golemcore.coursemate.domain.component;

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

import me.golemcore.coursemate.domain.model.Source;
import me.golemcore.coursemate.domain.model.ToolDefinition;

import java.util.List;
import java.util.Map;

/**
 * Component interface for tools the LLM can call during a query run. Each tool
 * publishes a definition with a JSON Schema for its arguments and returns plain
 * text that is fed back to the model.
 *
 * <p>
 * Implementations report their own failures as text starting with
 * {@code "Error:"} instead of throwing. Tools that cite material add
 * {@link Source} entries to the per-query list passed to {@link #execute}.
 */
public interface ToolComponent {

    /**
     * Returns the tool definition with JSON Schema for function calling.
     *
     * @return the tool definition
     */
    ToolDefinition getDefinition();

    /**
     * Executes the tool.
     *
     * @param arguments
     *            arguments produced by the model, already checked for required
     *            keys
     * @param sources
     *            citation list of the current query, appended to by tools that
     *            retrieve material
     * @return text result for the model
     */
    String execute(Map<String, Object> arguments, List<Source> sources);
}
