package me.golemcore.coursemate.domain.model;

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

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Immutable description of a tool the LLM can call: name, description and the
 * JSON Schema of its input object.
 */
@Value
@Builder
public class ToolDefinition {

    String name;
    String description;
    Map<String, Object> inputSchema; // JSON Schema

    /**
     * Declared properties of the input schema, empty when absent.
     */
    @SuppressWarnings("unchecked")
    public Map<String, Object> getProperties() {
        if (inputSchema == null || !(inputSchema.get("properties") instanceof Map<?, ?>)) {
            return Map.of();
        }
        return (Map<String, Object>) inputSchema.get("properties");
    }

    /**
     * Names of required input properties, empty when absent.
     */
    @SuppressWarnings("unchecked")
    public List<String> getRequired() {
        if (inputSchema == null || !(inputSchema.get("required") instanceof List<?>)) {
            return List.of();
        }
        return (List<String>) inputSchema.get("required");
    }
}
