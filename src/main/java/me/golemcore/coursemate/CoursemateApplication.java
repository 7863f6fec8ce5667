package me.golemcore.coursemate;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main entry point for the course materials assistant.
 *
 * <p>
 * Answers questions about course content by letting an LLM call retrieval
 * tools over a bounded number of rounds, then cites the material it used.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class CoursemateApplication {

    public static void main(String[] args) {
        SpringApplication.run(CoursemateApplication.class, args);
    }
}
