package me.golemcore.agentloop;

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
 * Entry point for the agent loop service.
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal layout (Ports &amp; Adapters):
 *
 * <pre>
 * Domain Layer       → AgentLoop, TurnOrchestrator, reasoning engines, parser
 * Ports              → LlmPort, AgentStateStorePort, StatusListener
 * Infrastructure     → langchain4j LLM adapter, file/in-memory state stores
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.yml} under the {@code agent.*}
 * prefix.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class AgentLoopApplication {

    public static void main(String[] args) {
        SpringApplication.run(AgentLoopApplication.class, args);
    }

}
