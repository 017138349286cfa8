package me.golemcore.gaplens;

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
 * Main application class for GapLens.
 *
 * <p>
 * GapLens answers staffing questions ("What skills do we need for a React
 * project?") by running a fixed pipeline of reasoning stages and persisting
 * every step.
 *
 * <h2>Key Features</h2>
 * <ul>
 * <li><b>Staged workflow</b> - Perception, Analysis and Decision stages with
 * declared input/output contracts</li>
 * <li><b>Backend fallback</b> - Anthropic or OpenAI via langchain4j, with a
 * deterministic stub when credentials are missing or calls fail</li>
 * <li><b>Resumable sessions</b> - state is persisted after every stage</li>
 * <li><b>Audit trail</b> - append-only JSONL trace of every stage and backend
 * call</li>
 * </ul>
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 * Inbound            → WorkflowPort (GapLensService)
 * Domain Layer       → WorkflowEngine, Stages, BackendSelector, MemoryStore
 * Infrastructure     → Backend/Storage/Data Adapters
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under
 * {@code gaplens.*} prefix.
 *
 * @version 1.0
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class GapLensApplication {

    public static void main(String[] args) {
        SpringApplication.run(GapLensApplication.class, args);
    }

}
