package me.golemcore.gaplens.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Centralized configuration properties, bound from application.properties.
 *
 * <p>
 * All configuration is organized under the {@code gaplens.*} prefix:
 * <ul>
 * <li>{@link BackendProperties} - reasoning backend selection and
 * credentials</li>
 * <li>{@link WorkflowProperties} - stage list, timeouts and worker pool</li>
 * <li>{@link StorageProperties} - workspace location</li>
 * <li>{@link MemoryProperties} - session retention</li>
 * <li>{@link DataProperties} - skills data catalog</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "gaplens")
@Data
public class GapLensProperties {

    private BackendProperties backend = new BackendProperties();
    private WorkflowProperties workflow = new WorkflowProperties();
    private StorageProperties storage = new StorageProperties();
    private MemoryProperties memory = new MemoryProperties();
    private DataProperties data = new DataProperties();

    @Data
    public static class BackendProperties {
        private String name = "anthropic";
        private double temperature = 0.2;
        private int maxTokens = 2000;
        private Map<String, ProviderProperties> providers = new HashMap<>();
    }

    @Data
    public static class ProviderProperties {
        private String apiKey;
        private String baseUrl;
        private String model;
    }

    @Data
    public static class WorkflowProperties {
        private List<String> stages = new ArrayList<>(List.of("perception", "analysis", "decision"));
        private long stageTimeoutMs = 30_000;
        private int workerThreads = 4;
    }

    @Data
    public static class StorageProperties {
        private String basePath = "${user.home}/.gaplens/workspace";
    }

    @Data
    public static class MemoryProperties {
        private int sessionRetentionDays = 30;
        private boolean retentionCleanupEnabled = true;
    }

    @Data
    public static class DataProperties {
        private String catalogPath = "classpath:data/skills-catalog.json";
    }
}
