package me.golemcore.gaplens.adapter.outbound.data;

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

import me.golemcore.gaplens.domain.model.Employee;
import me.golemcore.gaplens.domain.model.EmployeeSkill;
import me.golemcore.gaplens.domain.model.Project;
import me.golemcore.gaplens.domain.model.Team;
import me.golemcore.gaplens.infrastructure.config.GapLensProperties;
import me.golemcore.gaplens.port.outbound.DataProviderPort;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Serves skills data from a JSON catalog loaded once at startup.
 *
 * <p>
 * The catalog location is {@code gaplens.data.catalog-path} and may use any
 * Spring resource prefix ({@code classpath:}, {@code file:}). The bundled
 * catalog lives at {@code classpath:data/skills-catalog.json}.
 */
@Component
@Slf4j
public class CatalogDataProviderAdapter implements DataProviderPort {

    private final GapLensProperties properties;
    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;
    private volatile Catalog catalog = new Catalog();

    public CatalogDataProviderAdapter(GapLensProperties properties, ResourceLoader resourceLoader,
            ObjectMapper objectMapper) {
        this.properties = properties;
        this.resourceLoader = resourceLoader;
        this.objectMapper = objectMapper;
    }

    @PostConstruct
    public void init() {
        String location = properties.getData().getCatalogPath();
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new IllegalStateException("Skills catalog not found: " + location);
        }
        try (InputStream is = resource.getInputStream()) {
            catalog = objectMapper.readValue(is, Catalog.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read skills catalog " + location, e);
        }
        log.info("[Data] Loaded catalog {}: {} employees, {} projects, {} teams", location,
                catalog.getEmployees().size(), catalog.getProjects().size(), catalog.getTeams().size());
    }

    @Override
    public List<Employee> getEmployees() {
        return Collections.unmodifiableList(catalog.getEmployees());
    }

    @Override
    public List<Project> getProjects() {
        return Collections.unmodifiableList(catalog.getProjects());
    }

    @Override
    public Optional<Project> getProject(String projectId) {
        return catalog.getProjects().stream()
                .filter(project -> project.id().equals(projectId))
                .findFirst();
    }

    @Override
    public List<Team> getTeams() {
        return Collections.unmodifiableList(catalog.getTeams());
    }

    @Override
    public Map<String, Map<String, Object>> getSkillMarketData() {
        return Collections.unmodifiableMap(catalog.getSkillMarketData());
    }

    @Override
    public List<String> getKnownSkills() {
        // Keyed case-insensitively; the first spelling seen wins.
        Map<String, String> skills = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        for (Employee employee : catalog.getEmployees()) {
            for (EmployeeSkill skill : employee.skills()) {
                skills.putIfAbsent(skill.name(), skill.name());
            }
        }
        for (Project project : catalog.getProjects()) {
            for (String skill : project.requiredSkills()) {
                skills.putIfAbsent(skill, skill);
            }
        }
        for (String skill : catalog.getSkillMarketData().keySet()) {
            skills.putIfAbsent(skill, skill);
        }
        return List.copyOf(skills.values());
    }

    @Data
    static class Catalog {
        private List<Employee> employees = new ArrayList<>();
        private List<Project> projects = new ArrayList<>();
        private List<Team> teams = new ArrayList<>();
        private Map<String, Map<String, Object>> skillMarketData = new LinkedHashMap<>();
    }
}
