package me.golemcore.gaplens.port.outbound;

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
import me.golemcore.gaplens.domain.model.Project;
import me.golemcore.gaplens.domain.model.Team;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only access to organizational skills data (employees, projects, teams,
 * skill market data).
 */
public interface DataProviderPort {

    List<Employee> getEmployees();

    List<Project> getProjects();

    Optional<Project> getProject(String projectId);

    List<Team> getTeams();

    /**
     * Market information per skill (e.g., demand trend, salary range).
     */
    Map<String, Map<String, Object>> getSkillMarketData();

    /**
     * Every skill name known to the provider, in canonical spelling.
     */
    List<String> getKnownSkills();
}
