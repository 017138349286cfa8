package me.golemcore.gaplens.domain.model;

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

import java.util.List;

/**
 * Demand vs. supply of one skill across projects and employees.
 */
public record SkillGap(String skill, int demand, int supply, List<String> qualifiedEmployees,
        List<String> learnerCandidates, String severity, boolean focus) {

    public static final String SEVERITY_CRITICAL = "critical";
    public static final String SEVERITY_HIGH = "high";
    public static final String SEVERITY_MEDIUM = "medium";
    public static final String SEVERITY_LOW = "low";

    public SkillGap {
        qualifiedEmployees = qualifiedEmployees != null ? List.copyOf(qualifiedEmployees) : List.of();
        learnerCandidates = learnerCandidates != null ? List.copyOf(learnerCandidates) : List.of();
    }

    public int shortfall() {
        return Math.max(0, demand - supply);
    }
}
