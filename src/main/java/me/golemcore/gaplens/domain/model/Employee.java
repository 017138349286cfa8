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
import java.util.Locale;
import java.util.Optional;

/**
 * Employee profile served by the data provider.
 */
public record Employee(String id, String name, String role, String department, List<EmployeeSkill> skills,
        double experienceYears, String availability, String upskillingCapacity) {

    public Employee {
        skills = skills != null ? List.copyOf(skills) : List.of();
    }

    public Optional<EmployeeSkill> findSkill(String skillName) {
        String wanted = skillName.toLowerCase(Locale.ROOT);
        return skills.stream()
                .filter(skill -> skill.name().toLowerCase(Locale.ROOT).equals(wanted))
                .findFirst();
    }
}
