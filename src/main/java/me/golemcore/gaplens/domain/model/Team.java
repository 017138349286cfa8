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
import java.util.Map;

/**
 * Team with members and per-skill coverage counts.
 */
public record Team(String id, String name, String department, List<String> members,
        Map<String, Integer> skillsCoverage) {

    public Team {
        members = members != null ? List.copyOf(members) : List.of();
        skillsCoverage = skillsCoverage != null ? Map.copyOf(skillsCoverage) : Map.of();
    }
}
