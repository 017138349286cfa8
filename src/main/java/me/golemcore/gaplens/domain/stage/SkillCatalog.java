package me.golemcore.gaplens.domain.stage;

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

import me.golemcore.gaplens.port.outbound.DataProviderPort;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recognizes skill names in free text and maps any spelling to the canonical
 * one from the data provider (e.g. "react" to "React").
 */
@Component
@RequiredArgsConstructor
public class SkillCatalog {

    private final DataProviderPort dataProvider;

    /**
     * Returns the canonical skills mentioned in the text, in order of
     * appearance. Longer names win over names they contain, so "React Native"
     * does not also yield "React".
     */
    public List<String> extractSkills(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        List<String> skills = new ArrayList<>(dataProvider.getKnownSkills());
        skills.sort(Comparator.comparingInt(String::length).reversed());

        StringBuilder remaining = new StringBuilder(text);
        Map<Integer, String> found = new TreeMap<>();
        for (String skill : skills) {
            Matcher matcher = skillPattern(skill).matcher(remaining);
            if (matcher.find()) {
                found.put(matcher.start(), skill);
                for (int i = matcher.start(); i < matcher.end(); i++) {
                    remaining.setCharAt(i, ' ');
                }
            }
        }
        return List.copyOf(found.values());
    }

    public Optional<String> canonicalize(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String trimmed = name.trim();
        return dataProvider.getKnownSkills().stream()
                .filter(skill -> skill.equalsIgnoreCase(trimmed))
                .findFirst();
    }

    /**
     * Long-term store key for a skill: lowercase with every run of characters
     * other than letters and digits replaced by a dash ("CI/CD" becomes "ci-cd").
     */
    public static String keyOf(String skill) {
        String key = skill.toLowerCase(Locale.ROOT).replaceAll("[^\\p{L}\\p{N}]+", "-");
        return key.replaceAll("(^-+)|(-+$)", "");
    }

    private static Pattern skillPattern(String skill) {
        return Pattern.compile("(?<![\\p{L}\\p{N}])" + Pattern.quote(skill) + "(?![\\p{L}\\p{N}])",
                Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }
}
