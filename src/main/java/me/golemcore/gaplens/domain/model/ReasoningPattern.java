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

/**
 * Audit labels describing the reasoning style a stage applied. Stored on stage
 * records only; never consulted by the workflow engine.
 */
public enum ReasoningPattern {

    REWOO("rewoo"), REACT("react"), COT("cot"), TOT("tot"), AGENT("agent");

    private final String tag;

    ReasoningPattern(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }
}
