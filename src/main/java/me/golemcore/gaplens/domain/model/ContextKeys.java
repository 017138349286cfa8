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
 * Well-known context keys shared by the shipped stages.
 */
public final class ContextKeys {

    public static final String RAW_INPUT = "raw_input";
    public static final String INTENT = "intent";
    public static final String ENTITIES = "entities";
    public static final String NORMALIZED_QUESTION = "normalized_question";
    public static final String GAP_ANALYSIS = "gap_analysis";
    public static final String RECOMMENDATIONS = "recommendations";

    public static final String PARAM_PROJECT_ID = "project_id";
    public static final String PARAM_SCOPE = "scope";

    private ContextKeys() {
    }
}
