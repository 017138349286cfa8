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

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Immutable audit record of one successfully executed stage. Appended to the
 * session history and never modified afterwards.
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StageRecord {

    String stageName;
    Map<String, Object> inputSnapshot;
    Map<String, Object> outputSnapshot;
    String reasoningPatternTag;
    List<String> reasoningSteps;
    Double confidence;
    String backendId;
    boolean fallbackUsed;
    Instant timestamp;
    StageError error;

    public static class StageRecordBuilder {

        public StageRecordBuilder confidence(Double confidence) {
            if (confidence != null && (confidence < 0.0 || confidence > 1.0)) {
                throw new IllegalArgumentException("Confidence must be within [0,1]: " + confidence);
            }
            this.confidence = confidence;
            return this;
        }
    }
}
