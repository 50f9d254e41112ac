package me.golemcore.report.domain.model;

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

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One line of the append-only project log. Written once per completed run and
 * never edited in place.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MemoryLogEntry {

    /** Report date, ISO-8601 ({@code yyyy-MM-dd}). */
    private String date;

    private String summary;

    private int additions;

    private int deletions;

    @JsonProperty("change_magnitude")
    private int changeMagnitude;

    private int commits;

    @JsonProperty("recorded_at")
    private Instant recordedAt;
}
