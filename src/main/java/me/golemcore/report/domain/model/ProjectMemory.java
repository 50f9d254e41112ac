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

import lombok.Value;

/**
 * Distilled long-term memory of a project. Fully replaced on each
 * distillation.
 */
@Value
public class ProjectMemory {

    private static final ProjectMemory EMPTY = new ProjectMemory("");

    String content;

    public static ProjectMemory of(String content) {
        return content == null || content.isBlank() ? EMPTY : new ProjectMemory(content);
    }

    public static ProjectMemory empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return content.isBlank();
    }
}
