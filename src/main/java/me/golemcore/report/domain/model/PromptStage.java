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

/**
 * Pipeline stages that have their own prompt templates.
 */
public enum PromptStage {

    DIFF_MAP("diff_map"),
    SUMMARY_REDUCE("summary_reduce"),
    MEMORY_DISTILL("memory_distill"),
    ARTICLE("article");

    private final String key;

    PromptStage(String key) {
        this.key = key;
    }

    /** Template file stem. */
    public String getKey() {
        return key;
    }
}
