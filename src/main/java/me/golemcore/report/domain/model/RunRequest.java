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

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * What a caller asks for. Null fields fall back to project settings, then to
 * global configuration.
 */
@Value
@Builder
public class RunRequest {

    /** Project alias registered in {@code projects.json}. */
    String project;

    /** Local path or remote URL; wins over the alias mapping. */
    String repoLocation;

    CommitWindow window;
    String provider;
    String style;
    AttachFormat attachFormat;

    @Singular
    List<String> recipients;

    boolean forceDistill;
}
