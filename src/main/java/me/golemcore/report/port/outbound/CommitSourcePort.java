package me.golemcore.report.port.outbound;

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

import me.golemcore.report.domain.model.Commit;
import me.golemcore.report.domain.model.CommitWindow;

import java.util.List;
import java.util.Optional;

/**
 * Port for reading repository history. Implementations cover a local work tree
 * and a hosted API; every call takes the repository location so one adapter
 * serves any number of projects.
 *
 * <p>
 * All operations block until the source answers or its timeout elapses, and
 * throw {@link me.golemcore.report.domain.exception.SourceUnavailableException}
 * on network, authentication or process failures.
 */
public interface CommitSourcePort {

    /**
     * Source type name ({@code local}, {@code github}).
     */
    String getSourceType();

    /**
     * Whether this source understands the given repository location.
     */
    boolean supports(String repository);

    /**
     * Fetch commits with per-file statistics. Order is source-defined; the
     * pipeline normalizes to oldest-first.
     */
    List<Commit> fetch(String repository, CommitWindow window);

    /**
     * Unified diff of a single commit, empty when it has none.
     */
    String fetchDiff(String repository, Commit commit);

    /**
     * README content used as background for styled articles.
     */
    Optional<String> fetchReadme(String repository);
}
