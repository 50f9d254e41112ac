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

import java.util.List;

/**
 * Outcome of classifying a list of file changes.
 *
 * @param inventory
 *            every input change, in input order, with {@code significant} set
 * @param significant
 *            the subset that counts toward statistics and diffs
 * @param additions
 *            lines added over the significant subset
 * @param deletions
 *            lines removed over the significant subset
 */
public record FilteredChanges(List<FileChange> inventory, List<FileChange> significant, int additions,
        int deletions) {

    public FilteredChanges {
        inventory = List.copyOf(inventory);
        significant = List.copyOf(significant);
    }

    public List<String> excludedPaths() {
        return inventory.stream()
                .filter(change -> !change.isSignificant())
                .map(FileChange::getPath)
                .toList();
    }
}
