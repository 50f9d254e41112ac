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

package me.golemcore.report.domain.service;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.report.domain.model.CancellationToken;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Serializes runs per project so log appends from concurrent invocations can
 * never interleave, and tracks the active run's cancellation token.
 */
@Component
@Slf4j
public class ProjectRunCoordinator {

    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final Map<String, CancellationToken> activeRuns = new ConcurrentHashMap<>();

    /**
     * Run {@code work} while holding the project's lock, waiting for any run
     * already in progress.
     */
    public <T> T runExclusively(String project, CancellationToken token, Supplier<T> work) {
        ReentrantLock lock = locks.computeIfAbsent(project, k -> new ReentrantLock(true));
        if (lock.isLocked()) {
            log.info("[Coordinator] Waiting for the active run of '{}' to finish", project);
        }
        lock.lock();
        try {
            activeRuns.put(project, token);
            return work.get();
        } finally {
            activeRuns.remove(project, token);
            lock.unlock();
        }
    }

    /**
     * Cancel the active run of a project.
     *
     * @return false when the project has no active run
     */
    public boolean cancel(String project, String reason) {
        CancellationToken token = activeRuns.get(project);
        if (token == null) {
            return false;
        }
        log.info("[Coordinator] Cancelling run of '{}': {}", project, reason);
        token.cancel(reason);
        return true;
    }

    public boolean isRunning(String project) {
        return activeRuns.containsKey(project);
    }
}
