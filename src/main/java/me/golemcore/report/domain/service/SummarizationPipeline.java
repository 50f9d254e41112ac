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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.report.domain.exception.LlmProviderException;
import me.golemcore.report.domain.exception.SummarizationFailedException;
import me.golemcore.report.domain.model.CancellationToken;
import me.golemcore.report.domain.model.Commit;
import me.golemcore.report.domain.model.DailySummary;
import me.golemcore.report.domain.model.DiffPrompt;
import me.golemcore.report.domain.model.DiffSummary;
import me.golemcore.report.domain.model.PipelineSettings;
import me.golemcore.report.domain.model.ReducePrompt;
import me.golemcore.report.domain.model.RunContext;
import me.golemcore.report.domain.model.RunDiagnostic;
import me.golemcore.report.domain.model.RunStage;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Two-phase summarization of a run's commits.
 *
 * <p>
 * <b>Map</b>: every commit with significant changes and a non-empty filtered
 * diff is summarized independently on a bounded per-run worker pool. A failed
 * item becomes a placeholder plus a diagnostic and never fails the run. When
 * the Map deadline passes or the run is cancelled, no further provider calls
 * are started, in-flight calls get a grace period, and whatever finished is
 * kept. Results are returned in chronological commit order regardless of
 * completion order.
 *
 * <p>
 * <b>Reduce</b>: one call over the ordered Map outputs, statistics and prior
 * memory. Transient provider failures are retried with exponential backoff;
 * exhausting the budget raises {@link SummarizationFailedException}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SummarizationPipeline {

    private static final long POLL_NANOS = TimeUnit.MILLISECONDS.toNanos(200);
    private static final AtomicInteger POOL_SEQUENCE = new AtomicInteger();

    private final ChangeFilter changeFilter;
    private final Clock clock;

    /**
     * Ordered Map outputs and the diagnostics of failed or cancelled items.
     */
    public record MapPhaseResult(List<DiffSummary> summaries, List<RunDiagnostic> diagnostics) {

        public long successCount() {
            return summaries.stream().filter(s -> s.getStatus() == DiffSummary.Status.SUMMARIZED).count();
        }

        public long degradedCount() {
            return summaries.stream().filter(DiffSummary::isDegraded).count();
        }
    }

    private record MapItem(DiffSummary summary, String error) {
    }

    // ==================== MAP ====================

    /**
     * @param commits
     *            commits of the run, oldest first
     */
    public MapPhaseResult map(RunContext context, List<Commit> commits) {
        List<Integer> mappable = new ArrayList<>();
        for (int i = 0; i < commits.size(); i++) {
            Commit commit = commits.get(i);
            if (commit.isMerge()) {
                log.debug("[Pipeline] Skipping merge commit {}", commit.getShortId());
            } else if (changeFilter.filter(commit.getChanges()).significant().isEmpty()) {
                log.debug("[Pipeline] Skipping commit {} without significant changes", commit.getShortId());
            } else {
                mappable.add(i);
            }
        }
        if (mappable.isEmpty()) {
            log.info("[Pipeline] Nothing to map");
            return new MapPhaseResult(Collections.emptyList(), Collections.emptyList());
        }

        PipelineSettings settings = context.getSettings();
        CancellationToken token = context.getCancellationToken();
        int threads = Math.max(1, Math.min(settings.getMapConcurrency(), mappable.size()));
        log.info("[Pipeline] Map phase: {} commit(s), concurrency {}", mappable.size(), threads);

        ExecutorService pool = newPool(threads);
        try {
            List<Future<MapItem>> futures = new ArrayList<>(mappable.size());
            for (int index : mappable) {
                Commit commit = commits.get(index);
                futures.add(pool.submit(() -> mapOne(context, index, commit)));
            }
            pool.shutdown();

            MapAwait await = new MapAwait(token, System.nanoTime() + settings.getMapTimeout().toNanos(),
                    settings.getMapGracePeriod().toNanos());
            List<DiffSummary> summaries = new ArrayList<>();
            List<RunDiagnostic> diagnostics = new ArrayList<>();
            for (int i = 0; i < futures.size(); i++) {
                int index = mappable.get(i);
                MapItem item = await.get(futures.get(i), index, commits.get(index));
                if (item == null) {
                    continue;
                }
                summaries.add(item.summary());
                if (item.error() != null) {
                    diagnostics.add(diagnosticFor(item));
                }
            }
            log.info("[Pipeline] Map phase done: {} summarized, {} degraded",
                    summaries.stream().filter(s -> s.getStatus() == DiffSummary.Status.SUMMARIZED).count(),
                    diagnostics.size());
            return new MapPhaseResult(List.copyOf(summaries), List.copyOf(diagnostics));
        } finally {
            pool.shutdownNow();
        }
    }

    private MapItem mapOne(RunContext context, int index, Commit commit) {
        if (context.getCancellationToken().isCancelled()) {
            return new MapItem(DiffSummary.placeholder(index, commit, DiffSummary.Status.CANCELLED),
                    "not started: " + context.getCancellationToken().getReason());
        }
        try {
            String diff = changeFilter.filterDiff(
                    context.getCommitSource().fetchDiff(context.getRepository(), commit));
            if (diff.isBlank()) {
                return null;
            }
            int maxChars = context.getSettings().getMaxDiffChars();
            if (diff.length() > maxChars) {
                log.info("[Pipeline] Diff of {} too large ({} chars), not summarized", commit.getShortId(),
                        diff.length());
                return new MapItem(summary(index, commit,
                        "(diff too large to summarize: " + diff.length() + " chars)", DiffSummary.Status.SKIPPED),
                        null);
            }
            String text = context.getLlm().summarizeDiff(DiffPrompt.builder()
                    .style(context.getStyle())
                    .commit(commit)
                    .diffText(diff)
                    .build());
            return new MapItem(summary(index, commit, text, DiffSummary.Status.SUMMARIZED), null);
        } catch (RuntimeException e) { // NOSONAR - one commit must not abort the phase
            log.warn("[Pipeline] Map failed for commit {}: {}", commit.getShortId(), e.getMessage());
            return new MapItem(DiffSummary.placeholder(index, commit, DiffSummary.Status.FAILED), e.getMessage());
        }
    }

    private static DiffSummary summary(int index, Commit commit, String text, DiffSummary.Status status) {
        return DiffSummary.builder()
                .index(index)
                .commitId(commit.getShortId())
                .author(commit.getAuthor())
                .message(commit.getMessage())
                .text(text)
                .status(status)
                .build();
    }

    private static RunDiagnostic diagnosticFor(MapItem item) {
        boolean cancelled = item.summary().getStatus() == DiffSummary.Status.CANCELLED;
        return RunDiagnostic.builder()
                .stage(RunStage.MAPPING)
                .code(cancelled ? RunDiagnostic.Code.MAP_ITEM_CANCELLED : RunDiagnostic.Code.MAP_ITEM_FAILED)
                .subject(item.summary().getCommitId())
                .message(item.error())
                .build();
    }

    private static ExecutorService newPool(int threads) {
        int poolId = POOL_SEQUENCE.incrementAndGet();
        AtomicInteger threadSequence = new AtomicInteger();
        return Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "report-map-" + poolId + "-" + threadSequence.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Collects Map futures against the run deadline. The first wait that sees
     * the deadline passed, or the token cancelled, cancels the token and opens
     * the grace window for everything still in flight.
     */
    private static final class MapAwait {

        private final CancellationToken token;
        private final long deadline;
        private final long graceNanos;
        private Long graceDeadline;

        private MapAwait(CancellationToken token, long deadline, long graceNanos) {
            this.token = token;
            this.deadline = deadline;
            this.graceNanos = graceNanos;
        }

        MapItem get(Future<MapItem> future, int index, Commit commit) {
            while (true) {
                if (future.isDone()) {
                    return collect(future, index, commit);
                }
                long now = System.nanoTime();
                if (!token.isCancelled() && now - deadline >= 0) {
                    token.cancel("map deadline exceeded");
                    log.warn("[Pipeline] Map deadline exceeded, awaiting in-flight calls");
                }
                if (token.isCancelled() && graceDeadline == null) {
                    graceDeadline = now + graceNanos;
                }
                long until = graceDeadline != null ? graceDeadline : deadline;
                long remaining = until - now;
                if (remaining <= 0) {
                    future.cancel(true);
                    return new MapItem(DiffSummary.placeholder(index, commit, DiffSummary.Status.CANCELLED),
                            "abandoned after grace period: " + token.getReason());
                }
                try {
                    return future.get(Math.min(remaining, POLL_NANOS), TimeUnit.NANOSECONDS);
                } catch (TimeoutException e) {
                    log.trace("[Pipeline] Still waiting for commit {}", commit.getShortId());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    token.cancel("interrupted");
                    future.cancel(true);
                    return new MapItem(DiffSummary.placeholder(index, commit, DiffSummary.Status.CANCELLED),
                            "interrupted");
                } catch (ExecutionException | CancellationException e) {
                    return failed(index, commit, e);
                }
            }
        }

        private MapItem collect(Future<MapItem> future, int index, Commit commit) {
            try {
                return future.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return new MapItem(DiffSummary.placeholder(index, commit, DiffSummary.Status.CANCELLED),
                        "interrupted");
            } catch (ExecutionException | CancellationException e) {
                return failed(index, commit, e);
            }
        }

        private MapItem failed(int index, Commit commit, Exception e) {
            boolean cancelled = e instanceof CancellationException;
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            return new MapItem(DiffSummary.placeholder(index, commit,
                    cancelled ? DiffSummary.Status.CANCELLED : DiffSummary.Status.FAILED),
                    String.valueOf(cause.getMessage()));
        }
    }

    // ==================== REDUCE ====================

    /**
     * Produce the daily summary, retrying transient provider failures.
     *
     * @throws SummarizationFailedException
     *             when no attempt succeeds
     */
    public DailySummary reduce(RunContext context, ReducePrompt prompt) {
        PipelineSettings settings = context.getSettings();
        int maxAttempts = Math.max(1, settings.getReduceMaxAttempts());
        RuntimeException lastError = null;
        int attempt = 0;

        while (attempt < maxAttempts) {
            attempt++;
            try {
                String text = context.getLlm().reduceSummaries(prompt);
                if (text == null || text.isBlank()) {
                    throw new LlmProviderException(context.getProviderId(), LlmErrorClassifier.EMPTY_RESPONSE,
                            "Reduce returned no text");
                }
                log.info("[Pipeline] Reduce succeeded on attempt {}/{}", attempt, maxAttempts);
                return DailySummary.builder()
                        .date(LocalDate.now(clock))
                        .text(text.strip())
                        .stats(prompt.getStats())
                        .summarizedCommits((int) prompt.getDiffSummaries().stream()
                                .filter(s -> s.getStatus() == DiffSummary.Status.SUMMARIZED).count())
                        .degradedCommits((int) prompt.getDiffSummaries().stream()
                                .filter(DiffSummary::isDegraded).count())
                        .build();
            } catch (RuntimeException e) { // NOSONAR - classified below
                lastError = e;
                String code = e instanceof LlmProviderException lpe
                        ? lpe.getCode()
                        : LlmErrorClassifier.classifyFromThrowable(e);
                if (!LlmErrorClassifier.isTransientCode(code) || attempt >= maxAttempts) {
                    log.error("[Pipeline] Reduce failed on attempt {}/{} ({}): {}", attempt, maxAttempts, code,
                            e.getMessage());
                    break;
                }
                long backoffMs = (long) (settings.getReduceInitialBackoff().toMillis()
                        * Math.pow(settings.getReduceBackoffMultiplier(), attempt - 1.0));
                log.warn("[Pipeline] Reduce transient failure ({}), attempt {}/{}, retrying in {}ms", code,
                        attempt, maxAttempts, backoffMs);
                sleep(backoffMs, attempt, e);
            }
        }

        String reason = lastError != null ? lastError.getMessage() : "no attempt made";
        throw new SummarizationFailedException("Reduce failed after " + attempt + " attempt(s): " + reason,
                attempt, lastError);
    }

    private static void sleep(long backoffMs, int attempt, RuntimeException cause) {
        try {
            Thread.sleep(backoffMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new SummarizationFailedException("Reduce interrupted during retry backoff", attempt, cause);
        }
    }
}
