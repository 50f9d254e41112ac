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
import me.golemcore.report.domain.exception.DistillationFailedException;
import me.golemcore.report.domain.exception.ExportFailedException;
import me.golemcore.report.domain.exception.RenderFailedException;
import me.golemcore.report.domain.exception.SourceUnavailableException;
import me.golemcore.report.domain.model.ArticlePrompt;
import me.golemcore.report.domain.model.AttachFormat;
import me.golemcore.report.domain.model.ChangeStats;
import me.golemcore.report.domain.model.Commit;
import me.golemcore.report.domain.model.DailySummary;
import me.golemcore.report.domain.model.DeliveryResult;
import me.golemcore.report.domain.model.DiffSummary;
import me.golemcore.report.domain.model.HookPoint;
import me.golemcore.report.domain.model.MemoryLogEntry;
import me.golemcore.report.domain.model.ProjectMemory;
import me.golemcore.report.domain.model.ReducePrompt;
import me.golemcore.report.domain.model.ReportArtifact;
import me.golemcore.report.domain.model.RunContext;
import me.golemcore.report.domain.model.RunDiagnostic;
import me.golemcore.report.domain.model.RunResult;
import me.golemcore.report.domain.model.RunStage;
import me.golemcore.report.infrastructure.config.ReportProperties;
import me.golemcore.report.plugin.context.HookManager;
import me.golemcore.report.port.outbound.DocumentExportPort;
import me.golemcore.report.port.outbound.StoragePort;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Clock;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletionException;

/**
 * Runs one report end to end: fetch, filter, map, reduce, distill, hook,
 * render, notify.
 *
 * <p>
 * Runs of the same project are serialized through
 * {@link ProjectRunCoordinator}. Fatal errors stop the run and are returned as
 * a {@link RunResult.Status#FAILED} result naming the stage; nothing is written
 * to the project log after a fatal error. Non-fatal problems are collected as
 * diagnostics and the run completes with warnings.
 */
@Service
@Slf4j
public class ReportOrchestrator {

    private static final DateTimeFormatter FILE_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final SummarizationPipeline pipeline;
    private final ChangeFilter changeFilter;
    private final MemoryDistillationService distillationService;
    private final HookManager hookManager;
    private final ReportRenderer renderer;
    private final DocumentExportPort documentExporter;
    private final NotificationDispatcher notificationDispatcher;
    private final StoragePort storagePort;
    private final ProjectRunCoordinator runCoordinator;
    private final ReportProperties properties;
    private final Clock clock;

    @SuppressWarnings("java:S107")
    public ReportOrchestrator(SummarizationPipeline pipeline, ChangeFilter changeFilter,
            MemoryDistillationService distillationService, HookManager hookManager, ReportRenderer renderer,
            DocumentExportPort documentExporter, NotificationDispatcher notificationDispatcher,
            StoragePort storagePort, ProjectRunCoordinator runCoordinator, ReportProperties properties,
            Clock clock) {
        this.pipeline = pipeline;
        this.changeFilter = changeFilter;
        this.distillationService = distillationService;
        this.hookManager = hookManager;
        this.renderer = renderer;
        this.documentExporter = documentExporter;
        this.notificationDispatcher = notificationDispatcher;
        this.storagePort = storagePort;
        this.runCoordinator = runCoordinator;
        this.properties = properties;
        this.clock = clock;
    }

    public RunResult run(RunContext context) {
        return runCoordinator.runExclusively(context.getProjectName(), context.getCancellationToken(),
                () -> new Run(context).execute());
    }

    /**
     * Mutable state of a single run. Not shared between threads.
     */
    private final class Run {

        private final RunContext context;
        private final List<RunDiagnostic> diagnostics = new ArrayList<>();
        private final ZonedDateTime generatedAt;
        private final String timestamp;
        private RunStage stage = RunStage.FETCHING;
        private DailySummary dailySummary;
        private ReportArtifact artifact;
        private List<DeliveryResult> deliveries = Collections.emptyList();

        Run(RunContext context) {
            this.context = context;
            this.generatedAt = ZonedDateTime.now(clock);
            this.timestamp = FILE_TIMESTAMP.format(generatedAt);
        }

        RunResult execute() {
            log.info("[Run] {} started for '{}'", context.getRunId(), context.getProjectName());
            try {
                List<Commit> commits = fetch();
                if (commits.isEmpty()) {
                    log.info("[Run] No commits in window ({}), nothing to report", context.getWindow().describe());
                    return result(RunResult.Status.COMPLETED, null, null);
                }

                enter(RunStage.FILTERING);
                ChangeStats stats = changeFilter.summarize(commits);
                String textReport = renderer.renderText(commits, stats, generatedAt);

                enter(RunStage.MAPPING);
                List<DiffSummary> summaries = map(commits);

                enter(RunStage.REDUCING);
                ProjectMemory priorMemory = context.getMemoryStore().readMemory();
                dailySummary = reduce(summaries, stats, textReport, priorMemory);
                appendLog(dailySummary, commits.size());

                enter(RunStage.DISTILLING);
                ProjectMemory memory = distillIfDue(priorMemory);

                enter(RunStage.HOOKING);
                String summaryText = hookManager.apply(HookPoint.PRE_RENDER, context, dailySummary.getText(),
                        diagnostics::add);

                enter(RunStage.RENDERING);
                artifact = render(commits, stats, textReport, summaryText, memory);

                enter(RunStage.NOTIFYING);
                deliveries = notificationDispatcher.dispatch(context.getNotifiers(), artifact,
                        context.getRecipients(), diagnostics::add);

                enter(RunStage.DONE);
                RunResult.Status status = diagnostics.isEmpty()
                        ? RunResult.Status.COMPLETED
                        : RunResult.Status.COMPLETED_WITH_WARNINGS;
                log.info("[Run] {} finished: {} ({} diagnostics)", context.getRunId(), status, diagnostics.size());
                return result(status, null, null);
            } catch (RuntimeException e) { // NOSONAR - every fatal error becomes a FAILED result
                Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
                log.error("[Run] {} failed at {}: {}", context.getRunId(), stage, cause.getMessage(), cause);
                return result(RunResult.Status.FAILED, stage, cause.getMessage());
            }
        }

        private void enter(RunStage next) {
            stage = next;
            log.debug("[Run] {} -> {}", context.getRunId(), next);
        }

        private List<Commit> fetch() {
            List<Commit> fetched = context.getCommitSource().fetch(context.getRepository(), context.getWindow());
            // sources list newest first; reverse before the stable sort so equal timestamps keep history order
            List<Commit> commits = new ArrayList<>(fetched);
            Collections.reverse(commits);
            commits.sort(Comparator.comparing(Commit::getTimestamp, Comparator.nullsFirst(Comparator.naturalOrder())));
            return commits;
        }

        private List<DiffSummary> map(List<Commit> commits) {
            SummarizationPipeline.MapPhaseResult mapped = pipeline.map(context, commits);
            diagnostics.addAll(mapped.diagnostics());
            List<DiffSummary> hooked = new ArrayList<>(mapped.summaries().size());
            for (DiffSummary summary : mapped.summaries()) {
                if (summary.getStatus() != DiffSummary.Status.SUMMARIZED) {
                    hooked.add(summary);
                    continue;
                }
                String text = hookManager.apply(HookPoint.POST_MAP, context, summary.getText(), diagnostics::add);
                hooked.add(summary.toBuilder().text(text).build());
            }
            return hooked;
        }

        private DailySummary reduce(List<DiffSummary> summaries, ChangeStats stats, String textReport,
                ProjectMemory priorMemory) {
            DailySummary reduced = pipeline.reduce(context, ReducePrompt.builder()
                    .style(context.getStyle())
                    .projectName(context.getProjectName())
                    .window(context.getWindow().describe())
                    .diffSummaries(summaries)
                    .stats(stats)
                    .statsReport(textReport)
                    .priorMemory(priorMemory.getContent())
                    .build());
            String text = hookManager.apply(HookPoint.POST_REDUCE, context, reduced.getText(), diagnostics::add);
            return reduced.toBuilder().text(text).build();
        }

        private void appendLog(DailySummary summary, int commitCount) {
            ChangeStats stats = summary.getStats();
            context.getMemoryStore().append(MemoryLogEntry.builder()
                    .date(summary.getDate().toString())
                    .summary(summary.getText())
                    .additions(stats.getAdditions())
                    .deletions(stats.getDeletions())
                    .changeMagnitude(stats.getMagnitude())
                    .commits(commitCount)
                    .recordedAt(clock.instant())
                    .build());
        }

        private ProjectMemory distillIfDue(ProjectMemory priorMemory) {
            int entryCount = context.getMemoryStore().count();
            if (!distillationService.isDue(context, entryCount, priorMemory)) {
                log.debug("[Run] Distillation not due ({} log entries)", entryCount);
                return priorMemory;
            }
            try {
                return distillationService.distill(context);
            } catch (DistillationFailedException e) {
                log.warn("[Run] {}", e.getMessage());
                diagnostics.add(diagnostic(RunDiagnostic.Code.DISTILL_FAILED, context.getProjectName(),
                        e.getMessage()));
                return priorMemory;
            }
        }

        private ReportArtifact render(List<Commit> commits, ChangeStats stats, String textReport,
                String summaryText, ProjectMemory memory) {
            String prefix = properties.getOutput().getFilenamePrefix();
            String project = context.getProjectName();

            String article = null;
            Path articlePath = null;
            if (!context.isDefaultStyle() || context.getAttachFormat() == AttachFormat.PDF) {
                article = generateArticle(summaryText, memory);
                if (article != null) {
                    String articleName = prefix + "_Article_" + context.getStyle() + "_" + timestamp + ".md";
                    save(articleName, article);
                    articlePath = storagePort.resolve(project, articleName);
                }
            }

            String html = renderer.renderHtml(project, commits, stats, summaryText, article, generatedAt);
            html = hookManager.apply(HookPoint.POST_RENDER, context, html, diagnostics::add);
            String htmlName = prefix + "_" + timestamp + ".html";
            save(htmlName, html);
            save(prefix + "_" + timestamp + ".txt", textReport);
            log.info("[Run] Report saved as {}/{}", project, htmlName);

            Path pdfPath = context.getAttachFormat() == AttachFormat.PDF ? exportPdf(article, prefix) : null;

            return ReportArtifact.builder()
                    .subject("Git work report - " + project + " - " + generatedAt.toLocalDate())
                    .html(html)
                    .textReport(textReport)
                    .htmlPath(storagePort.resolve(project, htmlName))
                    .article(article)
                    .articlePath(articlePath)
                    .pdfPath(pdfPath)
                    .summary(summaryText)
                    .build();
        }

        private String generateArticle(String summaryText, ProjectMemory memory) {
            String readme = "";
            try {
                readme = context.getCommitSource().fetchReadme(context.getRepository()).orElse("");
            } catch (SourceUnavailableException e) {
                diagnostics.add(diagnostic(RunDiagnostic.Code.README_UNAVAILABLE, context.getRepository(),
                        e.getMessage()));
            }
            try {
                String article = context.getLlm().generateStyledArticle(ArticlePrompt.builder()
                        .style(context.getStyle())
                        .projectName(context.getProjectName())
                        .dailySummary(summaryText)
                        .projectMemory(memory.getContent())
                        .readme(readme)
                        .build());
                return Optional.ofNullable(article).filter(a -> !a.isBlank()).map(String::strip).orElse(null);
            } catch (RuntimeException e) { // NOSONAR - the article is optional
                log.warn("[Run] Styled article ({}) failed: {}", context.getStyle(), e.getMessage());
                diagnostics.add(diagnostic(RunDiagnostic.Code.ARTICLE_FAILED, context.getStyle(), e.getMessage()));
                return null;
            }
        }

        private Path exportPdf(String article, String prefix) {
            if (article == null) {
                diagnostics.add(diagnostic(RunDiagnostic.Code.EXPORT_FAILED, "pdf",
                        "No styled article to export, attaching the HTML report"));
                return null;
            }
            Path target = storagePort.resolve(context.getProjectName(),
                    prefix + "_Article_" + context.getStyle() + "_" + timestamp + ".pdf");
            try {
                String title = context.getProjectName() + " - " + generatedAt.toLocalDate();
                return documentExporter.exportPdf(renderer.renderArticleHtml(title, article), target);
            } catch (ExportFailedException e) {
                log.warn("[Run] PDF export failed, attaching the HTML report: {}", e.getMessage());
                diagnostics.add(diagnostic(RunDiagnostic.Code.EXPORT_FAILED, "pdf", e.getMessage()));
                return null;
            }
        }

        private void save(String name, String content) {
            try {
                storagePort.putText(context.getProjectName(), name, content).join();
            } catch (CompletionException e) {
                throw new RenderFailedException("Failed to save " + name, e.getCause());
            }
        }

        private RunDiagnostic diagnostic(RunDiagnostic.Code code, String subject, String message) {
            return RunDiagnostic.builder().stage(stage).code(code).subject(subject).message(message).build();
        }

        private RunResult result(RunResult.Status status, RunStage failedStage, String failureMessage) {
            return RunResult.builder()
                    .runId(context.getRunId())
                    .project(context.getProjectName())
                    .status(status)
                    .failedStage(failedStage)
                    .failureMessage(failureMessage)
                    .diagnostics(diagnostics)
                    .dailySummary(dailySummary)
                    .artifact(artifact)
                    .deliveries(deliveries)
                    .startedAt(context.getStartedAt())
                    .finishedAt(clock.instant())
                    .build();
        }
    }
}
